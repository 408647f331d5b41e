package com.autonomous.approval.exception;

/**
 * Slack rejected the bot token. The process stays unhealthy until an operator
 * fixes the token and restarts it.
 */
public class AuthErrorException extends PlatformException {

    public AuthErrorException(String operation, String errorCode) {
        super(operation, errorCode, "Slack authentication failed (" + errorCode + ") - check slack.bot.token");
    }
}

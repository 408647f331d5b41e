package com.autonomous.approval.exception;

/**
 * Failure of an outbound Slack call. Carries the Web API method and Slack's
 * error code (for example {@code name_taken}) when Slack returned one.
 */
public class PlatformException extends RuntimeException {

    private final String operation;
    private final String errorCode;

    public PlatformException(String operation, String errorCode, String message) {
        super(message);
        this.operation = operation;
        this.errorCode = errorCode;
    }

    public PlatformException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.errorCode = null;
    }

    public String getOperation() {
        return operation;
    }

    public String getErrorCode() {
        return errorCode;
    }
}

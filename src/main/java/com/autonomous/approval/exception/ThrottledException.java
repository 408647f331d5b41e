package com.autonomous.approval.exception;

public class ThrottledException extends PlatformException {

    public ThrottledException(String operation, String errorCode) {
        super(operation, errorCode, "Slack throttled " + operation);
    }
}

package com.autonomous.approval.exception;

public class PlatformUnavailableException extends PlatformException {

    public PlatformUnavailableException(String operation, String message) {
        super(operation, null, message);
    }

    public PlatformUnavailableException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }
}

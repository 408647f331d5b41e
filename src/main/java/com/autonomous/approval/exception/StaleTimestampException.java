package com.autonomous.approval.exception;

public class StaleTimestampException extends SignatureVerificationException {

    public StaleTimestampException(long requestEpochSecond, long nowEpochSecond) {
        super(String.format("Request timestamp %d is %ds away from server time",
            requestEpochSecond, Math.abs(nowEpochSecond - requestEpochSecond)));
    }
}

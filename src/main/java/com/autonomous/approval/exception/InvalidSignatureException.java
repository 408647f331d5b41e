package com.autonomous.approval.exception;

public class InvalidSignatureException extends SignatureVerificationException {

    public InvalidSignatureException(String message) {
        super(message);
    }
}

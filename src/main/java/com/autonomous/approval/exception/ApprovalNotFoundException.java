package com.autonomous.approval.exception;

public class ApprovalNotFoundException extends RuntimeException {

    public ApprovalNotFoundException(String approvalId) {
        super("Approval not found: " + approvalId);
    }
}

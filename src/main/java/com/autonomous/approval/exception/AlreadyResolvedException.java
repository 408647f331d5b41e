package com.autonomous.approval.exception;

import com.autonomous.approval.model.ApprovalStatus;

public class AlreadyResolvedException extends RuntimeException {

    private final String approvalId;
    private final ApprovalStatus status;

    public AlreadyResolvedException(String approvalId, ApprovalStatus status) {
        super("Approval " + approvalId + " already " + status.getValue());
        this.approvalId = approvalId;
        this.status = status;
    }

    public String getApprovalId() {
        return approvalId;
    }

    public ApprovalStatus getStatus() {
        return status;
    }
}

package com.autonomous.approval.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome handed back to the automation agent, whichever path served the approval.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResolvedApproval {
    private String approvalId;
    private String sessionId;
    private String channelId;
    private String command;
    private ApprovalStatus status;
    private String respondedBy;
    private String respondedByName;
    private Instant respondedAt;
    private ApprovalSource source;

    public boolean isApproved() {
        return status == ApprovalStatus.APPROVED || status == ApprovalStatus.ALWAYS_APPROVE;
    }
}

package com.autonomous.approval.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;

/**
 * Handle returned when an approval is submitted: the id to poll or register a
 * callback against, and the future that completes on resolution.
 */
@Getter
@AllArgsConstructor
public class ApprovalTicket {
    private final String approvalId;
    private final String channelId;
    private final ApprovalSource source;
    private final CompletableFuture<ResolvedApproval> resolution;
}

package com.autonomous.approval.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Channel {
    private String id;
    private String displayName;
    private String sessionId;
    private String subSessionId;
    private Instant createdAt;
    private boolean archived;

    // Set when Slack could not be reached at session end; archival is retried on recovery.
    private boolean archivePending;
}

package com.autonomous.approval.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionClosure {
    private String sessionId;
    private int cancelledApprovals;
    private boolean channelArchived;
}

package com.autonomous.approval.model;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
public class ApprovalSubmission {
    private String sessionId;
    private String command;
    private Map<String, String> metadata = new HashMap<>();
}

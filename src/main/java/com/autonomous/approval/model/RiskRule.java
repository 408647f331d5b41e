package com.autonomous.approval.model;

import lombok.Data;

@Data
public class RiskRule {
    private String pattern;
    private String level;
    private String description;
}

package com.autonomous.approval.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class RiskRuleSet {
    private String defaultLevel = "medium";
    private List<RiskRule> rules = new ArrayList<>();
}

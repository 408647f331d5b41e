package com.autonomous.approval.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ApprovalStatus {
    PENDING("pending"),
    APPROVED("approved"),
    DENIED("denied"),
    ALWAYS_APPROVE("alwaysApprove"),
    CANCELLED("cancelled");

    private final String value;

    ApprovalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Only {@link #PENDING} has outgoing transitions; every terminal state is final.
     */
    public boolean canTransitionTo(ApprovalStatus target) {
        return this == PENDING && target != null && target != PENDING;
    }

    @JsonCreator
    public static ApprovalStatus fromValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown approval status: " + value));
    }
}

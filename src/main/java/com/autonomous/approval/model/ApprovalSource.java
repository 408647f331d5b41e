package com.autonomous.approval.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ApprovalSource {
    SLACK("slack"),
    TERMINAL("terminal");

    private final String value;

    ApprovalSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

package com.autonomous.approval.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum RiskLevel {
    LOW("low", ":large_green_circle:"),
    MEDIUM("medium", ":large_yellow_circle:"),
    HIGH("high", ":red_circle:"),
    CRITICAL("critical", ":rotating_light:");

    private final String value;
    private final String emoji;

    RiskLevel(String value, String emoji) {
        this.value = value;
        this.emoji = emoji;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getEmoji() {
        return emoji;
    }

    public static Optional<RiskLevel> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(level -> level.value.equalsIgnoreCase(value.trim()))
            .findFirst();
    }
}

package com.conversionlog.sdk.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertSeverity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    AlertSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAtLeast(AlertSeverity other) {
        return ordinal() >= other.ordinal();
    }

    public static AlertSeverity fromValue(String value) {
        for (AlertSeverity severity : AlertSeverity.values()) {
            if (severity.value.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown AlertSeverity: " + value);
    }
}

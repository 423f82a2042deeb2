package com.conversionlog.sdk.monitoring;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
    HEALTHY("healthy"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * The more severe of the two statuses
     */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}

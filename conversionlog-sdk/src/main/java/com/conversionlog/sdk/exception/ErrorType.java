package com.conversionlog.sdk.exception;

import com.conversionlog.sdk.model.AlertSeverity;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of tracking failures, each with the severity its alert is raised at.
 */
public enum ErrorType {
    SCRIPT_LOAD_FAILURE("SCRIPT_LOAD_FAILURE", AlertSeverity.CRITICAL),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", AlertSeverity.CRITICAL),
    TRACKING_FAILURE("TRACKING_FAILURE", AlertSeverity.HIGH),
    NETWORK_ERROR("NETWORK_ERROR", AlertSeverity.HIGH),
    VALIDATION_ERROR("VALIDATION_ERROR", AlertSeverity.MEDIUM),
    PRIVACY_ERROR("PRIVACY_ERROR", AlertSeverity.MEDIUM);

    private final String value;
    private final AlertSeverity severity;

    ErrorType(String value, AlertSeverity severity) {
        this.value = value;
        this.severity = severity;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public static ErrorType fromValue(String value) {
        for (ErrorType type : ErrorType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown ErrorType: " + value);
    }
}

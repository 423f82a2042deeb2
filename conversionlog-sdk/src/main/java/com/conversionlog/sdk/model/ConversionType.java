package com.conversionlog.sdk.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery path that produced an attempt log entry.
 */
public enum ConversionType {
    CLIENT("client"),
    SERVER("server");

    private final String value;

    ConversionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ConversionType fromValue(String value) {
        for (ConversionType type : ConversionType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown ConversionType: " + value);
    }
}

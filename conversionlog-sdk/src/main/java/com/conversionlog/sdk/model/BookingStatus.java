package com.conversionlog.sdk.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Booking lifecycle states as held by the booking store.
 */
public enum BookingStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    PAID("paid"),
    CANCELLED("cancelled"),
    REFUNDED("refunded"),
    FAILED("failed");

    /** States that count as a completed purchase. */
    public static final Set<BookingStatus> CONVERSION_ELIGIBLE = EnumSet.of(CONFIRMED, PAID);

    private final String value;

    BookingStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isConversionEligible() {
        return CONVERSION_ELIGIBLE.contains(this);
    }

    public static BookingStatus fromValue(String value) {
        for (BookingStatus status : BookingStatus.values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown BookingStatus: " + value);
    }
}

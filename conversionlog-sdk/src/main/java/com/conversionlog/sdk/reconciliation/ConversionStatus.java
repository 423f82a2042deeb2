package com.conversionlog.sdk.reconciliation;

/**
 * Whether each path has a successful attempt on record for one booking.
 */
public record ConversionStatus(String bookingId, boolean clientTracked, boolean serverTracked) {

    public boolean isMatched() {
        return clientTracked && serverTracked;
    }

    public boolean isTracked() {
        return clientTracked || serverTracked;
    }
}

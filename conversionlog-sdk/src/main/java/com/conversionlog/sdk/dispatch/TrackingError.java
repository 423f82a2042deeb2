package com.conversionlog.sdk.dispatch;

import com.conversionlog.sdk.exception.ErrorType;
import com.conversionlog.sdk.model.ConversionAction;

import java.time.Instant;
import java.util.Map;

/**
 * A typed tracking failure reported by the dispatcher.
 *
 * @param bookingId may be {@code null} for events without a booking (e.g. view_item)
 */
public record TrackingError(
        ErrorType type,
        String message,
        ConversionAction action,
        String bookingId,
        int attempt,
        Instant timestamp,
        Map<String, Object> details) {

    public TrackingError {
        details = details != null ? Map.copyOf(details) : Map.of();
    }
}

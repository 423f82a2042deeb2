package com.conversionlog.sdk.dispatch;

/**
 * Receives tracking failures and timings from the dispatcher. Implementations must not throw;
 * the dispatcher logs and ignores listener failures.
 */
@FunctionalInterface
public interface TrackingListener {

    void onTrackingError(TrackingError error);

    default void onPerformanceMetric(MetricType type, long durationMillis) {
    }
}

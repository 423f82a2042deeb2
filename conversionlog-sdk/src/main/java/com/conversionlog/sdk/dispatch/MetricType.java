package com.conversionlog.sdk.dispatch;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * Timed operations reported to {@link TrackingListener#onPerformanceMetric}, each with the
 * duration above which it counts as slow.
 */
public enum MetricType {
    SCRIPT_LOAD_TIME("script_load_time", Duration.ofSeconds(10)),
    TRACKING_CALL_TIME("tracking_call_time", Duration.ofSeconds(2));

    private final String value;
    private final Duration slowThreshold;

    MetricType(String value, Duration slowThreshold) {
        this.value = value;
        this.slowThreshold = slowThreshold;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Duration getSlowThreshold() {
        return slowThreshold;
    }
}

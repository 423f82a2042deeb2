package com.conversionlog.sdk.dispatch;

import java.time.Duration;

/**
 * Per-call overrides for {@link ConversionDispatcher}. Unset values fall back to the dispatcher defaults.
 */
public final class TrackingOptions {

    private static final TrackingOptions DEFAULTS = new TrackingOptions(null, null);

    private final Integer maxAttempts;
    private final Duration timeout;

    private TrackingOptions(Integer maxAttempts, Duration timeout) {
        this.maxAttempts = maxAttempts;
        this.timeout = timeout;
    }

    public static TrackingOptions defaults() {
        return DEFAULTS;
    }

    public static TrackingOptions maxAttempts(int maxAttempts) {
        return new TrackingOptions(maxAttempts, null);
    }

    public TrackingOptions withMaxAttempts(int maxAttempts) {
        return new TrackingOptions(maxAttempts, timeout);
    }

    public TrackingOptions withTimeout(Duration timeout) {
        return new TrackingOptions(maxAttempts, timeout);
    }

    int resolveMaxAttempts(int fallback) {
        if (maxAttempts == null) {
            return fallback;
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        return maxAttempts;
    }

    Duration resolveTimeout(Duration fallback) {
        return timeout != null ? timeout : fallback;
    }

    @Override
    public String toString() {
        return "TrackingOptions{maxAttempts=" + maxAttempts + ", timeout=" + timeout + "}";
    }
}

package com.conversionlog.sdk.dispatch;

import java.time.Duration;

/**
 * Capped exponential backoff without jitter: {@code min(base * 2^(attempt-1), max)}.
 */
public final class BackoffPolicy {

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

    private final long baseDelayMs;
    private final long maxDelayMs;

    private BackoffPolicy(long baseDelayMs, long maxDelayMs) {
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public static BackoffPolicy exponential(Duration baseDelay, Duration maxDelay) {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        return new BackoffPolicy(baseDelay.toMillis(), maxDelay.toMillis());
    }

    public static BackoffPolicy defaults() {
        return exponential(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
    }

    /**
     * Delay to wait after the given failed attempt
     *
     * @param attempt 1-based number of the attempt that just failed
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        // shifts past 62 would overflow; the cap is reached long before that
        int shift = Math.min(attempt - 1, 62);
        long multiplier = 1L << shift;
        long delay = baseDelayMs > maxDelayMs / multiplier ? maxDelayMs : baseDelayMs * multiplier;
        return Duration.ofMillis(Math.min(delay, maxDelayMs));
    }

    public Duration getBaseDelay() {
        return Duration.ofMillis(baseDelayMs);
    }

    public Duration getMaxDelay() {
        return Duration.ofMillis(maxDelayMs);
    }

    @Override
    public String toString() {
        return "BackoffPolicy{base=" + baseDelayMs + "ms, max=" + maxDelayMs + "ms}";
    }
}

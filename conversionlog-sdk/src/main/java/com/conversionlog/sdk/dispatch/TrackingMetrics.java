package com.conversionlog.sdk.dispatch;

import com.conversionlog.sdk.exception.ErrorType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters for the client delivery path, read by health checks and metrics binders.
 * <p>
 * {@link #errorRate()} covers only the calls inside the recent window so a burst of fresh
 * failures is not diluted by a long successful history; {@link #lifetimeErrorRate()} covers all calls.
 */
public class TrackingMetrics {

    public static final Duration DEFAULT_ERROR_RATE_WINDOW = Duration.ofMinutes(5);

    private final Clock clock;
    private final Duration errorRateWindow;
    private final Deque<CallSample> recentCalls = new ArrayDeque<>();

    private final AtomicLong callsTotal = new AtomicLong();
    private final AtomicLong callsFailed = new AtomicLong();
    private final AtomicLong callTimeTotalMs = new AtomicLong();
    private final AtomicLong eventsDelivered = new AtomicLong();
    private final AtomicLong eventsFailed = new AtomicLong();
    private final AtomicLong eventsSuppressed = new AtomicLong();
    private final AtomicLong scriptLoads = new AtomicLong();
    private final AtomicLong scriptLoadTimeTotalMs = new AtomicLong();
    private final Map<ErrorType, AtomicLong> errorsByType = new EnumMap<>(ErrorType.class);

    public TrackingMetrics() {
        this(Clock.systemUTC(), DEFAULT_ERROR_RATE_WINDOW);
    }

    public TrackingMetrics(Clock clock, Duration errorRateWindow) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (errorRateWindow == null || errorRateWindow.isNegative() || errorRateWindow.isZero()) {
            throw new IllegalArgumentException("errorRateWindow must be positive");
        }
        this.clock = clock;
        this.errorRateWindow = errorRateWindow;
        for (ErrorType type : ErrorType.values()) {
            errorsByType.put(type, new AtomicLong());
        }
    }

    public void recordCall(long durationMillis, boolean success) {
        callsTotal.incrementAndGet();
        callTimeTotalMs.addAndGet(Math.max(0, durationMillis));
        if (!success) {
            callsFailed.incrementAndGet();
        }
        Instant now = clock.instant();
        synchronized (recentCalls) {
            recentCalls.addLast(new CallSample(now, success));
            evictExpired(now);
        }
    }

    public void recordDelivered() {
        eventsDelivered.incrementAndGet();
    }

    public void recordFailed() {
        eventsFailed.incrementAndGet();
    }

    /** Events dropped before any call, e.g. for missing consent. */
    public void recordSuppressed() {
        eventsSuppressed.incrementAndGet();
    }

    public void recordError(ErrorType type) {
        errorsByType.get(type).incrementAndGet();
    }

    public void recordScriptLoad(long durationMillis) {
        scriptLoads.incrementAndGet();
        scriptLoadTimeTotalMs.addAndGet(Math.max(0, durationMillis));
    }

    /**
     * Failed calls over total calls within the recent window; 0 when the window holds no calls.
     */
    public double errorRate() {
        synchronized (recentCalls) {
            evictExpired(clock.instant());
            if (recentCalls.isEmpty()) {
                return 0.0;
            }
            long failed = recentCalls.stream().filter(sample -> !sample.success).count();
            return (double) failed / recentCalls.size();
        }
    }

    /**
     * Failed calls over total calls since creation or the last reset; 0 before the first call.
     */
    public double lifetimeErrorRate() {
        long total = callsTotal.get();
        return total == 0 ? 0.0 : (double) callsFailed.get() / total;
    }

    public Duration getErrorRateWindow() {
        return errorRateWindow;
    }

    // Caller holds the recentCalls lock.
    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(errorRateWindow);
        while (!recentCalls.isEmpty() && recentCalls.peekFirst().at.isBefore(cutoff)) {
            recentCalls.removeFirst();
        }
    }

    public double averageCallTimeMillis() {
        long total = callsTotal.get();
        return total == 0 ? 0.0 : (double) callTimeTotalMs.get() / total;
    }

    public double averageScriptLoadMillis() {
        long loads = scriptLoads.get();
        return loads == 0 ? 0.0 : (double) scriptLoadTimeTotalMs.get() / loads;
    }

    public Snapshot snapshot() {
        Map<ErrorType, Long> errors = new EnumMap<>(ErrorType.class);
        errorsByType.forEach((type, count) -> errors.put(type, count.get()));
        return new Snapshot(
                callsTotal.get(),
                callsFailed.get(),
                eventsDelivered.get(),
                eventsFailed.get(),
                eventsSuppressed.get(),
                errorRate(),
                averageCallTimeMillis(),
                averageScriptLoadMillis(),
                errors);
    }

    public void reset() {
        callsTotal.set(0);
        callsFailed.set(0);
        callTimeTotalMs.set(0);
        eventsDelivered.set(0);
        eventsFailed.set(0);
        eventsSuppressed.set(0);
        scriptLoads.set(0);
        scriptLoadTimeTotalMs.set(0);
        errorsByType.values().forEach(count -> count.set(0));
        synchronized (recentCalls) {
            recentCalls.clear();
        }
    }

    private static final class CallSample {
        final Instant at;
        final boolean success;

        CallSample(Instant at, boolean success) {
            this.at = at;
            this.success = success;
        }
    }

    /**
     * Point-in-time view of the counters
     */
    public static class Snapshot {
        public final long callsTotal;
        public final long callsFailed;
        public final long eventsDelivered;
        public final long eventsFailed;
        public final long eventsSuppressed;
        public final double errorRate;
        public final double averageCallTimeMillis;
        public final double averageScriptLoadMillis;
        public final Map<ErrorType, Long> errorsByType;

        Snapshot(long callsTotal, long callsFailed, long eventsDelivered, long eventsFailed,
                 long eventsSuppressed, double errorRate, double averageCallTimeMillis,
                 double averageScriptLoadMillis, Map<ErrorType, Long> errorsByType) {
            this.callsTotal = callsTotal;
            this.callsFailed = callsFailed;
            this.eventsDelivered = eventsDelivered;
            this.eventsFailed = eventsFailed;
            this.eventsSuppressed = eventsSuppressed;
            this.errorRate = errorRate;
            this.averageCallTimeMillis = averageCallTimeMillis;
            this.averageScriptLoadMillis = averageScriptLoadMillis;
            this.errorsByType = Map.copyOf(errorsByType);
        }

        @Override
        public String toString() {
            return String.format("Snapshot{calls=%d, failedCalls=%d, delivered=%d, failed=%d, suppressed=%d, errorRate=%.3f, avgCallMs=%.1f}",
                    callsTotal, callsFailed, eventsDelivered, eventsFailed, eventsSuppressed, errorRate, averageCallTimeMillis);
        }
    }
}

package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.dispatch.TrackingMetrics;

/**
 * Delivery performance figures captured by a deep health check.
 *
 * @param recentErrors error alerts raised in the last 24 hours
 */
public record PerformanceSnapshot(
        long totalCalls,
        long failedCalls,
        double errorRate,
        double averageScriptLoadMillis,
        double averageTrackingCallMillis,
        long recentErrors) {

    public static PerformanceSnapshot empty() {
        return new PerformanceSnapshot(0, 0, 0.0, 0.0, 0.0, 0);
    }

    static PerformanceSnapshot of(TrackingMetrics.Snapshot metrics, long recentErrors) {
        return new PerformanceSnapshot(metrics.callsTotal, metrics.callsFailed, metrics.errorRate,
                metrics.averageScriptLoadMillis, metrics.averageCallTimeMillis, recentErrors);
    }
}

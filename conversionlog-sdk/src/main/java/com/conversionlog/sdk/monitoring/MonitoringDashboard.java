package com.conversionlog.sdk.monitoring;

/**
 * Summary for an operations dashboard.
 *
 * @param recentErrors error alerts raised in the last 24 hours
 * @param recentMetrics timing samples recorded in the last 24 hours
 */
public record MonitoringDashboard(
        HealthReport health,
        PerformanceSnapshot performance,
        int totalAlerts,
        int activeAlerts,
        int recentErrors,
        int recentMetrics) {
}

package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.model.Alert;

import java.util.List;

/**
 * Current health as seen by the {@link HealthMonitor}.
 *
 * @param lastCheck most recent basic check, {@code null} before the first one
 * @param recentAlerts the last ten alerts raised, oldest first
 */
public record HealthReport(
        HealthStatus status,
        HealthCheck lastCheck,
        HealthCheck lastDeepCheck,
        List<Alert> activeAlerts,
        List<Alert> recentAlerts) {
}

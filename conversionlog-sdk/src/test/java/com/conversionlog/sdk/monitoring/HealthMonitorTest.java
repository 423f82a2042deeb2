package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.dispatch.ConversionLabels;
import com.conversionlog.sdk.dispatch.MetricType;
import com.conversionlog.sdk.dispatch.TagManagerQueue;
import com.conversionlog.sdk.dispatch.TrackingMetrics;
import com.conversionlog.sdk.model.Alert;
import com.conversionlog.sdk.model.AlertSeverity;
import com.conversionlog.sdk.model.ConversionAction;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class HealthMonitorTest {

    private final AlertService alertService = AlertService.builder().build();
    private final TrackingMetrics metrics = new TrackingMetrics();

    private HealthCheckService checks(TrackingEnvironment environment) {
        ConversionLabels.Builder labels = ConversionLabels.builder().conversionId("AW-123456789");
        for (ConversionAction action : ConversionAction.values()) {
            labels.label(action, action.getValue() + "Lbl");
        }
        return HealthCheckService.builder()
                .environment(environment)
                .labels(labels.build())
                .metrics(metrics)
                .alertService(alertService)
                .build();
    }

    private static TrackingEnvironment ready() {
        TagManagerQueue queue = new TagManagerQueue().initialize();
        return TrackingEnvironment.fromSinks(queue, queue);
    }

    private static TrackingEnvironment broken() {
        return TrackingEnvironment.fromSinks(new TagManagerQueue(), new TagManagerQueue());
    }

    @Test
    void healthyCheckRaisesNothing() {
        HealthMonitor monitor = HealthMonitor.builder()
                .healthCheckService(checks(ready()))
                .alertService(alertService)
                .build();

        HealthCheck check = monitor.performHealthCheck();

        assertTrue(check.isHealthy());
        assertTrue(alertService.getAlertHistory().isEmpty());
        assertSame(check, monitor.getHealthStatus().lastCheck());
        monitor.close();
    }

    @Test
    void criticalBasicCheckRaisesCriticalAlert() {
        HealthMonitor monitor = HealthMonitor.builder()
                .healthCheckService(checks(broken()))
                .alertService(alertService)
                .build();

        monitor.performHealthCheck();

        Alert alert = alertService.getActiveAlerts().get(0);
        assertEquals(HealthMonitor.HEALTH_CHECK_FAILED, alert.getType());
        assertEquals(AlertSeverity.CRITICAL, alert.getSeverity());
        assertEquals("Health check failed: Tag function not available", alert.getMessage());
        assertEquals(List.of("Tag function not available"), alert.getData().get("issues"));
        assertEquals(HealthStatus.CRITICAL, monitor.getHealthStatus().status());
        monitor.close();
    }

    @Test
    void deepCheckAlertSeverity() {
        HealthMonitor monitor = HealthMonitor.builder()
                .healthCheckService(checks(broken()))
                .alertService(alertService)
                .build();

        HealthCheck deep = monitor.performDeepHealthCheck();

        assertEquals(HealthStatus.WARNING, deep.getStatus());
        Alert alert = alertService.getActiveAlerts().get(0);
        assertEquals(HealthMonitor.DEEP_HEALTH_CHECK_FAILED, alert.getType());
        assertEquals(AlertSeverity.MEDIUM, alert.getSeverity());
        monitor.close();
    }

    @Test
    void startSchedulesBothChecksOnce() {
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        HealthMonitor monitor = HealthMonitor.builder()
                .healthCheckService(checks(ready()))
                .alertService(alertService)
                .scheduler(scheduler)
                .build();

        monitor.start();
        monitor.start();

        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(0L), eq(300_000L), eq(TimeUnit.MILLISECONDS));
        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(1_800_000L), eq(1_800_000L), eq(TimeUnit.MILLISECONDS));
        assertTrue(monitor.isRunning());

        monitor.stop();
        verify(future, times(2)).cancel(false);
        assertFalse(monitor.isRunning());

        monitor.close();
        verify(scheduler, never()).shutdownNow();
    }

    @Test
    void ticksSkipWhileInactiveAndSurviveFailures() {
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        doReturn(mock(ScheduledFuture.class)).when(scheduler)
                .scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        AtomicBoolean active = new AtomicBoolean(false);
        HealthCheckService failing = mock(HealthCheckService.class);
        when(failing.performHealthCheck()).thenThrow(new IllegalStateException("boom"));
        HealthMonitor monitor = HealthMonitor.builder()
                .healthCheckService(failing)
                .alertService(alertService)
                .activitySignal(active::get)
                .scheduler(scheduler)
                .build();
        monitor.start();
        ArgumentCaptor<Runnable> ticks = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler, times(2)).scheduleAtFixedRate(ticks.capture(), anyLong(), anyLong(), any(TimeUnit.class));
        Runnable basicTick = ticks.getAllValues().get(0);

        basicTick.run();
        verify(failing, never()).performHealthCheck();

        active.set(true);
        assertDoesNotThrow(basicTick::run);
        verify(failing).performHealthCheck();
    }

    @Test
    void scheduledChecksRunOnOwnThread() throws Exception {
        HealthMonitor monitor = HealthMonitor.builder()
                .healthCheckService(checks(ready()))
                .alertService(alertService)
                .basicInterval(Duration.ofMillis(20))
                .deepInterval(Duration.ofMillis(30))
                .build();
        try {
            monitor.start();
            long deadline = System.currentTimeMillis() + 5_000;
            while (monitor.getHealthStatus().lastDeepCheck() == null && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertNotNull(monitor.getHealthStatus().lastCheck());
            assertNotNull(monitor.getHealthStatus().lastDeepCheck());
        } finally {
            monitor.close();
        }
        assertFalse(monitor.isRunning());
    }

    @Test
    void dashboardSummarizesAlertsAndPerformance() {
        HealthMonitor monitor = HealthMonitor.builder()
                .healthCheckService(checks(ready()))
                .alertService(alertService)
                .build();
        metrics.recordCall(100, true);
        alertService.handleAlert("tracking_error", AlertSeverity.HIGH, "boom", null);
        alertService.recordPerformanceMetric(MetricType.TRACKING_CALL_TIME, 100);

        monitor.performDeepHealthCheck();
        MonitoringDashboard dashboard = monitor.getDashboard();

        assertEquals(1, dashboard.totalAlerts());
        assertEquals(1, dashboard.activeAlerts());
        assertEquals(1, dashboard.recentErrors());
        assertEquals(1, dashboard.recentMetrics());
        assertEquals(1, dashboard.performance().totalCalls());
        assertEquals(1, dashboard.health().recentAlerts().size());
        monitor.close();
    }

    @Test
    void builderRequiresServices() {
        assertThrows(IllegalStateException.class, () -> HealthMonitor.builder().alertService(alertService).build());
        assertThrows(IllegalStateException.class, () -> HealthMonitor.builder()
                .healthCheckService(checks(ready()))
                .alertService(alertService)
                .basicInterval(Duration.ZERO)
                .build());
    }
}

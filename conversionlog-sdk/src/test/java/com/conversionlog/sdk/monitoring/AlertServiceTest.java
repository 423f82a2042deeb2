package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.dispatch.MetricType;
import com.conversionlog.sdk.dispatch.TrackingError;
import com.conversionlog.sdk.exception.ErrorType;
import com.conversionlog.sdk.model.Alert;
import com.conversionlog.sdk.model.AlertSeverity;
import com.conversionlog.sdk.model.ConversionAction;
import com.conversionlog.sdk.util.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AlertServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));

    private AlertService.Builder builder() {
        return AlertService.builder().clock(clock);
    }

    @Test
    void alertIsStoredActiveAndInHistory() {
        AlertService service = builder().build();
        Map<String, Object> data = new HashMap<>();
        data.put("booking_id", "B1");
        data.put("ignored", null);

        Alert alert = service.handleAlert("custom_check", AlertSeverity.LOW, "Something odd", data);

        assertTrue(alert.getId().startsWith("alert_"));
        assertEquals(clock.instant(), alert.getTimestamp());
        assertEquals(Map.of("booking_id", "B1"), alert.getData());
        assertEquals(List.of(alert), service.getActiveAlerts());
        assertEquals(List.of(alert), service.getAlertHistory());
    }

    @Test
    void alertsAreForwardedToEveryChannel() {
        List<Alert> received = new CopyOnWriteArrayList<>();
        AlertService service = builder()
                .channel(alert -> {
                    throw new IllegalStateException("webhook down");
                })
                .channel(received::add)
                .forwardingExecutor(Runnable::run)
                .build();

        Alert alert = service.handleAlert("tracking_error", AlertSeverity.HIGH, "boom", null);

        assertEquals(List.of(alert), received);
        assertEquals(1, service.getAlertHistory().size());
    }

    @Test
    void trackingErrorBecomesAlertWithTypeSeverity() {
        AlertService service = builder().build();

        service.onTrackingError(new TrackingError(ErrorType.NETWORK_ERROR, "timed out", ConversionAction.PURCHASE,
                "B1", 2, clock.instant(), Map.of("sink", "tag")));

        Alert alert = service.getActiveAlerts().get(0);
        assertEquals(AlertService.TRACKING_ERROR, alert.getType());
        assertEquals(AlertSeverity.HIGH, alert.getSeverity());
        assertEquals("Tracking error: timed out", alert.getMessage());
        assertEquals("NETWORK_ERROR", alert.getData().get("error_type"));
        assertEquals("purchase", alert.getData().get("action"));
        assertEquals("B1", alert.getData().get("booking_id"));
        assertEquals(2, alert.getData().get("attempt"));
        assertEquals(Map.of("sink", "tag"), alert.getData().get("details"));
    }

    @Test
    void configurationErrorIsCritical() {
        AlertService service = builder().build();

        service.onTrackingError(new TrackingError(ErrorType.CONFIGURATION_ERROR, null, ConversionAction.VIEW_ITEM,
                null, 0, clock.instant(), null));

        Alert alert = service.getActiveAlerts().get(0);
        assertEquals(AlertSeverity.CRITICAL, alert.getSeverity());
        assertEquals("Tracking error: Unknown error", alert.getMessage());
        assertFalse(alert.getData().containsKey("booking_id"));
    }

    @Test
    void slowTimingsRaiseMediumAlerts() {
        AlertService service = builder().build();

        service.recordPerformanceMetric(MetricType.SCRIPT_LOAD_TIME, 10_000);
        service.recordPerformanceMetric(MetricType.TRACKING_CALL_TIME, 1_500);
        assertTrue(service.getAlertHistory().isEmpty());

        service.recordPerformanceMetric(MetricType.SCRIPT_LOAD_TIME, 12_000);
        service.onPerformanceMetric(MetricType.TRACKING_CALL_TIME, 2_500);

        List<Alert> alerts = service.getAlertHistory();
        assertEquals(2, alerts.size());
        assertEquals(AlertService.SLOW_SCRIPT_LOADING, alerts.get(0).getType());
        assertEquals("Slow script loading detected: 12000ms", alerts.get(0).getMessage());
        assertEquals(AlertSeverity.MEDIUM, alerts.get(0).getSeverity());
        assertEquals(AlertService.SLOW_TRACKING_CALL, alerts.get(1).getType());
        assertEquals(4, service.getRecentMetrics(Duration.ofHours(1)).size());
    }

    @Test
    void recentErrorsOnlyCountErrorTypesInWindow() {
        AlertService service = builder().build();
        service.handleAlert("tracking_error", AlertSeverity.HIGH, "old", null);
        clock.advance(Duration.ofHours(25));
        service.handleAlert("tracking_error", AlertSeverity.HIGH, "new", null);
        service.handleAlert("slow_tracking_call", AlertSeverity.MEDIUM, "slow", null);

        List<Alert> recent = service.getRecentErrors(Duration.ofHours(24));

        assertEquals(1, recent.size());
        assertEquals("new", recent.get(0).getMessage());
    }

    @Test
    void expiredAlertsAndSamplesAreDropped() {
        AlertService service = builder().build();
        service.handleAlert("tracking_error", AlertSeverity.HIGH, "old", null);
        service.recordPerformanceMetric(MetricType.TRACKING_CALL_TIME, 100);

        clock.advance(Duration.ofDays(31));
        assertEquals(0, service.cleanupExpired());
        assertEquals(1, service.getAlertHistory().size());
        assertTrue(service.getRecentMetrics(Duration.ofDays(365)).isEmpty());

        clock.advance(Duration.ofDays(60));
        assertEquals(1, service.cleanupExpired());
        assertTrue(service.getAlertHistory().isEmpty());
        assertTrue(service.getActiveAlerts().isEmpty());
    }

    @Test
    void stateIsRestoredFromRepository() {
        InMemoryAlertRepository repository = new InMemoryAlertRepository();
        AlertService first = builder().repository(repository).build();
        Alert alert = first.handleAlert("tracking_error", AlertSeverity.HIGH, "boom", null);

        AlertService second = builder().repository(repository).build();

        assertEquals(List.of(alert), second.getAlertHistory());
        assertEquals(List.of(alert), second.getActiveAlerts());
    }

    @Test
    void clearAllEmptiesEverything() {
        InMemoryAlertRepository repository = new InMemoryAlertRepository();
        AlertService service = builder().repository(repository).build();
        service.handleAlert("tracking_error", AlertSeverity.HIGH, "boom", null);
        service.recordPerformanceMetric(MetricType.TRACKING_CALL_TIME, 100);

        service.clearAll();

        assertTrue(service.getAlertHistory().isEmpty());
        assertTrue(service.getRecentMetrics(Duration.ofDays(1)).isEmpty());
        assertTrue(repository.load().history().isEmpty());
    }

    @Test
    void builderRejectsNonPositiveRetention() {
        assertThrows(IllegalStateException.class, () -> builder().alertRetention(Duration.ZERO).build());
        assertThrows(IllegalStateException.class, () -> builder().metricsRetention(Duration.ofDays(-1)).build());
    }

    @Test
    void forwardingRunsOffTheRaisingThread() throws Exception {
        CountDownLatch released = new CountDownLatch(1);
        List<Alert> received = new CopyOnWriteArrayList<>();
        List<String> threads = new CopyOnWriteArrayList<>();
        AlertService service = builder()
                .channel(alert -> {
                    threads.add(Thread.currentThread().getName());
                    released.await();
                    received.add(alert);
                })
                .build();
        try {
            service.handleAlert("tracking_error", AlertSeverity.HIGH, "first", null);
            service.handleAlert("tracking_error", AlertSeverity.HIGH, "second", null);

            assertEquals(2, service.getAlertHistory().size());
            assertTrue(received.isEmpty());

            released.countDown();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (received.size() < 2 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(2, received.size());
            assertEquals("conversionlog-alert-forwarder", threads.get(0));
        } finally {
            released.countDown();
            service.close();
        }
    }

    @Test
    void historyIsCappedOldestFirst() {
        List<AlertRepository.Snapshot> saved = new CopyOnWriteArrayList<>();
        AlertService service = builder()
                .maxHistorySize(3)
                .repository(new InMemoryAlertRepository() {
                    @Override
                    public void save(Snapshot snapshot) {
                        saved.add(snapshot);
                        super.save(snapshot);
                    }
                })
                .build();

        for (int i = 1; i <= 5; i++) {
            service.handleAlert("tracking_error", AlertSeverity.HIGH, "failure " + i, null);
            clock.advance(Duration.ofSeconds(1));
        }

        List<Alert> history = service.getAlertHistory();
        assertEquals(3, history.size());
        assertEquals("failure 3", history.get(0).getMessage());
        assertEquals(3, service.getActiveAlerts().size());
        assertEquals(3, saved.get(saved.size() - 1).history().size());
        assertThrows(IllegalStateException.class, () -> builder().maxHistorySize(0).build());
    }
}

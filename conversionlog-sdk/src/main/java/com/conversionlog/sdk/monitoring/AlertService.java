package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.dispatch.MetricType;
import com.conversionlog.sdk.dispatch.TrackingError;
import com.conversionlog.sdk.dispatch.TrackingListener;
import com.conversionlog.sdk.model.Alert;
import com.conversionlog.sdk.model.AlertSeverity;
import com.conversionlog.sdk.util.ConversionLogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Raises, stores and forwards alerts
 *
 * <p>Every alert goes into the active set and the history, is persisted through the
 * {@link AlertRepository} and logged. Forwarding to each {@link AlertChannel} runs on the
 * forwarding executor, never on the thread that raised the alert. Alerts leave the active set and
 * the history when they fall outside the retention window, or oldest first once the history holds
 * {@code maxHistorySize} alerts.</p>
 *
 * <p>Registered as a {@link TrackingListener}, it turns dispatcher and backup failures into
 * {@code tracking_error} alerts and slow timings into {@code slow_script_loading} /
 * {@code slow_tracking_call} alerts.</p>
 */
public class AlertService implements TrackingListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    public static final Duration DEFAULT_ALERT_RETENTION = Duration.ofDays(90);
    public static final Duration DEFAULT_METRICS_RETENTION = Duration.ofDays(30);
    public static final int DEFAULT_MAX_HISTORY_SIZE = 1000;

    public static final String TRACKING_ERROR = "tracking_error";
    public static final String SLOW_SCRIPT_LOADING = "slow_script_loading";
    public static final String SLOW_TRACKING_CALL = "slow_tracking_call";

    private final AlertRepository repository;
    private final List<AlertChannel> channels;
    private final Clock clock;
    private final Duration alertRetention;
    private final Duration metricsRetention;
    private final Duration slowScriptLoadThreshold;
    private final Duration slowTrackingCallThreshold;
    private final int maxHistorySize;
    private final Executor forwardingExecutor;
    private final ExecutorService ownedExecutor;

    private final Map<String, Alert> activeAlerts = new LinkedHashMap<>();
    private final List<Alert> history = new ArrayList<>();
    private final List<MetricSample> metrics = new ArrayList<>();
    private final Object lock = new Object();

    private AlertService(Builder builder) {
        this.repository = builder.repository != null ? builder.repository : new InMemoryAlertRepository();
        this.channels = List.copyOf(builder.channels);
        this.clock = builder.clock;
        this.alertRetention = builder.alertRetention;
        this.metricsRetention = builder.metricsRetention;
        this.slowScriptLoadThreshold = builder.slowScriptLoadThreshold;
        this.slowTrackingCallThreshold = builder.slowTrackingCallThreshold;
        this.maxHistorySize = builder.maxHistorySize;
        if (builder.forwardingExecutor != null) {
            this.forwardingExecutor = builder.forwardingExecutor;
            this.ownedExecutor = null;
        } else if (channels.isEmpty()) {
            this.forwardingExecutor = Runnable::run;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "conversionlog-alert-forwarder");
                t.setDaemon(true);
                return t;
            });
            this.forwardingExecutor = ownedExecutor;
        }
        loadStored();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Raising alerts
    // ========================================================================

    /**
     * Raise an alert
     *
     * @return the stored alert with its assigned id and timestamp
     */
    public Alert handleAlert(String type, AlertSeverity severity, String message, Map<String, ?> data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (data != null) {
            data.forEach((key, value) -> {
                if (value != null) {
                    payload.put(key, value);
                }
            });
        }
        Alert alert = new Alert(ConversionLogUtils.createAlertId(clock), type, severity, message,
                clock.instant(), payload);

        synchronized (lock) {
            activeAlerts.put(alert.getId(), alert);
            history.add(alert);
            trimToMaxSize();
            persist();
        }

        if (severity.isAtLeast(AlertSeverity.HIGH)) {
            log.error("[ALERT {}] {} ({})", severity.getValue().toUpperCase(), message, type);
        } else {
            log.warn("[ALERT {}] {} ({})", severity.getValue().toUpperCase(), message, type);
        }

        forward(alert);
        cleanupExpired();
        return alert;
    }

    @Override
    public void onTrackingError(TrackingError error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error_type", error.type().getValue());
        data.put("action", error.action() != null ? error.action().getValue() : null);
        data.put("booking_id", error.bookingId());
        data.put("attempt", error.attempt());
        data.put("occurred_at", error.timestamp() != null ? error.timestamp().toString() : null);
        if (!error.details().isEmpty()) {
            data.put("details", error.details());
        }
        String message = error.message() != null ? error.message() : "Unknown error";
        handleAlert(TRACKING_ERROR, error.type().getSeverity(), "Tracking error: " + message, data);
    }

    @Override
    public void onPerformanceMetric(MetricType type, long durationMillis) {
        recordPerformanceMetric(type, durationMillis);
    }

    /**
     * Store a timing sample; raises a medium alert when it is slower than the threshold for its type
     */
    public void recordPerformanceMetric(MetricType type, long durationMillis) {
        synchronized (lock) {
            metrics.add(new MetricSample(type, durationMillis, clock.instant()));
        }
        if (type == MetricType.SCRIPT_LOAD_TIME && durationMillis > slowScriptLoadThreshold.toMillis()) {
            handleAlert(SLOW_SCRIPT_LOADING, AlertSeverity.MEDIUM,
                    "Slow script loading detected: " + durationMillis + "ms",
                    Map.of("metric", type.getValue(), "duration_ms", durationMillis));
        } else if (type == MetricType.TRACKING_CALL_TIME && durationMillis > slowTrackingCallThreshold.toMillis()) {
            handleAlert(SLOW_TRACKING_CALL, AlertSeverity.MEDIUM,
                    "Slow tracking call detected: " + durationMillis + "ms",
                    Map.of("metric", type.getValue(), "duration_ms", durationMillis));
        }
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public List<Alert> getActiveAlerts() {
        synchronized (lock) {
            return List.copyOf(activeAlerts.values());
        }
    }

    /**
     * All retained alerts, oldest first
     */
    public List<Alert> getAlertHistory() {
        synchronized (lock) {
            return List.copyOf(history);
        }
    }

    /**
     * Alerts raised within {@code window} whose type names an error
     */
    public List<Alert> getRecentErrors(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        synchronized (lock) {
            return history.stream()
                    .filter(alert -> alert.getTimestamp().isAfter(cutoff))
                    .filter(alert -> alert.getType().contains("error"))
                    .collect(Collectors.toList());
        }
    }

    public List<MetricSample> getRecentMetrics(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        synchronized (lock) {
            return metrics.stream()
                    .filter(sample -> sample.timestamp().isAfter(cutoff))
                    .collect(Collectors.toList());
        }
    }

    // ========================================================================
    // Retention
    // ========================================================================

    /**
     * Drop alerts older than the alert retention and samples older than the metrics retention
     *
     * @return number of alerts removed from the history
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        Instant alertCutoff = now.minus(alertRetention);
        Instant metricsCutoff = now.minus(metricsRetention);
        synchronized (lock) {
            int before = history.size();
            history.removeIf(alert -> alert.getTimestamp().isBefore(alertCutoff));
            int removed = before - history.size();
            boolean activeChanged = activeAlerts.values()
                    .removeIf(alert -> alert.getTimestamp().isBefore(alertCutoff));
            metrics.removeIf(sample -> sample.timestamp().isBefore(metricsCutoff));
            if (removed > 0 || activeChanged) {
                log.debug("Expired {} alerts older than {}", removed, alertCutoff);
                persist();
            }
            return removed;
        }
    }

    public void clearAll() {
        synchronized (lock) {
            activeAlerts.clear();
            history.clear();
            metrics.clear();
            persist();
        }
        log.info("All monitoring alerts cleared");
    }

    /**
     * Stop the owned forwarding thread; alerts not yet forwarded are dropped
     */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    // ========================================================================
    // Internal
    // ========================================================================

    private void forward(Alert alert) {
        if (channels.isEmpty()) {
            return;
        }
        try {
            forwardingExecutor.execute(() -> sendToChannels(alert));
        } catch (RejectedExecutionException e) {
            log.warn("Alert {} not forwarded, forwarding executor shut down", alert.getId());
        }
    }

    private void sendToChannels(Alert alert) {
        for (AlertChannel channel : channels) {
            try {
                channel.send(alert);
            } catch (Exception e) {
                log.warn("Failed to forward alert {} to {}: {}", alert.getId(), channel, e.getMessage());
            }
        }
    }

    // caller holds lock
    private void trimToMaxSize() {
        int excess = history.size() - maxHistorySize;
        if (excess <= 0) {
            return;
        }
        List<Alert> dropped = new ArrayList<>(history.subList(0, excess));
        history.subList(0, excess).clear();
        dropped.forEach(alert -> activeAlerts.remove(alert.getId()));
        log.debug("Alert history over {} entries, dropped {} oldest", maxHistorySize, excess);
    }

    private void persist() {
        try {
            repository.save(new AlertRepository.Snapshot(new ArrayList<>(activeAlerts.values()), history));
        } catch (RuntimeException e) {
            log.warn("Failed to persist alerts: {}", e.getMessage());
        }
    }

    private void loadStored() {
        try {
            AlertRepository.Snapshot snapshot = repository.load();
            synchronized (lock) {
                history.addAll(snapshot.history());
                snapshot.active().forEach(alert -> activeAlerts.put(alert.getId(), alert));
                trimToMaxSize();
            }
            if (!snapshot.history().isEmpty()) {
                log.info("Restored {} alerts ({} active)", snapshot.history().size(), snapshot.active().size());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to load stored alerts, starting empty: {}", e.getMessage());
        }
    }

    /**
     * One timing reported through {@link #recordPerformanceMetric}
     */
    public record MetricSample(MetricType type, long durationMillis, Instant timestamp) {
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private AlertRepository repository;
        private final List<AlertChannel> channels = new ArrayList<>();
        private Clock clock = Clock.systemUTC();
        private Duration alertRetention = DEFAULT_ALERT_RETENTION;
        private Duration metricsRetention = DEFAULT_METRICS_RETENTION;
        private Duration slowScriptLoadThreshold = MetricType.SCRIPT_LOAD_TIME.getSlowThreshold();
        private Duration slowTrackingCallThreshold = MetricType.TRACKING_CALL_TIME.getSlowThreshold();
        private int maxHistorySize = DEFAULT_MAX_HISTORY_SIZE;
        private Executor forwardingExecutor;

        /**
         * Where alerts are persisted (default: in memory)
         */
        public Builder repository(AlertRepository repository) {
            this.repository = repository;
            return this;
        }

        public Builder channel(AlertChannel channel) {
            if (channel != null) {
                this.channels.add(channel);
            }
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * How long alerts stay active and in the history (default: 90 days)
         */
        public Builder alertRetention(Duration alertRetention) {
            this.alertRetention = alertRetention;
            return this;
        }

        public Builder metricsRetention(Duration metricsRetention) {
            this.metricsRetention = metricsRetention;
            return this;
        }

        public Builder slowScriptLoadThreshold(Duration threshold) {
            this.slowScriptLoadThreshold = threshold;
            return this;
        }

        public Builder slowTrackingCallThreshold(Duration threshold) {
            this.slowTrackingCallThreshold = threshold;
            return this;
        }

        /**
         * Upper bound on retained alerts; the oldest are dropped first (default: 1000)
         */
        public Builder maxHistorySize(int maxHistorySize) {
            this.maxHistorySize = maxHistorySize;
            return this;
        }

        /**
         * Executor that forwards alerts to the channels (default: an owned daemon thread)
         */
        public Builder forwardingExecutor(Executor forwardingExecutor) {
            this.forwardingExecutor = forwardingExecutor;
            return this;
        }

        public AlertService build() {
            if (clock == null) {
                throw new IllegalStateException("clock must not be null");
            }
            if (alertRetention == null || alertRetention.isNegative() || alertRetention.isZero()) {
                throw new IllegalStateException("alertRetention must be positive");
            }
            if (metricsRetention == null || metricsRetention.isNegative() || metricsRetention.isZero()) {
                throw new IllegalStateException("metricsRetention must be positive");
            }
            if (slowScriptLoadThreshold == null || slowTrackingCallThreshold == null) {
                throw new IllegalStateException("slow thresholds must not be null");
            }
            if (maxHistorySize < 1) {
                throw new IllegalStateException("maxHistorySize must be at least 1");
            }
            return new AlertService(this);
        }
    }
}

package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.model.Alert;
import com.conversionlog.sdk.model.AlertSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs health checks on fixed-rate timers and raises alerts for unhealthy results
 *
 * <p>A basic check runs immediately on {@link #start()} and then every {@code basicInterval}; the
 * deep check runs every {@code deepInterval}. Ticks are skipped while the {@link ActivitySignal}
 * reports inactive. {@link #stop()} cancels both timers and the monitor can be started again.</p>
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    public static final Duration DEFAULT_BASIC_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_DEEP_INTERVAL = Duration.ofMinutes(30);

    public static final String HEALTH_CHECK_FAILED = "health_check_failed";
    public static final String DEEP_HEALTH_CHECK_FAILED = "deep_health_check_failed";

    private static final Duration DASHBOARD_WINDOW = Duration.ofHours(24);
    private static final int RECENT_ALERTS = 10;

    private final HealthCheckService healthCheckService;
    private final AlertService alertService;
    private final ActivitySignal activitySignal;
    private final Duration basicInterval;
    private final Duration deepInterval;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final Object lock = new Object();
    private ScheduledFuture<?> basicTask;
    private ScheduledFuture<?> deepTask;
    private volatile HealthStatus status = HealthStatus.HEALTHY;
    private volatile HealthCheck lastCheck;
    private volatile HealthCheck lastDeepCheck;

    private HealthMonitor(Builder builder) {
        this.healthCheckService = builder.healthCheckService;
        this.alertService = builder.alertService;
        this.activitySignal = builder.activitySignal;
        this.basicInterval = builder.basicInterval;
        this.deepInterval = builder.deepInterval;
        if (builder.scheduler != null) {
            this.scheduler = builder.scheduler;
            this.ownsScheduler = false;
        } else {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "conversionlog-health");
                thread.setDaemon(true);
                return thread;
            });
            this.ownsScheduler = true;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    public void start() {
        synchronized (lock) {
            if (isRunning()) {
                return;
            }
            basicTask = scheduler.scheduleAtFixedRate(this::basicTick,
                    0, basicInterval.toMillis(), TimeUnit.MILLISECONDS);
            deepTask = scheduler.scheduleAtFixedRate(this::deepTick,
                    deepInterval.toMillis(), deepInterval.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("Health monitor started - basic every {}, deep every {}", basicInterval, deepInterval);
    }

    public void stop() {
        synchronized (lock) {
            if (basicTask != null) {
                basicTask.cancel(false);
                basicTask = null;
            }
            if (deepTask != null) {
                deepTask.cancel(false);
                deepTask = null;
            }
        }
        log.info("Health monitor stopped");
    }

    public boolean isRunning() {
        synchronized (lock) {
            return basicTask != null && !basicTask.isCancelled();
        }
    }

    @Override
    public void close() {
        stop();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    // ========================================================================
    // Checks
    // ========================================================================

    /**
     * Run a basic check now, alerting when it is not healthy
     */
    public HealthCheck performHealthCheck() {
        HealthCheck check = healthCheckService.performHealthCheck();
        status = check.getStatus();
        lastCheck = check;
        if (!check.isHealthy()) {
            alertService.handleAlert(HEALTH_CHECK_FAILED,
                    check.getStatus() == HealthStatus.CRITICAL ? AlertSeverity.CRITICAL : AlertSeverity.MEDIUM,
                    "Health check failed: " + String.join(", ", check.getIssues()),
                    Map.of("checks", check.getChecks(), "issues", check.getIssues()));
        }
        return check;
    }

    /**
     * Run a deep check now, alerting when it is not healthy
     */
    public HealthCheck performDeepHealthCheck() {
        HealthCheck check = healthCheckService.performDeepHealthCheck();
        lastDeepCheck = check;
        if (!check.isHealthy()) {
            alertService.handleAlert(DEEP_HEALTH_CHECK_FAILED,
                    check.getStatus() == HealthStatus.CRITICAL ? AlertSeverity.HIGH : AlertSeverity.MEDIUM,
                    "Deep health check failed: " + String.join(", ", check.getIssues()),
                    Map.of("checks", check.getChecks(), "issues", check.getIssues()));
        }
        return check;
    }

    public HealthReport getHealthStatus() {
        List<Alert> history = alertService.getAlertHistory();
        List<Alert> recent = history.subList(Math.max(0, history.size() - RECENT_ALERTS), history.size());
        return new HealthReport(status, lastCheck, lastDeepCheck, alertService.getActiveAlerts(), List.copyOf(recent));
    }

    public MonitoringDashboard getDashboard() {
        HealthReport health = getHealthStatus();
        HealthCheck deep = lastDeepCheck;
        PerformanceSnapshot performance = deep != null
                ? deep.performance().orElse(PerformanceSnapshot.empty())
                : PerformanceSnapshot.empty();
        return new MonitoringDashboard(
                health,
                performance,
                alertService.getAlertHistory().size(),
                health.activeAlerts().size(),
                alertService.getRecentErrors(DASHBOARD_WINDOW).size(),
                alertService.getRecentMetrics(DASHBOARD_WINDOW).size());
    }

    // ========================================================================
    // Internal
    // ========================================================================

    private void basicTick() {
        runTick("basic", this::performHealthCheck);
    }

    private void deepTick() {
        runTick("deep", this::performDeepHealthCheck);
    }

    private void runTick(String name, Runnable check) {
        try {
            if (!activitySignal.isActive()) {
                log.debug("Skipping {} health check, no activity", name);
                return;
            }
            check.run();
        } catch (RuntimeException e) {
            // a throwing tick would cancel the fixed-rate timer
            log.error("Scheduled {} health check failed", name, e);
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private HealthCheckService healthCheckService;
        private AlertService alertService;
        private ActivitySignal activitySignal = ActivitySignal.always();
        private Duration basicInterval = DEFAULT_BASIC_INTERVAL;
        private Duration deepInterval = DEFAULT_DEEP_INTERVAL;
        private ScheduledExecutorService scheduler;

        public Builder healthCheckService(HealthCheckService healthCheckService) {
            this.healthCheckService = healthCheckService;
            return this;
        }

        public Builder alertService(AlertService alertService) {
            this.alertService = alertService;
            return this;
        }

        public Builder activitySignal(ActivitySignal activitySignal) {
            this.activitySignal = activitySignal;
            return this;
        }

        public Builder basicInterval(Duration basicInterval) {
            this.basicInterval = basicInterval;
            return this;
        }

        public Builder deepInterval(Duration deepInterval) {
            this.deepInterval = deepInterval;
            return this;
        }

        /**
         * Scheduler for the timers. When not set the monitor owns a daemon thread.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public HealthMonitor build() {
            if (healthCheckService == null) {
                throw new IllegalStateException("healthCheckService is required");
            }
            if (alertService == null) {
                throw new IllegalStateException("alertService is required");
            }
            if (activitySignal == null) {
                throw new IllegalStateException("activitySignal must not be null");
            }
            if (basicInterval == null || basicInterval.isZero() || basicInterval.isNegative()) {
                throw new IllegalStateException("basicInterval must be positive");
            }
            if (deepInterval == null || deepInterval.isZero() || deepInterval.isNegative()) {
                throw new IllegalStateException("deepInterval must be positive");
            }
            return new HealthMonitor(this);
        }
    }
}

package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.dispatch.ConversionLabels;
import com.conversionlog.sdk.dispatch.MetricType;
import com.conversionlog.sdk.dispatch.TrackingMetrics;
import com.conversionlog.sdk.model.ConversionAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Basic and deep checks over the tracking stack
 *
 * <p>The basic check is cheap and runs often: tag function, conversion id, required settings and
 * error rate. The deep check adds script, label and event-queue validation plus performance
 * thresholds.</p>
 */
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    public static final double DEFAULT_ERROR_RATE_THRESHOLD = 0.05;
    static final Duration RECENT_ERRORS_WINDOW = Duration.ofHours(24);

    public static final String TAG_FUNCTION_AVAILABLE = "tag_function_available";
    public static final String CONVERSION_ID_CONFIGURED = "conversion_id_configured";
    public static final String PLATFORM_CONFIGURED = "platform_configured";
    public static final String ERROR_RATE = "error_rate";
    public static final String ERROR_RATE_HEALTHY = "error_rate_healthy";
    public static final String SCRIPTS_LOADED = "scripts_loaded";
    public static final String CONVERSION_TRACKING = "conversion_tracking";
    public static final String EVENT_QUEUE = "event_queue";
    public static final String CONFIGURATION = "configuration";

    private final TrackingEnvironment environment;
    private final ConversionLabels labels;
    private final TrackingMetrics metrics;
    private final AlertService alertService;
    private final Map<String, String> requiredSettings;
    private final Set<ConversionAction> requiredActions;
    private final double errorRateThreshold;
    private final Duration slowScriptLoadThreshold;
    private final Duration slowTrackingCallThreshold;
    private final Clock clock;

    private HealthCheckService(Builder builder) {
        this.environment = builder.environment;
        this.labels = builder.labels;
        this.metrics = builder.metrics;
        this.alertService = builder.alertService;
        this.requiredSettings = new LinkedHashMap<>(builder.requiredSettings);
        this.requiredActions = EnumSet.copyOf(builder.requiredActions);
        this.errorRateThreshold = builder.errorRateThreshold;
        this.slowScriptLoadThreshold = builder.slowScriptLoadThreshold;
        this.slowTrackingCallThreshold = builder.slowTrackingCallThreshold;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Checks
    // ========================================================================

    public HealthCheck performHealthCheck() {
        Map<String, Object> checks = new LinkedHashMap<>();
        List<String> issues = new ArrayList<>();
        HealthStatus status = HealthStatus.HEALTHY;

        try {
            boolean tagFunction = environment.tagFunctionAvailable();
            checks.put(TAG_FUNCTION_AVAILABLE, tagFunction);
            if (!tagFunction) {
                issues.add("Tag function not available");
                status = HealthStatus.CRITICAL;
            }

            boolean conversionId = labels.hasConversionId();
            checks.put(CONVERSION_ID_CONFIGURED, conversionId);
            if (!conversionId) {
                issues.add("Conversion ID not configured");
                status = HealthStatus.CRITICAL;
            }

            List<String> missing = missingSettings();
            checks.put(PLATFORM_CONFIGURED, missing.isEmpty());
            if (!missing.isEmpty()) {
                issues.add("Missing configuration: " + String.join(", ", missing));
                status = status.worst(HealthStatus.WARNING);
            }

            double errorRate = metrics.errorRate();
            boolean errorRateHealthy = errorRate < errorRateThreshold;
            checks.put(ERROR_RATE, errorRate);
            checks.put(ERROR_RATE_HEALTHY, errorRateHealthy);
            if (!errorRateHealthy) {
                issues.add(String.format(Locale.ROOT, "High error rate: %.2f%%", errorRate * 100));
                status = HealthStatus.CRITICAL;
            }
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            issues.add("Health check error: " + e.getMessage());
            status = HealthStatus.CRITICAL;
        }

        HealthCheck result = new HealthCheck(HealthCheck.Kind.BASIC, clock.instant(), status, checks, issues, null);
        log.debug("Health check completed: {}", result);
        return result;
    }

    public HealthCheck performDeepHealthCheck() {
        Map<String, Object> checks = new LinkedHashMap<>();
        List<String> issues = new ArrayList<>();
        HealthStatus status = HealthStatus.HEALTHY;
        PerformanceSnapshot performance = PerformanceSnapshot.empty();

        try {
            checks.put(SCRIPTS_LOADED, environment.scriptsLoaded());
            checks.put(CONVERSION_TRACKING, labels.hasConversionId() && labels.missing(requiredActions).isEmpty());
            checks.put(EVENT_QUEUE, environment.eventQueueInitialized());
            checks.put(CONFIGURATION, missingSettings().isEmpty());

            List<String> failed = checks.entrySet().stream()
                    .filter(check -> !Boolean.TRUE.equals(check.getValue()))
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toList());
            if (!failed.isEmpty()) {
                status = failed.size() > 2 ? HealthStatus.CRITICAL : HealthStatus.WARNING;
                failed.forEach(name -> issues.add("Failed check: " + name));
            }

            long recentErrors = alertService != null ? alertService.getRecentErrors(RECENT_ERRORS_WINDOW).size() : 0;
            performance = PerformanceSnapshot.of(metrics.snapshot(), recentErrors);

            if (performance.averageScriptLoadMillis() > slowScriptLoadThreshold.toMillis()) {
                status = status.worst(HealthStatus.WARNING);
                issues.add("Slow script loading detected");
            }
            if (performance.averageTrackingCallMillis() > slowTrackingCallThreshold.toMillis()) {
                status = status.worst(HealthStatus.WARNING);
                issues.add("Slow tracking calls detected");
            }
        } catch (RuntimeException e) {
            log.error("Deep health check failed", e);
            issues.add("Deep health check error: " + e.getMessage());
            status = HealthStatus.CRITICAL;
        }

        HealthCheck result = new HealthCheck(HealthCheck.Kind.DEEP, clock.instant(), status, checks, issues, performance);
        log.debug("Deep health check completed: {}", result);
        return result;
    }

    private List<String> missingSettings() {
        return requiredSettings.entrySet().stream()
                .filter(setting -> ConversionLabels.isPlaceholder(setting.getValue()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private TrackingEnvironment environment;
        private ConversionLabels labels;
        private TrackingMetrics metrics;
        private AlertService alertService;
        private final Map<String, String> requiredSettings = new LinkedHashMap<>();
        private Set<ConversionAction> requiredActions = EnumSet.allOf(ConversionAction.class);
        private double errorRateThreshold = DEFAULT_ERROR_RATE_THRESHOLD;
        private Duration slowScriptLoadThreshold = MetricType.SCRIPT_LOAD_TIME.getSlowThreshold();
        private Duration slowTrackingCallThreshold = MetricType.TRACKING_CALL_TIME.getSlowThreshold();
        private Clock clock = Clock.systemUTC();

        public Builder environment(TrackingEnvironment environment) {
            this.environment = environment;
            return this;
        }

        public Builder labels(ConversionLabels labels) {
            this.labels = labels;
            return this;
        }

        public Builder metrics(TrackingMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Source of the recent-error count in deep checks (optional)
         */
        public Builder alertService(AlertService alertService) {
            this.alertService = alertService;
            return this;
        }

        /**
         * A setting that must be present and not a placeholder, e.g. the developer token
         */
        public Builder requiredSetting(String name, String value) {
            this.requiredSettings.put(name, value);
            return this;
        }

        /**
         * Actions whose labels must resolve for the deep check to pass (default: all)
         */
        public Builder requiredActions(Set<ConversionAction> requiredActions) {
            this.requiredActions = requiredActions;
            return this;
        }

        public Builder errorRateThreshold(double errorRateThreshold) {
            this.errorRateThreshold = errorRateThreshold;
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

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public HealthCheckService build() {
            if (environment == null) {
                throw new IllegalStateException("environment is required");
            }
            if (labels == null) {
                throw new IllegalStateException("labels are required");
            }
            if (metrics == null) {
                throw new IllegalStateException("metrics are required");
            }
            if (requiredActions == null || requiredActions.isEmpty()) {
                throw new IllegalStateException("requiredActions must not be empty");
            }
            if (errorRateThreshold <= 0 || errorRateThreshold > 1) {
                throw new IllegalStateException("errorRateThreshold must be in (0, 1]");
            }
            if (slowScriptLoadThreshold == null || slowTrackingCallThreshold == null || clock == null) {
                throw new IllegalStateException("thresholds and clock must not be null");
            }
            return new HealthCheckService(this);
        }
    }
}

package com.conversionlog.sdk.autoconfigure;

import com.conversionlog.sdk.monitoring.AlertService;
import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "conversionlog")
@Validated
public class ConversionLogProperties {

    private final boolean enabled;
    private final String transport;

    @NestedConfigurationProperty
    private final Platform platform;

    @NestedConfigurationProperty
    private final OAuth oauth;

    @NestedConfigurationProperty
    private final Dispatcher dispatcher;

    @NestedConfigurationProperty
    private final AttemptLog attemptLog;

    @NestedConfigurationProperty
    private final Alerts alerts;

    @NestedConfigurationProperty
    private final Health health;

    @NestedConfigurationProperty
    private final Reconciliation reconciliation;

    @NestedConfigurationProperty
    private final Metrics metrics;

    public ConversionLogProperties(
            Boolean enabled,
            String transport,
            Platform platform,
            OAuth oauth,
            Dispatcher dispatcher,
            AttemptLog attemptLog,
            Alerts alerts,
            Health health,
            Reconciliation reconciliation,
            Metrics metrics) {
        this.enabled = enabled != null && enabled;
        this.transport = normalizeTransport(transport);
        this.platform = platform != null ? platform : new Platform(null, null, null, null, null, null, null, null, null, null, null);
        this.oauth = oauth != null ? oauth : new OAuth(null, null, null, null, null);
        this.dispatcher = dispatcher != null ? dispatcher : new Dispatcher(null, null, null, null, null, null, null, null);
        this.attemptLog = attemptLog != null ? attemptLog : new AttemptLog(null, null);
        this.alerts = alerts != null ? alerts : new Alerts(null, null, null, null, null, null, null);
        this.health = health != null ? health : new Health(null, null, null, null, null, null, null);
        this.reconciliation = reconciliation != null ? reconciliation : new Reconciliation(null, null, null, null);
        this.metrics = metrics != null ? metrics : new Metrics(null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getTransport() {
        return transport;
    }

    public Platform getPlatform() {
        return platform;
    }

    public OAuth getOauth() {
        return oauth;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public AttemptLog getAttemptLog() {
        return attemptLog;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    public Health getHealth() {
        return health;
    }

    public Reconciliation getReconciliation() {
        return reconciliation;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    @AssertTrue(message = "conversionlog.platform requires customer-id, developer-token, and conversion-action-id when any of them is set")
    public boolean isPlatformValid() {
        if (!enabled) {
            return true;
        }
        boolean any = hasText(platform.customerId) || hasText(platform.developerToken) || hasText(platform.conversionActionId);
        if (!any) {
            return true;
        }
        return hasText(platform.customerId) && hasText(platform.developerToken) && hasText(platform.conversionActionId);
    }

    @AssertTrue(message = "conversionlog.oauth requires client-id, client-secret, and refresh-token when any oauth field is set")
    public boolean isOAuthValid() {
        if (!enabled) {
            return true;
        }
        boolean any = hasText(oauth.clientId) || hasText(oauth.clientSecret) || hasText(oauth.refreshToken);
        if (!any) {
            return true;
        }
        return hasText(oauth.clientId) && hasText(oauth.clientSecret) && hasText(oauth.refreshToken);
    }

    @AssertTrue(message = "conversionlog.transport must be one of: restclient, jdk")
    public boolean isTransportValid() {
        if (!hasText(transport)) {
            return true;
        }
        return transport.equals("restclient") || transport.equals("jdk");
    }

    @AssertTrue(message = "conversionlog.health.error-rate-threshold must be in (0, 1] and "
            + "conversionlog.reconciliation.accuracy-threshold in [0, 100]")
    public boolean isThresholdsValid() {
        double errorRate = health.errorRateThreshold;
        BigDecimal accuracy = reconciliation.accuracyThreshold;
        return errorRate > 0 && errorRate <= 1
                && accuracy.signum() >= 0 && accuracy.compareTo(BigDecimal.valueOf(100)) <= 0;
    }

    @AssertTrue(message = "conversionlog.dispatcher.max-attempts must be at least 1")
    public boolean isMaxAttemptsValid() {
        return dispatcher.maxAttempts >= 1;
    }

    /**
     * Advertising platform account used by the server-side backup path
     */
    public static class Platform {
        private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
        private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
        private static final int DEFAULT_MAX_RETRIES = 2;
        private static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(500);

        private final String baseUrl;
        private final String apiVersion;
        private final String customerId;
        private final String loginCustomerId;
        private final String developerToken;
        private final String conversionActionId;
        private final Duration connectTimeout;
        private final Duration requestTimeout;
        private final int maxRetries;
        private final Duration retryDelay;
        private final ZoneId zone;

        public Platform(
                String baseUrl,
                String apiVersion,
                String customerId,
                String loginCustomerId,
                String developerToken,
                String conversionActionId,
                Duration connectTimeout,
                Duration requestTimeout,
                Integer maxRetries,
                Duration retryDelay,
                ZoneId zone) {
            this.baseUrl = hasText(baseUrl) ? baseUrl : "https://googleads.googleapis.com";
            this.apiVersion = hasText(apiVersion) ? apiVersion : "v14";
            this.customerId = customerId;
            this.loginCustomerId = loginCustomerId;
            this.developerToken = developerToken;
            this.conversionActionId = conversionActionId;
            this.connectTimeout = connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
            this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
            this.maxRetries = maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES;
            this.retryDelay = retryDelay != null ? retryDelay : DEFAULT_RETRY_DELAY;
            this.zone = zone != null ? zone : ZoneId.of("Asia/Tokyo");
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public String getApiVersion() {
            return apiVersion;
        }

        public String getCustomerId() {
            return customerId;
        }

        public String getLoginCustomerId() {
            return loginCustomerId;
        }

        public String getDeveloperToken() {
            return developerToken;
        }

        public String getConversionActionId() {
            return conversionActionId;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public ZoneId getZone() {
            return zone;
        }
    }

    public static class OAuth {
        private static final Duration DEFAULT_REFRESH_BUFFER = Duration.ofSeconds(60);

        private final String tokenUrl;
        private final String clientId;
        private final String clientSecret;
        private final String refreshToken;
        private final Duration refreshBuffer;

        public OAuth(
                String tokenUrl,
                String clientId,
                String clientSecret,
                String refreshToken,
                Duration refreshBuffer) {
            this.tokenUrl = hasText(tokenUrl) ? tokenUrl : "https://oauth2.googleapis.com/token";
            this.clientId = clientId;
            this.clientSecret = clientSecret;
            this.refreshToken = refreshToken;
            this.refreshBuffer = refreshBuffer != null ? refreshBuffer : DEFAULT_REFRESH_BUFFER;
        }

        public String getTokenUrl() {
            return tokenUrl;
        }

        public String getClientId() {
            return clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public String getRefreshToken() {
            return refreshToken;
        }

        public Duration getRefreshBuffer() {
            return refreshBuffer;
        }
    }

    /**
     * Client-path delivery. Label keys are action names such as {@code purchase} or {@code add-to-cart}.
     */
    public static class Dispatcher {
        private static final int DEFAULT_MAX_ATTEMPTS = 3;
        private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
        private static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
        private static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

        private final String conversionId;
        private final Map<String, String> labels;
        private final int maxAttempts;
        private final Duration timeout;
        private final Duration baseDelay;
        private final Duration maxDelay;
        private final String collectorUrl;
        private final boolean tagManagerQueue;

        public Dispatcher(
                String conversionId,
                Map<String, String> labels,
                Integer maxAttempts,
                Duration timeout,
                Duration baseDelay,
                Duration maxDelay,
                String collectorUrl,
                Boolean tagManagerQueue) {
            this.conversionId = conversionId;
            this.labels = labels != null ? Map.copyOf(labels) : Map.of();
            this.maxAttempts = maxAttempts != null ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
            this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
            this.baseDelay = baseDelay != null ? baseDelay : DEFAULT_BASE_DELAY;
            this.maxDelay = maxDelay != null ? maxDelay : DEFAULT_MAX_DELAY;
            this.collectorUrl = collectorUrl;
            this.tagManagerQueue = tagManagerQueue == null || tagManagerQueue;
        }

        public String getConversionId() {
            return conversionId;
        }

        public Map<String, String> getLabels() {
            return labels;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public String getCollectorUrl() {
            return collectorUrl;
        }

        public boolean isTagManagerQueue() {
            return tagManagerQueue;
        }
    }

    public static class AttemptLog {
        private static final Duration DEFAULT_RETENTION = Duration.ofDays(90);

        private final Path path;
        private final Duration retention;

        public AttemptLog(Path path, Duration retention) {
            this.path = path;
            this.retention = retention != null ? retention : DEFAULT_RETENTION;
        }

        /**
         * JSON-lines file; entries are kept in memory when unset
         */
        public Path getPath() {
            return path;
        }

        public Duration getRetention() {
            return retention;
        }
    }

    public static class Alerts {
        private final Path path;
        private final String webhookUrl;
        private final String environment;
        private final String minimumSeverity;
        private final Duration retention;
        private final Duration metricsRetention;
        private final int maxHistorySize;

        public Alerts(
                Path path,
                String webhookUrl,
                String environment,
                String minimumSeverity,
                Duration retention,
                Duration metricsRetention,
                Integer maxHistorySize) {
            this.path = path;
            this.webhookUrl = webhookUrl;
            this.environment = hasText(environment) ? environment : "production";
            this.minimumSeverity = hasText(minimumSeverity) ? minimumSeverity.trim().toLowerCase(Locale.ROOT) : "high";
            this.retention = retention != null ? retention : Duration.ofDays(90);
            this.metricsRetention = metricsRetention != null ? metricsRetention : Duration.ofDays(30);
            this.maxHistorySize = maxHistorySize != null && maxHistorySize > 0
                    ? maxHistorySize : AlertService.DEFAULT_MAX_HISTORY_SIZE;
        }

        public Path getPath() {
            return path;
        }

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public String getEnvironment() {
            return environment;
        }

        public String getMinimumSeverity() {
            return minimumSeverity;
        }

        public Duration getRetention() {
            return retention;
        }

        public Duration getMetricsRetention() {
            return metricsRetention;
        }

        public int getMaxHistorySize() {
            return maxHistorySize;
        }
    }

    public static class Health {
        private final boolean enabled;
        private final Duration basicInterval;
        private final Duration deepInterval;
        private final double errorRateThreshold;
        private final Duration errorRateWindow;
        private final Duration slowScriptLoad;
        private final Duration slowTrackingCall;

        public Health(
                Boolean enabled,
                Duration basicInterval,
                Duration deepInterval,
                Double errorRateThreshold,
                Duration errorRateWindow,
                Duration slowScriptLoad,
                Duration slowTrackingCall) {
            this.enabled = enabled == null || enabled;
            this.basicInterval = basicInterval != null ? basicInterval : Duration.ofMinutes(5);
            this.deepInterval = deepInterval != null ? deepInterval : Duration.ofMinutes(30);
            this.errorRateThreshold = errorRateThreshold != null ? errorRateThreshold : 0.05;
            this.errorRateWindow = errorRateWindow != null && !errorRateWindow.isNegative() && !errorRateWindow.isZero()
                    ? errorRateWindow : Duration.ofMinutes(5);
            this.slowScriptLoad = slowScriptLoad != null ? slowScriptLoad : Duration.ofSeconds(10);
            this.slowTrackingCall = slowTrackingCall != null ? slowTrackingCall : Duration.ofSeconds(2);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public Duration getBasicInterval() {
            return basicInterval;
        }

        public Duration getDeepInterval() {
            return deepInterval;
        }

        public double getErrorRateThreshold() {
            return errorRateThreshold;
        }

        public Duration getErrorRateWindow() {
            return errorRateWindow;
        }

        public Duration getSlowScriptLoad() {
            return slowScriptLoad;
        }

        public Duration getSlowTrackingCall() {
            return slowTrackingCall;
        }
    }

    public static class Reconciliation {
        private final boolean enabled;
        private final Duration interval;
        private final Duration window;
        private final BigDecimal accuracyThreshold;

        public Reconciliation(Boolean enabled, Duration interval, Duration window, BigDecimal accuracyThreshold) {
            this.enabled = enabled == null || enabled;
            this.interval = interval != null ? interval : Duration.ofHours(1);
            this.window = window != null ? window : Duration.ofHours(1);
            this.accuracyThreshold = accuracyThreshold != null ? accuracyThreshold : new BigDecimal("95");
        }

        public boolean isEnabled() {
            return enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public Duration getWindow() {
            return window;
        }

        public BigDecimal getAccuracyThreshold() {
            return accuracyThreshold;
        }
    }

    public static class Metrics {
        private final boolean enabled;

        public Metrics(Boolean enabled) {
            this.enabled = enabled == null || enabled;
        }

        public boolean isEnabled() {
            return enabled;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String normalizeTransport(String transport) {
        if (!hasText(transport)) {
            return null;
        }
        return transport.trim().toLowerCase(Locale.ROOT);
    }
}

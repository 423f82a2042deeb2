package com.conversionlog.sdk.autoconfigure;

import com.conversionlog.sdk.attemptlog.AttemptLogStore;
import com.conversionlog.sdk.attemptlog.InMemoryAttemptLogStore;
import com.conversionlog.sdk.attemptlog.JsonLinesAttemptLogStore;
import com.conversionlog.sdk.autoconfigure.transport.RestClientTransport;
import com.conversionlog.sdk.backup.BackupConversionService;
import com.conversionlog.sdk.backup.BookingStore;
import com.conversionlog.sdk.client.AdPlatformClient;
import com.conversionlog.sdk.client.OAuthTokenProvider;
import com.conversionlog.sdk.client.TokenProvider;
import com.conversionlog.sdk.client.transport.ConversionTransport;
import com.conversionlog.sdk.client.transport.JdkHttpTransport;
import com.conversionlog.sdk.dispatch.BackoffPolicy;
import com.conversionlog.sdk.dispatch.ConsentProvider;
import com.conversionlog.sdk.dispatch.ConversionDispatcher;
import com.conversionlog.sdk.dispatch.ConversionLabels;
import com.conversionlog.sdk.dispatch.EventSink;
import com.conversionlog.sdk.dispatch.HttpEventSink;
import com.conversionlog.sdk.dispatch.TagManagerQueue;
import com.conversionlog.sdk.dispatch.TrackingMetrics;
import com.conversionlog.sdk.hashing.IdentifierHasher;
import com.conversionlog.sdk.model.AlertSeverity;
import com.conversionlog.sdk.model.ConversionAction;
import com.conversionlog.sdk.monitoring.ActivitySignal;
import com.conversionlog.sdk.monitoring.AlertChannel;
import com.conversionlog.sdk.monitoring.AlertRepository;
import com.conversionlog.sdk.monitoring.AlertService;
import com.conversionlog.sdk.monitoring.HealthCheckService;
import com.conversionlog.sdk.monitoring.HealthMonitor;
import com.conversionlog.sdk.monitoring.InMemoryAlertRepository;
import com.conversionlog.sdk.monitoring.JsonFileAlertRepository;
import com.conversionlog.sdk.monitoring.TrackingEnvironment;
import com.conversionlog.sdk.monitoring.WebhookAlertChannel;
import com.conversionlog.sdk.reconciliation.ReconciliationEngine;
import com.conversionlog.sdk.util.ConversionLogUtils;
import com.conversionlog.sdk.validation.ConversionEventValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

@AutoConfiguration
@EnableConfigurationProperties(ConversionLogProperties.class)
@ConditionalOnClass(ConversionDispatcher.class)
@ConditionalOnProperty(prefix = "conversionlog", name = "enabled", havingValue = "true")
public class ConversionLogAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ConversionLogAutoConfiguration.class);
    private static final Set<String> DEV_PROFILES = new HashSet<>(Arrays.asList("dev", "local", "test"));

    /** Bean name of a host-supplied primary delivery channel. */
    public static final String PRIMARY_SINK_BEAN = "conversionLogPrimarySink";

    private static final Duration DEV_CONNECT_TIMEOUT = Duration.ofSeconds(3);
    private static final Duration DEV_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEV_RETRY_DELAY = Duration.ofMillis(200);
    private static final Duration DEV_BASE_DELAY = Duration.ofMillis(200);

    private final Environment environment;

    public ConversionLogAutoConfiguration(Environment environment) {
        this.environment = environment;
    }

    // ========================================================================
    // Transport and platform client
    // ========================================================================

    @Bean
    @ConditionalOnClass(RestClient.class)
    @ConditionalOnProperty(prefix = "conversionlog", name = "transport", havingValue = "restclient", matchIfMissing = true)
    @ConditionalOnMissingBean(ConversionTransport.class)
    public ConversionTransport conversionLogRestClientTransport(
            ObjectProvider<RestClient.Builder> restClientBuilderProvider,
            ObjectProvider<Executor> asyncExecutorProvider) {
        RestClient.Builder builder = restClientBuilderProvider.getIfUnique();
        RestClient restClient = builder != null ? builder.build() : RestClient.builder().build();
        return new RestClientTransport(restClient, asyncExecutorProvider.getIfUnique());
    }

    @Bean
    @ConditionalOnProperty(prefix = "conversionlog", name = "transport", havingValue = "jdk", matchIfMissing = true)
    @ConditionalOnMissingBean(ConversionTransport.class)
    public ConversionTransport conversionLogJdkTransport(
            ConversionLogProperties properties,
            ObjectProvider<HttpClient> httpClientProvider) {
        HttpClient httpClient = httpClientProvider.getIfUnique();
        if (httpClient == null) {
            httpClient = HttpClient.newBuilder()
                    .connectTimeout(resolveDuration(properties.getPlatform().getConnectTimeout(),
                            "conversionlog.platform.connect-timeout", DEV_CONNECT_TIMEOUT))
                    .build();
        }
        return new JdkHttpTransport(httpClient);
    }

    @Bean
    @ConditionalOnMissingBean(TokenProvider.class)
    @ConditionalOnProperty(prefix = "conversionlog.oauth", name = {"client-id", "client-secret", "refresh-token"})
    public OAuthTokenProvider conversionLogTokenProvider(
            ConversionLogProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<HttpClient> httpClientProvider) {
        ConversionLogProperties.OAuth oauth = properties.getOauth();
        OAuthTokenProvider.Builder builder = OAuthTokenProvider.builder()
                .tokenUrl(oauth.getTokenUrl())
                .clientId(oauth.getClientId())
                .clientSecret(oauth.getClientSecret())
                .refreshToken(oauth.getRefreshToken())
                .refreshBuffer(oauth.getRefreshBuffer())
                .connectTimeout(resolveDuration(properties.getPlatform().getConnectTimeout(),
                        "conversionlog.platform.connect-timeout", DEV_CONNECT_TIMEOUT))
                .requestTimeout(resolveDuration(properties.getPlatform().getRequestTimeout(),
                        "conversionlog.platform.request-timeout", DEV_REQUEST_TIMEOUT));

        ObjectMapper objectMapper = objectMapperProvider.getIfUnique();
        if (objectMapper != null) {
            builder.objectMapper(objectMapper);
        }

        HttpClient httpClient = httpClientProvider.getIfUnique();
        if (httpClient != null) {
            builder.httpClient(httpClient);
        }

        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "conversionlog.platform", name = {"customer-id", "developer-token"})
    public AdPlatformClient adPlatformClient(
            ConversionLogProperties properties,
            ObjectProvider<TokenProvider> tokenProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<ConversionTransport> transportProvider) {
        ConversionLogProperties.Platform platform = properties.getPlatform();
        AdPlatformClient.Builder builder = AdPlatformClient.builder()
                .baseUrl(platform.getBaseUrl())
                .apiVersion(platform.getApiVersion())
                .customerId(platform.getCustomerId())
                .developerToken(platform.getDeveloperToken())
                .connectTimeout(resolveDuration(platform.getConnectTimeout(),
                        "conversionlog.platform.connect-timeout", DEV_CONNECT_TIMEOUT))
                .requestTimeout(resolveDuration(platform.getRequestTimeout(),
                        "conversionlog.platform.request-timeout", DEV_REQUEST_TIMEOUT))
                .maxRetries(platform.getMaxRetries())
                .retryDelay(resolveDuration(platform.getRetryDelay(),
                        "conversionlog.platform.retry-delay", DEV_RETRY_DELAY));

        if (hasText(platform.getLoginCustomerId())) {
            builder.loginCustomerId(platform.getLoginCustomerId());
        }

        TokenProvider token = tokenProvider.getIfUnique();
        if (token != null) {
            builder.tokenProvider(token);
        }

        ObjectMapper objectMapper = objectMapperProvider.getIfUnique();
        if (objectMapper != null) {
            builder.objectMapper(objectMapper);
        }

        ConversionTransport transport = transportProvider.getIfUnique();
        if (transport != null) {
            builder.transport(transport);
        }

        return builder.build();
    }

    // ========================================================================
    // Stores and alerts
    // ========================================================================

    @Bean
    @ConditionalOnMissingBean
    public AttemptLogStore conversionAttemptLogStore(
            ConversionLogProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider) {
        ConversionLogProperties.AttemptLog attemptLog = properties.getAttemptLog();
        if (attemptLog.getPath() == null) {
            log.info("conversionlog.attempt-log.path not set - attempt entries are kept in memory only");
            return new InMemoryAttemptLogStore();
        }
        return new JsonLinesAttemptLogStore(attemptLog.getPath(), mapper(objectMapperProvider));
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertRepository conversionAlertRepository(
            ConversionLogProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider) {
        Path path = properties.getAlerts().getPath();
        return path != null ? new JsonFileAlertRepository(path, mapper(objectMapperProvider)) : new InMemoryAlertRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "conversionlog.alerts", name = "webhook-url")
    public WebhookAlertChannel conversionWebhookAlertChannel(
            ConversionLogProperties properties,
            ConversionTransport transport,
            ObjectProvider<ObjectMapper> objectMapperProvider) {
        ConversionLogProperties.Alerts alerts = properties.getAlerts();
        return WebhookAlertChannel.builder()
                .webhookUrl(alerts.getWebhookUrl())
                .transport(transport)
                .objectMapper(mapper(objectMapperProvider))
                .environment(alerts.getEnvironment())
                .minimumSeverity(AlertSeverity.fromValue(alerts.getMinimumSeverity()))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertService conversionAlertService(
            ConversionLogProperties properties,
            AlertRepository repository,
            ObjectProvider<AlertChannel> channels,
            ObjectProvider<Clock> clockProvider) {
        ConversionLogProperties.Alerts alerts = properties.getAlerts();
        ConversionLogProperties.Health health = properties.getHealth();
        AlertService.Builder builder = AlertService.builder()
                .repository(repository)
                .clock(clockProvider.getIfUnique(Clock::systemUTC))
                .alertRetention(alerts.getRetention())
                .metricsRetention(alerts.getMetricsRetention())
                .maxHistorySize(alerts.getMaxHistorySize())
                .slowScriptLoadThreshold(health.getSlowScriptLoad())
                .slowTrackingCallThreshold(health.getSlowTrackingCall());
        channels.orderedStream().forEach(builder::channel);
        return builder.build();
    }

    // ========================================================================
    // Client path
    // ========================================================================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "conversionlog.dispatcher", name = "tag-manager-queue", havingValue = "true", matchIfMissing = true)
    public TagManagerQueue conversionTagManagerQueue() {
        return new TagManagerQueue().initialize();
    }

    @Bean(name = PRIMARY_SINK_BEAN)
    @ConditionalOnMissingBean(name = PRIMARY_SINK_BEAN)
    @ConditionalOnProperty(prefix = "conversionlog.dispatcher", name = "collector-url")
    public EventSink conversionCollectorSink(
            ConversionLogProperties properties,
            ConversionTransport transport,
            ObjectProvider<ObjectMapper> objectMapperProvider) {
        ConversionLogProperties.Dispatcher dispatcher = properties.getDispatcher();
        return new HttpEventSink("collector", URI.create(dispatcher.getCollectorUrl()), transport,
                mapper(objectMapperProvider), Map.of(), dispatcher.getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public TrackingMetrics conversionTrackingMetrics(
            ConversionLogProperties properties,
            ObjectProvider<Clock> clockProvider) {
        return new TrackingMetrics(clockProvider.getIfUnique(Clock::systemUTC),
                properties.getHealth().getErrorRateWindow());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConversionEventValidator conversionEventValidator() {
        return new ConversionEventValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConversionLabels conversionLabels(ConversionLogProperties properties) {
        ConversionLogProperties.Dispatcher dispatcher = properties.getDispatcher();
        Map<ConversionAction, String> labels = new EnumMap<>(ConversionAction.class);
        dispatcher.getLabels().forEach((key, label) ->
                labels.put(ConversionAction.fromValue(key.trim().replace('-', '_').toLowerCase(Locale.ROOT)), label));
        ConversionLabels resolved = ConversionLabels.builder()
                .conversionId(dispatcher.getConversionId())
                .labels(labels)
                .build();
        if (!resolved.hasConversionId()) {
            log.warn("conversionlog.dispatcher.conversion-id is not configured - purchases will fail health checks");
        }
        return resolved;
    }

    @Bean
    @ConditionalOnMissingBean
    public ConversionDispatcher conversionDispatcher(
            ConversionLogProperties properties,
            ConversionLabels labels,
            AttemptLogStore attemptLogStore,
            ConversionEventValidator validator,
            TrackingMetrics metrics,
            AlertService alertService,
            @Qualifier(PRIMARY_SINK_BEAN) ObjectProvider<EventSink> primarySinkProvider,
            ObjectProvider<TagManagerQueue> tagManagerQueueProvider,
            ObjectProvider<ConsentProvider> consentProvider,
            ObjectProvider<Clock> clockProvider) {
        ConversionLogProperties.Dispatcher dispatcher = properties.getDispatcher();
        EventSink primary = primarySinkProvider.getIfAvailable();
        TagManagerQueue queue = tagManagerQueueProvider.getIfAvailable();
        if (primary == null && queue == null) {
            throw new IllegalStateException("conversionlog.dispatcher needs collector-url, a '" + PRIMARY_SINK_BEAN
                    + "' bean, or the tag manager queue");
        }

        Duration baseDelay = resolveDuration(dispatcher.getBaseDelay(), "conversionlog.dispatcher.base-delay", DEV_BASE_DELAY);
        ConversionDispatcher.Builder builder = ConversionDispatcher.builder()
                .primarySink(primary != null ? primary : queue)
                .labels(labels)
                .consentProvider(consentProvider.getIfAvailable(ConsentProvider::granted))
                .attemptLogStore(attemptLogStore)
                .validator(validator)
                .backoffPolicy(BackoffPolicy.exponential(baseDelay, dispatcher.getMaxDelay().compareTo(baseDelay) < 0
                        ? baseDelay : dispatcher.getMaxDelay()))
                .maxAttempts(dispatcher.getMaxAttempts())
                .timeout(dispatcher.getTimeout())
                .listener(alertService)
                .metrics(metrics)
                .clock(clockProvider.getIfUnique(Clock::systemUTC));

        if (primary != null && queue != null) {
            builder.bestEffortSink(queue);
        }

        return builder.build();
    }

    // ========================================================================
    // Server path and reconciliation (need a host BookingStore)
    // ========================================================================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(BookingStore.class)
    @ConditionalOnProperty(prefix = "conversionlog.platform", name = {"customer-id", "developer-token", "conversion-action-id"})
    public BackupConversionService backupConversionService(
            ConversionLogProperties properties,
            BookingStore bookingStore,
            AdPlatformClient adPlatformClient,
            AttemptLogStore attemptLogStore,
            ConversionEventValidator validator,
            AlertService alertService,
            ObjectProvider<Clock> clockProvider) {
        ConversionLogProperties.Platform platform = properties.getPlatform();
        return BackupConversionService.builder()
                .bookingStore(bookingStore)
                .adPlatformClient(adPlatformClient)
                .attemptLogStore(attemptLogStore)
                .hasher(new IdentifierHasher())
                .validator(validator)
                .conversionActionId(platform.getConversionActionId())
                .zone(platform.getZone())
                .clock(clockProvider.getIfUnique(Clock::systemUTC))
                .listener(alertService)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(BookingStore.class)
    public ReconciliationEngine reconciliationEngine(
            ConversionLogProperties properties,
            BookingStore bookingStore,
            AttemptLogStore attemptLogStore,
            AlertService alertService,
            ObjectProvider<Clock> clockProvider) {
        return ReconciliationEngine.builder()
                .bookingStore(bookingStore)
                .attemptLogStore(attemptLogStore)
                .alertService(alertService)
                .accuracyAlertThreshold(properties.getReconciliation().getAccuracyThreshold())
                .clock(clockProvider.getIfUnique(Clock::systemUTC))
                .build();
    }

    @Bean
    @ConditionalOnBean(BookingStore.class)
    @ConditionalOnProperty(prefix = "conversionlog.reconciliation", name = "enabled", havingValue = "true", matchIfMissing = true)
    ReconciliationJob conversionReconciliationJob(
            ConversionLogProperties properties,
            ReconciliationEngine engine,
            AttemptLogStore attemptLogStore,
            ObjectProvider<Clock> clockProvider) {
        ConversionLogProperties.Reconciliation reconciliation = properties.getReconciliation();
        return new ReconciliationJob(engine, attemptLogStore, reconciliation.getInterval(), reconciliation.getWindow(),
                properties.getAttemptLog().getRetention(), clockProvider.getIfUnique(Clock::systemUTC), null);
    }

    // ========================================================================
    // Health monitoring
    // ========================================================================

    @Bean
    @ConditionalOnMissingBean
    public TrackingEnvironment conversionTrackingEnvironment(
            ConversionDispatcher dispatcher,
            ObjectProvider<TagManagerQueue> tagManagerQueueProvider) {
        return TrackingEnvironment.fromSinks(dispatcher.getPrimarySink(), tagManagerQueueProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "conversionlog.health", name = "enabled", havingValue = "true", matchIfMissing = true)
    public HealthCheckService conversionHealthCheckService(
            ConversionLogProperties properties,
            TrackingEnvironment trackingEnvironment,
            ConversionDispatcher dispatcher,
            AlertService alertService,
            ObjectProvider<Clock> clockProvider) {
        ConversionLogProperties.Health health = properties.getHealth();
        // purchase plus whatever actions have labels configured
        Set<ConversionAction> requiredActions = EnumSet.of(ConversionAction.PURCHASE);
        for (ConversionAction action : ConversionAction.values()) {
            if (dispatcher.getLabels().labelFor(action).isPresent()) {
                requiredActions.add(action);
            }
        }
        HealthCheckService.Builder builder = HealthCheckService.builder()
                .environment(trackingEnvironment)
                .labels(dispatcher.getLabels())
                .requiredActions(requiredActions)
                .metrics(dispatcher.getMetrics())
                .alertService(alertService)
                .errorRateThreshold(health.getErrorRateThreshold())
                .slowScriptLoadThreshold(health.getSlowScriptLoad())
                .slowTrackingCallThreshold(health.getSlowTrackingCall())
                .clock(clockProvider.getIfUnique(Clock::systemUTC));

        ConversionLogProperties.Platform platform = properties.getPlatform();
        if (hasText(platform.getCustomerId()) || hasText(platform.getDeveloperToken())) {
            builder.requiredSetting("customer_id", platform.getCustomerId())
                    .requiredSetting("developer_token", platform.getDeveloperToken())
                    .requiredSetting("conversion_action_id", platform.getConversionActionId());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "conversionlog.health", name = "enabled", havingValue = "true", matchIfMissing = true)
    public HealthMonitor conversionHealthMonitor(
            ConversionLogProperties properties,
            HealthCheckService healthCheckService,
            AlertService alertService,
            ObjectProvider<ActivitySignal> activitySignal) {
        ConversionLogProperties.Health health = properties.getHealth();
        return HealthMonitor.builder()
                .healthCheckService(healthCheckService)
                .alertService(alertService)
                .activitySignal(activitySignal.getIfAvailable(ActivitySignal::always))
                .basicInterval(health.getBasicInterval())
                .deepInterval(health.getDeepInterval())
                .build();
    }

    @Bean
    ConversionLogLifecycle conversionLogLifecycle(
            ObjectProvider<HealthMonitor> healthMonitor,
            ObjectProvider<ReconciliationJob> reconciliationJob) {
        return new ConversionLogLifecycle(healthMonitor.getIfAvailable(), reconciliationJob.getIfAvailable());
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static ObjectMapper mapper(ObjectProvider<ObjectMapper> objectMapperProvider) {
        return objectMapperProvider.getIfUnique(ConversionLogUtils::defaultObjectMapper);
    }

    private Duration resolveDuration(Duration currentValue, String propertyKey, Duration devDefault) {
        if (environment.containsProperty(propertyKey)) {
            return currentValue;
        }
        return isDevProfile() ? devDefault : currentValue;
    }

    private boolean isDevProfile() {
        String[] activeProfiles = environment.getActiveProfiles();
        if (activeProfiles.length == 0) {
            activeProfiles = environment.getDefaultProfiles();
        }
        for (String profile : activeProfiles) {
            if (DEV_PROFILES.contains(profile.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

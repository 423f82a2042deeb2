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
import com.conversionlog.sdk.dispatch.ConversionDispatcher;
import com.conversionlog.sdk.dispatch.ConversionLabels;
import com.conversionlog.sdk.dispatch.HttpEventSink;
import com.conversionlog.sdk.dispatch.TagManagerQueue;
import com.conversionlog.sdk.dispatch.TrackingMetrics;
import com.conversionlog.sdk.model.ConversionAction;
import com.conversionlog.sdk.monitoring.AlertService;
import com.conversionlog.sdk.monitoring.HealthMonitor;
import com.conversionlog.sdk.monitoring.JsonFileAlertRepository;
import com.conversionlog.sdk.monitoring.WebhookAlertChannel;
import com.conversionlog.sdk.reconciliation.ReconciliationEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ConversionLogAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConversionLogAutoConfiguration.class));

    private static final String[] PLATFORM = {
            "conversionlog.platform.customer-id=123-456-7890",
            "conversionlog.platform.developer-token=dev-token",
            "conversionlog.platform.conversion-action-id=555",
            "conversionlog.oauth.client-id=client",
            "conversionlog.oauth.client-secret=secret",
            "conversionlog.oauth.refresh-token=refresh"
    };

    @Test
    void doesNotRegisterBeansWhenDisabled() {
        contextRunner.run(context -> {
            assertThat(context).doesNotHaveBean(ConversionDispatcher.class);
            assertThat(context).doesNotHaveBean(AlertService.class);
            assertThat(context).doesNotHaveBean(ConversionTransport.class);
        });
    }

    @Test
    void registersClientPathWhenEnabled() {
        contextRunner
                .withPropertyValues(
                        "conversionlog.enabled=true",
                        "conversionlog.transport=jdk",
                        "conversionlog.dispatcher.conversion-id=AW-123456789",
                        "conversionlog.dispatcher.labels.purchase=purchaseLbl")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(ConversionDispatcher.class);
                    assertThat(context).hasSingleBean(AlertService.class);
                    assertThat(context).hasSingleBean(TagManagerQueue.class);
                    assertThat(context).hasSingleBean(HealthMonitor.class);
                    assertThat(context.getBean(AttemptLogStore.class)).isInstanceOf(InMemoryAttemptLogStore.class);
                    assertThat(context.getBean(ConversionTransport.class)).isInstanceOf(JdkHttpTransport.class);

                    ConversionDispatcher dispatcher = context.getBean(ConversionDispatcher.class);
                    assertThat(dispatcher.getPrimarySink()).isSameAs(context.getBean(TagManagerQueue.class));
                    assertThat(dispatcher.getBestEffortSinks()).isEmpty();
                });
    }

    @Test
    void withoutBookingStoreServerPathIsSkipped() {
        contextRunner
                .withPropertyValues("conversionlog.enabled=true", "conversionlog.transport=jdk")
                .withPropertyValues(PLATFORM)
                .run(context -> {
                    assertThat(context).hasSingleBean(AdPlatformClient.class);
                    assertThat(context).doesNotHaveBean(BackupConversionService.class);
                    assertThat(context).doesNotHaveBean(ReconciliationEngine.class);
                    assertThat(context).doesNotHaveBean(ReconciliationJob.class);
                });
    }

    @Test
    void registersServerPathWithBookingStore() {
        contextRunner
                .withUserConfiguration(BookingStoreConfig.class)
                .withPropertyValues("conversionlog.enabled=true", "conversionlog.transport=jdk")
                .withPropertyValues(PLATFORM)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(OAuthTokenProvider.class);
                    assertThat(context).hasSingleBean(AdPlatformClient.class);
                    assertThat(context).hasSingleBean(BackupConversionService.class);
                    assertThat(context).hasSingleBean(ReconciliationEngine.class);
                    assertThat(context).hasSingleBean(ReconciliationJob.class);
                    assertThat(context.getBean(ReconciliationJob.class).isRunning()).isTrue();
                });
    }

    @Test
    void reconciliationJobCanBeDisabled() {
        contextRunner
                .withUserConfiguration(BookingStoreConfig.class)
                .withPropertyValues(
                        "conversionlog.enabled=true",
                        "conversionlog.transport=jdk",
                        "conversionlog.reconciliation.enabled=false")
                .run(context -> {
                    assertThat(context).hasSingleBean(ReconciliationEngine.class);
                    assertThat(context).doesNotHaveBean(ReconciliationJob.class);
                });
    }

    @Test
    void userTokenProviderWins() {
        contextRunner
                .withUserConfiguration(TokenConfig.class)
                .withPropertyValues("conversionlog.enabled=true", "conversionlog.transport=jdk")
                .withPropertyValues(PLATFORM)
                .run(context -> {
                    assertThat(context).hasSingleBean(TokenProvider.class);
                    assertThat(context).doesNotHaveBean(OAuthTokenProvider.class);
                    assertThat(context).hasSingleBean(AdPlatformClient.class);
                });
    }

    // --- Transport selection ---

    @Test
    void registersRestClientTransportByDefault() {
        contextRunner
                .withPropertyValues("conversionlog.enabled=true")
                .run(context -> {
                    assertThat(context).hasSingleBean(ConversionTransport.class);
                    assertThat(context.getBean(ConversionTransport.class)).isInstanceOf(RestClientTransport.class);
                });
    }

    @Test
    void rejectsUnknownTransport() {
        contextRunner
                .withPropertyValues("conversionlog.enabled=true", "conversionlog.transport=webclient")
                .run(context -> assertThat(context).hasFailed());
    }

    // --- Sinks ---

    @Test
    void collectorUrlBecomesPrimaryWithQueueAsBestEffort() {
        contextRunner
                .withPropertyValues(
                        "conversionlog.enabled=true",
                        "conversionlog.transport=jdk",
                        "conversionlog.dispatcher.collector-url=https://collector.test/events")
                .run(context -> {
                    ConversionDispatcher dispatcher = context.getBean(ConversionDispatcher.class);
                    assertThat(dispatcher.getPrimarySink()).isInstanceOf(HttpEventSink.class);
                    assertThat(dispatcher.getBestEffortSinks())
                            .containsExactly(context.getBean(TagManagerQueue.class));
                });
    }

    @Test
    void failsWithoutAnySink() {
        contextRunner
                .withPropertyValues(
                        "conversionlog.enabled=true",
                        "conversionlog.transport=jdk",
                        "conversionlog.dispatcher.tag-manager-queue=false")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasStackTraceContaining("collector-url");
                });
    }

    @Test
    void bindsLabelsByActionName() {
        contextRunner
                .withPropertyValues(
                        "conversionlog.enabled=true",
                        "conversionlog.transport=jdk",
                        "conversionlog.dispatcher.conversion-id=AW-123456789",
                        "conversionlog.dispatcher.labels.purchase=purchaseLbl",
                        "conversionlog.dispatcher.labels.add-to-cart=cartLbl")
                .run(context -> {
                    ConversionLabels labels = context.getBean(ConversionLabels.class);
                    assertThat(labels.resolve(ConversionAction.PURCHASE)).contains("AW-123456789/purchaseLbl");
                    assertThat(labels.resolve(ConversionAction.ADD_TO_CART)).contains("AW-123456789/cartLbl");
                    assertThat(labels.resolve(ConversionAction.VIEW_ITEM)).isEmpty();
                });
    }

    // --- Stores and alerts ---

    @Test
    void fileStoresWhenPathsConfigured(@TempDir Path dir) {
        contextRunner
                .withPropertyValues(
                        "conversionlog.enabled=true",
                        "conversionlog.transport=jdk",
                        "conversionlog.attempt-log.path=" + dir.resolve("attempts.jsonl"),
                        "conversionlog.alerts.path=" + dir.resolve("alerts.json"))
                .run(context -> {
                    assertThat(context.getBean(AttemptLogStore.class)).isInstanceOf(JsonLinesAttemptLogStore.class);
                    assertThat(context).hasSingleBean(JsonFileAlertRepository.class);
                });
    }

    @Test
    void registersWebhookChannelWhenUrlSet() {
        contextRunner
                .withPropertyValues(
                        "conversionlog.enabled=true",
                        "conversionlog.transport=jdk",
                        "conversionlog.alerts.webhook-url=https://hooks.test/alerts",
                        "conversionlog.alerts.minimum-severity=medium")
                .run(context -> assertThat(context).hasSingleBean(WebhookAlertChannel.class));
    }

    @Test
    void healthMonitorCanBeDisabled() {
        contextRunner
                .withPropertyValues(
                        "conversionlog.enabled=true",
                        "conversionlog.transport=jdk",
                        "conversionlog.health.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(HealthMonitor.class);
                    assertThat(context).hasSingleBean(ConversionLogLifecycle.class);
                });
    }

    @Test
    void errorRateWindowIsConfigurable() {
        contextRunner
                .withPropertyValues("conversionlog.enabled=true", "conversionlog.transport=jdk")
                .run(context -> assertThat(context.getBean(TrackingMetrics.class).getErrorRateWindow())
                        .isEqualTo(Duration.ofMinutes(5)));
        contextRunner
                .withPropertyValues(
                        "conversionlog.enabled=true",
                        "conversionlog.transport=jdk",
                        "conversionlog.health.error-rate-window=1m")
                .run(context -> assertThat(context.getBean(TrackingMetrics.class).getErrorRateWindow())
                        .isEqualTo(Duration.ofMinutes(1)));
    }

    @Test
    void healthMonitorStartsWithContext() {
        contextRunner
                .withPropertyValues("conversionlog.enabled=true", "conversionlog.transport=jdk")
                .run(context -> assertThat(context.getBean(HealthMonitor.class).isRunning()).isTrue());
    }

    // --- Validation ---

    @Test
    void rejectsPartialPlatformCredentials() {
        contextRunner
                .withPropertyValues(
                        "conversionlog.enabled=true",
                        "conversionlog.transport=jdk",
                        "conversionlog.platform.customer-id=1234567890")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    static class BookingStoreConfig {
        @Bean
        BookingStore bookingStore() {
            return mock(BookingStore.class);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class TokenConfig {
        @Bean
        TokenProvider tokenProvider() {
            return TokenProvider.of("static-token");
        }
    }
}

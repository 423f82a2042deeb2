package com.conversionlog.sdk.autoconfigure;

import com.conversionlog.sdk.dispatch.ConversionDispatcher;
import com.conversionlog.sdk.validation.ConversionInput;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ConversionLogMetricsAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ConversionLogAutoConfiguration.class,
                    ConversionLogMetricsAutoConfiguration.class))
            .withPropertyValues(
                    "conversionlog.enabled=true",
                    "conversionlog.transport=jdk",
                    "conversionlog.health.enabled=false",
                    "conversionlog.dispatcher.conversion-id=AW-123456789",
                    "conversionlog.dispatcher.labels.purchase=purchaseLbl")
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void registersAllGaugesWhenMicrometerPresent() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ConversionLogMetricsBinder.class);
            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(registry.find("conversionlog.dispatch.calls").gauge()).isNotNull();
            assertThat(registry.find("conversionlog.dispatch.calls.failed").gauge()).isNotNull();
            assertThat(registry.find("conversionlog.events.delivered").gauge()).isNotNull();
            assertThat(registry.find("conversionlog.events.failed").gauge()).isNotNull();
            assertThat(registry.find("conversionlog.events.suppressed").gauge()).isNotNull();
            assertThat(registry.find("conversionlog.dispatch.error-rate").gauge()).isNotNull();
            assertThat(registry.find("conversionlog.dispatch.call-time.avg").gauge()).isNotNull();
            assertThat(registry.find("conversionlog.alerts.active").gauge()).isNotNull();
            assertThat(registry.find("conversionlog.attempt-log.size").gauge()).isNotNull();
        });
    }

    @Test
    void initialGaugeValuesAreZero() {
        contextRunner.run(context -> {
            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(gauge(registry, "conversionlog.dispatch.calls")).isZero();
            assertThat(gauge(registry, "conversionlog.events.delivered")).isZero();
            assertThat(gauge(registry, "conversionlog.dispatch.error-rate")).isZero();
            assertThat(gauge(registry, "conversionlog.attempt-log.size")).isZero();
        });
    }

    @Test
    void gaugesFollowDeliveries() {
        contextRunner.run(context -> {
            ConversionDispatcher dispatcher = context.getBean(ConversionDispatcher.class);
            boolean delivered = dispatcher.trackPurchase(ConversionInput.builder()
                    .transactionId("B1")
                    .bookingId("B1")
                    .value(new BigDecimal("9000"))
                    .currency("JPY")
                    .build(), null).get(5, TimeUnit.SECONDS);
            assertThat(delivered).isTrue();

            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(gauge(registry, "conversionlog.dispatch.calls")).isEqualTo(1.0);
            assertThat(gauge(registry, "conversionlog.events.delivered")).isEqualTo(1.0);
            assertThat(gauge(registry, "conversionlog.attempt-log.size")).isEqualTo(1.0);
        });
    }

    @Test
    void doesNotRegisterWhenMetricsDisabled() {
        contextRunner
                .withPropertyValues("conversionlog.metrics.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(ConversionLogMetricsBinder.class));
    }

    @Test
    void doesNotRegisterWhenNoMeterRegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        ConversionLogAutoConfiguration.class,
                        ConversionLogMetricsAutoConfiguration.class))
                .withPropertyValues("conversionlog.enabled=true", "conversionlog.transport=jdk")
                .run(context -> assertThat(context).doesNotHaveBean(ConversionLogMetricsBinder.class));
    }

    private static double gauge(MeterRegistry registry, String name) {
        Gauge g = registry.find(name).gauge();
        assertThat(g).as("gauge '%s' should exist", name).isNotNull();
        return g.value();
    }

    @Configuration(proxyBeanMethods = false)
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }
}

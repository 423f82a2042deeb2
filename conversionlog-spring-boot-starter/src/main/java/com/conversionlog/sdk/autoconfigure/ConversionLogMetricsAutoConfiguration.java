package com.conversionlog.sdk.autoconfigure;

import com.conversionlog.sdk.attemptlog.AttemptLogStore;
import com.conversionlog.sdk.dispatch.ConversionDispatcher;
import com.conversionlog.sdk.monitoring.AlertService;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = ConversionLogAutoConfiguration.class)
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean({ConversionDispatcher.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "conversionlog.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
class ConversionLogMetricsAutoConfiguration {

    @Bean
    ConversionLogMetricsBinder conversionLogMetricsBinder(
            ConversionDispatcher dispatcher,
            ObjectProvider<AlertService> alertService,
            ObjectProvider<AttemptLogStore> attemptLogStore,
            MeterRegistry registry) {
        return new ConversionLogMetricsBinder(dispatcher, alertService.getIfUnique(),
                attemptLogStore.getIfUnique(), registry);
    }
}

package com.conversionlog.sdk.autoconfigure;

import com.conversionlog.sdk.attemptlog.AttemptLogStore;
import com.conversionlog.sdk.dispatch.ConversionDispatcher;
import com.conversionlog.sdk.monitoring.AlertService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

class ConversionLogMetricsBinder {

    ConversionLogMetricsBinder(ConversionDispatcher dispatcher, AlertService alertService,
                               AttemptLogStore attemptLogStore, MeterRegistry registry) {
        Gauge.builder("conversionlog.dispatch.calls", dispatcher,
                        d -> d.getMetrics().snapshot().callsTotal)
                .description("Total primary sink calls, retries included")
                .register(registry);

        Gauge.builder("conversionlog.dispatch.calls.failed", dispatcher,
                        d -> d.getMetrics().snapshot().callsFailed)
                .description("Primary sink calls that failed")
                .register(registry);

        Gauge.builder("conversionlog.events.delivered", dispatcher,
                        d -> d.getMetrics().snapshot().eventsDelivered)
                .description("Events accepted by the primary sink")
                .register(registry);

        Gauge.builder("conversionlog.events.failed", dispatcher,
                        d -> d.getMetrics().snapshot().eventsFailed)
                .description("Events that exhausted their attempts")
                .register(registry);

        Gauge.builder("conversionlog.events.suppressed", dispatcher,
                        d -> d.getMetrics().snapshot().eventsSuppressed)
                .description("Events dropped before delivery (consent, validation, missing label)")
                .register(registry);

        Gauge.builder("conversionlog.dispatch.error-rate", dispatcher,
                        d -> d.getMetrics().errorRate())
                .description("Failed calls over total calls")
                .register(registry);

        Gauge.builder("conversionlog.dispatch.call-time.avg", dispatcher,
                        d -> d.getMetrics().averageCallTimeMillis())
                .description("Average primary sink call time in milliseconds")
                .baseUnit("milliseconds")
                .register(registry);

        if (alertService != null) {
            Gauge.builder("conversionlog.alerts.active", alertService,
                            a -> a.getActiveAlerts().size())
                    .description("Alerts currently active")
                    .register(registry);
        }

        if (attemptLogStore != null) {
            Gauge.builder("conversionlog.attempt-log.size", attemptLogStore, AttemptLogStore::size)
                    .description("Entries held in the attempt log")
                    .register(registry);
        }
    }
}

package com.conversionlog.sdk.dispatch;

import com.conversionlog.sdk.attemptlog.AttemptLogStore;
import com.conversionlog.sdk.exception.ConversionLogException;
import com.conversionlog.sdk.exception.ErrorType;
import com.conversionlog.sdk.model.AttemptLogEntry;
import com.conversionlog.sdk.model.ConversionAction;
import com.conversionlog.sdk.model.ConversionEvent;
import com.conversionlog.sdk.model.ConversionType;
import com.conversionlog.sdk.util.ConversionLogUtils;
import com.conversionlog.sdk.validation.ConversionEventValidator;
import com.conversionlog.sdk.validation.ConversionInput;
import com.conversionlog.sdk.validation.FieldIssue;
import com.conversionlog.sdk.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Client-path conversion dispatcher - fire-and-forget delivery with retry
 *
 * <p>Every {@code track*} call returns immediately; validation, delivery and retries run on the
 * dispatcher's scheduler so tracking never blocks the booking flow. The returned future completes
 * with {@code true} once the primary sink accepted the event, or {@code false} when the event was
 * suppressed, rejected, or every attempt failed. It never completes exceptionally.</p>
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>No consent: complete {@code false}, no sink call, no attempt entry.</li>
 *   <li>Validation failure: one failed client attempt entry with the field issues.</li>
 *   <li>Unresolved conversion label: one failed client attempt entry, no retry.</li>
 *   <li>Primary sink: up to {@code maxAttempts} tries with capped exponential backoff, one
 *       failed client attempt entry per failed try.</li>
 *   <li>On success: push once to each best-effort sink, then append one successful entry with
 *       the per-sink outcomes.</li>
 * </ol>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * ConversionDispatcher dispatcher = ConversionDispatcher.builder()
 *     .primarySink(new HttpEventSink("collector", collectorUri, transport))
 *     .bestEffortSink(tagManagerQueue)
 *     .labels(labels)
 *     .consentProvider(consent)
 *     .attemptLogStore(store)
 *     .build();
 *
 * dispatcher.trackPurchase(ConversionInput.builder()
 *     .transactionId("B1").bookingId("B1").value(9000).currency("JPY").build(),
 *     TrackingOptions.defaults());
 * }</pre>
 */
public class ConversionDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConversionDispatcher.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final EventSink primarySink;
    private final List<EventSink> bestEffortSinks;
    private final ConversionLabels labels;
    private final ConsentProvider consentProvider;
    private final AttemptLogStore attemptLogStore;
    private final ConversionEventValidator validator;
    private final BackoffPolicy backoffPolicy;
    private final int maxAttempts;
    private final Duration timeout;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final List<TrackingListener> listeners;
    private final TrackingMetrics metrics;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ConversionDispatcher(Builder builder) {
        this.primarySink = builder.primarySink;
        this.bestEffortSinks = List.copyOf(builder.bestEffortSinks);
        this.labels = builder.labels;
        this.consentProvider = builder.consentProvider;
        this.attemptLogStore = builder.attemptLogStore;
        this.clock = builder.clock;
        this.validator = builder.validator != null
                ? builder.validator
                : new ConversionEventValidator("JPY", ConversionEventValidator.DEFAULT_MAX_VALUE, clock);
        this.backoffPolicy = builder.backoffPolicy;
        this.maxAttempts = builder.maxAttempts;
        this.timeout = builder.timeout;
        this.listeners = List.copyOf(builder.listeners);
        this.metrics = builder.metrics != null ? builder.metrics : new TrackingMetrics();
        if (builder.scheduler != null) {
            this.scheduler = builder.scheduler;
            this.ownsScheduler = false;
        } else {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreadFactory());
            this.ownsScheduler = true;
        }
        log.info("ConversionDispatcher started - primary sink: {}, best-effort sinks: {}, max attempts: {}, backoff: {}",
                primarySink.name(),
                bestEffortSinks.stream().map(EventSink::name).collect(Collectors.toList()),
                maxAttempts, backoffPolicy);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Public API
    // ========================================================================

    public CompletableFuture<Boolean> trackViewItem(ConversionInput input, TrackingOptions options) {
        return track(ConversionAction.VIEW_ITEM, input, options);
    }

    public CompletableFuture<Boolean> trackAddToCart(ConversionInput input, TrackingOptions options) {
        return track(ConversionAction.ADD_TO_CART, input, options);
    }

    public CompletableFuture<Boolean> trackBeginCheckout(ConversionInput input, TrackingOptions options) {
        return track(ConversionAction.BEGIN_CHECKOUT, input, options);
    }

    public CompletableFuture<Boolean> trackAddPaymentInfo(ConversionInput input, TrackingOptions options) {
        return track(ConversionAction.ADD_PAYMENT_INFO, input, options);
    }

    public CompletableFuture<Boolean> trackPurchase(ConversionInput input, TrackingOptions options) {
        return track(ConversionAction.PURCHASE, input, options);
    }

    /**
     * Track a conversion for the given action
     *
     * @param options per-call overrides, or {@code null} for the dispatcher defaults
     * @return future completing with whether the primary sink accepted the event
     */
    public CompletableFuture<Boolean> track(ConversionAction action, ConversionInput input, TrackingOptions options) {
        if (closed.get()) {
            log.warn("Dispatcher closed, dropping {} event", action.getValue());
            return CompletableFuture.completedFuture(false);
        }
        if (!hasConsent()) {
            log.debug("Tracking consent not granted, skipping {} event", action.getValue());
            metrics.recordSuppressed();
            metrics.recordError(ErrorType.PRIVACY_ERROR);
            return CompletableFuture.completedFuture(false);
        }

        TrackingOptions resolved = options != null ? options : TrackingOptions.defaults();
        Delivery delivery;
        try {
            delivery = new Delivery(action, input, resolved.resolveMaxAttempts(maxAttempts),
                    resolved.resolveTimeout(timeout));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid tracking options {}: {}", resolved, e.getMessage());
            return CompletableFuture.completedFuture(false);
        }

        try {
            scheduler.execute(delivery::start);
        } catch (RejectedExecutionException e) {
            log.warn("Dispatcher scheduler rejected {} event", action.getValue());
            delivery.result.complete(false);
        }
        return delivery.result;
    }

    /**
     * Record how long the tag runtime took to load, for health checks and slow-load alerts
     */
    public void recordScriptLoad(Duration loadTime) {
        long millis = loadTime.toMillis();
        metrics.recordScriptLoad(millis);
        notifyPerformance(MetricType.SCRIPT_LOAD_TIME, millis);
    }

    public TrackingMetrics getMetrics() {
        return metrics;
    }

    public ConversionLabels getLabels() {
        return labels;
    }

    public EventSink getPrimarySink() {
        return primarySink;
    }

    public List<EventSink> getBestEffortSinks() {
        return bestEffortSinks;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stop accepting events. In-flight retries are abandoned.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        log.info("ConversionDispatcher closed - {}", metrics.snapshot());
    }

    // ========================================================================
    // Internal - delivery state machine
    // ========================================================================

    private final class Delivery {
        final ConversionAction action;
        final ConversionInput input;
        final int maxAttempts;
        final Duration timeout;
        final CompletableFuture<Boolean> result = new CompletableFuture<>();
        SinkEvent sinkEvent;
        List<FieldIssue> degradedIssues = List.of();

        Delivery(ConversionAction action, ConversionInput input, int maxAttempts, Duration timeout) {
            this.action = action;
            this.input = input;
            this.maxAttempts = maxAttempts;
            this.timeout = timeout;
        }

        String logKey() {
            return input != null ? input.getLogKey() : null;
        }

        void start() {
            try {
                ValidationResult validation = validator.validate(action, input);
                if (!validation.isValid()) {
                    fail(ErrorType.VALIDATION_ERROR, "Validation failed: " + validation.summary(), 0,
                            Map.of("issues", validation.getIssues().stream()
                                    .map(FieldIssue::toString).collect(Collectors.toList())));
                    return;
                }
                ConversionEvent event = validation.getEventOrThrow();
                degradedIssues = validation.getIssues();

                Optional<String> sendTo = labels.resolve(action);
                if (sendTo.isEmpty()) {
                    fail(ErrorType.CONFIGURATION_ERROR, "No conversion label configured for " + action.getValue(),
                            0, Map.of());
                    return;
                }
                sinkEvent = SinkEvent.of(event, sendTo.get());
                attempt(1);
            } catch (RuntimeException e) {
                log.error("Unexpected error dispatching {} event", action.getValue(), e);
                fail(ErrorType.TRACKING_FAILURE, ConversionLogUtils.getRootCauseMessage(e), 0, Map.of());
            }
        }

        void attempt(int attempt) {
            if (closed.get()) {
                result.complete(false);
                return;
            }
            long startNanos = System.nanoTime();
            withTimeout(primarySink, sinkEvent, timeout).whenComplete((ignored, error) -> {
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                metrics.recordCall(elapsedMs, error == null);
                notifyPerformance(MetricType.TRACKING_CALL_TIME, elapsedMs);
                if (error == null) {
                    onDelivered(attempt);
                } else {
                    onAttemptFailed(attempt, unwrap(error));
                }
            });
        }

        void onAttemptFailed(int attempt, Throwable cause) {
            ErrorType type = classify(cause);
            String message = describe(cause);
            log.debug("{} attempt {}/{} for {} failed: {}",
                    action.getValue(), attempt, maxAttempts, logKey(), message);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("sink", primarySink.name());
            record(false, attempt, type, message, details);
            report(type, message, attempt, details);

            if (attempt >= maxAttempts || closed.get()) {
                log.warn("Giving up on {} event for {} after {} attempts: {}",
                        action.getValue(), logKey(), attempt, message);
                metrics.recordFailed();
                result.complete(false);
                return;
            }

            long delayMs = backoffPolicy.delayFor(attempt).toMillis();
            try {
                scheduler.schedule(() -> attempt(attempt + 1), delayMs, TimeUnit.MILLISECONDS);
                log.debug("Scheduled {} retry in {}ms for {}", action.getValue(), delayMs, logKey());
            } catch (RejectedExecutionException e) {
                log.warn("Retry for {} abandoned, scheduler shut down", logKey());
                metrics.recordFailed();
                result.complete(false);
            }
        }

        void onDelivered(int attempt) {
            List<CompletableFuture<Map.Entry<String, String>>> outcomes = new ArrayList<>();
            for (EventSink sink : bestEffortSinks) {
                outcomes.add(withTimeout(sink, sinkEvent, timeout)
                        .handle((ignored, error) -> {
                            if (error == null) {
                                return Map.entry(sink.name(), "ok");
                            }
                            String reason = describe(unwrap(error));
                            log.debug("Best-effort sink {} failed for {}: {}", sink.name(), logKey(), reason);
                            return Map.entry(sink.name(), "failed: " + reason);
                        }));
            }

            CompletableFuture.allOf(outcomes.toArray(new CompletableFuture<?>[0])).whenComplete((ignored, error) -> {
                Map<String, String> sinks = new LinkedHashMap<>();
                sinks.put(primarySink.name(), "ok");
                for (CompletableFuture<Map.Entry<String, String>> outcome : outcomes) {
                    Map.Entry<String, String> entry = outcome.join();
                    sinks.put(entry.getKey(), entry.getValue());
                }

                Map<String, Object> details = new LinkedHashMap<>();
                details.put("sinks", sinks);
                details.put("send_to", sinkEvent.getSendTo());
                if (sinkEvent.getValue() != null) {
                    details.put("value", sinkEvent.getValue());
                    details.put("currency", sinkEvent.getCurrency());
                }
                if (!degradedIssues.isEmpty()) {
                    details.put("degraded", degradedIssues.stream()
                            .map(FieldIssue::toString).collect(Collectors.toList()));
                }
                record(true, attempt, null, null, details);
                metrics.recordDelivered();
                log.debug("{} event for {} delivered on attempt {}", action.getValue(), logKey(), attempt);
                result.complete(true);
            });
        }

        void fail(ErrorType type, String message, int attempt, Map<String, Object> extra) {
            log.warn("{} event for {} not sent: {}", action.getValue(), logKey(), message);
            record(false, attempt, type, message, extra);
            report(type, message, attempt, extra);
            metrics.recordFailed();
            result.complete(false);
        }

        void record(boolean success, int attempt, ErrorType type, String message, Map<String, Object> extra) {
            String key = logKey();
            if (key == null || key.isBlank()) {
                // nothing to reconcile against
                return;
            }
            try {
                AttemptLogEntry.Builder entry = AttemptLogEntry.builder()
                        .bookingId(key)
                        .conversionType(ConversionType.CLIENT)
                        .success(success)
                        .timestamp(clock.instant())
                        .detail("action", action.getValue())
                        .detail("attempt", attempt)
                        .details(extra);
                if (type != null) {
                    entry.detail("error_type", type.getValue());
                    entry.detail("error", message);
                }
                attemptLogStore.append(entry.build());
            } catch (RuntimeException e) {
                log.error("Failed to record client attempt for {}", key, e);
            }
        }

        void report(ErrorType type, String message, int attempt, Map<String, Object> details) {
            metrics.recordError(type);
            TrackingError error = new TrackingError(type, message, action, logKey(), attempt, clock.instant(), details);
            for (TrackingListener listener : listeners) {
                try {
                    listener.onTrackingError(error);
                } catch (RuntimeException e) {
                    log.warn("Tracking listener {} failed: {}", listener, e.getMessage());
                }
            }
        }
    }

    // ========================================================================
    // Internal - helpers
    // ========================================================================

    private boolean hasConsent() {
        try {
            return consentProvider.hasTrackingConsent();
        } catch (RuntimeException e) {
            log.warn("Consent provider failed, treating as no consent: {}", e.getMessage());
            return false;
        }
    }

    private void notifyPerformance(MetricType type, long millis) {
        for (TrackingListener listener : listeners) {
            try {
                listener.onPerformanceMetric(type, millis);
            } catch (RuntimeException e) {
                log.warn("Tracking listener {} failed: {}", listener, e.getMessage());
            }
        }
    }

    private static CompletableFuture<Void> withTimeout(EventSink sink, SinkEvent event, Duration timeout) {
        CompletableFuture<Void> push;
        try {
            push = sink.push(event);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (push == null) {
            return CompletableFuture.failedFuture(new IllegalStateException(sink.name() + " returned no future"));
        }
        return push.copy().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static ErrorType classify(Throwable cause) {
        if (cause instanceof ConversionLogException conversionLogException) {
            return conversionLogException.getErrorType();
        }
        if (cause instanceof TimeoutException || cause instanceof java.io.IOException) {
            return ErrorType.NETWORK_ERROR;
        }
        return ErrorType.TRACKING_FAILURE;
    }

    private static String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static ThreadFactory daemonThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "conversionlog-dispatcher-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private EventSink primarySink;
        private final List<EventSink> bestEffortSinks = new ArrayList<>();
        private ConversionLabels labels;
        private ConsentProvider consentProvider;
        private AttemptLogStore attemptLogStore;
        private ConversionEventValidator validator;
        private BackoffPolicy backoffPolicy = BackoffPolicy.defaults();
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration timeout = DEFAULT_TIMEOUT;
        private ScheduledExecutorService scheduler;
        private final List<TrackingListener> listeners = new ArrayList<>();
        private TrackingMetrics metrics;
        private Clock clock = Clock.systemUTC();

        /**
         * Channel whose acceptance defines success; retried with backoff (required)
         */
        public Builder primarySink(EventSink primarySink) {
            this.primarySink = primarySink;
            return this;
        }

        /**
         * Channel tried once after the primary succeeds; its failure never changes the result
         */
        public Builder bestEffortSink(EventSink sink) {
            if (sink != null) {
                this.bestEffortSinks.add(sink);
            }
            return this;
        }

        public Builder labels(ConversionLabels labels) {
            this.labels = labels;
            return this;
        }

        public Builder consentProvider(ConsentProvider consentProvider) {
            this.consentProvider = consentProvider;
            return this;
        }

        public Builder attemptLogStore(AttemptLogStore attemptLogStore) {
            this.attemptLogStore = attemptLogStore;
            return this;
        }

        public Builder validator(ConversionEventValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
            this.backoffPolicy = backoffPolicy;
            return this;
        }

        /**
         * Total tries on the primary sink per event, including the first (default: 3)
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Timeout applied to every sink push (default: 10 seconds)
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Scheduler for deliveries and retries. When not set the dispatcher owns a daemon thread
         * and shuts it down on {@link ConversionDispatcher#close()}.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder listener(TrackingListener listener) {
            if (listener != null) {
                this.listeners.add(listener);
            }
            return this;
        }

        public Builder metrics(TrackingMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ConversionDispatcher build() {
            if (primarySink == null) {
                throw new IllegalStateException("primarySink is required");
            }
            if (labels == null) {
                throw new IllegalStateException("labels are required");
            }
            if (consentProvider == null) {
                throw new IllegalStateException("consentProvider is required");
            }
            if (attemptLogStore == null) {
                throw new IllegalStateException("attemptLogStore is required");
            }
            if (backoffPolicy == null) {
                throw new IllegalStateException("backoffPolicy is required");
            }
            if (maxAttempts < 1) {
                throw new IllegalStateException("maxAttempts must be >= 1");
            }
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw new IllegalStateException("timeout must be positive");
            }
            if (clock == null) {
                throw new IllegalStateException("clock must not be null");
            }
            return new ConversionDispatcher(this);
        }
    }
}

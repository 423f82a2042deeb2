package com.conversionlog.sdk.autoconfigure;

import com.conversionlog.sdk.attemptlog.AttemptLogStore;
import com.conversionlog.sdk.reconciliation.ReconciliationEngine;
import com.conversionlog.sdk.reconciliation.ReconciliationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Reconciles the trailing window on a fixed rate, then purges attempt entries past retention.
 * Drift alerts are raised by the engine itself.
 */
final class ReconciliationJob implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationJob.class);

    private final ReconciliationEngine engine;
    private final AttemptLogStore attemptLogStore;
    private final Duration interval;
    private final Duration window;
    private final Duration retention;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private ScheduledFuture<?> task;
    private volatile ReconciliationResult lastResult;

    ReconciliationJob(ReconciliationEngine engine, AttemptLogStore attemptLogStore, Duration interval,
                      Duration window, Duration retention, Clock clock, ScheduledExecutorService scheduler) {
        this.engine = engine;
        this.attemptLogStore = attemptLogStore;
        this.interval = interval;
        this.window = window;
        this.retention = retention;
        this.clock = clock;
        if (scheduler != null) {
            this.scheduler = scheduler;
            this.ownsScheduler = false;
        } else {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "conversionlog-reconciliation");
                thread.setDaemon(true);
                return thread;
            });
            this.ownsScheduler = true;
        }
    }

    synchronized void start() {
        if (task != null) {
            return;
        }
        task = scheduler.scheduleAtFixedRate(this::runOnce,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Reconciliation scheduled every {} over the last {}", interval, window);
    }

    synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    synchronized boolean isRunning() {
        return task != null;
    }

    /**
     * One reconciliation pass; failures are logged so the schedule keeps running
     */
    void runOnce() {
        try {
            lastResult = engine.reconcileRecent(window);
        } catch (RuntimeException e) {
            log.error("Scheduled reconciliation failed", e);
        }
        try {
            int purged = attemptLogStore.purgeOlderThan(clock.instant().minus(retention));
            if (purged > 0) {
                log.info("Purged {} attempt entries older than {}", purged, retention);
            }
        } catch (RuntimeException e) {
            log.warn("Attempt log purge failed: {}", e.getMessage());
        }
    }

    ReconciliationResult getLastResult() {
        return lastResult;
    }

    @Override
    public void close() {
        stop();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }
}

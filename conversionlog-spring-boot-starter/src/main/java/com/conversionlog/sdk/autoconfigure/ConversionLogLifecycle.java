package com.conversionlog.sdk.autoconfigure;

import com.conversionlog.sdk.monitoring.HealthMonitor;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the scheduled health monitor and reconciliation job with the context and stops them
 * before the beans they use are destroyed.
 */
final class ConversionLogLifecycle implements SmartLifecycle {
    private final HealthMonitor healthMonitor;
    private final ReconciliationJob reconciliationJob;
    private volatile boolean running;

    ConversionLogLifecycle(HealthMonitor healthMonitor, ReconciliationJob reconciliationJob) {
        this.healthMonitor = healthMonitor;
        this.reconciliationJob = reconciliationJob;
    }

    @Override
    public void start() {
        if (healthMonitor != null) {
            healthMonitor.start();
        }
        if (reconciliationJob != null) {
            reconciliationJob.start();
        }
        running = true;
    }

    @Override
    public void stop() {
        if (running) {
            running = false;
            if (healthMonitor != null) {
                healthMonitor.stop();
            }
            if (reconciliationJob != null) {
                reconciliationJob.stop();
            }
        }
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}

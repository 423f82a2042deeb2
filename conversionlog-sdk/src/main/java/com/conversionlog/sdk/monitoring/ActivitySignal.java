package com.conversionlog.sdk.monitoring;

/**
 * Tells the {@link HealthMonitor} whether anyone is using the storefront right now. Scheduled
 * checks are skipped while inactive.
 */
@FunctionalInterface
public interface ActivitySignal {

    boolean isActive();

    static ActivitySignal always() {
        return () -> true;
    }
}

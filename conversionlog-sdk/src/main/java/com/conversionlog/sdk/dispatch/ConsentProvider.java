package com.conversionlog.sdk.dispatch;

/**
 * Answers whether the current visitor allows marketing/analytics tracking.
 */
@FunctionalInterface
public interface ConsentProvider {

    boolean hasTrackingConsent();

    static ConsentProvider granted() {
        return () -> true;
    }

    static ConsentProvider denied() {
        return () -> false;
    }
}

package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.model.Alert;

/**
 * Destination alerts are forwarded to after they are stored. Failures are logged by the
 * {@link AlertService} and never affect the alert itself.
 */
@FunctionalInterface
public interface AlertChannel {

    void send(Alert alert) throws Exception;
}

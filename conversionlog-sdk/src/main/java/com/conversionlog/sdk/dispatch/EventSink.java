package com.conversionlog.sdk.dispatch;

import java.util.concurrent.CompletableFuture;

/**
 * A delivery channel for conversion events.
 *
 * <p>The dispatcher uses one sink as its primary channel (retried) and any number of best-effort
 * sinks (tried once after the primary succeeds). Implementations should not block the calling
 * thread; the dispatcher applies its own timeout to the returned future.</p>
 */
public interface EventSink {

    /**
     * Short identifier used in logs and attempt details
     */
    String name();

    /**
     * Deliver the event. A failed future (or a thrown exception) marks the attempt as failed.
     */
    CompletableFuture<Void> push(SinkEvent event);

    /**
     * Whether the channel is currently able to accept events
     */
    default boolean isAvailable() {
        return true;
    }
}

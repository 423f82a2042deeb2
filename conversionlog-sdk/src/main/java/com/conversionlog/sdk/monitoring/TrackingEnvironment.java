package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.dispatch.EventSink;
import com.conversionlog.sdk.dispatch.TagManagerQueue;

/**
 * Runtime state of the client tracking stack, inspected by health checks.
 */
public interface TrackingEnvironment {

    /**
     * Whether the primary tracking call can be made at all
     */
    boolean tagFunctionAvailable();

    /**
     * Whether every tracking runtime the dispatcher depends on is loaded
     */
    boolean scriptsLoaded();

    boolean eventQueueInitialized();

    /**
     * Environment derived from the dispatcher's sinks: the tag function is the primary sink, the
     * event queue is the tag-manager queue, and scripts count as loaded when both are usable.
     */
    static TrackingEnvironment fromSinks(EventSink primarySink, TagManagerQueue queue) {
        return new TrackingEnvironment() {
            @Override
            public boolean tagFunctionAvailable() {
                return primarySink != null && primarySink.isAvailable();
            }

            @Override
            public boolean scriptsLoaded() {
                return tagFunctionAvailable() && eventQueueInitialized();
            }

            @Override
            public boolean eventQueueInitialized() {
                return queue != null && queue.isInitialized();
            }
        };
    }
}

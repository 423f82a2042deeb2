package com.conversionlog.sdk.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process append-only event queue consumed by a tag manager.
 *
 * <p>Pushes before {@link #initialize()} fail, mirroring a tag-manager data layer that has not
 * been created yet.</p>
 */
public class TagManagerQueue implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(TagManagerQueue.class);

    public static final String NAME = "tag_manager";

    private final CopyOnWriteArrayList<SinkEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicBoolean initialized = new AtomicBoolean();
    private final int capacity;

    public TagManagerQueue() {
        this(10_000);
    }

    public TagManagerQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    public TagManagerQueue initialize() {
        if (initialized.compareAndSet(false, true)) {
            log.debug("Tag manager queue initialized (capacity {})", capacity);
        }
        return this;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompletableFuture<Void> push(SinkEvent event) {
        if (!initialized.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Tag manager queue not initialized"));
        }
        if (events.size() >= capacity) {
            return CompletableFuture.failedFuture(new IllegalStateException("Tag manager queue full"));
        }
        events.add(event);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean isAvailable() {
        return initialized.get();
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    public List<SinkEvent> snapshot() {
        return List.copyOf(events);
    }

    /**
     * Remove and return everything queued so far
     */
    public List<SinkEvent> drain() {
        List<SinkEvent> drained = List.copyOf(events);
        events.removeAll(drained);
        return drained;
    }

    public int size() {
        return events.size();
    }
}

package com.conversionlog.sdk.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link EventSink} for tests. Records every accepted event and can be told to fail
 * the next pushes.
 */
public class RecordingEventSink implements EventSink {

    private final String name;
    private final CopyOnWriteArrayList<SinkEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private final AtomicInteger pushCount = new AtomicInteger();
    private volatile String failureMessage = "simulated sink failure";
    private volatile boolean available = true;

    public RecordingEventSink() {
        this("recording");
    }

    public RecordingEventSink(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<Void> push(SinkEvent event) {
        pushCount.incrementAndGet();
        if (failuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            return CompletableFuture.failedFuture(new IllegalStateException(failureMessage));
        }
        events.add(event);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    /**
     * Fail the next {@code count} pushes with {@code message}
     */
    public RecordingEventSink failNext(int count, String message) {
        failuresRemaining.set(count);
        if (message != null) {
            failureMessage = message;
        }
        return this;
    }

    public RecordingEventSink setAvailable(boolean available) {
        this.available = available;
        return this;
    }

    public List<SinkEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<SinkEvent> getEventsForBooking(String bookingId) {
        List<SinkEvent> matches = new ArrayList<>();
        for (SinkEvent event : events) {
            if (bookingId.equals(event.getBookingId()) || bookingId.equals(event.getTransactionId())) {
                matches.add(event);
            }
        }
        return matches;
    }

    /**
     * Pushes seen, failed ones included
     */
    public int getPushCount() {
        return pushCount.get();
    }

    public void reset() {
        events.clear();
        failuresRemaining.set(0);
        pushCount.set(0);
        available = true;
    }

    public void assertEventCount(int expected) {
        int actual = events.size();
        if (actual != expected) {
            throw new AssertionError("Expected " + expected + " events but found " + actual);
        }
    }

    public void assertEventSent(String eventName, String transactionId) {
        for (SinkEvent event : events) {
            if (eventName.equals(event.getEvent()) && transactionId.equals(event.getTransactionId())) {
                return;
            }
        }
        throw new AssertionError("Expected " + eventName + " event for transaction " + transactionId
                + " but sink has " + events);
    }
}

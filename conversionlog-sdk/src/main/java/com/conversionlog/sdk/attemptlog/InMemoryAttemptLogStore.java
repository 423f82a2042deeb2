package com.conversionlog.sdk.attemptlog;

import com.conversionlog.sdk.model.AttemptLogEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Thread-safe in-process attempt log. Contents are lost on restart.
 */
public class InMemoryAttemptLogStore implements AttemptLogStore {

    private final CopyOnWriteArrayList<AttemptLogEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(AttemptLogEntry entry) {
        entries.add(Objects.requireNonNull(entry, "entry"));
    }

    @Override
    public List<AttemptLogEntry> findByBookingId(String bookingId) {
        return entries.stream()
                .filter(entry -> entry.getBookingId().equals(bookingId))
                .sorted(Comparator.comparing(AttemptLogEntry::getTimestamp).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<AttemptLogEntry> findBetween(Instant start, Instant end) {
        return entries.stream()
                .filter(entry -> !entry.getTimestamp().isBefore(start) && !entry.getTimestamp().isAfter(end))
                .sorted(Comparator.comparing(AttemptLogEntry::getTimestamp))
                .collect(Collectors.toList());
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        List<AttemptLogEntry> expired = new ArrayList<>();
        for (AttemptLogEntry entry : entries) {
            if (entry.getTimestamp().isBefore(cutoff)) {
                expired.add(entry);
            }
        }
        entries.removeAll(expired);
        return expired.size();
    }

    @Override
    public int size() {
        return entries.size();
    }

    public List<AttemptLogEntry> getEntries() {
        return List.copyOf(entries);
    }

    public void clear() {
        entries.clear();
    }
}

package com.conversionlog.sdk.attemptlog;

import com.conversionlog.sdk.model.AttemptLogEntry;

import java.time.Instant;
import java.util.List;

/**
 * Append-only log of delivery attempts, written by both delivery paths and read by
 * reconciliation and health checks.
 *
 * <p>Duplicates are expected: a booking may be attempted several times per path. Implementations
 * must make {@link #append(AttemptLogEntry)} atomic and safe to call concurrently.</p>
 */
public interface AttemptLogStore {

    void append(AttemptLogEntry entry);

    /**
     * @return entries for the booking, newest first
     */
    List<AttemptLogEntry> findByBookingId(String bookingId);

    /**
     * @return entries with {@code start <= timestamp <= end}, oldest first
     */
    List<AttemptLogEntry> findBetween(Instant start, Instant end);

    /**
     * Remove entries older than {@code cutoff}.
     *
     * @return number of entries removed
     */
    int purgeOlderThan(Instant cutoff);

    int size();
}

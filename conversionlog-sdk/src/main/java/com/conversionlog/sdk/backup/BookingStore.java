package com.conversionlog.sdk.backup;

import com.conversionlog.sdk.model.BookingRecord;
import com.conversionlog.sdk.model.BookingStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to the authoritative booking records.
 *
 * <p>Implementations may throw {@link com.conversionlog.sdk.exception.ConversionLogException}
 * when the underlying store is unreachable.</p>
 */
public interface BookingStore {

    Optional<BookingRecord> findById(String bookingId);

    /**
     * Bookings created within {@code [start, end]} whose status is one of {@code statuses}
     */
    List<BookingRecord> findCreatedBetween(Instant start, Instant end, Set<BookingStatus> statuses);
}

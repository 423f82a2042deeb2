package com.conversionlog.sdk.backup;

import com.conversionlog.sdk.model.BookingRecord;
import com.conversionlog.sdk.model.BookingStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Map-backed {@link BookingStore} for tests.
 */
public class InMemoryBookingStore implements BookingStore {

    private final Map<String, BookingRecord> bookings = new ConcurrentHashMap<>();

    public InMemoryBookingStore save(BookingRecord booking) {
        bookings.put(booking.getBookingId(), booking);
        return this;
    }

    @Override
    public Optional<BookingRecord> findById(String bookingId) {
        return bookingId == null ? Optional.empty() : Optional.ofNullable(bookings.get(bookingId));
    }

    @Override
    public List<BookingRecord> findCreatedBetween(Instant start, Instant end, Set<BookingStatus> statuses) {
        return bookings.values().stream()
                .filter(booking -> booking.getCreatedAt() != null)
                .filter(booking -> !booking.getCreatedAt().isBefore(start) && !booking.getCreatedAt().isAfter(end))
                .filter(booking -> statuses == null || statuses.contains(booking.getStatus()))
                .sorted(Comparator.comparing(BookingRecord::getCreatedAt))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    public int size() {
        return bookings.size();
    }

    public void clear() {
        bookings.clear();
    }
}

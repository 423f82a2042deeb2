package com.conversionlog.sdk.backup;

import com.conversionlog.sdk.model.BookingRecord;
import com.conversionlog.sdk.model.ConversionUpload;

import java.util.Optional;

/**
 * Outcome of one backup conversion for a booking.
 */
public final class BackupConversionResult {

    public static final String BOOKING_VALIDATION_FAILED = "Booking validation failed";
    public static final String ALREADY_TRACKED = "Client-side conversion already tracked";

    private final String bookingId;
    private final boolean success;
    private final boolean skipped;
    private final BookingRecord booking;
    private final ConversionUpload upload;
    private final String error;

    private BackupConversionResult(String bookingId, boolean success, boolean skipped,
                                   BookingRecord booking, ConversionUpload upload, String error) {
        this.bookingId = bookingId;
        this.success = success;
        this.skipped = skipped;
        this.booking = booking;
        this.upload = upload;
        this.error = error;
    }

    static BackupConversionResult success(BookingRecord booking, ConversionUpload upload) {
        return new BackupConversionResult(booking.getBookingId(), true, false, booking, upload, null);
    }

    static BackupConversionResult failure(String bookingId, BookingRecord booking, ConversionUpload upload,
                                          String error) {
        return new BackupConversionResult(bookingId, false, false, booking, upload, error);
    }

    static BackupConversionResult skipped(String bookingId) {
        return new BackupConversionResult(bookingId, false, true, null, null, ALREADY_TRACKED);
    }

    public String getBookingId() {
        return bookingId;
    }

    /**
     * Whether the platform accepted the upload
     */
    public boolean isSuccess() {
        return success;
    }

    /**
     * Whether a scheduled backup found a successful client conversion and did nothing
     */
    public boolean isSkipped() {
        return skipped;
    }

    public Optional<BookingRecord> getBooking() {
        return Optional.ofNullable(booking);
    }

    public Optional<ConversionUpload> getUpload() {
        return Optional.ofNullable(upload);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "BackupConversionResult{bookingId='" + bookingId + "', success=" + success
                + ", skipped=" + skipped + (error != null ? ", error='" + error + "'" : "") + "}";
    }
}

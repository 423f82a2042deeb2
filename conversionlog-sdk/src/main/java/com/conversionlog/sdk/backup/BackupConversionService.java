package com.conversionlog.sdk.backup;

import com.conversionlog.sdk.attemptlog.AttemptLogStore;
import com.conversionlog.sdk.client.AdPlatformClient;
import com.conversionlog.sdk.dispatch.TrackingError;
import com.conversionlog.sdk.dispatch.TrackingListener;
import com.conversionlog.sdk.exception.ConversionLogException;
import com.conversionlog.sdk.exception.ErrorType;
import com.conversionlog.sdk.hashing.IdentifierHasher;
import com.conversionlog.sdk.model.ApiResponses.UploadConversionsResponse;
import com.conversionlog.sdk.model.AttemptLogEntry;
import com.conversionlog.sdk.model.Attribution;
import com.conversionlog.sdk.model.BookingRecord;
import com.conversionlog.sdk.model.ConversionAction;
import com.conversionlog.sdk.model.ConversionEvent;
import com.conversionlog.sdk.model.ConversionType;
import com.conversionlog.sdk.model.ConversionUpload;
import com.conversionlog.sdk.model.UserIdentifiers;
import com.conversionlog.sdk.util.ConversionLogUtils;
import com.conversionlog.sdk.validation.ConversionEventValidator;
import com.conversionlog.sdk.validation.ConversionInput;
import com.conversionlog.sdk.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Server-side backup path - re-derives a purchase from the booking record and uploads it
 *
 * <p>The platform deduplicates on {@code order_id}, so uploading a purchase the client already
 * reported is harmless. Every operation returns a result instead of throwing; upload outcomes are
 * appended to the attempt log as {@code server} entries.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * BackupConversionService backup = BackupConversionService.builder()
 *     .bookingStore(bookings)
 *     .adPlatformClient(client)
 *     .attemptLogStore(store)
 *     .conversionActionId("987654321")
 *     .build();
 *
 * BackupConversionResult result = backup.validateAndConvert("B1");
 * }</pre>
 */
public class BackupConversionService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackupConversionService.class);

    public static final Duration DEFAULT_BACKUP_DELAY = Duration.ofSeconds(30);
    public static final ZoneId DEFAULT_ZONE = ZoneId.of("Asia/Tokyo");
    static final String EMPTY_UPLOAD_RESPONSE = "Upload response was empty";

    private final BookingStore bookingStore;
    private final AdPlatformClient adPlatformClient;
    private final AttemptLogStore attemptLogStore;
    private final IdentifierHasher hasher;
    private final ConversionEventValidator validator;
    private final String conversionActionId;
    private final ZoneId zone;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final List<TrackingListener> listeners;

    private BackupConversionService(Builder builder) {
        this.bookingStore = builder.bookingStore;
        this.adPlatformClient = builder.adPlatformClient;
        this.attemptLogStore = builder.attemptLogStore;
        this.hasher = builder.hasher != null ? builder.hasher : new IdentifierHasher();
        this.clock = builder.clock;
        this.validator = builder.validator != null
                ? builder.validator
                : ConversionEventValidator.withoutValueCap(BookingRecord.DEFAULT_CURRENCY, clock);
        this.conversionActionId = builder.conversionActionId;
        this.zone = builder.zone;
        this.listeners = List.copyOf(builder.listeners);
        if (builder.scheduler != null) {
            this.scheduler = builder.scheduler;
            this.ownsScheduler = false;
        } else {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "conversionlog-backup");
                thread.setDaemon(true);
                return thread;
            });
            this.ownsScheduler = true;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Public API
    // ========================================================================

    /**
     * Validate the booking and upload its purchase conversion
     *
     * @return the outcome; never throws
     */
    public BackupConversionResult validateAndConvert(String bookingId) {
        if (!ConversionLogUtils.hasText(bookingId)) {
            log.warn("Backup conversion requested without a booking id");
            return BackupConversionResult.failure(bookingId, null, null, BackupConversionResult.BOOKING_VALIDATION_FAILED);
        }

        Optional<BookingRecord> found;
        try {
            found = bookingStore.findById(bookingId);
        } catch (RuntimeException e) {
            log.error("Failed to load booking {} for backup conversion", bookingId, e);
            return BackupConversionResult.failure(bookingId, null, null,
                    "Booking lookup failed: " + ConversionLogUtils.getRootCauseMessage(e));
        }
        if (found.isEmpty() || !found.get().isConversionEligible()) {
            log.warn("Booking {} is {} - skipping backup conversion", bookingId,
                    found.map(b -> b.getStatus().getValue()).orElse("missing"));
            return BackupConversionResult.failure(bookingId, found.orElse(null), null,
                    BackupConversionResult.BOOKING_VALIDATION_FAILED);
        }
        BookingRecord booking = found.get();

        ValidationResult validation = validator.validate(ConversionAction.PURCHASE, toInput(booking));
        if (!validation.isValid()) {
            log.warn("Booking {} does not produce a valid purchase: {}", bookingId, validation.summary());
            return BackupConversionResult.failure(bookingId, booking, null,
                    "Conversion validation failed: " + validation.summary());
        }
        if (validation.isDegraded()) {
            log.debug("Backup conversion for {} degraded: {}", bookingId, validation.summary());
        }

        ConversionUpload upload = toUpload(validation.getEventOrThrow());
        try {
            UploadConversionsResponse response = adPlatformClient.uploadConversions(List.of(upload));
            if (response == null) {
                String message = EMPTY_UPLOAD_RESPONSE;
                record(bookingId, false, upload, ErrorType.TRACKING_FAILURE, message);
                report(ErrorType.TRACKING_FAILURE, message, bookingId);
                log.error("Backup conversion for {} got no upload result from the platform", bookingId);
                return BackupConversionResult.failure(bookingId, booking, upload, message);
            }
            if (response.hasPartialFailure()) {
                String message = "Partial failure: " + response.partialFailureError.message;
                record(bookingId, false, upload, ErrorType.TRACKING_FAILURE, message);
                report(ErrorType.TRACKING_FAILURE, message, bookingId);
                log.error("Backup conversion for {} rejected by platform: {}", bookingId, message);
                return BackupConversionResult.failure(bookingId, booking, upload, message);
            }
            record(bookingId, true, upload, null, null);
            log.info("Backup conversion uploaded for booking {} ({} {})",
                    bookingId, upload.getConversionValue(), upload.getCurrencyCode());
            return BackupConversionResult.success(booking, upload);
        } catch (ConversionLogException e) {
            return uploadFailed(booking, upload, e.getErrorType(), e);
        } catch (RuntimeException e) {
            return uploadFailed(booking, upload, ErrorType.TRACKING_FAILURE, e);
        }
    }

    /**
     * Upload an operator-supplied row as-is. No booking validation and no attempt entry.
     */
    public boolean uploadManualConversion(ConversionUpload upload) {
        if (upload == null) {
            return false;
        }
        try {
            UploadConversionsResponse response = adPlatformClient.uploadConversions(List.of(upload));
            if (response == null) {
                log.error("Manual conversion {} got no upload result from the platform", upload.getOrderId());
                return false;
            }
            if (response.hasPartialFailure()) {
                log.error("Manual conversion {} rejected: {}", upload.getOrderId(), response.partialFailureError.message);
                return false;
            }
            log.info("Manual conversion uploaded for order {}", upload.getOrderId());
            return true;
        } catch (RuntimeException e) {
            log.error("Manual conversion upload failed for order {}: {}", upload.getOrderId(), e.getMessage());
            return false;
        }
    }

    public ScheduledFuture<BackupConversionResult> scheduleBackupConversion(String bookingId) {
        return scheduleBackupConversion(bookingId, DEFAULT_BACKUP_DELAY);
    }

    /**
     * After {@code delay}, run {@link #validateAndConvert(String)} unless the attempt log already
     * holds a successful client entry for the booking.
     */
    public ScheduledFuture<BackupConversionResult> scheduleBackupConversion(String bookingId, Duration delay) {
        Duration effective = delay != null ? delay : DEFAULT_BACKUP_DELAY;
        log.debug("Backup conversion for {} scheduled in {}ms", bookingId, effective.toMillis());
        return scheduler.schedule(() -> {
            if (clientAlreadyTracked(bookingId)) {
                log.debug("Client-side conversion found for {}, backup not needed", bookingId);
                return BackupConversionResult.skipped(bookingId);
            }
            return validateAndConvert(bookingId);
        }, effective.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    // ========================================================================
    // Internal
    // ========================================================================

    private ConversionInput toInput(BookingRecord booking) {
        ConversionInput.Builder input = ConversionInput.builder()
                .action(ConversionAction.PURCHASE.getValue())
                .value(booking.getAmount())
                .currency(booking.getCurrency())
                .transactionId(booking.getBookingId())
                .bookingId(booking.getBookingId())
                .gclid(booking.getGclid())
                .wbraid(booking.getWbraid())
                .gbraid(booking.getGbraid())
                .timestamp(booking.getCreatedAt());
        if (ConversionLogUtils.hasText(booking.getCustomerEmail()) || ConversionLogUtils.hasText(booking.getCustomerPhone())) {
            UserIdentifiers identifiers = hasher.hashIdentifiers(booking.getCustomerEmail(), booking.getCustomerPhone(),
                    booking.getCustomerFirstName(), booking.getCustomerLastName());
            if (!identifiers.isEmpty()) {
                input.userIdentifiers(identifiers);
            }
        }
        return input.build();
    }

    private ConversionUpload toUpload(ConversionEvent event) {
        ConversionUpload.Builder upload = ConversionUpload.builder()
                .conversionAction(adPlatformClient.conversionActionResource(conversionActionId))
                .conversionValue(event.getValue())
                .currencyCode(event.getCurrency())
                .orderId(event.getTransactionId())
                .conversionDateTime(ConversionLogUtils.formatConversionDateTime(event.getTimestamp(), zone));

        Attribution attribution = event.getAttribution();
        if (attribution != null) {
            upload.gclid(attribution.getGclid())
                    .wbraid(attribution.getWbraid())
                    .gbraid(attribution.getGbraid());
        }

        UserIdentifiers identifiers = event.getUserIdentifiers();
        if (identifiers != null) {
            List<Map<String, String>> rows = new ArrayList<>();
            if (identifiers.getHashedEmail() != null) {
                rows.add(Map.of("hashed_email", identifiers.getHashedEmail()));
            }
            if (identifiers.getHashedPhoneNumber() != null) {
                rows.add(Map.of("hashed_phone_number", identifiers.getHashedPhoneNumber()));
            }
            if (!rows.isEmpty()) {
                upload.userIdentifiers(rows);
            }
        }
        return upload.build();
    }

    private BackupConversionResult uploadFailed(BookingRecord booking, ConversionUpload upload,
                                                ErrorType type, Exception e) {
        String message = ConversionLogUtils.getRootCauseMessage(e);
        log.error("Backup conversion upload failed for booking {}: {}", booking.getBookingId(), message);
        record(booking.getBookingId(), false, upload, type, message);
        report(type, message, booking.getBookingId());
        return BackupConversionResult.failure(booking.getBookingId(), booking, upload, message);
    }

    private boolean clientAlreadyTracked(String bookingId) {
        try {
            return attemptLogStore.findByBookingId(bookingId).stream()
                    .anyMatch(entry -> entry.isClient() && entry.isSuccess());
        } catch (RuntimeException e) {
            log.warn("Could not read attempt log for {}, running backup anyway: {}", bookingId, e.getMessage());
            return false;
        }
    }

    private void record(String bookingId, boolean success, ConversionUpload upload, ErrorType type, String error) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("conversion_action", upload.getConversionAction());
        row.put("conversion_value", upload.getConversionValue());
        row.put("currency_code", upload.getCurrencyCode());
        row.put("order_id", upload.getOrderId());
        row.put("conversion_date_time", upload.getConversionDateTime());
        row.put("enhanced", upload.getUserIdentifiers() != null);
        try {
            AttemptLogEntry.Builder entry = AttemptLogEntry.builder()
                    .bookingId(bookingId)
                    .conversionType(ConversionType.SERVER)
                    .success(success)
                    .timestamp(clock.instant())
                    .details(row);
            if (type != null) {
                entry.detail("error_type", type.getValue());
                entry.detail("error", error);
            }
            attemptLogStore.append(entry.build());
        } catch (RuntimeException e) {
            log.error("Failed to record server attempt for {}", bookingId, e);
        }
    }

    private void report(ErrorType type, String message, String bookingId) {
        TrackingError error = new TrackingError(type, message, ConversionAction.PURCHASE, bookingId, 1,
                clock.instant(), Map.of("path", ConversionType.SERVER.getValue()));
        for (TrackingListener listener : listeners) {
            try {
                listener.onTrackingError(error);
            } catch (RuntimeException e) {
                log.warn("Tracking listener {} failed: {}", listener, e.getMessage());
            }
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private BookingStore bookingStore;
        private AdPlatformClient adPlatformClient;
        private AttemptLogStore attemptLogStore;
        private IdentifierHasher hasher;
        private ConversionEventValidator validator;
        private String conversionActionId;
        private ZoneId zone = DEFAULT_ZONE;
        private Clock clock = Clock.systemUTC();
        private ScheduledExecutorService scheduler;
        private final List<TrackingListener> listeners = new ArrayList<>();

        public Builder bookingStore(BookingStore bookingStore) {
            this.bookingStore = bookingStore;
            return this;
        }

        public Builder adPlatformClient(AdPlatformClient adPlatformClient) {
            this.adPlatformClient = adPlatformClient;
            return this;
        }

        public Builder attemptLogStore(AttemptLogStore attemptLogStore) {
            this.attemptLogStore = attemptLogStore;
            return this;
        }

        public Builder hasher(IdentifierHasher hasher) {
            this.hasher = hasher;
            return this;
        }

        public Builder validator(ConversionEventValidator validator) {
            this.validator = validator;
            return this;
        }

        /**
         * Numeric id of the purchase conversion action (required)
         */
        public Builder conversionActionId(String conversionActionId) {
            this.conversionActionId = conversionActionId;
            return this;
        }

        /**
         * Zone used for the platform conversion date-time (default: Asia/Tokyo)
         */
        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder listener(TrackingListener listener) {
            if (listener != null) {
                this.listeners.add(listener);
            }
            return this;
        }

        public BackupConversionService build() {
            if (bookingStore == null) {
                throw new IllegalStateException("bookingStore is required");
            }
            if (adPlatformClient == null) {
                throw new IllegalStateException("adPlatformClient is required");
            }
            if (attemptLogStore == null) {
                throw new IllegalStateException("attemptLogStore is required");
            }
            if (!ConversionLogUtils.hasText(conversionActionId)) {
                throw new IllegalStateException("conversionActionId is required");
            }
            if (zone == null || clock == null) {
                throw new IllegalStateException("zone and clock must not be null");
            }
            return new BackupConversionService(this);
        }
    }
}

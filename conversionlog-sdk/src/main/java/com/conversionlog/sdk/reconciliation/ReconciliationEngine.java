package com.conversionlog.sdk.reconciliation;

import com.conversionlog.sdk.attemptlog.AttemptLogStore;
import com.conversionlog.sdk.backup.BookingStore;
import com.conversionlog.sdk.exception.ConversionLogException;
import com.conversionlog.sdk.model.AlertSeverity;
import com.conversionlog.sdk.model.AttemptLogEntry;
import com.conversionlog.sdk.model.BookingRecord;
import com.conversionlog.sdk.model.BookingStatus;
import com.conversionlog.sdk.monitoring.AlertService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares the client and server attempt logs against the bookings that should have converted
 *
 * <p>A booking counts as tracked on a path when the path has at least one successful attempt
 * within the range; failed attempts and duplicate successes do not change the outcome. When the
 * accuracy drops below the alert threshold a {@code reconciliation_accuracy_low} alert is raised.</p>
 */
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    public static final BigDecimal DEFAULT_ACCURACY_ALERT_THRESHOLD = new BigDecimal("95");
    public static final String ACCURACY_LOW = "reconciliation_accuracy_low";

    private final BookingStore bookingStore;
    private final AttemptLogStore attemptLogStore;
    private final AlertService alertService;
    private final BigDecimal accuracyAlertThreshold;
    private final Clock clock;

    private ReconciliationEngine(Builder builder) {
        this.bookingStore = builder.bookingStore;
        this.attemptLogStore = builder.attemptLogStore;
        this.alertService = builder.alertService;
        this.accuracyAlertThreshold = builder.accuracyAlertThreshold;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reconcile bookings created within {@code [start, end]}
     *
     * @throws ConversionLogException when the booking store or attempt log cannot be read
     */
    public ReconciliationResult reconcile(Instant start, Instant end) {
        if (start == null || end == null || end.isBefore(start)) {
            throw new IllegalArgumentException("start must not be after end");
        }

        List<BookingRecord> bookings;
        List<AttemptLogEntry> entries;
        try {
            bookings = bookingStore.findCreatedBetween(start, end, BookingStatus.CONVERSION_ELIGIBLE);
            entries = attemptLogStore.findBetween(start, end);
        } catch (ConversionLogException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConversionLogException("Failed to load reconciliation data for " + start + " to " + end, e);
        }

        Set<String> clientTracked = new HashSet<>();
        Set<String> serverTracked = new HashSet<>();
        for (AttemptLogEntry entry : entries) {
            if (!entry.isSuccess()) {
                continue;
            }
            if (entry.isClient()) {
                clientTracked.add(entry.getBookingId());
            } else if (entry.isServer()) {
                serverTracked.add(entry.getBookingId());
            }
        }

        int client = 0;
        int server = 0;
        int matched = 0;
        List<Discrepancy> discrepancies = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (BookingRecord booking : bookings) {
            String bookingId = booking.getBookingId();
            if (!seen.add(bookingId)) {
                continue;
            }
            boolean clientOk = clientTracked.contains(bookingId);
            boolean serverOk = serverTracked.contains(bookingId);
            if (clientOk) {
                client++;
            }
            if (serverOk) {
                server++;
            }
            DiscrepancyType type = DiscrepancyType.classify(clientOk, serverOk);
            if (type == null) {
                matched++;
            } else {
                discrepancies.add(new Discrepancy(bookingId, clientOk, serverOk, type));
            }
        }

        ReconciliationResult result = new ReconciliationResult(start + " to " + end, seen.size(),
                client, server, matched, discrepancies);
        log.info("Reconciliation {}", result);

        if (result.getTotalEligibleBookings() > 0
                && result.getAccuracyPercentage().compareTo(accuracyAlertThreshold) < 0) {
            raiseDriftAlert(result);
        }
        return result;
    }

    /**
     * Reconcile the window ending now
     */
    public ReconciliationResult reconcileRecent(Duration window) {
        Instant end = clock.instant();
        return reconcile(end.minus(window), end);
    }

    /**
     * Whether each path has a successful attempt on record for the booking, over all retained entries
     */
    public ConversionStatus conversionStatus(String bookingId) {
        List<AttemptLogEntry> entries;
        try {
            entries = attemptLogStore.findByBookingId(bookingId);
        } catch (ConversionLogException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConversionLogException("Failed to read attempt log for booking " + bookingId, e);
        }
        boolean client = entries.stream().anyMatch(entry -> entry.isClient() && entry.isSuccess());
        boolean server = entries.stream().anyMatch(entry -> entry.isServer() && entry.isSuccess());
        return new ConversionStatus(bookingId, client, server);
    }

    private void raiseDriftAlert(ReconciliationResult result) {
        boolean untracked = result.hasDiscrepancy(DiscrepancyType.NO_TRACKING);
        String message = "Conversion tracking accuracy " + result.getAccuracyPercentage().toPlainString()
                + "% is below " + accuracyAlertThreshold.toPlainString() + "% for " + result.getDateRange();
        if (alertService == null) {
            log.warn(message);
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("date_range", result.getDateRange());
        data.put("accuracy_percentage", result.getAccuracyPercentage());
        data.put("agreement_percentage", result.getAgreementPercentage());
        data.put("threshold", accuracyAlertThreshold);
        data.put("total_eligible_bookings", result.getTotalEligibleBookings());
        data.put("client_side_conversions", result.getClientSideConversions());
        data.put("server_side_conversions", result.getServerSideConversions());
        data.put("discrepancies", result.getDiscrepancies().size());
        alertService.handleAlert(ACCURACY_LOW, untracked ? AlertSeverity.CRITICAL : AlertSeverity.HIGH, message, data);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private BookingStore bookingStore;
        private AttemptLogStore attemptLogStore;
        private AlertService alertService;
        private BigDecimal accuracyAlertThreshold = DEFAULT_ACCURACY_ALERT_THRESHOLD;
        private Clock clock = Clock.systemUTC();

        public Builder bookingStore(BookingStore bookingStore) {
            this.bookingStore = bookingStore;
            return this;
        }

        public Builder attemptLogStore(AttemptLogStore attemptLogStore) {
            this.attemptLogStore = attemptLogStore;
            return this;
        }

        /**
         * Receives drift alerts; without one drift is only logged
         */
        public Builder alertService(AlertService alertService) {
            this.alertService = alertService;
            return this;
        }

        /**
         * Accuracy percentage below which drift is alerted (default: 95)
         */
        public Builder accuracyAlertThreshold(BigDecimal accuracyAlertThreshold) {
            this.accuracyAlertThreshold = accuracyAlertThreshold;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ReconciliationEngine build() {
            if (bookingStore == null) {
                throw new IllegalStateException("bookingStore is required");
            }
            if (attemptLogStore == null) {
                throw new IllegalStateException("attemptLogStore is required");
            }
            if (accuracyAlertThreshold == null || accuracyAlertThreshold.signum() < 0
                    || accuracyAlertThreshold.compareTo(BigDecimal.valueOf(100)) > 0) {
                throw new IllegalStateException("accuracyAlertThreshold must be between 0 and 100");
            }
            if (clock == null) {
                throw new IllegalStateException("clock must not be null");
            }
            return new ReconciliationEngine(this);
        }
    }
}

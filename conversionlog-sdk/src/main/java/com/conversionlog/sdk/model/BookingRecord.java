package com.conversionlog.sdk.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Read model of a booking as held by the authoritative booking store.
 */
public final class BookingRecord {

    public static final String DEFAULT_CURRENCY = "JPY";

    private final String bookingId;
    private final BookingStatus status;
    private final BigDecimal amount;
    private final String currency;
    private final String customerEmail;
    private final String customerPhone;
    private final String customerFirstName;
    private final String customerLastName;
    private final String tourId;
    private final LocalDate bookingDate;
    private final String gclid;
    private final String wbraid;
    private final String gbraid;
    private final Instant createdAt;

    private BookingRecord(Builder builder) {
        this.bookingId = builder.bookingId;
        this.status = builder.status;
        this.amount = builder.amount;
        this.currency = builder.currency != null && !builder.currency.isBlank()
                ? builder.currency
                : DEFAULT_CURRENCY;
        this.customerEmail = builder.customerEmail;
        this.customerPhone = builder.customerPhone;
        this.customerFirstName = builder.customerFirstName;
        this.customerLastName = builder.customerLastName;
        this.tourId = builder.tourId;
        this.bookingDate = builder.bookingDate;
        this.gclid = builder.gclid;
        this.wbraid = builder.wbraid;
        this.gbraid = builder.gbraid;
        this.createdAt = builder.createdAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .bookingId(bookingId)
                .status(status)
                .amount(amount)
                .currency(currency)
                .customerEmail(customerEmail)
                .customerPhone(customerPhone)
                .customerFirstName(customerFirstName)
                .customerLastName(customerLastName)
                .tourId(tourId)
                .bookingDate(bookingDate)
                .gclid(gclid)
                .wbraid(wbraid)
                .gbraid(gbraid)
                .createdAt(createdAt);
    }

    public String getBookingId() { return bookingId; }
    public BookingStatus getStatus() { return status; }
    public BigDecimal getAmount() { return amount; }
    public String getCurrency() { return currency; }
    public String getCustomerEmail() { return customerEmail; }
    public String getCustomerPhone() { return customerPhone; }
    public String getCustomerFirstName() { return customerFirstName; }
    public String getCustomerLastName() { return customerLastName; }
    public String getTourId() { return tourId; }
    public LocalDate getBookingDate() { return bookingDate; }
    public String getGclid() { return gclid; }
    public String getWbraid() { return wbraid; }
    public String getGbraid() { return gbraid; }
    public Instant getCreatedAt() { return createdAt; }

    public boolean isConversionEligible() {
        return status != null && status.isConversionEligible();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BookingRecord that = (BookingRecord) o;
        return Objects.equals(bookingId, that.bookingId) &&
               status == that.status &&
               Objects.equals(amount, that.amount) &&
               Objects.equals(createdAt, that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bookingId, status, amount, createdAt);
    }

    @Override
    public String toString() {
        return "BookingRecord{bookingId='" + bookingId + "', status=" + status +
                ", amount=" + amount + " " + currency + ", createdAt=" + createdAt + "}";
    }

    public static class Builder {
        private String bookingId;
        private BookingStatus status;
        private BigDecimal amount;
        private String currency;
        private String customerEmail;
        private String customerPhone;
        private String customerFirstName;
        private String customerLastName;
        private String tourId;
        private LocalDate bookingDate;
        private String gclid;
        private String wbraid;
        private String gbraid;
        private Instant createdAt;

        public Builder bookingId(String bookingId) {
            this.bookingId = bookingId;
            return this;
        }

        public Builder status(BookingStatus status) {
            this.status = status;
            return this;
        }

        public Builder amount(BigDecimal amount) {
            this.amount = amount;
            return this;
        }

        public Builder amount(long amount) {
            return amount(BigDecimal.valueOf(amount));
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder customerEmail(String customerEmail) {
            this.customerEmail = customerEmail;
            return this;
        }

        public Builder customerPhone(String customerPhone) {
            this.customerPhone = customerPhone;
            return this;
        }

        public Builder customerFirstName(String customerFirstName) {
            this.customerFirstName = customerFirstName;
            return this;
        }

        public Builder customerLastName(String customerLastName) {
            this.customerLastName = customerLastName;
            return this;
        }

        public Builder tourId(String tourId) {
            this.tourId = tourId;
            return this;
        }

        public Builder bookingDate(LocalDate bookingDate) {
            this.bookingDate = bookingDate;
            return this;
        }

        public Builder gclid(String gclid) {
            this.gclid = gclid;
            return this;
        }

        public Builder wbraid(String wbraid) {
            this.wbraid = wbraid;
            return this;
        }

        public Builder gbraid(String gbraid) {
            this.gbraid = gbraid;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public BookingRecord build() {
            if (bookingId == null || bookingId.isBlank()) {
                throw new IllegalStateException("bookingId is required");
            }
            if (status == null) {
                throw new IllegalStateException("status is required");
            }
            if (createdAt == null) {
                createdAt = Instant.now();
            }
            return new BookingRecord(this);
        }
    }
}

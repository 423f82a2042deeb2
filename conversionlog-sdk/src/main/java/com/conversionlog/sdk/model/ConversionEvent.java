package com.conversionlog.sdk.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Conversion Event - canonical, platform-agnostic unit reported by both delivery paths
 *
 * <p>Both the client dispatcher and the backup conversion service use the booking id as
 * {@code transactionId}, which is what reconciliation and platform-side dedup key on.</p>
 *
 * <pre>{@code
 * ConversionEvent event = ConversionEvent.builder()
 *     .action(ConversionAction.PURCHASE)
 *     .value(new BigDecimal("9000"))
 *     .currency("JPY")
 *     .transactionId("B1")
 *     .build();
 * }</pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionEvent {

    @JsonProperty("action")
    private ConversionAction action;

    @JsonProperty("value")
    private BigDecimal value;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("transaction_id")
    private String transactionId;

    @JsonProperty("booking_id")
    private String bookingId;

    @JsonProperty("attribution")
    private Attribution attribution;

    @JsonProperty("user_identifiers")
    private UserIdentifiers userIdentifiers;

    @JsonProperty("timestamp")
    private Instant timestamp;

    // Default constructor for Jackson
    public ConversionEvent() {
    }

    private ConversionEvent(Builder builder) {
        this.action = builder.action;
        this.value = builder.value;
        this.currency = builder.currency;
        this.transactionId = builder.transactionId;
        this.bookingId = builder.bookingId;
        this.attribution = builder.attribution;
        this.userIdentifiers = builder.userIdentifiers;
        this.timestamp = builder.timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .action(action)
                .value(value)
                .currency(currency)
                .transactionId(transactionId)
                .bookingId(bookingId)
                .attribution(attribution)
                .userIdentifiers(userIdentifiers)
                .timestamp(timestamp);
    }

    public ConversionAction getAction() { return action; }
    public BigDecimal getValue() { return value; }
    public String getCurrency() { return currency; }
    public String getTransactionId() { return transactionId; }
    public String getBookingId() { return bookingId; }
    public Attribution getAttribution() { return attribution; }
    public UserIdentifiers getUserIdentifiers() { return userIdentifiers; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConversionEvent that = (ConversionEvent) o;
        return action == that.action &&
               Objects.equals(transactionId, that.transactionId) &&
               Objects.equals(bookingId, that.bookingId) &&
               Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, transactionId, bookingId, timestamp);
    }

    @Override
    public String toString() {
        return "ConversionEvent{" +
                "action=" + action +
                ", value=" + value +
                ", currency='" + currency + '\'' +
                ", transactionId='" + transactionId + '\'' +
                ", bookingId='" + bookingId + '\'' +
                ", enhanced=" + (userIdentifiers != null && !userIdentifiers.isEmpty()) +
                '}';
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private ConversionAction action;
        private BigDecimal value;
        private String currency;
        private String transactionId;
        private String bookingId;
        private Attribution attribution;
        private UserIdentifiers userIdentifiers;
        private Instant timestamp;

        public Builder action(ConversionAction action) {
            this.action = action;
            return this;
        }

        public Builder value(BigDecimal value) {
            this.value = value;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder transactionId(String transactionId) {
            this.transactionId = transactionId;
            return this;
        }

        public Builder bookingId(String bookingId) {
            this.bookingId = bookingId;
            return this;
        }

        public Builder attribution(Attribution attribution) {
            this.attribution = attribution;
            return this;
        }

        public Builder userIdentifiers(UserIdentifiers userIdentifiers) {
            this.userIdentifiers = userIdentifiers;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * Build the event
         *
         * @throws IllegalStateException if required fields are missing or out of range
         */
        public ConversionEvent build() {
            if (timestamp == null) {
                timestamp = Instant.now();
            }
            if (bookingId == null && action == ConversionAction.PURCHASE) {
                bookingId = transactionId;
            }
            validate();
            return new ConversionEvent(this);
        }

        private void validate() {
            StringBuilder errors = new StringBuilder();

            if (action == null) {
                errors.append("action is required; ");
            }
            if (action != null && action.requiresTransactionId()
                    && (transactionId == null || transactionId.isBlank())) {
                errors.append("transactionId is required for purchase; ");
            }
            if (action == ConversionAction.PURCHASE && value == null) {
                errors.append("value is required for purchase; ");
            }
            if (value != null && value.signum() < 0) {
                errors.append("value must be non-negative; ");
            }
            if (value != null && (currency == null || currency.isBlank())) {
                errors.append("currency is required when value is set; ");
            }

            if (errors.length() > 0) {
                throw new IllegalStateException("Invalid ConversionEvent: " + errors);
            }
        }
    }
}

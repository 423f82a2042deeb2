package com.conversionlog.sdk.validation;

import com.conversionlog.sdk.model.UserIdentifiers;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Raw, unvalidated conversion data as collected at the tracking call site.
 *
 * <p>{@code action} is only consulted by {@link ConversionEventValidator#validate(ConversionInput)};
 * the dispatcher's typed entry points supply the action themselves.</p>
 */
public final class ConversionInput {

    private final String action;
    private final BigDecimal value;
    private final String currency;
    private final String transactionId;
    private final String bookingId;
    private final String gclid;
    private final String wbraid;
    private final String gbraid;
    private final String source;
    private final String medium;
    private final String campaign;
    private final UserIdentifiers userIdentifiers;
    private final Instant timestamp;

    private ConversionInput(Builder builder) {
        this.action = builder.action;
        this.value = builder.value;
        this.currency = builder.currency;
        this.transactionId = builder.transactionId;
        this.bookingId = builder.bookingId;
        this.gclid = builder.gclid;
        this.wbraid = builder.wbraid;
        this.gbraid = builder.gbraid;
        this.source = builder.source;
        this.medium = builder.medium;
        this.campaign = builder.campaign;
        this.userIdentifiers = builder.userIdentifiers;
        this.timestamp = builder.timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getAction() { return action; }
    public BigDecimal getValue() { return value; }
    public String getCurrency() { return currency; }
    public String getTransactionId() { return transactionId; }
    public String getBookingId() { return bookingId; }
    public String getGclid() { return gclid; }
    public String getWbraid() { return wbraid; }
    public String getGbraid() { return gbraid; }
    public String getSource() { return source; }
    public String getMedium() { return medium; }
    public String getCampaign() { return campaign; }
    public UserIdentifiers getUserIdentifiers() { return userIdentifiers; }
    public Instant getTimestamp() { return timestamp; }

    /**
     * Booking id when present, otherwise the transaction id. Used to key attempt log entries.
     */
    public String getLogKey() {
        if (bookingId != null && !bookingId.isBlank()) {
            return bookingId;
        }
        return transactionId;
    }

    @Override
    public String toString() {
        return "ConversionInput{action='" + action + "', value=" + value + ", currency='" + currency +
                "', transactionId='" + transactionId + "', bookingId='" + bookingId + "'}";
    }

    public static class Builder {
        private String action;
        private BigDecimal value;
        private String currency;
        private String transactionId;
        private String bookingId;
        private String gclid;
        private String wbraid;
        private String gbraid;
        private String source;
        private String medium;
        private String campaign;
        private UserIdentifiers userIdentifiers;
        private Instant timestamp;

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder value(BigDecimal value) {
            this.value = value;
            return this;
        }

        public Builder value(long value) {
            return value(BigDecimal.valueOf(value));
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

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder medium(String medium) {
            this.medium = medium;
            return this;
        }

        public Builder campaign(String campaign) {
            this.campaign = campaign;
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

        public ConversionInput build() {
            return new ConversionInput(this);
        }
    }
}

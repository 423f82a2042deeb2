package com.conversionlog.sdk.dispatch;

import com.conversionlog.sdk.model.Attribution;
import com.conversionlog.sdk.model.ConversionEvent;
import com.conversionlog.sdk.model.UserIdentifiers;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Payload pushed to every {@link EventSink}: the validated event plus its resolved destination.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SinkEvent {

    private final ConversionEvent conversion;
    private final String sendTo;

    private SinkEvent(ConversionEvent conversion, String sendTo) {
        this.conversion = Objects.requireNonNull(conversion, "conversion");
        this.sendTo = Objects.requireNonNull(sendTo, "sendTo");
    }

    public static SinkEvent of(ConversionEvent conversion, String sendTo) {
        return new SinkEvent(conversion, sendTo);
    }

    @JsonIgnore
    public ConversionEvent getConversion() {
        return conversion;
    }

    @JsonProperty("event")
    public String getEvent() {
        return conversion.getAction().getValue();
    }

    @JsonProperty("send_to")
    public String getSendTo() {
        return sendTo;
    }

    @JsonProperty("value")
    public BigDecimal getValue() {
        return conversion.getValue();
    }

    @JsonProperty("currency")
    public String getCurrency() {
        return conversion.getCurrency();
    }

    @JsonProperty("transaction_id")
    public String getTransactionId() {
        return conversion.getTransactionId();
    }

    @JsonProperty("booking_id")
    public String getBookingId() {
        return conversion.getBookingId();
    }

    @JsonProperty("attribution")
    public Attribution getAttribution() {
        return conversion.getAttribution();
    }

    @JsonProperty("user_data")
    public UserIdentifiers getUserData() {
        return conversion.getUserIdentifiers();
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return conversion.getTimestamp();
    }

    @Override
    public String toString() {
        return "SinkEvent{event='" + getEvent() + "', sendTo='" + sendTo + "', transactionId='" +
                getTransactionId() + "'}";
    }
}

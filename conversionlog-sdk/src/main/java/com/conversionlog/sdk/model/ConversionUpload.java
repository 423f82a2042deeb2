package com.conversionlog.sdk.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * One row of an offline conversion upload, in the platform's wire shape.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionUpload {

    @JsonProperty("conversion_action")
    private String conversionAction;

    @JsonProperty("conversion_value")
    private BigDecimal conversionValue;

    @JsonProperty("currency_code")
    private String currencyCode;

    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("conversion_date_time")
    private String conversionDateTime;

    @JsonProperty("gclid")
    private String gclid;

    @JsonProperty("wbraid")
    private String wbraid;

    @JsonProperty("gbraid")
    private String gbraid;

    @JsonProperty("user_identifiers")
    private List<Map<String, String>> userIdentifiers;

    // Default constructor for Jackson
    public ConversionUpload() {
    }

    private ConversionUpload(Builder builder) {
        this.conversionAction = builder.conversionAction;
        this.conversionValue = builder.conversionValue;
        this.currencyCode = builder.currencyCode;
        this.orderId = builder.orderId;
        this.conversionDateTime = builder.conversionDateTime;
        this.gclid = builder.gclid;
        this.wbraid = builder.wbraid;
        this.gbraid = builder.gbraid;
        this.userIdentifiers = builder.userIdentifiers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getConversionAction() { return conversionAction; }
    public BigDecimal getConversionValue() { return conversionValue; }
    public String getCurrencyCode() { return currencyCode; }
    public String getOrderId() { return orderId; }
    public String getConversionDateTime() { return conversionDateTime; }
    public String getGclid() { return gclid; }
    public String getWbraid() { return wbraid; }
    public String getGbraid() { return gbraid; }
    public List<Map<String, String>> getUserIdentifiers() { return userIdentifiers; }

    @Override
    public String toString() {
        return "ConversionUpload{conversionAction='" + conversionAction + "', orderId='" + orderId +
                "', value=" + conversionValue + " " + currencyCode + "}";
    }

    public static class Builder {
        private String conversionAction;
        private BigDecimal conversionValue;
        private String currencyCode;
        private String orderId;
        private String conversionDateTime;
        private String gclid;
        private String wbraid;
        private String gbraid;
        private List<Map<String, String>> userIdentifiers;

        /**
         * Resource name, {@code customers/{customerId}/conversionActions/{actionId}}
         */
        public Builder conversionAction(String conversionAction) {
            this.conversionAction = conversionAction;
            return this;
        }

        public Builder conversionValue(BigDecimal conversionValue) {
            this.conversionValue = conversionValue;
            return this;
        }

        public Builder currencyCode(String currencyCode) {
            this.currencyCode = currencyCode;
            return this;
        }

        public Builder orderId(String orderId) {
            this.orderId = orderId;
            return this;
        }

        /**
         * Platform date-time, {@code yyyy-MM-dd HH:mm:ss+HH:mm}
         */
        public Builder conversionDateTime(String conversionDateTime) {
            this.conversionDateTime = conversionDateTime;
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

        public Builder userIdentifiers(List<Map<String, String>> userIdentifiers) {
            this.userIdentifiers = userIdentifiers;
            return this;
        }

        public ConversionUpload build() {
            if (conversionAction == null || conversionAction.isBlank()) {
                throw new IllegalStateException("conversionAction is required");
            }
            if (orderId == null || orderId.isBlank()) {
                throw new IllegalStateException("orderId is required");
            }
            if (conversionDateTime == null || conversionDateTime.isBlank()) {
                throw new IllegalStateException("conversionDateTime is required");
            }
            return new ConversionUpload(this);
        }
    }
}

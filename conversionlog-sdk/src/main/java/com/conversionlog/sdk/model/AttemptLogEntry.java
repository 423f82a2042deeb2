package com.conversionlog.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One delivery attempt by either path. Entries are written once and never mutated.
 *
 * <p>A booking may have several entries per {@link ConversionType}; reconciliation treats
 * any successful entry as the signal that the path delivered.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AttemptLogEntry {

    private final String id;
    private final String bookingId;
    private final ConversionType conversionType;
    private final boolean success;
    private final Instant timestamp;
    private final Map<String, Object> details;

    @JsonCreator
    public AttemptLogEntry(
            @JsonProperty("id") String id,
            @JsonProperty("booking_id") String bookingId,
            @JsonProperty("conversion_type") ConversionType conversionType,
            @JsonProperty("success") boolean success,
            @JsonProperty("created_at") Instant timestamp,
            @JsonProperty("details") Map<String, Object> details) {
        this.id = id;
        this.bookingId = bookingId;
        this.conversionType = conversionType;
        this.success = success;
        this.timestamp = timestamp;
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("booking_id")
    public String getBookingId() {
        return bookingId;
    }

    @JsonProperty("conversion_type")
    public ConversionType getConversionType() {
        return conversionType;
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return success;
    }

    @JsonProperty("created_at")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("details")
    public Map<String, Object> getDetails() {
        return details;
    }

    public boolean isClient() {
        return conversionType == ConversionType.CLIENT;
    }

    public boolean isServer() {
        return conversionType == ConversionType.SERVER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((AttemptLogEntry) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AttemptLogEntry{" +
                "bookingId='" + bookingId + '\'' +
                ", type=" + conversionType +
                ", success=" + success +
                ", timestamp=" + timestamp +
                '}';
    }

    public static class Builder {
        private String id;
        private String bookingId;
        private ConversionType conversionType;
        private boolean success;
        private Instant timestamp;
        private final Map<String, Object> details = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder bookingId(String bookingId) {
            this.bookingId = bookingId;
            return this;
        }

        public Builder conversionType(ConversionType conversionType) {
            this.conversionType = conversionType;
            return this;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder detail(String key, Object value) {
            if (value != null) {
                this.details.put(key, value);
            }
            return this;
        }

        public Builder details(Map<String, ?> details) {
            if (details != null) {
                details.forEach(this::detail);
            }
            return this;
        }

        public AttemptLogEntry build() {
            if (bookingId == null || bookingId.isBlank()) {
                throw new IllegalStateException("bookingId is required");
            }
            if (conversionType == null) {
                throw new IllegalStateException("conversionType is required");
            }
            if (id == null) {
                id = UUID.randomUUID().toString();
            }
            if (timestamp == null) {
                timestamp = Instant.now();
            }
            return new AttemptLogEntry(id, bookingId, conversionType, success, timestamp, details);
        }
    }
}

package com.conversionlog.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A raised alert. Alerts are immutable and expire only through the retention window.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Alert {

    private final String id;
    private final String type;
    private final AlertSeverity severity;
    private final String message;
    private final Instant timestamp;
    private final Map<String, Object> data;

    @JsonCreator
    public Alert(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("severity") AlertSeverity severity,
            @JsonProperty("message") String message,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("data") Map<String, Object> data) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message = message;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.data = data != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(data))
                : Map.of();
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("severity")
    public AlertSeverity getSeverity() {
        return severity;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("data")
    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Alert) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Alert{id='" + id + "', type='" + type + "', severity=" + severity +
                ", message='" + message + "'}";
    }
}

package com.conversionlog.sdk.monitoring;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of a basic or deep health check.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class HealthCheck {

    public enum Kind { BASIC, DEEP }

    private final Kind kind;
    private final Instant timestamp;
    private final HealthStatus status;
    private final Map<String, Object> checks;
    private final List<String> issues;
    private final PerformanceSnapshot performance;

    HealthCheck(Kind kind, Instant timestamp, HealthStatus status, Map<String, Object> checks,
                List<String> issues, PerformanceSnapshot performance) {
        this.kind = kind;
        this.timestamp = timestamp;
        this.status = status;
        this.checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
        this.issues = List.copyOf(issues);
        this.performance = performance;
    }

    @JsonProperty("kind")
    public Kind getKind() {
        return kind;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("status")
    public HealthStatus getStatus() {
        return status;
    }

    /**
     * Named check results; booleans except for measured values such as {@code error_rate}
     */
    @JsonProperty("checks")
    public Map<String, Object> getChecks() {
        return checks;
    }

    @JsonProperty("issues")
    public List<String> getIssues() {
        return issues;
    }

    @JsonProperty("performance")
    public PerformanceSnapshot getPerformance() {
        return performance;
    }

    public Optional<PerformanceSnapshot> performance() {
        return Optional.ofNullable(performance);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }

    /**
     * Whether the named boolean check passed
     */
    public boolean passed(String check) {
        return Boolean.TRUE.equals(checks.get(check));
    }

    @Override
    public String toString() {
        return "HealthCheck{kind=" + kind + ", status=" + status + ", issues=" + issues + "}";
    }
}

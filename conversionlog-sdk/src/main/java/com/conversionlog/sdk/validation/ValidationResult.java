package com.conversionlog.sdk.validation;

import com.conversionlog.sdk.exception.ConversionValidationException;
import com.conversionlog.sdk.model.ConversionEvent;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of validating raw conversion input.
 *
 * <p>Valid results always carry an event. A degraded result is valid but had its
 * enhanced-data fields removed.</p>
 */
public final class ValidationResult {

    private final ConversionEvent event;
    private final List<FieldIssue> issues;

    private ValidationResult(ConversionEvent event, List<FieldIssue> issues) {
        this.event = event;
        this.issues = List.copyOf(issues);
    }

    static ValidationResult valid(ConversionEvent event, List<FieldIssue> enhancedIssues) {
        return new ValidationResult(event, enhancedIssues);
    }

    static ValidationResult invalid(List<FieldIssue> issues) {
        return new ValidationResult(null, issues);
    }

    public boolean isValid() {
        return event != null;
    }

    public boolean isDegraded() {
        return event != null && !issues.isEmpty();
    }

    public Optional<ConversionEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    public List<FieldIssue> getIssues() {
        return issues;
    }

    public List<FieldIssue> getCoreIssues() {
        return issues.stream().filter(FieldIssue::core).collect(Collectors.toList());
    }

    /**
     * @throws ConversionValidationException when the input failed core validation
     */
    public ConversionEvent getEventOrThrow() {
        if (event == null) {
            throw new ConversionValidationException("Conversion validation failed: " + summary(), issues);
        }
        return event;
    }

    public String summary() {
        return issues.stream().map(FieldIssue::toString).collect(Collectors.joining("; "));
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid() + ", degraded=" + isDegraded() + ", issues=" + issues + "}";
    }
}

package com.conversionlog.sdk.validation;

/**
 * A single field-level validation problem.
 *
 * @param field   wire name of the offending field
 * @param message human readable reason
 * @param core    {@code true} when the issue makes the event unusable; {@code false} for
 *                enhanced-data fields that are dropped instead
 */
public record FieldIssue(String field, String message, boolean core) {

    public static FieldIssue core(String field, String message) {
        return new FieldIssue(field, message, true);
    }

    public static FieldIssue enhanced(String field, String message) {
        return new FieldIssue(field, message, false);
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}

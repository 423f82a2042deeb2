package com.conversionlog.sdk.exception;

import com.conversionlog.sdk.validation.FieldIssue;

import java.util.List;

/**
 * Thrown when an event is built from input that fails core validation.
 */
public class ConversionValidationException extends ConversionLogException {

    private final List<FieldIssue> issues;

    public ConversionValidationException(String message, List<FieldIssue> issues) {
        super(message, ErrorType.VALIDATION_ERROR);
        this.issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public List<FieldIssue> getIssues() {
        return issues;
    }
}

package com.conversionlog.sdk.exception;

import com.conversionlog.sdk.model.AlertSeverity;
import com.conversionlog.sdk.validation.FieldIssue;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversionLogExceptionTest {

    @Test
    void messageOnlyDefaultsToTrackingFailure() {
        ConversionLogException e = new ConversionLogException("boom");
        assertEquals("boom", e.getMessage());
        assertEquals(0, e.getStatusCode());
        assertNull(e.getErrorCode());
        assertEquals(ErrorType.TRACKING_FAILURE, e.getErrorType());
    }

    @Test
    void statusConstructorsAreNetworkErrors() {
        IOException cause = new IOException("reset");
        ConversionLogException e = new ConversionLogException("upstream", 503, "UNAVAILABLE", cause);
        assertEquals(503, e.getStatusCode());
        assertEquals("UNAVAILABLE", e.getErrorCode());
        assertEquals(ErrorType.NETWORK_ERROR, e.getErrorType());
        assertSame(cause, e.getCause());
    }

    @Test
    void explicitTypeIsKept() {
        ConversionLogException e = new ConversionLogException("no label", ErrorType.CONFIGURATION_ERROR);
        assertEquals(ErrorType.CONFIGURATION_ERROR, e.getErrorType());
        assertEquals(AlertSeverity.CRITICAL, e.getErrorType().getSeverity());
    }

    @Test
    void nullTypeFallsBack() {
        ConversionLogException e = new ConversionLogException("x", 0, null, null, null);
        assertEquals(ErrorType.TRACKING_FAILURE, e.getErrorType());
    }

    @Test
    void validationExceptionCarriesIssues() {
        ConversionValidationException e = new ConversionValidationException("invalid",
                List.of(FieldIssue.core("value", "must be non-negative")));
        assertEquals(ErrorType.VALIDATION_ERROR, e.getErrorType());
        assertEquals("value: must be non-negative", e.getIssues().get(0).toString());
        assertInstanceOf(ConversionLogException.class, e);
    }

    @Test
    void errorTypeSeverities() {
        assertEquals(AlertSeverity.CRITICAL, ErrorType.SCRIPT_LOAD_FAILURE.getSeverity());
        assertEquals(AlertSeverity.HIGH, ErrorType.NETWORK_ERROR.getSeverity());
        assertEquals(AlertSeverity.MEDIUM, ErrorType.PRIVACY_ERROR.getSeverity());
        assertEquals(ErrorType.VALIDATION_ERROR, ErrorType.fromValue("validation_error"));
        assertThrows(IllegalArgumentException.class, () -> ErrorType.fromValue("nope"));
    }
}

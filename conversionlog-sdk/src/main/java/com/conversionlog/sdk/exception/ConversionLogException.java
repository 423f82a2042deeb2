package com.conversionlog.sdk.exception;

/**
 * Base exception for Conversion Log SDK errors
 */
public class ConversionLogException extends RuntimeException {

    private final int statusCode;
    private final String errorCode;
    private final ErrorType errorType;

    public ConversionLogException(String message) {
        this(message, 0, null, ErrorType.TRACKING_FAILURE, null);
    }

    public ConversionLogException(String message, Throwable cause) {
        this(message, 0, null, ErrorType.TRACKING_FAILURE, cause);
    }

    public ConversionLogException(String message, ErrorType errorType) {
        this(message, 0, null, errorType, null);
    }

    public ConversionLogException(String message, int statusCode, String errorCode) {
        this(message, statusCode, errorCode, ErrorType.NETWORK_ERROR, null);
    }

    public ConversionLogException(String message, int statusCode, String errorCode, Throwable cause) {
        this(message, statusCode, errorCode, ErrorType.NETWORK_ERROR, cause);
    }

    public ConversionLogException(String message, int statusCode, String errorCode,
                                  ErrorType errorType, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.errorType = errorType != null ? errorType : ErrorType.TRACKING_FAILURE;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}

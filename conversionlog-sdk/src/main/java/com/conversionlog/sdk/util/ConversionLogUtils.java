package com.conversionlog.sdk.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Utility class for Conversion Log SDK operations
 */
public final class ConversionLogUtils {

    private static final DateTimeFormatter PLATFORM_DATE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssxxx");

    private ConversionLogUtils() {
        // Prevent instantiation
    }

    // ========================================================================
    // JSON
    // ========================================================================

    /**
     * ObjectMapper used when the caller does not supply one: ISO-8601 dates, lenient on unknown fields.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // ========================================================================
    // ID Generation
    // ========================================================================

    /**
     * Generate an alert ID
     *
     * @return A unique alert ID in format "alert_{epochMillis}_{random}"
     */
    public static String createAlertId(Clock clock) {
        String random = Long.toString(ThreadLocalRandom.current().nextLong(0, Long.MAX_VALUE), 36);
        return "alert_" + clock.millis() + "_" + random.substring(0, Math.min(9, random.length()));
    }

    // ========================================================================
    // Formatting
    // ========================================================================

    /**
     * Format an instant the way the conversion upload API expects, e.g. {@code 2024-05-01 12:30:00+09:00}
     */
    public static String formatConversionDateTime(Instant instant, ZoneId zone) {
        return PLATFORM_DATE_TIME.format(instant.atZone(zone != null ? zone : ZoneOffset.UTC));
    }

    public static String getRootCauseMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

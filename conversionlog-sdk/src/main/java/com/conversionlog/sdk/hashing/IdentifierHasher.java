package com.conversionlog.sdk.hashing;

import com.conversionlog.sdk.model.UserIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalises and SHA-256 hashes customer identifiers for enhanced conversions.
 *
 * <p>Emails are trimmed and lower-cased. Phone numbers are reduced to E.164 using the
 * configured default country code for national numbers (Japan by default). Names and
 * address parts are lower-cased with non-letter characters removed. Values that are
 * already 64 character hex digests are passed through unchanged.</p>
 */
public final class IdentifierHasher {

    private static final Logger log = LoggerFactory.getLogger(IdentifierHasher.class);

    public static final String DEFAULT_COUNTRY_CODE = "81";

    private static final Pattern SHA256_HEX = Pattern.compile("^[a-f0-9]{64}$");
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern NON_LETTER = Pattern.compile("[^\\p{L}]");
    private static final Pattern NON_ADDRESS = Pattern.compile("[^\\p{L}\\p{N} ]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String defaultCountryCode;

    public IdentifierHasher() {
        this(DEFAULT_COUNTRY_CODE);
    }

    public IdentifierHasher(String defaultCountryCode) {
        if (defaultCountryCode == null || !defaultCountryCode.matches("[1-9]\\d{0,2}")) {
            throw new IllegalArgumentException("defaultCountryCode must be 1-3 digits: " + defaultCountryCode);
        }
        this.defaultCountryCode = defaultCountryCode;
    }

    // ========================================================================
    // Hashing
    // ========================================================================

    /**
     * @return hex digest, or {@code null} when the email is blank or malformed
     */
    public String hashEmail(String email) {
        if (isSha256Hex(email)) {
            return email;
        }
        String normalized = normalizeEmail(email);
        return normalized != null ? sha256Hex(normalized) : null;
    }

    /**
     * @return hex digest of the E.164 form, or {@code null} when the number cannot be normalised
     */
    public String hashPhone(String phone) {
        if (isSha256Hex(phone)) {
            return phone;
        }
        String normalized = normalizePhone(phone);
        return normalized != null ? sha256Hex(normalized) : null;
    }

    public String hashName(String name) {
        if (isSha256Hex(name)) {
            return name;
        }
        String normalized = normalizeName(name);
        return normalized != null ? sha256Hex(normalized) : null;
    }

    public String hashAddressPart(String part) {
        if (isSha256Hex(part)) {
            return part;
        }
        if (part == null || part.isBlank()) {
            return null;
        }
        String normalized = WHITESPACE.matcher(
                NON_ADDRESS.matcher(part.trim().toLowerCase(Locale.ROOT)).replaceAll("")).replaceAll(" ").trim();
        return normalized.isEmpty() ? null : sha256Hex(normalized);
    }

    /**
     * Hash whichever raw identifiers are present. Identifiers that fail normalisation are omitted.
     */
    public UserIdentifiers hashIdentifiers(String email, String phone, String firstName, String lastName) {
        return UserIdentifiers.builder()
                .hashedEmail(hashEmail(email))
                .hashedPhoneNumber(hashPhone(phone))
                .hashedFirstName(hashName(firstName))
                .hashedLastName(hashName(lastName))
                .build();
    }

    // ========================================================================
    // Normalisation
    // ========================================================================

    public String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(normalized).matches()) {
            log.debug("Discarding malformed email identifier");
            return null;
        }
        return normalized;
    }

    /**
     * Reduce a phone number to E.164, e.g. {@code 090-1234-5678 -> +819012345678}
     */
    public String normalizePhone(String phone) {
        if (phone == null || phone.isBlank()) {
            return null;
        }
        String trimmed = phone.trim();
        String digits = NON_DIGIT.matcher(trimmed).replaceAll("");
        if (digits.isEmpty()) {
            return null;
        }

        String e164;
        if (trimmed.startsWith("+")) {
            e164 = digits;
        } else if (digits.length() == 11 && digits.startsWith("0")) {
            // national format with trunk prefix
            e164 = defaultCountryCode + digits.substring(1);
        } else if (digits.length() == 10 && digits.startsWith("9")) {
            // mobile number without trunk prefix
            e164 = defaultCountryCode + digits;
        } else if (digits.length() == 12 && digits.startsWith(defaultCountryCode)) {
            e164 = digits;
        } else if (digits.length() >= 10) {
            e164 = digits;
        } else {
            log.debug("Discarding phone identifier with {} digits", digits.length());
            return null;
        }

        if (e164.length() > 15 || e164.startsWith("0")) {
            return null;
        }
        return "+" + e164;
    }

    public String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String normalized = NON_LETTER.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll("");
        return normalized.isEmpty() ? null : normalized;
    }

    // ========================================================================
    // Static helpers
    // ========================================================================

    public static boolean isSha256Hex(String value) {
        return value != null && SHA256_HEX.matcher(value).matches();
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

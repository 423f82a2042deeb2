package com.conversionlog.sdk.validation;

import com.conversionlog.sdk.hashing.IdentifierHasher;
import com.conversionlog.sdk.model.Attribution;
import com.conversionlog.sdk.model.ConversionAction;
import com.conversionlog.sdk.model.ConversionEvent;
import com.conversionlog.sdk.model.UserIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Currency;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates raw conversion input and builds the canonical {@link ConversionEvent}.
 *
 * <p>Core fields (action, value, currency, transaction id) fail the whole event. Attribution and
 * hashed identifier fields are enhanced data: invalid attribution fields are dropped one by one,
 * and any invalid identifier drops the identifier block so the event goes out as a standard
 * conversion.</p>
 */
public class ConversionEventValidator {

    private static final Logger log = LoggerFactory.getLogger(ConversionEventValidator.class);

    public static final BigDecimal DEFAULT_MAX_VALUE = new BigDecimal("1000000");
    public static final int MAX_TRANSACTION_ID_LENGTH = 100;
    public static final int MAX_CAMPAIGN_FIELD_LENGTH = 100;

    private static final Pattern CURRENCY_CODE = Pattern.compile("^[A-Z]{3}$");
    private static final Pattern CLICK_ID = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final Pattern RAW_EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern RAW_PHONE = Pattern.compile("^\\+?[\\d\\s().-]{7,20}$");

    private final String defaultCurrency;
    private final BigDecimal maxValue;
    private final Clock clock;

    public ConversionEventValidator() {
        this("JPY", DEFAULT_MAX_VALUE, Clock.systemUTC());
    }

    public ConversionEventValidator(String defaultCurrency, BigDecimal maxValue, Clock clock) {
        this(defaultCurrency, maxValue != null ? maxValue : DEFAULT_MAX_VALUE, clock, true);
    }

    private ConversionEventValidator(String defaultCurrency, BigDecimal maxValue, Clock clock, boolean capped) {
        this.defaultCurrency = defaultCurrency;
        this.maxValue = capped ? maxValue : null;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Validator without an upper bound on {@code value}, for events derived from booking records
     * whose amount is already authoritative.
     */
    public static ConversionEventValidator withoutValueCap(String defaultCurrency, Clock clock) {
        return new ConversionEventValidator(defaultCurrency, null, clock, false);
    }

    /**
     * Validate input whose action is carried in {@link ConversionInput#getAction()}.
     */
    public ValidationResult validate(ConversionInput input) {
        if (input == null) {
            return ValidationResult.invalid(List.of(FieldIssue.core("input", "is required")));
        }
        if (input.getAction() == null || input.getAction().isBlank()) {
            return ValidationResult.invalid(List.of(FieldIssue.core("action", "is required")));
        }
        ConversionAction action;
        try {
            action = ConversionAction.fromValue(input.getAction());
        } catch (IllegalArgumentException e) {
            return ValidationResult.invalid(List.of(
                    FieldIssue.core("action", "unknown action '" + input.getAction() + "'")));
        }
        return validate(action, input);
    }

    public ValidationResult validate(ConversionAction action, ConversionInput input) {
        List<FieldIssue> coreIssues = new ArrayList<>();
        List<FieldIssue> enhancedIssues = new ArrayList<>();

        if (action == null) {
            coreIssues.add(FieldIssue.core("action", "is required"));
        }
        if (input == null) {
            coreIssues.add(FieldIssue.core("input", "is required"));
            return ValidationResult.invalid(coreIssues);
        }

        // ====== Core fields ======

        String transactionId = input.getTransactionId();
        if (action != null && action.requiresTransactionId() && isBlank(transactionId)) {
            coreIssues.add(FieldIssue.core("transaction_id", "is required for " + action.getValue()));
        } else if (transactionId != null && (transactionId.isBlank()
                || transactionId.length() > MAX_TRANSACTION_ID_LENGTH)) {
            coreIssues.add(FieldIssue.core("transaction_id",
                    "must be 1-" + MAX_TRANSACTION_ID_LENGTH + " characters"));
        }

        BigDecimal value = input.getValue();
        if (action == ConversionAction.PURCHASE && value == null) {
            coreIssues.add(FieldIssue.core("value", "is required for purchase"));
        } else if (value != null && value.signum() < 0) {
            coreIssues.add(FieldIssue.core("value", "must be non-negative"));
        } else if (value != null && maxValue != null && value.compareTo(maxValue) > 0) {
            coreIssues.add(FieldIssue.core("value", "must not exceed " + maxValue.toPlainString()));
        }

        String currency = input.getCurrency() != null ? input.getCurrency() : defaultCurrency;
        if (value != null || input.getCurrency() != null) {
            if (currency == null || !CURRENCY_CODE.matcher(currency).matches()) {
                coreIssues.add(FieldIssue.core("currency", "must be a 3-letter upper-case ISO 4217 code"));
            } else if (!isKnownCurrency(currency)) {
                coreIssues.add(FieldIssue.core("currency", "unknown currency '" + currency + "'"));
            }
        }

        if (!coreIssues.isEmpty()) {
            coreIssues.addAll(enhancedIssues);
            log.debug("Rejecting {} conversion: {}", action != null ? action.getValue() : "unknown", coreIssues);
            return ValidationResult.invalid(coreIssues);
        }

        // ====== Enhanced fields ======

        Attribution attribution = validateAttribution(input, enhancedIssues);
        UserIdentifiers identifiers = validateIdentifiers(input.getUserIdentifiers(), enhancedIssues);

        ConversionEvent event = ConversionEvent.builder()
                .action(action)
                .value(value)
                .currency(value != null ? currency : null)
                .transactionId(transactionId)
                .bookingId(input.getBookingId())
                .attribution(attribution)
                .userIdentifiers(identifiers)
                .timestamp(input.getTimestamp() != null ? input.getTimestamp() : clock.instant())
                .build();

        if (!enhancedIssues.isEmpty()) {
            log.debug("Degrading {} conversion to standard: {}", action.getValue(), enhancedIssues);
        }
        return ValidationResult.valid(event, enhancedIssues);
    }

    private Attribution validateAttribution(ConversionInput input, List<FieldIssue> issues) {
        Attribution attribution = Attribution.builder()
                .gclid(clickId("gclid", input.getGclid(), issues))
                .wbraid(clickId("wbraid", input.getWbraid(), issues))
                .gbraid(clickId("gbraid", input.getGbraid(), issues))
                .source(campaignField("source", input.getSource(), issues))
                .medium(campaignField("medium", input.getMedium(), issues))
                .campaign(campaignField("campaign", input.getCampaign(), issues))
                .build();
        return attribution.isEmpty() ? null : attribution;
    }

    private UserIdentifiers validateIdentifiers(UserIdentifiers identifiers, List<FieldIssue> issues) {
        if (identifiers == null || identifiers.isEmpty()) {
            return null;
        }
        int before = issues.size();
        for (Map.Entry<String, String> field : identifiers.asMap().entrySet()) {
            String value = field.getValue();
            if (IdentifierHasher.isSha256Hex(value)) {
                continue;
            }
            if (RAW_EMAIL.matcher(value).matches()) {
                issues.add(FieldIssue.enhanced(field.getKey(), "contains a raw email address"));
            } else if (RAW_PHONE.matcher(value).matches()) {
                issues.add(FieldIssue.enhanced(field.getKey(), "contains a raw phone number"));
            } else {
                issues.add(FieldIssue.enhanced(field.getKey(), "must be a SHA-256 hex digest"));
            }
        }
        return issues.size() == before ? identifiers : null;
    }

    private static String clickId(String field, String value, List<FieldIssue> issues) {
        if (isBlank(value)) {
            return null;
        }
        if (!CLICK_ID.matcher(value).matches()) {
            issues.add(FieldIssue.enhanced(field, "contains invalid characters"));
            return null;
        }
        return value;
    }

    private static String campaignField(String field, String value, List<FieldIssue> issues) {
        if (isBlank(value)) {
            return null;
        }
        if (value.length() > MAX_CAMPAIGN_FIELD_LENGTH) {
            issues.add(FieldIssue.enhanced(field, "must not exceed " + MAX_CAMPAIGN_FIELD_LENGTH + " characters"));
            return null;
        }
        return value;
    }

    private static boolean isKnownCurrency(String code) {
        try {
            Currency.getInstance(code);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

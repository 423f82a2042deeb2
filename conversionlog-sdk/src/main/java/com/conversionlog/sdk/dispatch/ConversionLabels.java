package com.conversionlog.sdk.dispatch;

import com.conversionlog.sdk.model.ConversionAction;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Destination identifiers per conversion action: a conversion id ({@code AW-123456789}) plus
 * one label per action, combined into the {@code send_to} value {@code AW-123456789/label}.
 *
 * <p>Values made only of {@code X} characters after the prefix are unreplaced template
 * placeholders and are treated as missing.</p>
 */
public final class ConversionLabels {

    private final String conversionId;
    private final Map<ConversionAction, String> labels;

    private ConversionLabels(String conversionId, Map<ConversionAction, String> labels) {
        this.conversionId = conversionId;
        this.labels = labels;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getConversionId() {
        return conversionId;
    }

    public boolean hasConversionId() {
        return !isPlaceholder(conversionId);
    }

    public Optional<String> labelFor(ConversionAction action) {
        String label = labels.get(action);
        return isPlaceholder(label) ? Optional.empty() : Optional.of(label);
    }

    /**
     * @return {@code conversionId/label} for the action, or empty if either part is missing or a placeholder
     */
    public Optional<String> resolve(ConversionAction action) {
        if (!hasConversionId()) {
            return Optional.empty();
        }
        return labelFor(action).map(label -> conversionId + "/" + label);
    }

    public List<ConversionAction> missing(Collection<ConversionAction> actions) {
        return actions.stream()
                .filter(action -> resolve(action).isEmpty())
                .collect(Collectors.toList());
    }

    public static boolean isPlaceholder(String value) {
        if (value == null || value.isBlank()) {
            return true;
        }
        String body = value.startsWith("AW-") ? value.substring(3) : value;
        return body.chars().allMatch(c -> c == 'X' || c == 'x');
    }

    @Override
    public String toString() {
        return "ConversionLabels{conversionId='" + conversionId + "', actions=" + labels.keySet() + "}";
    }

    public static class Builder {
        private String conversionId;
        private final Map<ConversionAction, String> labels = new EnumMap<>(ConversionAction.class);

        public Builder conversionId(String conversionId) {
            this.conversionId = conversionId;
            return this;
        }

        public Builder label(ConversionAction action, String label) {
            if (label != null) {
                labels.put(action, label);
            }
            return this;
        }

        public Builder labels(Map<ConversionAction, String> labels) {
            if (labels != null) {
                labels.forEach(this::label);
            }
            return this;
        }

        public ConversionLabels build() {
            return new ConversionLabels(conversionId, Map.copyOf(labels));
        }
    }
}

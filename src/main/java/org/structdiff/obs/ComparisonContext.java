package org.structdiff.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Comparison metadata emitted with every structured log event.
 */
public final class ComparisonContext {
    private final String comparisonId;
    private final String leftName;
    private final String rightName;

    private ComparisonContext(Builder builder) {
        this.comparisonId = requireText(builder.comparisonId, "comparisonId");
        this.leftName = normalize(builder.leftName);
        this.rightName = normalize(builder.rightName);
    }

    public static ComparisonContext of(String comparisonId) {
        return builder(comparisonId).build();
    }

    public static ComparisonContext of(String comparisonId, String leftName, String rightName) {
        return builder(comparisonId).leftName(leftName).rightName(rightName).build();
    }

    public static Builder builder(String comparisonId) {
        return new Builder(comparisonId);
    }

    public String comparisonId() {
        return comparisonId;
    }

    public Optional<String> leftName() {
        return Optional.ofNullable(leftName);
    }

    public Optional<String> rightName() {
        return Optional.ofNullable(rightName);
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("comparisonId", comparisonId);
        if (leftName != null) {
            fields.put("leftName", leftName);
        }
        if (rightName != null) {
            fields.put("rightName", rightName);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String comparisonId;
        private String leftName;
        private String rightName;

        private Builder(String comparisonId) {
            this.comparisonId = Objects.requireNonNull(comparisonId, "comparisonId");
        }

        public Builder leftName(String leftName) {
            this.leftName = leftName;
            return this;
        }

        public Builder rightName(String rightName) {
            this.rightName = rightName;
            return this;
        }

        public ComparisonContext build() {
            return new ComparisonContext(this);
        }
    }
}

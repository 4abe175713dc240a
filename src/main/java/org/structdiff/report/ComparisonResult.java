package org.structdiff.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single comparison: its status and the difference lines that produced it.
 */
public final class ComparisonResult {
    private final String comparisonId;
    private final String leftName;
    private final String rightName;
    private final ComparisonStatus status;
    private final List<String> differences;
    private final String errorMessage;

    private ComparisonResult(
        String comparisonId,
        String leftName,
        String rightName,
        ComparisonStatus status,
        List<String> differences,
        String errorMessage
    ) {
        this.comparisonId = requireText(comparisonId, "comparisonId");
        this.leftName = requireText(leftName, "leftName");
        this.rightName = requireText(rightName, "rightName");
        this.status = Objects.requireNonNull(status, "status");
        this.differences = copyDifferences(differences);
        this.errorMessage = normalize(errorMessage);
    }

    public static ComparisonResult match(String comparisonId, String leftName, String rightName) {
        return new ComparisonResult(comparisonId, leftName, rightName, ComparisonStatus.MATCH, List.of(), null);
    }

    public static ComparisonResult mismatch(
        String comparisonId,
        String leftName,
        String rightName,
        List<String> differences
    ) {
        if (differences == null || differences.isEmpty()) {
            throw new IllegalArgumentException("differences must not be empty for mismatches");
        }
        return new ComparisonResult(comparisonId, leftName, rightName, ComparisonStatus.MISMATCH, differences, null);
    }

    public static ComparisonResult error(
        String comparisonId,
        String leftName,
        String rightName,
        String errorMessage
    ) {
        return new ComparisonResult(comparisonId, leftName, rightName, ComparisonStatus.ERROR, List.of(), errorMessage);
    }

    public String comparisonId() {
        return comparisonId;
    }

    public String leftName() {
        return leftName;
    }

    public String rightName() {
        return rightName;
    }

    public ComparisonStatus status() {
        return status;
    }

    public List<String> differences() {
        return differences;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    private static List<String> copyDifferences(List<String> source) {
        Objects.requireNonNull(source, "differences");
        return List.copyOf(new ArrayList<>(source));
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
}

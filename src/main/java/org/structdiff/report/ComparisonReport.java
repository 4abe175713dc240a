package org.structdiff.report;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate report for a harness run.
 */
public final class ComparisonReport {
    private final Instant generatedAt;
    private final String leftName;
    private final String rightName;
    private final List<ComparisonResult> results;

    public ComparisonReport(
        Instant generatedAt,
        String leftName,
        String rightName,
        List<ComparisonResult> results
    ) {
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt");
        this.leftName = requireText(leftName, "leftName");
        this.rightName = requireText(rightName, "rightName");
        this.results = List.copyOf(new ArrayList<>(Objects.requireNonNull(results, "results")));
    }

    public Instant generatedAt() {
        return generatedAt;
    }

    public String leftName() {
        return leftName;
    }

    public String rightName() {
        return rightName;
    }

    public List<ComparisonResult> results() {
        return results;
    }

    public int totalComparisons() {
        return results.size();
    }

    public int matchCount() {
        return countByStatus(ComparisonStatus.MATCH);
    }

    public int mismatchCount() {
        return countByStatus(ComparisonStatus.MISMATCH);
    }

    public int errorCount() {
        return countByStatus(ComparisonStatus.ERROR);
    }

    public boolean allMatch() {
        return matchCount() == results.size();
    }

    private int countByStatus(ComparisonStatus status) {
        int count = 0;
        for (ComparisonResult result : results) {
            if (result.status() == status) {
                count++;
            }
        }
        return count;
    }

    private static String requireText(String value, String fieldName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}

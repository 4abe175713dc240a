package org.structdiff.report;

/**
 * Outcome category of one comparison.
 */
public enum ComparisonStatus {
    MATCH,
    MISMATCH,
    ERROR
}

package org.structdiff.report;

/**
 * Supplies one side of each comparison (expected fixtures, actual output, a mock, ...).
 */
public interface ValueSource {
    String name();

    /**
     * Loads the value this source holds for {@code comparison}. Failures become
     * {@link ComparisonStatus#ERROR} results.
     */
    Object load(Comparison comparison) throws Exception;
}

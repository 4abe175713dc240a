package org.structdiff.sink;

/**
 * External log sink that accepts printf-style formatted records.
 */
@FunctionalInterface
public interface FormattedLog {
    void logf(String format, Object... args);
}

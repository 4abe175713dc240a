package org.structdiff.sink;

import java.util.Objects;

/**
 * Forwards every line to a {@link FormattedLog} unchanged.
 */
public final class LogPrinter implements DiffPrinter {
    private final FormattedLog log;

    public LogPrinter(FormattedLog log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public void printf(String format, Object... args) {
        log.logf(format, args);
    }
}

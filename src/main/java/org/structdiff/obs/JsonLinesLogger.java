package org.structdiff.obs;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import org.structdiff.sink.DiffPrinter;
import org.structdiff.sink.FormattedLog;

/**
 * Minimal structured logger that writes one JSON object per line.
 */
public interface JsonLinesLogger extends AutoCloseable {
    void log(String level, String message, ComparisonContext context, Map<String, ?> fields);

    default void log(String level, String message, ComparisonContext context) {
        log(level, message, context, Collections.emptyMap());
    }

    default void info(String message, ComparisonContext context, Map<String, ?> fields) {
        log("INFO", message, context, fields);
    }

    default void info(String message, ComparisonContext context) {
        info(message, context, Collections.emptyMap());
    }

    default void error(String message, ComparisonContext context, Map<String, ?> fields) {
        log("ERROR", message, context, fields);
    }

    default void error(String message, ComparisonContext context) {
        error(message, context, Collections.emptyMap());
    }

    /**
     * Formatted-record view of this logger: every {@code logf} call becomes one {@code INFO}
     * event in {@code context} whose message is the rendered line.
     */
    default FormattedLog bind(ComparisonContext context) {
        Objects.requireNonNull(context, "context");
        return (format, args) -> info(DiffPrinter.render(format, args), context);
    }

    @Override
    void close();
}

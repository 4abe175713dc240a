package org.structdiff.sink;

import java.util.Locale;

/**
 * Destination for difference lines. Each call produces one logical line without a terminator.
 */
@FunctionalInterface
public interface DiffPrinter {
    void printf(String format, Object... args);

    /**
     * Rendering shared by every printer, so output is identical regardless of destination.
     */
    static String render(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}

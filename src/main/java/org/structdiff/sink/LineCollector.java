package org.structdiff.sink;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects rendered lines in emission order.
 */
public final class LineCollector implements DiffPrinter {
    private final List<String> lines = new ArrayList<>();

    @Override
    public void printf(String format, Object... args) {
        lines.add(DiffPrinter.render(format, args));
    }

    public List<String> lines() {
        return List.copyOf(lines);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}

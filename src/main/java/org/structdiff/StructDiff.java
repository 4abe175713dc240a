package org.structdiff;

import java.io.OutputStream;
import java.io.Writer;
import java.util.List;
import org.structdiff.diff.StructuralDiffer;
import org.structdiff.sink.DiffPrinter;
import org.structdiff.sink.FormattedLog;
import org.structdiff.sink.LineCollector;
import org.structdiff.sink.LogPrinter;
import org.structdiff.sink.StreamPrinter;

/**
 * Entry points for describing the differences between two values.
 *
 * <p>Every line has the form {@code [label: ]body}, where the label is the path from the root to
 * the disagreeing sub-value.
 */
public final class StructDiff {
    private static final StructuralDiffer DIFFER = new StructuralDiffer();

    private StructDiff() {}

    /**
     * Returns one element per difference between {@code a} and {@code b}, without line terminators.
     */
    public static List<String> diff(Object a, Object b) {
        LineCollector collector = new LineCollector();
        DIFFER.diff(collector, a, b);
        return collector.lines();
    }

    /**
     * Writes each difference to {@code out} followed by a newline.
     */
    public static void writeDiff(OutputStream out, Object a, Object b) {
        DIFFER.diff(new StreamPrinter(out), a, b);
    }

    public static void writeDiff(Writer out, Object a, Object b) {
        DIFFER.diff(new StreamPrinter(out), a, b);
    }

    /**
     * Forwards each difference to {@code log} as one formatted record.
     */
    public static void logDiff(FormattedLog log, Object a, Object b) {
        DIFFER.diff(new LogPrinter(log), a, b);
    }

    public static void printDiff(DiffPrinter printer, Object a, Object b) {
        DIFFER.diff(printer, a, b);
    }
}

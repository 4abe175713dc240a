package org.structdiff;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.structdiff.sink.DiffPrinter;
import org.structdiff.sink.LineCollector;

class StructDiffTest {
    private final Order left = new Order("A-1", List.of(new Line("apple", 2)), Map.of("note", "gift"));
    private final Order right = new Order("A-1", List.of(new Line("apple", 3)), Map.of("note", "rush"));

    @Test
    void diffListsOneLinePerDifference() {
        assertEquals(
            List.of("lines[0].quantity: 2 != 3", "tags[\"note\"]: \"gift\" != \"rush\""),
            StructDiff.diff(left, right)
        );
        assertEquals(List.of(), StructDiff.diff(left, left));
    }

    @Test
    void writeDiffTerminatesEachLine() {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        StringWriter writer = new StringWriter();

        StructDiff.writeDiff(stream, left, right);
        StructDiff.writeDiff(writer, left, right);

        String expected = "lines[0].quantity: 2 != 3\ntags[\"note\"]: \"gift\" != \"rush\"\n";
        assertEquals(expected, stream.toString(StandardCharsets.UTF_8));
        assertEquals(expected, writer.toString());
    }

    @Test
    void logDiffForwardsFormatAndArguments() {
        List<String> records = new ArrayList<>();

        StructDiff.logDiff((format, args) -> records.add(DiffPrinter.render(format, args)), left, right);

        assertEquals(StructDiff.diff(left, right), records);
    }

    @Test
    void printDiffAcceptsAnyPrinter() {
        LineCollector collector = new LineCollector();

        StructDiff.printDiff(collector, 1, 2);

        assertEquals(List.of("1 != 2"), collector.lines());
    }

    @Test
    void repeatedCallsGiveIdenticalOutput() {
        assertEquals(StructDiff.diff(left, right), StructDiff.diff(left, right));
    }

    private record Order(String id, List<Line> lines, Map<String, String> tags) {}

    private record Line(String product, int quantity) {}
}

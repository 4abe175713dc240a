package org.structdiff.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiffPrinterTest {
    @Test
    void everySinkRendersTheSameText() {
        LineCollector collector = new LineCollector();
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        StreamPrinter streamPrinter = new StreamPrinter(stream);
        List<String> logged = new ArrayList<>();
        LogPrinter logPrinter = new LogPrinter((format, args) -> logged.add(DiffPrinter.render(format, args)));

        for (DiffPrinter printer : List.of(collector, streamPrinter, logPrinter)) {
            printer.printf("%s != %s", 1.5, "\"ü\"");
            printer.printf("items[%d]: %s != (missing)", 3, "x");
        }

        List<String> expected = List.of("1.5 != \"ü\"", "items[3]: x != (missing)");
        assertEquals(expected, collector.lines());
        assertEquals(expected, logged);
        assertEquals(String.join("\n", expected) + "\n", stream.toString(StandardCharsets.UTF_8));
    }

    @Test
    void renderingIgnoresTheDefaultLocale() {
        assertEquals("0.5", DiffPrinter.render("%s", 0.5));
        assertEquals("1000", DiffPrinter.render("%d", 1000));
    }

    @Test
    void collectorStartsEmptyAndReturnsSnapshots() {
        LineCollector collector = new LineCollector();
        assertTrue(collector.isEmpty());

        collector.printf("a");
        List<String> snapshot = collector.lines();
        collector.printf("b");

        assertEquals(List.of("a"), snapshot);
        assertEquals(List.of("a", "b"), collector.lines());
    }

    @Test
    void streamPrinterWritesToWriters() {
        StringWriter writer = new StringWriter();

        new StreamPrinter(writer).printf("%s: %d", "n", 4);

        assertEquals("n: 4\n", writer.toString());
    }

    @Test
    void streamFailuresSurfaceAsUncheckedIo() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() {}

            @Override
            public void close() {}
        };

        assertThrows(UncheckedIOException.class, () -> new StreamPrinter(broken).printf("x"));
    }
}

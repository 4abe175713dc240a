package org.structdiff.sink;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Writes each rendered line followed by {@code \n} and flushes.
 *
 * <p>The printer does not own the underlying stream and never closes it.
 */
public final class StreamPrinter implements DiffPrinter {
    private final Writer writer;

    public StreamPrinter(OutputStream outputStream) {
        this(new OutputStreamWriter(Objects.requireNonNull(outputStream, "outputStream"), StandardCharsets.UTF_8));
    }

    public StreamPrinter(Writer writer) {
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    @Override
    public void printf(String format, Object... args) {
        try {
            writer.write(DiffPrinter.render(format, args));
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write diff line", e);
        }
    }
}

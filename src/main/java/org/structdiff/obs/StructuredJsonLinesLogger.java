package org.structdiff.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * JSON-lines logger for comparison diagnostics. Each event carries {@code timestamp},
 * {@code level}, {@code message}, the comparison context and any extra fields.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private final Writer writer;
    private final Clock clock;
    private final boolean autoFlush;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), true);
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, Clock clock, boolean autoFlush) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), clock, autoFlush);
    }

    public StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.autoFlush = autoFlush;
        this.closed = false;
    }

    @Override
    public synchronized void log(String level, String message, ComparisonContext context, Map<String, ?> fields) {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
        ComparisonContext safeContext = Objects.requireNonNull(context, "context");

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("timestamp", Instant.now(clock).toString());
        event.put("level", level == null || level.isBlank() ? "INFO" : level.trim().toUpperCase(Locale.ROOT));
        event.put("message", message == null ? "" : message);
        event.putAll(safeContext.asFields());
        if (fields != null) {
            for (Map.Entry<String, ?> entry : fields.entrySet()) {
                String key = entry.getKey();
                // reserved and context keys win over caller fields
                if (key == null || key.isBlank() || event.containsKey(key)) {
                    continue;
                }
                event.put(key, entry.getValue());
            }
        }

        try {
            writer.write(JsonEncoder.encode(event));
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }
}

package org.structdiff.tool;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;
import org.structdiff.obs.StructuredJsonLinesLogger;
import org.structdiff.report.Comparison;
import org.structdiff.report.ComparisonHarness;
import org.structdiff.report.ComparisonReport;
import org.structdiff.report.FileValueSource;
import org.structdiff.report.ReportRenderer;

/**
 * CLI that diffs two JSON/YAML documents, or two directories of documents paired by file name.
 */
public final class StructDiffTool {
    static final String FORMAT_PROPERTY = "structdiff.format";

    private StructDiffTool() {}

    public static void main(final String[] args) {
        final int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(final String[] args, final PrintStream out, final PrintStream err) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");

        final Config config;
        try {
            config = parseArgs(args);
        } catch (final IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return 2;
        }

        if (config.help()) {
            printUsage(out);
            return 0;
        }

        try {
            final ComparisonReport report = compare(config);
            out.print(render(report, config.format()));
            return report.allMatch() ? 0 : 1;
        } catch (final IOException | RuntimeException e) {
            err.println("structdiff tool failed: " + e.getMessage());
            return 3;
        }
    }

    private static ComparisonReport compare(final Config config) throws IOException {
        final FileValueSource left = new FileValueSource(config.leftPath());
        final FileValueSource right = new FileValueSource(config.rightPath());
        final List<Comparison> comparisons = comparisons(config, left, right);
        if (config.logPath() == null) {
            return new ComparisonHarness(left, right).run(comparisons);
        }
        try (OutputStream logStream = Files.newOutputStream(config.logPath());
             StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(logStream)) {
            return new ComparisonHarness(left, right, logger, Clock.systemUTC()).run(comparisons);
        }
    }

    private static List<Comparison> comparisons(
            final Config config,
            final FileValueSource left,
            final FileValueSource right) throws IOException {
        final boolean leftIsDirectory = Files.isDirectory(config.leftPath());
        final boolean rightIsDirectory = Files.isDirectory(config.rightPath());
        final TreeSet<String> ids = new TreeSet<>();
        if (leftIsDirectory) {
            ids.addAll(left.comparisonIds());
        }
        if (rightIsDirectory) {
            ids.addAll(right.comparisonIds());
        }
        if (!leftIsDirectory && !rightIsDirectory) {
            ids.addAll(left.comparisonIds());
        }
        final List<Comparison> comparisons = new ArrayList<>(ids.size());
        for (final String id : ids) {
            comparisons.add(Comparison.of(id));
        }
        return comparisons;
    }

    private static String render(final ComparisonReport report, final OutputFormat format) {
        final ReportRenderer renderer = new ReportRenderer();
        return switch (format) {
            case TEXT -> renderer.toText(report);
            case MARKDOWN -> renderer.toMarkdown(report);
            case JSON -> renderer.toJson(report) + System.lineSeparator();
        };
    }

    private static Config parseArgs(final String[] args) {
        Path leftPath = null;
        Path rightPath = null;
        Path logPath = null;
        OutputFormat format = OutputFormat.fromText(System.getProperty(FORMAT_PROPERTY, "text"));
        boolean help = false;

        for (final String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                help = true;
                continue;
            }
            if (arg.startsWith("--left=")) {
                leftPath = Path.of(valueAfterPrefix(arg, "--left="));
                continue;
            }
            if (arg.startsWith("--right=")) {
                rightPath = Path.of(valueAfterPrefix(arg, "--right="));
                continue;
            }
            if (arg.startsWith("--format=")) {
                format = OutputFormat.fromText(valueAfterPrefix(arg, "--format="));
                continue;
            }
            if (arg.startsWith("--log=")) {
                logPath = Path.of(valueAfterPrefix(arg, "--log="));
                continue;
            }
            throw new IllegalArgumentException("unknown argument: " + arg);
        }

        if (!help && leftPath == null) {
            throw new IllegalArgumentException("--left=<path> is required");
        }
        if (!help && rightPath == null) {
            throw new IllegalArgumentException("--right=<path> is required");
        }
        return new Config(leftPath, rightPath, format, logPath, help);
    }

    private static String valueAfterPrefix(final String arg, final String prefix) {
        final String value = arg.substring(prefix.length()).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException(prefix + " must have a value");
        }
        return value;
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: StructDiffTool --left=<path> --right=<path> [--format=text|markdown|json] [--log=<path>]");
        stream.println("  --left=<path>         JSON/YAML document or directory of documents (required)");
        stream.println("  --right=<path>        JSON/YAML document or directory of documents (required)");
        stream.println("  --format=<name>       Report format (default: -D" + FORMAT_PROPERTY + " or text)");
        stream.println("  --log=<path>          Write JSON-lines diagnostics to this file");
        stream.println("  --help                Show usage");
    }

    enum OutputFormat {
        TEXT,
        MARKDOWN,
        JSON;

        static OutputFormat fromText(final String text) {
            final String normalized = text == null ? "" : text.trim().toUpperCase(Locale.ROOT);
            for (final OutputFormat format : values()) {
                if (format.name().equals(normalized)) {
                    return format;
                }
            }
            throw new IllegalArgumentException("unsupported format: " + text);
        }
    }

    private record Config(
            Path leftPath,
            Path rightPath,
            OutputFormat format,
            Path logPath,
            boolean help) {}
}

package org.structdiff.report;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.structdiff.diff.StructuralDiffer;
import org.structdiff.obs.ComparisonContext;
import org.structdiff.obs.JsonLinesLogger;
import org.structdiff.sink.DiffPrinter;
import org.structdiff.sink.FormattedLog;
import org.structdiff.sink.LineCollector;

/**
 * Loads each comparison from two sources and diffs the loaded values.
 *
 * <p>Load failures are reported as {@link ComparisonStatus#ERROR} results. Failures of the
 * differ itself (unsupported kinds) are programming errors and propagate.
 */
public final class ComparisonHarness {
    private final ValueSource leftSource;
    private final ValueSource rightSource;
    private final StructuralDiffer differ;
    private final JsonLinesLogger logger;
    private final Clock clock;

    public ComparisonHarness(ValueSource leftSource, ValueSource rightSource) {
        this(leftSource, rightSource, null, Clock.systemUTC());
    }

    /**
     * @param logger receives every difference line and one summary event per comparison; may be null
     */
    public ComparisonHarness(ValueSource leftSource, ValueSource rightSource, JsonLinesLogger logger, Clock clock) {
        this.leftSource = Objects.requireNonNull(leftSource, "leftSource");
        this.rightSource = Objects.requireNonNull(rightSource, "rightSource");
        this.differ = new StructuralDiffer();
        this.logger = logger;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ComparisonReport run(List<Comparison> comparisons) {
        Objects.requireNonNull(comparisons, "comparisons");
        List<ComparisonResult> results = new ArrayList<>(comparisons.size());
        for (Comparison comparison : comparisons) {
            results.add(runComparison(comparison));
        }
        return new ComparisonReport(clock.instant(), leftSource.name(), rightSource.name(), results);
    }

    public ComparisonResult runComparison(Comparison comparison) {
        Objects.requireNonNull(comparison, "comparison");
        ComparisonContext context = ComparisonContext.of(comparison.id(), leftSource.name(), rightSource.name());
        Object left;
        Object right;
        try {
            left = leftSource.load(comparison);
            right = rightSource.load(comparison);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String message = e.getClass().getSimpleName() + ": " + e.getMessage();
            if (logger != null) {
                logger.error("comparison failed", context, Map.of("error", message));
            }
            return ComparisonResult.error(comparison.id(), leftSource.name(), rightSource.name(), message);
        }

        LineCollector collector = new LineCollector();
        differ.diff(printerFor(collector, context), left, right);

        ComparisonResult result = collector.isEmpty()
            ? ComparisonResult.match(comparison.id(), leftSource.name(), rightSource.name())
            : ComparisonResult.mismatch(comparison.id(), leftSource.name(), rightSource.name(), collector.lines());
        if (logger != null) {
            logger.info(
                "comparison finished",
                context,
                Map.of("status", result.status().name(), "differences", result.differences().size())
            );
        }
        return result;
    }

    private DiffPrinter printerFor(LineCollector collector, ComparisonContext context) {
        if (logger == null) {
            return collector;
        }
        FormattedLog log = logger.bind(context);
        return (format, args) -> {
            collector.printf(format, args);
            log.logf(format, args);
        };
    }
}

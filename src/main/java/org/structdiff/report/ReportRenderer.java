package org.structdiff.report;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.structdiff.obs.JsonEncoder;

/**
 * Renders comparison reports as plain text, markdown and JSON.
 */
public final class ReportRenderer {
    public String toText(ComparisonReport report) {
        StringBuilder sb = new StringBuilder();
        for (ComparisonResult result : report.results()) {
            sb.append("== ").append(result.comparisonId()).append(' ').append(result.status()).append('\n');
            if (result.status() == ComparisonStatus.ERROR) {
                sb.append(result.errorMessage().orElse("unknown error")).append('\n');
                continue;
            }
            for (String line : result.differences()) {
                sb.append(line).append('\n');
            }
        }
        sb.append(report.matchCount()).append(" match, ")
            .append(report.mismatchCount()).append(" mismatch, ")
            .append(report.errorCount()).append(" error\n");
        return sb.toString();
    }

    public String toMarkdown(ComparisonReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Structural Diff Report\n\n");
        sb.append("- generatedAt: ").append(report.generatedAt()).append('\n');
        sb.append("- sources: ").append(report.leftName()).append(" vs ").append(report.rightName()).append('\n');
        sb.append("- total: ").append(report.totalComparisons()).append('\n');
        sb.append("- match: ").append(report.matchCount()).append('\n');
        sb.append("- mismatch: ").append(report.mismatchCount()).append('\n');
        sb.append("- error: ").append(report.errorCount()).append("\n\n");

        for (ComparisonResult result : report.results()) {
            sb.append("## ").append(result.comparisonId()).append(" (").append(result.status()).append(")\n");
            if (result.status() == ComparisonStatus.MATCH) {
                sb.append("- No differences\n\n");
                continue;
            }
            if (result.status() == ComparisonStatus.ERROR) {
                sb.append("- Error: ").append(result.errorMessage().orElse("unknown error")).append("\n\n");
                continue;
            }
            for (String line : result.differences()) {
                sb.append("- `").append(line).append("`\n");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public String toJson(ComparisonReport report) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("generatedAt", report.generatedAt().toString());
        root.put("leftName", report.leftName());
        root.put("rightName", report.rightName());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", report.totalComparisons());
        summary.put("match", report.matchCount());
        summary.put("mismatch", report.mismatchCount());
        summary.put("error", report.errorCount());
        root.put("summary", summary);

        List<Map<String, Object>> items = new ArrayList<>();
        for (ComparisonResult result : report.results()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("comparisonId", result.comparisonId());
            item.put("status", result.status().name());
            item.put("errorMessage", result.errorMessage().orElse(null));
            item.put("differences", result.differences());
            items.add(item);
        }
        root.put("results", items);
        return JsonEncoder.encode(root);
    }
}

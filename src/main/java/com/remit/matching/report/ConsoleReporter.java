package com.remit.matching.report;

import com.remit.matching.config.MatchConfig;
import com.remit.matching.match.MatchResult;
import com.remit.matching.match.MatchRun;
import com.remit.matching.match.MatchSummary;
import com.remit.matching.metrics.MatchMetrics;
import com.remit.matching.normalize.NormalizationPass;
import com.remit.matching.scoring.ConfidenceCategory;
import com.remit.matching.scoring.ReviewPolicy;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Console reporter for matching runs.
 */
public class ConsoleReporter {

    private static final String SEPARATOR = "=".repeat(96);
    private static final String THIN_SEPARATOR = "-".repeat(96);
    private static final DateTimeFormatter DT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream out;
    private final boolean quiet;
    private final boolean verbose;

    public ConsoleReporter(PrintStream out, boolean quiet, boolean verbose) {
        this.out = out;
        this.quiet = quiet;
        this.verbose = verbose;
    }

    public void printMatchHeader(MatchConfig config, String invoiceFile, String paymentFile, int lineCount) {
        if (quiet) return;

        out.println();
        out.println(SEPARATOR);
        out.println("                         Remittance Matching");
        out.println(SEPARATOR);
        out.println();
        out.printf("Invoice ledger:  %s%n", invoiceFile);
        out.printf("Payment advice:  %s (%,d lines)%n", paymentFile, lineCount);
        out.printf("Started:         %s%n", LocalDateTime.now().format(DT_FORMAT));
        out.println();
        out.println("Configuration:");
        out.printf("  Threads:           %d%n", config.getThreads());
        out.printf("  Amount Tolerance:  %s%n", config.getAmountTolerance().toPlainString());
        out.printf("  Auto-approve at:   %s%n", config.getAutoApproveThreshold().toPlainString());
        out.printf("  Manual review <:   %s%n", config.getManualReviewThreshold().toPlainString());
        out.printf("  Invoice Statuses:  %s%n", String.join(", ", config.getInvoiceStatuses()));
        out.println();
    }

    public void printMatchResults(MatchRun run, ReviewPolicy policy) {
        if (quiet) {
            printMatchResultsCompact(run.getSummary());
            return;
        }

        out.println(SEPARATOR);
        out.println("                            Line Results");
        out.println(SEPARATOR);
        out.printf("%5s  %-24s %12s  %-24s %-8s %10s  %-13s%n",
            "Line", "Payment Reference", "Paid", "Matched Invoice", "Pass", "Confidence", "Decision");
        out.println(THIN_SEPARATOR);

        for (MatchResult r : run.getResults()) {
            out.printf("%5d  %-24s %12s  %-24s %-8s %10s  %-13s%n",
                r.getLineNumber(),
                truncate(r.getPaymentRawText(), 24),
                r.getPaidAmount() == null ? "-" : r.getPaidAmount().toPlainString(),
                truncate(r.getMatchedInvoice().orElse("(no match)"), 24),
                r.getPass().map(NormalizationPass::getLabel).orElse("-"),
                r.getConfidence().map(this::formatConfidence).orElse("-"),
                decisionLabel(policy.decide(r)));

            if (verbose) {
                printNormalizations(r.getPaymentRawText());
            }
        }

        printSummary(run.getSummary());
        printMetrics(run.getMetrics());
    }

    private void printNormalizations(String rawText) {
        StringBuilder sb = new StringBuilder("         keys:");
        for (NormalizationPass pass : NormalizationPass.values()) {
            String key = pass.normalize(rawText);
            sb.append(String.format(" %s='%s'%s", pass.getLabel(), key, pass.isUsableKey(key) ? "" : " (unusable)"));
        }
        out.println(sb);
    }

    private void printSummary(MatchSummary s) {
        out.println();
        out.println(SEPARATOR);
        out.println("                               Summary");
        out.println(SEPARATOR);
        out.printf("Total Lines:         %,d%n", s.getTotalLines());
        out.printf("Matched:             %,d (%s%%)%n", s.getMatchedCount(), s.getMatchPercentage().toPlainString());
        out.printf("Unmatched:           %,d%n", s.getUnmatchedCount());
        out.printf("  Exact:             %,d%n", s.getExactMatches());
        out.printf("  Relaxed:           %,d%n", s.getRelaxedMatches());
        out.printf("  Numeric:           %,d%n", s.getNumericMatches());
        out.printf("Overall Confidence:  %s (%s)%n",
            s.getOverallConfidence().toPlainString(),
            ConfidenceCategory.of(s.getOverallConfidence()).getLabel());
        out.printf("Processing Time:     %s%n", formatDuration(s.getProcessingTimeMs()));
        out.printf("Completed:           %s%n", LocalDateTime.now().format(DT_FORMAT));
    }

    private void printMetrics(MatchMetrics m) {
        if (m.getLinesResolved() == 0) {
            out.println(SEPARATOR);
            return;
        }
        out.println(THIN_SEPARATOR);
        out.printf("Table Build:         %.2f ms%n", m.getTableBuildMs());
        out.printf("Line Latency:        avg=%.3f ms  p50=%.3f ms  p95=%.3f ms  p99=%.3f ms  max=%.3f ms%n",
            m.getAvgLatencyMs(), m.getP50LatencyMs(), m.getP95LatencyMs(), m.getP99LatencyMs(), m.getMaxLatencyMs());
        out.printf("Throughput:          %,.0f lines/sec%n", m.getThroughput());
        out.println(SEPARATOR);
    }

    private void printMatchResultsCompact(MatchSummary s) {
        out.printf("Matched %,d/%,d lines (%s%%): exact=%d relaxed=%d numeric=%d in %s%n",
            s.getMatchedCount(), s.getTotalLines(), s.getMatchPercentage().toPlainString(),
            s.getExactMatches(), s.getRelaxedMatches(), s.getNumericMatches(),
            formatDuration(s.getProcessingTimeMs()));
    }

    public void printMatchResultsCsv(List<MatchResult> results, ReviewPolicy policy) {
        out.println("line,payment_reference,paid_amount,matched_invoice,pass,confidence,category,decision");

        for (MatchResult r : results) {
            out.printf("%d,%s,%s,%s,%s,%s,%s,%s%n",
                r.getLineNumber(),
                csv(r.getPaymentRawText()),
                r.getPaidAmount() == null ? "" : r.getPaidAmount().toPlainString(),
                csv(r.getMatchedInvoice().orElse("")),
                r.getPass().map(NormalizationPass::getLabel).orElse(""),
                r.getConfidence().map(this::formatConfidence).orElse(""),
                r.getConfidence().map(c -> ConfidenceCategory.of(c).getLabel()).orElse(""),
                decisionLabel(policy.decide(r)));
        }
    }

    public void printMatchResultsJson(MatchRun run, ReviewPolicy policy) {
        StringBuilder sb = new StringBuilder();
        sb.append("{\n  \"results\": [\n");

        List<MatchResult> results = run.getResults();
        for (int i = 0; i < results.size(); i++) {
            MatchResult r = results.get(i);
            sb.append("    {\n");
            sb.append(String.format("      \"line\": %d,\n", r.getLineNumber()));
            sb.append(String.format("      \"paymentReference\": \"%s\",\n", escape(r.getPaymentRawText())));
            sb.append(String.format("      \"paidAmount\": %s,\n",
                r.getPaidAmount() == null ? "null" : r.getPaidAmount().toPlainString()));
            sb.append(String.format("      \"matchedInvoice\": %s,\n",
                r.getMatchedInvoice().map(v -> "\"" + escape(v) + "\"").orElse("null")));
            sb.append(String.format("      \"pass\": %s,\n",
                r.getPass().map(p -> "\"" + p.getLabel() + "\"").orElse("null")));
            sb.append(String.format("      \"confidence\": %s,\n",
                r.getConfidence().map(this::formatConfidence).orElse("null")));
            sb.append(String.format("      \"decision\": \"%s\"\n", decisionLabel(policy.decide(r))));
            sb.append("    }");
            if (i < results.size() - 1) {
                sb.append(",");
            }
            sb.append("\n");
        }

        MatchSummary s = run.getSummary();
        sb.append("  ],\n");
        sb.append("  \"summary\": {\n");
        sb.append(String.format("    \"totalLines\": %d,\n", s.getTotalLines()));
        sb.append(String.format("    \"matchedCount\": %d,\n", s.getMatchedCount()));
        sb.append(String.format("    \"unmatchedCount\": %d,\n", s.getUnmatchedCount()));
        sb.append(String.format("    \"matchPercentage\": %s,\n", s.getMatchPercentage().toPlainString()));
        sb.append(String.format("    \"exactMatches\": %d,\n", s.getExactMatches()));
        sb.append(String.format("    \"relaxedMatches\": %d,\n", s.getRelaxedMatches()));
        sb.append(String.format("    \"numericMatches\": %d,\n", s.getNumericMatches()));
        sb.append(String.format("    \"overallConfidence\": %s,\n", s.getOverallConfidence().toPlainString()));
        sb.append(String.format("    \"processingTimeMs\": %d\n", s.getProcessingTimeMs()));
        sb.append("  },\n");
        sb.append(String.format("  \"timestamp\": \"%s\"\n", LocalDateTime.now().format(DT_FORMAT)));
        sb.append("}\n");

        out.println(sb);
    }

    private String formatConfidence(BigDecimal confidence) {
        return confidence.setScale(4, RoundingMode.HALF_UP).toPlainString();
    }

    private String decisionLabel(ReviewPolicy.Decision decision) {
        return decision.name().toLowerCase(Locale.ROOT);
    }

    private String truncate(String value, int width) {
        if (value.length() <= width) return value;
        return value.substring(0, width - 1) + "~";
    }

    private String csv(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private String escape(String str) {
        if (str == null) return "";
        return str.replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n")
            .replace("\r", "\\r")
            .replace("\t", "\\t");
    }

    private String formatDuration(long millis) {
        if (millis < 1000) {
            return millis + "ms";
        } else if (millis < 60_000) {
            return String.format("%.1f seconds", millis / 1000.0);
        } else {
            long minutes = millis / 60_000;
            long seconds = (millis % 60_000) / 1000;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }
}

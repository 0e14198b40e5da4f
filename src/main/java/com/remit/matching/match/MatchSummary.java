package com.remit.matching.match;

import com.remit.matching.normalize.NormalizationPass;
import com.remit.matching.scoring.ConfidenceScorer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view of one matching run, derived entirely from its results.
 */
public final class MatchSummary {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final int totalLines;
    private final int matchedCount;
    private final int unmatchedCount;
    private final BigDecimal matchPercentage;
    private final int exactMatches;
    private final int relaxedMatches;
    private final int numericMatches;
    private final BigDecimal overallConfidence;
    private final long processingTimeMs;

    private MatchSummary(int totalLines, int matchedCount, BigDecimal matchPercentage,
                         Map<NormalizationPass, Integer> passCounts, BigDecimal overallConfidence,
                         long processingTimeMs) {
        this.totalLines = totalLines;
        this.matchedCount = matchedCount;
        this.unmatchedCount = totalLines - matchedCount;
        this.matchPercentage = matchPercentage;
        this.exactMatches = passCounts.getOrDefault(NormalizationPass.EXACT, 0);
        this.relaxedMatches = passCounts.getOrDefault(NormalizationPass.RELAXED, 0);
        this.numericMatches = passCounts.getOrDefault(NormalizationPass.NUMERIC, 0);
        this.overallConfidence = overallConfidence;
        this.processingTimeMs = processingTimeMs;
    }

    /**
     * Summarize a result list.
     *
     * @param results the ordered results of one run
     * @param processingTimeMs wall-clock time of the whole run
     */
    public static MatchSummary of(List<MatchResult> results, long processingTimeMs) {
        Map<NormalizationPass, Integer> passCounts = new EnumMap<>(NormalizationPass.class);
        List<BigDecimal> confidences = new ArrayList<>(results.size());
        int matched = 0;

        for (MatchResult result : results) {
            if (result.isMatched()) {
                matched++;
                result.getPass().ifPresent(pass -> passCounts.merge(pass, 1, Integer::sum));
            }
            confidences.add(result.getConfidence().orElse(null));
        }

        BigDecimal percentage = results.isEmpty()
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(matched).multiply(HUNDRED)
                .divide(BigDecimal.valueOf(results.size()), 2, RoundingMode.HALF_UP);

        BigDecimal overall = results.isEmpty()
            ? BigDecimal.ZERO
            : ConfidenceScorer.overallConfidence(confidences, null);

        return new MatchSummary(results.size(), matched, percentage, passCounts, overall, processingTimeMs);
    }

    public int getTotalLines() {
        return totalLines;
    }

    public int getMatchedCount() {
        return matchedCount;
    }

    public int getUnmatchedCount() {
        return unmatchedCount;
    }

    /** Percentage of matched lines, two decimal places; zero for an empty batch. */
    public BigDecimal getMatchPercentage() {
        return matchPercentage;
    }

    public int getExactMatches() {
        return exactMatches;
    }

    public int getRelaxedMatches() {
        return relaxedMatches;
    }

    public int getNumericMatches() {
        return numericMatches;
    }

    public int getMatches(NormalizationPass pass) {
        return switch (pass) {
            case EXACT -> exactMatches;
            case RELAXED -> relaxedMatches;
            case NUMERIC -> numericMatches;
        };
    }

    public BigDecimal getOverallConfidence() {
        return overallConfidence;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    /**
     * Compare every field except the processing time.
     */
    public boolean sameOutcomeAs(MatchSummary other) {
        return other != null
                && totalLines == other.totalLines
                && matchedCount == other.matchedCount
                && unmatchedCount == other.unmatchedCount
                && matchPercentage.compareTo(other.matchPercentage) == 0
                && exactMatches == other.exactMatches
                && relaxedMatches == other.relaxedMatches
                && numericMatches == other.numericMatches
                && overallConfidence.compareTo(other.overallConfidence) == 0;
    }

    @Override
    public String toString() {
        return String.format(
            "MatchSummary{total=%d, matched=%d, unmatched=%d, pct=%s%%, exact=%d, relaxed=%d, numeric=%d, " +
                "overallConfidence=%s, elapsed=%dms}",
            totalLines, matchedCount, unmatchedCount, matchPercentage.toPlainString(),
            exactMatches, relaxedMatches, numericMatches, overallConfidence.toPlainString(), processingTimeMs);
    }
}

package com.remit.matching.match;

import com.remit.matching.metrics.MatchMetrics;

import java.util.List;

/**
 * Everything one matching run hands back to its caller.
 */
public final class MatchRun {

    private final List<MatchResult> results;
    private final MatchSummary summary;
    private final MatchMetrics metrics;

    public MatchRun(List<MatchResult> results, MatchSummary summary, MatchMetrics metrics) {
        this.results = List.copyOf(results);
        this.summary = summary;
        this.metrics = metrics;
    }

    /** Results in payment-line order. */
    public List<MatchResult> getResults() {
        return results;
    }

    public MatchSummary getSummary() {
        return summary;
    }

    public MatchMetrics getMetrics() {
        return metrics;
    }
}

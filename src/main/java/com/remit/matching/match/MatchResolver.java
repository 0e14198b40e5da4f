package com.remit.matching.match;

import com.remit.matching.lookup.LookupTables;
import com.remit.matching.normalize.NormalizationPass;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Resolves a payment line against all three passes and keeps the highest-priority answer.
 *
 * <p>The three probes run concurrently on the supplied executor. The combined future completes
 * once every probe has completed; no pool thread waits on another.
 */
public class MatchResolver {

    private final LookupTables tables;
    private final Executor executor;

    public MatchResolver(LookupTables tables, Executor executor) {
        this.tables = tables;
        this.executor = executor;
    }

    /**
     * Launch the three probes for one line.
     *
     * @param rawInvoiceText the payment's invoice reference
     * @return future of the winning match, or empty if no pass matched
     */
    public CompletableFuture<Optional<PassMatch>> resolveAsync(String rawInvoiceText) {
        NormalizationPass[] passes = NormalizationPass.values();
        List<CompletableFuture<Optional<PassMatch>>> probes = new ArrayList<>(passes.length);
        for (NormalizationPass pass : passes) {
            probes.add(CompletableFuture.supplyAsync(
                () -> PassMatcher.match(rawInvoiceText, tables.get(pass)), executor));
        }

        return CompletableFuture.allOf(probes.toArray(new CompletableFuture[0]))
            .thenApply(ignored -> {
                List<Optional<PassMatch>> outcomes = new ArrayList<>(probes.size());
                for (CompletableFuture<Optional<PassMatch>> probe : probes) {
                    outcomes.add(probe.join());
                }
                return select(outcomes);
            });
    }

    /**
     * Sequential variant for callers that have no executor at hand.
     */
    public Optional<PassMatch> resolve(String rawInvoiceText) {
        List<Optional<PassMatch>> outcomes = new ArrayList<>();
        for (NormalizationPass pass : NormalizationPass.values()) {
            outcomes.add(PassMatcher.match(rawInvoiceText, tables.get(pass)));
        }
        return select(outcomes);
    }

    /**
     * Pick the match of the highest-priority pass among the probe outcomes, regardless of their order.
     */
    static Optional<PassMatch> select(List<Optional<PassMatch>> outcomes) {
        PassMatch best = null;
        for (Optional<PassMatch> outcome : outcomes) {
            if (outcome.isPresent() && outcome.get().pass().outranks(best == null ? null : best.pass())) {
                best = outcome.get();
            }
        }
        return Optional.ofNullable(best);
    }
}

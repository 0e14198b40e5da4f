package com.remit.matching.match;

import com.remit.matching.lookup.LookupTable;
import com.remit.matching.lookup.LookupTableBuilder;
import com.remit.matching.lookup.LookupTables;
import com.remit.matching.metrics.MatchMetrics;
import com.remit.matching.normalize.NormalizationPass;
import com.remit.matching.scoring.AmountTolerance;
import com.remit.matching.scoring.ConfidenceScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Runs one batch of payment lines against one invoice snapshot.
 *
 * <p>The run builds the three lookup tables concurrently and waits for all of them, then resolves
 * every line concurrently and waits for all of them, then scores the matches. Each line's answer
 * lands in the slot of its input position, so results come back in input order whatever the
 * completion order was. An instance runs once.
 */
public class MatchingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MatchingOrchestrator.class);

    public enum State {
        INIT,
        BUILDING_TABLES,
        RESOLVING,
        SCORING,
        RESOLVED
    }

    private final List<String> invoiceNumbers;
    private final List<PaymentLine> payments;
    private final AmountTolerance amountTolerance;
    private final ConfidenceScorer scorer;
    private final Executor executor;
    private final MatchMetrics metrics = new MatchMetrics();

    private volatile State state = State.INIT;

    public MatchingOrchestrator(List<String> invoiceNumbers, List<PaymentLine> payments,
                                AmountTolerance amountTolerance, ConfidenceScorer scorer, Executor executor) {
        this.invoiceNumbers = List.copyOf(Objects.requireNonNull(invoiceNumbers, "invoiceNumbers"));
        this.payments = List.copyOf(Objects.requireNonNull(payments, "payments"));
        this.amountTolerance = Objects.requireNonNull(amountTolerance, "amountTolerance");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Execute the run.
     *
     * @return ordered results, summary and timing
     * @throws IllegalStateException if this orchestrator already ran
     * @throws MatchingException if the calling thread is interrupted while waiting on a join
     */
    public MatchRun run() {
        synchronized (this) {
            if (state != State.INIT) {
                throw new IllegalStateException("Orchestrator already used, state=" + state);
            }
            state = State.BUILDING_TABLES;
        }

        long startNanos = System.nanoTime();
        metrics.start();

        if (invoiceNumbers.isEmpty()) {
            log.warn("No invoices in snapshot, {} payment lines left unmatched", payments.size());
            List<MatchResult> results = new ArrayList<>(payments.size());
            for (int i = 0; i < payments.size(); i++) {
                results.add(MatchResult.unmatched(i + 1, payments.get(i)));
            }
            state = State.RESOLVED;
            return finish(results, startNanos);
        }

        LookupTables tables = buildTables();

        state = State.RESOLVING;
        PassMatch[] resolutions = resolveAll(tables);

        state = State.SCORING;
        List<MatchResult> results = score(resolutions);

        state = State.RESOLVED;
        return finish(results, startNanos);
    }

    private LookupTables buildTables() {
        long buildStart = System.nanoTime();

        Map<NormalizationPass, CompletableFuture<LookupTable>> builds = new EnumMap<>(NormalizationPass.class);
        for (NormalizationPass pass : NormalizationPass.values()) {
            builds.put(pass, CompletableFuture.supplyAsync(
                () -> LookupTableBuilder.build(pass, invoiceNumbers), executor));
        }
        await(new ArrayList<>(builds.values()), "building lookup tables");

        Map<NormalizationPass, LookupTable> built = new EnumMap<>(NormalizationPass.class);
        builds.forEach((pass, future) -> built.put(pass, future.join()));
        LookupTables tables = new LookupTables(built);

        metrics.recordTableBuild((System.nanoTime() - buildStart) / 1000);
        log.info("Built lookup tables from {} invoices: exact={} relaxed={} numeric={} keys",
            invoiceNumbers.size(),
            tables.get(NormalizationPass.EXACT).size(),
            tables.get(NormalizationPass.RELAXED).size(),
            tables.get(NormalizationPass.NUMERIC).size());

        return tables;
    }

    private PassMatch[] resolveAll(LookupTables tables) {
        MatchResolver resolver = new MatchResolver(tables, executor);
        PassMatch[] slots = new PassMatch[payments.size()];
        List<CompletableFuture<Void>> lines = new ArrayList<>(payments.size());

        for (int i = 0; i < payments.size(); i++) {
            int index = i;
            long launchedNanos = System.nanoTime();
            lines.add(resolver.resolveAsync(payments.get(i).getRawInvoiceText())
                .thenAccept(match -> {
                    slots[index] = match.orElse(null);
                    metrics.recordLine((System.nanoTime() - launchedNanos) / 1000);
                }));
        }
        await(lines, "resolving payment lines");

        return slots;
    }

    private List<MatchResult> score(PassMatch[] resolutions) {
        List<MatchResult> results = new ArrayList<>(resolutions.length);
        for (int i = 0; i < resolutions.length; i++) {
            PaymentLine line = payments.get(i);
            PassMatch match = resolutions[i];
            if (match == null) {
                results.add(MatchResult.unmatched(i + 1, line));
                continue;
            }

            boolean amountMatches = amountTolerance.isWithinTolerance(line, match.invoiceNumber());
            BigDecimal confidence = scorer.score(
                match.pass(), line.getRawInvoiceText(), match.invoiceNumber(), amountMatches);

            log.debug("Matched '{}' to '{}' via {} with confidence {}",
                line.getRawInvoiceText(), match.invoiceNumber(), match.pass().getLabel(), confidence);

            results.add(MatchResult.matched(i + 1, line, match, confidence));
        }
        return results;
    }

    private MatchRun finish(List<MatchResult> results, long startNanos) {
        metrics.complete();
        long processingTimeMs = (System.nanoTime() - startNanos) / 1_000_000;
        MatchSummary summary = MatchSummary.of(results, processingTimeMs);

        log.info("Matching completed: {}/{} matched (exact={}, relaxed={}, numeric={}) in {}ms",
            summary.getMatchedCount(), summary.getTotalLines(),
            summary.getExactMatches(), summary.getRelaxedMatches(), summary.getNumericMatches(),
            processingTimeMs);

        return new MatchRun(results, summary, metrics);
    }

    private void await(List<? extends CompletableFuture<?>> tasks, String phase) {
        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            tasks.forEach(task -> task.cancel(true));
            Thread.currentThread().interrupt();
            throw new MatchingException("Interrupted while " + phase, e);
        } catch (ExecutionException e) {
            throw new MatchingException("Failed while " + phase, e.getCause());
        }
    }

    public State getState() {
        return state;
    }
}

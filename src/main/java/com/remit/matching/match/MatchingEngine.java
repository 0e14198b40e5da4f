package com.remit.matching.match;

import com.remit.matching.scoring.AmountTolerance;
import com.remit.matching.scoring.ConfidenceScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the worker pool shared by matching runs. Each call to {@code match} gets a fresh
 * {@link MatchingOrchestrator}; nothing is carried between runs.
 */
public class MatchingEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);

    private final ExecutorService executor;
    private final ConfidenceScorer scorer;

    public MatchingEngine(int threads) {
        this(threads, new ConfidenceScorer());
    }

    public MatchingEngine(int threads, ConfidenceScorer scorer) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1, was " + threads);
        }
        this.scorer = scorer;
        this.executor = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
    }

    /**
     * Match a batch with known amount agreement.
     */
    public MatchRun match(List<String> invoiceNumbers, List<PaymentLine> payments, AmountTolerance amountTolerance) {
        return new MatchingOrchestrator(invoiceNumbers, payments, amountTolerance, scorer, executor).run();
    }

    /**
     * Match a batch when invoice totals are unknown; every match carries the amount penalty.
     */
    public MatchRun match(List<String> invoiceNumbers, List<PaymentLine> payments) {
        return match(invoiceNumbers, payments, AmountTolerance.unknownTotals());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Matching workers did not stop in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "remit-match-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

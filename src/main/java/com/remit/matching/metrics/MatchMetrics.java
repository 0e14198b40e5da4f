package com.remit.matching.metrics;

import org.HdrHistogram.Histogram;

import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe timing collected during one matching run.
 */
public class MatchMetrics {

    private final LongAdder linesResolved = new LongAdder();
    private final Histogram lineLatencyHistogram;

    private volatile long startTimeNanos;
    private volatile long endTimeNanos;
    private volatile long tableBuildMicros;

    public MatchMetrics() {
        // Histogram for latencies from 1 microsecond to 60 seconds with 3 significant digits
        this.lineLatencyHistogram = new Histogram(1, 60_000_000, 3);
    }

    public void start() {
        this.startTimeNanos = System.nanoTime();
    }

    public void complete() {
        this.endTimeNanos = System.nanoTime();
    }

    public void recordTableBuild(long micros) {
        this.tableBuildMicros = micros;
    }

    public void recordLine(long latencyMicros) {
        linesResolved.increment();
        synchronized (lineLatencyHistogram) {
            lineLatencyHistogram.recordValue(Math.max(1, Math.min(latencyMicros, 60_000_000)));
        }
    }

    public long getLinesResolved() {
        return linesResolved.sum();
    }

    public long getElapsedTimeMs() {
        if (startTimeNanos == 0) return 0;
        long end = endTimeNanos > 0 ? endTimeNanos : System.nanoTime();
        return (end - startTimeNanos) / 1_000_000;
    }

    public double getTableBuildMs() {
        return tableBuildMicros / 1000.0;
    }

    public double getThroughput() {
        long elapsedMs = getElapsedTimeMs();
        if (elapsedMs == 0) return 0;
        return (linesResolved.sum() * 1000.0) / elapsedMs;
    }

    public double getAvgLatencyMs() {
        synchronized (lineLatencyHistogram) {
            return lineLatencyHistogram.getTotalCount() == 0 ? 0 : lineLatencyHistogram.getMean() / 1000.0;
        }
    }

    public double getMaxLatencyMs() {
        synchronized (lineLatencyHistogram) {
            return lineLatencyHistogram.getMaxValue() / 1000.0;
        }
    }

    public double getPercentileLatencyMs(double percentile) {
        synchronized (lineLatencyHistogram) {
            return lineLatencyHistogram.getValueAtPercentile(percentile) / 1000.0;
        }
    }

    public double getP50LatencyMs() {
        return getPercentileLatencyMs(50.0);
    }

    public double getP95LatencyMs() {
        return getPercentileLatencyMs(95.0);
    }

    public double getP99LatencyMs() {
        return getPercentileLatencyMs(99.0);
    }

    @Override
    public String toString() {
        return String.format(
            "MatchMetrics{lines=%d, elapsed=%dms, tableBuild=%.2fms, throughput=%.1f/sec, " +
                "avgLatency=%.3fms, p95=%.3fms}",
            getLinesResolved(), getElapsedTimeMs(), getTableBuildMs(), getThroughput(),
            getAvgLatencyMs(), getP95LatencyMs());
    }
}

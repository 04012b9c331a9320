package com.typeddsl.dag.util;

import com.typeddsl.dag.api.ProgramListener;
import com.typeddsl.dag.ir.OperationRecord;

/**
 * A listener that tracks what dead-code elimination does to the programs it
 * is attached to.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Volume:</b> operations and placeholders recorded.</li>
 * <li><b>Pruning:</b> operations kept and eliminated, last and total.</li>
 * <li><b>Latency:</b> min, max and average time per finalization (in
 * nanoseconds).</li>
 * </ul>
 */
public final class OptimizationStatsListener implements ProgramListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(OptimizationStatsListener.class);

    private long operationsRecorded, placeholdersDeclared;
    private long totalFinalizations, totalLatencyNanos, totalEliminated;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private int lastLive, lastEliminated;

    @Override
    public void onPlaceholder(String program, String name) {
        placeholdersDeclared++;
    }

    @Override
    public void onOperation(String program, OperationRecord record) {
        operationsRecorded++;
    }

    @Override
    public void onFinalized(String program, int recorded, int live, long durationNanos) {
        lastLive = live;
        lastEliminated = recorded - live;
        totalEliminated += lastEliminated;
        totalFinalizations++;
        totalLatencyNanos += durationNanos;
        if (durationNanos < minLatencyNanos)
            minLatencyNanos = durationNanos;
        if (durationNanos > maxLatencyNanos)
            maxLatencyNanos = durationNanos;
        log.debug("Program '{}' finalized: {}/{} operations live in {} us", program, live, recorded,
                durationNanos / 1000.0);
    }

    public long operationsRecorded() {
        return operationsRecorded;
    }

    public long placeholdersDeclared() {
        return placeholdersDeclared;
    }

    public long totalFinalizations() {
        return totalFinalizations;
    }

    public int lastLive() {
        return lastLive;
    }

    public int lastEliminated() {
        return lastEliminated;
    }

    public long totalEliminated() {
        return totalEliminated;
    }

    public double avgLatencyNanos() {
        return totalFinalizations > 0 ? (double) totalLatencyNanos / totalFinalizations : 0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public void reset() {
        operationsRecorded = 0;
        placeholdersDeclared = 0;
        totalFinalizations = 0;
        totalLatencyNanos = 0;
        totalEliminated = 0;
        lastLive = 0;
        lastEliminated = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }
}

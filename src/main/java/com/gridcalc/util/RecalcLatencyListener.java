package com.gridcalc.util;

import com.gridcalc.api.CellRef;
import com.gridcalc.api.RecalcListener;
import com.gridcalc.api.Value;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tracks how long recalculation passes take and how much work each one does.
 *
 * <p>
 * Captures min, max and average pass latency, the number of passes, the cells
 * evaluated by the last pass and the circular references it found. Cell
 * failures are logged, throttled to one line per second.
 */
public final class RecalcLatencyListener implements RecalcListener {
    private static final Logger log = LogManager.getLogger(RecalcLatencyListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private long passStartNanos, lastLatencyNanos;
    private long totalPasses, totalLatencyNanos;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private int lastCellsEvaluated, lastCircular, circularInPass;

    @Override
    public void onRecalcStart(long epoch) {
        passStartNanos = System.nanoTime();
        circularInPass = 0;
    }

    @Override
    public void onCellEvaluated(long epoch, CellRef cell, Value value, long durationNanos) {
    }

    @Override
    public void onCellError(long epoch, CellRef cell, Throwable error) {
        errLimiter.log(String.format("Formula failure at %s: %s", cell, error.getMessage()), null);
    }

    @Override
    public void onCircularReference(long epoch, CellRef cell) {
        circularInPass++;
    }

    @Override
    public void onRecalcEnd(long epoch, int cellsEvaluated) {
        lastLatencyNanos = System.nanoTime() - passStartNanos;
        lastCellsEvaluated = cellsEvaluated;
        lastCircular = circularInPass;
        totalPasses++;
        totalLatencyNanos += lastLatencyNanos;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public int lastCellsEvaluated() {
        return lastCellsEvaluated;
    }

    public int lastCircularCount() {
        return lastCircular;
    }

    public long totalPasses() {
        return totalPasses;
    }

    public double avgLatencyMicros() {
        return totalPasses > 0 ? (double) totalLatencyNanos / totalPasses / 1000.0 : 0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public void reset() {
        totalPasses = 0;
        totalLatencyNanos = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s | %10s | %10s | %10s%n", "Metric", "Value", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("------------------------------------------------------------------------\n");
        sb.append(String.format("%-20s | %10d | %10.2f | %10.2f | %10.2f%n",
                "Recalc passes",
                totalPasses,
                avgLatencyMicros(),
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0));
        sb.append(String.format("%-20s | %10d |%n", "Last pass cells", lastCellsEvaluated));
        return sb.toString();
    }
}

package com.gridcalc.util;

import com.gridcalc.api.CellRef;
import com.gridcalc.api.RecalcListener;
import com.gridcalc.api.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Per-cell evaluation statistics, for finding the formulas that cost the most. */
public class RecalcProfileListener implements RecalcListener {

    public static class CellStats {
        public final CellRef cell;
        public long count;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;

        public CellStats(CellRef cell) {
            this.cell = cell;
        }

        void update(long duration) {
            count++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    private final Map<CellRef, CellStats> stats = new HashMap<>();

    /** @return stats for the cell, or null if it was never evaluated. */
    public synchronized CellStats statsFor(CellRef cell) {
        return stats.get(cell);
    }

    @Override
    public void onRecalcStart(long epoch) {
    }

    @Override
    public synchronized void onCellEvaluated(long epoch, CellRef cell, Value value, long durationNanos) {
        stats.computeIfAbsent(cell, CellStats::new).update(durationNanos);
    }

    @Override
    public synchronized void onCellError(long epoch, CellRef cell, Throwable error) {
        stats.computeIfAbsent(cell, CellStats::new).errors++;
    }

    @Override
    public void onRecalcEnd(long epoch, int cellsEvaluated) {
    }

    public synchronized void reset() {
        stats.clear();
    }

    /** Table of cell statistics, most expensive first. */
    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-10s | %10s | %8s | %10s | %10s | %10s | %10s%n", "Cell", "Count", "Errors",
                "Recent(us)", "Avg (us)", "Min (us)", "Max (us)"));
        sb.append("------------------------------------------------------------------------------------------\n");

        List<CellStats> valid = new ArrayList<>();
        for (CellStats s : stats.values())
            if (s.count > 0)
                valid.add(s);
        valid.sort((s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));

        for (CellStats s : valid) {
            sb.append(String.format("%-10s | %10d | %8d | %10.2f | %10.2f | %10.2f | %10.2f%n",
                    s.cell,
                    s.count,
                    s.errors,
                    s.lastDurationNanos / 1000.0,
                    s.avgMicros(),
                    s.minDurationNanos / 1000.0,
                    s.maxDurationNanos / 1000.0));
        }
        return sb.toString();
    }
}

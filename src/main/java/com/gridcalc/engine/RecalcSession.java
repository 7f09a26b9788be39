package com.gridcalc.engine;

import com.gridcalc.api.CellRef;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-pass bookkeeping, created by the engine for every pass and dropped at
 * the end of it. Keeps cycle detection local to one pass of one sheet.
 */
final class RecalcSession {

    final long epoch;
    final long startNanos = System.nanoTime();
    /**
     * Whether dirty cells that still hold a value are recomputed before being
     * read. False only for on-demand reads in manual mode, which serve the
     * stale value.
     */
    final boolean refreshStale;

    // cells currently on the evaluation stack
    final Set<CellRef> inProgress = new HashSet<>();
    // cells found on a cycle during this pass
    final Set<CellRef> circular = new LinkedHashSet<>();

    int evaluated;
    int errors;

    RecalcSession(long epoch, boolean refreshStale) {
        this.epoch = epoch;
        this.refreshStale = refreshStale;
    }

    RecalcStats stats() {
        return new RecalcStats(epoch, evaluated, circular.size(), errors, System.nanoTime() - startNanos);
    }
}

package com.gridcalc.api;

/**
 * Observability hook for recalculation passes.
 *
 * Registered with the recalculation engine to receive callbacks while a pass
 * runs. Used for profiling (per-cell timings), tracing which cells were
 * recomputed, and counting circular references or failures.
 *
 * Callbacks run on the recalculating thread inside the sheet's write lock, so
 * implementations must be cheap and must not call back into the sheet.
 */
public interface RecalcListener {

    /**
     * Called before a recalculation pass begins.
     *
     * @param epoch The pass number, incremented once per pass.
     */
    void onRecalcStart(long epoch);

    /**
     * Called after a formula cell has been evaluated and cached.
     *
     * @param epoch         Current pass.
     * @param cell          The evaluated cell.
     * @param value         The value now cached for the cell.
     * @param durationNanos Time spent in the evaluator for this cell,
     *                      excluding its dependencies.
     */
    void onCellEvaluated(long epoch, CellRef cell, Value value, long durationNanos);

    /**
     * Called when evaluating a cell threw unexpectedly. The cell caches
     * {@code #ERR!} and the pass continues.
     */
    void onCellError(long epoch, CellRef cell, Throwable error);

    /** Called when a cell is found to take part in a circular reference. */
    default void onCircularReference(long epoch, CellRef cell) {
    }

    /**
     * Called when the pass is complete.
     *
     * @param epoch          Current pass.
     * @param cellsEvaluated Number of formula cells evaluated in this pass.
     */
    void onRecalcEnd(long epoch, int cellsEvaluated);
}

package com.gridcalc.engine;

/** Recalculation state of a formula cell. */
public enum CellState {
    /** Cached value is current. */
    CLEAN,
    /** An input changed since the cached value (if any) was computed. */
    DIRTY,
    /** On the evaluation stack of the running pass. */
    RECALCULATING,
    /** Found on a reference cycle; the cached value is {@code #CIRC!}. */
    CIRCULAR_DETECTED
}

package com.gridcalc.engine;

public enum RecalcMode {
    /** Every edit recalculates its dependents before returning. */
    AUTOMATIC,
    /** Edits only mark dependents dirty; an explicit recalculation catches up. */
    MANUAL
}

package com.gridcalc.engine;

import com.gridcalc.api.CellRef;

import java.util.Comparator;

/**
 * The order dirty cells are visited in a pass. Dependencies are pulled first
 * whatever the order, so every order produces the same values; the scan
 * orders only reproduce the visiting sequence of the classic products.
 */
public enum RecalcOrder {
    /** Dependencies before dependents. */
    NATURAL(null),
    /** Column by column, top to bottom within a column. */
    COLUMN_WISE(Comparator.comparingInt(CellRef::col).thenComparingInt(CellRef::row)),
    /** Row by row, left to right within a row. */
    ROW_WISE(Comparator.comparingInt(CellRef::row).thenComparingInt(CellRef::col));

    private final Comparator<CellRef> scanOrder;

    RecalcOrder(Comparator<CellRef> scanOrder) {
        this.scanOrder = scanOrder;
    }

    /** Null for NATURAL, which orders by the dependency graph instead. */
    public Comparator<CellRef> scanOrder() {
        return scanOrder;
    }
}

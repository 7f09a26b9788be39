package com.gridcalc.api;

import com.gridcalc.util.CellRefs;

/**
 * Zero-based (row, col) coordinate of a cell.
 *
 * This is the identity of a cell inside the store and the dependency graph.
 * Anchoring ({@code $}) is a property of formula text, not of the coordinate,
 * so {@code $A$1} and {@code A1} name the same CellRef.
 */
public record CellRef(int row, int col) implements Comparable<CellRef> {

    public CellRef {
        if (row < 0 || col < 0)
            throw new IllegalArgumentException("Negative cell coordinate: (" + row + ", " + col + ")");
    }

    public static CellRef of(int row, int col) {
        return new CellRef(row, col);
    }

    /** Parses A1 notation; {@code $} anchors are accepted and ignored. */
    public static CellRef parse(String a1) {
        return CellRefs.parseCellRef(a1);
    }

    /** Row-major ordering: A1, B1, ..., A2, B2, ... */
    @Override
    public int compareTo(CellRef o) {
        int c = Integer.compare(row, o.row);
        return c != 0 ? c : Integer.compare(col, o.col);
    }

    @Override
    public String toString() {
        return CellRefs.makeCellRef(row, col);
    }
}

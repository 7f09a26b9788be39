package com.gridcalc.api;

import com.gridcalc.util.CellRefs;

/**
 * Rectangular block of cells stored as its bounding box.
 *
 * The compact constructor normalizes the corners, so {@code start} is always
 * the top-left and {@code end} the bottom-right cell. A single-cell reference
 * is a 1x1 range; the dependency graph stores every edge this way and never
 * expands a range into its cells.
 */
public record RangeRef(CellRef start, CellRef end) {

    public RangeRef {
        if (start == null || end == null)
            throw new IllegalArgumentException("Range corners must not be null");
        int top = Math.min(start.row(), end.row());
        int bottom = Math.max(start.row(), end.row());
        int left = Math.min(start.col(), end.col());
        int right = Math.max(start.col(), end.col());
        start = new CellRef(top, left);
        end = new CellRef(bottom, right);
    }

    public static RangeRef of(CellRef cell) {
        return new RangeRef(cell, cell);
    }

    public static RangeRef of(int startRow, int startCol, int endRow, int endCol) {
        return new RangeRef(new CellRef(startRow, startCol), new CellRef(endRow, endCol));
    }

    /** Parses {@code A1:B10}, {@code A1..B10} or a single {@code A1}. */
    public static RangeRef parse(String text) {
        return CellRefs.parseRangeRef(text);
    }

    public boolean isSingleCell() {
        return start.equals(end);
    }

    public boolean contains(CellRef cell) {
        return contains(cell.row(), cell.col());
    }

    public boolean contains(int row, int col) {
        return row >= start.row() && row <= end.row() && col >= start.col() && col <= end.col();
    }

    public int rowCount() {
        return end.row() - start.row() + 1;
    }

    public int colCount() {
        return end.col() - start.col() + 1;
    }

    public long area() {
        return (long) rowCount() * colCount();
    }

    @Override
    public String toString() {
        return isSingleCell() ? start.toString() : start + ":" + end;
    }
}

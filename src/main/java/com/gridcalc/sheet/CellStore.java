package com.gridcalc.sheet;

import com.gridcalc.api.CellRef;
import com.gridcalc.api.RangeRef;
import com.gridcalc.api.Value;
import com.gridcalc.engine.CellState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Sparse map from coordinate to {@link Cell}.
 *
 * Cells are kept in row-major order so a range scan walks one sorted slice per
 * row instead of probing every coordinate. A cell exists from its first write
 * until it is emptied and has no custom format or protection left.
 *
 * Not thread-safe; the owning sheet serializes access.
 */
public final class CellStore {

    private final NavigableMap<CellRef, Cell> cells = new TreeMap<>();
    private final int maxRows;
    private final int maxCols;

    public CellStore(int maxRows, int maxCols) {
        if (maxRows <= 0 || maxCols <= 0)
            throw new IllegalArgumentException("Sheet bounds must be positive: " + maxRows + "x" + maxCols);
        this.maxRows = maxRows;
        this.maxCols = maxCols;
    }

    public int maxRows() {
        return maxRows;
    }

    public int maxCols() {
        return maxCols;
    }

    public CellRef validate(CellRef ref) {
        if (ref.row() >= maxRows || ref.col() >= maxCols)
            throw new IllegalArgumentException("Cell " + ref + " is outside the sheet (" + maxRows + " rows, "
                    + maxCols + " columns)");
        return ref;
    }

    /** @return the cell, or null if it does not exist. */
    public Cell get(CellRef ref) {
        return cells.get(ref);
    }

    public Cell getOrCreate(CellRef ref) {
        return cells.computeIfAbsent(validate(ref), k -> new Cell());
    }

    /** Stores a freshly computed value and drops the rendered display. */
    public void cacheValue(Cell cell, Value value) {
        cell.cache(value);
    }

    public void invalidate(Cell cell) {
        cell.invalidate();
    }

    public void setState(Cell cell, CellState state) {
        cell.setState(state);
    }

    public boolean contains(CellRef ref) {
        return cells.containsKey(ref);
    }

    /**
     * Writes raw text, creating the cell on first write.
     *
     * @return the cell, or null when the write emptied a cell that had nothing
     *         else to keep and it was removed.
     */
    public Cell set(CellRef ref, String rawText) {
        Cell cell = getOrCreate(ref);
        cell.setRawText(rawText);
        if (cell.isDisposable()) {
            cells.remove(ref);
            return null;
        }
        return cell;
    }

    public Cell remove(CellRef ref) {
        return cells.remove(ref);
    }

    /** Drops the cell if it no longer carries text, format or protection. */
    public void compact(CellRef ref) {
        Cell cell = cells.get(ref);
        if (cell != null && cell.isDisposable())
            cells.remove(ref);
    }

    public int size() {
        return cells.size();
    }

    public void clear() {
        cells.clear();
    }

    /** Existing cells inside the range, row-major. */
    public void forEachIn(RangeRef range, BiConsumer<CellRef, Cell> action) {
        int top = range.start().row(), bottom = range.end().row();
        int left = range.start().col(), right = range.end().col();
        if (bottom - top + 1 > cells.size()) {
            // fewer cells than rows: one pass over the slice is cheaper
            for (Map.Entry<CellRef, Cell> e : cells.subMap(range.start(), true, range.end(), true).entrySet()) {
                int col = e.getKey().col();
                if (col >= left && col <= right)
                    action.accept(e.getKey(), e.getValue());
            }
            return;
        }
        for (int r = top; r <= bottom; r++) {
            for (Map.Entry<CellRef, Cell> e : cells.subMap(new CellRef(r, left), true, new CellRef(r, right), true)
                    .entrySet())
                action.accept(e.getKey(), e.getValue());
        }
    }

    public List<CellRef> formulaCells() {
        List<CellRef> result = new ArrayList<>();
        for (Map.Entry<CellRef, Cell> e : cells.entrySet())
            if (e.getValue().isFormula())
                result.add(e.getKey());
        return result;
    }

    /** Read-only row-major view of every cell. */
    public Map<CellRef, Cell> cells() {
        return Collections.unmodifiableMap(cells);
    }

    /** Smallest range holding every non-empty cell, or null for an empty sheet. */
    public RangeRef usedRange() {
        int top = Integer.MAX_VALUE, left = Integer.MAX_VALUE, bottom = -1, right = -1;
        for (Map.Entry<CellRef, Cell> e : cells.entrySet()) {
            if (e.getValue().content().isEmpty())
                continue;
            CellRef ref = e.getKey();
            top = Math.min(top, ref.row());
            bottom = Math.max(bottom, ref.row());
            left = Math.min(left, ref.col());
            right = Math.max(right, ref.col());
        }
        return bottom < 0 ? null : RangeRef.of(top, left, bottom, right);
    }

    /** Moves every cell at or below {@code index} down one row; the last row falls off. */
    public void insertRow(int index) {
        renumber(ref -> ref.row() >= index ? shifted(ref.row() + 1, ref.col()) : ref);
    }

    /** Removes row {@code index} and moves the rows below it up. */
    public void deleteRow(int index) {
        renumber(ref -> ref.row() == index ? null : ref.row() > index ? shifted(ref.row() - 1, ref.col()) : ref);
    }

    public void insertCol(int index) {
        renumber(ref -> ref.col() >= index ? shifted(ref.row(), ref.col() + 1) : ref);
    }

    public void deleteCol(int index) {
        renumber(ref -> ref.col() == index ? null : ref.col() > index ? shifted(ref.row(), ref.col() - 1) : ref);
    }

    private CellRef shifted(int row, int col) {
        return row < maxRows && col < maxCols ? new CellRef(row, col) : null;
    }

    private void renumber(Function<CellRef, CellRef> mapping) {
        NavigableMap<CellRef, Cell> moved = new TreeMap<>();
        for (Map.Entry<CellRef, Cell> e : cells.entrySet()) {
            CellRef target = mapping.apply(e.getKey());
            if (target != null)
                moved.put(target, e.getValue());
        }
        cells.clear();
        cells.putAll(moved);
    }
}

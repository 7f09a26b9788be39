package com.gridcalc.sheet;

import com.gridcalc.api.Value;
import com.gridcalc.engine.CellState;

/**
 * One grid cell: raw text as typed, its parsed content, format and protection,
 * and the value cache maintained by the recalculation engine.
 *
 * Owned by the {@link CellStore}; never shared between sheets. Cache and
 * state mutators are package-private; the engine reaches them through the store.
 */
public final class Cell {

    private String rawText = "";
    private CellContent content = CellContent.EMPTY;
    private String formatCode;
    private boolean protectedCell = true;

    private Value cachedValue;
    private String cachedDisplay;
    private CellState state = CellState.CLEAN;

    public String rawText() {
        return rawText;
    }

    public CellContent content() {
        return content;
    }

    public boolean isFormula() {
        return content.isFormula();
    }

    /** Replaces the text and drops the caches. */
    void setRawText(String raw) {
        this.rawText = raw == null ? "" : raw;
        this.content = CellContent.parse(this.rawText);
        invalidate();
    }

    /** Null means the sheet's default format. */
    public String formatCode() {
        return formatCode;
    }

    void setFormatCode(String formatCode) {
        this.formatCode = formatCode;
        this.cachedDisplay = null;
    }

    public boolean isProtected() {
        return protectedCell;
    }

    void setProtected(boolean protectedCell) {
        this.protectedCell = protectedCell;
    }

    /** The cached value, or null when there is none. */
    public Value cachedValue() {
        return cachedValue;
    }

    void cache(Value value) {
        this.cachedValue = value;
        this.cachedDisplay = null;
    }

    public String cachedDisplay() {
        return cachedDisplay;
    }

    void cacheDisplay(String display) {
        this.cachedDisplay = display;
    }

    void invalidate() {
        this.cachedValue = null;
        this.cachedDisplay = null;
    }

    public CellState state() {
        return state;
    }

    void setState(CellState state) {
        this.state = state;
    }

    /** True when the cell carries nothing worth keeping in the store. */
    boolean isDisposable() {
        return content.isEmpty() && formatCode == null && protectedCell;
    }

    /** Copies text, format and protection; caches are not copied. */
    Cell copy() {
        Cell c = new Cell();
        c.rawText = rawText;
        c.content = content;
        c.formatCode = formatCode;
        c.protectedCell = protectedCell;
        return c;
    }

    @Override
    public String toString() {
        return "Cell{" + rawText + ", " + state + (cachedValue != null ? ", =" + cachedValue : "") + "}";
    }
}

package com.gridcalc.sheet;

import com.gridcalc.api.CellProtectedException;
import com.gridcalc.api.CellRef;
import com.gridcalc.api.RangeRef;
import com.gridcalc.api.RecalcListener;
import com.gridcalc.api.Value;
import com.gridcalc.engine.RecalcEngine;
import com.gridcalc.engine.RecalcMode;
import com.gridcalc.engine.RecalcOrder;
import com.gridcalc.engine.RecalcStats;
import com.gridcalc.fn.FunctionRegistry;
import com.gridcalc.format.FormatTable;
import com.gridcalc.formula.FormulaEvaluator;
import com.gridcalc.formula.ReferenceRewriter;
import com.gridcalc.formula.ReferenceRewriter.Axis;
import com.gridcalc.io.SheetConfig;
import com.gridcalc.util.CellRefs;
import com.gridcalc.util.CompositeRecalcListener;
import com.gridcalc.util.RecalcLatencyListener;
import com.gridcalc.util.RecalcProfileListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A worksheet: the cell grid, its formulas and their values.
 *
 * <p>
 * All access goes through this facade. Writes, and reads that may evaluate
 * formulas (evaluation fills caches), take the write lock; pure introspection
 * takes the read lock. A structural edit rewrites formulas, moves cells and
 * rebuilds the dependency graph inside a single write-locked section, so no
 * reader ever sees it half done.
 *
 * <p>
 * Rows and columns are zero-based throughout.
 */
public final class Sheet {
    private static final Logger log = LogManager.getLogger(Sheet.class);

    private final SheetConfig config;
    private final CellStore store;
    private final RecalcEngine engine;
    private final ReferenceRewriter rewriter = new ReferenceRewriter();
    private final FormatTable formats;
    private final NamedRanges names;
    private final CompositeRecalcListener listeners = new CompositeRecalcListener();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private boolean protectionEnabled;
    private String defaultFormat;
    private RecalcProfileListener profiler;
    private RecalcLatencyListener latencyTracker;

    public Sheet() {
        this(new SheetConfig());
    }

    public Sheet(SheetConfig config) {
        this(config, new FunctionRegistry(config.getErrorLogIntervalMillis()), new FormatTable());
    }

    public Sheet(SheetConfig config, FunctionRegistry functions, FormatTable formats) {
        config.validate();
        this.config = config;
        this.formats = formats;
        this.store = new CellStore(config.getMaxRows(), config.getMaxCols());
        this.engine = new RecalcEngine(store, new FormulaEvaluator(functions), config.getErrorLogIntervalMillis());
        this.names = new NamedRanges(this::namesChanged);
        this.protectionEnabled = config.isProtectionEnabled();
        this.defaultFormat = FormatTable.normalize(config.getDefaultFormat());
        engine.setListener(listeners);
        engine.setNameResolver(names::get);
        engine.setMode(config.getRecalcMode());
        engine.setOrder(config.getRecalcOrder());
        log.info("Sheet created: {} rows x {} columns, {} / {}", config.getMaxRows(), config.getMaxCols(),
                config.getRecalcMode(), config.getRecalcOrder());
    }

    // ── Cells ───────────────────────────────────────────────────────

    /** The cell at the coordinate, created empty if absent. */
    public Cell getCell(int row, int col) {
        lock.writeLock().lock();
        try {
            return store.getOrCreate(new CellRef(row, col));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** @return the cell, or null when nothing was ever written there. */
    public Cell getCellIfExists(int row, int col) {
        lock.readLock().lock();
        try {
            return store.get(new CellRef(row, col));
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setCell(int row, int col, String text) {
        setCell(new CellRef(row, col), text);
    }

    /** Writes raw text, e.g. {@code "42"}, {@code "'label"} or {@code "=SUM(A1:A3)"}. */
    public void setCell(CellRef ref, String text) {
        lock.writeLock().lock();
        try {
            store.validate(ref);
            checkWritable(ref);
            store.set(ref, text);
            engine.cellChanged(ref);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setCell(String a1, String text) {
        setCell(CellRefs.parseCellRef(a1), text);
    }

    public void clearCell(int row, int col) {
        setCell(new CellRef(row, col), "");
    }

    public String getRawText(int row, int col) {
        lock.readLock().lock();
        try {
            Cell cell = store.get(new CellRef(row, col));
            return cell == null ? "" : cell.rawText();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Values ──────────────────────────────────────────────────────

    public Value getValue(int row, int col) {
        return getValue(new CellRef(row, col));
    }

    public Value getValue(String a1) {
        return getValue(CellRefs.parseCellRef(a1));
    }

    /** Evaluates on demand when there is no cached value; in manual mode the value may be stale. */
    public Value getValue(CellRef ref) {
        lock.writeLock().lock();
        try {
            return engine.value(ref);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** The value rendered through the cell's format, or the sheet default. */
    public String getDisplayValue(int row, int col) {
        CellRef ref = new CellRef(row, col);
        lock.writeLock().lock();
        try {
            Cell cell = store.get(ref);
            if (cell == null)
                return "";
            Value value = engine.value(ref);
            String display = cell.cachedDisplay();
            if (display == null) {
                String code = cell.formatCode() != null ? cell.formatCode() : defaultFormat;
                display = formats.resolve(code).format(value);
                cell.cacheDisplay(display);
            }
            return display;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Values of the range by row then column, empty cells included. */
    public Value[][] getRange(RangeRef range) {
        lock.writeLock().lock();
        try {
            checkArea(range);
            Value[][] out = new Value[range.rowCount()][range.colCount()];
            for (int r = 0; r < range.rowCount(); r++)
                for (int c = 0; c < range.colCount(); c++)
                    out[r][c] = engine.value(new CellRef(range.start().row() + r, range.start().col() + c));
            return out;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Value> getRangeFlat(RangeRef range) {
        lock.writeLock().lock();
        try {
            checkArea(range);
            List<Value> out = new ArrayList<>((int) range.area());
            for (int r = range.start().row(); r <= range.end().row(); r++)
                for (int c = range.start().col(); c <= range.end().col(); c++)
                    out.add(engine.value(new CellRef(r, c)));
            return out;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void checkArea(RangeRef range) {
        store.validate(range.end());
        if (range.area() > Integer.MAX_VALUE - 8)
            throw new IllegalArgumentException("Range too large to materialize: " + range);
    }

    // ── Structural edits ────────────────────────────────────────────

    public void insertRow(int index) {
        structuralEdit(Axis.ROW, index, true);
    }

    public void deleteRow(int index) {
        structuralEdit(Axis.ROW, index, false);
    }

    public void insertCol(int index) {
        structuralEdit(Axis.COLUMN, index, true);
    }

    public void deleteCol(int index) {
        structuralEdit(Axis.COLUMN, index, false);
    }

    private void structuralEdit(Axis axis, int index, boolean insert) {
        int limit = axis == Axis.ROW ? store.maxRows() : store.maxCols();
        if (index < 0 || index >= limit)
            throw new IllegalArgumentException((axis == Axis.ROW ? "Row " : "Column ") + index + " is outside the sheet");
        int maxRow = store.maxRows() - 1, maxCol = store.maxCols() - 1;
        lock.writeLock().lock();
        try {
            if (protectionEnabled)
                throw new CellProtectedException("Sheet is protected; " + (insert ? "insert" : "delete") + " of "
                        + axis.name().toLowerCase() + " " + index + " rejected");
            int rewritten = 0;
            for (CellRef ref : store.formulaCells()) {
                Cell cell = store.get(ref);
                String raw = cell.rawText();
                String moved = insert ? rewriter.adjustForInsert(raw, axis, index, maxRow, maxCol)
                        : rewriter.adjustForDelete(raw, axis, index, maxRow, maxCol);
                if (!moved.equals(raw)) {
                    cell.setRawText(moved);
                    rewritten++;
                }
            }
            if (axis == Axis.ROW) {
                if (insert)
                    store.insertRow(index);
                else
                    store.deleteRow(index);
            } else {
                if (insert)
                    store.insertCol(index);
                else
                    store.deleteCol(index);
            }
            if (insert)
                names.adjustForInsert(axis, index, maxRow, maxCol);
            else
                names.adjustForDelete(axis, index);
            log.info("{} {} {}: {} formulas rewritten", insert ? "Inserted" : "Deleted", axis.name().toLowerCase(),
                    index, rewritten);
            engine.rebuild();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ── Copy and fill ───────────────────────────────────────────────

    /** Copies text, format and protection; relative references shift by the offset. */
    public void copyCell(CellRef from, CellRef to) {
        copyRange(RangeRef.of(from), to);
    }

    /**
     * Copies a block so that its top-left corner lands on {@code to}. Every
     * target is computed from the source before any is written, so the two
     * may overlap.
     */
    public void copyRange(RangeRef source, CellRef to) {
        lock.writeLock().lock();
        try {
            int dRow = to.row() - source.start().row();
            int dCol = to.col() - source.start().col();
            store.validate(new CellRef(source.end().row() + dRow, source.end().col() + dCol));
            Map<CellRef, Cell> targets = new LinkedHashMap<>();
            for (int r = source.start().row(); r <= source.end().row(); r++)
                for (int c = source.start().col(); c <= source.end().col(); c++)
                    targets.put(new CellRef(r + dRow, c + dCol), shiftedCopy(new CellRef(r, c), dRow, dCol));
            for (CellRef target : targets.keySet())
                checkWritable(target);
            writeAll(targets);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Copies the top row of the range into every other row of it. */
    public void fillDown(RangeRef range) {
        lock.writeLock().lock();
        try {
            store.validate(range.end());
            Map<CellRef, Cell> targets = new LinkedHashMap<>();
            int top = range.start().row();
            for (int r = top + 1; r <= range.end().row(); r++)
                for (int c = range.start().col(); c <= range.end().col(); c++)
                    targets.put(new CellRef(r, c), shiftedCopy(new CellRef(top, c), r - top, 0));
            for (CellRef target : targets.keySet())
                checkWritable(target);
            writeAll(targets);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Copies the left column of the range into every other column of it. */
    public void fillRight(RangeRef range) {
        lock.writeLock().lock();
        try {
            store.validate(range.end());
            Map<CellRef, Cell> targets = new LinkedHashMap<>();
            int left = range.start().col();
            for (int r = range.start().row(); r <= range.end().row(); r++)
                for (int c = left + 1; c <= range.end().col(); c++)
                    targets.put(new CellRef(r, c), shiftedCopy(new CellRef(r, left), 0, c - left));
            for (CellRef target : targets.keySet())
                checkWritable(target);
            writeAll(targets);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** A detached copy of the source cell with its formula shifted, or null when the source is absent. */
    private Cell shiftedCopy(CellRef source, int dRow, int dCol) {
        Cell src = store.get(source);
        if (src == null)
            return null;
        Cell copy = src.copy();
        if (src.isFormula())
            copy.setRawText(rewriter.adjust(src.rawText(), dRow, dCol, store.maxRows() - 1, store.maxCols() - 1));
        return copy;
    }

    private void writeAll(Map<CellRef, Cell> targets) {
        for (Map.Entry<CellRef, Cell> e : targets.entrySet()) {
            Cell src = e.getValue();
            if (src == null) {
                store.set(e.getKey(), "");
                continue;
            }
            Cell target = store.getOrCreate(e.getKey());
            target.setRawText(src.rawText());
            target.setFormatCode(src.formatCode());
            target.setProtected(src.isProtected());
            store.compact(e.getKey());
        }
        engine.cellsChanged(new ArrayList<>(targets.keySet()));
    }

    // ── Formats ─────────────────────────────────────────────────────

    /** Sets the cell's format code; null restores the sheet default. */
    public void setFormat(CellRef ref, String code) {
        setRangeFormat(RangeRef.of(ref), code);
    }

    public void setRangeFormat(RangeRef range, String code) {
        if (code != null && !formats.isValid(code))
            throw new IllegalArgumentException("Unknown format code: " + code);
        String normalized = code == null ? null : FormatTable.normalize(code);
        lock.writeLock().lock();
        try {
            store.validate(range.end());
            for (int r = range.start().row(); r <= range.end().row(); r++) {
                for (int c = range.start().col(); c <= range.end().col(); c++) {
                    CellRef ref = new CellRef(r, c);
                    if (normalized == null && !store.contains(ref))
                        continue;
                    store.getOrCreate(ref).setFormatCode(normalized);
                    store.compact(ref);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String getDefaultFormat() {
        lock.readLock().lock();
        try {
            return defaultFormat;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setDefaultFormat(String code) {
        if (!formats.isValid(code))
            throw new IllegalArgumentException("Unknown format code: " + code);
        lock.writeLock().lock();
        try {
            defaultFormat = FormatTable.normalize(code);
            for (Cell cell : store.cells().values())
                cell.cacheDisplay(null);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public FormatTable formats() {
        return formats;
    }

    // ── Protection ──────────────────────────────────────────────────

    public boolean isProtectionEnabled() {
        lock.readLock().lock();
        try {
            return protectionEnabled;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setProtectionEnabled(boolean enabled) {
        lock.writeLock().lock();
        try {
            this.protectionEnabled = enabled;
            log.info("Sheet protection {}", enabled ? "enabled" : "disabled");
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Marks the range protected or unprotected. Allowed while protection is on. */
    public void setProtected(RangeRef range, boolean protect) {
        lock.writeLock().lock();
        try {
            store.validate(range.end());
            for (int r = range.start().row(); r <= range.end().row(); r++) {
                for (int c = range.start().col(); c <= range.end().col(); c++) {
                    CellRef ref = new CellRef(r, c);
                    if (protect && !store.contains(ref))
                        continue;
                    store.getOrCreate(ref).setProtected(protect);
                    store.compact(ref);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void checkWritable(CellRef ref) {
        if (!protectionEnabled)
            return;
        Cell cell = store.get(ref);
        if (cell == null || cell.isProtected())
            throw new CellProtectedException(ref);
    }

    // ── Named ranges ────────────────────────────────────────────────

    public NamedRanges namedRanges() {
        return names;
    }

    private void namesChanged() {
        lock.writeLock().lock();
        try {
            engine.rebuild();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ── Recalculation ───────────────────────────────────────────────

    public RecalcMode getRecalcMode() {
        lock.readLock().lock();
        try {
            return engine.mode();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setRecalcMode(RecalcMode mode) {
        lock.writeLock().lock();
        try {
            engine.setMode(mode);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public RecalcOrder getRecalcOrder() {
        lock.readLock().lock();
        try {
            return engine.order();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setRecalcOrder(RecalcOrder order) {
        lock.writeLock().lock();
        try {
            engine.setOrder(order);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public RecalcStats recalculate() {
        lock.writeLock().lock();
        try {
            return engine.recalculate();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public RecalcStats recalculateAll() {
        lock.writeLock().lock();
        try {
            return engine.recalculateAll();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean needsRecalc() {
        lock.readLock().lock();
        try {
            return engine.needsRecalc();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasCircularRefs() {
        lock.readLock().lock();
        try {
            return engine.hasCircularRefs();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<CellRef> circularReferences() {
        lock.readLock().lock();
        try {
            return engine.circularReferences();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Defers automatic recalculation until the matching {@link #endBatch()}. */
    public void beginBatch() {
        lock.writeLock().lock();
        try {
            engine.beginBatch();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** @return stats of the recalculation run at the close of the outermost batch, or null. */
    public RecalcStats endBatch() {
        lock.writeLock().lock();
        try {
            return engine.endBatch();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long epoch() {
        lock.readLock().lock();
        try {
            return engine.epoch();
        } finally {
            lock.readLock().unlock();
        }
    }

    public RecalcStats lastStats() {
        lock.readLock().lock();
        try {
            return engine.lastStats();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Introspection ───────────────────────────────────────────────

    /** References the formula at {@code ref} reads, as written; empty for non-formulas. */
    public List<RangeRef> dependenciesOf(CellRef ref) {
        lock.readLock().lock();
        try {
            return engine.graph().edges(ref);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Formula cells that read {@code ref} directly. */
    public Set<CellRef> dependentsOf(CellRef ref) {
        lock.readLock().lock();
        try {
            return engine.graph().directDependents(ref);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** @return the smallest range holding every non-empty cell, or null for an empty sheet. */
    public RangeRef usedRange() {
        lock.readLock().lock();
        try {
            return store.usedRange();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Coordinates of every formula cell, row-major. */
    public List<CellRef> formulaCells() {
        lock.readLock().lock();
        try {
            return store.formulaCells();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int cellCount() {
        lock.readLock().lock();
        try {
            return store.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int maxRows() {
        return store.maxRows();
    }

    public int maxCols() {
        return store.maxCols();
    }

    public SheetConfig config() {
        return config;
    }

    public FunctionRegistry functions() {
        return engine.evaluator().functions();
    }

    // ── Listeners ───────────────────────────────────────────────────

    public void addListener(RecalcListener listener) {
        lock.writeLock().lock();
        try {
            listeners.addForComposite(listener);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Starts per-cell profiling on first call; later calls return the same profiler. */
    public RecalcProfileListener enableProfiling() {
        lock.writeLock().lock();
        try {
            if (profiler == null) {
                profiler = new RecalcProfileListener();
                listeners.addForComposite(profiler);
            }
            return profiler;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public RecalcLatencyListener enableLatencyTracking() {
        lock.writeLock().lock();
        try {
            if (latencyTracker == null) {
                latencyTracker = new RecalcLatencyListener();
                listeners.addForComposite(latencyTracker);
            }
            return latencyTracker;
        } finally {
            lock.writeLock().unlock();
        }
    }
}

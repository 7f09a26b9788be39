package com.gridcalc.sheet;

import com.gridcalc.api.RangeRef;
import com.gridcalc.formula.ReferenceRewriter;
import com.gridcalc.formula.ReferenceRewriter.Axis;
import com.gridcalc.util.CellRefs;

import java.util.Collections;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Names for ranges, usable in formulas in place of the range itself.
 *
 * Names are case-insensitive and stored upper case. A name must start with a
 * letter, continue with letters, digits or underscores, and must not read as
 * a cell reference ({@code AB12} is not a legal name).
 *
 * Every change runs the change hook after the table has been updated, outside
 * this object's monitor, so the owning sheet can re-resolve its formulas.
 */
public final class NamedRanges {
    private static final Pattern NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

    private final Map<String, RangeRef> ranges = new TreeMap<>();
    private final Runnable onChange;

    public NamedRanges() {
        this(() -> {
        });
    }

    public NamedRanges(Runnable onChange) {
        this.onChange = onChange;
    }

    public static boolean isValidName(String name) {
        return name != null && NAME.matcher(name).matches() && !CellRefs.isCellRef(name);
    }

    /** Defines or redefines a name. */
    public void define(String name, RangeRef range) {
        if (!isValidName(name))
            throw new IllegalArgumentException("Invalid range name: " + name);
        if (range == null)
            throw new IllegalArgumentException("Range must not be null for name " + name);
        synchronized (this) {
            ranges.put(key(name), range);
        }
        onChange.run();
    }

    public void define(String name, String rangeText) {
        define(name, CellRefs.parseRangeRef(rangeText));
    }

    /** @return true if the name existed. */
    public boolean remove(String name) {
        boolean removed;
        synchronized (this) {
            removed = name != null && ranges.remove(key(name)) != null;
        }
        if (removed)
            onChange.run();
        return removed;
    }

    /** @return the range, or null when the name is not defined. */
    public synchronized RangeRef get(String name) {
        return name == null ? null : ranges.get(key(name));
    }

    public synchronized boolean contains(String name) {
        return name != null && ranges.containsKey(key(name));
    }

    /** Snapshot, sorted by name. */
    public synchronized Map<String, RangeRef> asMap() {
        return Collections.unmodifiableMap(new TreeMap<>(ranges));
    }

    public synchronized int size() {
        return ranges.size();
    }

    public void clear() {
        synchronized (this) {
            ranges.clear();
        }
        onChange.run();
    }

    /**
     * Follows a row or column insert. Names pushed off the sheet are dropped.
     * Does not run the change hook; the caller rebuilds anyway.
     */
    synchronized void adjustForInsert(Axis axis, int index, int maxRow, int maxCol) {
        ranges.replaceAll((name, range) -> ReferenceRewriter.adjustRangeForInsert(range, axis, index, maxRow, maxCol));
        ranges.values().removeIf(r -> r == null);
    }

    /** Follows a row or column delete. Names whose every cell was deleted are dropped. */
    synchronized void adjustForDelete(Axis axis, int index) {
        for (Iterator<Map.Entry<String, RangeRef>> it = ranges.entrySet().iterator(); it.hasNext();) {
            Map.Entry<String, RangeRef> e = it.next();
            RangeRef moved = ReferenceRewriter.adjustRangeForDelete(e.getValue(), axis, index);
            if (moved == null)
                it.remove();
            else
                e.setValue(moved);
        }
    }

    private static String key(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}

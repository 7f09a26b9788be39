package com.gridcalc.util;

import com.gridcalc.api.CellRef;
import com.gridcalc.api.RangeRef;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless A1-notation helpers.
 *
 * Columns are letters (A=0, Z=25, AA=26, ...), rows are one-based in text and
 * zero-based in {@link CellRef}. A reference may carry {@code $} anchors on
 * either component; they matter only to formula rewriting.
 */
public final class CellRefs {

    /** At most three column letters: beyond IV the grid has no columns anyway. */
    private static final Pattern CELL_REF = Pattern.compile("^(\\$?)([A-Za-z]{1,3})(\\$?)(\\d{1,7})$");

    private CellRefs() {
    }

    /** A1 text with its anchors, as it appears inside a formula. */
    public record ParsedRef(int row, int col, boolean colAbsolute, boolean rowAbsolute) {

        public CellRef toCellRef() {
            return new CellRef(row, col);
        }

        public ParsedRef withPosition(int newRow, int newCol) {
            return new ParsedRef(newRow, newCol, colAbsolute, rowAbsolute);
        }

        public String format() {
            return (colAbsolute ? "$" : "") + indexToCol(col) + (rowAbsolute ? "$" : "") + (row + 1);
        }
    }

    /**
     * Parses reference text keeping its anchors.
     *
     * @return the parsed reference, or null if the text is not shaped like a
     *         cell reference.
     */
    public static ParsedRef parseAnchored(String text) {
        if (text == null)
            return null;
        Matcher m = CELL_REF.matcher(text.trim());
        if (!m.matches())
            return null;
        int row = Integer.parseInt(m.group(4)) - 1;
        if (row < 0)
            return null;
        return new ParsedRef(row, colToIndex(m.group(2)), !m.group(1).isEmpty(), !m.group(3).isEmpty());
    }

    public static boolean isCellRef(String text) {
        return parseAnchored(text) != null;
    }

    public static CellRef parseCellRef(String text) {
        ParsedRef parsed = parseAnchored(text);
        if (parsed == null)
            throw new IllegalArgumentException("Invalid cell reference: " + text);
        return parsed.toCellRef();
    }

    /** Accepts {@code A1:B2}, the Lotus form {@code A1..B2}, or a single cell. */
    public static RangeRef parseRangeRef(String text) {
        if (text == null)
            throw new IllegalArgumentException("Invalid range reference: null");
        String t = text.trim();
        int sep = t.indexOf("..");
        int sepLen = 2;
        if (sep < 0) {
            sep = t.indexOf(':');
            sepLen = 1;
        }
        if (sep < 0)
            return RangeRef.of(parseCellRef(t));
        return new RangeRef(parseCellRef(t.substring(0, sep)), parseCellRef(t.substring(sep + sepLen)));
    }

    public static String makeCellRef(int row, int col) {
        if (row < 0 || col < 0)
            throw new IllegalArgumentException("Negative cell coordinate: (" + row + ", " + col + ")");
        return indexToCol(col) + (row + 1);
    }

    public static int colToIndex(String letters) {
        if (letters == null || letters.isEmpty())
            throw new IllegalArgumentException("Empty column name");
        int result = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z')
                throw new IllegalArgumentException("Invalid column name: " + letters);
            result = result * 26 + (c - 'A' + 1);
        }
        return result - 1;
    }

    public static String indexToCol(int index) {
        if (index < 0)
            throw new IllegalArgumentException("Negative column index: " + index);
        StringBuilder sb = new StringBuilder(3);
        int n = index + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }
}

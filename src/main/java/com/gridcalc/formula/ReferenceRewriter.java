package com.gridcalc.formula;

import com.gridcalc.api.ErrorKind;
import com.gridcalc.api.RangeRef;
import com.gridcalc.util.CellRefs;
import com.gridcalc.util.CellRefs.ParsedRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites the cell references inside formula text when geometry changes.
 *
 * Only CELL tokens are touched; everything else (string literals, function
 * names, spacing, the {@code ..} or {@code :} separator) is copied through
 * verbatim. {@code maxRow} and {@code maxCol} are the largest valid zero-based
 * indices of the sheet.
 */
public final class ReferenceRewriter {

    public enum Axis {
        ROW, COLUMN
    }

    private static final String REF_ERROR = ErrorKind.REF.tag();

    private final FormulaLexer lexer;

    public ReferenceRewriter() {
        this(new FormulaLexer());
    }

    public ReferenceRewriter(FormulaLexer lexer) {
        this.lexer = lexer;
    }

    /**
     * Relative shift for copy and fill. {@code $}-anchored components stay,
     * others move by the delta and are clamped into the sheet.
     */
    public String adjust(String formula, int rowDelta, int colDelta, int maxRow, int maxCol) {
        if (rowDelta == 0 && colDelta == 0)
            return formula;
        List<Token> tokens = lexer.tokenize(formula);
        List<Splice> splices = new ArrayList<>();
        for (Token t : tokens) {
            if (!t.is(TokenType.CELL))
                continue;
            ParsedRef ref = CellRefs.parseAnchored(t.text());
            int row = ref.rowAbsolute() ? ref.row() : clamp(ref.row() + rowDelta, maxRow);
            int col = ref.colAbsolute() ? ref.col() : clamp(ref.col() + colDelta, maxCol);
            splices.add(new Splice(t.start(), t.end(), ref.withPosition(row, col).format()));
        }
        return apply(formula, splices);
    }

    /**
     * A row or column was inserted before {@code index}. Every reference at or
     * beyond it moves by one, anchored or not, because the cells moved. A lone
     * reference pushed off the sheet becomes {@code #REF!}; a range is cut at
     * the sheet edge.
     */
    public String adjustForInsert(String formula, Axis axis, int index, int maxRow, int maxCol) {
        return rewriteStructural(formula, axis, insertShift(index, axis == Axis.ROW ? maxRow : maxCol));
    }

    /**
     * The row or column at {@code index} was deleted. References past it move
     * back by one. A reference to the deleted line becomes {@code #REF!}; a
     * range spanning it shrinks, and becomes {@code #REF!} only when every cell
     * it covered is gone.
     */
    public String adjustForDelete(String formula, Axis axis, int index, int maxRow, int maxCol) {
        return rewriteStructural(formula, axis, deleteShift(index));
    }

    /** The range after an insert, or null when it was pushed off the sheet. */
    public static RangeRef adjustRangeForInsert(RangeRef range, Axis axis, int index, int maxRow, int maxCol) {
        return shiftRange(range, axis, insertShift(index, axis == Axis.ROW ? maxRow : maxCol));
    }

    /** The range after a delete, or null when every cell it covered is gone. */
    public static RangeRef adjustRangeForDelete(RangeRef range, Axis axis, int index) {
        return shiftRange(range, axis, deleteShift(index));
    }

    private static Shift insertShift(int index, int max) {
        return (lo, hi, isRange) -> {
            int newLo = lo >= index ? lo + 1 : lo;
            int newHi = hi >= index ? hi + 1 : hi;
            if (newLo > max)
                return null;
            return new int[] { newLo, Math.min(newHi, max) };
        };
    }

    private static Shift deleteShift(int index) {
        return (lo, hi, isRange) -> {
            if (lo == index && hi == index)
                return null;
            int newLo = lo > index ? lo - 1 : lo;
            int newHi = hi >= index ? hi - 1 : hi;
            return new int[] { newLo, newHi };
        };
    }

    private static RangeRef shiftRange(RangeRef range, Axis axis, Shift shift) {
        boolean rows = axis == Axis.ROW;
        int lo = rows ? range.start().row() : range.start().col();
        int hi = rows ? range.end().row() : range.end().col();
        int[] span = shift.apply(lo, hi, !range.isSingleCell());
        if (span == null || (range.isSingleCell() && span[0] != span[1]))
            return null;
        return rows
                ? RangeRef.of(span[0], range.start().col(), span[1], range.end().col())
                : RangeRef.of(range.start().row(), span[0], range.end().row(), span[1]);
    }

    @FunctionalInterface
    private interface Shift {
        /** @return the new [lo, hi] along the axis, or null for {@code #REF!}. */
        int[] apply(int lo, int hi, boolean isRange);
    }

    private String rewriteStructural(String formula, Axis axis, Shift shift) {
        List<Token> tokens = lexer.tokenize(formula);
        List<Splice> splices = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (!t.is(TokenType.CELL))
                continue;
            ParsedRef a = CellRefs.parseAnchored(t.text());
            if (i + 2 < tokens.size() && tokens.get(i + 1).is(TokenType.COLON)
                    && tokens.get(i + 2).is(TokenType.CELL)) {
                Token endToken = tokens.get(i + 2);
                ParsedRef b = CellRefs.parseAnchored(endToken.text());
                i += 2;
                // the written corners may be in any order; shift the bounding box
                boolean aFirst = axis == Axis.ROW ? a.row() <= b.row() : a.col() <= b.col();
                ParsedRef first = aFirst ? a : b;
                ParsedRef second = aFirst ? b : a;
                int[] span = shift.apply(coord(first, axis), coord(second, axis), true);
                if (span == null) {
                    splices.add(new Splice(t.start(), endToken.end(), REF_ERROR));
                    continue;
                }
                ParsedRef newFirst = move(first, axis, span[0]);
                ParsedRef newSecond = move(second, axis, span[1]);
                splices.add(new Splice(t.start(), t.end(), (aFirst ? newFirst : newSecond).format()));
                splices.add(new Splice(endToken.start(), endToken.end(), (aFirst ? newSecond : newFirst).format()));
            } else {
                int c = coord(a, axis);
                int[] span = shift.apply(c, c, false);
                if (span == null || span[0] != span[1])
                    splices.add(new Splice(t.start(), t.end(), REF_ERROR));
                else
                    splices.add(new Splice(t.start(), t.end(), move(a, axis, span[0]).format()));
            }
        }
        return apply(formula, splices);
    }

    private static int coord(ParsedRef ref, Axis axis) {
        return axis == Axis.ROW ? ref.row() : ref.col();
    }

    private static ParsedRef move(ParsedRef ref, Axis axis, int to) {
        return axis == Axis.ROW ? ref.withPosition(to, ref.col()) : ref.withPosition(ref.row(), to);
    }

    private static int clamp(int v, int max) {
        return Math.max(0, Math.min(max, v));
    }

    private record Splice(int start, int end, String text) {
    }

    private static String apply(String formula, List<Splice> splices) {
        if (splices.isEmpty())
            return formula;
        StringBuilder sb = new StringBuilder(formula.length() + 8);
        int copied = 0;
        for (Splice s : splices) {
            sb.append(formula, copied, s.start()).append(s.text());
            copied = s.end();
        }
        return sb.append(formula, copied, formula.length()).toString();
    }
}

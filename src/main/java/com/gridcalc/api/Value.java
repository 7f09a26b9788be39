package com.gridcalc.api;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of evaluating a cell.
 *
 * A tagged union of EMPTY, NUMBER, TEXT and ERROR. Logical results are plain
 * numbers (1 for true, 0 for false), as in the classic spreadsheet products.
 *
 * Numbers are never NaN or infinite: {@link #number(double)} turns such
 * results into {@code ERROR(NUM)} so a broken calculation cannot leak into
 * dependents as a silent NaN.
 */
public final class Value {

    public enum Kind {
        EMPTY, NUMBER, TEXT, ERROR
    }

    public static final Value EMPTY = new Value(Kind.EMPTY, 0.0, null, null);
    public static final Value TRUE = new Value(Kind.NUMBER, 1.0, null, null);
    public static final Value FALSE = new Value(Kind.NUMBER, 0.0, null, null);
    public static final Value ZERO = FALSE;

    private static final Map<ErrorKind, Value> ERRORS = new EnumMap<>(ErrorKind.class);

    static {
        for (ErrorKind kind : ErrorKind.values())
            ERRORS.put(kind, new Value(Kind.ERROR, 0.0, null, kind));
    }

    private final Kind kind;
    private final double number;
    private final String text;
    private final ErrorKind error;

    private Value(Kind kind, double number, String text, ErrorKind error) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.error = error;
    }

    public static Value number(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d))
            return ERRORS.get(ErrorKind.NUM);
        return new Value(Kind.NUMBER, d, null, null);
    }

    public static Value text(String s) {
        Objects.requireNonNull(s, "text");
        return new Value(Kind.TEXT, 0.0, s, null);
    }

    public static Value error(ErrorKind kind) {
        return ERRORS.get(Objects.requireNonNull(kind, "kind"));
    }

    public static Value bool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    public boolean isError(ErrorKind expected) {
        return kind == Kind.ERROR && error == expected;
    }

    /** The numeric payload; 0 for anything that is not a NUMBER. */
    public double number() {
        return number;
    }

    /** The text payload; null for anything that is not TEXT. */
    public String text() {
        return text;
    }

    /** The error tag; null for anything that is not an ERROR. */
    public ErrorKind error() {
        return error;
    }

    /**
     * Human readable form using general formatting: integral numbers without a
     * fraction, errors as their tag, empty as the empty string.
     */
    @Override
    public String toString() {
        switch (kind) {
            case NUMBER:
                return formatGeneral(number);
            case TEXT:
                return text;
            case ERROR:
                return error.tag();
            default:
                return "";
        }
    }

    public static String formatGeneral(double d) {
        if (d == Math.rint(d) && Math.abs(d) < 1e15)
            return Long.toString((long) d);
        String s = String.format("%.10f", d);
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '0')
            end--;
        if (end > 0 && s.charAt(end - 1) == '.')
            end--;
        return s.substring(0, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Value other))
            return false;
        return kind == other.kind
                && Double.compare(number, other.number) == 0
                && Objects.equals(text, other.text)
                && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number, text, error);
    }
}

package com.gridcalc.fn;

import com.gridcalc.api.ErrorKind;
import com.gridcalc.api.Value;

/**
 * Operand conversions shared by operators and built-in functions.
 *
 * Each conversion returns a Value: either the converted value or the error that
 * stops the computation, so callers test {@link Value#isError()} and return
 * early. Errors always propagate unchanged.
 */
public final class Coercions {

    private Coercions() {
    }

    /** Empty is 0, numeric text parses, other text is {@code #ERR!}. */
    public static Value asNumber(Value v) {
        switch (v.kind()) {
            case NUMBER:
            case ERROR:
                return v;
            case EMPTY:
                return Value.ZERO;
            default:
                Double d = parseNumber(v.text());
                return d == null ? Value.error(ErrorKind.GENERIC) : Value.number(d);
        }
    }

    /** Empty is "", numbers use general formatting. */
    public static Value asText(Value v) {
        switch (v.kind()) {
            case TEXT:
            case ERROR:
                return v;
            case EMPTY:
                return Value.text("");
            default:
                return Value.text(Value.formatGeneral(v.number()));
        }
    }

    /** Logical view: non-zero numbers are true; TRUE/FALSE text is accepted. */
    public static Value asBoolean(Value v) {
        if (v.isText()) {
            String t = v.text().trim();
            if (t.equalsIgnoreCase("TRUE"))
                return Value.TRUE;
            if (t.equalsIgnoreCase("FALSE"))
                return Value.FALSE;
        }
        Value n = asNumber(v);
        if (n.isError())
            return n;
        return Value.bool(n.number() != 0.0);
    }

    /** Whole-number argument, truncated toward zero. */
    public static Value asInt(Value v) {
        Value n = asNumber(v);
        if (n.isError())
            return n;
        return Value.number((long) n.number());
    }

    /**
     * Parses plain numeric text, tolerating surrounding blanks.
     *
     * @return the number, or null if the text is not numeric.
     */
    public static Double parseNumber(String text) {
        if (text == null)
            return null;
        String t = text.trim();
        if (t.isEmpty())
            return null;
        char last = t.charAt(t.length() - 1);
        if (!Character.isDigit(last) && last != '.')
            return null;
        try {
            return Double.parseDouble(t);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Like {@link #parseNumber(String)} but also accepts the entry forms a user
     * types into a cell: thousands separators, a leading currency sign and a
     * trailing percent.
     */
    public static Double parseLenient(String text) {
        if (text == null)
            return null;
        String t = text.trim().replace(",", "");
        boolean percent = t.endsWith("%");
        if (percent)
            t = t.substring(0, t.length() - 1).trim();
        boolean negative = false;
        if (t.startsWith("-")) {
            negative = true;
            t = t.substring(1).trim();
        }
        if (t.startsWith("$"))
            t = t.substring(1).trim();
        Double d = parseNumber(t);
        if (d == null || (negative && (t.startsWith("-") || t.startsWith("+"))))
            return null;
        double r = negative ? -d : d;
        return percent ? r / 100.0 : r;
    }
}

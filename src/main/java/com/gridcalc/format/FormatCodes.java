package com.gridcalc.format;

import com.gridcalc.api.Value;

import java.util.Locale;

/**
 * The built-in display formats.
 *
 * Every format shows an error as its tag and an empty value as "". Text is
 * shown as is under any format except hidden. Numeric formats take a
 * precision of 0 to 15 digits.
 */
public final class FormatCodes {

    public static final int DEFAULT_DIGITS = 2;
    public static final int MAX_DIGITS = 15;
    public static final int DEFAULT_BAR_WIDTH = 10;

    private FormatCodes() {
    }

    /** Integral numbers without a fraction, others with up to ten decimals. */
    public static FormatSpec general() {
        return numeric(Value::toString);
    }

    public static FormatSpec hidden() {
        return v -> "";
    }

    public static FormatSpec fixed(int digits) {
        String pattern = "%." + clampDigits(digits) + "f";
        return numeric(v -> String.format(Locale.ROOT, pattern, v.number()));
    }

    public static FormatSpec scientific(int digits) {
        String pattern = "%." + clampDigits(digits) + "E";
        return numeric(v -> String.format(Locale.ROOT, pattern, v.number()));
    }

    /** {@code $1,234.50}; negatives in parentheses. */
    public static FormatSpec currency(int digits) {
        String pattern = "%,." + clampDigits(digits) + "f";
        return numeric(v -> {
            double x = v.number();
            String body = "$" + String.format(Locale.ROOT, pattern, Math.abs(x));
            return x < 0 ? "(" + body + ")" : body;
        });
    }

    public static FormatSpec comma(int digits) {
        String pattern = "%,." + clampDigits(digits) + "f";
        return numeric(v -> String.format(Locale.ROOT, pattern, v.number()));
    }

    public static FormatSpec percent(int digits) {
        String pattern = "%." + clampDigits(digits) + "f%%";
        return numeric(v -> String.format(Locale.ROOT, pattern, v.number() * 100));
    }

    /**
     * A horizontal bar of {@code +} (positive) or {@code -} (negative)
     * characters. Magnitudes are capped at 10, which fills the width less one.
     */
    public static FormatSpec bar(int width) {
        int w = width <= 0 ? DEFAULT_BAR_WIDTH : width;
        return numeric(v -> {
            double x = v.number();
            int len = (int) (Math.min(Math.abs(x), 10) / 10 * (w - 1));
            return String.valueOf(x < 0 ? '-' : '+').repeat(len);
        });
    }

    public static int clampDigits(int digits) {
        return Math.max(0, Math.min(MAX_DIGITS, digits));
    }

    /** Wraps a number renderer with the shared handling of the other kinds. */
    static FormatSpec numeric(FormatSpec forNumbers) {
        return v -> {
            switch (v.kind()) {
                case EMPTY:
                    return "";
                case ERROR:
                    return v.error().tag();
                case TEXT:
                    return v.text();
                default:
                    return forNumbers.format(v);
            }
        };
    }
}

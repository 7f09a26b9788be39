package com.gridcalc.sheet;

import com.gridcalc.api.Value;
import com.gridcalc.fn.Coercions;
import com.gridcalc.formula.FormulaLexer;
import com.gridcalc.formula.Token;

import java.util.List;

/**
 * What a cell's raw text means, decided once when the text is written.
 *
 * <ul>
 * <li>{@code =expr} or {@code @FN(...)}: a formula; the {@code =} is dropped.</li>
 * <li>{@code +expr} / {@code -expr} whose text is not a plain number: a
 * formula with the sign kept as a unary operator.</li>
 * <li>{@code '} {@code "} {@code ^} {@code \}: a label aligned left, right,
 * centered or repeated; the prefix is dropped.</li>
 * <li>numeric text: a number. Anything else is a left-aligned label.</li>
 * </ul>
 * Formula text is tokenized here, once, and the tokens are reused by every
 * recalculation.
 */
public final class CellContent {

    public enum Kind {
        EMPTY, NUMBER, LABEL, FORMULA
    }

    public enum Alignment {
        LEFT('\''), RIGHT('"'), CENTER('^'), REPEAT('\\');

        private final char prefix;

        Alignment(char prefix) {
            this.prefix = prefix;
        }

        public char prefix() {
            return prefix;
        }

        static Alignment fromPrefix(char c) {
            for (Alignment a : values())
                if (a.prefix == c)
                    return a;
            return null;
        }
    }

    public static final CellContent EMPTY = new CellContent(Kind.EMPTY, 0, "", null, null);

    private static final FormulaLexer LEXER = new FormulaLexer();

    private final Kind kind;
    private final double number;
    private final String text;
    private final Alignment alignment;
    private final List<Token> tokens;

    private CellContent(Kind kind, double number, String text, Alignment alignment, List<Token> tokens) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.alignment = alignment;
        this.tokens = tokens;
    }

    public static CellContent parse(String raw) {
        if (raw == null || raw.isBlank())
            return EMPTY;
        char first = raw.charAt(0);
        if (first == '=')
            return formula(raw.substring(1));
        if (first == '@')
            return formula(raw);
        if (first == '+' || first == '-') {
            Double d = Coercions.parseNumber(raw);
            return d != null ? new CellContent(Kind.NUMBER, d, raw, null, null) : formula(raw);
        }
        Alignment align = Alignment.fromPrefix(first);
        if (align != null)
            return new CellContent(Kind.LABEL, 0, raw.substring(1), align, null);
        Double d = Coercions.parseNumber(raw);
        if (d != null)
            return new CellContent(Kind.NUMBER, d, raw, null, null);
        return new CellContent(Kind.LABEL, 0, raw, Alignment.LEFT, null);
    }

    private static CellContent formula(String text) {
        return new CellContent(Kind.FORMULA, 0, text, null, List.copyOf(LEXER.tokenize(text)));
    }

    public Kind kind() {
        return kind;
    }

    public boolean isFormula() {
        return kind == Kind.FORMULA;
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    /** Label text without its prefix, or the formula text without its sigil. */
    public String text() {
        return text;
    }

    public Alignment alignment() {
        return alignment;
    }

    /** Formula tokens; empty for anything that is not a formula. */
    public List<Token> tokens() {
        return tokens != null ? tokens : List.of();
    }

    /** The value of a non-formula cell. */
    public Value constantValue() {
        switch (kind) {
            case NUMBER:
                return Value.number(number);
            case LABEL:
                return Value.text(text);
            default:
                return Value.EMPTY;
        }
    }

    @Override
    public String toString() {
        return kind + (kind == Kind.EMPTY ? "" : "(" + text + ")");
    }
}

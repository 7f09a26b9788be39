package com.gridcalc.formula;

/**
 * One lexeme of a formula.
 *
 * {@code start} and {@code end} delimit the token in the source text
 * (end exclusive) so the reference rewriter can splice new text in place
 * without re-emitting the rest of the formula.
 */
public record Token(TokenType type, String text, int start, int end) {

    public boolean is(TokenType t) {
        return type == t;
    }

    public boolean is(TokenType t, String s) {
        return type == t && text.equals(s);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + start;
    }
}

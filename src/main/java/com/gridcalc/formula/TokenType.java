package com.gridcalc.formula;

public enum TokenType {
    NUMBER,
    /** Double-quoted literal; the token text is the content without quotes. */
    STRING,
    /** Cell reference, bare or {@code $}-anchored. */
    CELL,
    /** Identifier followed by an opening parenthesis; text is upper-cased. */
    FUNCTION,
    /** Any other identifier: a named range, or {@code #NAME?} if undefined. */
    NAME,
    /** Literal error tag such as {@code #REF!} left behind by a deletion. */
    ERROR,
    OPERATOR,
    COMPARISON,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    EOF
}

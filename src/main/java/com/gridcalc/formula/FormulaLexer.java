package com.gridcalc.formula;

import com.gridcalc.api.ErrorKind;
import com.gridcalc.util.CellRefs;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns formula text into a token list terminated by {@link TokenType#EOF}.
 *
 * Lexing is total: characters that start no token are skipped, so a malformed
 * formula produces a token list the evaluator rejects as {@code #ERR!}
 * instead of an exception. The lexer is stateless and thread-safe.
 */
public final class FormulaLexer {

    private static final Pattern NUMBER = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        if (text == null)
            text = "";
        final int n = text.length();
        int i = 0;
        while (i < n) {
            char ch = text.charAt(i);

            if (Character.isWhitespace(ch)) {
                i++;
                continue;
            }

            if (ch == '"') {
                int close = text.indexOf('"', i + 1);
                int contentEnd = close < 0 ? n : close;
                int end = close < 0 ? n : close + 1;
                tokens.add(new Token(TokenType.STRING, text.substring(i + 1, contentEnd), i, end));
                i = end;
                continue;
            }

            if (i + 1 < n) {
                String two = text.substring(i, i + 2);
                if (two.equals("<>") || two.equals("<=") || two.equals(">=") || two.equals("!=")
                        || two.equals("==")) {
                    tokens.add(new Token(TokenType.COMPARISON, two, i, i + 2));
                    i += 2;
                    continue;
                }
                if (two.equals("..")) {
                    tokens.add(new Token(TokenType.COLON, ":", i, i + 2));
                    i += 2;
                    continue;
                }
            }

            switch (ch) {
                case '<', '>', '=' -> {
                    tokens.add(new Token(TokenType.COMPARISON, String.valueOf(ch), i, i + 1));
                    i++;
                    continue;
                }
                case '+', '-', '*', '/', '^', '%', '&' -> {
                    tokens.add(new Token(TokenType.OPERATOR, String.valueOf(ch), i, i + 1));
                    i++;
                    continue;
                }
                case '(' -> {
                    tokens.add(new Token(TokenType.LPAREN, "(", i, i + 1));
                    i++;
                    continue;
                }
                case ')' -> {
                    tokens.add(new Token(TokenType.RPAREN, ")", i, i + 1));
                    i++;
                    continue;
                }
                case ',' -> {
                    tokens.add(new Token(TokenType.COMMA, ",", i, i + 1));
                    i++;
                    continue;
                }
                case ':' -> {
                    tokens.add(new Token(TokenType.COLON, ":", i, i + 1));
                    i++;
                    continue;
                }
                case '@' -> {
                    // Lotus function sigil, carries no meaning of its own
                    i++;
                    continue;
                }
                case '#' -> {
                    ErrorKind kind = errorTagAt(text, i);
                    if (kind != null) {
                        int end = i + kind.tag().length();
                        tokens.add(new Token(TokenType.ERROR, kind.tag(), i, end));
                        i = end;
                    } else {
                        i++;
                    }
                    continue;
                }
                default -> {
                }
            }

            if (Character.isDigit(ch) || (ch == '.' && i + 1 < n && Character.isDigit(text.charAt(i + 1)))) {
                Matcher m = NUMBER.matcher(text);
                m.region(i, n);
                if (m.lookingAt()) {
                    tokens.add(new Token(TokenType.NUMBER, m.group(), i, m.end()));
                    i = m.end();
                    continue;
                }
            }

            if (Character.isLetter(ch) || ch == '_' || ch == '$') {
                int j = i;
                while (j < n && (Character.isLetterOrDigit(text.charAt(j)) || text.charAt(j) == '_'
                        || text.charAt(j) == '$'))
                    j++;
                String word = text.substring(i, j);
                int k = j;
                while (k < n && Character.isWhitespace(text.charAt(k)))
                    k++;
                if (k < n && text.charAt(k) == '(' && word.indexOf('$') < 0) {
                    tokens.add(new Token(TokenType.FUNCTION, word.toUpperCase(Locale.ROOT), i, j));
                } else if (CellRefs.isCellRef(word)) {
                    tokens.add(new Token(TokenType.CELL, word, i, j));
                } else {
                    tokens.add(new Token(TokenType.NAME, word, i, j));
                }
                i = j;
                continue;
            }

            // unknown character
            i++;
        }
        tokens.add(new Token(TokenType.EOF, "", n, n));
        return tokens;
    }

    private static ErrorKind errorTagAt(String text, int pos) {
        for (ErrorKind kind : ErrorKind.values()) {
            String tag = kind.tag();
            if (text.regionMatches(true, pos, tag, 0, tag.length()))
                return kind;
        }
        return null;
    }
}

package com.gridcalc.formula;

import com.gridcalc.api.CellRef;
import com.gridcalc.api.ErrorKind;
import com.gridcalc.api.RangeRef;
import com.gridcalc.api.Value;
import com.gridcalc.fn.Coercions;
import com.gridcalc.fn.FunctionRegistry;
import com.gridcalc.fn.Operand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Precedence-climbing parser that evaluates while it parses.
 *
 * Binding, loosest first:
 * <ol>
 * <li>comparisons {@code = == <> != < > <= >=} (result 1 or 0)</li>
 * <li>text concatenation {@code &}</li>
 * <li>{@code + -}</li>
 * <li>{@code * / %} ({@code %} is the remainder)</li>
 * <li>{@code ^}, right-associative</li>
 * <li>unary {@code + -}, so {@code -2^2} is 4</li>
 * </ol>
 * Function arguments are all evaluated, whatever the function does with them.
 *
 * Nothing here throws for a bad formula: syntax errors give {@code #ERR!},
 * unknown functions and undefined names give {@code #NAME?}, and arithmetic
 * failures give their own error kinds. Every reference in the token list is
 * reported to {@link CellResolver#reference} before evaluation starts, so the
 * recorded dependencies do not depend on how far evaluation got.
 */
public final class FormulaEvaluator {

    private final FunctionRegistry functions;
    private final FormulaLexer lexer = new FormulaLexer();

    public FormulaEvaluator() {
        this(new FunctionRegistry());
    }

    public FormulaEvaluator(FunctionRegistry functions) {
        this.functions = functions;
    }

    public FunctionRegistry functions() {
        return functions;
    }

    public Value evaluate(String formula, CellResolver resolver) {
        return evaluate(lexer.tokenize(formula), resolver);
    }

    public Value evaluate(List<Token> tokens, CellResolver resolver) {
        for (RangeRef ref : references(tokens, resolver))
            resolver.reference(ref);
        Parser parser = new Parser(tokens, resolver, functions);
        try {
            Operand result = parser.comparison();
            if (!parser.peek().is(TokenType.EOF))
                return Value.error(ErrorKind.GENERIC);
            Value v = result.scalar();
            return v.isEmpty() ? Value.ZERO : v;
        } catch (SyntaxException e) {
            return Value.error(ErrorKind.GENERIC);
        }
    }

    /**
     * The distinct references in a token list, in order of appearance:
     * {@code CELL:CELL} pairs as ranges, lone cells as 1x1 ranges, and named
     * ranges the resolver knows. Undefined names contribute nothing.
     */
    public static List<RangeRef> references(List<Token> tokens, CellResolver names) {
        Set<RangeRef> refs = new LinkedHashSet<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.is(TokenType.CELL)) {
                CellRef start = CellRef.parse(t.text());
                if (i + 2 < tokens.size() && tokens.get(i + 1).is(TokenType.COLON)
                        && tokens.get(i + 2).is(TokenType.CELL)) {
                    refs.add(new RangeRef(start, CellRef.parse(tokens.get(i + 2).text())));
                    i += 2;
                } else {
                    refs.add(RangeRef.of(start));
                }
            } else if (t.is(TokenType.NAME) && names != null) {
                RangeRef named = names.namedRange(t.text());
                if (named != null)
                    refs.add(named);
            }
        }
        return refs.isEmpty() ? Collections.emptyList() : new ArrayList<>(refs);
    }

    private static final class SyntaxException extends RuntimeException {
        SyntaxException(String message) {
            super(message, null, false, false);
        }
    }

    private static final class Parser {
        private final List<Token> tokens;
        private final CellResolver resolver;
        private final FunctionRegistry functions;
        private int pos;

        Parser(List<Token> tokens, CellResolver resolver, FunctionRegistry functions) {
            this.tokens = tokens;
            this.resolver = resolver;
            this.functions = functions;
        }

        Token peek() {
            return pos < tokens.size() ? tokens.get(pos) : new Token(TokenType.EOF, "", -1, -1);
        }

        Token next() {
            Token t = peek();
            if (pos < tokens.size())
                pos++;
            return t;
        }

        void expect(TokenType type) {
            Token t = next();
            if (!t.is(type))
                throw new SyntaxException("Expected " + type + " but found " + t);
        }

        Operand comparison() {
            Operand left = concatenation();
            while (peek().is(TokenType.COMPARISON)) {
                String op = next().text();
                Operand right = concatenation();
                left = Operand.of(compare(op, left.scalar(), right.scalar()));
            }
            return left;
        }

        Operand concatenation() {
            Operand left = additive();
            while (peek().is(TokenType.OPERATOR, "&")) {
                next();
                Operand right = additive();
                Value a = Coercions.asText(left.scalar());
                Value b = Coercions.asText(right.scalar());
                left = Operand.of(a.isError() ? a : b.isError() ? b : Value.text(a.text() + b.text()));
            }
            return left;
        }

        Operand additive() {
            Operand left = term();
            while (peek().is(TokenType.OPERATOR, "+") || peek().is(TokenType.OPERATOR, "-")) {
                String op = next().text();
                Operand right = term();
                left = Operand.of(arithmetic(op, left.scalar(), right.scalar()));
            }
            return left;
        }

        Operand term() {
            Operand left = power();
            while (peek().is(TokenType.OPERATOR, "*") || peek().is(TokenType.OPERATOR, "/")
                    || peek().is(TokenType.OPERATOR, "%")) {
                String op = next().text();
                Operand right = power();
                left = Operand.of(arithmetic(op, left.scalar(), right.scalar()));
            }
            return left;
        }

        Operand power() {
            Operand base = unary();
            if (peek().is(TokenType.OPERATOR, "^")) {
                next();
                Operand exponent = power();
                return Operand.of(arithmetic("^", base.scalar(), exponent.scalar()));
            }
            return base;
        }

        Operand unary() {
            if (peek().is(TokenType.OPERATOR, "-")) {
                next();
                Value v = Coercions.asNumber(unary().scalar());
                return Operand.of(v.isError() ? v : Value.number(-v.number()));
            }
            if (peek().is(TokenType.OPERATOR, "+")) {
                next();
                return Operand.of(Coercions.asNumber(unary().scalar()));
            }
            return primary();
        }

        Operand primary() {
            Token t = next();
            switch (t.type()) {
                case NUMBER:
                    return Operand.of(Value.number(Double.parseDouble(t.text())));
                case STRING:
                    return Operand.of(Value.text(t.text()));
                case ERROR:
                    return Operand.of(Value.error(ErrorKind.fromTag(t.text())));
                case CELL:
                    return cellOrRange(t);
                case NAME:
                    return named(t);
                case FUNCTION:
                    return call(t);
                case LPAREN: {
                    Operand inner = comparison();
                    expect(TokenType.RPAREN);
                    return inner;
                }
                default:
                    throw new SyntaxException("Unexpected " + t);
            }
        }

        private Operand cellOrRange(Token t) {
            CellRef start = CellRef.parse(t.text());
            if (peek().is(TokenType.COLON)) {
                next();
                Token endToken = next();
                if (!endToken.is(TokenType.CELL))
                    throw new SyntaxException("Range end must be a cell, found " + endToken);
                RangeRef range = new RangeRef(start, CellRef.parse(endToken.text()));
                return Operand.ofRange(range, resolver.rangeValues(range));
            }
            return Operand.of(resolver.cellValue(start));
        }

        private Operand named(Token t) {
            RangeRef range = resolver.namedRange(t.text());
            if (range == null)
                return Operand.of(Value.error(ErrorKind.NAME));
            if (range.isSingleCell())
                return Operand.of(resolver.cellValue(range.start()));
            return Operand.ofRange(range, resolver.rangeValues(range));
        }

        private Operand call(Token fn) {
            expect(TokenType.LPAREN);
            List<Operand> args = new ArrayList<>();
            if (!peek().is(TokenType.RPAREN)) {
                args.add(comparison());
                while (peek().is(TokenType.COMMA)) {
                    next();
                    args.add(comparison());
                }
            }
            expect(TokenType.RPAREN);
            return Operand.of(functions.invoke(fn.text(), args));
        }
    }

    static Value arithmetic(String op, Value left, Value right) {
        Value a = Coercions.asNumber(left);
        if (a.isError())
            return a;
        Value b = Coercions.asNumber(right);
        if (b.isError())
            return b;
        double x = a.number(), y = b.number();
        switch (op) {
            case "+":
                return Value.number(x + y);
            case "-":
                return Value.number(x - y);
            case "*":
                return Value.number(x * y);
            case "/":
                return y == 0.0 ? Value.error(ErrorKind.DIV_ZERO) : Value.number(x / y);
            case "%":
                return y == 0.0 ? Value.error(ErrorKind.DIV_ZERO) : Value.number(x - y * Math.floor(x / y));
            case "^":
                if (x == 0.0 && y < 0)
                    return Value.error(ErrorKind.DIV_ZERO);
                return Value.number(Math.pow(x, y));
            default:
                return Value.error(ErrorKind.GENERIC);
        }
    }

    /**
     * Numbers compare numerically and text case-insensitively. Empty takes
     * the type of the other side; a number sorts before any text.
     */
    static Value compare(String op, Value left, Value right) {
        if (left.isError())
            return left;
        if (right.isError())
            return right;
        int c;
        boolean leftText = left.isText() || (left.isEmpty() && right.isText());
        boolean rightText = right.isText() || (right.isEmpty() && left.isText());
        if (leftText && rightText) {
            String a = left.isText() ? left.text() : "";
            String b = right.isText() ? right.text() : "";
            c = a.compareToIgnoreCase(b);
        } else if (!leftText && !rightText) {
            double x = left.number(), y = right.number();
            c = x < y ? -1 : x > y ? 1 : 0;
        } else {
            c = leftText ? 1 : -1;
        }
        switch (op) {
            case "=":
            case "==":
                return Value.bool(c == 0);
            case "<>":
            case "!=":
                return Value.bool(c != 0);
            case "<":
                return Value.bool(c < 0);
            case ">":
                return Value.bool(c > 0);
            case "<=":
                return Value.bool(c <= 0);
            case ">=":
                return Value.bool(c >= 0);
            default:
                return Value.error(ErrorKind.GENERIC);
        }
    }
}

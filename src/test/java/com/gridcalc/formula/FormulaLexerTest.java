package com.gridcalc.formula;

import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

public class FormulaLexerTest {

    private FormulaLexer lexer;

    @Before
    public void setUp() {
        lexer = new FormulaLexer();
    }

    private List<TokenType> types(String text) {
        return lexer.tokenize(text).stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    public void testArithmeticTokens() {
        assertEquals(List.of(TokenType.CELL, TokenType.OPERATOR, TokenType.NUMBER, TokenType.OPERATOR,
                TokenType.CELL, TokenType.EOF), types("A1 + 2.5*$B$3"));
    }

    @Test
    public void testFunctionWithRange() {
        List<Token> tokens = lexer.tokenize("sum (A1:B2)");
        assertEquals(TokenType.FUNCTION, tokens.get(0).type());
        assertEquals("SUM", tokens.get(0).text());
        assertEquals(TokenType.LPAREN, tokens.get(1).type());
        assertEquals(TokenType.CELL, tokens.get(2).type());
        assertEquals(TokenType.COLON, tokens.get(3).type());
        assertEquals(TokenType.CELL, tokens.get(4).type());
        assertEquals(TokenType.RPAREN, tokens.get(5).type());
    }

    @Test
    public void testLotusRangeSeparatorAndSigil() {
        List<Token> tokens = lexer.tokenize("@SUM(A1..A3)");
        assertEquals(TokenType.FUNCTION, tokens.get(0).type());
        assertEquals(TokenType.COLON, tokens.get(3).type());
        assertEquals(":", tokens.get(3).text());
        assertEquals(TokenType.CELL, tokens.get(4).type());
    }

    @Test
    public void testComparisonOperators() {
        for (String op : new String[] { "<>", "<=", ">=", "!=", "==", "<", ">", "=" }) {
            List<Token> tokens = lexer.tokenize("1" + op + "2");
            assertEquals(op, TokenType.COMPARISON, tokens.get(1).type());
            assertEquals(op, tokens.get(1).text());
        }
    }

    @Test
    public void testStringLiteralKeepsContentAndPositions() {
        List<Token> tokens = lexer.tokenize("\"A1 + B1\"&C1");
        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("A1 + B1", tokens.get(0).text());
        assertEquals(0, tokens.get(0).start());
        assertEquals(9, tokens.get(0).end());
        assertEquals(TokenType.OPERATOR, tokens.get(1).type());
        assertEquals(TokenType.CELL, tokens.get(2).type());
        assertEquals(10, tokens.get(2).start());
    }

    @Test
    public void testUnterminatedStringRunsToEnd() {
        List<Token> tokens = lexer.tokenize("\"abc");
        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("abc", tokens.get(0).text());
        assertEquals(TokenType.EOF, tokens.get(1).type());
    }

    @Test
    public void testErrorLiteral() {
        List<Token> tokens = lexer.tokenize("#REF!+1");
        assertEquals(TokenType.ERROR, tokens.get(0).type());
        assertEquals("#REF!", tokens.get(0).text());
        assertEquals(TokenType.OPERATOR, tokens.get(1).type());
    }

    @Test
    public void testNamesAreNotCells() {
        List<Token> tokens = lexer.tokenize("TAX_RATE*A1");
        assertEquals(TokenType.NAME, tokens.get(0).type());
        assertEquals("TAX_RATE", tokens.get(0).text());
        assertEquals(TokenType.CELL, tokens.get(2).type());
    }

    @Test
    public void testUnknownCharactersAreSkipped() {
        assertEquals(List.of(TokenType.NUMBER, TokenType.OPERATOR, TokenType.NUMBER, TokenType.EOF),
                types("1 ~+ 2 ?"));
    }

    @Test
    public void testEmptyInputYieldsOnlyEof() {
        assertEquals(List.of(TokenType.EOF), types(""));
        assertEquals(List.of(TokenType.EOF), types(null));
    }

    @Test
    public void testScientificNumber() {
        List<Token> tokens = lexer.tokenize("1.5e3");
        assertEquals(TokenType.NUMBER, tokens.get(0).type());
        assertEquals("1.5e3", tokens.get(0).text());
    }
}

package com.gridcalc.sheet;

import com.gridcalc.api.Value;
import com.gridcalc.formula.TokenType;

import org.junit.Test;

import static org.junit.Assert.*;

public class CellContentTest {

    @Test
    public void testEmpty() {
        assertSame(CellContent.EMPTY, CellContent.parse(""));
        assertSame(CellContent.EMPTY, CellContent.parse("   "));
        assertSame(CellContent.EMPTY, CellContent.parse(null));
        assertEquals(Value.EMPTY, CellContent.EMPTY.constantValue());
    }

    @Test
    public void testNumbers() {
        CellContent c = CellContent.parse("42.5");
        assertEquals(CellContent.Kind.NUMBER, c.kind());
        assertEquals(Value.number(42.5), c.constantValue());
        assertEquals(Value.number(-3), CellContent.parse("-3").constantValue());
        assertEquals(Value.number(3), CellContent.parse("+3").constantValue());
    }

    @Test
    public void testLabelPrefixes() {
        assertEquals(CellContent.Alignment.LEFT, CellContent.parse("'left").alignment());
        assertEquals(CellContent.Alignment.RIGHT, CellContent.parse("\"right").alignment());
        assertEquals(CellContent.Alignment.CENTER, CellContent.parse("^mid").alignment());
        assertEquals(CellContent.Alignment.REPEAT, CellContent.parse("\\-").alignment());
        assertEquals(Value.text("123"), CellContent.parse("'123").constantValue());
        assertEquals(Value.text("plain text"), CellContent.parse("plain text").constantValue());
    }

    @Test
    public void testFormulas() {
        CellContent eq = CellContent.parse("=A1+1");
        assertTrue(eq.isFormula());
        assertEquals("A1+1", eq.text());
        assertEquals(TokenType.CELL, eq.tokens().get(0).type());

        CellContent at = CellContent.parse("@SUM(A1..A3)");
        assertTrue(at.isFormula());
        assertEquals(TokenType.FUNCTION, at.tokens().get(0).type());

        CellContent signed = CellContent.parse("-A1");
        assertTrue(signed.isFormula());
        assertEquals(Value.EMPTY, signed.constantValue());
    }

    @Test
    public void testTokensAreReadOnly() {
        CellContent c = CellContent.parse("=1+2");
        try {
            c.tokens().clear();
            fail("tokens must not be mutable");
        } catch (UnsupportedOperationException expected) {
        }
        assertTrue(CellContent.parse("7").tokens().isEmpty());
    }
}

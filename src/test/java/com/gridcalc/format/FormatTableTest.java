package com.gridcalc.format;

import com.gridcalc.api.ErrorKind;
import com.gridcalc.api.Value;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class FormatTableTest {

    private FormatTable table;

    @Before
    public void setUp() {
        table = new FormatTable();
    }

    private String fmt(String code, double d) {
        return table.resolve(code).format(Value.number(d));
    }

    @Test
    public void testGeneral() {
        assertEquals("42", fmt("G", 42));
        assertEquals("0.5", fmt("G", 0.5));
        assertEquals("-3", fmt(null, -3));
        assertEquals("3", fmt("  ", 3));
    }

    @Test
    public void testFixedAndScientific() {
        assertEquals("3.14", fmt("F2", Math.PI));
        assertEquals("3", fmt("F0", Math.PI));
        assertEquals("2.50", fmt("F", 2.5));
        assertEquals("1.23E+03", fmt("S2", 1234));
    }

    @Test
    public void testCurrencyAndComma() {
        assertEquals("$1,234.57", fmt("C2", 1234.567));
        assertEquals("($1,234.57)", fmt("C2", -1234.567));
        assertEquals("$0", fmt("C0", 0.4));
        assertEquals("1,000,000.0", fmt(",1", 1e6));
        assertEquals("-1,000", fmt(",0", -1000));
    }

    @Test
    public void testPercent() {
        assertEquals("12.50%", fmt("P", 0.125));
        assertEquals("50%", fmt("p0", 0.5));
    }

    @Test
    public void testBar() {
        assertEquals("++++", fmt("+", 5));
        assertEquals("---------", fmt("+", -25));
        assertEquals("", fmt("+", 0.5));
        assertEquals("++", fmt("+5", 5));
    }

    @Test
    public void testNonNumericValues() {
        FormatSpec currency = table.resolve("C2");
        assertEquals("", currency.format(Value.EMPTY));
        assertEquals("#DIV/0!", currency.format(Value.error(ErrorKind.DIV_ZERO)));
        assertEquals("label", currency.format(Value.text("label")));
        assertEquals("", table.resolve("H").format(Value.text("secret")));
    }

    @Test
    public void testDigitsClamped() {
        assertEquals(15, FormatCodes.clampDigits(40));
        assertEquals(0, FormatCodes.clampDigits(-1));
        assertEquals("1.000000000000000", fmt("F99", 1));
    }

    @Test
    public void testValidity() {
        assertTrue(table.isValid("f2"));
        assertTrue(table.isValid(",3"));
        assertTrue(table.isValid(null));
        assertFalse(table.isValid("Q2"));
        assertEquals("F2", FormatTable.normalize(" f2 "));
        assertEquals("G", FormatTable.normalize(null));
    }

    @Test
    public void testUnknownCodeFallsBackToGeneral() {
        assertEquals("1.5", fmt("ZZ9", 1.5));
    }

    @Test
    public void testResolveIsCached() {
        assertSame(table.resolve("F2"), table.resolve("f2"));
    }

    @Test
    public void testCustomPrefix() {
        table.register("X", d -> v -> "x" + d);
        assertTrue(table.contains("x"));
        assertEquals("x3", fmt("X3", 1));
        assertEquals("x-1", fmt("X", 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPrefixEndingInDigitRejected() {
        table.register("Q1", d -> FormatCodes.general());
    }
}

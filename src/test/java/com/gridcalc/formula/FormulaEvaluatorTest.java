package com.gridcalc.formula;

import com.gridcalc.api.ErrorKind;
import com.gridcalc.api.RangeRef;
import com.gridcalc.api.Value;
import com.gridcalc.fn.FunctionRegistry;

import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class FormulaEvaluatorTest {

    private FormulaEvaluator evaluator;
    private MapResolver cells;

    @Before
    public void setUp() {
        evaluator = new FormulaEvaluator();
        cells = new MapResolver()
                .put("A1", 10)
                .put("A2", 20)
                .put("A3", 30)
                .put("B1", "hello")
                .put("B2", "3")
                .put("C1", Value.error(ErrorKind.DIV_ZERO));
    }

    private Value eval(String formula) {
        return evaluator.evaluate(formula, cells);
    }

    private double num(String formula) {
        Value v = eval(formula);
        assertTrue(formula + " gave " + v, v.isNumber());
        return v.number();
    }

    @Test
    public void testPrecedence() {
        assertEquals(14, num("2+3*4"), 0);
        assertEquals(20, num("(2+3)*4"), 0);
        assertEquals(2, num("10-4-4"), 0);
        assertEquals(512, num("2^3^2"), 0);
        assertEquals(4, num("-2^2"), 0);
        assertEquals(-6, num("-2*3"), 0);
        assertEquals(1, num("1+1=2"), 0);
        assertEquals(0, num("2*3<5"), 0);
    }

    @Test
    public void testCellAndRangeReferences() {
        assertEquals(30, num("A1+A2"), 0);
        assertEquals(60, num("SUM(A1:A3)"), 0);
        assertEquals(60, num("@SUM(A1..A3)"), 0);
        assertEquals(20, num("AVG(A1:A3)"), 0);
        assertEquals(10, num("$A$1"), 0);
    }

    @Test
    public void testEmptyResultIsZero() {
        assertEquals(Value.ZERO, eval("Z99"));
        assertEquals(10, num("A1+Z99"), 0);
    }

    @Test
    public void testDivisionByZero() {
        assertTrue(eval("1/0").isError(ErrorKind.DIV_ZERO));
        assertTrue(eval("A1/Z1").isError(ErrorKind.DIV_ZERO));
        assertTrue(eval("5%0").isError(ErrorKind.DIV_ZERO));
        assertTrue(eval("0^-1").isError(ErrorKind.DIV_ZERO));
    }

    @Test
    public void testErrorsPropagateThroughOperators() {
        assertTrue(eval("C1+1").isError(ErrorKind.DIV_ZERO));
        assertTrue(eval("-C1").isError(ErrorKind.DIV_ZERO));
        assertTrue(eval("SUM(A1:C1)").isError(ErrorKind.DIV_ZERO));
        assertTrue(eval("C1=1").isError(ErrorKind.DIV_ZERO));
    }

    @Test
    public void testTextCoercion() {
        assertEquals(5, num("B2+2"), 0);
        assertTrue(eval("B1+1").isError(ErrorKind.GENERIC));
        assertEquals(Value.text("hello3"), eval("B1&B2"));
        assertEquals(Value.text("x10"), eval("\"x\"&A1"));
    }

    @Test
    public void testTextComparisonIgnoresCase() {
        assertEquals(1, num("B1=\"HELLO\""), 0);
        assertEquals(1, num("\"abc\"<\"ABD\""), 0);
        assertEquals(1, num("1<\"a\""), 0);
        assertEquals(1, num("Z9=\"\""), 0);
        assertEquals(1, num("Z9=0"), 0);
    }

    @Test
    public void testUnknownFunctionAndName() {
        assertTrue(eval("NOSUCH(1)").isError(ErrorKind.NAME));
        assertTrue(eval("UNDEFINED_NAME+1").isError(ErrorKind.NAME));
    }

    @Test
    public void testSyntaxErrorsAreGeneric() {
        assertTrue(eval("1+").isError(ErrorKind.GENERIC));
        assertTrue(eval("(1+2").isError(ErrorKind.GENERIC));
        assertTrue(eval("1 2").isError(ErrorKind.GENERIC));
        assertTrue(eval("").isError(ErrorKind.GENERIC));
    }

    @Test
    public void testNumericOverflowIsNum() {
        assertTrue(eval("10^400").isError(ErrorKind.NUM));
        assertTrue(eval("SQRT(-1)").isError(ErrorKind.NUM));
    }

    @Test
    public void testErrorLiteral() {
        assertTrue(eval("#REF!").isError(ErrorKind.REF));
        assertTrue(eval("#REF!+1").isError(ErrorKind.REF));
    }

    @Test
    public void testRangeAsScalarIsError() {
        assertTrue(eval("A1:A3+1").isError(ErrorKind.GENERIC));
        assertEquals(11, num("A1:A1+1"), 0);
    }

    @Test
    public void testNamedRanges() {
        cells.names.put("TOTALS", RangeRef.parse("A1:A3"));
        cells.names.put("RATE", RangeRef.parse("A2"));
        assertEquals(60, num("SUM(totals)"), 0);
        assertEquals(200, num("A1*Rate"), 0);
    }

    @Test
    public void testEveryReferenceIsReportedEvenOnEarlyFailure() {
        Value v = eval("IF(1, 1/0, A2) + SUM(A1:A3) + $B$2");
        assertTrue(v.isError(ErrorKind.DIV_ZERO));
        assertEquals(List.of(RangeRef.parse("A2"), RangeRef.parse("A1:A3"), RangeRef.parse("B2")),
                cells.referenced);
    }

    @Test
    public void testReferencesAreDistinctAndOrdered() {
        List<RangeRef> refs = FormulaEvaluator.references(new FormulaLexer().tokenize("B1+A1+B1+SUM(A1..A3)"),
                null);
        assertEquals(List.of(RangeRef.parse("B1"), RangeRef.parse("A1"), RangeRef.parse("A1:A3")), refs);
    }

    @Test
    public void testStringLiteralsAreNotReferences() {
        eval("\"A1\"&\"B2\"");
        assertTrue(cells.referenced.isEmpty());
        assertEquals(0, cells.reads);
    }

    @Test
    public void testCustomFunction() {
        FunctionRegistry registry = new FunctionRegistry();
        registry.register("DOUBLE", 1, 1, true, args -> Value.number(args.get(0).scalar().number() * 2));
        FormulaEvaluator custom = new FormulaEvaluator(registry);
        assertEquals(Value.number(20), custom.evaluate("double(A1)", cells));
        assertTrue(custom.evaluate("DOUBLE(C1)", cells).isError(ErrorKind.DIV_ZERO));
    }

    @Test
    public void testThrowingFunctionBecomesGenericError() {
        FunctionRegistry registry = new FunctionRegistry();
        registry.register("BOOM", args -> {
            throw new IllegalStateException("boom");
        });
        assertTrue(new FormulaEvaluator(registry).evaluate("BOOM()+1", cells).isError(ErrorKind.GENERIC));
    }
}

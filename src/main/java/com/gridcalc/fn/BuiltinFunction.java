package com.gridcalc.fn;

import com.gridcalc.api.Value;

import java.util.Locale;

/**
 * Built-in functions with their arity and implementation.
 *
 * {@code propagatesErrors} means an error passed directly as an argument is
 * returned without calling the function. Functions that inspect errors
 * themselves (IF, ISERR, the counting functions) opt out.
 */
public enum BuiltinFunction {
    // --- Aggregates ---
    SUM(1, FunctionRegistry.VARARGS, true, StatisticalFunctions::sum),
    AVG(1, FunctionRegistry.VARARGS, true, StatisticalFunctions::average),
    AVERAGE(1, FunctionRegistry.VARARGS, true, StatisticalFunctions::average),
    MIN(1, FunctionRegistry.VARARGS, true, StatisticalFunctions::min),
    MAX(1, FunctionRegistry.VARARGS, true, StatisticalFunctions::max),
    COUNT(1, FunctionRegistry.VARARGS, false, StatisticalFunctions::count),
    COUNTA(1, FunctionRegistry.VARARGS, false, StatisticalFunctions::countA),
    COUNTBLANK(1, FunctionRegistry.VARARGS, false, StatisticalFunctions::countBlank),
    STD(1, FunctionRegistry.VARARGS, true, StatisticalFunctions::std),
    VAR(1, FunctionRegistry.VARARGS, true, StatisticalFunctions::var),

    // --- Logical ---
    IF(2, 3, false, LogicalFunctions::ifThenElse),
    AND(1, FunctionRegistry.VARARGS, true, LogicalFunctions::and),
    OR(1, FunctionRegistry.VARARGS, true, LogicalFunctions::or),
    NOT(1, 1, true, LogicalFunctions::not),
    TRUE(0, 0, true, args -> Value.TRUE),
    FALSE(0, 0, true, args -> Value.FALSE),
    ISERR(1, 1, false, LogicalFunctions::isErr),
    ISNUMBER(1, 1, false, LogicalFunctions::isNumber),
    ISSTRING(1, 1, false, LogicalFunctions::isString),

    // --- Math ---
    ABS(1, 1, true, MathFunctions::abs),
    INT(1, 1, true, MathFunctions::intPart),
    ROUND(1, 2, true, MathFunctions::round),
    SQRT(1, 1, true, MathFunctions::sqrt),
    SIN(1, 1, true, MathFunctions.unary(Math::sin)),
    COS(1, 1, true, MathFunctions.unary(Math::cos)),
    TAN(1, 1, true, MathFunctions.unary(Math::tan)),
    ASIN(1, 1, true, MathFunctions.unary(Math::asin)),
    ACOS(1, 1, true, MathFunctions.unary(Math::acos)),
    ATAN(1, 1, true, MathFunctions.unary(Math::atan)),
    LOG(1, 1, true, MathFunctions::log10),
    LN(1, 1, true, MathFunctions::ln),
    EXP(1, 1, true, MathFunctions.unary(Math::exp)),
    PI(0, 0, true, MathFunctions::pi),
    POWER(2, 2, true, MathFunctions::power),
    MOD(2, 2, true, MathFunctions::mod),
    SIGN(1, 1, true, MathFunctions::sign),

    // --- Text ---
    LEN(1, 1, true, TextFunctions::length),
    LENGTH(1, 1, true, TextFunctions::length),
    LEFT(1, 2, true, TextFunctions::left),
    RIGHT(1, 2, true, TextFunctions::right),
    MID(3, 3, true, TextFunctions::mid),
    UPPER(1, 1, true, TextFunctions::upper),
    LOWER(1, 1, true, TextFunctions::lower),
    PROPER(1, 1, true, TextFunctions::proper),
    TRIM(1, 1, true, TextFunctions::trim),
    CONCATENATE(1, FunctionRegistry.VARARGS, true, TextFunctions::concatenate),
    VALUE(1, 1, true, TextFunctions::value),
    REPEAT(2, 2, true, TextFunctions::repeat),
    FIND(2, 3, true, TextFunctions::find);

    private final int minArgs;
    private final int maxArgs;
    private final boolean propagatesErrors;
    private final SheetFunction function;

    BuiltinFunction(int minArgs, int maxArgs, boolean propagatesErrors, SheetFunction function) {
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.propagatesErrors = propagatesErrors;
        this.function = function;
    }

    public String functionName() {
        return name().toUpperCase(Locale.ROOT);
    }

    public int minArgs() {
        return minArgs;
    }

    public int maxArgs() {
        return maxArgs;
    }

    public boolean propagatesErrors() {
        return propagatesErrors;
    }

    public SheetFunction function() {
        return function;
    }
}

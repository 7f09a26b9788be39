package com.gridcalc.fn;

import com.gridcalc.api.ErrorKind;
import com.gridcalc.api.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Numeric functions. Domain errors (square root of a negative, log of zero)
 * surface as NaN and become {@code #NUM!} through {@link Value#number(double)}.
 */
final class MathFunctions {

    private MathFunctions() {
    }

    static SheetFunction unary(DoubleUnaryOperator op) {
        return args -> {
            Value x = Args.number(args, 0);
            return x.isError() ? x : Value.number(op.applyAsDouble(x.number()));
        };
    }

    static Value abs(List<Operand> args) {
        Value x = Args.number(args, 0);
        return x.isError() ? x : Value.number(Math.abs(x.number()));
    }

    /** Rounds down toward negative infinity. */
    static Value intPart(List<Operand> args) {
        Value x = Args.number(args, 0);
        return x.isError() ? x : Value.number(Math.floor(x.number()));
    }

    /** Half away from zero; negative digits round to tens, hundreds, ... */
    static Value round(List<Operand> args) {
        Value x = Args.number(args, 0);
        if (x.isError())
            return x;
        Value digits = Args.integer(args, 1, 0);
        if (digits.isError())
            return digits;
        int d = (int) Math.max(-15, Math.min(15, digits.number()));
        BigDecimal rounded = BigDecimal.valueOf(x.number()).setScale(d, RoundingMode.HALF_UP);
        return Value.number(rounded.doubleValue());
    }

    static Value sqrt(List<Operand> args) {
        Value x = Args.number(args, 0);
        if (x.isError())
            return x;
        return x.number() < 0 ? Value.error(ErrorKind.NUM) : Value.number(Math.sqrt(x.number()));
    }

    static Value log10(List<Operand> args) {
        Value x = Args.number(args, 0);
        if (x.isError())
            return x;
        return x.number() <= 0 ? Value.error(ErrorKind.NUM) : Value.number(Math.log10(x.number()));
    }

    static Value ln(List<Operand> args) {
        Value x = Args.number(args, 0);
        if (x.isError())
            return x;
        return x.number() <= 0 ? Value.error(ErrorKind.NUM) : Value.number(Math.log(x.number()));
    }

    static Value power(List<Operand> args) {
        Value base = Args.number(args, 0);
        if (base.isError())
            return base;
        Value exp = Args.number(args, 1);
        if (exp.isError())
            return exp;
        return power(base.number(), exp.number());
    }

    static Value power(double base, double exp) {
        if (base == 0.0 && exp < 0)
            return Value.error(ErrorKind.DIV_ZERO);
        return Value.number(Math.pow(base, exp));
    }

    /** Result takes the sign of the divisor. */
    static Value mod(List<Operand> args) {
        Value a = Args.number(args, 0);
        if (a.isError())
            return a;
        Value b = Args.number(args, 1);
        if (b.isError())
            return b;
        return mod(a.number(), b.number());
    }

    static Value mod(double a, double b) {
        if (b == 0.0)
            return Value.error(ErrorKind.DIV_ZERO);
        return Value.number(a - b * Math.floor(a / b));
    }

    static Value sign(List<Operand> args) {
        Value x = Args.number(args, 0);
        return x.isError() ? x : Value.number(Math.signum(x.number()));
    }

    static Value pi(List<Operand> args) {
        return Value.number(Math.PI);
    }
}

package com.gridcalc.fn;

import com.gridcalc.api.Value;

import java.util.List;

/** Logical functions return 1 for true and 0 for false. */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    /**
     * Both branches are already evaluated, so references in the branch not
     * taken are still dependencies. Only the chosen branch's error surfaces.
     */
    static Value ifThenElse(List<Operand> args) {
        Value cond = Coercions.asBoolean(Args.scalar(args, 0));
        if (cond.isError())
            return cond;
        if (cond.number() != 0.0)
            return Args.scalar(args, 1);
        return args.size() > 2 ? Args.scalar(args, 2) : Value.text("");
    }

    static Value and(List<Operand> args) {
        for (Operand arg : args) {
            for (Value v : arg.values()) {
                if (arg.isRange() && (v.isEmpty() || v.isText()))
                    continue;
                Value b = Coercions.asBoolean(v);
                if (b.isError())
                    return b;
                if (b.number() == 0.0)
                    return Value.FALSE;
            }
        }
        return Value.TRUE;
    }

    static Value or(List<Operand> args) {
        boolean any = false;
        for (Operand arg : args) {
            for (Value v : arg.values()) {
                if (arg.isRange() && (v.isEmpty() || v.isText()))
                    continue;
                Value b = Coercions.asBoolean(v);
                if (b.isError())
                    return b;
                any |= b.number() != 0.0;
            }
        }
        return Value.bool(any);
    }

    static Value not(List<Operand> args) {
        Value b = Coercions.asBoolean(Args.scalar(args, 0));
        return b.isError() ? b : Value.bool(b.number() == 0.0);
    }

    static Value isErr(List<Operand> args) {
        return Value.bool(Args.scalar(args, 0).isError());
    }

    static Value isNumber(List<Operand> args) {
        return Value.bool(Args.scalar(args, 0).isNumber());
    }

    static Value isString(List<Operand> args) {
        return Value.bool(Args.scalar(args, 0).isText());
    }
}

package com.gridcalc.fn;

import com.gridcalc.api.Value;

import java.util.List;

/**
 * Aggregates over flattened arguments.
 *
 * Text and empty range members are ignored, an error member propagates.
 * Aggregates over no numbers at all return 0.
 */
final class StatisticalFunctions {

    private StatisticalFunctions() {
    }

    static Value sum(List<Operand> args) {
        Args.DoubleBuffer nums = new Args.DoubleBuffer();
        Value err = Args.collectNumbers(args, nums);
        return err != null ? err : Value.number(nums.sum());
    }

    static Value average(List<Operand> args) {
        Args.DoubleBuffer nums = new Args.DoubleBuffer();
        Value err = Args.collectNumbers(args, nums);
        if (err != null)
            return err;
        return nums.size() == 0 ? Value.ZERO : Value.number(nums.sum() / nums.size());
    }

    static Value min(List<Operand> args) {
        Args.DoubleBuffer nums = new Args.DoubleBuffer();
        Value err = Args.collectNumbers(args, nums);
        if (err != null)
            return err;
        if (nums.size() == 0)
            return Value.ZERO;
        double m = nums.get(0);
        for (int i = 1; i < nums.size(); i++)
            m = Math.min(m, nums.get(i));
        return Value.number(m);
    }

    static Value max(List<Operand> args) {
        Args.DoubleBuffer nums = new Args.DoubleBuffer();
        Value err = Args.collectNumbers(args, nums);
        if (err != null)
            return err;
        if (nums.size() == 0)
            return Value.ZERO;
        double m = nums.get(0);
        for (int i = 1; i < nums.size(); i++)
            m = Math.max(m, nums.get(i));
        return Value.number(m);
    }

    /** Numeric members only; errors are not counted and do not propagate. */
    static Value count(List<Operand> args) {
        int n = 0;
        for (Operand arg : args)
            for (Value v : arg.values())
                if (v.isNumber())
                    n++;
        return Value.number(n);
    }

    static Value countA(List<Operand> args) {
        int n = 0;
        for (Operand arg : args)
            for (Value v : arg.values())
                if (!v.isEmpty())
                    n++;
        return Value.number(n);
    }

    /** Empty cells plus cells holding empty text. */
    static Value countBlank(List<Operand> args) {
        long n = 0;
        for (Operand arg : args) {
            n += arg.blankCount();
            for (Value v : arg.values())
                if (v.isText() && v.text().isEmpty())
                    n++;
        }
        return Value.number(n);
    }

    /** Sample variance (n - 1 denominator); fewer than two numbers give 0. */
    static Value var(List<Operand> args) {
        Args.DoubleBuffer nums = new Args.DoubleBuffer();
        Value err = Args.collectNumbers(args, nums);
        if (err != null)
            return err;
        return Value.number(sampleVariance(nums));
    }

    static Value std(List<Operand> args) {
        Args.DoubleBuffer nums = new Args.DoubleBuffer();
        Value err = Args.collectNumbers(args, nums);
        if (err != null)
            return err;
        return Value.number(Math.sqrt(sampleVariance(nums)));
    }

    private static double sampleVariance(Args.DoubleBuffer nums) {
        int n = nums.size();
        if (n < 2)
            return 0.0;
        double mean = nums.sum() / n;
        double ss = 0;
        for (int i = 0; i < n; i++) {
            double d = nums.get(i) - mean;
            ss += d * d;
        }
        return ss / (n - 1);
    }
}

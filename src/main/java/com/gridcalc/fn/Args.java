package com.gridcalc.fn;

import com.gridcalc.api.Value;

import java.util.List;

/** Argument access helpers for the built-in function classes. */
final class Args {

    private Args() {
    }

    static Value scalar(List<Operand> args, int i) {
        return args.get(i).scalar();
    }

    static Value number(List<Operand> args, int i) {
        return Coercions.asNumber(args.get(i).scalar());
    }

    static Value number(List<Operand> args, int i, double defaultValue) {
        return i < args.size() ? number(args, i) : Value.number(defaultValue);
    }

    static Value integer(List<Operand> args, int i, long defaultValue) {
        return i < args.size() ? Coercions.asInt(args.get(i).scalar()) : Value.number(defaultValue);
    }

    static Value text(List<Operand> args, int i) {
        return Coercions.asText(args.get(i).scalar());
    }

    /**
     * Collects the numbers an aggregate works on. Range members that are text
     * or empty are skipped; numeric text passed directly is converted.
     *
     * @return null when collection succeeded, otherwise the error to return.
     */
    static Value collectNumbers(List<Operand> args, DoubleBuffer out) {
        for (Operand arg : args) {
            for (Value v : arg.values()) {
                if (v.isError())
                    return v;
                if (v.isNumber()) {
                    out.add(v.number());
                } else if (v.isText() && !arg.isRange()) {
                    Double d = Coercions.parseNumber(v.text());
                    if (d != null)
                        out.add(d);
                }
            }
        }
        return null;
    }

    /** Growable primitive buffer; aggregates run on every recalculation. */
    static final class DoubleBuffer {
        private double[] data = new double[16];
        private int size;

        void add(double d) {
            if (size == data.length)
                data = java.util.Arrays.copyOf(data, size * 2);
            data[size++] = d;
        }

        int size() {
            return size;
        }

        double get(int i) {
            return data[i];
        }

        double sum() {
            double s = 0;
            for (int i = 0; i < size; i++)
                s += data[i];
            return s;
        }
    }
}

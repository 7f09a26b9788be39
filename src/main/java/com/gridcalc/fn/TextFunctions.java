package com.gridcalc.fn;

import com.gridcalc.api.ErrorKind;
import com.gridcalc.api.Value;

import java.util.List;
import java.util.Locale;

/** String functions. Positions are 1-based; numbers are formatted as general. */
final class TextFunctions {

    private TextFunctions() {
    }

    static Value length(List<Operand> args) {
        Value s = Args.text(args, 0);
        return s.isError() ? s : Value.number(s.text().length());
    }

    static Value left(List<Operand> args) {
        Value s = Args.text(args, 0);
        if (s.isError())
            return s;
        Value n = Args.integer(args, 1, 1);
        if (n.isError())
            return n;
        if (n.number() < 0)
            return Value.error(ErrorKind.GENERIC);
        String t = s.text();
        return Value.text(t.substring(0, (int) Math.min(t.length(), n.number())));
    }

    static Value right(List<Operand> args) {
        Value s = Args.text(args, 0);
        if (s.isError())
            return s;
        Value n = Args.integer(args, 1, 1);
        if (n.isError())
            return n;
        if (n.number() < 0)
            return Value.error(ErrorKind.GENERIC);
        String t = s.text();
        int count = (int) Math.min(t.length(), n.number());
        return Value.text(t.substring(t.length() - count));
    }

    static Value mid(List<Operand> args) {
        Value s = Args.text(args, 0);
        if (s.isError())
            return s;
        Value start = Args.integer(args, 1, 1);
        if (start.isError())
            return start;
        Value n = Args.integer(args, 2, 0);
        if (n.isError())
            return n;
        if (start.number() < 1 || n.number() < 0)
            return Value.error(ErrorKind.GENERIC);
        String t = s.text();
        int from = (int) Math.min(t.length(), start.number() - 1);
        int to = (int) Math.min(t.length(), from + n.number());
        return Value.text(t.substring(from, to));
    }

    static Value upper(List<Operand> args) {
        Value s = Args.text(args, 0);
        return s.isError() ? s : Value.text(s.text().toUpperCase(Locale.ROOT));
    }

    static Value lower(List<Operand> args) {
        Value s = Args.text(args, 0);
        return s.isError() ? s : Value.text(s.text().toLowerCase(Locale.ROOT));
    }

    /** Capitalizes the first letter of every word. */
    static Value proper(List<Operand> args) {
        Value s = Args.text(args, 0);
        if (s.isError())
            return s;
        StringBuilder sb = new StringBuilder(s.text().length());
        boolean startOfWord = true;
        for (char c : s.text().toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return Value.text(sb.toString());
    }

    /** Strips both ends and collapses inner runs of blanks to one space. */
    static Value trim(List<Operand> args) {
        Value s = Args.text(args, 0);
        return s.isError() ? s : Value.text(s.text().trim().replaceAll("\\s+", " "));
    }

    static Value concatenate(List<Operand> args) {
        StringBuilder sb = new StringBuilder();
        for (Operand arg : args) {
            for (Value v : arg.values()) {
                Value t = Coercions.asText(v);
                if (t.isError())
                    return t;
                sb.append(t.text());
            }
        }
        return Value.text(sb.toString());
    }

    /** Accepts {@code 12%}, {@code $1,200} and plain numeric text. */
    static Value value(List<Operand> args) {
        Value v = Args.scalar(args, 0);
        if (v.isError() || v.isNumber())
            return v;
        if (v.isEmpty())
            return Value.ZERO;
        Double d = Coercions.parseLenient(v.text());
        return d == null ? Value.error(ErrorKind.GENERIC) : Value.number(d);
    }

    static Value repeat(List<Operand> args) {
        Value s = Args.text(args, 0);
        if (s.isError())
            return s;
        Value n = Args.integer(args, 1, 1);
        if (n.isError())
            return n;
        if (n.number() < 0)
            return Value.error(ErrorKind.GENERIC);
        return Value.text(s.text().repeat((int) n.number()));
    }

    /** Case-sensitive search; 1-based position, 0 when absent. */
    static Value find(List<Operand> args) {
        Value needle = Args.text(args, 0);
        if (needle.isError())
            return needle;
        Value haystack = Args.text(args, 1);
        if (haystack.isError())
            return haystack;
        Value start = Args.integer(args, 2, 1);
        if (start.isError())
            return start;
        int from = (int) Math.max(0, start.number() - 1);
        int pos = haystack.text().indexOf(needle.text(), from);
        return Value.number(pos + 1);
    }
}

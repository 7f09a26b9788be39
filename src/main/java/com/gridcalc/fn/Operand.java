package com.gridcalc.fn;

import com.gridcalc.api.ErrorKind;
import com.gridcalc.api.RangeRef;
import com.gridcalc.api.Value;

import java.util.Collections;
import java.util.List;

/**
 * A function argument: either a single value or the contents of a range.
 *
 * A range operand holds only the non-empty cells of the range, in row-major
 * order; the blanks are implied by the range's area. Ranges are only legal as
 * function arguments. Where a scalar is required a single-cell range collapses
 * to its value, anything larger is {@code #ERR!}.
 */
public final class Operand {

    private final Value value;
    private final RangeRef range;
    private final List<Value> values;

    private Operand(Value value, RangeRef range, List<Value> values) {
        this.value = value;
        this.range = range;
        this.values = values;
    }

    public static Operand of(Value value) {
        return new Operand(value, null, null);
    }

    public static Operand ofRange(RangeRef range, List<Value> nonEmptyValues) {
        return new Operand(null, range, Collections.unmodifiableList(nonEmptyValues));
    }

    public boolean isRange() {
        return range != null;
    }

    public RangeRef range() {
        return range;
    }

    /** The value where a scalar is required. */
    public Value scalar() {
        if (range == null)
            return value;
        if (range.isSingleCell())
            return values.isEmpty() ? Value.EMPTY : values.get(0);
        return Value.error(ErrorKind.GENERIC);
    }

    /** Non-empty range members in row-major order, or the single value itself. */
    public List<Value> values() {
        return range != null ? values : List.of(value);
    }

    /** Empty cells in the range; 0 or 1 for a single value. */
    public long blankCount() {
        if (range == null)
            return value.isEmpty() ? 1 : 0;
        return range.area() - values.size();
    }

    @Override
    public String toString() {
        return range != null ? range + values.toString() : String.valueOf(value);
    }
}

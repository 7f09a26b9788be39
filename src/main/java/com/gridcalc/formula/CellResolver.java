package com.gridcalc.formula;

import com.gridcalc.api.CellRef;
import com.gridcalc.api.RangeRef;
import com.gridcalc.api.Value;

import java.util.List;

/**
 * The evaluator's view of the grid.
 *
 * The recalculation engine supplies an implementation that serves cached
 * values and makes sure dependencies are computed before they are read.
 */
public interface CellResolver {

    Value cellValue(CellRef cell);

    /**
     * Values of the non-empty cells in the range, row-major. Blank cells are
     * left out so a whole-column range costs only what the column holds.
     */
    List<Value> rangeValues(RangeRef range);

    /**
     * Notified once for every reference in the formula, before evaluation and
     * whether or not evaluation reaches it.
     */
    default void reference(RangeRef range) {
    }

    /**
     * Resolves a named range.
     *
     * @return the range, or null when the name is not defined.
     */
    default RangeRef namedRange(String name) {
        return null;
    }
}

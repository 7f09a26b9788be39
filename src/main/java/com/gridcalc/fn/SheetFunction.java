package com.gridcalc.fn;

import com.gridcalc.api.Value;

import java.util.List;

/**
 * A formula function such as {@code SUM} or {@code LEFT}.
 *
 * Implementations return error values instead of throwing. Anything thrown is
 * caught by the {@link FunctionRegistry} and turned into {@code #ERR!}.
 */
@FunctionalInterface
public interface SheetFunction {
    Value apply(List<Operand> args);
}

package com.gridcalc.format;

import com.gridcalc.api.Value;

/** Turns a cell value into the text shown for it. */
@FunctionalInterface
public interface FormatSpec {

    String format(Value value);
}

package com.gridcalc.api;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Raised by dependency ordering when the requested cells contain a cycle.
 *
 * Carries what could be ordered before the cycle blocked progress, plus the
 * cells left over. Never escapes the recalculation engine: it converts the
 * cyclic cells into {@code #CIRC!} values.
 */
public class CircularReferenceException extends RuntimeException {

    private final List<CellRef> partialOrder;
    private final Set<CellRef> cyclicCells;

    public CircularReferenceException(List<CellRef> partialOrder, Set<CellRef> cyclicCells) {
        super("Cycle detected! Ordered " + partialOrder.size() + " cells, " + cyclicCells.size()
                + " left in or behind a cycle: " + cyclicCells);
        this.partialOrder = List.copyOf(partialOrder);
        this.cyclicCells = Collections.unmodifiableSet(new LinkedHashSet<>(cyclicCells));
    }

    public List<CellRef> partialOrder() {
        return partialOrder;
    }

    public Set<CellRef> cyclicCells() {
        return cyclicCells;
    }
}

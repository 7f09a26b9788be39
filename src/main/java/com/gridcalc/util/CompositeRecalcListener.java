package com.gridcalc.util;

import com.gridcalc.api.CellRef;
import com.gridcalc.api.RecalcListener;
import com.gridcalc.api.Value;

import java.util.Arrays;

/**
 * Fans recalculation events out to several listeners. Iteration walks a plain
 * array; adding copies it.
 */
public class CompositeRecalcListener implements RecalcListener {
    private RecalcListener[] listeners = new RecalcListener[0];

    public void addForComposite(RecalcListener listener) {
        RecalcListener[] old = listeners;
        RecalcListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRecalcStart(long epoch) {
        for (RecalcListener l : listeners)
            l.onRecalcStart(epoch);
    }

    @Override
    public void onCellEvaluated(long epoch, CellRef cell, Value value, long durationNanos) {
        for (RecalcListener l : listeners)
            l.onCellEvaluated(epoch, cell, value, durationNanos);
    }

    @Override
    public void onCellError(long epoch, CellRef cell, Throwable error) {
        for (RecalcListener l : listeners)
            l.onCellError(epoch, cell, error);
    }

    @Override
    public void onCircularReference(long epoch, CellRef cell) {
        for (RecalcListener l : listeners)
            l.onCircularReference(epoch, cell);
    }

    @Override
    public void onRecalcEnd(long epoch, int cellsEvaluated) {
        for (RecalcListener l : listeners)
            l.onRecalcEnd(epoch, cellsEvaluated);
    }
}

package com.gridcalc.util;

import com.gridcalc.api.CellRef;
import com.gridcalc.api.RecalcListener;
import com.gridcalc.api.Value;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class CompositeRecalcListenerTest {

    private static final class Recorder implements RecalcListener {
        private final String name;
        private final List<String> log;

        Recorder(String name, List<String> log) {
            this.name = name;
            this.log = log;
        }

        @Override
        public void onRecalcStart(long epoch) {
            log.add(name + ":start" + epoch);
        }

        @Override
        public void onCellEvaluated(long epoch, CellRef cell, Value value, long durationNanos) {
            log.add(name + ":" + cell + "=" + value);
        }

        @Override
        public void onCellError(long epoch, CellRef cell, Throwable error) {
            log.add(name + ":error " + cell);
        }

        @Override
        public void onRecalcEnd(long epoch, int cellsEvaluated) {
            log.add(name + ":end" + cellsEvaluated);
        }
    }

    @Test
    public void testFansOutInRegistrationOrder() {
        List<String> log = new ArrayList<>();
        CompositeRecalcListener composite = new CompositeRecalcListener();
        composite.addForComposite(new Recorder("a", log));
        composite.addForComposite(new Recorder("b", log));
        assertEquals(2, composite.size());

        composite.onRecalcStart(3);
        composite.onCellEvaluated(3, CellRef.parse("B2"), Value.number(7), 10);
        composite.onCellError(3, CellRef.parse("C1"), new IllegalStateException());
        composite.onCircularReference(3, CellRef.parse("D1"));
        composite.onRecalcEnd(3, 1);

        assertEquals(List.of("a:start3", "b:start3", "a:B2=7", "b:B2=7", "a:error C1", "b:error C1", "a:end1",
                "b:end1"), log);
    }

    @Test
    public void testEmptyCompositeIsHarmless() {
        CompositeRecalcListener composite = new CompositeRecalcListener();
        composite.onRecalcStart(1);
        composite.onRecalcEnd(1, 0);
        assertEquals(0, composite.size());
    }
}

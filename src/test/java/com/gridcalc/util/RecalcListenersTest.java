package com.gridcalc.util;

import com.gridcalc.api.CellRef;
import com.gridcalc.sheet.Sheet;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class RecalcListenersTest {

    private Sheet sheet;
    private RecalcProfileListener profiler;
    private RecalcLatencyListener latency;

    @Before
    public void setUp() {
        sheet = new Sheet();
        profiler = sheet.enableProfiling();
        latency = sheet.enableLatencyTracking();
        sheet.setCell("A1", "1");
        sheet.setCell("B1", "=A1*2");
        sheet.setCell("C1", "=B1+1");
        sheet.setCell("A1", "2");
    }

    @Test
    public void testProfilerCountsEvaluations() {
        RecalcProfileListener.CellStats b1 = profiler.statsFor(CellRef.parse("B1"));
        assertEquals(2, b1.count);
        assertEquals(0, b1.errors);
        assertTrue(b1.maxDurationNanos >= b1.minDurationNanos);
        assertEquals(2, profiler.statsFor(CellRef.parse("C1")).count);
        assertNull(profiler.statsFor(CellRef.parse("A1")));
        String dump = profiler.dump();
        assertTrue(dump, dump.contains("B1"));
        assertTrue(dump, dump.contains("C1"));
        profiler.reset();
        assertNull(profiler.statsFor(CellRef.parse("B1")));
    }

    @Test
    public void testLatencyTracksPasses() {
        assertEquals(3, latency.totalPasses());
        assertEquals(2, latency.lastCellsEvaluated());
        assertEquals(0, latency.lastCircularCount());
        assertTrue(latency.maxLatencyNanos() >= latency.minLatencyNanos());
        assertTrue(latency.dump().contains("3"));
        latency.reset();
        assertEquals(0, latency.totalPasses());
    }

    @Test
    public void testLatencyCountsCircularCells() {
        sheet.setCell("D1", "=E1");
        sheet.setCell("E1", "=D1");
        assertEquals(2, latency.lastCircularCount());
    }

    @Test
    public void testExplain() {
        SheetExplain explain = new SheetExplain(sheet);
        String cell = explain.explainCell(CellRef.parse("B1"));
        assertTrue(cell, cell.contains("Raw: =A1*2"));
        assertTrue(cell, cell.contains("Value: 4"));
        assertTrue(cell, cell.contains("Reads (1): A1"));
        assertTrue(cell, cell.contains("Read by (1): C1"));
        assertTrue(explain.explainCell(CellRef.parse("Z9")).contains("(empty)"));

        String deps = explain.dumpDependencies();
        assertTrue(deps, deps.contains("Formulas (2)"));
        assertTrue(deps, deps.contains("C1 =B1+1 <- B1"));
        assertTrue(explain.explainLastRecalc().contains("Evaluated: 2"));
    }
}

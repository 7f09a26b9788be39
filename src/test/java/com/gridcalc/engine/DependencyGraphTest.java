package com.gridcalc.engine;

import com.gridcalc.api.CellRef;
import com.gridcalc.api.CircularReferenceException;
import com.gridcalc.api.RangeRef;

import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class DependencyGraphTest {

    private DependencyGraph graph;

    private static CellRef c(String a1) {
        return CellRef.parse(a1);
    }

    private static RangeRef r(String text) {
        return RangeRef.parse(text);
    }

    @Before
    public void setUp() {
        graph = new DependencyGraph();
        // C1 = A1 + B1, D1 = SUM(A1:C1), E1 = D1
        graph.record(c("C1"), List.of(r("A1"), r("B1")));
        graph.record(c("D1"), List.of(r("A1:C1")));
        graph.record(c("E1"), List.of(r("D1")));
    }

    @Test
    public void testDirectDependentsUseBothIndexes() {
        assertEquals(Set.of(c("C1"), c("D1")), graph.directDependents(c("A1")));
        assertEquals(Set.of(c("D1")), graph.directDependents(c("C1")));
        assertTrue(graph.directDependents(c("Z9")).isEmpty());
    }

    @Test
    public void testAffectedByIsTransitive() {
        assertEquals(Set.of(c("C1"), c("D1"), c("E1")), graph.affectedBy(c("B1")));
        assertEquals(Set.of(c("E1")), graph.affectedBy(c("D1")));
    }

    @Test
    public void testRecordReplacesEdges() {
        graph.record(c("C1"), List.of(r("F1")));
        assertEquals(List.of(r("F1")), graph.edges(c("C1")));
        assertEquals(Set.of(c("D1")), graph.directDependents(c("A1")));
        assertEquals(Set.of(c("C1")), graph.directDependents(c("F1")));
    }

    @Test
    public void testRemoveAndCounts() {
        assertEquals(3, graph.size());
        assertEquals(4, graph.edgeCount());
        graph.remove(c("D1"));
        assertEquals(2, graph.size());
        assertTrue(graph.edges(c("D1")).isEmpty());
        assertEquals(Set.of(c("C1")), graph.directDependents(c("A1")));
        graph.clear();
        assertEquals(0, graph.size());
    }

    @Test
    public void testTopologicalOrder() {
        List<CellRef> order = graph.topologicalOrder(List.of(c("E1"), c("D1"), c("C1")));
        assertEquals(List.of(c("C1"), c("D1"), c("E1")), order);
    }

    @Test
    public void testTopologicalOrderIgnoresOutsideDependencies() {
        assertEquals(List.of(c("E1")), graph.topologicalOrder(List.of(c("E1"))));
    }

    @Test
    public void testCycleDetected() {
        graph.record(c("A1"), List.of(r("E1")));
        try {
            graph.topologicalOrder(List.of(c("A1"), c("C1"), c("D1"), c("E1"), c("X1")));
            fail("Expected cycle");
        } catch (CircularReferenceException e) {
            assertEquals(List.of(c("X1")), e.partialOrder());
            assertEquals(Set.of(c("A1"), c("C1"), c("D1"), c("E1")), e.cyclicCells());
            assertTrue(e.getMessage().startsWith("Cycle detected!"));
        }
    }

    @Test
    public void testAffectedByTerminatesOnCycle() {
        graph.record(c("A1"), List.of(r("E1")));
        Set<CellRef> affected = graph.affectedBy(c("A1"));
        assertTrue(affected.contains(c("A1")));
        assertEquals(4, affected.size());
    }

    @Test
    public void testLongChainAffectedBy() {
        DependencyGraph chain = new DependencyGraph();
        for (int i = 1; i < 20000; i++)
            chain.record(new CellRef(i, 0), List.of(RangeRef.of(new CellRef(i - 1, 0))));
        assertEquals(19999, chain.affectedBy(new CellRef(0, 0)).size());
    }
}

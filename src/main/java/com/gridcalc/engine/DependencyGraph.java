package com.gridcalc.engine;

import com.gridcalc.api.CellRef;
import com.gridcalc.api.CircularReferenceException;
import com.gridcalc.api.RangeRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed "reads" edges from formula cells to the cells and ranges they read.
 *
 * Edges are stored as bounding boxes and never expanded: {@code SUM(A1:A60000)}
 * is one edge. Two reverse indexes answer "who reads this cell?": a hash index
 * for single-cell edges and a list of distinct multi-cell ranges checked by
 * containment.
 *
 * Not thread-safe; the owning sheet serializes access.
 */
public final class DependencyGraph {

    // dependent -> what it reads
    private final Map<CellRef, List<RangeRef>> forward = new HashMap<>();
    // single cell -> cells reading it
    private final Map<CellRef, Set<CellRef>> cellReaders = new HashMap<>();
    // multi-cell range -> cells reading it
    private final Map<RangeRef, Set<CellRef>> rangeReaders = new LinkedHashMap<>();

    /**
     * Replaces every outgoing edge of {@code dependent}. Edges from an earlier
     * version of the formula do not survive.
     */
    public void record(CellRef dependent, Collection<RangeRef> dependencies) {
        remove(dependent);
        if (dependencies.isEmpty())
            return;
        List<RangeRef> edges = List.copyOf(new LinkedHashSet<>(dependencies));
        forward.put(dependent, edges);
        for (RangeRef edge : edges) {
            if (edge.isSingleCell())
                cellReaders.computeIfAbsent(edge.start(), k -> new LinkedHashSet<>()).add(dependent);
            else
                rangeReaders.computeIfAbsent(edge, k -> new LinkedHashSet<>()).add(dependent);
        }
    }

    public void remove(CellRef dependent) {
        List<RangeRef> old = forward.remove(dependent);
        if (old == null)
            return;
        for (RangeRef edge : old) {
            Map<?, Set<CellRef>> index = edge.isSingleCell() ? cellReaders : rangeReaders;
            Object key = edge.isSingleCell() ? edge.start() : edge;
            Set<CellRef> readers = index.get(key);
            if (readers != null) {
                readers.remove(dependent);
                if (readers.isEmpty())
                    index.remove(key);
            }
        }
    }

    public void clear() {
        forward.clear();
        cellReaders.clear();
        rangeReaders.clear();
    }

    /** What {@code cell} reads, in formula order; empty if nothing. */
    public List<RangeRef> edges(CellRef cell) {
        return forward.getOrDefault(cell, Collections.emptyList());
    }

    /** Every cell that currently has outgoing edges. */
    public Set<CellRef> dependents() {
        return Collections.unmodifiableSet(forward.keySet());
    }

    /** Cells whose formula reads {@code cell} directly or through a range. */
    public Set<CellRef> directDependents(CellRef cell) {
        Set<CellRef> result = new LinkedHashSet<>(cellReaders.getOrDefault(cell, Collections.emptySet()));
        for (Map.Entry<RangeRef, Set<CellRef>> e : rangeReaders.entrySet()) {
            if (e.getKey().contains(cell))
                result.addAll(e.getValue());
        }
        return result;
    }

    /**
     * Every cell that transitively reads {@code cell}. Iterative, so it
     * terminates on cycles and never deepens the call stack. The cell itself
     * is included only when it sits on a cycle.
     */
    public Set<CellRef> affectedBy(CellRef cell) {
        return affectedBy(List.of(cell));
    }

    public Set<CellRef> affectedBy(Collection<CellRef> changed) {
        Set<CellRef> seen = new LinkedHashSet<>();
        ArrayDeque<CellRef> work = new ArrayDeque<>(changed);
        while (!work.isEmpty()) {
            CellRef current = work.poll();
            for (CellRef reader : directDependents(current)) {
                if (seen.add(reader))
                    work.add(reader);
            }
        }
        return seen;
    }

    /**
     * Orders {@code roots} so that every cell comes after the cells among
     * {@code roots} it reads (Kahn's algorithm). Dependencies outside the root
     * set are ignored.
     *
     * @throws CircularReferenceException if the roots contain a cycle; it
     *                                    carries the cells that could be ordered
     *                                    and the ones that could not.
     */
    public List<CellRef> topologicalOrder(Collection<CellRef> roots) {
        Set<CellRef> rootSet = new LinkedHashSet<>(roots);
        Map<CellRef, List<CellRef>> readers = new HashMap<>();
        Map<CellRef, Integer> inDegree = new HashMap<>();

        // 1. in-degree = number of roots each root reads
        for (CellRef r : rootSet) {
            Set<CellRef> reads = dependenciesWithin(r, rootSet);
            inDegree.put(r, reads.size());
            for (CellRef d : reads)
                readers.computeIfAbsent(d, k -> new ArrayList<>()).add(r);
        }

        // 2. seed with cells reading no other root
        ArrayDeque<CellRef> queue = new ArrayDeque<>();
        for (CellRef r : rootSet)
            if (inDegree.get(r) == 0)
                queue.add(r);

        // 3. Kahn
        List<CellRef> order = new ArrayList<>(rootSet.size());
        while (!queue.isEmpty()) {
            CellRef curr = queue.poll();
            order.add(curr);
            for (CellRef reader : readers.getOrDefault(curr, Collections.emptyList())) {
                if (inDegree.merge(reader, -1, Integer::sum) == 0)
                    queue.add(reader);
            }
        }
        if (order.size() != rootSet.size()) {
            Set<CellRef> remaining = new LinkedHashSet<>(rootSet);
            order.forEach(remaining::remove);
            throw new CircularReferenceException(order, remaining);
        }
        return order;
    }

    private Set<CellRef> dependenciesWithin(CellRef cell, Set<CellRef> candidates) {
        Set<CellRef> result = new HashSet<>();
        for (RangeRef edge : edges(cell)) {
            if (edge.isSingleCell()) {
                if (candidates.contains(edge.start()))
                    result.add(edge.start());
            } else if (edge.area() <= candidates.size()) {
                for (int r = edge.start().row(); r <= edge.end().row(); r++)
                    for (int c = edge.start().col(); c <= edge.end().col(); c++) {
                        CellRef ref = new CellRef(r, c);
                        if (candidates.contains(ref))
                            result.add(ref);
                    }
            } else {
                for (CellRef candidate : candidates)
                    if (edge.contains(candidate))
                        result.add(candidate);
            }
        }
        return result;
    }

    public int size() {
        return forward.size();
    }

    public int edgeCount() {
        int n = 0;
        for (List<RangeRef> edges : forward.values())
            n += edges.size();
        return n;
    }
}

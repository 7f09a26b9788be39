package com.gridcalc.engine;

import com.gridcalc.api.CellRef;
import com.gridcalc.api.CircularReferenceException;
import com.gridcalc.api.ErrorKind;
import com.gridcalc.api.RangeRef;
import com.gridcalc.api.RecalcListener;
import com.gridcalc.api.Value;
import com.gridcalc.formula.CellResolver;
import com.gridcalc.formula.FormulaEvaluator;
import com.gridcalc.sheet.Cell;
import com.gridcalc.sheet.CellStore;
import com.gridcalc.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Keeps formula values consistent with their inputs.
 *
 * Invalidation: a write marks the written cell and everything that
 * transitively reads it DIRTY. In {@link RecalcMode#AUTOMATIC} their caches
 * are dropped and a pass runs before the write returns. In
 * {@link RecalcMode#MANUAL} the caches are kept, so dependents keep showing
 * their previous values until {@link #recalculate()}.
 *
 * Evaluation is pull-based: before a cell is evaluated, every formula cell it
 * reads that needs evaluating is evaluated first. The walk uses an explicit
 * stack, never JVM recursion, so a chain of any length cannot overflow. A cell
 * met again while it is still on the stack closes a cycle: every cell on the
 * cycle gets {@code #CIRC!} and is reported as circular.
 *
 * One cell's failure never aborts a pass. An exception thrown while evaluating
 * a cell caches {@code #ERR!}, goes to the listener and is logged through a
 * rate limiter.
 *
 * Single-threaded by contract: the owning sheet holds its write lock around
 * every call that can evaluate.
 */
public final class RecalcEngine {
    private static final Logger log = LogManager.getLogger(RecalcEngine.class);

    private final CellStore store;
    private final DependencyGraph graph = new DependencyGraph();
    private final FormulaEvaluator evaluator;
    private final ErrorRateLimiter errLimiter;

    private final Set<CellRef> dirty = new LinkedHashSet<>();
    private final Set<CellRef> circular = new TreeSet<>();

    private Function<String, RangeRef> names = name -> null;
    private RecalcMode mode = RecalcMode.AUTOMATIC;
    private RecalcOrder order = RecalcOrder.NATURAL;
    private RecalcListener listener;
    private long epoch;
    private int batchDepth;
    private RecalcStats lastStats = RecalcStats.NONE;

    public RecalcEngine(CellStore store) {
        this(store, new FormulaEvaluator(), 1000);
    }

    public RecalcEngine(CellStore store, FormulaEvaluator evaluator, long errorLogIntervalMillis) {
        this.store = store;
        this.evaluator = evaluator;
        this.errLimiter = new ErrorRateLimiter(log, errorLogIntervalMillis);
    }

    public void setListener(RecalcListener listener) {
        this.listener = listener;
    }

    /** Lookup used for named ranges inside formulas; returns null for unknown names. */
    public void setNameResolver(Function<String, RangeRef> names) {
        this.names = names != null ? names : name -> null;
    }

    public RecalcMode mode() {
        return mode;
    }

    /** Switching to automatic brings every dirty cell up to date at once. */
    public void setMode(RecalcMode newMode) {
        if (newMode == mode)
            return;
        log.info("Recalculation mode {} -> {}", mode, newMode);
        this.mode = newMode;
        if (newMode == RecalcMode.AUTOMATIC) {
            for (CellRef ref : dirty) {
                Cell cell = store.get(ref);
                if (cell != null)
                    store.invalidate(cell);
            }
            autoRecalc();
        }
    }

    public RecalcOrder order() {
        return order;
    }

    public void setOrder(RecalcOrder order) {
        this.order = order;
    }

    // ── Invalidation ────────────────────────────────────────────────

    /** Call after the cell's text changed or the cell was removed. */
    public void cellChanged(CellRef ref) {
        cellsChanged(List.of(ref));
    }

    /** Like {@link #cellChanged} for several cells, with a single pass at the end. */
    public void cellsChanged(Collection<CellRef> refs) {
        for (CellRef ref : refs) {
            Cell cell = store.get(ref);
            dirty.remove(ref);
            circular.remove(ref);
            if (cell != null && cell.isFormula()) {
                graph.record(ref, FormulaEvaluator.references(cell.content().tokens(), resolverFor(null, null)));
                store.invalidate(cell);
                store.setState(cell, CellState.DIRTY);
                dirty.add(ref);
            } else {
                graph.remove(ref);
                if (cell != null)
                    store.setState(cell, CellState.CLEAN);
            }
        }
        for (CellRef dependent : graph.affectedBy(refs))
            markDirty(dependent);
        autoRecalc();
    }

    /**
     * Throws the graph away and rebuilds it from every formula in the store.
     * Used after structural edits, when every coordinate may have moved.
     */
    public void rebuild() {
        graph.clear();
        dirty.clear();
        circular.clear();
        List<CellRef> formulas = store.formulaCells();
        for (CellRef ref : formulas) {
            Cell cell = store.get(ref);
            graph.record(ref, FormulaEvaluator.references(cell.content().tokens(), resolverFor(null, null)));
            markDirty(ref);
        }
        log.info("Dependency graph rebuilt: {} formula cells, {} edges", formulas.size(), graph.edgeCount());
        autoRecalc();
    }

    private void markDirty(CellRef ref) {
        Cell cell = store.get(ref);
        if (cell == null || !cell.isFormula())
            return;
        if (mode == RecalcMode.AUTOMATIC)
            store.invalidate(cell);
        store.setState(cell, CellState.DIRTY);
        dirty.add(ref);
    }

    private void autoRecalc() {
        if (mode == RecalcMode.AUTOMATIC && batchDepth == 0 && !dirty.isEmpty())
            runPass(new ArrayList<>(dirty), true);
    }

    // ── Batches ─────────────────────────────────────────────────────

    /** Defers automatic recalculation until the matching {@link #endBatch()}. Nests. */
    public void beginBatch() {
        batchDepth++;
    }

    /** @return stats of the pass run when the outermost batch closes, or null if none ran. */
    public RecalcStats endBatch() {
        if (batchDepth == 0)
            throw new IllegalStateException("endBatch() without beginBatch()");
        if (--batchDepth > 0 || mode != RecalcMode.AUTOMATIC || dirty.isEmpty())
            return null;
        return runPass(new ArrayList<>(dirty), true);
    }

    public boolean inBatch() {
        return batchDepth > 0;
    }

    // ── Passes ──────────────────────────────────────────────────────

    /** Brings every dirty cell up to date in the configured order. */
    public RecalcStats recalculate() {
        return runPass(new ArrayList<>(dirty), true);
    }

    /** Re-evaluates every formula cell, dirty or not. */
    public RecalcStats recalculateAll() {
        List<CellRef> formulas = store.formulaCells();
        for (CellRef ref : formulas) {
            Cell cell = store.get(ref);
            store.invalidate(cell);
            store.setState(cell, CellState.DIRTY);
            dirty.add(ref);
        }
        return runPass(formulas, true);
    }

    /**
     * Current value of a cell. A formula with a cached value answers from the
     * cache (in manual mode it may be stale); one without is evaluated now.
     */
    public Value value(CellRef ref) {
        Cell cell = store.get(ref);
        if (cell == null)
            return Value.EMPTY;
        if (!cell.isFormula())
            return cell.content().constantValue();
        Value cached = cell.cachedValue();
        if (cached != null)
            return cached;
        runPass(List.of(ref), mode == RecalcMode.AUTOMATIC);
        Value computed = cell.cachedValue();
        return computed != null ? computed : Value.error(ErrorKind.GENERIC);
    }

    private RecalcStats runPass(Collection<CellRef> roots, boolean refreshStale) {
        RecalcSession session = new RecalcSession(++epoch, refreshStale);
        final RecalcListener l = this.listener;
        if (l != null)
            l.onRecalcStart(session.epoch);
        try {
            for (CellRef ref : visitOrder(roots)) {
                Cell cell = store.get(ref);
                if (cell == null || !cell.isFormula()) {
                    dirty.remove(ref);
                    continue;
                }
                if (needsEvaluation(cell, session))
                    evaluate(ref, cell, session);
            }
        } finally {
            lastStats = session.stats();
            if (l != null)
                l.onRecalcEnd(session.epoch, session.evaluated);
        }
        if (!session.circular.isEmpty())
            log.warn("Circular reference detected in pass {}: {}", session.epoch, session.circular);
        log.debug("Pass {}: {} cells evaluated, {} errors, {} us", session.epoch, lastStats.cellsEvaluated(),
                lastStats.errorsFound(), lastStats.elapsedNanos() / 1000);
        return lastStats;
    }

    private List<CellRef> visitOrder(Collection<CellRef> roots) {
        if (order == RecalcOrder.NATURAL) {
            try {
                return graph.topologicalOrder(roots);
            } catch (CircularReferenceException e) {
                // cycle members still get visited, and become #CIRC! when evaluated
                List<CellRef> visit = new ArrayList<>(e.partialOrder());
                visit.addAll(e.cyclicCells());
                return visit;
            }
        }
        List<CellRef> visit = new ArrayList<>(roots);
        visit.sort(order.scanOrder());
        return visit;
    }

    private static boolean needsEvaluation(Cell cell, RecalcSession session) {
        return cell.cachedValue() == null || (session.refreshStale && cell.state() == CellState.DIRTY);
    }

    // ── Evaluation ──────────────────────────────────────────────────

    private static final class Frame {
        final CellRef ref;
        final Cell cell;
        final Iterator<CellRef> pending;

        Frame(CellRef ref, Cell cell, Iterator<CellRef> pending) {
            this.ref = ref;
            this.cell = cell;
            this.pending = pending;
        }
    }

    private void evaluate(CellRef root, Cell rootCell, RecalcSession session) {
        Deque<Frame> stack = new ArrayDeque<>();
        push(stack, root, rootCell, session);
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            Frame next = nextDependency(top, stack, session);
            if (next != null) {
                stack.push(next);
                continue;
            }
            stack.pop();
            compute(top.ref, top.cell, session);
        }
    }

    private void push(Deque<Frame> stack, CellRef ref, Cell cell, RecalcSession session) {
        stack.push(frame(ref, cell, session));
    }

    private Frame frame(CellRef ref, Cell cell, RecalcSession session) {
        store.setState(cell, CellState.RECALCULATING);
        session.inProgress.add(ref);
        return new Frame(ref, cell, formulaDependencies(ref).iterator());
    }

    /** The next dependency of {@code top} that must be evaluated first, or null when none is left. */
    private Frame nextDependency(Frame top, Deque<Frame> stack, RecalcSession session) {
        while (top.pending.hasNext()) {
            CellRef dep = top.pending.next();
            if (session.inProgress.contains(dep)) {
                markCycle(dep, stack, session);
                continue;
            }
            Cell cell = store.get(dep);
            if (cell != null && cell.isFormula() && needsEvaluation(cell, session))
                return frame(dep, cell, session);
        }
        return null;
    }

    /** Every frame from the top of the stack down to {@code reentered} is on the cycle. */
    private static void markCycle(CellRef reentered, Deque<Frame> stack, RecalcSession session) {
        for (Frame f : stack) {
            session.circular.add(f.ref);
            if (f.ref.equals(reentered))
                break;
        }
    }

    private Set<CellRef> formulaDependencies(CellRef ref) {
        List<RangeRef> edges = graph.edges(ref);
        if (edges.isEmpty())
            return Collections.emptySet();
        Set<CellRef> deps = new LinkedHashSet<>();
        for (RangeRef edge : edges) {
            if (edge.isSingleCell()) {
                Cell cell = store.get(edge.start());
                if (cell != null && cell.isFormula())
                    deps.add(edge.start());
            } else {
                store.forEachIn(edge, (r, c) -> {
                    if (c.isFormula())
                        deps.add(r);
                });
            }
        }
        return deps;
    }

    private void compute(CellRef ref, Cell cell, RecalcSession session) {
        final RecalcListener l = this.listener;
        List<RangeRef> touched = new ArrayList<>();
        long start = System.nanoTime();
        Value value;
        try {
            value = evaluator.evaluate(cell.content().tokens(), resolverFor(session, touched));
        } catch (Throwable t) {
            value = Value.error(ErrorKind.GENERIC);
            errLimiter.log("Error evaluating cell " + ref, t);
            if (l != null)
                l.onCellError(session.epoch, ref, t);
        }
        long duration = System.nanoTime() - start;

        session.inProgress.remove(ref);
        graph.record(ref, touched);
        dirty.remove(ref);
        session.evaluated++;

        if (session.circular.contains(ref)) {
            value = Value.error(ErrorKind.CIRCULAR);
            store.setState(cell, CellState.CIRCULAR_DETECTED);
            circular.add(ref);
            if (l != null)
                l.onCircularReference(session.epoch, ref);
        } else {
            store.setState(cell, CellState.CLEAN);
            circular.remove(ref);
        }
        if (value.isError())
            session.errors++;
        store.cacheValue(cell, value);
        if (l != null)
            l.onCellEvaluated(session.epoch, ref, value, duration);
    }

    /**
     * Resolver serving evaluation. With a null session it only resolves names,
     * which is all reference extraction needs.
     */
    private CellResolver resolverFor(RecalcSession session, List<RangeRef> touched) {
        return new CellResolver() {
            @Override
            public Value cellValue(CellRef ref) {
                Cell cell = store.get(ref);
                if (cell == null)
                    return Value.EMPTY;
                if (!cell.isFormula())
                    return cell.content().constantValue();
                if (session.inProgress.contains(ref)) {
                    session.circular.add(ref);
                    return Value.error(ErrorKind.CIRCULAR);
                }
                if (needsEvaluation(cell, session))
                    evaluate(ref, cell, session);
                Value v = cell.cachedValue();
                return v != null ? v : Value.error(ErrorKind.GENERIC);
            }

            @Override
            public List<Value> rangeValues(RangeRef range) {
                List<Value> values = new ArrayList<>();
                store.forEachIn(range, (r, c) -> {
                    Value v = c.isFormula() ? cellValue(r) : c.content().constantValue();
                    if (!v.isEmpty())
                        values.add(v);
                });
                return values;
            }

            @Override
            public void reference(RangeRef range) {
                if (touched != null)
                    touched.add(range);
            }

            @Override
            public RangeRef namedRange(String name) {
                return names.apply(name);
            }
        };
    }

    // ── Introspection ───────────────────────────────────────────────

    public DependencyGraph graph() {
        return graph;
    }

    public boolean needsRecalc() {
        return !dirty.isEmpty();
    }

    public Set<CellRef> dirtyCells() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(dirty));
    }

    public boolean hasCircularRefs() {
        return !circular.isEmpty();
    }

    public Set<CellRef> circularReferences() {
        return Collections.unmodifiableSet(new TreeSet<>(circular));
    }

    public long epoch() {
        return epoch;
    }

    public RecalcStats lastStats() {
        return lastStats;
    }

    public FormulaEvaluator evaluator() {
        return evaluator;
    }
}

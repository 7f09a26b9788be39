package com.gridcalc.util;

import com.gridcalc.api.CellRef;
import com.gridcalc.api.RangeRef;
import com.gridcalc.sheet.Cell;
import com.gridcalc.sheet.Sheet;

import java.util.List;
import java.util.Set;

/**
 * Human-readable dumps of cell state and formula dependencies.
 *
 * <p>
 * Meant for debugging sessions and error logs. Allocates freely; keep it off
 * hot paths.
 */
public final class SheetExplain {
    private final Sheet sheet;

    public SheetExplain(Sheet sheet) {
        this.sheet = sheet;
    }

    /** Raw text, value, display, state and edges of one cell. */
    public String explainCell(CellRef ref) {
        Cell cell = sheet.getCellIfExists(ref.row(), ref.col());
        StringBuilder sb = new StringBuilder(256);
        sb.append("Cell: ").append(ref).append('\n');
        if (cell == null)
            return sb.append("  (empty)\n").toString();
        sb.append("  Raw: ").append(cell.rawText()).append('\n')
                .append("  Kind: ").append(cell.content().kind()).append('\n')
                .append("  Value: ").append(sheet.getValue(ref)).append('\n')
                .append("  Display: '").append(sheet.getDisplayValue(ref.row(), ref.col())).append("'\n")
                .append("  State: ").append(cell.state()).append('\n')
                .append("  Format: ").append(cell.formatCode() != null ? cell.formatCode() : "(default)").append('\n')
                .append("  Protected: ").append(cell.isProtected()).append('\n');
        List<RangeRef> deps = sheet.dependenciesOf(ref);
        sb.append("  Reads (").append(deps.size()).append("): ");
        join(sb, deps);
        Set<CellRef> readers = sheet.dependentsOf(ref);
        sb.append("\n  Read by (").append(readers.size()).append("): ");
        join(sb, readers);
        return sb.append('\n').toString();
    }

    /** Summary of the last recalculation pass. */
    public String explainLastRecalc() {
        var stats = sheet.lastStats();
        return "Epoch: " + stats.epoch() + ", Evaluated: " + stats.cellsEvaluated() + ", Errors: "
                + stats.errorsFound() + ", Circular: " + stats.circularFound();
    }

    /** One line per formula cell: {@code A3 = A1+A2 <- A1, A2}. */
    public String dumpDependencies() {
        List<CellRef> formulas = sheet.formulaCells();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Formulas (").append(formulas.size()).append("):\n");
        for (CellRef ref : formulas) {
            sb.append("  ").append(ref).append(' ').append(sheet.getRawText(ref.row(), ref.col()));
            List<RangeRef> deps = sheet.dependenciesOf(ref);
            if (!deps.isEmpty()) {
                sb.append(" <- ");
                join(sb, deps);
            }
            if (sheet.circularReferences().contains(ref))
                sb.append(" (CIRC)");
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void join(StringBuilder sb, Iterable<?> items) {
        boolean first = true;
        for (Object item : items) {
            if (!first)
                sb.append(", ");
            sb.append(item);
            first = false;
        }
    }
}

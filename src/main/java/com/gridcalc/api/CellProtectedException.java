package com.gridcalc.api;

/** Thrown when sheet protection rejects an edit. */
public class CellProtectedException extends RuntimeException {

    private final CellRef cell;

    public CellProtectedException(CellRef cell) {
        super("Cell " + cell + " is protected");
        this.cell = cell;
    }

    public CellProtectedException(String message) {
        super(message);
        this.cell = null;
    }

    /** The rejected cell, or null for a rejected structural edit. */
    public CellRef cell() {
        return cell;
    }
}

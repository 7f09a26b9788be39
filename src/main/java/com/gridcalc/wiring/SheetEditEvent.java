package com.gridcalc.wiring;

/**
 * One cell edit travelling through the ring buffer.
 *
 * Instances are allocated once when the ring buffer is built and reused for
 * every edit, so producers overwrite all fields on each publish.
 *
 * {@code batchEnd} forces a recalculation right after this edit even when more
 * edits are already queued.
 */
public final class SheetEditEvent {
    private int row = -1;
    private int col = -1;
    private String text;
    private boolean batchEnd;
    private long sequenceId;

    public void setEdit(int row, int col, String text, boolean batchEnd, long seqId) {
        this.row = row;
        this.col = col;
        this.text = text;
        this.batchEnd = batchEnd;
        this.sequenceId = seqId;
    }

    public int row() {
        return row;
    }

    public int col() {
        return col;
    }

    public String text() {
        return text;
    }

    public boolean isBatchEnd() {
        return batchEnd;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        row = -1;
        col = -1;
        text = null;
        batchEnd = false;
        sequenceId = 0;
    }
}

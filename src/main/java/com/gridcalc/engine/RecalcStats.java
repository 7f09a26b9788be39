package com.gridcalc.engine;

/**
 * Outcome of one recalculation pass.
 *
 * @param epoch            pass number
 * @param cellsEvaluated   formula cells evaluated
 * @param circularFound    cells found on a reference cycle
 * @param errorsFound      cells whose new value is an error
 * @param elapsedNanos     wall time of the pass
 */
public record RecalcStats(long epoch, int cellsEvaluated, int circularFound, int errorsFound, long elapsedNanos) {

    public static final RecalcStats NONE = new RecalcStats(0, 0, 0, 0, 0);

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}

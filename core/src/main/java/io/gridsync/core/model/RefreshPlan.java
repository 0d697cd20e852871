package io.gridsync.core.model;

/**
 * The redraw an apply pass asks of the grid, run once on the next frame.
 *
 * @param header        redraw column headers
 * @param cells         redraw cells
 * @param force         redraw even cells whose value did not change
 * @param suppressFlash do not flash redrawn cells
 */
public record RefreshPlan(boolean header, boolean cells, boolean force, boolean suppressFlash) {

    /** No redraw at all. */
    public static final RefreshPlan NONE = new RefreshPlan(false, false, false, true);

    /** Full forced redraw of header and cells, used after a profile load. */
    public static final RefreshPlan FORCED = new RefreshPlan(true, true, true, false);

    /** Non-forcing, flash-suppressing redraw of the requested regions. */
    public static RefreshPlan incremental(boolean header, boolean cells) {
        if (!header && !cells) {
            return NONE;
        }
        return new RefreshPlan(header, cells, false, true);
    }

    public boolean isEmpty() {
        return !header && !cells;
    }
}

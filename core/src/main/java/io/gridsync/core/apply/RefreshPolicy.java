package io.gridsync.core.apply;

/** How aggressively the grid is redrawn after an apply pass. */
public enum RefreshPolicy {
    /**
     * Redraw only the regions the applied categories affect, without forcing unchanged cells and
     * without flashing. Nothing is redrawn when nothing was applied.
     */
    INCREMENTAL,
    /** Redraw header and every cell, forced. Used after loading a profile. */
    FORCED
}

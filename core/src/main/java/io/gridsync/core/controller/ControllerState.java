package io.gridsync.core.controller;

/** Lifecycle of a {@link SettingsController}. */
public enum ControllerState {
    /** No grid has been bound yet. Edits are ignored. */
    UNINITIALIZED,
    /** A grid is bound; the first full apply has not run yet. */
    BOUND,
    /** A grid is bound and holds the canonical state. */
    READY,
    /** The grid was unbound. Edits are ignored until the next bind. */
    UNBOUND;

    /** True while a grid is attached. */
    public boolean isAttached() {
        return this == BOUND || this == READY;
    }
}

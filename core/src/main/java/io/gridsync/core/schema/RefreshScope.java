package io.gridsync.core.schema;

/** Which part of the grid must be redrawn after an option changes. */
public enum RefreshScope {
    NONE,
    HEADER,
    CELLS
}

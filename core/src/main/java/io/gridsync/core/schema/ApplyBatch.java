package io.gridsync.core.schema;

/**
 * Application batches in the order they are pushed to the grid. Declaration order is application
 * order: special options first, then options that need no refresh, then layout and so on.
 */
public enum ApplyBatch {
    SPECIAL(false),
    IMMEDIATE(false),
    LAYOUT(true),
    DATA(true),
    GROUPING(true),
    EDITING(true),
    OTHER(true);

    private final boolean transactional;

    ApplyBatch(boolean transactional) {
        this.transactional = transactional;
    }

    /** Whether the batch is wrapped in one grid update transaction when the grid supports it. */
    public boolean isTransactional() {
        return transactional;
    }
}

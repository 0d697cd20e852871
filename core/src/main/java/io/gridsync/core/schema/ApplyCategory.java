package io.gridsync.core.schema;

/** Category of a canonical option. Decides its application batch and the redraw it requires. */
public enum ApplyCategory {
    SPECIAL,
    NO_REFRESH,
    LAYOUT,
    COLUMN_BEHAVIOR,
    DATA,
    SELECTION,
    GROUPING,
    EDITING,
    OTHER;

    /** The batch options of this category are applied in. */
    public ApplyBatch batch() {
        return switch (this) {
            case SPECIAL -> ApplyBatch.SPECIAL;
            case NO_REFRESH -> ApplyBatch.IMMEDIATE;
            case LAYOUT, COLUMN_BEHAVIOR -> ApplyBatch.LAYOUT;
            case DATA, SELECTION -> ApplyBatch.DATA;
            case GROUPING -> ApplyBatch.GROUPING;
            case EDITING -> ApplyBatch.EDITING;
            case OTHER -> ApplyBatch.OTHER;
        };
    }

    /** The redraw a change in this category requires. */
    public RefreshScope refreshScope() {
        return switch (this) {
            case LAYOUT, COLUMN_BEHAVIOR -> RefreshScope.HEADER;
            case DATA, SELECTION, GROUPING, EDITING -> RefreshScope.CELLS;
            case SPECIAL, NO_REFRESH, OTHER -> RefreshScope.NONE;
        };
    }
}

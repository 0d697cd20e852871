package io.gridsync.core.model;

/**
 * Bookkeeping stored with each snapshot.
 *
 * @param createdAt     epoch millis of the first save
 * @param updatedAt     epoch millis of the latest save
 * @param schemaVersion snapshot layout version
 */
public record SnapshotMetadata(long createdAt, long updatedAt, int schemaVersion) {

    /** Current snapshot layout version. */
    public static final int CURRENT_SCHEMA_VERSION = 1;

    public static SnapshotMetadata firstSavedAt(long epochMillis) {
        return new SnapshotMetadata(epochMillis, epochMillis, CURRENT_SCHEMA_VERSION);
    }

    /** Same creation time, new update time. */
    public SnapshotMetadata touchedAt(long epochMillis) {
        return new SnapshotMetadata(createdAt, epochMillis, CURRENT_SCHEMA_VERSION);
    }
}

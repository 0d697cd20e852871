package io.gridsync.core.error;

/**
 * Thrown when a persisted snapshot cannot be parsed at all (not JSON, or not a JSON object).
 * Structurally incomplete snapshots do not raise this: missing sections are filled with defaults
 * and reported as warnings.
 */
public final class SnapshotCodecException extends GridSyncException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SnapshotCodecException(String message, String source) {
        super(message, Area.SNAPSHOT);
        this.source = source;
    }

    public SnapshotCodecException(String message, Throwable cause, String source) {
        super(message, cause, Area.SNAPSHOT);
        this.source = source;
    }

    /** Where the snapshot came from (profile name or file path), or {@code null}. */
    public String source() {
        return source;
    }
}

package io.gridsync.core.store;

import io.gridsync.core.model.Snapshot;
import java.util.List;
import java.util.Objects;

/**
 * A decoded snapshot plus the problems found while decoding it.
 *
 * @param snapshot the snapshot, with defaults filled in for any unusable section
 * @param warnings human-readable problems; empty for a well-formed snapshot
 */
public record SnapshotReadResult(Snapshot snapshot, List<String> warnings) {

    public SnapshotReadResult {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isClean() {
        return warnings.isEmpty();
    }
}

package io.gridsync.core.normalize;

import io.gridsync.core.model.OptionBag;
import java.util.Objects;
import java.util.Set;

/**
 * Result of normalizing a raw option bag.
 *
 * @param options     canonical options, keyed by canonical name
 * @param changedKeys canonical names produced by this pass; when normalized against a baseline,
 *                    only those whose value differs from it
 */
public record NormalizedOptions(OptionBag options, Set<String> changedKeys) {

    public NormalizedOptions {
        Objects.requireNonNull(options, "options must not be null");
        changedKeys = changedKeys == null ? Set.of() : Set.copyOf(changedKeys);
    }
}

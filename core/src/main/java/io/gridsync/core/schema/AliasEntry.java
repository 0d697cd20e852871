package io.gridsync.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One legacy option name and how its value maps onto a canonical option.
 *
 * @param legacyName    the deprecated option name
 * @param canonicalName the canonical option it maps to
 * @param transform     converts the legacy value into the canonical value (or a fragment of it)
 * @param mergeStrategy how the result combines with other values for the same canonical option
 */
public record AliasEntry(
        String legacyName, String canonicalName, UnaryOperator<JsonNode> transform, MergeStrategy mergeStrategy) {

    public AliasEntry {
        Objects.requireNonNull(legacyName, "legacyName must not be null");
        Objects.requireNonNull(canonicalName, "canonicalName must not be null");
        Objects.requireNonNull(transform, "transform must not be null");
        Objects.requireNonNull(mergeStrategy, "mergeStrategy must not be null");
    }

    /** Applies the transform to a legacy value. */
    public AliasResolution resolve(JsonNode legacyValue) {
        return new AliasResolution(canonicalName, transform.apply(legacyValue), mergeStrategy, true);
    }
}

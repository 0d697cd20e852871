package io.gridsync.core.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of resolving one raw option through the alias table.
 *
 * @param canonicalName  the option name to store the value under
 * @param canonicalValue the value in canonical shape
 * @param mergeStrategy  how to combine with an already present value for the same name
 * @param aliased        true when the raw name was a legacy alias
 */
public record AliasResolution(
        String canonicalName, JsonNode canonicalValue, MergeStrategy mergeStrategy, boolean aliased) {}

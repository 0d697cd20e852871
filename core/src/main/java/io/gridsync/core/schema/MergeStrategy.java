package io.gridsync.core.schema;

/** How a resolved option value combines with a value already present for the same canonical key. */
public enum MergeStrategy {
    /** The new value replaces the old one. */
    REPLACE,
    /** The new object's fields are merged shallowly onto the old object. */
    MERGE_INTO
}

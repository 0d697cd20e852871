package io.gridsync.core.model;

/**
 * One column of the active sort.
 *
 * @param colId     column id
 * @param sort      {@code "asc"} or {@code "desc"}
 * @param sortIndex position in a multi-column sort
 */
public record SortEntry(String colId, String sort, int sortIndex) {}

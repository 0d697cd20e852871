package io.gridsync.core.model;

/** Open/closed state of one column group. */
public record ColumnGroupState(String groupId, boolean open) {}

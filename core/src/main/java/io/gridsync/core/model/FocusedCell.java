package io.gridsync.core.model;

/** The cell holding keyboard focus. */
public record FocusedCell(int rowIndex, String columnId) {}

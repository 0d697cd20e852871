package io.gridsync.core.model;

import java.util.List;

/**
 * Row grouping as reported by the grid.
 *
 * @param groupedColumns ids of the row group columns, outermost first
 * @param expandedGroups keys of the expanded group rows
 */
public record RowGroupState(List<String> groupedColumns, List<String> expandedGroups) {

    public RowGroupState {
        groupedColumns = groupedColumns == null ? List.of() : List.copyOf(groupedColumns);
        expandedGroups = expandedGroups == null ? List.of() : List.copyOf(expandedGroups);
    }
}

package io.gridsync.core.model;

import java.util.List;

/**
 * A selected cell range.
 *
 * @param startRow first row index, inclusive
 * @param endRow   last row index, inclusive
 * @param columns  ids of the columns in the range
 */
public record CellRange(int startRow, int endRow, List<String> columns) {

    public CellRange {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}

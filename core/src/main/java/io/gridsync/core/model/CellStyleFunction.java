package io.gridsync.core.model;

import java.util.Map;

/**
 * Computes the inline style of a cell. Synthesized from alignment inputs and attached to a
 * column definition before it is handed to the grid.
 */
@FunctionalInterface
public interface CellStyleFunction {

    /**
     * Returns the CSS properties for the given cell.
     *
     * @param cell the cell being rendered
     * @return style properties, never {@code null}
     */
    Map<String, String> styleFor(CellContext cell);

    /**
     * The facts about a cell a style function may consult.
     *
     * @param columnId   id of the column the cell belongs to
     * @param columnType declared column type, e.g. {@code "numericColumn"}, or {@code null}
     */
    record CellContext(String columnId, String columnType) {

        public boolean isNumeric() {
            return columnType != null && columnType.contains("numericColumn");
        }
    }
}

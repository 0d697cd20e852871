package io.gridsync.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * Per-column layout as reported by the grid. Every field except {@code colId} is optional.
 *
 * @param colId         column id
 * @param width         width in pixels
 * @param hide          whether the column is hidden
 * @param pinned        {@code "left"}, {@code "right"} or {@code null}
 * @param sort          {@code "asc"}, {@code "desc"} or {@code null}
 * @param sortIndex     position in a multi-column sort
 * @param flex          flex weight, when the column is flex-sized
 * @param aggFunc       aggregation function name
 * @param rowGroup      whether the column is a row group
 * @param rowGroupIndex position among row group columns
 * @param pivot         whether the column is a pivot
 * @param pivotIndex    position among pivot columns
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnState(
        String colId,
        Integer width,
        Boolean hide,
        String pinned,
        String sort,
        Integer sortIndex,
        Double flex,
        String aggFunc,
        Boolean rowGroup,
        Integer rowGroupIndex,
        Boolean pivot,
        Integer pivotIndex) {

    public ColumnState {
        Objects.requireNonNull(colId, "colId must not be null");
    }

    /** A column with only an id and a width. */
    public static ColumnState ofWidth(String colId, Integer width) {
        return new ColumnState(colId, width, null, null, null, null, null, null, null, null, null, null);
    }

    public ColumnState withWidth(Integer newWidth) {
        return new ColumnState(
                colId, newWidth, hide, pinned, sort, sortIndex, flex, aggFunc, rowGroup, rowGroupIndex, pivot,
                pivotIndex);
    }

    public ColumnState withSort(String newSort, Integer newSortIndex) {
        return new ColumnState(
                colId, width, hide, pinned, newSort, newSortIndex, flex, aggFunc, rowGroup, rowGroupIndex, pivot,
                pivotIndex);
    }

    public ColumnState withHide(Boolean newHide) {
        return new ColumnState(
                colId, width, newHide, pinned, sort, sortIndex, flex, aggFunc, rowGroup, rowGroupIndex, pivot,
                pivotIndex);
    }

    /** This column without width and flex, for replaying order and visibility first. */
    public ColumnState withoutSizing() {
        return new ColumnState(
                colId, null, hide, pinned, sort, sortIndex, null, aggFunc, rowGroup, rowGroupIndex, pivot, pivotIndex);
    }
}

package io.gridsync.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Everything about the live view that is not a grid option: column layout, sort, filters,
 * grouping, selection, scroll and focus. Captured when a profile is saved and replayed shortly
 * after it is loaded.
 *
 * <p>
 * Every facet is optional. A facet that could not be read at capture time is simply absent.
 *
 * <p>
 * {@code sortState} and {@code displayedColumns} are derived from the column state and kept for
 * readers of the stored profile; replay restores sort and order from {@code columnState}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransientViewState(
        List<ColumnState> columnState,
        List<SortEntry> sortState,
        List<ColumnGroupState> columnGroupState,
        RowGroupState rowGroupState,
        JsonNode filterModel,
        JsonNode advancedFilterModel,
        String quickFilterText,
        SelectionState selectionState,
        List<CellRange> rangeSelection,
        SideBarState sideBarState,
        PaginationState paginationState,
        ScrollPosition scrollPosition,
        FocusedCell focusedCell,
        List<String> displayedColumns,
        ColumnSizing columnSizing,
        ObjectNode capturedOptions) {

    /** State with no facets at all. */
    public static final TransientViewState EMPTY = builder().build();

    public TransientViewState {
        columnState = columnState == null ? null : List.copyOf(columnState);
        sortState = sortState == null ? null : List.copyOf(sortState);
        columnGroupState = columnGroupState == null ? null : List.copyOf(columnGroupState);
        filterModel = filterModel == null ? null : filterModel.deepCopy();
        advancedFilterModel = advancedFilterModel == null ? null : advancedFilterModel.deepCopy();
        rangeSelection = rangeSelection == null ? null : List.copyOf(rangeSelection);
        displayedColumns = displayedColumns == null ? null : List.copyOf(displayedColumns);
        capturedOptions = capturedOptions == null ? null : capturedOptions.deepCopy();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** True when no facet was captured. */
    @JsonIgnore
    public boolean isEmpty() {
        return columnState == null
                && sortState == null
                && columnGroupState == null
                && rowGroupState == null
                && filterModel == null
                && advancedFilterModel == null
                && quickFilterText == null
                && selectionState == null
                && rangeSelection == null
                && sideBarState == null
                && paginationState == null
                && scrollPosition == null
                && focusedCell == null
                && displayedColumns == null
                && columnSizing == null
                && capturedOptions == null;
    }

    /** Builder; unset facets stay absent. */
    public static final class Builder {

        private List<ColumnState> columnState;
        private List<SortEntry> sortState;
        private List<ColumnGroupState> columnGroupState;
        private RowGroupState rowGroupState;
        private JsonNode filterModel;
        private JsonNode advancedFilterModel;
        private String quickFilterText;
        private SelectionState selectionState;
        private List<CellRange> rangeSelection;
        private SideBarState sideBarState;
        private PaginationState paginationState;
        private ScrollPosition scrollPosition;
        private FocusedCell focusedCell;
        private List<String> displayedColumns;
        private ColumnSizing columnSizing;
        private ObjectNode capturedOptions;

        Builder() {}

        public Builder columnState(List<ColumnState> columnState) {
            this.columnState = columnState;
            return this;
        }

        public Builder sortState(List<SortEntry> sortState) {
            this.sortState = sortState;
            return this;
        }

        public Builder columnGroupState(List<ColumnGroupState> columnGroupState) {
            this.columnGroupState = columnGroupState;
            return this;
        }

        public Builder rowGroupState(RowGroupState rowGroupState) {
            this.rowGroupState = rowGroupState;
            return this;
        }

        public Builder filterModel(JsonNode filterModel) {
            this.filterModel = filterModel;
            return this;
        }

        public Builder advancedFilterModel(JsonNode advancedFilterModel) {
            this.advancedFilterModel = advancedFilterModel;
            return this;
        }

        public Builder quickFilterText(String quickFilterText) {
            this.quickFilterText = quickFilterText;
            return this;
        }

        public Builder selectionState(SelectionState selectionState) {
            this.selectionState = selectionState;
            return this;
        }

        public Builder rangeSelection(List<CellRange> rangeSelection) {
            this.rangeSelection = rangeSelection;
            return this;
        }

        public Builder sideBarState(SideBarState sideBarState) {
            this.sideBarState = sideBarState;
            return this;
        }

        public Builder paginationState(PaginationState paginationState) {
            this.paginationState = paginationState;
            return this;
        }

        public Builder scrollPosition(ScrollPosition scrollPosition) {
            this.scrollPosition = scrollPosition;
            return this;
        }

        public Builder focusedCell(FocusedCell focusedCell) {
            this.focusedCell = focusedCell;
            return this;
        }

        public Builder displayedColumns(List<String> displayedColumns) {
            this.displayedColumns = displayedColumns;
            return this;
        }

        public Builder columnSizing(ColumnSizing columnSizing) {
            this.columnSizing = columnSizing;
            return this;
        }

        public Builder capturedOptions(ObjectNode capturedOptions) {
            this.capturedOptions = capturedOptions;
            return this;
        }

        public TransientViewState build() {
            return new TransientViewState(
                    columnState,
                    sortState,
                    columnGroupState,
                    rowGroupState,
                    filterModel,
                    advancedFilterModel,
                    quickFilterText,
                    selectionState,
                    rangeSelection,
                    sideBarState,
                    paginationState,
                    scrollPosition,
                    focusedCell,
                    displayedColumns,
                    columnSizing,
                    capturedOptions);
        }
    }
}

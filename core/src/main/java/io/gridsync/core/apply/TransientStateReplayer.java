package io.gridsync.core.apply;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.gridsync.core.model.ApplyResult;
import io.gridsync.core.model.ColumnState;
import io.gridsync.core.model.JsonNodes;
import io.gridsync.core.model.OptionValue;
import io.gridsync.core.model.PaginationState;
import io.gridsync.core.model.SelectionState;
import io.gridsync.core.model.SideBarState;
import io.gridsync.core.model.TransientViewState;
import io.gridsync.core.spi.GridInstance;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a captured {@link TransientViewState} onto a live grid.
 *
 * <p>
 * Each facet is replayed on its own; a facet the grid rejects is reported in the result's errors
 * and the remaining facets still go through. Facet names used in results: {@code columnState},
 * {@code columnWidths}, {@code columnGroupState}, {@code filterModel}, {@code advancedFilterModel},
 * {@code quickFilterText}, {@code rowGroupState}, {@code selection}, {@code rangeSelection},
 * {@code sideBar}, {@code pagination}, {@code scrollPosition}, {@code focusedCell}.
 *
 * <p>
 * {@code sortState} and {@code displayedColumns} are informational: sort and column order are
 * replayed through {@code columnState}.
 *
 * <p>
 * Column widths are replayed twice: once with the rest of the state and once more, after a
 * further delay, via {@link #reassertWidths}, because flex layout may override them while the grid
 * settles.
 */
public final class TransientStateReplayer {

    private static final Logger LOG = LoggerFactory.getLogger(TransientStateReplayer.class);

    private static final String SERVER_SIDE = "serverSide";
    private static final String QUICK_FILTER_TEXT = "quickFilterText";

    /**
     * Replays every captured facet.
     *
     * @return the facets replayed and the facets the grid rejected
     */
    public ApplyResult replay(GridInstance grid, TransientViewState state) {
        ApplyResult.Builder result = ApplyResult.builder();
        if (state == null || state.isEmpty()) {
            return result.build();
        }

        if (state.columnState() != null && !state.columnState().isEmpty()) {
            replayColumns(grid, state.columnState(), result);
        }
        Map<String, Integer> widths = widthsOf(state);
        if (!widths.isEmpty()) {
            facet(result, "columnWidths", () -> grid.setColumnWidths(widths));
        }
        if (state.columnGroupState() != null && !state.columnGroupState().isEmpty()) {
            facet(result, "columnGroupState", () -> grid.setColumnGroupState(state.columnGroupState()));
        }
        if (state.filterModel() != null) {
            facet(result, "filterModel", () -> grid.setFilterModel(state.filterModel()));
        }
        if (state.advancedFilterModel() != null) {
            facet(result, "advancedFilterModel", () -> grid.setAdvancedFilterModel(state.advancedFilterModel()));
        }
        if (state.quickFilterText() != null) {
            facet(result, "quickFilterText", () -> grid.setOption(
                    QUICK_FILTER_TEXT, OptionValue.scalar(TextNode.valueOf(state.quickFilterText()))));
        }
        if (state.rowGroupState() != null && !state.rowGroupState().expandedGroups().isEmpty()) {
            facet(result, "rowGroupState", () -> grid.setExpandedGroupKeys(
                    state.rowGroupState().expandedGroups()));
        }
        if (state.selectionState() != null) {
            facet(result, "selection", () -> replaySelection(grid, state.selectionState()));
        }
        if (state.rangeSelection() != null && !state.rangeSelection().isEmpty()) {
            facet(result, "rangeSelection", () -> grid.setCellRanges(state.rangeSelection()));
        }
        if (state.sideBarState() != null) {
            facet(result, "sideBar", () -> replaySideBar(grid, state.sideBarState()));
        }
        if (state.paginationState() != null) {
            facet(result, "pagination", () -> replayPagination(grid, state.paginationState()));
        }
        if (state.scrollPosition() != null) {
            facet(result, "scrollPosition", () -> grid.setScrollPosition(state.scrollPosition()));
        }
        if (state.focusedCell() != null) {
            facet(result, "focusedCell", () -> grid.setFocusedCell(state.focusedCell()));
        }

        ApplyResult built = result.build();
        LOG.info("Replayed view state: facets={}, errors={}", built.applied().size(), built.errors().size());
        return built;
    }

    /**
     * Sets the captured column widths again.
     *
     * @return {@code columnWidths} as applied, or as an error if the grid rejected them
     */
    public ApplyResult reassertWidths(GridInstance grid, TransientViewState state) {
        ApplyResult.Builder result = ApplyResult.builder();
        Map<String, Integer> widths = state == null ? Map.of() : widthsOf(state);
        if (!widths.isEmpty()) {
            facet(result, "columnWidths", () -> grid.setColumnWidths(widths));
            LOG.debug("Re-asserted column widths: columns={}", widths.size());
        }
        return result.build();
    }

    // --- Private helpers ---

    /**
     * Order, visibility, pinning and sort go first without sizing; widths follow separately. If
     * the grid rejects the stripped state, the full state is tried once.
     */
    private static void replayColumns(GridInstance grid, List<ColumnState> columns, ApplyResult.Builder result) {
        List<ColumnState> unsized = new ArrayList<>(columns.size());
        for (ColumnState column : columns) {
            unsized.add(column.withoutSizing());
        }
        try {
            grid.applyColumnState(unsized, true);
            result.applied("columnState");
        } catch (RuntimeException e) {
            LOG.debug("Column state without sizing rejected, retrying with full state: detail={}", e.getMessage());
            facet(result, "columnState", () -> grid.applyColumnState(columns, true));
        }
    }

    private static void replaySelection(GridInstance grid, SelectionState selection) {
        if (selection.isServerSide() && isServerSide(grid)) {
            grid.setServerSideSelectionState(selection.serverSideSelection());
        } else if (selection.selectedRowIds() != null && !selection.selectedRowIds().isEmpty()) {
            grid.setSelectedRowIds(selection.selectedRowIds());
        }
    }

    private static void replaySideBar(GridInstance grid, SideBarState sideBar) {
        if (sideBar.visible() && sideBar.openedPanel() != null) {
            grid.openToolPanel(sideBar.openedPanel());
        } else {
            grid.closeToolPanel();
        }
    }

    private static void replayPagination(GridInstance grid, PaginationState pagination) {
        if (pagination.pageSize() != null && pagination.pageSize() > 0) {
            grid.setPaginationPageSize(pagination.pageSize());
        }
        if (pagination.currentPage() != null && pagination.currentPage() >= 0) {
            grid.goToPage(pagination.currentPage());
        }
    }

    private static boolean isServerSide(GridInstance grid) {
        OptionValue rowModel = grid.getOption("rowModelType");
        JsonNode json = rowModel == null ? null : rowModel.toJson();
        return !JsonNodes.isAbsent(json) && SERVER_SIDE.equals(json.asText());
    }

    /** Widths from column state, topped up from the separately captured sizing. */
    private static Map<String, Integer> widthsOf(TransientViewState state) {
        Map<String, Integer> widths = new LinkedHashMap<>();
        if (state.columnState() != null) {
            for (ColumnState column : state.columnState()) {
                if (column.width() != null && column.width() > 0) {
                    widths.put(column.colId(), column.width());
                }
            }
        }
        if (state.columnSizing() != null) {
            state.columnSizing().widths().forEach((colId, width) -> {
                if (width != null && width > 0) {
                    widths.putIfAbsent(colId, width);
                }
            });
        }
        return widths;
    }

    private static void facet(ApplyResult.Builder result, String name, Runnable replay) {
        try {
            replay.run();
            result.applied(name);
        } catch (RuntimeException e) {
            LOG.warn("View state facet rejected: facet={}, detail={}", name, e.getMessage());
            result.error(name, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}

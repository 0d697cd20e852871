package io.gridsync.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.gridsync.core.model.CellRange;
import io.gridsync.core.model.ColumnGroupState;
import io.gridsync.core.model.ColumnState;
import io.gridsync.core.model.FocusedCell;
import io.gridsync.core.model.OptionValue;
import io.gridsync.core.model.PaginationState;
import io.gridsync.core.model.ScrollPosition;
import io.gridsync.core.model.SideBarState;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A live data grid the engine reads from and pushes options to.
 *
 * <p>
 * Hosts implement this over their grid component. The engine never holds a grid past
 * {@code unbind}, and never touches one whose {@link #isAlive()} returns {@code false}.
 *
 * <p>
 * Every accessor may throw if the grid does not support the facet or rejects the value. The engine
 * isolates such failures per option and per facet: they are logged and reported, never propagated
 * to the host.
 *
 * <p>
 * All calls happen on the thread that drives the engine's event loop. Implementations need not be
 * thread-safe.
 */
public interface GridInstance {

    /** False once the grid has been destroyed. */
    boolean isAlive();

    // --- Options ---

    /**
     * Current value of a grid option.
     *
     * @return the value, or {@code null} if the option is unset
     */
    OptionValue getOption(String key);

    /**
     * Sets a grid option.
     *
     * @throws RuntimeException if the grid rejects the value
     */
    void setOption(String key, OptionValue value);

    /** Update batching, when the grid supports it. */
    default Optional<UpdateTransactions> transactions() {
        return Optional.empty();
    }

    /** Redraws column headers. */
    void refreshHeader();

    /**
     * Redraws cells.
     *
     * @param force         redraw cells whose value did not change
     * @param suppressFlash do not flash redrawn cells
     */
    void refreshCells(boolean force, boolean suppressFlash);

    // --- Columns ---

    List<ColumnState> getColumnState();

    /**
     * Applies column state.
     *
     * @param state      per-column state; absent fields are left unchanged
     * @param applyOrder reorder columns to match {@code state}
     */
    void applyColumnState(List<ColumnState> state, boolean applyOrder);

    /**
     * Rendered width of a column, which may differ from the width in column state while a resize
     * is settling.
     *
     * @return width in pixels, or {@code null} if the column is not rendered
     */
    Integer getActualColumnWidth(String colId);

    /** Sets explicit pixel widths by column id. */
    void setColumnWidths(Map<String, Integer> widths);

    List<ColumnGroupState> getColumnGroupState();

    void setColumnGroupState(List<ColumnGroupState> state);

    /** Ids of the displayed columns, left to right. */
    List<String> getDisplayedColumnIds();

    // --- Filtering ---

    /** Column filter model, or {@code null}/empty when nothing is filtered. */
    JsonNode getFilterModel();

    void setFilterModel(JsonNode model);

    /** Advanced filter model, or {@code null}. */
    JsonNode getAdvancedFilterModel();

    void setAdvancedFilterModel(JsonNode model);

    // --- Grouping ---

    /** Ids of the row group columns, outermost first. */
    List<String> getRowGroupColumnIds();

    /** Keys of the expanded group rows. */
    List<String> getExpandedGroupKeys();

    void setExpandedGroupKeys(List<String> keys);

    // --- Selection ---

    List<String> getSelectedRowIds();

    void setSelectedRowIds(List<String> rowIds);

    /** Server-side selection state, for server-side row models. */
    JsonNode getServerSideSelectionState();

    void setServerSideSelectionState(JsonNode state);

    List<CellRange> getCellRanges();

    void setCellRanges(List<CellRange> ranges);

    // --- Chrome and viewport ---

    SideBarState getSideBarState();

    void openToolPanel(String panelId);

    void closeToolPanel();

    PaginationState getPaginationState();

    void setPaginationPageSize(int pageSize);

    void goToPage(int page);

    ScrollPosition getScrollPosition();

    void setScrollPosition(ScrollPosition position);

    /** The focused cell, or {@code null}. */
    FocusedCell getFocusedCell();

    void setFocusedCell(FocusedCell cell);
}

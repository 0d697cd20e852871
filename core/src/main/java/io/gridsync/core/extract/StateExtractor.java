package io.gridsync.core.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gridsync.core.model.CellRange;
import io.gridsync.core.model.ColumnGroupState;
import io.gridsync.core.model.ColumnSizing;
import io.gridsync.core.model.ColumnState;
import io.gridsync.core.model.FocusedCell;
import io.gridsync.core.model.JsonNodes;
import io.gridsync.core.model.OptionBag;
import io.gridsync.core.model.OptionValue;
import io.gridsync.core.model.PaginationState;
import io.gridsync.core.model.RowGroupState;
import io.gridsync.core.model.ScrollPosition;
import io.gridsync.core.model.SelectionState;
import io.gridsync.core.model.SideBarState;
import io.gridsync.core.model.Snapshot;
import io.gridsync.core.model.SnapshotMetadata;
import io.gridsync.core.model.SortEntry;
import io.gridsync.core.model.ToolbarState;
import io.gridsync.core.model.TransientViewState;
import io.gridsync.core.schema.CanonicalOption;
import io.gridsync.core.schema.EngineDefaults;
import io.gridsync.core.spi.GridInstance;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the transient view state of a live grid and assembles persistable snapshots.
 *
 * <p>
 * Each facet is read on its own. A facet the grid cannot report (unsupported, or it throws) is
 * logged and left absent; extraction as a whole never fails. Extraction only reads: it never
 * changes the grid.
 *
 * <p>
 * Column widths are reconciled against the rendered widths: while a resize is settling, the
 * grid's column state may still hold the old width, and the rendered one is what the user sees.
 */
public final class StateExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(StateExtractor.class);

    /** Options captured alongside the view state, as the grid reports them. */
    public static final List<String> CAPTURED_OPTIONS =
            List.of("animateRows", "rowSelection", "cellSelection", "suppressMovableColumns", "statusBar");

    private final EngineDefaults defaults;

    public StateExtractor(EngineDefaults defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
    }

    /** Unnamed snapshot of {@code grid} and the given canonical state. */
    public Snapshot snapshot(GridInstance grid, OptionBag canonical, ToolbarState toolbar) {
        return snapshot("", grid, canonical, toolbar, null);
    }

    /**
     * Assembles a snapshot from the live view state of {@code grid} and the canonical options.
     *
     * <p>
     * Canonical options are split three ways: unknown options go to {@code freeformExtension}
     * verbatim, initialization-only options to {@code initializationOptions}, and the remaining
     * options to {@code viewConfiguration} only where they differ from the engine defaults. Every
     * value is stored in its persistable form, so function values keep only their inputs.
     *
     * @param name      profile name
     * @param grid      live grid, or {@code null} to capture no view state
     * @param canonical canonical options held by the controller
     * @param toolbar   toolbar settings
     * @param metadata  bookkeeping, or {@code null}
     */
    public Snapshot snapshot(
            String name, GridInstance grid, OptionBag canonical, ToolbarState toolbar, SnapshotMetadata metadata) {
        Objects.requireNonNull(canonical, "canonical must not be null");
        ObjectNode view = JsonNodeFactory.instance.objectNode();
        ObjectNode initialization = JsonNodeFactory.instance.objectNode();
        ObjectNode freeform = JsonNodeFactory.instance.objectNode();
        OptionBag defaultOptions = defaults.options();
        canonical.forEach((key, value) -> {
            CanonicalOption option = CanonicalOption.fromKey(key);
            JsonNode json = value.toJson();
            if (option == null) {
                freeform.set(key, json);
            } else if (option.isInitializationOnly()) {
                initialization.set(key, json);
            } else if (!JsonNodes.structurallyEqual(json, defaultOptions.getJson(key))) {
                view.set(key, json);
            }
        });
        TransientViewState transientState = grid != null && isAlive(grid) ? extract(grid) : TransientViewState.EMPTY;
        return new Snapshot(name, toolbar, view, initialization, transientState, freeform, metadata);
    }

    /**
     * Captures the view state of {@code grid}.
     *
     * @param grid a live grid
     * @return the captured facets; facets that could not be read are absent
     */
    public TransientViewState extract(GridInstance grid) {
        Objects.requireNonNull(grid, "grid must not be null");
        List<String> failed = new ArrayList<>();
        TransientViewState.Builder state = TransientViewState.builder();

        List<ColumnState> columns = read("columnState", failed, () -> reconcileWidths(grid, grid.getColumnState()));
        if (columns != null && !columns.isEmpty()) {
            state.columnState(columns);
            List<SortEntry> sort = sortOf(columns);
            if (!sort.isEmpty()) {
                state.sortState(sort);
            }
            ColumnSizing sizing = sizingOf(columns);
            if (!sizing.isEmpty()) {
                state.columnSizing(sizing);
            }
        }

        List<ColumnGroupState> groups = read("columnGroupState", failed, grid::getColumnGroupState);
        if (groups != null && !groups.isEmpty()) {
            state.columnGroupState(groups);
        }

        JsonNode filterModel = read("filterModel", failed, grid::getFilterModel);
        if (!JsonNodes.isAbsent(filterModel) && !(filterModel.isObject() && filterModel.isEmpty())) {
            state.filterModel(filterModel);
        }

        JsonNode advancedFilter = read("advancedFilterModel", failed, grid::getAdvancedFilterModel);
        if (!JsonNodes.isAbsent(advancedFilter)) {
            state.advancedFilterModel(advancedFilter);
        }

        String quickFilter = read("quickFilterText", failed, () -> textOption(grid, "quickFilterText"));
        if (quickFilter != null && !quickFilter.isEmpty()) {
            state.quickFilterText(quickFilter);
        }

        RowGroupState rowGroups = read("rowGroupState", failed, () -> rowGroupsOf(grid));
        if (rowGroups != null) {
            state.rowGroupState(rowGroups);
        }

        SelectionState selection = read("selection", failed, () -> selectionOf(grid));
        if (selection != null) {
            state.selectionState(selection);
        }

        List<CellRange> ranges = read("rangeSelection", failed, grid::getCellRanges);
        if (ranges != null && !ranges.isEmpty()) {
            state.rangeSelection(ranges);
        }

        SideBarState sideBar = read("sideBar", failed, grid::getSideBarState);
        if (sideBar != null) {
            state.sideBarState(sideBar);
        }

        PaginationState pagination = read("pagination", failed, grid::getPaginationState);
        if (pagination != null) {
            state.paginationState(pagination);
        }

        ScrollPosition scroll = read("scrollPosition", failed, grid::getScrollPosition);
        if (scroll != null) {
            state.scrollPosition(scroll);
        }

        FocusedCell focused = read("focusedCell", failed, grid::getFocusedCell);
        if (focused != null) {
            state.focusedCell(focused);
        }

        List<String> displayed = read("displayedColumns", failed, grid::getDisplayedColumnIds);
        if (displayed != null && !displayed.isEmpty()) {
            state.displayedColumns(displayed);
        }

        ObjectNode captured = capturedOptions(grid, failed);
        if (!captured.isEmpty()) {
            state.capturedOptions(captured);
        }

        if (failed.isEmpty()) {
            LOG.debug("Extracted view state");
        } else {
            LOG.info("Extracted view state with unreadable facets: failed={}", failed);
        }
        return state.build();
    }

    // --- Private helpers ---

    private static boolean isAlive(GridInstance grid) {
        try {
            return grid.isAlive();
        } catch (RuntimeException e) {
            LOG.warn("Grid liveness check failed, capturing no view state", e);
            return false;
        }
    }

    private static <T> T read(String facet, List<String> failed, Supplier<T> reader) {
        try {
            return reader.get();
        } catch (RuntimeException e) {
            LOG.warn("Could not read view state facet: facet={}, detail={}", facet, e.getMessage());
            failed.add(facet);
            return null;
        }
    }

    /** Prefers the rendered width over the column-state width when they disagree. */
    private static List<ColumnState> reconcileWidths(GridInstance grid, List<ColumnState> columns) {
        if (columns == null) {
            return null;
        }
        List<ColumnState> reconciled = new ArrayList<>(columns.size());
        for (ColumnState column : columns) {
            Integer actual = null;
            try {
                actual = grid.getActualColumnWidth(column.colId());
            } catch (RuntimeException e) {
                LOG.debug("Rendered width unavailable, keeping state width: col_id={}", column.colId());
            }
            if (actual != null && actual > 0 && !actual.equals(column.width())) {
                reconciled.add(column.withWidth(actual));
            } else {
                reconciled.add(column);
            }
        }
        return reconciled;
    }

    private static List<SortEntry> sortOf(List<ColumnState> columns) {
        List<SortEntry> sort = new ArrayList<>();
        for (ColumnState column : columns) {
            if (column.sort() != null) {
                int index = column.sortIndex() != null ? column.sortIndex() : 0;
                sort.add(new SortEntry(column.colId(), column.sort(), index));
            }
        }
        sort.sort(Comparator.comparingInt(SortEntry::sortIndex));
        return sort;
    }

    private static ColumnSizing sizingOf(List<ColumnState> columns) {
        Map<String, Integer> widths = new LinkedHashMap<>();
        Map<String, Double> flex = new LinkedHashMap<>();
        for (ColumnState column : columns) {
            if (column.width() != null && column.width() > 0) {
                widths.put(column.colId(), column.width());
            }
            if (column.flex() != null && column.flex() > 0) {
                flex.put(column.colId(), column.flex());
            }
        }
        return new ColumnSizing(widths, flex);
    }

    private static RowGroupState rowGroupsOf(GridInstance grid) {
        List<String> grouped = grid.getRowGroupColumnIds();
        if (grouped == null || grouped.isEmpty()) {
            return null;
        }
        return new RowGroupState(grouped, grid.getExpandedGroupKeys());
    }

    /**
     * Server-side grids with group selection report an opaque selection state; everything else
     * reports row ids.
     */
    private static SelectionState selectionOf(GridInstance grid) {
        JsonNode rowSelection = json(grid.getOption("rowSelection"));
        String mode = rowSelection.path("mode").isTextual() ? rowSelection.path("mode").asText() : null;
        boolean serverSide = "serverSide".equals(textOption(grid, "rowModelType"));
        boolean groupSelection = "descendants".equals(rowSelection.path("groupSelects").asText(null));
        if (serverSide && groupSelection) {
            JsonNode serverState = grid.getServerSideSelectionState();
            return JsonNodes.isAbsent(serverState) ? null : new SelectionState(mode, null, serverState);
        }
        List<String> selected = grid.getSelectedRowIds();
        if (selected == null || selected.isEmpty()) {
            return null;
        }
        return new SelectionState(mode, selected, null);
    }

    private static ObjectNode capturedOptions(GridInstance grid, List<String> failed) {
        ObjectNode captured = JsonNodeFactory.instance.objectNode();
        for (String key : CAPTURED_OPTIONS) {
            OptionValue value = read("option:" + key, failed, () -> grid.getOption(key));
            if (value != null) {
                captured.set(key, value.toJson());
            }
        }
        return captured;
    }

    private static String textOption(GridInstance grid, String key) {
        JsonNode value = json(grid.getOption(key));
        return value.isTextual() ? value.asText() : null;
    }

    private static JsonNode json(OptionValue value) {
        return value == null ? JsonNodeFactory.instance.missingNode() : value.toJson();
    }
}

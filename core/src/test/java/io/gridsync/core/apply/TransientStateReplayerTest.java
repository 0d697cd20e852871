package io.gridsync.core.apply;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.gridsync.core.model.ApplyResult;
import io.gridsync.core.model.CellRange;
import io.gridsync.core.model.ColumnSizing;
import io.gridsync.core.model.ColumnState;
import io.gridsync.core.model.FocusedCell;
import io.gridsync.core.model.OptionValue;
import io.gridsync.core.model.PaginationState;
import io.gridsync.core.model.RowGroupState;
import io.gridsync.core.model.ScrollPosition;
import io.gridsync.core.model.SelectionState;
import io.gridsync.core.model.SideBarState;
import io.gridsync.core.model.TransientViewState;
import io.gridsync.core.testkit.FakeGridInstance;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TransientStateReplayerTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final TransientStateReplayer replayer = new TransientStateReplayer();
    private final FakeGridInstance grid = new FakeGridInstance();

    @Test
    void replaysEveryCapturedFacet() throws Exception {
        JsonNode filter = JSON.readTree("{\"country\":{\"filterType\":\"set\",\"values\":[\"NO\"]}}");
        TransientViewState state = TransientViewState.builder()
                .columnState(List.of(ColumnState.ofWidth("name", 180), ColumnState.ofWidth("price", 90)))
                .filterModel(filter)
                .rowGroupState(new RowGroupState(List.of("country"), List.of("NO")))
                .selectionState(new SelectionState("multiRow", List.of("r1", "r2"), null))
                .rangeSelection(List.of(new CellRange(0, 3, List.of("price"))))
                .sideBarState(new SideBarState(true, "filters"))
                .paginationState(new PaginationState(50, 2, 10))
                .scrollPosition(new ScrollPosition(0, 420))
                .focusedCell(new FocusedCell(3, "price"))
                .build();

        ApplyResult result = replayer.replay(grid, state);

        assertThat(result.errors()).isEmpty();
        assertThat(grid.columnWidths()).containsEntry("name", 180).containsEntry("price", 90);
        assertThat(grid.filterModel()).isEqualTo(filter);
        assertThat(grid.expandedGroupKeys()).containsExactly("NO");
        assertThat(grid.selectedRowIds()).containsExactly("r1", "r2");
        assertThat(grid.cellRanges()).hasSize(1);
        assertThat(grid.sideBarState()).isEqualTo(new SideBarState(true, "filters"));
        assertThat(grid.paginationState().pageSize()).isEqualTo(50);
        assertThat(grid.paginationState().currentPage()).isEqualTo(2);
        assertThat(grid.scrollPosition()).isEqualTo(new ScrollPosition(0, 420));
        assertThat(grid.focusedCell()).isEqualTo(new FocusedCell(3, "price"));
    }

    @Test
    void quickFilterTextIsSetAsOption() {
        TransientViewState state = TransientViewState.builder().quickFilterText("oslo").build();

        ApplyResult result = replayer.replay(grid, state);

        assertThat(result.applied()).contains("quickFilterText");
        assertThat(grid.options().get("quickFilterText")).isEqualTo(OptionValue.scalar(TextNode.valueOf("oslo")));
    }

    @Test
    void columnStateIsAppliedWithoutSizingThenWidthsSeparately() {
        TransientViewState state = TransientViewState.builder()
                .columnState(List.of(ColumnState.ofWidth("name", 180)))
                .build();

        replayer.replay(grid, state);

        assertThat(grid.calls()).containsSubsequence("applyColumnState", "setColumnWidths");
        assertThat(grid.getColumnState()).singleElement().satisfies(c -> assertThat(c.width()).isNull());
    }

    @Test
    void failingFacetIsIsolated() throws Exception {
        grid.failOn("setFilterModel");
        TransientViewState state = TransientViewState.builder()
                .filterModel(JSON.readTree("{\"a\":{}}"))
                .scrollPosition(new ScrollPosition(5, 6))
                .build();

        ApplyResult result = replayer.replay(grid, state);

        assertThat(result.errors()).extracting(ApplyResult.ApplyError::key).containsExactly("filterModel");
        assertThat(result.applied()).containsExactly("scrollPosition");
        assertThat(grid.scrollPosition()).isEqualTo(new ScrollPosition(5, 6));
    }

    @Test
    void serverSideSelectionOnlyForServerSideGrids() throws Exception {
        JsonNode serverState = JSON.readTree("{\"selectAll\":false,\"toggledNodes\":[\"g1\"]}");
        TransientViewState state = TransientViewState.builder()
                .selectionState(new SelectionState("multiRow", null, serverState))
                .build();

        replayer.replay(grid, state);
        assertThat(grid.serverSideSelectionState()).isNull();

        grid.seedOption("rowModelType", OptionValue.scalar(TextNode.valueOf("serverSide")));
        replayer.replay(grid, state);
        assertThat(grid.serverSideSelectionState()).isEqualTo(serverState);
    }

    @Test
    void closedSideBarClosesToolPanel() {
        replayer.replay(grid, TransientViewState.builder().sideBarState(new SideBarState(false, null)).build());

        assertThat(grid.calls()).containsExactly("closeToolPanel");
    }

    @Test
    void reassertWidthsUsesSizingWhenColumnStateHasNoWidth() {
        TransientViewState state = TransientViewState.builder()
                .columnSizing(new ColumnSizing(Map.of("name", 200), Map.of()))
                .build();

        ApplyResult result = replayer.reassertWidths(grid, state);

        assertThat(result.applied()).containsExactly("columnWidths");
        assertThat(grid.columnWidths()).containsEntry("name", 200);
    }

    @Test
    void emptyStateTouchesNothing() {
        ApplyResult result = replayer.replay(grid, TransientViewState.EMPTY);

        assertThat(result.isNoOp()).isTrue();
        assertThat(grid.calls()).isEmpty();
    }
}

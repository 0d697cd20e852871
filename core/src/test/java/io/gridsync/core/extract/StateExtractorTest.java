package io.gridsync.core.extract;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.gridsync.core.model.ColumnState;
import io.gridsync.core.model.OptionBag;
import io.gridsync.core.model.OptionValue;
import io.gridsync.core.model.Snapshot;
import io.gridsync.core.model.ToolbarState;
import io.gridsync.core.model.TransientViewState;
import io.gridsync.core.schema.EngineDefaults;
import io.gridsync.core.testkit.FakeGridInstance;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StateExtractorTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final EngineDefaults defaults = EngineDefaults.load();
    private final StateExtractor extractor = new StateExtractor(defaults);
    private final FakeGridInstance grid = new FakeGridInstance();

    private static ColumnState sorted(String colId, String sort, int index) {
        return ColumnState.ofWidth(colId, 100).withSort(sort, index);
    }

    @Nested
    class ViewState {

        @Test
        void renderedWidthWinsOverStateWidth() {
            grid.seedColumns(List.of(ColumnState.ofWidth("name", 150), ColumnState.ofWidth("price", 80)))
                    .seedActualWidth("name", 212);

            TransientViewState state = extractor.extract(grid);

            assertThat(state.columnState())
                    .extracting(ColumnState::width)
                    .containsExactly(212, 80);
            assertThat(state.columnSizing().widths()).containsEntry("name", 212).containsEntry("price", 80);
        }

        @Test
        void sortStateIsDerivedInSortIndexOrder() {
            grid.seedColumns(List.of(sorted("a", "asc", 1), ColumnState.ofWidth("b", 90), sorted("c", "desc", 0)));

            TransientViewState state = extractor.extract(grid);

            assertThat(state.sortState()).extracting(s -> s.colId()).containsExactly("c", "a");
        }

        @Test
        void failingFacetIsOmittedAndTheRestCaptured() {
            grid.failOn("getFilterModel")
                    .failOn("getColumnState")
                    .seedDisplayedColumns(List.of("name", "price"));

            TransientViewState state = extractor.extract(grid);

            assertThat(state.filterModel()).isNull();
            assertThat(state.columnState()).isNull();
            assertThat(state.displayedColumns()).containsExactly("name", "price");
        }

        @Test
        void rowGroupsOnlyWhenGrouped() {
            assertThat(extractor.extract(grid).rowGroupState()).isNull();

            grid.seedRowGroups(List.of("country"), List.of("NO", "SE"));

            assertThat(extractor.extract(grid).rowGroupState().expandedGroups()).containsExactly("NO", "SE");
        }

        @Test
        void serverSideGroupSelectionReadsOpaqueState() throws Exception {
            grid.seedOption("rowModelType", OptionValue.scalar(TextNode.valueOf("serverSide")))
                    .seedOption(
                            "rowSelection",
                            OptionValue.structured((ObjectNode) JSON.readTree(
                                    "{\"mode\":\"multiRow\",\"groupSelects\":\"descendants\"}")));
            grid.setServerSideSelectionState(JSON.readTree("{\"selectAllChildren\":true}"));

            TransientViewState state = extractor.extract(grid);

            assertThat(state.selectionState().isServerSide()).isTrue();
            assertThat(state.selectionState().mode()).isEqualTo("multiRow");
        }

        @Test
        void capturedOptionsComeFromTheLiveGrid() {
            grid.seedOption("animateRows", OptionValue.scalar(BooleanNode.FALSE))
                    .seedOption("rowHeight", OptionValue.scalar(IntNode.valueOf(28)));

            TransientViewState state = extractor.extract(grid);

            assertThat(state.capturedOptions().fieldNames()).toIterable().containsExactly("animateRows");
        }
    }

    @Nested
    class Snapshots {

        @Test
        void optionsAreSplitThreeWays() throws Exception {
            OptionBag canonical = defaults.options()
                    .with("rowHeight", OptionValue.scalar(IntNode.valueOf(28)))
                    .with("hostSetting", OptionValue.scalar(TextNode.valueOf("x")));

            Snapshot snapshot = extractor.snapshot(grid, canonical, ToolbarState.DEFAULT);

            assertThat(snapshot.viewConfiguration()).isEqualTo(JSON.readTree("{\"rowHeight\":28}"));
            assertThat(snapshot.freeformExtension()).isEqualTo(JSON.readTree("{\"hostSetting\":\"x\"}"));
            assertThat(snapshot.initializationOptions().has("rowModelType")).isTrue();
            assertThat(snapshot.initializationOptions().has("rowHeight")).isFalse();
        }

        @Test
        void defaultsOnlyCanonicalStatePersistsNoViewConfiguration() {
            Snapshot snapshot = extractor.snapshot(grid, defaults.options(), ToolbarState.DEFAULT);

            assertThat(snapshot.viewConfiguration().isEmpty()).isTrue();
        }

        @Test
        void deadGridContributesNoViewState() {
            grid.seedDisplayedColumns(List.of("name")).destroy();

            Snapshot snapshot = extractor.snapshot(grid, defaults.options(), ToolbarState.DEFAULT);

            assertThat(snapshot.transientViewState().isEmpty()).isTrue();
        }

        @Test
        void extractionOnlyReadsTheGrid() {
            grid.seedColumns(List.of(ColumnState.ofWidth("name", 150))).seedDisplayedColumns(List.of("name"));

            extractor.snapshot(grid, defaults.options(), ToolbarState.DEFAULT);

            assertThat(grid.calls()).isEmpty();
        }
    }
}

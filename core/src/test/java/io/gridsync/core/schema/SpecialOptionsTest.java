package io.gridsync.core.schema;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

class SpecialOptionsTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return JSON.readTree(text);
    }

    @Test
    void sideBarDisabledForms() {
        assertThat(SpecialOptions.canonicalSideBar(null)).isEqualTo(BooleanNode.FALSE);
        assertThat(SpecialOptions.canonicalSideBar(NullNode.getInstance())).isEqualTo(BooleanNode.FALSE);
        assertThat(SpecialOptions.canonicalSideBar(TextNode.valueOf(""))).isEqualTo(BooleanNode.FALSE);
        assertThat(SpecialOptions.canonicalSideBar(TextNode.valueOf("None"))).isEqualTo(BooleanNode.FALSE);
        assertThat(SpecialOptions.canonicalSideBar(BooleanNode.FALSE)).isEqualTo(BooleanNode.FALSE);
    }

    @Test
    void sideBarEnabledFormsPassThrough() throws Exception {
        assertThat(SpecialOptions.canonicalSideBar(TextNode.valueOf("columns"))).isEqualTo(TextNode.valueOf("columns"));
        assertThat(SpecialOptions.canonicalSideBar(BooleanNode.TRUE)).isEqualTo(BooleanNode.TRUE);
        assertThat(SpecialOptions.canonicalSideBar(json("[\"columns\",\"filters\"]")))
                .isEqualTo(json("[\"columns\",\"filters\"]"));
    }

    @Test
    void statusBarWithoutPanelsIsFalse() throws Exception {
        assertThat(SpecialOptions.canonicalStatusBar(json("{\"statusPanels\":[]}"))).isEqualTo(BooleanNode.FALSE);
        assertThat(SpecialOptions.canonicalStatusBar(BooleanNode.TRUE)).isEqualTo(BooleanNode.FALSE);
        assertThat(SpecialOptions.canonicalStatusBar(null)).isEqualTo(BooleanNode.FALSE);
    }

    @Test
    void statusBarWithPanelsIsKept() throws Exception {
        JsonNode bar = json("{\"statusPanels\":[{\"statusPanel\":\"agTotalRowCountComponent\"}]}");

        assertThat(SpecialOptions.canonicalStatusBar(bar)).isEqualTo(bar);
        assertThat(SpecialOptions.liveStatusBar(bar)).isEqualTo(bar);
    }

    @Test
    void disabledStatusBarIsNullOnTheGrid() {
        assertThat(SpecialOptions.liveStatusBar(BooleanNode.FALSE).isNull()).isTrue();
    }

    @Test
    void rowSelectionLegacyModes() throws Exception {
        assertThat(SpecialOptions.canonicalRowSelection(TextNode.valueOf("single")))
                .isEqualTo(json("{\"mode\":\"singleRow\"}"));
        assertThat(SpecialOptions.canonicalRowSelection(json("{\"mode\":\"multiple\",\"checkboxes\":true}")))
                .isEqualTo(json("{\"mode\":\"multiRow\",\"checkboxes\":true}"));
        assertThat(SpecialOptions.canonicalRowSelection(IntNode.valueOf(1)))
                .isEqualTo(json("{\"mode\":\"multiRow\"}"));
    }

    @Test
    void shapesAreIdempotent() throws Exception {
        JsonNode row = SpecialOptions.canonicalRowSelection(TextNode.valueOf("multiple"));
        JsonNode cell = SpecialOptions.canonicalCellSelection(BooleanNode.TRUE);

        assertThat(SpecialOptions.canonicalRowSelection(row)).isEqualTo(row);
        assertThat(SpecialOptions.canonicalCellSelection(cell)).isEqualTo(cell);
        assertThat(SpecialOptions.canonicalSideBar(SpecialOptions.canonicalSideBar(TextNode.valueOf("none"))))
                .isEqualTo(BooleanNode.FALSE);
    }
}

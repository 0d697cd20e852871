package io.gridsync.core.schema;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gridsync.core.model.ToolbarState;
import io.gridsync.core.model.ValueKind;
import org.junit.jupiter.api.Test;

class EngineDefaultsTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void bundledDefaultsAreCanonical() {
        EngineDefaults defaults = EngineDefaults.load();

        assertThat(defaults.options().getJson("statusBar")).isEqualTo(BooleanNode.FALSE);
        assertThat(defaults.options().getJson("sideBar")).isEqualTo(BooleanNode.FALSE);
        assertThat(defaults.options().get("rowSelection").kind()).isEqualTo(ValueKind.STRUCTURED);
        assertThat(defaults.options().getJson("defaultColDef").path("verticalAlign").asText())
                .isEqualTo("middle");
        assertThat(defaults.toolbar()).isEqualTo(ToolbarState.DEFAULT);
    }

    @Test
    void legacyNamesInDefaultsAreResolved() throws Exception {
        EngineDefaults defaults = EngineDefaults.fromJson(
                (ObjectNode) JSON.readTree("{\"enableRangeSelection\":true,\"rowHeight\":28}"));

        assertThat(defaults.options().names()).containsExactly("cellSelection", "rowHeight");
        assertThat(defaults.options().getJson("cellSelection")).isEqualTo(JSON.readTree("{\"enabled\":true}"));
    }
}

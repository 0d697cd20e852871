package io.gridsync.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OptionValueTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final CellStyleFunction CENTERED = cell -> Map.of("display", "flex");

    private static ObjectNode object(String json) throws Exception {
        return (ObjectNode) JSON.readTree(json);
    }

    @Test
    void structuredMergeKeepsUntouchedFields() throws Exception {
        OptionValue.Structured current = OptionValue.structured(object("{\"mode\":\"multiRow\",\"checkboxes\":true}"));

        OptionValue.Structured merged = current.mergedWith(object("{\"enableDeselection\":false}"));

        assertThat(merged.toJson())
                .isEqualTo(JSON.readTree("{\"mode\":\"multiRow\",\"checkboxes\":true,\"enableDeselection\":false}"));
        assertThat(current.field("enableDeselection").isMissingNode()).isTrue();
    }

    @Test
    void structuredValueIsDefensivelyCopied() throws Exception {
        ObjectNode source = object("{\"enabled\":true}");
        OptionValue.Structured value = OptionValue.structured(source);

        source.put("enabled", false);
        value.fields().put("enabled", false);

        assertThat(value.field("enabled").booleanValue()).isTrue();
    }

    @Test
    void functionRefPersistsInputsButNotTheFunction() throws Exception {
        OptionValue.FunctionRef ref = new OptionValue.FunctionRef(
                object("{\"sortable\":true}"), "cellStyle", CENTERED, object("{\"verticalAlign\":\"middle\"}"));

        assertThat(ref.kind()).isEqualTo(ValueKind.FUNCTION_REF);
        assertThat(ref.toJson()).isEqualTo(JSON.readTree("{\"sortable\":true,\"verticalAlign\":\"middle\"}"));
    }

    @Test
    void functionRefsWithSameInputsAreEqualWhateverTheFunctionInstance() throws Exception {
        CellStyleFunction other = cell -> Map.of("display", "block");
        OptionValue.FunctionRef a = new OptionValue.FunctionRef(
                object("{\"minWidth\":100}"), "cellStyle", CENTERED, object("{\"horizontalAlign\":\"left\"}"));
        OptionValue.FunctionRef b = new OptionValue.FunctionRef(
                object("{\"minWidth\":100.0}"), "cellStyle", other, object("{\"horizontalAlign\":\"left\"}"));

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    }

    @Test
    void functionRefsWithDifferentInputsDiffer() throws Exception {
        OptionValue.FunctionRef left = new OptionValue.FunctionRef(
                object("{}"), "cellStyle", CENTERED, object("{\"horizontalAlign\":\"left\"}"));
        OptionValue.FunctionRef right = new OptionValue.FunctionRef(
                object("{}"), "cellStyle", CENTERED, object("{\"horizontalAlign\":\"right\"}"));

        assertThat(left).isNotEqualTo(right);
    }

    @Test
    void scalarNullIsJsonNull() {
        assertThat(OptionValue.scalar(null).toJson().isNull()).isTrue();
        assertThat(OptionValue.scalar(null).kind()).isEqualTo(ValueKind.SCALAR);
    }
}

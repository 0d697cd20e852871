package io.gridsync.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JsonNodesTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return JSON.readTree(text);
    }

    @Nested
    class Truthiness {

        @Test
        void absentAndFalseyValuesAreFalsy() {
            assertThat(JsonNodes.isTruthy(null)).isFalse();
            assertThat(JsonNodes.isTruthy(NullNode.getInstance())).isFalse();
            assertThat(JsonNodes.isTruthy(MissingNode.getInstance())).isFalse();
            assertThat(JsonNodes.isTruthy(BooleanNode.FALSE)).isFalse();
            assertThat(JsonNodes.isTruthy(TextNode.valueOf(""))).isFalse();
            assertThat(JsonNodes.isTruthy(IntNode.valueOf(0))).isFalse();
        }

        @Test
        void everythingElseIsTruthy() throws Exception {
            assertThat(JsonNodes.isTruthy(BooleanNode.TRUE)).isTrue();
            assertThat(JsonNodes.isTruthy(TextNode.valueOf("columns"))).isTrue();
            assertThat(JsonNodes.isTruthy(IntNode.valueOf(3))).isTrue();
            assertThat(JsonNodes.isTruthy(json("{}"))).isTrue();
        }
    }

    @Nested
    class StructuralEquality {

        @Test
        void objectKeyOrderIsIgnored() throws Exception {
            assertThat(JsonNodes.structurallyEqual(json("{\"a\":1,\"b\":2}"), json("{\"b\":2,\"a\":1}")))
                    .isTrue();
        }

        @Test
        void numbersCompareByValue() throws Exception {
            assertThat(JsonNodes.structurallyEqual(IntNode.valueOf(30), LongNode.valueOf(30L))).isTrue();
            assertThat(JsonNodes.structurallyEqual(IntNode.valueOf(30), DoubleNode.valueOf(30.0))).isTrue();
            assertThat(JsonNodes.structurallyEqual(json("{\"w\":[1,2]}"), json("{\"w\":[1.0,2.0]}"))).isTrue();
        }

        @Test
        void arraysComparePositionally() throws Exception {
            assertThat(JsonNodes.structurallyEqual(json("[1,2]"), json("[2,1]"))).isFalse();
        }

        @Test
        void javaNullMissingAndJsonNullAreTheSame() {
            assertThat(JsonNodes.structurallyEqual(null, NullNode.getInstance())).isTrue();
            assertThat(JsonNodes.structurallyEqual(MissingNode.getInstance(), null)).isTrue();
            assertThat(JsonNodes.structurallyEqual(null, BooleanNode.FALSE)).isFalse();
        }
    }

    @Test
    void shallowMergeOverwritesTopLevelFieldsOnly() throws Exception {
        ObjectNode base = (ObjectNode) json("{\"mode\":\"multiRow\",\"checkboxes\":{\"header\":true}}");
        ObjectNode delta = (ObjectNode) json("{\"checkboxes\":{\"cell\":true},\"enableDeselection\":false}");

        ObjectNode merged = JsonNodes.shallowMerge(base, delta);

        assertThat(merged).isEqualTo(json(
                "{\"mode\":\"multiRow\",\"checkboxes\":{\"cell\":true},\"enableDeselection\":false}"));
        assertThat(base.has("enableDeselection")).isFalse();
    }

    @Test
    void copyOfTurnsAbsentIntoJsonNull() {
        assertThat(JsonNodes.copyOf(null)).isEqualTo(NullNode.getInstance());
        assertThat(JsonNodes.copyOf(MissingNode.getInstance())).isEqualTo(NullNode.getInstance());
    }
}

package io.gridsync.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;

/**
 * Shared JSON node helpers for option values.
 *
 * <p>
 * Thread-safe; stateless utility class.
 */
public final class JsonNodes {

    /**
     * Orders numeric nodes by value so that {@code 30}, {@code 30L} and {@code 30.0} compare
     * equal. Non-numeric nodes fall back to {@link JsonNode#equals(Object)}.
     */
    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.equals(b) ? 0 : 1;
    };

    private JsonNodes() {}

    /**
     * Determines if a node represents a truthy option value.
     *
     * <ul>
     * <li>{@code null}, {@code NullNode}, {@code MissingNode} → falsy</li>
     * <li>{@code BooleanNode(false)} → falsy</li>
     * <li>{@code TextNode("")} → falsy</li>
     * <li>numeric zero → falsy</li>
     * <li>any other node → truthy</li>
     * </ul>
     */
    public static boolean isTruthy(JsonNode node) {
        if (isAbsent(node)) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0.0;
        }
        return true;
    }

    /** True for Java {@code null}, JSON {@code null} and missing nodes. */
    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /**
     * Structural equality: object key order is ignored, arrays compare positionally and numbers
     * compare by value regardless of their integral or floating representation. Java {@code null}
     * and JSON {@code null} are treated as the same value.
     */
    public static boolean structurallyEqual(JsonNode a, JsonNode b) {
        JsonNode left = a == null ? NullNode.getInstance() : a;
        JsonNode right = b == null ? NullNode.getInstance() : b;
        if (left.isMissingNode()) {
            left = NullNode.getInstance();
        }
        if (right.isMissingNode()) {
            right = NullNode.getInstance();
        }
        return left.equals(NUMERIC_AWARE, right);
    }

    /**
     * Returns a new object holding every field of {@code base} overwritten by the fields of
     * {@code delta}. Neither argument is modified.
     */
    public static ObjectNode shallowMerge(ObjectNode base, ObjectNode delta) {
        ObjectNode merged = base == null ? JsonNodeFactory.instance.objectNode() : base.deepCopy();
        if (delta != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = delta.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                merged.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return merged;
    }

    /** Null-safe deep copy; absent input yields JSON {@code null}. */
    public static JsonNode copyOf(JsonNode node) {
        return node == null || node.isMissingNode() ? NullNode.getInstance() : node.deepCopy();
    }
}

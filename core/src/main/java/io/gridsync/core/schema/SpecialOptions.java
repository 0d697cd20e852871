package io.gridsync.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gridsync.core.model.JsonNodes;

/**
 * Canonical shapes of the options whose accepted inputs are looser than what the grid takes.
 *
 * <p>
 * Every function here is pure and idempotent: feeding a canonical value back in returns an equal
 * value. Both the alias table (when normalizing input) and the batch applier (when pushing to the
 * grid) go through these, so the two can never disagree about what "disabled" means.
 */
public final class SpecialOptions {

    private SpecialOptions() {}

    /**
     * Canonical side bar: {@code false} when disabled ({@code false}, {@code null}, {@code ""} or
     * {@code "none"}), otherwise the value as given ({@code true}, a panel id, a panel id list or a
     * full definition).
     */
    public static JsonNode canonicalSideBar(JsonNode value) {
        if (JsonNodes.isAbsent(value)) {
            return BooleanNode.FALSE;
        }
        if (value.isBoolean()) {
            return BooleanNode.valueOf(value.booleanValue());
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty() || "none".equalsIgnoreCase(text)) {
                return BooleanNode.FALSE;
            }
            return value.deepCopy();
        }
        return value.deepCopy();
    }

    /**
     * Canonical status bar: {@code false} unless the value is a definition with a non-empty
     * {@code statusPanels} list.
     */
    public static JsonNode canonicalStatusBar(JsonNode value) {
        if (value != null && value.isObject()) {
            JsonNode panels = value.path("statusPanels");
            if (panels.isArray() && !panels.isEmpty()) {
                return value.deepCopy();
            }
        }
        return BooleanNode.FALSE;
    }

    /**
     * The status bar value the grid takes: a canonical {@code false} becomes JSON {@code null},
     * which the grid reads as "no status bar".
     */
    public static JsonNode liveStatusBar(JsonNode canonical) {
        JsonNode value = canonicalStatusBar(canonical);
        return value.isObject() ? value : NullNode.getInstance();
    }

    /**
     * Canonical row selection object. Legacy string modes ({@code "multiple"}, {@code "single"})
     * and legacy modes inside an object become {@code multiRow}/{@code singleRow}; anything that is
     * not an object or a string yields {@code {"mode":"multiRow"}}.
     */
    public static ObjectNode canonicalRowSelection(JsonNode value) {
        ObjectNode result;
        if (value != null && value.isObject()) {
            result = ((ObjectNode) value).deepCopy();
            JsonNode mode = result.get("mode");
            if (mode != null && mode.isTextual()) {
                result.put("mode", canonicalSelectionMode(mode.asText()));
            }
        } else {
            result = JsonNodeFactory.instance.objectNode();
            String mode = value != null && value.isTextual() ? canonicalSelectionMode(value.asText()) : "multiRow";
            result.put("mode", mode);
        }
        return result;
    }

    /** Canonical cell selection object: a boolean {@code b} becomes {@code {"enabled": b}}. */
    public static ObjectNode canonicalCellSelection(JsonNode value) {
        if (value != null && value.isObject()) {
            return ((ObjectNode) value).deepCopy();
        }
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("enabled", JsonNodes.isTruthy(value));
        return result;
    }

    private static String canonicalSelectionMode(String mode) {
        return switch (mode) {
            case "multiple" -> "multiRow";
            case "single" -> "singleRow";
            default -> mode;
        };
    }
}

package io.gridsync.core.apply;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gridsync.core.model.CellStyleFunction;
import io.gridsync.core.model.OptionValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds the live form of {@code defaultColDef}: alignment inputs ({@code verticalAlign},
 * {@code horizontalAlign}) are stripped from the column definition and replaced by a cell style
 * function that lays the cell out as a flex box.
 *
 * <p>
 * Functions are cached per alignment pair, so re-applying the same inputs hands the grid the same
 * function instance.
 *
 * <p>
 * Alignment mapping:
 * <ul>
 * <li>vertical: {@code top}/{@code start} → {@code flex-start}, {@code middle}/{@code center} →
 * {@code center}, {@code bottom}/{@code end} → {@code flex-end}</li>
 * <li>horizontal: {@code left} → {@code flex-start}, {@code center} → {@code center},
 * {@code right} → {@code flex-end}; when absent, numeric columns align to {@code flex-end} and all
 * others to {@code flex-start}</li>
 * </ul>
 */
public final class CellStyleSynthesizer {

    /** Field the synthesized function is attached under. */
    public static final String STYLE_FIELD = "cellStyle";

    static final String VERTICAL_ALIGN = "verticalAlign";
    static final String HORIZONTAL_ALIGN = "horizontalAlign";

    private final Map<String, CellStyleFunction> cache = new ConcurrentHashMap<>();

    /**
     * Converts a persisted column definition into the value pushed to the grid.
     *
     * @param colDef column definition, possibly carrying alignment inputs
     * @return a {@link OptionValue.FunctionRef} when alignment inputs are present, otherwise the
     *         definition as a scalar
     */
    public OptionValue toLiveValue(JsonNode colDef) {
        if (colDef == null || !colDef.isObject()) {
            return OptionValue.scalar(colDef);
        }
        ObjectNode data = ((ObjectNode) colDef).deepCopy();
        JsonNode vertical = data.remove(VERTICAL_ALIGN);
        JsonNode horizontal = data.remove(HORIZONTAL_ALIGN);
        if (!isSet(vertical) && !isSet(horizontal)) {
            return OptionValue.scalar(colDef);
        }
        ObjectNode inputs = JsonNodeFactory.instance.objectNode();
        if (isSet(vertical)) {
            inputs.put(VERTICAL_ALIGN, vertical.asText());
        }
        if (isSet(horizontal)) {
            inputs.put(HORIZONTAL_ALIGN, horizontal.asText());
        }
        // the synthesized style replaces any static one
        data.remove(STYLE_FIELD);
        CellStyleFunction function = styleFunction(textOrNull(vertical), textOrNull(horizontal));
        return new OptionValue.FunctionRef(data, STYLE_FIELD, function, inputs);
    }

    /**
     * Returns the (cached) style function for an alignment pair.
     *
     * @param vertical   vertical alignment input, or {@code null}
     * @param horizontal horizontal alignment input, or {@code null}
     */
    public CellStyleFunction styleFunction(String vertical, String horizontal) {
        String cacheKey = vertical + "|" + horizontal;
        return cache.computeIfAbsent(cacheKey, k -> synthesize(vertical, horizontal));
    }

    int cachedFunctions() {
        return cache.size();
    }

    // --- Private helpers ---

    private static CellStyleFunction synthesize(String vertical, String horizontal) {
        String alignItems = verticalFlex(vertical);
        return cell -> {
            Map<String, String> style = new LinkedHashMap<>();
            style.put("display", "flex");
            if (alignItems != null) {
                style.put("alignItems", alignItems);
            }
            style.put("justifyContent", horizontalFlex(horizontal, cell));
            return Collections.unmodifiableMap(style);
        };
    }

    private static String verticalFlex(String vertical) {
        if (vertical == null) {
            return null;
        }
        return switch (vertical) {
            case "top", "start" -> "flex-start";
            case "middle", "center" -> "center";
            case "bottom", "end" -> "flex-end";
            default -> null;
        };
    }

    private static String horizontalFlex(String horizontal, CellStyleFunction.CellContext cell) {
        String justify = horizontal == null
                ? null
                : switch (horizontal) {
                    case "left", "start" -> "flex-start";
                    case "center" -> "center";
                    case "right", "end" -> "flex-end";
                    default -> null;
                };
        if (justify != null) {
            return justify;
        }
        return cell != null && cell.isNumeric() ? "flex-end" : "flex-start";
    }

    private static boolean isSet(JsonNode node) {
        return node != null && !node.isNull() && !node.asText().isEmpty();
    }

    private static String textOrNull(JsonNode node) {
        return isSet(node) ? node.asText() : null;
    }
}

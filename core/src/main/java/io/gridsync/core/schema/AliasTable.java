package io.gridsync.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.gridsync.core.model.JsonNodes;
import io.gridsync.core.model.ValueKind;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Static mapping from legacy grid option names to their canonical replacements.
 *
 * <p>
 * Two kinds of rewrite happen here:
 * <ul>
 * <li><b>Renames</b>: a legacy name maps to a different canonical name, with a value transform.
 * Legacy flags that became a field of a structured option (for example
 * {@code suppressRowDeselection} → {@code rowSelection.enableDeselection}) produce an object
 * fragment that is merged into the target, never a replacement of it.
 * <li><b>Shape fixes</b>: a canonical name given in a legacy shape (for example
 * {@code rowSelection: "multiple"} or {@code cellSelection: true}) is rewritten into the canonical
 * shape under the same name.
 * </ul>
 *
 * <p>
 * Resolution is pure and idempotent: resolving a canonical name with a canonical value returns
 * the same name and an equal value.
 */
public final class AliasTable {

    private static final Map<String, AliasEntry> LEGACY;
    private static final Map<String, UnaryOperator<JsonNode>> SHAPES;

    static {
        Map<String, AliasEntry> legacy = new LinkedHashMap<>();

        // rowSelection fragments
        register(legacy, "rowMultiSelectWithClick", "rowSelection", v -> {
            ObjectNode fragment = object();
            fragment.put("mode", "multiRow");
            fragment.put("enableSelectionWithoutKeys", JsonNodes.isTruthy(v));
            return fragment;
        });
        register(legacy, "suppressRowClickSelection", "rowSelection", v -> flag("enableClickSelection", !truthy(v)));
        register(legacy, "suppressCopyRowsToClipboard", "rowSelection", v -> flag("copySelectedRows", !truthy(v)));
        register(legacy, "suppressRowDeselection", "rowSelection", v -> flag("enableDeselection", !truthy(v)));
        register(legacy, "groupSelectsChildren", "rowSelection", v -> {
            ObjectNode fragment = object();
            fragment.put("groupSelects", truthy(v) ? "descendants" : "self");
            return fragment;
        });

        // cellSelection fragments
        register(legacy, "enableRangeSelection", "cellSelection", v -> flag("enabled", truthy(v)));
        register(legacy, "suppressCellSelection", "cellSelection", v -> flag("enabled", !truthy(v)));
        register(legacy, "suppressMultiRangeSelection", "cellSelection", v -> flag("suppressMultiRanges", truthy(v)));

        // straight renames
        register(legacy, "groupRemoveSingleChildren", "groupHideParentOfSingleChild", JsonNodes::copyOf);
        register(legacy, "enterMovesDown", "enterNavigatesVertically", JsonNodes::copyOf);
        register(legacy, "enterMovesDownAfterEdit", "enterNavigatesVerticallyAfterEdit", JsonNodes::copyOf);
        register(legacy, "exporterCsvFilename", "csvFilename", JsonNodes::copyOf);
        register(legacy, "exporterExcelFilename", "excelFilename", JsonNodes::copyOf);

        // renames with a value change
        register(legacy, "enableCellChangeFlash", "cellFlashDuration", v -> IntNode.valueOf(truthy(v) ? 500 : 0));
        register(legacy, "groupIncludeFooter", "groupTotalRow", AliasTable::bottomOrNull);
        register(legacy, "groupIncludeTotalFooter", "grandTotalRow", AliasTable::bottomOrNull);

        LEGACY = Collections.unmodifiableMap(legacy);

        Map<String, UnaryOperator<JsonNode>> shapes = new LinkedHashMap<>();
        shapes.put(CanonicalOption.ROW_SELECTION.key(), SpecialOptions::canonicalRowSelection);
        shapes.put(CanonicalOption.CELL_SELECTION.key(), SpecialOptions::canonicalCellSelection);
        shapes.put(CanonicalOption.SIDE_BAR.key(), SpecialOptions::canonicalSideBar);
        shapes.put(CanonicalOption.STATUS_BAR.key(), SpecialOptions::canonicalStatusBar);
        SHAPES = Collections.unmodifiableMap(shapes);
    }

    private AliasTable() {}

    /**
     * Resolves a raw option name and value into canonical form.
     *
     * @param name  raw option name, legacy or canonical
     * @param value raw value; {@code null} is treated as JSON {@code null}
     * @return the canonical name, value and merge strategy
     */
    public static AliasResolution resolve(String name, JsonNode value) {
        AliasEntry entry = LEGACY.get(name);
        if (entry != null) {
            return entry.resolve(value);
        }
        UnaryOperator<JsonNode> shape = SHAPES.get(name);
        JsonNode canonical = shape != null ? shape.apply(value) : JsonNodes.copyOf(value);
        return new AliasResolution(name, canonical, mergeStrategyFor(name), false);
    }

    /** True when {@code name} is a legacy option name. */
    public static boolean isLegacy(String name) {
        return LEGACY.containsKey(name);
    }

    /** The entry for a legacy name, or {@code null}. */
    public static AliasEntry entry(String legacyName) {
        return LEGACY.get(legacyName);
    }

    /** All legacy entries in registration order. */
    public static Collection<AliasEntry> entries() {
        return LEGACY.values();
    }

    /** Legacy names that map onto {@code canonicalName}. */
    public static List<String> legacyNamesFor(String canonicalName) {
        List<String> names = new ArrayList<>();
        for (AliasEntry entry : LEGACY.values()) {
            if (entry.canonicalName().equals(canonicalName)) {
                names.add(entry.legacyName());
            }
        }
        return names;
    }

    /** Structured options always merge; everything else replaces. */
    static MergeStrategy mergeStrategyFor(String canonicalName) {
        CanonicalOption option = CanonicalOption.fromKey(canonicalName);
        return option != null && option.kind() == ValueKind.STRUCTURED ? MergeStrategy.MERGE_INTO : MergeStrategy.REPLACE;
    }

    // --- Private helpers ---

    private static void register(
            Map<String, AliasEntry> table, String legacyName, String canonicalName, UnaryOperator<JsonNode> transform) {
        table.put(legacyName, new AliasEntry(legacyName, canonicalName, transform, mergeStrategyFor(canonicalName)));
    }

    private static boolean truthy(JsonNode value) {
        return JsonNodes.isTruthy(value);
    }

    private static ObjectNode object() {
        return JsonNodeFactory.instance.objectNode();
    }

    private static ObjectNode flag(String field, boolean value) {
        ObjectNode fragment = object();
        fragment.set(field, BooleanNode.valueOf(value));
        return fragment;
    }

    private static JsonNode bottomOrNull(JsonNode value) {
        return truthy(value) ? TextNode.valueOf("bottom") : NullNode.getInstance();
    }
}

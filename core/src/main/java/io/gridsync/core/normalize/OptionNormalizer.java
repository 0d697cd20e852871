package io.gridsync.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gridsync.core.model.JsonNodes;
import io.gridsync.core.model.OptionBag;
import io.gridsync.core.model.OptionValue;
import io.gridsync.core.schema.AliasResolution;
import io.gridsync.core.schema.AliasTable;
import io.gridsync.core.schema.CanonicalOption;
import io.gridsync.core.schema.MergeStrategy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw option bag, as edited in a settings dialog or read from an older profile, into a
 * bag of canonical options.
 *
 * <p>
 * Normalization steps, in order:
 * <ol>
 * <li>Dialog sections ({@code basic}, {@code selection}, {@code defaults}, ...) holding an object
 * are flattened one level into the top-level bag.</li>
 * <li>Noise is dropped: numeric keys, column-definition properties and row-selection
 * sub-properties at grid level, and UI-only keys.</li>
 * <li>Every remaining key is resolved through {@link AliasTable}. Values bound for a structured
 * option merge onto what the same pass has already accumulated for it; everything else replaces,
 * so the later raw key wins.</li>
 * </ol>
 *
 * <p>
 * Unknown keys pass through untouched. Normalization is idempotent on canonical input.
 *
 * <p>
 * Thread-safe: stateless.
 */
public final class OptionNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(OptionNormalizer.class);

    /** Settings dialog section names whose object value is flattened one level. */
    static final Set<String> DIALOG_SECTIONS = Set.of(
            "basic",
            "selection",
            "sorting",
            "filtering",
            "pagination",
            "grouping",
            "editing",
            "appearance",
            "styling",
            "data",
            "clipboard",
            "export",
            "columns",
            "defaults",
            "sizing",
            "performance",
            "advanced",
            "ui");

    /** Column-definition properties; noise at grid level, kept inside {@code defaultColDef}. */
    static final Set<String> COLUMN_DEF_PROPERTIES = Set.of(
            "sortable",
            "resizable",
            "filter",
            "editable",
            "flex",
            "minWidth",
            "maxWidth",
            "width",
            "enableValue",
            "enableRowGroup",
            "enablePivot",
            "sortingOrder",
            "checkboxSelection",
            "headerCheckboxSelection",
            "cellStyle",
            "cellEditor",
            "cellRenderer",
            "floatingFilter",
            "wrapText",
            "autoHeight",
            "wrapHeaderText",
            "autoHeaderHeight",
            "suppressHeaderMenuButton");

    /** Alignment inputs accepted inside {@code defaultColDef}. */
    static final Set<String> ALIGNMENT_PROPERTIES = Set.of("verticalAlign", "horizontalAlign");

    /** Fields of the {@code rowSelection} object; noise when they appear at grid level. */
    static final Set<String> ROW_SELECTION_PROPERTIES = Set.of(
            "mode",
            "checkboxes",
            "headerCheckbox",
            "checkboxLocation",
            "enableClickSelection",
            "enableSelectionWithoutKeys",
            "enableDeselection",
            "copySelectedRows",
            "groupSelects",
            "hideDisabledCheckboxes",
            "isRowSelectable");

    /** Keys owned by the host UI, never grid options. */
    static final Set<String> UI_ONLY_KEYS = Set.of("theme");

    private static final Pattern NUMERIC_KEY = Pattern.compile("\\d+");

    /**
     * Normalizes a raw bag. Every canonical key produced is reported as changed.
     *
     * @param raw raw options; not modified
     * @return canonical options and the keys produced
     */
    public NormalizedOptions normalize(ObjectNode raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        Map<String, JsonNode> accumulated = new LinkedHashMap<>();
        int aliased = 0;
        for (Map.Entry<String, JsonNode> entry : flatten(raw)) {
            AliasResolution resolution = AliasTable.resolve(entry.getKey(), entry.getValue());
            if (resolution.aliased()) {
                aliased++;
                LOG.debug(
                        "Resolved legacy option: legacy={}, canonical={}",
                        entry.getKey(),
                        resolution.canonicalName());
            }
            accumulate(accumulated, resolution);
        }

        OptionBag.Builder builder = OptionBag.builder();
        accumulated.forEach((name, json) -> builder.put(name, wrap(name, json)));
        OptionBag options = builder.build();
        if (aliased > 0) {
            LOG.info("Normalized options: keys={}, legacy_aliases={}", options.size(), aliased);
        }
        return new NormalizedOptions(options, new LinkedHashSet<>(options.names()));
    }

    /**
     * Normalizes a raw bag and reports as changed only the keys whose value differs from
     * {@code baseline}.
     *
     * @param raw      raw options; not modified
     * @param baseline canonical options to compare against
     */
    public NormalizedOptions normalize(ObjectNode raw, OptionBag baseline) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        NormalizedOptions normalized = normalize(raw);
        Set<String> changed = new LinkedHashSet<>();
        normalized.options().forEach((name, value) -> {
            if (!OptionDelta.sameValue(value, baseline.get(name))) {
                changed.add(name);
            }
        });
        return new NormalizedOptions(normalized.options(), changed);
    }

    /** True when {@code name} is a settings dialog section flattened by this normalizer. */
    public static boolean isDialogSection(String name) {
        return DIALOG_SECTIONS.contains(name);
    }

    /**
     * Wraps a canonical JSON value in the shape its option expects. Unknown options stay scalar.
     */
    public static OptionValue wrap(String name, JsonNode json) {
        CanonicalOption option = CanonicalOption.fromKey(name);
        return option != null ? option.wrap(json) : OptionValue.scalar(json);
    }

    // --- Private helpers ---

    private static void accumulate(Map<String, JsonNode> accumulated, AliasResolution resolution) {
        String name = resolution.canonicalName();
        JsonNode value = resolution.canonicalValue();
        JsonNode existing = accumulated.get(name);
        if (resolution.mergeStrategy() == MergeStrategy.MERGE_INTO
                && existing != null
                && existing.isObject()
                && value.isObject()) {
            accumulated.put(name, JsonNodes.shallowMerge((ObjectNode) existing, (ObjectNode) value));
        } else {
            accumulated.put(name, value);
        }
    }

    private static List<Map.Entry<String, JsonNode>> flatten(ObjectNode raw) {
        List<Map.Entry<String, JsonNode>> entries = new ArrayList<>();
        raw.fields().forEachRemaining(field -> {
            String key = field.getKey();
            JsonNode value = field.getValue();
            if (DIALOG_SECTIONS.contains(key) && value.isObject()) {
                value.fields().forEachRemaining(inner -> {
                    if ("defaults".equals(key) && "defaultColDef".equals(inner.getKey())) {
                        ObjectNode colDef = columnDefaults(inner.getValue());
                        if (colDef != null) {
                            entries.add(Map.entry("defaultColDef", colDef));
                        }
                    } else if (!isNoise(inner.getKey(), inner.getValue())) {
                        entries.add(Map.entry(inner.getKey(), inner.getValue()));
                    }
                });
            } else if (!isNoise(key, value)) {
                entries.add(Map.entry(key, value));
            }
        });
        return entries;
    }

    private static boolean isNoise(String key, JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return true;
        }
        if (NUMERIC_KEY.matcher(key).matches()) {
            return true;
        }
        return COLUMN_DEF_PROPERTIES.contains(key)
                || ROW_SELECTION_PROPERTIES.contains(key)
                || UI_ONLY_KEYS.contains(key);
    }

    /** Keeps only column-definition and alignment properties; {@code null} if nothing is left. */
    private static ObjectNode columnDefaults(JsonNode value) {
        if (value == null || !value.isObject()) {
            return null;
        }
        ObjectNode kept = JsonNodeFactory.instance.objectNode();
        value.fields().forEachRemaining(field -> {
            if (COLUMN_DEF_PROPERTIES.contains(field.getKey()) || ALIGNMENT_PROPERTIES.contains(field.getKey())) {
                kept.set(field.getKey(), field.getValue().deepCopy());
            }
        });
        return kept.isEmpty() ? null : kept;
    }
}

package io.gridsync.core.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gridsync.core.model.JsonNodes;
import io.gridsync.core.normalize.OptionNormalizer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Edits recorded since the last commit, in the order they were made.
 *
 * <p>
 * Repeated edits to the same option key collapse to the last value, which moves to the end,
 * whichever category each edit came through. Toolbar fields are keyed separately from options.
 * Not thread-safe; owned by the controller.
 */
public final class PendingChangeSet {

    /** Category whose edits change the toolbar state instead of grid options. */
    public static final String TOOLBAR_CATEGORY = "toolbar";

    private final Map<EditKey, JsonNode> edits = new LinkedHashMap<>();

    /**
     * Records an edit, replacing any earlier edit of the same key.
     *
     * @param value new value; {@code null} is recorded as JSON {@code null}
     */
    public void record(String category, String key, JsonNode value) {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(key, "key must not be null");
        EditKey editKey = new EditKey(category, key);
        edits.keySet().removeIf(editKey::sameTarget);
        edits.put(editKey, JsonNodes.copyOf(value));
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    /** Number of distinct keys edited. */
    public int size() {
        return edits.size();
    }

    public void clear() {
        edits.clear();
    }

    /**
     * Removes and returns every recorded edit.
     *
     * <p>
     * Option edits come back as a raw bag for the normalizer: edits in a dialog section category
     * are nested under the section name, edits in any other category are placed at top level.
     * Toolbar edits come back separately.
     */
    public Drained drain() {
        ObjectNode options = JsonNodeFactory.instance.objectNode();
        Map<String, JsonNode> toolbar = new LinkedHashMap<>();
        edits.forEach((editKey, value) -> {
            String category = editKey.category();
            if (editKey.isToolbar()) {
                toolbar.put(editKey.key(), value);
            } else if (OptionNormalizer.isDialogSection(category)) {
                ObjectNode nested = options.has(category) && options.get(category).isObject()
                        ? (ObjectNode) options.get(category)
                        : options.putObject(category);
                nested.set(editKey.key(), value);
            } else {
                options.set(editKey.key(), value);
            }
        });
        edits.clear();
        return new Drained(options, Collections.unmodifiableMap(toolbar));
    }

    private record EditKey(String category, String key) {

        boolean isToolbar() {
            return TOOLBAR_CATEGORY.equals(category);
        }

        /** Same option key, or same toolbar field, regardless of category. */
        boolean sameTarget(EditKey other) {
            return key.equals(other.key) && isToolbar() == other.isToolbar();
        }
    }

    /**
     * Drained edits.
     *
     * @param options raw option bag for the normalizer
     * @param toolbar toolbar field edits
     */
    public record Drained(ObjectNode options, Map<String, JsonNode> toolbar) {

        public boolean isEmpty() {
            return options.isEmpty() && toolbar.isEmpty();
        }
    }
}

package io.gridsync.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Presentation settings of the toolbar surrounding the grid. Edited through the {@code "toolbar"}
 * settings category and persisted with each profile; never pushed to the grid.
 *
 * @param fontFamily font family, e.g. {@code "monospace"}
 * @param fontSize   font size in pixels
 * @param spacing    spacing between toolbar items in pixels
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolbarState(String fontFamily, Integer fontSize, Integer spacing) {

    /** Toolbar settings used when a profile carries none. */
    public static final ToolbarState DEFAULT = new ToolbarState("monospace", 12, 6);

    /** Returns this state with every missing field taken from {@link #DEFAULT}. */
    public ToolbarState withDefaults() {
        return new ToolbarState(
                fontFamily != null ? fontFamily : DEFAULT.fontFamily,
                fontSize != null ? fontSize : DEFAULT.fontSize,
                spacing != null ? spacing : DEFAULT.spacing);
    }

    /**
     * Returns this state with one field replaced. Unknown field names and absent values leave the
     * state unchanged.
     */
    public ToolbarState with(String field, JsonNode value) {
        if (JsonNodes.isAbsent(value)) {
            return this;
        }
        return switch (field) {
            case "fontFamily" -> new ToolbarState(value.asText(), fontSize, spacing);
            case "fontSize" -> new ToolbarState(fontFamily, value.asInt(), spacing);
            case "spacing" -> new ToolbarState(fontFamily, fontSize, value.asInt());
            default -> this;
        };
    }
}

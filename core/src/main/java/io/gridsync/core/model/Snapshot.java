package io.gridsync.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * A persisted profile: the complete serializable description of a grid's configuration.
 *
 * <ul>
 * <li>{@code viewConfiguration}: option values that differ from the engine defaults, in their
 * persistable form (function values reduced to their scalar inputs).
 * <li>{@code initializationOptions}: options only honored at grid construction. Persisted so a
 * host can construct a grid with them; never pushed to a live grid.
 * <li>{@code freeformExtension}: options with no canonical definition, preserved verbatim.
 * <li>{@code transientViewState}: column layout, filters, selection and the like.
 * </ul>
 *
 * <p>
 * Snapshots contain no functions, no live handles and no reference to the grid they came from.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Snapshot(
        String name,
        ToolbarState toolbarState,
        ObjectNode viewConfiguration,
        ObjectNode initializationOptions,
        TransientViewState transientViewState,
        ObjectNode freeformExtension,
        SnapshotMetadata metadata) {

    public Snapshot {
        Objects.requireNonNull(name, "name must not be null");
        toolbarState = toolbarState == null ? ToolbarState.DEFAULT : toolbarState.withDefaults();
        viewConfiguration = copyOrEmpty(viewConfiguration);
        initializationOptions = copyOrEmpty(initializationOptions);
        transientViewState = transientViewState == null ? TransientViewState.EMPTY : transientViewState;
        freeformExtension = copyOrEmpty(freeformExtension);
    }

    @Override
    public ObjectNode viewConfiguration() {
        return viewConfiguration.deepCopy();
    }

    @Override
    public ObjectNode initializationOptions() {
        return initializationOptions.deepCopy();
    }

    @Override
    public ObjectNode freeformExtension() {
        return freeformExtension.deepCopy();
    }

    /** Returns a copy of this snapshot under a different name. */
    public Snapshot renamed(String newName) {
        return new Snapshot(
                newName,
                toolbarState,
                viewConfiguration,
                initializationOptions,
                transientViewState,
                freeformExtension,
                metadata);
    }

    private static ObjectNode copyOrEmpty(ObjectNode node) {
        return node == null ? JsonNodeFactory.instance.objectNode() : node.deepCopy();
    }
}

package io.gridsync.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gridsync.core.error.ConfigLoadException;
import io.gridsync.core.model.OptionBag;
import io.gridsync.core.model.OptionValue;
import io.gridsync.core.model.ToolbarState;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The option values a grid has before any profile is applied.
 *
 * <p>
 * Loaded from the classpath resource {@value #RESOURCE}. Every entry goes through the alias table
 * on load, so the resource may use legacy names or shapes and the resulting bag is still
 * canonical. Profiles persist only their difference from these defaults.
 *
 * <p>
 * Thread-safe: immutable after construction.
 */
public final class EngineDefaults {

    private static final Logger LOG = LoggerFactory.getLogger(EngineDefaults.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    /** Classpath location of the bundled defaults. */
    public static final String RESOURCE = "gridsync/default-options.json";

    private final OptionBag options;
    private final ToolbarState toolbar;

    public EngineDefaults(OptionBag options, ToolbarState toolbar) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.toolbar = Objects.requireNonNull(toolbar, "toolbar must not be null").withDefaults();
    }

    /**
     * Loads the bundled defaults.
     *
     * @throws ConfigLoadException if the resource is missing or is not a JSON object
     */
    public static EngineDefaults load() {
        try (InputStream in = EngineDefaults.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new ConfigLoadException("Default options resource not found on classpath: " + RESOURCE);
            }
            JsonNode root = JSON.readTree(in);
            if (root == null || !root.isObject()) {
                throw new ConfigLoadException("Default options resource must hold a JSON object: " + RESOURCE);
            }
            EngineDefaults defaults = fromJson((ObjectNode) root);
            LOG.debug("Loaded engine defaults: options={}", defaults.options.size());
            return defaults;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read default options resource: " + RESOURCE, e);
        }
    }

    /** Builds defaults from a JSON object of option values, resolving aliases. */
    public static EngineDefaults fromJson(ObjectNode json) {
        OptionBag.Builder builder = OptionBag.builder();
        json.fields().forEachRemaining(field -> {
            AliasResolution resolved = AliasTable.resolve(field.getKey(), field.getValue());
            CanonicalOption option = CanonicalOption.fromKey(resolved.canonicalName());
            OptionValue value = option != null
                    ? option.wrap(resolved.canonicalValue())
                    : OptionValue.scalar(resolved.canonicalValue());
            builder.put(resolved.canonicalName(), value);
        });
        return new EngineDefaults(builder.build(), ToolbarState.DEFAULT);
    }

    /** Default option values in canonical form. */
    public OptionBag options() {
        return options;
    }

    /** Default toolbar settings. */
    public ToolbarState toolbar() {
        return toolbar;
    }
}

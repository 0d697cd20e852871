package io.gridsync.core.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.gridsync.core.error.SnapshotCodecException;
import io.gridsync.core.model.Snapshot;
import io.gridsync.core.model.SnapshotMetadata;
import io.gridsync.core.model.ToolbarState;
import io.gridsync.core.model.TransientViewState;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON encoding of {@link Snapshot}s.
 *
 * <p>
 * Decoding is lenient: the document is validated against the bundled JSON Schema
 * ({@value #SCHEMA_RESOURCE}), and any section that is missing or unusable is replaced by its
 * default and reported as a warning. Only input that is not a JSON object at all is rejected with
 * a {@link SnapshotCodecException}.
 *
 * <p>
 * Thread-safe: the mapper and schema are immutable after construction.
 */
public final class SnapshotCodec {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotCodec.class);

    /** Classpath location of the snapshot JSON Schema. */
    public static final String SCHEMA_RESOURCE = "gridsync/snapshot.schema.json";

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final ObjectMapper mapper;
    private final JsonSchema schema;

    public SnapshotCodec() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.schema = loadSchema(mapper);
    }

    /** Encodes a snapshot as a JSON tree. */
    public ObjectNode toJson(Snapshot snapshot) {
        return mapper.valueToTree(snapshot);
    }

    /**
     * Encodes a snapshot as JSON text.
     *
     * @param pretty indent the output
     */
    public String write(Snapshot snapshot, boolean pretty) {
        try {
            return pretty
                    ? mapper.writer().with(SerializationFeature.INDENT_OUTPUT).writeValueAsString(snapshot)
                    : mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new SnapshotCodecException("Failed to encode snapshot", e, snapshot.name());
        }
    }

    /**
     * Decodes JSON text.
     *
     * @param json   snapshot JSON
     * @param source where the text came from, used in messages and as the fallback name
     * @throws SnapshotCodecException if the text is not a JSON object
     */
    public SnapshotReadResult read(String json, String source) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SnapshotCodecException("Snapshot is not valid JSON: " + e.getOriginalMessage(), e, source);
        }
        return read(root, source);
    }

    /**
     * Decodes a JSON tree, filling defaults for missing or unusable sections.
     *
     * @param root   snapshot JSON
     * @param source where the tree came from, used in messages and as the fallback name
     * @throws SnapshotCodecException if {@code root} is not a JSON object
     */
    public SnapshotReadResult read(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new SnapshotCodecException("Snapshot must be a JSON object", source);
        }
        List<String> warnings = new ArrayList<>();
        Set<ValidationMessage> violations = schema.validate(root);
        if (!violations.isEmpty()) {
            warnings.add(violations.stream().map(ValidationMessage::getMessage).collect(Collectors.joining("; ")));
        }

        String name = root.path("name").isTextual() ? root.get("name").asText() : source;
        ToolbarState toolbar = section(root, "toolbarState", ToolbarState.class, warnings);
        ObjectNode viewConfiguration = objectSection(root, "viewConfiguration", warnings);
        ObjectNode initializationOptions = objectSection(root, "initializationOptions", null);
        TransientViewState transientState = section(root, "transientViewState", TransientViewState.class, warnings);
        ObjectNode freeform = objectSection(root, "freeformExtension", null);
        SnapshotMetadata metadata = section(root, "metadata", SnapshotMetadata.class, null);

        if (!warnings.isEmpty()) {
            LOG.warn(
                    "Snapshot is incomplete, using defaults for unusable sections: source={}, issues={}",
                    source,
                    warnings);
        }
        Snapshot snapshot = new Snapshot(
                name == null ? "" : name,
                toolbar,
                viewConfiguration,
                initializationOptions,
                transientState,
                freeform,
                metadata);
        return new SnapshotReadResult(snapshot, warnings);
    }

    // --- Private helpers ---

    private <T> T section(JsonNode root, String field, Class<T> type, List<String> warnings) {
        JsonNode node = root.get(field);
        if (node == null || !node.isObject()) {
            if (warnings != null) {
                warnings.add("section '" + field + "' is missing or not an object");
            }
            return null;
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            if (warnings != null) {
                warnings.add("section '" + field + "' is unreadable: " + e.getMessage());
            }
            return null;
        }
    }

    private static ObjectNode objectSection(JsonNode root, String field, List<String> warnings) {
        JsonNode node = root.get(field);
        if (node != null && node.isObject()) {
            return (ObjectNode) node;
        }
        if (warnings != null) {
            warnings.add("section '" + field + "' is missing or not an object");
        }
        return null;
    }

    private static JsonSchema loadSchema(ObjectMapper mapper) {
        try (InputStream in = SnapshotCodec.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SnapshotCodecException("Snapshot schema not found on classpath", SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(mapper.readTree(in));
        } catch (IOException e) {
            throw new SnapshotCodecException("Failed to read snapshot schema", e, SCHEMA_RESOURCE);
        }
    }
}

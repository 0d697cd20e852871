package io.gridsync.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.gridsync.core.error.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link SyncConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * YAML layout:
 *
 * <pre>
 * timing:
 *   frame-delay-ms: 16
 *   settle-delay-ms: 20
 *   width-reassert-delay-ms: 200
 * store:
 *   dir: ./profiles
 *   pretty-print: true
 * </pre>
 *
 * <p>
 * Missing keys take the defaults from {@link SyncConfig.Builder}. Every key can be overridden by
 * an environment variable ({@code GRIDSYNC_FRAME_DELAY_MS}, {@code GRIDSYNC_SETTLE_DELAY_MS},
 * {@code GRIDSYNC_WIDTH_REASSERT_DELAY_MS}, {@code GRIDSYNC_STORE_DIR},
 * {@code GRIDSYNC_STORE_PRETTY_PRINT}). A variable counts as set only if it is defined and
 * non-blank after trimming; otherwise the YAML value stands.
 */
public final class SyncConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SyncConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_FRAME_DELAY_MS = "GRIDSYNC_FRAME_DELAY_MS";
    static final String ENV_SETTLE_DELAY_MS = "GRIDSYNC_SETTLE_DELAY_MS";
    static final String ENV_WIDTH_REASSERT_DELAY_MS = "GRIDSYNC_WIDTH_REASSERT_DELAY_MS";
    static final String ENV_STORE_DIR = "GRIDSYNC_STORE_DIR";
    static final String ENV_STORE_PRETTY_PRINT = "GRIDSYNC_STORE_PRETTY_PRINT";

    private SyncConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from a YAML file, overlaid with {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid
     *                             value
     */
    public static SyncConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from a YAML file, overlaid with the supplied environment lookup.
     *
     * @param configPath path to the YAML file
     * @param envLookup  maps variable names to values; {@code null} means undefined
     */
    public static SyncConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            SyncConfig config = mapToConfig(root, envLookup);
            LOG.info(
                    "Loaded configuration: path={}, settle_delay_ms={}, width_reassert_delay_ms={}, store_dir={}",
                    configPath,
                    config.settleDelayMs(),
                    config.widthReassertDelayMs(),
                    config.storeDir());
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /** Defaults overlaid with {@link System#getenv}; no file involved. */
    public static SyncConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Defaults overlaid with the supplied environment lookup. */
    public static SyncConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(null, envLookup);
    }

    /** Maps a parsed YAML tree onto the builder, then overlays environment variables. */
    private static SyncConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        SyncConfig.Builder builder = SyncConfig.builder();

        // --- YAML mapping ---
        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping");
            }
            JsonNode timing = root.path("timing");
            if (timing.has("frame-delay-ms")) builder.frameDelayMs(intValue(timing, "frame-delay-ms"));
            if (timing.has("settle-delay-ms")) builder.settleDelayMs(intValue(timing, "settle-delay-ms"));
            if (timing.has("width-reassert-delay-ms"))
                builder.widthReassertDelayMs(intValue(timing, "width-reassert-delay-ms"));

            JsonNode store = root.path("store");
            if (store.has("dir")) builder.storeDir(store.get("dir").asText());
            if (store.has("pretty-print")) builder.storePrettyPrint(store.get("pretty-print").asBoolean());
        }

        // --- Environment variable overlay ---
        envInt(envLookup, ENV_FRAME_DELAY_MS, builder::frameDelayMs);
        envInt(envLookup, ENV_SETTLE_DELAY_MS, builder::settleDelayMs);
        envInt(envLookup, ENV_WIDTH_REASSERT_DELAY_MS, builder::widthReassertDelayMs);
        envString(envLookup, ENV_STORE_DIR, builder::storeDir);
        envBool(envLookup, ENV_STORE_PRETTY_PRINT, builder::storePrettyPrint);

        return builder.build();
    }

    private static int intValue(JsonNode section, String field) {
        JsonNode value = section.get(field);
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.asInt();
        }
        if (value.isTextual()) {
            return parseInt(field, value.asText());
        }
        throw new ConfigLoadException("Expected an integer for '" + field + "' but got: " + value);
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the variable is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseInt(envVar, envLookup.apply(envVar).trim()));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    private static int parseInt(String name, String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Expected an integer for '" + name + "' but got: " + text, e);
        }
    }
}

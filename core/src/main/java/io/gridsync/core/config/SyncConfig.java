package io.gridsync.core.config;

import io.gridsync.core.error.ConfigLoadException;
import java.time.Duration;

/**
 * Engine configuration. Use {@link #builder()}; every field has a default.
 *
 * @param frameDelayMs         delay of a frame task, i.e. one rendering frame
 * @param settleDelayMs        delay between applying a loaded profile's options and replaying its
 *                             view state
 * @param widthReassertDelayMs delay between the view state replay and re-asserting column widths
 * @param storeDir             directory of the file profile store
 * @param storePrettyPrint     whether the file profile store indents its JSON
 */
public record SyncConfig(
        int frameDelayMs, int settleDelayMs, int widthReassertDelayMs, String storeDir, boolean storePrettyPrint) {

    /** All defaults. */
    public static final SyncConfig DEFAULT = builder().build();

    public SyncConfig {
        requireNonNegative("frameDelayMs", frameDelayMs);
        requireNonNegative("settleDelayMs", settleDelayMs);
        requireNonNegative("widthReassertDelayMs", widthReassertDelayMs);
        if (storeDir == null || storeDir.isBlank()) {
            throw new ConfigLoadException("storeDir must not be blank");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration settleDelay() {
        return Duration.ofMillis(settleDelayMs);
    }

    public Duration widthReassertDelay() {
        return Duration.ofMillis(widthReassertDelayMs);
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new ConfigLoadException(name + " must not be negative: " + value);
        }
    }

    /** Builder for {@link SyncConfig}. */
    public static final class Builder {
        private int frameDelayMs = 16;
        private int settleDelayMs = 20;
        private int widthReassertDelayMs = 200;
        private String storeDir = "./profiles";
        private boolean storePrettyPrint = true;

        Builder() {}

        public Builder frameDelayMs(int frameDelayMs) {
            this.frameDelayMs = frameDelayMs;
            return this;
        }

        public Builder settleDelayMs(int settleDelayMs) {
            this.settleDelayMs = settleDelayMs;
            return this;
        }

        public Builder widthReassertDelayMs(int widthReassertDelayMs) {
            this.widthReassertDelayMs = widthReassertDelayMs;
            return this;
        }

        public Builder storeDir(String storeDir) {
            this.storeDir = storeDir;
            return this;
        }

        public Builder storePrettyPrint(boolean storePrettyPrint) {
            this.storePrettyPrint = storePrettyPrint;
            return this;
        }

        public SyncConfig build() {
            return new SyncConfig(frameDelayMs, settleDelayMs, widthReassertDelayMs, storeDir, storePrettyPrint);
        }
    }
}

package io.gridsync.core.error;

/** Thrown when the engine configuration cannot be loaded or holds an invalid value. */
public final class ConfigLoadException extends GridSyncException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message, Area.CONFIGURATION);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause, Area.CONFIGURATION);
    }
}

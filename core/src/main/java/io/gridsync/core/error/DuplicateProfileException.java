package io.gridsync.core.error;

/**
 * Thrown when creating a profile whose name already exists. Names are compared case-insensitively,
 * so {@code "Compact"} collides with {@code "compact"}.
 */
public final class DuplicateProfileException extends ProfileStoreException {

    private static final long serialVersionUID = 1L;

    public DuplicateProfileException(String profileName) {
        super("A profile named '" + profileName + "' already exists", profileName, Area.PROFILE);
    }
}

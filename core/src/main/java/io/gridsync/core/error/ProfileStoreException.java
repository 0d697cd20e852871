package io.gridsync.core.error;

/** Thrown by a {@code ProfileStore} when the backing storage cannot be read or written. */
public class ProfileStoreException extends GridSyncException {

    private static final long serialVersionUID = 1L;

    private final String profileName;

    public ProfileStoreException(String message, String profileName) {
        super(message, Area.STORE);
        this.profileName = profileName;
    }

    public ProfileStoreException(String message, Throwable cause, String profileName) {
        super(message, cause, Area.STORE);
        this.profileName = profileName;
    }

    protected ProfileStoreException(String message, String profileName, Area area) {
        super(message, area);
        this.profileName = profileName;
    }

    /** The profile involved, or {@code null} for store-wide failures. */
    public String profileName() {
        return profileName;
    }
}

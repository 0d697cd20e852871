package io.gridsync.core.spi;

import io.gridsync.core.model.Snapshot;
import java.util.List;

/**
 * Durable storage for named profiles, plus the pointer to the profile that was last active.
 *
 * <p>
 * The engine never holds a snapshot past the call that produced or consumed it, so stores may
 * hand out copies freely. Implementations throw {@link io.gridsync.core.error.ProfileStoreException}
 * when the backing storage fails.
 */
public interface ProfileStore {

    /**
     * Reads a profile.
     *
     * @return the snapshot, or {@code null} if no profile has that name
     */
    Snapshot get(String name);

    /** Writes a profile, replacing any profile of the same name. */
    void set(String name, Snapshot snapshot);

    /** Profile names, in display order. */
    List<String> list();

    /**
     * Deletes a profile. Deleting an absent profile is a no-op.
     *
     * @return true if a profile was removed
     */
    boolean delete(String name);

    /** Name of the last active profile, or {@code null}. */
    String activeProfileName();

    /** Records the active profile; {@code null} clears the pointer. */
    void setActiveProfileName(String name);
}

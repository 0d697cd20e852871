package io.gridsync.core.controller;

import io.gridsync.core.error.DuplicateProfileException;
import io.gridsync.core.model.Snapshot;
import io.gridsync.core.spi.ProfileStore;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named-profile operations on top of a {@link SettingsController} and a {@link ProfileStore}.
 *
 * <p>
 * The store's active-profile pointer is kept in step with the profile the controller last loaded
 * or created, so {@link #restoreActive()} brings the same profile back on the next start.
 */
public final class ProfileManager {

    private static final Logger LOG = LoggerFactory.getLogger(ProfileManager.class);

    private final SettingsController controller;
    private final ProfileStore store;

    public ProfileManager(SettingsController controller, ProfileStore store) {
        this.controller = Objects.requireNonNull(controller, "controller must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Loads the profile named by the store's active pointer. A pointer to a missing profile is
     * cleared.
     *
     * @return true if a profile was loaded
     */
    public boolean restoreActive() {
        String name = store.activeProfileName();
        if (name == null) {
            return false;
        }
        Snapshot snapshot = store.get(name);
        if (snapshot == null) {
            LOG.warn("Active profile missing from store, pointer cleared: name={}", name);
            store.setActiveProfileName(null);
            return false;
        }
        controller.loadProfile(snapshot);
        return true;
    }

    public List<String> profiles() {
        return store.list();
    }

    /** Name of the active profile, or {@code null}. */
    public String activeProfile() {
        return store.activeProfileName();
    }

    /**
     * Saves the current state as a new profile and makes it active.
     *
     * @throws DuplicateProfileException if a profile with the same name exists, ignoring case
     * @throws IllegalArgumentException  if the name is blank
     */
    public Snapshot create(String name) {
        Objects.requireNonNull(name, "name must not be null");
        String trimmed = name.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Profile name must not be blank");
        }
        for (String existing : store.list()) {
            if (existing.equalsIgnoreCase(trimmed)) {
                throw new DuplicateProfileException(existing);
            }
        }
        Snapshot snapshot = controller.saveProfile(trimmed);
        store.setActiveProfileName(trimmed);
        LOG.info("Created profile: name={}, profiles={}", trimmed, store.list().size());
        return snapshot;
    }

    /**
     * Loads profile {@code name} and makes it active. Selecting the active profile again is a no-op.
     *
     * @return true if a profile was loaded
     */
    public boolean select(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.equals(store.activeProfileName())) {
            return false;
        }
        Snapshot snapshot = store.get(name);
        if (snapshot == null) {
            LOG.warn("Profile not found: name={}", name);
            return false;
        }
        controller.loadProfile(snapshot);
        store.setActiveProfileName(name);
        return true;
    }

    /**
     * Saves the current state over the active profile.
     *
     * @return the saved snapshot, or {@code null} when no profile is active
     */
    public Snapshot saveCurrent() {
        String active = store.activeProfileName();
        if (active == null) {
            LOG.warn("No active profile to save");
            return null;
        }
        return controller.saveProfile(active);
    }

    /**
     * Deletes a profile. Deleting the active profile selects the first remaining profile, or clears
     * the active pointer when none remain; the current view is kept either way.
     *
     * @return true if a profile was removed
     */
    public boolean delete(String name) {
        Objects.requireNonNull(name, "name must not be null");
        boolean wasActive = name.equals(store.activeProfileName());
        if (!store.delete(name)) {
            return false;
        }
        if (wasActive) {
            store.setActiveProfileName(null);
            List<String> remaining = store.list();
            if (!remaining.isEmpty()) {
                select(remaining.get(0));
            }
        }
        LOG.info("Deleted profile: name={}, was_active={}", name, wasActive);
        return true;
    }
}

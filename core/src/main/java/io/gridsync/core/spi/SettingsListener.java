package io.gridsync.core.spi;

import io.gridsync.core.model.OptionBag;
import io.gridsync.core.model.ToolbarState;
import java.util.Set;

/**
 * Observer of the settings controller's state changes.
 *
 * <p>
 * All methods default to no-ops so hosts override only what they render. Events are immutable.
 * Exceptions thrown by listeners are caught and logged; they never affect the controller.
 */
public interface SettingsListener {

    /** Canonical options changed after a commit. */
    default void onOptionsChanged(OptionsChangedEvent event) {}

    /** Toolbar settings changed. */
    default void onToolbarChanged(ToolbarState toolbar) {}

    /** A profile was loaded into the controller. */
    default void onProfileLoaded(ProfileLoadedEvent event) {}

    /** The controller's state was saved as a profile. */
    default void onProfileSaved(ProfileSavedEvent event) {}

    /** Event: options changed. */
    record OptionsChangedEvent(Set<String> changedKeys, OptionBag options, boolean dirty) {}

    /** Event: profile loaded. */
    record ProfileLoadedEvent(String profileName, OptionBag options) {}

    /** Event: profile saved. */
    record ProfileSavedEvent(String profileName, Set<String> persistedKeys) {}
}

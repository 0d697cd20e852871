package io.gridsync.core.model;

/**
 * Side bar visibility.
 *
 * @param visible     whether the side bar is shown
 * @param openedPanel id of the open tool panel, or {@code null}
 */
public record SideBarState(boolean visible, String openedPanel) {}

package io.gridsync.core.controller;

/** Handle returned by {@link SettingsController#subscribe}; cancelling stops further callbacks. */
@FunctionalInterface
public interface Subscription {

    void cancel();
}

package io.gridsync.core.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gridsync.core.apply.BatchApplier;
import io.gridsync.core.apply.RefreshPolicy;
import io.gridsync.core.apply.TransientStateReplayer;
import io.gridsync.core.config.SyncConfig;
import io.gridsync.core.extract.StateExtractor;
import io.gridsync.core.model.ApplyResult;
import io.gridsync.core.model.JsonNodes;
import io.gridsync.core.model.OptionBag;
import io.gridsync.core.model.OptionValue;
import io.gridsync.core.model.Snapshot;
import io.gridsync.core.model.SnapshotMetadata;
import io.gridsync.core.model.ToolbarState;
import io.gridsync.core.model.TransientViewState;
import io.gridsync.core.normalize.OptionDelta;
import io.gridsync.core.normalize.OptionNormalizer;
import io.gridsync.core.scheduler.EventLoop;
import io.gridsync.core.scheduler.ScheduledTask;
import io.gridsync.core.schema.CanonicalOption;
import io.gridsync.core.schema.EngineDefaults;
import io.gridsync.core.spi.GridInstance;
import io.gridsync.core.spi.ProfileStore;
import io.gridsync.core.spi.SettingsListener;
import io.gridsync.core.spi.SettingsListener.OptionsChangedEvent;
import io.gridsync.core.spi.SettingsListener.ProfileLoadedEvent;
import io.gridsync.core.spi.SettingsListener.ProfileSavedEvent;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the canonical settings of one grid and keeps the live grid in step with them.
 *
 * <p>
 * Settings edits are recorded into a {@link PendingChangeSet} and committed together on the next
 * tick of the {@link EventLoop}, so a burst of edits from one user action reaches the grid as a
 * single batched apply. Profiles are loaded by replacing the canonical state (engine defaults
 * overlaid by the profile) and replaying the saved view state once the grid has settled.
 *
 * <p>
 * Not thread-safe. Every method must be called on the thread that runs the event loop.
 */
public final class SettingsController {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsController.class);

    private final EventLoop eventLoop;
    private final ProfileStore store;
    private final EngineDefaults defaults;
    private final SyncConfig config;
    private final OptionNormalizer normalizer;
    private final BatchApplier applier;
    private final StateExtractor extractor;
    private final TransientStateReplayer replayer;
    private final LongSupplier clock;
    private final List<SettingsListener> listeners = new CopyOnWriteArrayList<>();
    private final PendingChangeSet pending = new PendingChangeSet();
    private final List<ScheduledTask> replayTasks = new ArrayList<>();

    private ControllerState state = ControllerState.UNINITIALIZED;
    private GridInstance grid;
    private OptionBag canonical;
    private OptionBag savedBaseline;
    private ToolbarState toolbar;
    private ToolbarState savedToolbar;
    private ScheduledTask commitTask;
    private TransientViewState pendingReplay;
    private boolean fullReplay;
    private boolean dirty;
    private String activeProfileName;

    public SettingsController(EventLoop eventLoop, ProfileStore store) {
        this(eventLoop, store, EngineDefaults.load(), SyncConfig.DEFAULT);
    }

    public SettingsController(EventLoop eventLoop, ProfileStore store, EngineDefaults defaults, SyncConfig config) {
        this(eventLoop, store, defaults, config, new BatchApplier(eventLoop), System::currentTimeMillis);
    }

    SettingsController(
            EventLoop eventLoop,
            ProfileStore store,
            EngineDefaults defaults,
            SyncConfig config,
            BatchApplier applier,
            LongSupplier clock) {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.applier = Objects.requireNonNull(applier, "applier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.normalizer = new OptionNormalizer();
        this.extractor = new StateExtractor(defaults);
        this.replayer = new TransientStateReplayer();
        this.canonical = defaults.options();
        this.savedBaseline = canonical;
        this.toolbar = defaults.toolbar();
        this.savedToolbar = toolbar;
    }

    // --- Lifecycle ---

    /**
     * Attaches a grid. The next commit pushes the full canonical state with a forced refresh, and
     * replays any view state from a profile loaded while no grid was live.
     */
    public void bind(GridInstance target) {
        Objects.requireNonNull(target, "grid must not be null");
        if (state.isAttached() && grid == target) {
            scheduleCommit();
            return;
        }
        if (state.isAttached()) {
            cancelReplayTasks();
        }
        grid = target;
        state = ControllerState.BOUND;
        fullReplay = true;
        LOG.info("Bound grid instance: pending_edits={}, replay_pending={}", pending.size(), pendingReplay != null);
        scheduleCommit();
    }

    /** Detaches the grid. Pending edits and outstanding replay tasks are discarded. */
    public void unbind() {
        if (state == ControllerState.UNBOUND) {
            return;
        }
        int discarded = pending.size();
        pending.clear();
        if (commitTask != null) {
            commitTask.cancel();
            commitTask = null;
        }
        cancelReplayTasks();
        grid = null;
        state = ControllerState.UNBOUND;
        LOG.info("Unbound grid instance: discarded_edits={}", discarded);
    }

    // --- Edits ---

    /**
     * Records one settings edit and schedules a commit for the next tick. Edits arriving while no
     * grid is bound are ignored.
     *
     * @param category settings category; {@code "toolbar"} edits the toolbar state, a dialog
     *                 section name nests {@code key} under that section, anything else is taken
     *                 as a top-level option
     * @param key      option or toolbar field name, canonical or legacy
     * @param value    new value
     */
    public void recordEdit(String category, String key, JsonNode value) {
        if (!state.isAttached()) {
            LOG.debug("Edit ignored, no grid bound: category={}, key={}, state={}", category, key, state);
            return;
        }
        pending.record(category, key, value);
        scheduleCommit();
    }

    /**
     * Commits the pending edits: normalizes them, merges structured values onto the current
     * canonical values, and applies the changed keys to the grid in one batch.
     *
     * <p>
     * While unbound this is a no-op. When the bound grid is not live the edits stay pending and
     * are committed on the next bind.
     */
    public ApplyResult commitPending() {
        if (!state.isAttached()) {
            return ApplyResult.empty();
        }
        if (!grid.isAlive()) {
            LOG.info("Grid not live, commit deferred: pending_edits={}", pending.size());
            return ApplyResult.empty();
        }

        PendingChangeSet.Drained drained = pending.drain();
        boolean toolbarChanged = applyToolbarEdits(drained.toolbar());
        Set<String> changed = Set.of();
        if (!drained.options().isEmpty()) {
            OptionBag merged = mergeOnto(canonical, normalizer.normalize(drained.options()).options());
            changed = OptionDelta.between(merged, canonical);
            canonical = merged;
        }

        ApplyResult result;
        if (fullReplay) {
            fullReplay = false;
            result = applier.apply(grid, canonical, RefreshPolicy.FORCED);
        } else if (!changed.isEmpty()) {
            result = applier.apply(grid, canonical.select(changed), RefreshPolicy.INCREMENTAL);
        } else {
            result = ApplyResult.empty();
        }
        state = ControllerState.READY;

        if (pendingReplay != null) {
            scheduleReplay(grid, pendingReplay);
            pendingReplay = null;
        }
        if (!changed.isEmpty() || toolbarChanged) {
            dirty = true;
        }
        if (!changed.isEmpty()) {
            notifyOptionsChanged(changed);
        }
        if (toolbarChanged) {
            notifyToolbarChanged();
        }
        return result;
    }

    /** Puts the canonical options and toolbar back to the engine defaults. */
    public void resetToDefaults() {
        pending.clear();
        cancelReplayTasks();
        pendingReplay = null;
        Set<String> changed = new LinkedHashSet<>(OptionDelta.between(defaults.options(), canonical));
        boolean toolbarChanged = !toolbar.equals(defaults.toolbar());
        canonical = defaults.options();
        toolbar = defaults.toolbar();
        dirty = !OptionDelta.between(canonical, savedBaseline).isEmpty() || !toolbar.equals(savedToolbar);
        fullReplay = true;
        LOG.info("Reset to defaults: changed={}", changed.size());
        if (!changed.isEmpty()) {
            notifyOptionsChanged(changed);
        }
        if (toolbarChanged) {
            notifyToolbarChanged();
        }
        if (state.isAttached()) {
            scheduleCommit();
        }
    }

    // --- Profiles ---

    /**
     * Makes {@code snapshot} the canonical state: engine defaults overlaid by the profile. Edits
     * still pending are superseded. The options are pushed on the next tick with a forced refresh;
     * the saved view state is replayed after the settle delay and explicit column widths are
     * re-asserted after a further delay. Replay tasks of an earlier load are cancelled.
     */
    public void loadProfile(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        int superseded = pending.size();
        pending.clear();
        cancelReplayTasks();

        OptionBag profile = normalizer.normalize(profileOptions(snapshot)).options();
        canonical = mergeOnto(defaults.options(), profile);
        savedBaseline = canonical;
        toolbar = snapshot.toolbarState().withDefaults();
        savedToolbar = toolbar;
        dirty = false;
        activeProfileName = snapshot.name();
        TransientViewState view = snapshot.transientViewState();
        pendingReplay = view.isEmpty() ? null : view;
        fullReplay = true;

        LOG.info(
                "Loaded profile: name={}, options={}, superseded_edits={}",
                snapshot.name(),
                profile.size(),
                superseded);
        notifyProfileLoaded();
        notifyToolbarChanged();
        if (state.isAttached()) {
            scheduleCommit();
        }
    }

    /**
     * Saves the current state as profile {@code name}: the held canonical options plus the view
     * state read from the live grid. The grid is only read.
     *
     * @return the snapshot written to the store
     */
    public Snapshot saveProfile(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Profile name must not be blank");
        }
        long now = clock.getAsLong();
        Snapshot previous = store.get(name);
        SnapshotMetadata metadata = previous != null && previous.metadata() != null
                ? previous.metadata().touchedAt(now)
                : SnapshotMetadata.firstSavedAt(now);
        GridInstance live = state.isAttached() ? grid : null;
        Snapshot snapshot = extractor.snapshot(name, live, canonical, toolbar, metadata);
        store.set(name, snapshot);

        savedBaseline = canonical;
        savedToolbar = toolbar;
        dirty = false;
        activeProfileName = name;
        LOG.info(
                "Saved profile: name={}, view_options={}, init_options={}, freeform_options={}",
                name,
                snapshot.viewConfiguration().size(),
                snapshot.initializationOptions().size(),
                snapshot.freeformExtension().size());
        Set<String> persisted = new LinkedHashSet<>();
        snapshot.viewConfiguration().fieldNames().forEachRemaining(persisted::add);
        notifyProfileSaved(name, persisted);
        return snapshot;
    }

    // --- Queries ---

    /** Keys whose values differ between two canonical bags, compared structurally. */
    public static Set<String> computeDelta(OptionBag current, OptionBag baseline) {
        return OptionDelta.between(current, baseline);
    }

    /** Keys changed since the last load or save. */
    public Set<String> pendingDelta() {
        return OptionDelta.between(canonical, savedBaseline);
    }

    public boolean isDirty() {
        return dirty;
    }

    public OptionBag canonicalOptions() {
        return canonical;
    }

    public ToolbarState toolbarState() {
        return toolbar;
    }

    public ControllerState state() {
        return state;
    }

    /** Name of the profile last loaded or saved, or {@code null}. */
    public String activeProfileName() {
        return activeProfileName;
    }

    public Subscription subscribe(SettingsListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // --- Internals ---

    private void scheduleCommit() {
        if (commitTask != null && !commitTask.isDone()) {
            return;
        }
        commitTask = eventLoop.microtask("commit", () -> state.isAttached(), this::commitPending);
    }

    private void scheduleReplay(GridInstance target, TransientViewState view) {
        BooleanSupplier live = () -> grid == target && target.isAlive();
        replayTasks.add(eventLoop.after(
                config.settleDelay(), "replay-view-state", live, () -> replayer.replay(target, view)));
        replayTasks.add(eventLoop.after(
                config.settleDelay().plus(config.widthReassertDelay()),
                "reassert-widths",
                live,
                () -> replayer.reassertWidths(target, view)));
    }

    private void cancelReplayTasks() {
        int cancelled = 0;
        for (ScheduledTask task : replayTasks) {
            if (!task.isDone()) {
                task.cancel();
                cancelled++;
            }
        }
        replayTasks.clear();
        if (cancelled > 0) {
            LOG.debug("Cancelled replay tasks: count={}", cancelled);
        }
    }

    private boolean applyToolbarEdits(Map<String, JsonNode> edits) {
        ToolbarState updated = toolbar;
        for (Map.Entry<String, JsonNode> edit : edits.entrySet()) {
            updated = updated.with(edit.getKey(), edit.getValue());
        }
        boolean changed = !updated.equals(toolbar);
        toolbar = updated;
        return changed;
    }

    /** Overlays {@code delta} onto {@code base}, merging structured values field by field. */
    private static OptionBag mergeOnto(OptionBag base, OptionBag delta) {
        OptionBag.Builder builder = base.toBuilder();
        delta.forEach((key, value) -> {
            OptionValue merged = switch (value.kind()) {
                case STRUCTURED -> base.get(key) instanceof OptionValue.Structured current
                        ? current.mergedWith(((OptionValue.Structured) value).fields())
                        : value;
                case SCALAR, FUNCTION_REF -> CanonicalOption.DEFAULT_COL_DEF.key().equals(key)
                        ? mergeColumnDefaults(base.get(key), value)
                        : value;
            };
            builder.put(key, merged);
        });
        return builder.build();
    }

    /** Column defaults edited one property at a time keep their other properties. */
    private static OptionValue mergeColumnDefaults(OptionValue current, OptionValue edit) {
        JsonNode base = current == null ? null : current.toJson();
        JsonNode delta = edit.toJson();
        if (base != null && base.isObject() && delta.isObject()) {
            return OptionValue.scalar(JsonNodes.shallowMerge((ObjectNode) base, (ObjectNode) delta));
        }
        return edit;
    }

    /**
     * Raw options of a profile, lowest precedence first. A captured quick filter is what the grid
     * showed when the profile was saved, so it wins over the configured one.
     */
    private static ObjectNode profileOptions(Snapshot snapshot) {
        ObjectNode raw = JsonNodeFactory.instance.objectNode();
        TransientViewState view = snapshot.transientViewState();
        if (view.capturedOptions() != null) {
            raw.setAll(view.capturedOptions());
        }
        raw.setAll(snapshot.freeformExtension());
        raw.setAll(snapshot.initializationOptions());
        raw.setAll(snapshot.viewConfiguration());
        if (view.quickFilterText() != null) {
            raw.put(CanonicalOption.QUICK_FILTER_TEXT.key(), view.quickFilterText());
        }
        return raw;
    }

    private void notifyOptionsChanged(Set<String> changed) {
        OptionsChangedEvent event = new OptionsChangedEvent(changed, canonical, dirty);
        for (SettingsListener listener : listeners) {
            try {
                listener.onOptionsChanged(event);
            } catch (Exception e) {
                LOG.warn("SettingsListener.onOptionsChanged failed", e);
            }
        }
    }

    private void notifyToolbarChanged() {
        for (SettingsListener listener : listeners) {
            try {
                listener.onToolbarChanged(toolbar);
            } catch (Exception e) {
                LOG.warn("SettingsListener.onToolbarChanged failed", e);
            }
        }
    }

    private void notifyProfileLoaded() {
        ProfileLoadedEvent event = new ProfileLoadedEvent(activeProfileName, canonical);
        for (SettingsListener listener : listeners) {
            try {
                listener.onProfileLoaded(event);
            } catch (Exception e) {
                LOG.warn("SettingsListener.onProfileLoaded failed", e);
            }
        }
    }

    private void notifyProfileSaved(String name, Set<String> persisted) {
        ProfileSavedEvent event = new ProfileSavedEvent(name, persisted);
        for (SettingsListener listener : listeners) {
            try {
                listener.onProfileSaved(event);
            } catch (Exception e) {
                LOG.warn("SettingsListener.onProfileSaved failed", e);
            }
        }
    }
}

package io.gridsync.core.store;

import io.gridsync.core.model.Snapshot;
import io.gridsync.core.spi.ProfileStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProfileStore} that keeps profiles in memory as encoded JSON.
 *
 * <p>
 * Profiles go through {@link SnapshotCodec} on the way in and out, exactly as a durable store's
 * would, so what comes back is what a persisted copy would decode to. Listing order is insertion
 * order.
 *
 * <p>
 * Thread-safe: all access is synchronized.
 */
public final class InMemoryProfileStore implements ProfileStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryProfileStore.class);

    private final SnapshotCodec codec;
    private final Map<String, String> profiles = new LinkedHashMap<>();
    private String activeProfileName;

    public InMemoryProfileStore() {
        this(new SnapshotCodec());
    }

    public InMemoryProfileStore(SnapshotCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public synchronized Snapshot get(String name) {
        String json = profiles.get(name);
        if (json == null) {
            return null;
        }
        return codec.read(json, name).snapshot();
    }

    @Override
    public synchronized void set(String name, Snapshot snapshot) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        profiles.put(name, codec.write(snapshot.renamed(name), false));
        LOG.debug("Stored profile: name={}", name);
    }

    @Override
    public synchronized List<String> list() {
        return new ArrayList<>(profiles.keySet());
    }

    @Override
    public synchronized boolean delete(String name) {
        boolean removed = profiles.remove(name) != null;
        if (removed && name.equals(activeProfileName)) {
            activeProfileName = null;
        }
        return removed;
    }

    @Override
    public synchronized String activeProfileName() {
        return activeProfileName;
    }

    @Override
    public synchronized void setActiveProfileName(String name) {
        this.activeProfileName = name;
    }
}

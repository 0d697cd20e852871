package io.gridsync.core.store;

import static org.assertj.core.api.Assertions.assertThat;

import io.gridsync.core.model.Snapshot;
import io.gridsync.core.model.ToolbarState;
import org.junit.jupiter.api.Test;

class InMemoryProfileStoreTest {

    private final InMemoryProfileStore store = new InMemoryProfileStore();

    private static Snapshot named(String name, int fontSize) {
        return new Snapshot(name, new ToolbarState("monospace", fontSize, 6), null, null, null, null, null);
    }

    @Test
    void storedSnapshotTakesTheKeyName() {
        store.set("daily", named("draft", 13));

        Snapshot read = store.get("daily");

        assertThat(read.name()).isEqualTo("daily");
        assertThat(read.toolbarState().fontSize()).isEqualTo(13);
    }

    @Test
    void missingProfileIsNull() {
        assertThat(store.get("absent")).isNull();
    }

    @Test
    void listKeepsInsertionOrderAndOverwriteKeepsPosition() {
        store.set("b", named("b", 12));
        store.set("a", named("a", 12));
        store.set("b", named("b", 16));

        assertThat(store.list()).containsExactly("b", "a");
        assertThat(store.get("b").toolbarState().fontSize()).isEqualTo(16);
    }

    @Test
    void deletingTheActiveProfileClearsThePointer() {
        store.set("a", named("a", 12));
        store.set("b", named("b", 12));
        store.setActiveProfileName("a");

        assertThat(store.delete("b")).isTrue();
        assertThat(store.activeProfileName()).isEqualTo("a");

        assertThat(store.delete("a")).isTrue();
        assertThat(store.activeProfileName()).isNull();
        assertThat(store.delete("a")).isFalse();
    }
}

package io.gridsync.core.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.node.IntNode;
import io.gridsync.core.error.DuplicateProfileException;
import io.gridsync.core.error.ProfileStoreException;
import io.gridsync.core.model.Snapshot;
import io.gridsync.core.scheduler.ManualEventLoop;
import io.gridsync.core.spi.ProfileStore;
import io.gridsync.core.store.InMemoryProfileStore;
import io.gridsync.core.testkit.FakeGridInstance;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class ProfileManagerTest {

    private ManualEventLoop loop;
    private InMemoryProfileStore store;
    private SettingsController controller;
    private ProfileManager profiles;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        store = new InMemoryProfileStore();
        controller = new SettingsController(loop, store);
        profiles = new ProfileManager(controller, store);
        controller.bind(new FakeGridInstance());
        loop.runUntilIdle();
    }

    private void editRowHeight(int height) {
        controller.recordEdit("layout", "rowHeight", IntNode.valueOf(height));
        loop.runUntilIdle();
    }

    private int rowHeight() {
        return controller.canonicalOptions().getJson("rowHeight").asInt();
    }

    @Nested
    class Create {

        @Test
        void createSavesAndActivates() {
            editRowHeight(28);

            Snapshot created = profiles.create("  Compact ");

            assertThat(created.name()).isEqualTo("Compact");
            assertThat(profiles.profiles()).containsExactly("Compact");
            assertThat(profiles.activeProfile()).isEqualTo("Compact");
        }

        @Test
        @DisplayName("names differing only in case are duplicates")
        void duplicateIgnoresCase() {
            profiles.create("Compact");

            assertThatThrownBy(() -> profiles.create("COMPACT"))
                    .isInstanceOf(DuplicateProfileException.class)
                    .satisfies(e -> assertThat(((DuplicateProfileException) e).profileName()).isEqualTo("Compact"));
            assertThat(profiles.profiles()).containsExactly("Compact");
        }

        @Test
        void blankNameIsRejected() {
            assertThatThrownBy(() -> profiles.create("   ")).isInstanceOf(IllegalArgumentException.class);
            assertThat(profiles.profiles()).isEmpty();
        }
    }

    @Nested
    class Select {

        @Test
        void selectLoadsAndActivates() {
            editRowHeight(28);
            profiles.create("compact");
            editRowHeight(40);
            profiles.create("roomy");

            assertThat(profiles.select("compact")).isTrue();
            loop.runUntilIdle();

            assertThat(rowHeight()).isEqualTo(28);
            assertThat(profiles.activeProfile()).isEqualTo("compact");
        }

        @Test
        void selectingTheActiveProfileIsANoOp() {
            profiles.create("compact");
            editRowHeight(40);

            assertThat(profiles.select("compact")).isFalse();
            assertThat(rowHeight()).isEqualTo(40);
        }

        @Test
        void selectingAMissingProfileChangesNothing() {
            profiles.create("compact");

            assertThat(profiles.select("nope")).isFalse();
            assertThat(profiles.activeProfile()).isEqualTo("compact");
        }
    }

    @Nested
    class SaveAndDelete {

        @Test
        void saveCurrentOverwritesTheActiveProfile() {
            profiles.create("compact");
            editRowHeight(26);

            Snapshot saved = profiles.saveCurrent();

            assertThat(saved.viewConfiguration().get("rowHeight").asInt()).isEqualTo(26);
            assertThat(store.get("compact").viewConfiguration().get("rowHeight").asInt()).isEqualTo(26);
        }

        @Test
        void saveCurrentWithoutActiveProfileSavesNothing() {
            assertThat(profiles.saveCurrent()).isNull();
            assertThat(profiles.profiles()).isEmpty();
        }

        @Test
        @DisplayName("deleting the active profile selects the first remaining one")
        void deleteActiveFallsBack() {
            editRowHeight(28);
            profiles.create("compact");
            editRowHeight(40);
            profiles.create("roomy");

            assertThat(profiles.delete("roomy")).isTrue();
            loop.runUntilIdle();

            assertThat(profiles.profiles()).containsExactly("compact");
            assertThat(profiles.activeProfile()).isEqualTo("compact");
            assertThat(rowHeight()).isEqualTo(28);
        }

        @Test
        void deleteLastProfileClearsPointerAndKeepsView() {
            editRowHeight(28);
            profiles.create("compact");

            assertThat(profiles.delete("compact")).isTrue();

            assertThat(profiles.activeProfile()).isNull();
            assertThat(rowHeight()).isEqualTo(28);
        }

        @Test
        void deleteInactiveKeepsActive() {
            profiles.create("compact");
            profiles.create("roomy");

            assertThat(profiles.delete("compact")).isTrue();
            assertThat(profiles.delete("compact")).isFalse();
            assertThat(profiles.activeProfile()).isEqualTo("roomy");
        }
    }

    @Nested
    class Restore {

        @Test
        void restoreLoadsTheActiveProfile() {
            editRowHeight(28);
            profiles.create("compact");

            SettingsController fresh = new SettingsController(loop, store);
            ProfileManager restarted = new ProfileManager(fresh, store);

            assertThat(restarted.restoreActive()).isTrue();
            assertThat(fresh.canonicalOptions().getJson("rowHeight").asInt()).isEqualTo(28);
            assertThat(fresh.activeProfileName()).isEqualTo("compact");
        }

        @Test
        void pointerToMissingProfileIsCleared() {
            store.setActiveProfileName("gone");

            assertThat(profiles.restoreActive()).isFalse();
            assertThat(store.activeProfileName()).isNull();
        }

        @Test
        void nothingToRestore() {
            assertThat(profiles.restoreActive()).isFalse();
        }
    }

    @Nested
    @DisplayName("Store interaction")
    class StoreInteraction {

        private ProfileStore mockStore;
        private ProfileManager managed;

        @BeforeEach
        void setUp() {
            mockStore = mock(ProfileStore.class);
            managed = new ProfileManager(new SettingsController(loop, mockStore), mockStore);
        }

        @Test
        void createWritesTheProfileBeforeActivatingIt() {
            when(mockStore.list()).thenReturn(List.of());

            managed.create("compact");

            InOrder inOrder = inOrder(mockStore);
            inOrder.verify(mockStore).set(eq("compact"), any(Snapshot.class));
            inOrder.verify(mockStore).setActiveProfileName("compact");
        }

        @Test
        void duplicateNeverWrites() {
            when(mockStore.list()).thenReturn(List.of("Compact"));

            assertThatThrownBy(() -> managed.create("compact")).isInstanceOf(DuplicateProfileException.class);

            verify(mockStore, never()).set(anyString(), any());
            verify(mockStore, never()).setActiveProfileName(any());
        }

        @Test
        void storeFailureOnSelectPropagatesAndKeepsPointer() {
            when(mockStore.get("broken")).thenThrow(new ProfileStoreException("Cannot read profile file", "broken"));

            assertThatThrownBy(() -> managed.select("broken"))
                    .isInstanceOf(ProfileStoreException.class)
                    .satisfies(e -> assertThat(((ProfileStoreException) e).profileName()).isEqualTo("broken"));

            verify(mockStore, never()).setActiveProfileName(any());
        }
    }
}

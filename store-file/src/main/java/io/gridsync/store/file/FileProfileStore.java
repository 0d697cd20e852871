package io.gridsync.store.file;

import io.gridsync.core.config.SyncConfig;
import io.gridsync.core.error.ProfileStoreException;
import io.gridsync.core.model.Snapshot;
import io.gridsync.core.spi.ProfileStore;
import io.gridsync.core.store.SnapshotCodec;
import io.gridsync.core.store.SnapshotReadResult;
import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProfileStore} keeping one JSON file per profile in a directory.
 *
 * <p>
 * Profile names are URL-encoded into file names, so any name maps to a safe file name and back.
 * Files are written to a temporary sibling first and moved into place, so a crash never leaves a
 * half-written profile. The active profile name is kept in {@value #ACTIVE_POINTER_FILE}.
 *
 * <p>
 * Thread-safe within one process: all access is synchronized.
 */
public final class FileProfileStore implements ProfileStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileProfileStore.class);

    static final String EXTENSION = ".json";
    static final String ACTIVE_POINTER_FILE = ".active-profile";

    private final Path directory;
    private final boolean prettyPrint;
    private final SnapshotCodec codec;

    public FileProfileStore(Path directory, boolean prettyPrint) {
        this(directory, prettyPrint, new SnapshotCodec());
    }

    public FileProfileStore(Path directory, boolean prettyPrint, SnapshotCodec codec) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.prettyPrint = prettyPrint;
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ProfileStoreException("Cannot create profile directory: " + directory, e, null);
        }
    }

    /** Store rooted at {@link SyncConfig#storeDir()}. */
    public static FileProfileStore fromConfig(SyncConfig config) {
        return new FileProfileStore(Paths.get(config.storeDir()), config.storePrettyPrint());
    }

    public Path directory() {
        return directory;
    }

    @Override
    public synchronized Snapshot get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        Path file = fileFor(name);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProfileStoreException("Cannot read profile file: " + file, e, name);
        }
        SnapshotReadResult result = codec.read(json, file.toString());
        if (!result.isClean()) {
            LOG.warn("Profile read with defaults filled in: name={}, warnings={}", name, result.warnings().size());
        }
        return result.snapshot().renamed(name);
    }

    @Override
    public synchronized void set(String name, Snapshot snapshot) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        writeAtomically(fileFor(name), codec.write(snapshot.renamed(name), prettyPrint), name);
        LOG.info("Stored profile: name={}, file={}", name, fileFor(name).getFileName());
    }

    @Override
    public synchronized List<String> list() {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry)) {
                    names.add(nameOf(entry));
                }
            }
        } catch (IOException e) {
            throw new ProfileStoreException("Cannot list profile directory: " + directory, e, null);
        }
        Collections.sort(names);
        return names;
    }

    @Override
    public synchronized boolean delete(String name) {
        Objects.requireNonNull(name, "name must not be null");
        boolean removed;
        try {
            removed = Files.deleteIfExists(fileFor(name));
        } catch (IOException e) {
            throw new ProfileStoreException("Cannot delete profile file: " + fileFor(name), e, name);
        }
        if (removed) {
            if (name.equals(activeProfileName())) {
                setActiveProfileName(null);
            }
            LOG.info("Deleted profile: name={}", name);
        }
        return removed;
    }

    @Override
    public synchronized String activeProfileName() {
        Path pointer = directory.resolve(ACTIVE_POINTER_FILE);
        if (!Files.isRegularFile(pointer)) {
            return null;
        }
        try {
            String name = Files.readString(pointer, StandardCharsets.UTF_8).strip();
            return name.isEmpty() ? null : name;
        } catch (IOException e) {
            throw new ProfileStoreException("Cannot read active profile pointer: " + pointer, e, null);
        }
    }

    @Override
    public synchronized void setActiveProfileName(String name) {
        Path pointer = directory.resolve(ACTIVE_POINTER_FILE);
        if (name == null) {
            try {
                Files.deleteIfExists(pointer);
            } catch (IOException e) {
                throw new ProfileStoreException("Cannot clear active profile pointer: " + pointer, e, null);
            }
            return;
        }
        writeAtomically(pointer, name, name);
    }

    Path fileFor(String name) {
        return directory.resolve(URLEncoder.encode(name, StandardCharsets.UTF_8) + EXTENSION);
    }

    private static String nameOf(Path file) {
        String fileName = file.getFileName().toString();
        return URLDecoder.decode(fileName.substring(0, fileName.length() - EXTENSION.length()), StandardCharsets.UTF_8);
    }

    private void writeAtomically(Path target, String content, String profileName) {
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, ".tmp-", ".part");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move not supported, falling back to plain replace: target={}", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new ProfileStoreException("Cannot write file: " + target, e, profileName);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Failed to remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}

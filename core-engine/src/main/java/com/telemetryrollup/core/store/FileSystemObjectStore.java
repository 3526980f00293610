package com.telemetryrollup.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * {@link ObjectStore} backed by a local directory.
 *
 * <p>
 * A key {@code a/b/c.json} maps to the file {@code <root>/a/b/c.json}. Writes
 * go to a temporary sibling file that is then moved into place, so a reader
 * never observes a half-written object.
 * </p>
 *
 * @since 1.0.0
 */
public class FileSystemObjectStore implements ObjectStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemObjectStore.class);

    private final Path root;

    /**
     * @param root directory holding the objects; created on first write
     */
    public FileSystemObjectStore(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    }

    @Override
    public List<String> list(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        Path start = resolveDirectoryFor(prefix);
        if (!Files.isDirectory(start)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(start)) {
            return files.filter(Files::isRegularFile)
                    .map(this::toKey)
                    .filter(key -> key.startsWith(prefix))
                    .filter(key -> !key.endsWith(".tmp"))
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new ObjectStoreException("Failed to list prefix " + prefix, prefix, e);
        }
    }

    @Override
    public byte[] get(String key) {
        Path file = resolve(key);
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new ObjectStoreException("Object not found: " + key, key, e);
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to read object " + key, key, e);
        }
    }

    @Override
    public void put(String key, byte[] body, String contentType) {
        Objects.requireNonNull(body, "body must not be null");
        Path file = resolve(key);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.write(tmp, body);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Wrote {} byte(s) to {} ({})", body.length, file, contentType);
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to write object " + key, key, e);
        }
    }

    public Path getRoot() {
        return root;
    }

    private Path resolve(String key) {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isBlank() || key.endsWith("/")) {
            throw new ObjectStoreException("Invalid object key: '" + key + "'", key);
        }
        Path file = root.resolve(key).normalize();
        if (!file.startsWith(root)) {
            throw new ObjectStoreException("Key escapes store root: " + key, key);
        }
        return file;
    }

    private Path resolveDirectoryFor(String prefix) {
        int slash = prefix.lastIndexOf('/');
        Path dir = slash < 0 ? root : root.resolve(prefix.substring(0, slash)).normalize();
        if (!dir.startsWith(root)) {
            throw new ObjectStoreException("Prefix escapes store root: " + prefix, prefix);
        }
        return dir;
    }

    private String toKey(Path file) {
        return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }
}

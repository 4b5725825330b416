package com.lorastudio.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A JSON document shared by every process that points at the same path.
 *
 * <p>Each access holds an exclusive lock on a sibling {@code .lock} file and re-reads the document, so a
 * read-modify-write never works from a stale copy. Writes go to a temp file that is moved into place.
 */
public final class JsonFileStore<T> {
    // FileChannel locks are held per JVM, so threads of one process queue on a monitor first
    private static final Map<Path, Object> PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final Path path;
    private final Path lockPath;
    private final TypeReference<T> type;
    private final Supplier<T> empty;
    private final ObjectMapper objectMapper;

    public JsonFileStore(Path path, TypeReference<T> type, Supplier<T> empty, ObjectMapper objectMapper) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        this.lockPath = this.path.resolveSibling(this.path.getFileName() + ".lock");
        this.type = Objects.requireNonNull(type, "type");
        this.empty = Objects.requireNonNull(empty, "empty");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public Path path() {
        return path;
    }

    public T read() {
        return locked(this::load);
    }

    public T update(UnaryOperator<T> change) {
        return locked(() -> {
            T before = load();
            T after = Objects.requireNonNull(change.apply(before), "updated document");
            if (after != before) {
                store(after);
            }
            return after;
        });
    }

    /** Runs {@code action} while holding the lock. Calls must not nest. */
    public <R> R locked(LockedAction<R> action) {
        Object processLock = PROCESS_LOCKS.computeIfAbsent(path, key -> new Object());
        synchronized (processLock) {
            try {
                createParent(lockPath);
                try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                        FileLock ignored = channel.lock()) {
                    return action.run();
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to access " + path, e);
            }
        }
    }

    public T load() throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0) {
            return empty.get();
        }
        return objectMapper.readValue(path.toFile(), type);
    }

    public void store(T value) throws IOException {
        createParent(path);
        Path temp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void createParent(Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
    }

    @FunctionalInterface
    public interface LockedAction<R> {
        R run() throws IOException;
    }
}

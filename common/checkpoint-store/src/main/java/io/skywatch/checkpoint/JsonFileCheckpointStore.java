package io.skywatch.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-backed {@link CheckpointStore}.
 * <p>
 * Each save writes the JSON document to a sibling temp file, forces it to disk and renames it
 * over the checkpoint, so the file always holds either the old or the new value.
 */
public final class JsonFileCheckpointStore<T> implements CheckpointStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileCheckpointStore.class);

    private final ObjectMapper mapper;
    private final Path file;
    private final Class<T> type;
    private final Lock lock = new ReentrantLock();

    public JsonFileCheckpointStore(ObjectMapper mapper, Path file, Class<T> type) {
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
        this.type = Objects.requireNonNull(type, "type");
        Path parent = this.file.getParent();
        if (parent == null) {
            throw new IllegalArgumentException("Checkpoint file must have a parent directory: " + file);
        }
    }

    public Path file() {
        return file;
    }

    @Override
    public Optional<T> load() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                log.info("No checkpoint at {}; starting fresh", file);
                return Optional.empty();
            }
            T value = mapper.readValue(file.toFile(), type);
            log.info("Loaded checkpoint from {}", file);
            return Optional.ofNullable(value);
        } catch (IOException e) {
            throw new CheckpointException("Unable to read checkpoint " + file + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void save(T value) {
        Objects.requireNonNull(value, "value");
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new CheckpointException("Unable to serialise checkpoint: " + e.getMessage(), e);
        }
        lock.lock();
        Path temp = null;
        try {
            Files.createDirectories(file.getParent());
            temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(json);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            move(temp, file);
            temp = null;
            log.debug("Checkpoint written to {}", file);
        } catch (IOException e) {
            throw new CheckpointException("Unable to write checkpoint " + file + ": " + e.getMessage(), e);
        } finally {
            deleteTemp(temp);
            lock.unlock();
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}; falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Unable to delete temporary checkpoint {}: {}", temp, e.getMessage());
        }
    }
}

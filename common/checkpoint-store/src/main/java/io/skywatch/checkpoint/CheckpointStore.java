package io.skywatch.checkpoint;

import java.util.Optional;

/**
 * Durable single-value store for restart state. {@link #save} replaces the previous value as a
 * whole; a reader never observes a partially written checkpoint.
 */
public interface CheckpointStore<T> {

    /**
     * @return the last saved value, or empty when nothing was saved yet
     * @throws CheckpointException when a checkpoint exists but cannot be read
     */
    Optional<T> load();

    /**
     * @throws CheckpointException when the value cannot be made durable
     */
    void save(T value);
}

package io.skywatch.checkpoint;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local {@link CheckpointStore} for tests and dry runs. Writes can be made to fail to
 * exercise runtime checkpoint errors.
 */
public final class InMemoryCheckpointStore<T> implements CheckpointStore<T> {

    private final AtomicReference<T> value = new AtomicReference<>();
    private final AtomicBoolean failing = new AtomicBoolean();
    private final AtomicInteger saves = new AtomicInteger();

    public InMemoryCheckpointStore() {
    }

    public InMemoryCheckpointStore(T initial) {
        value.set(initial);
    }

    @Override
    public Optional<T> load() {
        return Optional.ofNullable(value.get());
    }

    @Override
    public void save(T next) {
        Objects.requireNonNull(next, "value");
        if (failing.get()) {
            throw new CheckpointException("in-memory checkpoint store is failing");
        }
        value.set(next);
        saves.incrementAndGet();
    }

    public void setFailing(boolean failing) {
        this.failing.set(failing);
    }

    public int saveCount() {
        return saves.get();
    }
}

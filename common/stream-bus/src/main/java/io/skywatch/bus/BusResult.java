package io.skywatch.bus;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a {@link StreamBus} call: either a value or a {@link BusError}, never both.
 */
public final class BusResult<T> {

    private final T value;
    private final BusError error;

    private BusResult(T value, BusError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> BusResult<T> ok(T value) {
        return new BusResult<>(value, null);
    }

    public static <T> BusResult<T> failed(BusError error) {
        return new BusResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value for failed result: " + error.describe());
        }
        return value;
    }

    public BusError error() {
        if (error == null) {
            throw new IllegalStateException("Result succeeded");
        }
        return error;
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    public T orElseThrow() {
        if (error != null) {
            throw new BusUnavailableException(error);
        }
        return value;
    }

    public <R> BusResult<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return error == null ? ok(mapper.apply(value)) : failed(error);
    }

    public BusResult<T> onFailure(Consumer<BusError> action) {
        if (error != null) {
            action.accept(error);
        }
        return this;
    }

    @Override
    public String toString() {
        return error == null ? "BusResult[ok=" + value + "]" : "BusResult[error=" + error.describe() + "]";
    }
}

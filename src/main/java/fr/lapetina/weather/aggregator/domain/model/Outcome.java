package fr.lapetina.weather.aggregator.domain.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a single fetch step: either a value or a {@link SourceError}.
 * Immutable and thread-safe when the carried value is.
 *
 * @param <T> value type
 */
public final class Outcome<T> {

    private final T value;
    private final SourceError error;

    private Outcome(T value, SourceError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "Value is required"), null);
    }

    public static <T> Outcome<T> failure(SourceError error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "Error is required"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Returns the value.
     *
     * @throws IllegalStateException if this outcome is a failure
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value present: " + error.message());
        }
        return value;
    }

    /**
     * Returns the error, or null on success.
     */
    public SourceError error() {
        return error;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        if (error != null) {
            return failure(error);
        }
        return mapper.apply(value);
    }

    /**
     * Replaces the error with another one, leaving successes untouched.
     */
    public Outcome<T> mapError(Function<SourceError, SourceError> mapper) {
        if (error == null) {
            return this;
        }
        return failure(mapper.apply(error));
    }

    public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<SourceError, ? extends R> onFailure) {
        return error == null ? onSuccess.apply(value) : onFailure.apply(error);
    }

    @Override
    public String toString() {
        return error == null ? "Outcome[success=" + value + "]" : "Outcome[failure=" + error.message() + "]";
    }
}

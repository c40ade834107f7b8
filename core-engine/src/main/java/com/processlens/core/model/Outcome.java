package com.processlens.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Per-item result carrying either a success value or an {@link AnalysisError}.
 *
 * <p>
 * Batch drivers collect outcomes instead of relying on caught exceptions for
 * expected failure modes, so a failure in one item never blocks the others.
 * </p>
 *
 * @param <T> type of the success value
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Outcome<T> {

    private final T value;
    private final AnalysisError error;

    private Outcome(T value, AnalysisError error) {
        this.value = value;
        this.error = error;
    }

    /**
     * @param value success value; must not be {@code null}
     * @param <T>   value type
     * @return a successful outcome
     */
    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value must not be null"), null);
    }

    /**
     * @param error failure description; must not be {@code null}
     * @param <T>   value type
     * @return a failed outcome
     */
    public static <T> Outcome<T> failure(AnalysisError error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public static <T> Outcome<T> failure(ErrorKind kind, String subject, String message) {
        return failure(new AnalysisError(kind, subject, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the success value, or {@code null} for a failed outcome
     */
    public T getValue() {
        return value;
    }

    /**
     * @return the error, or {@code null} for a successful outcome
     */
    public AnalysisError getError() {
        return error;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * Transform the success value, passing failures through unchanged.
     *
     * @param mapper transformation; must not return {@code null}
     * @param <R>    result type
     * @return mapped outcome
     */
    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    /**
     * @return the success value
     * @throws IllegalStateException if this outcome is a failure
     */
    public T orElseThrow() {
        if (!isSuccess()) {
            throw new IllegalStateException(error.describe());
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Outcome<?> that))
            return false;
        return Objects.equals(value, that.value) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome{success=" + value + '}' : "Outcome{failure=" + error + '}';
    }
}

package com.sortableid.domain.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an operation that either produced a value or failed with an expected error.
 * Configuration problems, exhausted capacity and malformed IDs travel as {@link Failure}s;
 * exceptions are kept for programming errors.
 *
 * @param <T> the type of the success value
 * @param <E> the type of the error
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    record Success<T, E>(T value) implements Result<T, E> {
    }

    record Failure<T, E>(E error) implements Result<T, E> {
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }
    }

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    default T getOrThrow() {
        return orElseThrow(error -> new IllegalStateException("Cannot get value from Failure: " + error));
    }

    default <X extends RuntimeException> T orElseThrow(Function<? super E, X> exceptionMapper) {
        if (this instanceof Success<T, E> success) {
            return success.value();
        }
        throw exceptionMapper.apply(errorOrNull());
    }

    default E errorOrNull() {
        return this instanceof Failure<T, E> failure ? failure.error() : null;
    }

    default <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T, E> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return new Failure<>(errorOrNull());
    }

    default <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
        if (this instanceof Success<T, E> success) {
            return mapper.apply(success.value());
        }
        return new Failure<>(errorOrNull());
    }

    default <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
        if (this instanceof Success<T, E> success) {
            return onSuccess.apply(success.value());
        }
        return onFailure.apply(errorOrNull());
    }
}

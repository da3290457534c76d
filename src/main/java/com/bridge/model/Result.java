package com.bridge.model;

import com.bridge.model.error.CapabilityError;
import java.util.Objects;
import java.util.function.Function;

/**
 * Success-or-failure value returned by every public operation of the bridge.
 *
 * @param <T> The success value type.
 * @param <E> The error type.
 */
public sealed interface Result<T, E extends CapabilityError> permits Result.Success, Result.Failure {

    static <T, E extends CapabilityError> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E extends CapabilityError> Result<T, E> failure(E error) {
        return new Failure<>(Objects.requireNonNull(error, "error"));
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * @return the success value.
     * @throws IllegalStateException if this is a failure.
     */
    T value();

    /**
     * @return the error.
     * @throws IllegalStateException if this is a success.
     */
    E error();

    default <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T, E> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return new Failure<>(error());
    }

    default <F extends CapabilityError> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
        if (this instanceof Failure<T, E> failure) {
            return new Failure<>(mapper.apply(failure.error()));
        }
        return new Success<>(value());
    }

    default <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
        if (this instanceof Success<T, E> success) {
            return mapper.apply(success.value());
        }
        return new Failure<>(error());
    }

    default <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
        return isSuccess() ? onSuccess.apply(value()) : onFailure.apply(error());
    }

    record Success<T, E extends CapabilityError>(T value) implements Result<T, E> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public E error() {
            throw new IllegalStateException("Result is a success: " + value);
        }
    }

    record Failure<T, E extends CapabilityError>(E error) implements Result<T, E> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Result is a failure: " + error.message());
        }
    }
}

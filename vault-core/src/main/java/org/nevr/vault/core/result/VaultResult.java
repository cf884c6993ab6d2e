package org.nevr.vault.core.result;

import org.nevr.vault.core.exception.VaultException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Tagged result of a public vault operation: either {@link Ok} or {@link Err}.
 * Callers match with {@code instanceof VaultResult.Err<T> err} instead of catching.
 *
 * @param <T> the success value type
 */
public interface VaultResult<T> {

    static <T> VaultResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> VaultResult<T> err(VaultError error) {
        return new Err<>(error);
    }

    static <T> VaultResult<T> err(VaultErrorKind kind, String message) {
        return new Err<>(new VaultError(kind, message));
    }

    static <T> VaultResult<T> fromException(VaultException e) {
        return new Err<>(e.toError());
    }

    boolean isOk();

    /**
     * @return the value of an {@link Ok}
     * @throws VaultException carrying the error of an {@link Err}
     */
    T orElseThrow();

    <U> VaultResult<U> map(Function<? super T, ? extends U> mapper);

    <U> VaultResult<U> flatMap(Function<? super T, VaultResult<U>> mapper);

    record Ok<T>(T value) implements VaultResult<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public T orElseThrow() {
            return value;
        }

        @Override
        public <U> VaultResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> VaultResult<U> flatMap(Function<? super T, VaultResult<U>> mapper) {
            return mapper.apply(value);
        }
    }

    record Err<T>(VaultError error) implements VaultResult<T> {

        public Err {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T orElseThrow() {
            throw VaultException.of(error);
        }

        @Override
        public <U> VaultResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Err<>(error);
        }

        @Override
        public <U> VaultResult<U> flatMap(Function<? super T, VaultResult<U>> mapper) {
            return new Err<>(error);
        }
    }
}

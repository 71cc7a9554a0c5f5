package com.cistrade.domain.common;

import java.util.function.Function;

/**
 * Result of a database operation at the repository boundary.
 * Either carries a value, or an {@link ErrorKind} with a message; never both.
 */
public record DbResult<T>(
    T value,
    ErrorKind error,
    String message
) {
    /**
     * Create a successful result.
     */
    public static <T> DbResult<T> ok(T value) {
        return new DbResult<>(value, null, null);
    }

    /**
     * Create a successful result with no payload.
     */
    public static DbResult<Void> done() {
        return new DbResult<>(null, null, null);
    }

    /**
     * Create a failed result.
     */
    public static <T> DbResult<T> fail(ErrorKind error, String message) {
        if (error == null) {
            throw new IllegalArgumentException("error kind is required for a failed result");
        }
        return new DbResult<>(null, error, message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }

    /**
     * Transform the value of a successful result; failures pass through untouched.
     */
    public <R> DbResult<R> map(Function<? super T, ? extends R> fn) {
        if (!isSuccess()) {
            return new DbResult<>(null, error, message);
        }
        return new DbResult<>(fn.apply(value), null, null);
    }

    /**
     * Drop the payload, keeping only success or failure.
     */
    public DbResult<Void> discardValue() {
        return isSuccess() ? done() : new DbResult<>(null, error, message);
    }
}

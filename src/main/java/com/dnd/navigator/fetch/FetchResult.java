package com.dnd.navigator.fetch;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a fetch: either a value or a {@link FetchError}, never both.
 *
 * @param value     the fetched value, null on failure
 * @param error     the failure, null on success
 * @param fromCache whether the value was served from the cache
 * @param <T>       value type
 */
public record FetchResult<T>(T value, FetchError error, boolean fromCache) {

    public FetchResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value or error must be set");
        }
    }

    public static <T> FetchResult<T> fetched(T value) {
        return new FetchResult<>(Objects.requireNonNull(value), null, false);
    }

    public static <T> FetchResult<T> cached(T value) {
        return new FetchResult<>(Objects.requireNonNull(value), null, true);
    }

    public static <T> FetchResult<T> failure(FetchError.Kind kind, String message) {
        return new FetchResult<>(null, new FetchError(kind, message), false);
    }

    public static <T> FetchResult<T> invalidInput(String message) {
        return failure(FetchError.Kind.INVALID_INPUT, message);
    }

    public static <T> FetchResult<T> notFound(String message) {
        return failure(FetchError.Kind.NOT_FOUND, message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * Maps the value, carrying a failure through unchanged.
     */
    public <R> FetchResult<R> map(Function<T, R> mapper) {
        if (!isSuccess()) {
            return new FetchResult<>(null, error, false);
        }
        return new FetchResult<>(mapper.apply(value), null, fromCache);
    }
}

package com.dnd.navigator.fetch;

import java.util.Objects;

/**
 * Structured failure of a fetch operation.
 *
 * @param kind    failure class
 * @param message human readable explanation
 */
public record FetchError(Kind kind, String message) {

    public enum Kind {
        /** The caller supplied an unknown category, an ill-formed index or a blank query. */
        INVALID_INPUT,
        /** The upstream answered with a non-success status. */
        NOT_FOUND,
        /** The upstream could not be reached or timed out. */
        UNAVAILABLE,
        /** The upstream answered with a body that is not the expected JSON. */
        MALFORMED
    }

    public FetchError {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(message, "message is required");
    }
}

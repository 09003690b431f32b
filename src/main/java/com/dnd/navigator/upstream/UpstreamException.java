package com.dnd.navigator.upstream;

/**
 * Runtime exception thrown when the upstream API cannot be reached or does not answer
 * within the request timeout.
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}

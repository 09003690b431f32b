package com.dnd.navigator.upstream;

/**
 * Read-only client for the upstream reference API.
 *
 * <p>Paths are resolved against the API base URL, so {@code "spells"} and
 * {@code "spells/fireball"} address the listing and detail endpoints, while an absolute path or
 * URL taken from a {@code Location} header is followed as given.</p>
 */
public interface ReferenceApiClient {

    /**
     * Issues a GET request. Redirects are returned to the caller, not followed.
     *
     * @param path path relative to the base URL, an absolute path, or an absolute URL
     * @return the response, whatever its status
     * @throws UpstreamException on timeout, connection failure or interruption
     */
    ApiResponse get(String path);

    /**
     * Returns the base URL requests are resolved against.
     */
    String getBaseUrl();
}

package com.dnd.navigator.upstream;

import java.util.Optional;

/**
 * Raw upstream response.
 *
 * @param statusCode HTTP status code
 * @param body       response body, empty string when none
 * @param location   the {@code Location} header, or null
 */
public record ApiResponse(int statusCode, String body, String location) {

    public ApiResponse {
        body = body != null ? body : "";
    }

    public static ApiResponse ok(String body) {
        return new ApiResponse(200, body, null);
    }

    public static ApiResponse status(int statusCode) {
        return new ApiResponse(statusCode, "", null);
    }

    public static ApiResponse redirect(int statusCode, String location) {
        return new ApiResponse(statusCode, "", location);
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * True for a redirect status that carries a target.
     */
    public boolean isRedirect() {
        return (statusCode == 301 || statusCode == 302 || statusCode == 303
                || statusCode == 307 || statusCode == 308)
                && location != null && !location.isBlank();
    }

    public Optional<String> locationHeader() {
        return Optional.ofNullable(location);
    }
}

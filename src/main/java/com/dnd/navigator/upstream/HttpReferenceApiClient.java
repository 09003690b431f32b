package com.dnd.navigator.upstream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * {@link ReferenceApiClient} backed by the JDK HTTP client.
 *
 * <p>Every request carries the configured timeout. Redirects are never followed here so the
 * caller can bound the number of hops.</p>
 *
 * Usage:
 * <pre>
 * ReferenceApiClient client = HttpReferenceApiClient.builder()
 *     .baseUrl("https://www.dnd5eapi.co/api/")
 *     .timeout(Duration.ofSeconds(10))
 *     .build();
 * </pre>
 */
public class HttpReferenceApiClient implements ReferenceApiClient {
    private static final Logger log = LoggerFactory.getLogger(HttpReferenceApiClient.class);

    public static final String DEFAULT_BASE_URL = "https://www.dnd5eapi.co/api/";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final URI baseUri;
    private final Duration timeout;
    private final HttpClient httpClient;

    private HttpReferenceApiClient(Builder builder) {
        String baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUri = URI.create(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public ApiResponse get(String path) {
        URI uri;
        HttpRequest request;
        try {
            uri = resolve(path);
            request = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            // illegal character or non-HTTP scheme, usually from a redirect Location
            throw new UpstreamException("Invalid request target '" + path + "': " + e.getMessage(), e);
        }

        log.debug("GET {}", uri);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            String location = response.headers().firstValue("Location").orElse(null);
            log.debug("GET {} -> {}", uri, response.statusCode());
            return new ApiResponse(response.statusCode(), response.body(), location);
        } catch (HttpTimeoutException e) {
            throw new UpstreamException("Request to " + uri + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new UpstreamException("Request to " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("Request to " + uri + " was interrupted", e);
        }
    }

    @Override
    public String getBaseUrl() {
        return baseUri.toString();
    }

    public Duration getTimeout() {
        return timeout;
    }

    URI resolve(String path) {
        if (path == null || path.isEmpty()) {
            return baseUri;
        }
        return baseUri.resolve(path);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a client for the public D&D 5e API with the default timeout.
     */
    public static HttpReferenceApiClient createDefault() {
        return builder().build();
    }

    public static class Builder {
        private String baseUrl;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpReferenceApiClient build() {
            return new HttpReferenceApiClient(this);
        }
    }
}

package com.dnd.navigator.upstream;

import com.dnd.navigator.cache.CacheConfig;
import com.dnd.navigator.cache.TieredCacheStore;
import com.dnd.navigator.fetch.FetchError;
import com.dnd.navigator.fetch.ItemFetcher;
import com.dnd.navigator.search.RelevanceSearchEngine;
import com.dnd.navigator.search.SearchResult;
import com.dnd.navigator.testing.MutableClock;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class HttpReferenceApiClientTest {

    private HttpServer server;
    private ExecutorService executor;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.createContext("/api/spells/fireball", exchange ->
                send(exchange, 200, "{\"index\":\"fireball\",\"name\":\"Fireball\"}"));
        server.createContext("/api/spells/missing", exchange -> send(exchange, 404, "{\"error\":\"Not found\"}"));
        server.createContext("/api/spells/old-fireball", exchange -> {
            exchange.getResponseHeaders().set("Location", "/api/spells/fireball");
            exchange.sendResponseHeaders(301, -1);
            exchange.close();
        });
        server.createContext("/api/spells/ftp-redirect", exchange -> {
            exchange.getResponseHeaders().set("Location", "ftp://example.com/api/spells/fireball");
            exchange.sendResponseHeaders(301, -1);
            exchange.close();
        });
        server.createContext("/api/spells/bad-redirect", exchange -> {
            exchange.getResponseHeaders().set("Location", "/api/spells/fire ball");
            exchange.sendResponseHeaders(301, -1);
            exchange.close();
        });
        server.createContext("/api/spells", exchange -> {
            if ("/api/spells".equals(exchange.getRequestURI().getPath())) {
                send(exchange, 200, "{\"count\":1,\"results\":[{\"index\":\"ftp-redirect\","
                        + "\"name\":\"Ftp Redirect\",\"url\":\"/api/spells/ftp-redirect\"}]}");
            } else {
                send(exchange, 404, "");
            }
        });
        server.createContext("/api/spells/slow", exchange -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            send(exchange, 200, "{}");
        });
        server.createContext("/api/", exchange -> {
            if ("/api/".equals(exchange.getRequestURI().getPath())) {
                send(exchange, 200, "{\"spells\":\"/api/spells\",\"monsters\":\"/api/monsters\"}");
            } else {
                send(exchange, 404, "");
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/api";
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        executor.shutdownNow();
    }

    private static void send(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    private HttpReferenceApiClient client(Duration timeout) {
        return HttpReferenceApiClient.builder().baseUrl(baseUrl).timeout(timeout).build();
    }

    @Nested
    @DisplayName("Responses")
    class ResponseTests {

        @Test
        @DisplayName("Should return body and status of a successful request")
        void testOk() {
            ApiResponse response = client(Duration.ofSeconds(5)).get("spells/fireball");
            assertTrue(response.isSuccess());
            assertTrue(response.body().contains("Fireball"));
        }

        @Test
        @DisplayName("Should return non-success statuses without throwing")
        void testNotFound() {
            ApiResponse response = client(Duration.ofSeconds(5)).get("spells/missing");
            assertEquals(404, response.statusCode());
            assertFalse(response.isSuccess());
        }

        @Test
        @DisplayName("Should surface redirects with their location instead of following them")
        void testRedirectNotFollowed() {
            ApiResponse response = client(Duration.ofSeconds(5)).get("spells/old-fireball");
            assertEquals(301, response.statusCode());
            assertTrue(response.isRedirect());
            assertEquals("/api/spells/fireball", response.location());
        }

        @Test
        @DisplayName("Should resolve an absolute redirect path against the host")
        void testAbsolutePath() {
            ApiResponse response = client(Duration.ofSeconds(5)).get("/api/spells/fireball");
            assertTrue(response.isSuccess());
        }

        @Test
        @DisplayName("Should request the API root for an empty path")
        void testRoot() {
            ApiResponse response = client(Duration.ofSeconds(5)).get("");
            assertTrue(response.isSuccess());
            assertTrue(response.body().contains("monsters"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should throw UpstreamException on timeout")
        void testTimeout() {
            HttpReferenceApiClient client = client(Duration.ofMillis(300));
            UpstreamException e = assertThrows(UpstreamException.class, () -> client.get("spells/slow"));
            assertTrue(e.getMessage().contains("timed out"));
        }

        @Test
        @DisplayName("Should throw UpstreamException when the host is unreachable")
        void testUnreachable() throws IOException {
            int port;
            try (ServerSocket socket = new ServerSocket(0)) {
                port = socket.getLocalPort();
            }
            HttpReferenceApiClient client = HttpReferenceApiClient.builder()
                    .baseUrl("http://127.0.0.1:" + port + "/api/")
                    .timeout(Duration.ofSeconds(2))
                    .build();
            assertThrows(UpstreamException.class, () -> client.get("spells"));
        }

        @Test
        @DisplayName("Should throw UpstreamException for a redirect location it cannot request")
        void testUnusableLocation() {
            HttpReferenceApiClient client = client(Duration.ofSeconds(5));

            String ftp = client.get("spells/ftp-redirect").location();
            String spaced = client.get("spells/bad-redirect").location();

            assertThrows(UpstreamException.class, () -> client.get(ftp));
            assertThrows(UpstreamException.class, () -> client.get(spaced));
        }

        @Test
        @DisplayName("Should report an item behind an unusable redirect as unavailable")
        void testFetchThroughUnusableRedirect() {
            ItemFetcher fetcher = new ItemFetcher(
                    new TieredCacheStore(CacheConfig.inMemory(24), MutableClock.fixed()), client(Duration.ofSeconds(5)));

            assertEquals(FetchError.Kind.UNAVAILABLE, fetcher.fetchItem("spells", "ftp-redirect").error().kind());
            assertEquals(FetchError.Kind.UNAVAILABLE, fetcher.fetchItem("spells", "bad-redirect").error().kind());
        }

        @Test
        @DisplayName("Should skip a category whose item redirects somewhere unusable during search")
        void testSearchThroughUnusableRedirect() {
            ItemFetcher fetcher = new ItemFetcher(
                    new TieredCacheStore(CacheConfig.inMemory(24), MutableClock.fixed()), client(Duration.ofSeconds(5)));
            RelevanceSearchEngine engine = new RelevanceSearchEngine(fetcher, List.of("spells"));

            SearchResult result = engine.search("redirect");

            assertTrue(result.isSuccess());
            assertEquals(List.of("spells"), result.failedCategories());
            assertEquals(0, result.totalCount());
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("Should default to the public API and a ten second timeout")
        void testDefaults() {
            HttpReferenceApiClient client = HttpReferenceApiClient.createDefault();
            assertEquals("https://www.dnd5eapi.co/api/", client.getBaseUrl());
            assertEquals(Duration.ofSeconds(10), client.getTimeout());
        }

        @Test
        @DisplayName("Should treat the base URL as a directory")
        void testTrailingSlash() {
            HttpReferenceApiClient client = HttpReferenceApiClient.builder()
                    .baseUrl("https://example.test/api")
                    .build();
            assertEquals("https://example.test/api/spells/fireball", client.resolve("spells/fireball").toString());
        }
    }
}

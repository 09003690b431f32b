package com.dnd.navigator.health;

import com.dnd.navigator.cache.CacheConfig;
import com.dnd.navigator.cache.TieredCacheStore;
import com.dnd.navigator.testing.FakeReferenceApiClient;
import com.dnd.navigator.upstream.ApiResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("online() should name the component and carry no details")
        void onlineFactory() {
            HealthStatus status = HealthStatus.online("cache", "in-memory");
            assertTrue(status.isOnline());
            assertEquals("cache", status.component());
            assertEquals("in-memory", status.message());
            assertTrue(status.details().isEmpty());
        }

        @Test
        @DisplayName("withDetail() should add key-value detail without mutating the original")
        void withDetail() {
            HealthStatus base = HealthStatus.offline("upstream-api", "timed out");
            HealthStatus status = base.withDetail("latencyMs", 42L);

            assertEquals(42L, status.details().get("latencyMs"));
            assertEquals(HealthStatus.Status.OFFLINE, status.status());
            assertTrue(base.details().isEmpty());
        }

        @Test
        @DisplayName("Should require a component name")
        void requiresComponent() {
            assertThrows(NullPointerException.class,
                    () -> new HealthStatus(null, HealthStatus.Status.ONLINE, "ok", null));
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        private HealthCheck check(HealthStatus status) {
            HealthCheck check = mock(HealthCheck.class);
            when(check.component()).thenReturn(status.component());
            when(check.check()).thenReturn(status);
            return check;
        }

        @Test
        @DisplayName("Should be ONLINE with no checks")
        void empty() {
            HealthStatus status = new HealthCheckRegistry().checkAll();
            assertTrue(status.isOnline());
            assertEquals("navigator", status.component());
        }

        @Test
        @DisplayName("Should report the worst component status")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check(HealthStatus.online("upstream-api", "online")));
            registry.register(check(HealthStatus.degraded("cache", "Cache directory not writable: /ro")));

            HealthStatus status = registry.checkAll();
            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertEquals("cache: Cache directory not writable: /ro", status.message());
            assertEquals(2, status.details().size());

            registry.register(check(HealthStatus.offline("mirror-api", "connection refused")));
            HealthStatus offline = registry.checkAll();
            assertEquals(HealthStatus.Status.OFFLINE, offline.status());
            assertEquals("mirror-api: connection refused", offline.message());
        }

        @Test
        @DisplayName("Should report online when every component is online")
        void allOnline() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check(HealthStatus.online("upstream-api", "online")));
            registry.register(check(HealthStatus.online("cache", "persistent")));

            HealthStatus status = registry.checkAll();
            assertTrue(status.isOnline());
            assertEquals("online", status.message());
            assertEquals(Set.of("upstream-api", "cache"), status.details().keySet());
        }

        @Test
        @DisplayName("Should ignore null checks")
        void ignoresNull() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(null);
            assertEquals(0, registry.size());
        }
    }

    @Nested
    @DisplayName("UpstreamApiHealthCheck")
    class UpstreamTests {

        @Test
        @DisplayName("Should be UP with endpoint count when the API root answers")
        void online() {
            FakeReferenceApiClient api = new FakeReferenceApiClient()
                    .respondJson("", "{\"spells\":\"/api/spells\",\"monsters\":\"/api/monsters\"}");

            HealthStatus status = new UpstreamApiHealthCheck(api).check();

            assertTrue(status.isOnline());
            assertEquals("upstream-api", status.component());
            assertEquals(2, status.details().get("endpointCount"));
            assertEquals("fake://dnd/api/", status.details().get("baseUrl"));
            assertTrue(status.details().containsKey("latencyMs"));
        }

        @Test
        @DisplayName("Should be DOWN on a non-success status")
        void badStatus() {
            FakeReferenceApiClient api = new FakeReferenceApiClient().respond("", ApiResponse.status(503));
            HealthStatus status = new UpstreamApiHealthCheck(api).check();
            assertEquals(HealthStatus.Status.OFFLINE, status.status());
            assertEquals(503, status.details().get("responseCode"));
        }

        @Test
        @DisplayName("Should be DOWN when unreachable")
        void unreachable() {
            FakeReferenceApiClient api = new FakeReferenceApiClient().failWith("", FakeReferenceApiClient.unavailable());
            HealthStatus status = new UpstreamApiHealthCheck(api).check();
            assertEquals(HealthStatus.Status.OFFLINE, status.status());
            assertTrue(status.message().contains("connection refused"));
            assertEquals("fake://dnd/api/", status.details().get("baseUrl"));
        }
    }

    @Nested
    @DisplayName("CacheStorageHealthCheck")
    class CacheTests {

        @TempDir
        Path dir;

        @Test
        @DisplayName("Should be UP for an in-memory cache")
        void inMemory() {
            HealthStatus status = new CacheStorageHealthCheck(new TieredCacheStore(CacheConfig.inMemory(24))).check();
            assertTrue(status.isOnline());
            assertEquals("in-memory", status.message());
            assertEquals(24L, status.details().get("ttlHours"));
        }

        @Test
        @DisplayName("Should be UP for a writable cache directory")
        void writable() {
            HealthStatus status = new CacheStorageHealthCheck(
                    new TieredCacheStore(CacheConfig.persistent(24, dir.resolve("cache")))).check();
            assertTrue(status.isOnline());
            assertEquals(dir.resolve("cache").toString(), status.details().get("cacheDir"));
        }

        @Test
        @DisplayName("Should be DEGRADED when the cache directory is unusable")
        void unwritable() throws Exception {
            Path file = Files.writeString(dir.resolve("file"), "x");
            HealthStatus status = new CacheStorageHealthCheck(
                    new TieredCacheStore(CacheConfig.persistent(24, file))).check();
            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            Map<String, Object> details = status.details();
            assertEquals(file.toString(), details.get("cacheDir"));
            assertEquals(0L, details.get("size"));
        }
    }
}

package com.dnd.navigator.cache;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the cache store.
 *
 * @param ttl              lifetime of each entry
 * @param persistent       whether entries are written through to disk
 * @param cacheDir         root directory for durable entries
 * @param maxMemoryEntries bound on the in-memory tier, 0 for unbounded
 */
public record CacheConfig(Duration ttl, boolean persistent, Path cacheDir, long maxMemoryEntries) {

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        if (maxMemoryEntries < 0) {
            throw new IllegalArgumentException("maxMemoryEntries must be >= 0");
        }
        if (persistent) {
            Objects.requireNonNull(cacheDir, "cacheDir is required when persistent");
        }
    }

    /**
     * In-memory only cache with the given TTL in hours.
     */
    public static CacheConfig inMemory(long ttlHours) {
        return new CacheConfig(Duration.ofHours(ttlHours), false, null, 0);
    }

    /**
     * Write-through cache persisted under {@code cacheDir}.
     */
    public static CacheConfig persistent(long ttlHours, Path cacheDir) {
        return new CacheConfig(Duration.ofHours(ttlHours), true, cacheDir, 0);
    }

    public CacheConfig withMaxMemoryEntries(long maxEntries) {
        return new CacheConfig(ttl, persistent, cacheDir, maxEntries);
    }
}

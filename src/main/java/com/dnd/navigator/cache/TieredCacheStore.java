package com.dnd.navigator.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Caffeine-backed cache store with an optional write-through disk tier.
 *
 * <p>Expiry is evaluated lazily on read against the entry's own creation time and TTL;
 * nothing is swept in the background. When persistence is enabled a memory miss falls back
 * to {@link DiskCacheStorage}, and every {@link #set} commits to disk before the entry
 * becomes visible in memory.</p>
 *
 * <p>Thread-safe. Concurrent writes to one key resolve last-write-wins, and the memory and disk
 * tiers always agree on which write was last.</p>
 */
public class TieredCacheStore implements CacheStore {
    private static final Logger log = LoggerFactory.getLogger(TieredCacheStore.class);

    private final CacheConfig config;
    private final Clock clock;
    private final Cache<String, CacheEntry> memory;
    private final DiskCacheStorage disk;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder diskLoads = new LongAdder();
    private final LongAdder diskWrites = new LongAdder();
    private final LongAdder diskFailures = new LongAdder();

    public TieredCacheStore(CacheConfig config) {
        this(config, Clock.systemUTC());
    }

    public TieredCacheStore(CacheConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        Caffeine<Object, Object> builder = Caffeine.newBuilder();
        if (config.maxMemoryEntries() > 0) {
            builder.maximumSize(config.maxMemoryEntries());
        }
        this.memory = builder.build();
        this.disk = config.persistent() ? new DiskCacheStorage(config.cacheDir()) : null;
        log.info("TieredCacheStore initialized: ttl={}, persistent={}, cacheDir={}, maxMemoryEntries={}",
                config.ttl(), config.persistent(), config.cacheDir(), config.maxMemoryEntries());
    }

    @Override
    public Optional<JsonNode> get(CacheKey key) {
        Instant now = clock.instant();
        CacheEntry entry = memory.getIfPresent(key.value());
        if (entry == null && disk != null) {
            entry = loadFromDisk(key, now);
        }
        if (entry == null || entry.isExpired(now)) {
            misses.increment();
            log.debug("Cache miss: {}", key);
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(entry.value());
    }

    @Override
    public void set(CacheKey key, JsonNode value) {
        if (value == null) {
            log.warn("Refusing to cache null value for {}", key);
            return;
        }
        CacheEntry entry = new CacheEntry(key.value(), value, clock.instant(), config.ttl());
        // both tiers are written under the key's lock so they agree on the last writer
        memory.asMap().compute(key.value(), (k, current) -> {
            persist(key, entry);
            return entry;
        });
    }

    private void persist(CacheKey key, CacheEntry entry) {
        if (disk == null) {
            return;
        }
        try {
            disk.write(key, entry);
            diskWrites.increment();
        } catch (IOException | RuntimeException e) {
            diskFailures.increment();
            log.warn("Failed to persist cache entry {}: {}", key, e.getMessage());
        }
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(hits.sum(), misses.sum(), diskLoads.sum(), diskWrites.sum(),
                diskFailures.sum(), memory.estimatedSize());
    }

    @Override
    public CacheConfig getConfig() {
        return config;
    }

    /**
     * Returns the disk tier, or null when persistence is disabled.
     */
    public DiskCacheStorage getDiskStorage() {
        return disk;
    }

    private CacheEntry loadFromDisk(CacheKey key, Instant now) {
        Optional<CacheEntry> stored;
        try {
            stored = disk.read(key);
        } catch (IOException | RuntimeException e) {
            diskFailures.increment();
            log.warn("Ignoring unreadable cache file for {}: {}", key, e.getMessage());
            return null;
        }
        if (stored.isEmpty() || stored.get().isExpired(now)) {
            return null;
        }
        diskLoads.increment();
        // a set that landed in memory meanwhile is newer than the file we read
        return memory.asMap().computeIfAbsent(key.value(), k -> stored.get());
    }
}

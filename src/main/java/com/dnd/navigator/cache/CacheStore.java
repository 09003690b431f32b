package com.dnd.navigator.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Key/value store with per-entry TTL and optional durable backing.
 * Implementations never throw to the caller: storage failures degrade to a miss.
 */
public interface CacheStore {

    /**
     * Gets a cached value.
     *
     * @param key the cache key
     * @return the value, or empty if absent, expired or unreadable
     */
    Optional<JsonNode> get(CacheKey key);

    /**
     * Stores a value with the configured TTL, replacing any previous entry.
     *
     * @param key   the cache key
     * @param value the value to cache
     */
    void set(CacheKey key, JsonNode value);

    /**
     * Returns true if an unexpired entry exists for the key.
     */
    default boolean contains(CacheKey key) {
        return get(key).isPresent();
    }

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();

    /**
     * Returns the configuration this store was built with.
     */
    CacheConfig getConfig();
}

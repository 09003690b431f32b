package com.dnd.navigator.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached value with the moment it was written and the TTL fixed at write time.
 *
 * @param key       the cache key string
 * @param value     the cached payload
 * @param createdAt when the entry was written
 * @param ttl       lifetime of the entry
 */
public record CacheEntry(String key, JsonNode value, Instant createdAt, Duration ttl) {

    /**
     * An entry is expired once strictly more than {@code ttl} has elapsed since creation.
     */
    public boolean isExpired(Instant now) {
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }
}

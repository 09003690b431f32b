package com.dnd.navigator.cache;

import java.util.Objects;

/**
 * Key of a cache entry.
 *
 * <p>The {@code group} partitions durable storage (one directory per group) so keys from
 * different groups never collide on disk. The {@code value} is the full, unique key string.</p>
 *
 * @param group partition name for durable storage
 * @param value the key string
 */
public record CacheKey(String group, String value) {

    public CacheKey {
        Objects.requireNonNull(group, "group is required");
        Objects.requireNonNull(value, "value is required");
        if (group.isBlank() || value.isBlank()) {
            throw new IllegalArgumentException("group and value must not be blank");
        }
    }

    @Override
    public String toString() {
        return group + "/" + value;
    }
}

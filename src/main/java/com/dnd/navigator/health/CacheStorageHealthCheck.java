package com.dnd.navigator.health;

import com.dnd.navigator.cache.CacheStats;
import com.dnd.navigator.cache.DiskCacheStorage;
import com.dnd.navigator.cache.TieredCacheStore;

/**
 * Reports cache statistics and, when persistence is enabled, whether the cache directory is
 * writable. An unwritable directory degrades the navigator: it still serves from memory.
 */
public class CacheStorageHealthCheck implements HealthCheck {

    static final String COMPONENT = "cache";

    private final TieredCacheStore store;

    public CacheStorageHealthCheck(TieredCacheStore store) {
        this.store = store;
    }

    @Override
    public String component() {
        return COMPONENT;
    }

    @Override
    public HealthStatus check() {
        CacheStats stats = store.getStats();
        DiskCacheStorage disk = store.getDiskStorage();
        HealthStatus status;
        if (disk == null) {
            status = HealthStatus.online(COMPONENT, "in-memory");
        } else if (disk.isWritable()) {
            status = HealthStatus.online(COMPONENT, "persistent").withDetail("cacheDir", disk.getRoot().toString());
        } else {
            status = HealthStatus.degraded(COMPONENT, "Cache directory not writable: " + disk.getRoot())
                    .withDetail("cacheDir", disk.getRoot().toString());
        }
        return status
                .withDetail("size", stats.size())
                .withDetail("hitRate", stats.hitRate())
                .withDetail("ttlHours", store.getConfig().ttl().toHours())
                .withDetail("diskFailures", stats.diskFailures());
    }
}

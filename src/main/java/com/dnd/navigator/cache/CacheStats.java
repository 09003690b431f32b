package com.dnd.navigator.cache;

/**
 * Cache counters.
 *
 * @param hitCount     reads served from memory or disk
 * @param missCount    reads that found nothing usable
 * @param diskLoads    entries loaded from disk into memory
 * @param diskWrites   successful write-throughs
 * @param diskFailures failed disk reads or writes
 * @param size         current number of in-memory entries
 */
public record CacheStats(long hitCount, long missCount, long diskLoads, long diskWrites,
                         long diskFailures, long size) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}

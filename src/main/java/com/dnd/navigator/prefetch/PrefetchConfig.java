package com.dnd.navigator.prefetch;

/**
 * Concurrency bounds for background warm-up.
 *
 * @param lanes                  number of categories warmed concurrently
 * @param maxInFlightPerCategory maximum concurrent item fetches within one category
 */
public record PrefetchConfig(int lanes, int maxInFlightPerCategory) {

    public PrefetchConfig {
        if (lanes <= 0) {
            throw new IllegalArgumentException("lanes must be > 0");
        }
        if (maxInFlightPerCategory <= 0) {
            throw new IllegalArgumentException("maxInFlightPerCategory must be > 0");
        }
    }

    /**
     * Default: five lanes (one per default hot category), four item fetches in flight each.
     */
    public static PrefetchConfig defaults() {
        return new PrefetchConfig(5, 4);
    }
}

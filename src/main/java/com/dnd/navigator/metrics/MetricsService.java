package com.dnd.navigator.metrics;

import java.time.Duration;

/**
 * Interface for recording navigator metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependency on the classpath.
 */
public interface MetricsService {

    void recordCacheHit();

    void recordCacheMiss();

    /**
     * Records one upstream HTTP call.
     *
     * @param outcome  {@code success}, {@code redirect}, {@code status_<code>} or {@code error}
     * @param duration wall time of the call
     */
    void recordUpstreamRequest(String outcome, Duration duration);

    void recordSearch(Duration duration, int totalCount);

    void incrementPrefetchedItems(String category);

    void incrementPrefetchFailures(String category);
}

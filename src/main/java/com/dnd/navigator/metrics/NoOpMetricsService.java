package com.dnd.navigator.metrics;

import java.time.Duration;

/**
 * No-op metrics implementation. Used when no metrics backend is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordUpstreamRequest(String outcome, Duration duration) {
    }

    @Override
    public void recordSearch(Duration duration, int totalCount) {
    }

    @Override
    public void incrementPrefetchedItems(String category) {
    }

    @Override
    public void incrementPrefetchFailures(String category) {
    }
}

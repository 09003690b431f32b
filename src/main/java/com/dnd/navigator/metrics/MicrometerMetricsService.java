package com.dnd.navigator.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code navigator.cache.hit} - Counter</li>
 *   <li>{@code navigator.cache.miss} - Counter</li>
 *   <li>{@code navigator.upstream.request} - Timer (tag: outcome)</li>
 *   <li>{@code navigator.search.duration} - Timer</li>
 *   <li>{@code navigator.search.matches} - DistributionSummary</li>
 *   <li>{@code navigator.prefetch.items} - Counter (tag: category)</li>
 *   <li>{@code navigator.prefetch.failures} - Counter (tag: category)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Timer searchTimer;
    private final DistributionSummary searchMatchesSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("navigator.cache.hit")
                .description("Number of cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("navigator.cache.miss")
                .description("Number of cache misses")
                .register(registry);
        this.searchTimer = Timer.builder("navigator.search.duration")
                .description("Duration of cross-category searches")
                .register(registry);
        this.searchMatchesSummary = DistributionSummary.builder("navigator.search.matches")
                .description("Number of surviving candidates per search")
                .register(registry);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordUpstreamRequest(String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("navigator.upstream.request")
                        .description("Duration of upstream API requests")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordSearch(Duration duration, int totalCount) {
        searchTimer.record(duration);
        searchMatchesSummary.record(totalCount);
    }

    @Override
    public void incrementPrefetchedItems(String category) {
        counter("navigator.prefetch.items", "Number of items warmed into the cache", category).increment();
    }

    @Override
    public void incrementPrefetchFailures(String category) {
        counter("navigator.prefetch.failures", "Number of items that failed to prefetch", category).increment();
    }

    private Counter counter(String name, String description, String category) {
        return counterCache.computeIfAbsent(name + ":" + category, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("category", category)
                        .register(registry));
    }
}

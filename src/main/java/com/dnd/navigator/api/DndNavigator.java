package com.dnd.navigator.api;

import com.dnd.navigator.cache.CacheStats;
import com.dnd.navigator.cache.CacheStore;
import com.dnd.navigator.cache.TieredCacheStore;
import com.dnd.navigator.core.model.CategoryInfo;
import com.dnd.navigator.core.model.CategoryItemSummary;
import com.dnd.navigator.fetch.FetchResult;
import com.dnd.navigator.fetch.ItemFetcher;
import com.dnd.navigator.health.CacheStorageHealthCheck;
import com.dnd.navigator.health.HealthCheckRegistry;
import com.dnd.navigator.health.HealthStatus;
import com.dnd.navigator.health.UpstreamApiHealthCheck;
import com.dnd.navigator.metrics.MetricsService;
import com.dnd.navigator.metrics.NoOpMetricsService;
import com.dnd.navigator.prefetch.PrefetchReport;
import com.dnd.navigator.prefetch.Prefetcher;
import com.dnd.navigator.search.DefaultScoringRules;
import com.dnd.navigator.search.QueryClassifier;
import com.dnd.navigator.search.RelevanceSearchEngine;
import com.dnd.navigator.search.SearchResult;
import com.dnd.navigator.upstream.HttpReferenceApiClient;
import com.dnd.navigator.upstream.ReferenceApiClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Main entry point of the navigator.
 *
 * <p>Wires the cache, the upstream client, the fetcher, the prefetcher and the search engine,
 * and exposes them as one facade. Use {@link #builder()} to create instances.</p>
 *
 * <pre>
 * try (DndNavigator navigator = DndNavigator.builder()
 *         .options(NavigatorOptions.defaults())
 *         .build()) {
 *     SearchResult result = navigator.search("fire sword");
 * }
 * </pre>
 */
public class DndNavigator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DndNavigator.class);

    private final NavigatorOptions options;
    private final CacheStore cacheStore;
    private final ItemFetcher fetcher;
    private final Prefetcher prefetcher;
    private final RelevanceSearchEngine searchEngine;
    private final HealthCheckRegistry healthChecks;

    private DndNavigator(NavigatorOptions options, CacheStore cacheStore, ReferenceApiClient apiClient,
                         MetricsService metricsService) {
        this.options = options;
        this.cacheStore = cacheStore;
        this.fetcher = new ItemFetcher(cacheStore, apiClient, metricsService);
        this.prefetcher = new Prefetcher(fetcher, options.toPrefetchConfig(), metricsService);
        this.searchEngine = new RelevanceSearchEngine(fetcher, options.getSearchCategories(),
                DefaultScoringRules.create(), new QueryClassifier(), metricsService);

        this.healthChecks = new HealthCheckRegistry();
        healthChecks.register(new UpstreamApiHealthCheck(apiClient));
        if (cacheStore instanceof TieredCacheStore tiered) {
            healthChecks.register(new CacheStorageHealthCheck(tiered));
        }
    }

    public FetchResult<List<CategoryItemSummary>> fetchCategoryList(String category) {
        return fetcher.fetchCategoryList(category);
    }

    public FetchResult<JsonNode> fetchItem(String category, String index) {
        return fetcher.fetchItem(category, index);
    }

    public FetchResult<List<CategoryInfo>> fetchCategories() {
        return fetcher.fetchCategories();
    }

    public FetchResult<List<CategoryItemSummary>> searchCategory(String category, String query) {
        return fetcher.searchCategory(category, query);
    }

    public SearchResult search(String query) {
        return searchEngine.search(query);
    }

    /**
     * Starts warming the given categories in the background.
     */
    public CompletableFuture<List<PrefetchReport>> warm(List<String> categories) {
        return prefetcher.warm(categories);
    }

    /**
     * Starts warming the configured prefetch categories in the background.
     */
    public CompletableFuture<List<PrefetchReport>> startPrefetch() {
        return prefetcher.warm(options.getPrefetchCategories());
    }

    /**
     * Checks the reference API and the cache. Always contacts the API.
     */
    public HealthStatus health() {
        HealthStatus status = healthChecks.checkAll();
        if (!status.isOnline()) {
            log.warn("Navigator is {}: {}", status.status(), status.message());
        }
        return status;
    }

    public CacheStats cacheStats() {
        return cacheStore.getStats();
    }

    public NavigatorOptions getOptions() {
        return options;
    }

    public ItemFetcher getFetcher() {
        return fetcher;
    }

    @Override
    public void close() {
        if (!prefetcher.shutdown(Duration.ofSeconds(5))) {
            log.warn("Prefetch did not finish before shutdown; cache left partially warm");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private NavigatorOptions options = NavigatorOptions.defaults();
        private ReferenceApiClient apiClient;
        private CacheStore cacheStore;
        private MetricsService metricsService = new NoOpMetricsService();
        private Clock clock = Clock.systemUTC();

        public Builder options(NavigatorOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets the upstream client. Defaults to an HTTP client built from the options.
         */
        public Builder apiClient(ReferenceApiClient apiClient) {
            this.apiClient = apiClient;
            return this;
        }

        /**
         * Sets a custom cache store. Defaults to a {@link TieredCacheStore} built from the options.
         */
        public Builder cacheStore(CacheStore cacheStore) {
            this.cacheStore = cacheStore;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets the clock used for cache expiry.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DndNavigator build() {
            if (options == null) {
                throw new IllegalStateException("options are required");
            }
            ReferenceApiClient client = apiClient != null ? apiClient
                    : HttpReferenceApiClient.builder()
                            .baseUrl(options.getBaseUrl())
                            .timeout(options.getRequestTimeout())
                            .build();
            CacheStore store = cacheStore != null ? cacheStore
                    : new TieredCacheStore(options.toCacheConfig(), clock);

            DndNavigator navigator = new DndNavigator(options, store, client, metricsService);
            log.info("DndNavigator started: baseUrl={}, persistent={}, ttlHours={}",
                    client.getBaseUrl(), options.isPersistent(), options.getTtlHours());
            if (options.isPrefetchOnStartup()) {
                navigator.startPrefetch();
            }
            return navigator;
        }
    }
}

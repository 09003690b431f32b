package com.dnd.navigator.api;

import com.dnd.navigator.cache.CacheConfig;
import com.dnd.navigator.core.model.Categories;
import com.dnd.navigator.prefetch.PrefetchConfig;
import com.dnd.navigator.upstream.HttpReferenceApiClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Options for a {@link DndNavigator}.
 * Configures the upstream endpoint, caching, prefetching and the searched categories.
 */
public class NavigatorOptions {

    private static final long DEFAULT_TTL_HOURS = 24;
    private static final String DEFAULT_CACHE_DIR = "cache";

    private final String baseUrl;
    private final Duration requestTimeout;
    private final long ttlHours;
    private final boolean persistent;
    private final Path cacheDir;
    private final long maxMemoryEntries;
    private final boolean prefetchOnStartup;
    private final List<String> prefetchCategories;
    private final int prefetchLanes;
    private final int maxInFlightPerCategory;
    private final List<String> searchCategories;

    private NavigatorOptions(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.requestTimeout = builder.requestTimeout;
        this.ttlHours = builder.ttlHours;
        this.persistent = builder.persistent;
        this.cacheDir = builder.cacheDir;
        this.maxMemoryEntries = builder.maxMemoryEntries;
        this.prefetchOnStartup = builder.prefetchOnStartup;
        this.prefetchCategories = List.copyOf(builder.prefetchCategories);
        this.prefetchLanes = builder.prefetchLanes;
        this.maxInFlightPerCategory = builder.maxInFlightPerCategory;
        this.searchCategories = List.copyOf(builder.searchCategories);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public long getTtlHours() {
        return ttlHours;
    }

    public boolean isPersistent() {
        return persistent;
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public long getMaxMemoryEntries() {
        return maxMemoryEntries;
    }

    public boolean isPrefetchOnStartup() {
        return prefetchOnStartup;
    }

    public List<String> getPrefetchCategories() {
        return prefetchCategories;
    }

    public int getPrefetchLanes() {
        return prefetchLanes;
    }

    public int getMaxInFlightPerCategory() {
        return maxInFlightPerCategory;
    }

    public List<String> getSearchCategories() {
        return searchCategories;
    }

    public CacheConfig toCacheConfig() {
        return new CacheConfig(Duration.ofHours(ttlHours), persistent, cacheDir, maxMemoryEntries);
    }

    public PrefetchConfig toPrefetchConfig() {
        return new PrefetchConfig(prefetchLanes, maxInFlightPerCategory);
    }

    /**
     * Creates default options: public API, 24 hour persistent cache, hot categories prefetched
     * on startup.
     */
    public static NavigatorOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options with an in-memory cache and no startup prefetch.
     */
    public static NavigatorOptions inMemory() {
        return builder().persistent(false).prefetchOnStartup(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl = HttpReferenceApiClient.DEFAULT_BASE_URL;
        private Duration requestTimeout = HttpReferenceApiClient.DEFAULT_TIMEOUT;
        private long ttlHours = DEFAULT_TTL_HOURS;
        private boolean persistent = true;
        private Path cacheDir = Path.of(DEFAULT_CACHE_DIR);
        private long maxMemoryEntries = 0;
        private boolean prefetchOnStartup = true;
        private List<String> prefetchCategories = Categories.DEFAULT_PREFETCH;
        private int prefetchLanes = PrefetchConfig.defaults().lanes();
        private int maxInFlightPerCategory = PrefetchConfig.defaults().maxInFlightPerCategory();
        private List<String> searchCategories = Categories.searchable();

        public Builder baseUrl(String baseUrl) {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("baseUrl must not be blank");
            }
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            Objects.requireNonNull(requestTimeout, "requestTimeout is required");
            if (requestTimeout.isZero() || requestTimeout.isNegative()) {
                throw new IllegalArgumentException("requestTimeout must be positive");
            }
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder ttlHours(long ttlHours) {
            if (ttlHours <= 0) {
                throw new IllegalArgumentException("ttlHours must be positive");
            }
            this.ttlHours = ttlHours;
            return this;
        }

        public Builder persistent(boolean persistent) {
            this.persistent = persistent;
            return this;
        }

        public Builder cacheDir(Path cacheDir) {
            this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir is required");
            return this;
        }

        public Builder maxMemoryEntries(long maxMemoryEntries) {
            if (maxMemoryEntries < 0) {
                throw new IllegalArgumentException("maxMemoryEntries must be >= 0");
            }
            this.maxMemoryEntries = maxMemoryEntries;
            return this;
        }

        public Builder prefetchOnStartup(boolean prefetchOnStartup) {
            this.prefetchOnStartup = prefetchOnStartup;
            return this;
        }

        public Builder prefetchCategories(List<String> prefetchCategories) {
            this.prefetchCategories = Objects.requireNonNull(prefetchCategories, "prefetchCategories is required");
            return this;
        }

        public Builder prefetchLanes(int prefetchLanes) {
            if (prefetchLanes <= 0) {
                throw new IllegalArgumentException("prefetchLanes must be positive");
            }
            this.prefetchLanes = prefetchLanes;
            return this;
        }

        public Builder maxInFlightPerCategory(int maxInFlightPerCategory) {
            if (maxInFlightPerCategory <= 0) {
                throw new IllegalArgumentException("maxInFlightPerCategory must be positive");
            }
            this.maxInFlightPerCategory = maxInFlightPerCategory;
            return this;
        }

        public Builder searchCategories(List<String> searchCategories) {
            this.searchCategories = Objects.requireNonNull(searchCategories, "searchCategories is required");
            return this;
        }

        public NavigatorOptions build() {
            for (String category : prefetchCategories) {
                if (!Categories.isKnown(category)) {
                    throw new IllegalArgumentException("Unknown prefetch category: " + category);
                }
            }
            for (String category : searchCategories) {
                if (!Categories.isKnown(category)) {
                    throw new IllegalArgumentException("Unknown search category: " + category);
                }
            }
            return new NavigatorOptions(this);
        }
    }
}

package com.dnd.navigator.fetch;

import com.dnd.navigator.cache.CacheKey;
import com.dnd.navigator.cache.CacheStore;
import com.dnd.navigator.core.model.Categories;
import com.dnd.navigator.core.model.CategoryInfo;
import com.dnd.navigator.core.model.CategoryItemSummary;
import com.dnd.navigator.metrics.MetricsService;
import com.dnd.navigator.metrics.NoOpMetricsService;
import com.dnd.navigator.upstream.ApiResponse;
import com.dnd.navigator.upstream.ReferenceApiClient;
import com.dnd.navigator.upstream.UpstreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Fetch-through-cache accessor for the upstream reference API.
 *
 * <p>Owns cache key construction: category listings live under {@code items_<category>},
 * item details under {@code item_<category>_<index>}, both grouped by category on disk.</p>
 *
 * <p>Never throws at runtime. Every failure is returned as a {@link FetchResult} carrying a
 * {@link FetchError}.</p>
 */
public class ItemFetcher {
    private static final Logger log = LoggerFactory.getLogger(ItemFetcher.class);

    public static final String SOURCE_ATTRIBUTION = "D&D 5e API (www.dnd5eapi.co)";

    static final CacheKey CATEGORIES_KEY = new CacheKey("index", "categories");

    private static final TypeReference<List<CategoryItemSummary>> SUMMARY_LIST = new TypeReference<>() {};
    private static final TypeReference<List<CategoryInfo>> CATEGORY_LIST = new TypeReference<>() {};

    private final CacheStore cache;
    private final ReferenceApiClient client;
    private final MetricsService metricsService;
    private final Set<String> knownCategories;
    private final ObjectMapper objectMapper;

    public ItemFetcher(CacheStore cache, ReferenceApiClient client) {
        this(cache, client, new NoOpMetricsService());
    }

    public ItemFetcher(CacheStore cache, ReferenceApiClient client, MetricsService metricsService) {
        this(cache, client, metricsService, Categories.ALL);
    }

    public ItemFetcher(CacheStore cache, ReferenceApiClient client, MetricsService metricsService,
                       Collection<String> knownCategories) {
        this.cache = cache;
        this.client = client;
        this.metricsService = metricsService;
        this.knownCategories = Set.copyOf(knownCategories);
        this.objectMapper = new ObjectMapper();
    }

    public static CacheKey categoryListKey(String category) {
        return new CacheKey(category, "items_" + category);
    }

    public static CacheKey itemKey(String category, String index) {
        return new CacheKey(category, "item_" + category + "_" + index);
    }

    /**
     * Returns the item summaries of a category, from cache or upstream.
     */
    public FetchResult<List<CategoryItemSummary>> fetchCategoryList(String category) {
        Optional<String> invalid = validateCategory(category);
        if (invalid.isPresent()) {
            return FetchResult.invalidInput(invalid.get());
        }

        CacheKey key = categoryListKey(category);
        Optional<List<CategoryItemSummary>> cached = readCached(key, SUMMARY_LIST);
        if (cached.isPresent()) {
            return FetchResult.cached(cached.get());
        }

        ApiResponse response;
        try {
            response = call(category);
        } catch (UpstreamException e) {
            log.warn("Failed to fetch items for {}: {}", category, e.getMessage());
            return FetchResult.failure(FetchError.Kind.UNAVAILABLE,
                    "Failed to fetch items for " + category + ": " + e.getMessage());
        }
        if (!response.isSuccess()) {
            log.warn("Failed to fetch items for {}: status {}", category, response.statusCode());
            return FetchResult.notFound("Category '" + category + "' not found or API request failed");
        }

        JsonNode results;
        try {
            results = objectMapper.readTree(response.body()).path("results");
        } catch (JsonProcessingException e) {
            log.warn("Malformed listing for {}: {}", category, e.getOriginalMessage());
            return FetchResult.failure(FetchError.Kind.MALFORMED, "Malformed listing for " + category);
        }
        if (!results.isArray()) {
            return FetchResult.failure(FetchError.Kind.MALFORMED, "Listing for " + category + " has no results");
        }

        List<CategoryItemSummary> summaries = new ArrayList<>(results.size());
        for (JsonNode result : results) {
            String name = result.path("name").asText(null);
            String index = result.path("index").asText(null);
            if (name == null || index == null) {
                log.debug("Skipping listing entry without name or index in {}: {}", category, result);
                continue;
            }
            summaries.add(CategoryItemSummary.of(category, name, index));
        }

        cache.set(key, objectMapper.valueToTree(summaries));
        log.debug("Fetched {} items for {}", summaries.size(), category);
        return FetchResult.fetched(List.copyOf(summaries));
    }

    /**
     * Returns the detail payload of one item, from cache or upstream. Follows at most one
     * redirect.
     */
    public FetchResult<JsonNode> fetchItem(String category, String index) {
        Optional<String> invalid = validateCategory(category);
        if (invalid.isEmpty() && !Categories.isSlug(index)) {
            invalid = Optional.of("Invalid item index: '" + index + "'");
        }
        if (invalid.isPresent()) {
            return FetchResult.invalidInput(invalid.get());
        }

        CacheKey key = itemKey(category, index);
        Optional<JsonNode> cached = cache.get(key);
        if (cached.isPresent() && cached.get().isObject()) {
            metricsService.recordCacheHit();
            return FetchResult.cached(cached.get());
        }
        metricsService.recordCacheMiss();

        ApiResponse response;
        try {
            response = call(category + "/" + index);
            if (response.isRedirect()) {
                log.debug("Following redirect for {}/{} to {}", category, index, response.location());
                response = call(response.location());
            }
        } catch (UpstreamException e) {
            log.warn("Failed to fetch item {}/{}: {}", category, index, e.getMessage());
            return FetchResult.failure(FetchError.Kind.UNAVAILABLE,
                    "Failed to fetch item " + category + "/" + index + ": " + e.getMessage());
        }
        if (!response.isSuccess()) {
            log.warn("Failed to fetch item {}/{}: status {}", category, index, response.statusCode());
            return FetchResult.notFound(
                    "Item '" + index + "' not found in category '" + category + "' or API request failed");
        }

        JsonNode detail;
        try {
            detail = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            log.warn("Malformed detail for {}/{}: {}", category, index, e.getOriginalMessage());
            return FetchResult.failure(FetchError.Kind.MALFORMED, "Malformed detail for " + category + "/" + index);
        }
        if (!(detail instanceof ObjectNode object)) {
            return FetchResult.failure(FetchError.Kind.MALFORMED,
                    "Detail for " + category + "/" + index + " is not an object");
        }

        object.put("source", SOURCE_ATTRIBUTION);
        cache.set(key, object);
        return FetchResult.fetched(object);
    }

    /**
     * True if an unexpired detail entry is cached for the item.
     */
    public boolean isItemCached(String category, String index) {
        return cache.contains(itemKey(category, index));
    }

    /**
     * Lists the categories exposed by the API root, with descriptions attached.
     */
    public FetchResult<List<CategoryInfo>> fetchCategories() {
        Optional<List<CategoryInfo>> cached = readCached(CATEGORIES_KEY, CATEGORY_LIST);
        if (cached.isPresent()) {
            return FetchResult.cached(cached.get());
        }

        ApiResponse response;
        try {
            response = call("");
        } catch (UpstreamException e) {
            log.warn("Failed to fetch categories: {}", e.getMessage());
            return FetchResult.failure(FetchError.Kind.UNAVAILABLE, "Failed to fetch categories: " + e.getMessage());
        }
        if (!response.isSuccess()) {
            log.warn("Failed to fetch categories: status {}", response.statusCode());
            return FetchResult.notFound("API request failed with status " + response.statusCode());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            return FetchResult.failure(FetchError.Kind.MALFORMED, "Malformed category index");
        }
        if (!root.isObject()) {
            return FetchResult.failure(FetchError.Kind.MALFORMED, "Category index is not an object");
        }

        List<CategoryInfo> categories = new ArrayList<>();
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            categories.add(new CategoryInfo(name, Categories.describe(name), Categories.categoryUri(name)));
        }
        cache.set(CATEGORIES_KEY, objectMapper.valueToTree(categories));
        return FetchResult.fetched(List.copyOf(categories));
    }

    /**
     * Case-insensitive name substring search within one category listing.
     */
    public FetchResult<List<CategoryItemSummary>> searchCategory(String category, String query) {
        if (query == null || query.isBlank()) {
            return FetchResult.invalidInput("Query must not be empty");
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return fetchCategoryList(category).map(items -> items.stream()
                .filter(item -> item.name().toLowerCase(Locale.ROOT).contains(needle))
                .toList());
    }

    private Optional<String> validateCategory(String category) {
        if (category == null || category.isBlank()) {
            return Optional.of("Category must not be empty");
        }
        if (!Categories.isSlug(category) || !knownCategories.contains(category)) {
            return Optional.of("Unknown category: '" + category + "'");
        }
        return Optional.empty();
    }

    private <T> Optional<T> readCached(CacheKey key, TypeReference<T> type) {
        Optional<JsonNode> node = cache.get(key);
        if (node.isEmpty()) {
            metricsService.recordCacheMiss();
            return Optional.empty();
        }
        try {
            T value = objectMapper.convertValue(node.get(), type);
            if (value == null) {
                metricsService.recordCacheMiss();
                return Optional.empty();
            }
            metricsService.recordCacheHit();
            return Optional.of(value);
        } catch (IllegalArgumentException e) {
            log.warn("Discarding malformed cache entry {}: {}", key, e.getMessage());
            metricsService.recordCacheMiss();
            return Optional.empty();
        }
    }

    private ApiResponse call(String path) {
        long start = System.nanoTime();
        String outcome = "error";
        try {
            ApiResponse response = client.get(path);
            outcome = response.isSuccess() ? "success" : response.isRedirect() ? "redirect" : "status_" + response.statusCode();
            return response;
        } finally {
            metricsService.recordUpstreamRequest(outcome, Duration.ofNanos(System.nanoTime() - start));
        }
    }
}

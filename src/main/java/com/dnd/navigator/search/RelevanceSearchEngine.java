package com.dnd.navigator.search;

import com.dnd.navigator.core.model.Categories;
import com.dnd.navigator.core.model.CategoryItemSummary;
import com.dnd.navigator.core.model.SearchMatch;
import com.dnd.navigator.fetch.FetchResult;
import com.dnd.navigator.fetch.ItemFetcher;
import com.dnd.navigator.logging.LogContext;
import com.dnd.navigator.metrics.MetricsService;
import com.dnd.navigator.metrics.NoOpMetricsService;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Free-text search across categories, served through the cache.
 *
 * <p>For each searched category the listing is fetched; items whose name or index contains a
 * query token get their detail fetched and are scored by the ordered {@link ScoringRule}s plus the
 * category boost from {@link QueryClassifier}. Candidates scoring 0 or less are dropped.</p>
 *
 * <p>Ranking is by score descending. Sorting is stable, so equal scores keep the upstream listing
 * order within a category and the search order across categories.</p>
 *
 * <p>A category whose listing or any candidate detail cannot be fetched is skipped for the
 * search and reported in {@link SearchResult#failedCategories()}.</p>
 */
public class RelevanceSearchEngine {
    private static final Logger log = LoggerFactory.getLogger(RelevanceSearchEngine.class);

    public static final int MAX_PER_CATEGORY = 5;
    public static final int MAX_OVERALL = 5;

    private static final Comparator<SearchMatch> BY_SCORE_DESC =
            Comparator.comparingInt(SearchMatch::score).reversed();

    private final ItemFetcher fetcher;
    private final List<String> categories;
    private final List<ScoringRule> rules;
    private final QueryClassifier classifier;
    private final MetricsService metricsService;

    public RelevanceSearchEngine(ItemFetcher fetcher) {
        this(fetcher, Categories.searchable());
    }

    public RelevanceSearchEngine(ItemFetcher fetcher, List<String> categories) {
        this(fetcher, categories, DefaultScoringRules.create(), new QueryClassifier(), new NoOpMetricsService());
    }

    public RelevanceSearchEngine(ItemFetcher fetcher, List<String> categories, List<ScoringRule> rules,
                                 QueryClassifier classifier, MetricsService metricsService) {
        this.fetcher = fetcher;
        this.categories = categories.stream()
                .filter(c -> !Categories.RULE_TEXT.contains(c))
                .toList();
        this.rules = List.copyOf(rules);
        this.classifier = classifier;
        this.metricsService = metricsService;
    }

    public SearchResult search(String query) {
        if (query == null || query.isBlank()) {
            return SearchResult.invalid(query, "Query must not be empty");
        }

        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forSearch(LogContext.generateCorrelationId(), query)) {
            String normalized = query.trim().toLowerCase(Locale.ROOT);
            List<String> tokens = tokenize(normalized);
            Map<String, Integer> boosts = classifier.classify(tokens);

            Map<String, List<SearchMatch>> perCategory = new LinkedHashMap<>();
            List<SearchMatch> all = new ArrayList<>();
            List<String> failed = new ArrayList<>();

            for (String category : categories) {
                Optional<List<SearchMatch>> matches = searchCategory(
                        category, normalized, tokens, boosts.getOrDefault(category, 0));
                if (matches.isEmpty()) {
                    failed.add(category);
                    continue;
                }
                List<SearchMatch> ranked = matches.get();
                if (!ranked.isEmpty()) {
                    perCategory.put(category, List.copyOf(ranked.subList(0, Math.min(MAX_PER_CATEGORY, ranked.size()))));
                    all.addAll(ranked);
                }
            }

            all.sort(BY_SCORE_DESC);
            List<SearchMatch> top = all.subList(0, Math.min(MAX_OVERALL, all.size()));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordSearch(elapsed, all.size());
            log.info("search.completed totalCount={} categoriesWithMatches={} failedCategories={} elapsedMs={}",
                    all.size(), perCategory.size(), failed.size(), elapsed.toMillis());

            return new SearchResult(query, perCategory, top, all.size(), failed, null);
        }
    }

    /**
     * Splits a lower-cased query on whitespace into distinct tokens, keeping first-seen order.
     */
    static List<String> tokenize(String normalizedQuery) {
        LinkedHashSet<String> tokens = new LinkedHashSet<>();
        for (String token : normalizedQuery.split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return List.copyOf(tokens);
    }

    /**
     * Scores one category. Empty when a fetch failed.
     */
    private Optional<List<SearchMatch>> searchCategory(String category, String query, List<String> tokens, int boost) {
        FetchResult<List<CategoryItemSummary>> listing = fetcher.fetchCategoryList(category);
        if (!listing.isSuccess()) {
            log.debug("Skipping {} in search: {}", category, listing.error().message());
            return Optional.empty();
        }

        List<SearchMatch> matches = new ArrayList<>();
        for (CategoryItemSummary item : listing.value()) {
            String name = item.name().toLowerCase(Locale.ROOT);
            String index = item.index().toLowerCase(Locale.ROOT);
            if (tokens.stream().noneMatch(t -> name.contains(t) || index.contains(t))) {
                continue;
            }

            FetchResult<JsonNode> detail = fetcher.fetchItem(category, item.index());
            if (!detail.isSuccess()) {
                log.warn("Skipping {} in search: detail for {} unavailable: {}",
                        category, item.index(), detail.error().message());
                return Optional.empty();
            }

            ScoringCandidate candidate = new ScoringCandidate(category, item, query, tokens, detail.value(), boost);
            int score = score(candidate);
            if (score > 0) {
                matches.add(new SearchMatch(category, item, score));
            }
        }
        matches.sort(BY_SCORE_DESC);
        return Optional.of(matches);
    }

    int score(ScoringCandidate candidate) {
        int total = 0;
        for (ScoringRule rule : rules) {
            int contribution = rule.score(candidate);
            if (contribution != 0 && log.isTraceEnabled()) {
                log.trace("Rule '{}' scored {} for {}/{}", rule.getName(), contribution,
                        candidate.category(), candidate.item().index());
            }
            total += contribution;
        }
        return total;
    }

    public List<String> getCategories() {
        return categories;
    }
}

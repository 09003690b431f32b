package com.dnd.navigator.search;

import com.dnd.navigator.cache.CacheConfig;
import com.dnd.navigator.cache.TieredCacheStore;
import com.dnd.navigator.core.model.SearchMatch;
import com.dnd.navigator.fetch.ItemFetcher;
import com.dnd.navigator.metrics.MetricsService;
import com.dnd.navigator.testing.FakeReferenceApiClient;
import com.dnd.navigator.upstream.ApiResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RelevanceSearchEngineTest {

    private FakeReferenceApiClient api;
    private ItemFetcher fetcher;

    @BeforeEach
    void setUp() {
        api = new FakeReferenceApiClient()
                .category("spells",
                        new String[]{"Fire Bolt", "fire-bolt", "You hurl a mote of fire"},
                        new String[]{"Fireball", "fireball", "A bright streak flashes to a point you choose"},
                        new String[]{"Wish", "wish", "The mightiest spell"})
                .category("monsters",
                        new String[]{"Fire Giant", "fire-giant", "A giant of fire"},
                        new String[]{"Aboleth", "aboleth", ""})
                .category("equipment",
                        new String[]{"Longsword", "longsword", ""},
                        new String[]{"Shortsword", "shortsword", ""});
        fetcher = new ItemFetcher(new TieredCacheStore(CacheConfig.inMemory(24)), api);
    }

    private RelevanceSearchEngine engine(String... categories) {
        return new RelevanceSearchEngine(fetcher, List.of(categories));
    }

    private static List<String> indexes(List<SearchMatch> matches) {
        return matches.stream().map(m -> m.item().index()).toList();
    }

    @Nested
    @DisplayName("Ranking")
    class RankingTests {

        @Test
        @DisplayName("Should rank the exact name match first")
        void testExactMatchFirst() {
            SearchResult result = engine("spells", "monsters", "equipment").search("fireball");

            assertTrue(result.isSuccess());
            SearchMatch top = result.topOverall().get(0);
            assertEquals("fireball", top.item().index());
            assertEquals("spells", top.category());
            assertTrue(top.score() >= 100);
        }

        @Test
        @DisplayName("Should match case-insensitively and ignore surrounding whitespace")
        void testCaseInsensitive() {
            SearchResult lower = engine("spells").search("fireball");
            SearchResult upper = engine("spells").search("  FIREBALL ");
            assertEquals(lower.topOverall().get(0).score(), upper.topOverall().get(0).score());
        }

        @Test
        @DisplayName("Should return nothing for a query no item contains")
        void testNoMatch() {
            SearchResult result = engine("spells", "monsters", "equipment").search("zzzznomatch");

            assertTrue(result.isSuccess());
            assertEquals(0, result.totalCount());
            assertTrue(result.topOverall().isEmpty());
            assertTrue(result.perCategory().isEmpty());
            assertEquals(0, api.callCount("spells/fireball"));
        }

        @Test
        @DisplayName("Should group matches per category in search order")
        void testPerCategory() {
            SearchResult result = engine("spells", "monsters", "equipment").search("fire");

            assertEquals(List.of("spells", "monsters"), List.copyOf(result.perCategory().keySet()));
            assertEquals(3, result.totalCount());
            assertEquals(List.of("fire-giant"), indexes(result.perCategory().get("monsters")));
        }

        @Test
        @DisplayName("Should keep listing order for equal scores")
        void testStableTieBreak() {
            SearchResult result = engine("equipment").search("sword");

            List<SearchMatch> matches = result.perCategory().get("equipment");
            assertEquals(matches.get(0).score(), matches.get(1).score());
            assertEquals(List.of("longsword", "shortsword"), indexes(matches));
        }

        @Test
        @DisplayName("Should keep search order across categories for equal scores")
        void testStableAcrossCategories() {
            api.category("magic-items", new String[]{"Longsword", "longsword", ""});

            SearchResult result = engine("equipment", "magic-items").search("longsword");

            assertEquals(List.of("equipment", "magic-items"),
                    result.topOverall().stream().map(SearchMatch::category).toList());
        }

        @Test
        @DisplayName("Should boost the category a query's vocabulary points at")
        void testCategoryBoost() {
            api.category("magic-items", new String[]{"Ring of Fire", "ring-of-fire", ""});

            SearchResult plain = engine("magic-items").search("fire");
            SearchResult boosted = engine("magic-items").search("fire ring");

            int plainScore = plain.topOverall().get(0).score();
            int boostedScore = boosted.topOverall().get(0).score();
            assertTrue(boostedScore > plainScore);
        }
    }

    @Nested
    @DisplayName("Limits")
    class LimitTests {

        @Test
        @DisplayName("Should cap each category and the overall list at five")
        void testCaps() {
            String[][] entries = new String[8][];
            for (int i = 0; i < entries.length; i++) {
                entries[i] = new String[]{"Potion " + i, "potion-" + i, ""};
            }
            api.category("magic-items", entries);

            SearchResult result = engine("magic-items").search("potion");

            assertEquals(8, result.totalCount());
            assertEquals(RelevanceSearchEngine.MAX_PER_CATEGORY, result.perCategory().get("magic-items").size());
            assertEquals(RelevanceSearchEngine.MAX_OVERALL, result.topOverall().size());
            assertEquals("potion-0", result.topOverall().get(0).item().index());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should reject an empty query")
        void testEmptyQuery() {
            SearchResult result = engine("spells").search("   ");
            assertFalse(result.isSuccess());
            assertEquals(0, api.totalCalls());
        }

        @Test
        @DisplayName("Should skip a category whose listing fails")
        void testListingFailure() {
            api.failWith("monsters", FakeReferenceApiClient.unavailable());

            SearchResult result = engine("spells", "monsters").search("fire");

            assertEquals(List.of("monsters"), result.failedCategories());
            assertEquals(2, result.totalCount());
        }

        @Test
        @DisplayName("Should skip a category when a candidate detail fails")
        void testDetailFailure() {
            api.respond("spells/fireball", ApiResponse.status(500));

            SearchResult result = engine("spells", "monsters").search("fire");

            assertEquals(List.of("spells"), result.failedCategories());
            assertFalse(result.perCategory().containsKey("spells"));
            assertEquals(List.of("fire-giant"), indexes(result.topOverall()));
        }

        @Test
        @DisplayName("Should never search rule text")
        void testRuleTextExcluded() {
            RelevanceSearchEngine engine = new RelevanceSearchEngine(fetcher, List.of("rules", "spells", "rule-sections"));
            assertEquals(List.of("spells"), engine.getCategories());
        }
    }

    @Test
    @DisplayName("Should record search duration and match count")
    void testMetrics() {
        MetricsService metrics = mock(MetricsService.class);
        RelevanceSearchEngine engine = new RelevanceSearchEngine(fetcher, List.of("spells"),
                DefaultScoringRules.create(), new QueryClassifier(), metrics);

        engine.search("fire");

        verify(metrics).recordSearch(any(), eq(2));
    }

    @Test
    @DisplayName("tokenize() should split on whitespace and drop duplicates")
    void testTokenize() {
        assertEquals(List.of("fire", "ball"), RelevanceSearchEngine.tokenize("fire  ball fire"));
    }
}

package com.dnd.navigator.search;

import com.dnd.navigator.core.model.SearchMatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a cross-category search.
 *
 * @param query            the query as given
 * @param perCategory      top matches per category, in search order; categories without matches are absent
 * @param topOverall       top matches across all categories
 * @param totalCount       number of surviving candidates across all categories, uncapped
 * @param failedCategories categories skipped because a fetch failed
 * @param error            why the search could not run, or null
 */
public record SearchResult(String query,
                           Map<String, List<SearchMatch>> perCategory,
                           List<SearchMatch> topOverall,
                           int totalCount,
                           List<String> failedCategories,
                           String error) {

    public SearchResult {
        perCategory = Collections.unmodifiableMap(new LinkedHashMap<>(perCategory));
        topOverall = List.copyOf(topOverall);
        failedCategories = List.copyOf(failedCategories);
    }

    public static SearchResult invalid(String query, String error) {
        return new SearchResult(query, Map.of(), List.of(), 0, List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}

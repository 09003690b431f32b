package com.dnd.navigator.core.model;

/**
 * A scored search hit. Produced per search call and never persisted.
 *
 * @param category the category the item belongs to
 * @param item     the matched item
 * @param score    relevance score, always positive
 */
public record SearchMatch(String category, CategoryItemSummary item, int score) {
}

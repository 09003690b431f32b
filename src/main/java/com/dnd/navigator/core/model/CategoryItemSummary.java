package com.dnd.navigator.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Lightweight listing entry for an item in a category.
 *
 * @param name  display name, e.g. {@code Fireball}
 * @param index the item key, e.g. {@code fireball}
 * @param uri   resource URI used to retrieve the item
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CategoryItemSummary(String name, String index, String uri) {

    public CategoryItemSummary {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(index, "index is required");
    }

    public static CategoryItemSummary of(String category, String name, String index) {
        return new CategoryItemSummary(name, index, Categories.itemUri(category, index));
    }
}

package com.dnd.navigator.search;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A query vocabulary and the priority boosts it grants when any query token belongs to it.
 *
 * @param name       label used in logs
 * @param vocabulary lower-case keywords
 * @param boosts     category to boost
 */
public record CategoryBoost(String name, Set<String> vocabulary, Map<String, Integer> boosts) {

    public CategoryBoost {
        Objects.requireNonNull(name, "name is required");
        vocabulary = Set.copyOf(vocabulary);
        boosts = Map.copyOf(boosts);
    }
}

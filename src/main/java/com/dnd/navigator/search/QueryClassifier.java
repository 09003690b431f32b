package com.dnd.navigator.search;

import com.dnd.navigator.core.model.Categories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies a query by keyword vocabularies into per-category priority boosts.
 * When several vocabularies boost the same category the largest boost wins.
 */
public class QueryClassifier {
    private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);

    private final List<CategoryBoost> boosts;

    public QueryClassifier() {
        this(defaultBoosts());
    }

    public QueryClassifier(List<CategoryBoost> boosts) {
        this.boosts = List.copyOf(boosts);
    }

    /**
     * Returns the boost per category for the given tokens; categories without a boost are absent.
     */
    public Map<String, Integer> classify(Collection<String> tokens) {
        Map<String, Integer> result = new HashMap<>();
        for (CategoryBoost boost : boosts) {
            if (tokens.stream().anyMatch(boost.vocabulary()::contains)) {
                log.debug("Query matches {} vocabulary", boost.name());
                boost.boosts().forEach((category, value) -> result.merge(category, value, Math::max));
            }
        }
        return result;
    }

    public static List<CategoryBoost> defaultBoosts() {
        return List.of(
                new CategoryBoost("magic-item",
                        Set.of("magic", "magical", "item", "items", "wondrous", "artifact", "ring", "wand",
                                "staff", "rod", "potion", "amulet", "cloak", "rare", "legendary", "attunement"),
                        Map.of(Categories.MAGIC_ITEMS, 10, Categories.EQUIPMENT, 5)),
                new CategoryBoost("spell",
                        Set.of("spell", "spells", "cast", "cantrip", "ritual", "evocation", "abjuration",
                                "conjuration", "divination", "enchantment", "illusion", "necromancy",
                                "transmutation", "concentration"),
                        Map.of(Categories.SPELLS, 10)),
                new CategoryBoost("monster",
                        Set.of("monster", "monsters", "creature", "creatures", "beast", "dragon", "undead",
                                "fiend", "giant", "challenge"),
                        Map.of(Categories.MONSTERS, 10))
        );
    }
}

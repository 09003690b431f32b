package com.dnd.navigator.search;

import com.dnd.navigator.core.model.Categories;

import java.util.List;

/**
 * The default relevance heuristic, in evaluation order.
 */
public final class DefaultScoringRules {

    private DefaultScoringRules() {
    }

    public static List<ScoringRule> create() {
        return List.of(
                ScoringRule.builder()
                        .name("exact-match")
                        .weight(100)
                        .when(c -> c.query().equals(c.name()) || c.query().equals(c.index()))
                        .build(),
                ScoringRule.builder()
                        .name("name-token")
                        .weight(20)
                        .perOccurrence(c -> c.countTokensIn(c.name()))
                        .build(),
                ScoringRule.builder()
                        .name("key-token")
                        .weight(15)
                        .perOccurrence(c -> c.countTokensIn(c.index()))
                        .build(),
                ScoringRule.builder()
                        .name("all-tokens-in-name")
                        .weight(50)
                        .when(c -> !c.tokens().isEmpty() && c.countTokensIn(c.name()) == c.tokens().size())
                        .build(),
                ScoringRule.builder()
                        .name("name-prefix")
                        .weight(10)
                        .when(c -> c.tokens().stream().anyMatch(c.name()::startsWith))
                        .build(),
                ScoringRule.builder()
                        .name("description-token")
                        .weight(5)
                        .perOccurrence(c -> c.countTokensIn(c.description()))
                        .build(),
                ScoringRule.builder()
                        .name("equipment-category")
                        .weight(10)
                        .when(c -> c.anyTokenIn(c.referenceName("equipment_category")))
                        .build(),
                ScoringRule.builder()
                        .name("rarity")
                        .weight(10)
                        .applicableCategories(Categories.EQUIPMENT, Categories.MAGIC_ITEMS)
                        .when(c -> c.anyTokenIn(c.referenceName("rarity")))
                        .build(),
                ScoringRule.builder()
                        .name("spell-school")
                        .weight(10)
                        .applicableCategories(Categories.SPELLS)
                        .when(c -> c.anyTokenIn(c.referenceName("school")))
                        .build(),
                ScoringRule.builder()
                        .name("spell-class")
                        .weight(15)
                        .applicableCategories(Categories.SPELLS)
                        .when(c -> c.referenceNames("classes").stream().anyMatch(c::anyTokenIn))
                        .build(),
                ScoringRule.builder()
                        .name("category-priority")
                        .weight(1)
                        .perOccurrence(ScoringCandidate::categoryBoost)
                        .build()
        );
    }
}

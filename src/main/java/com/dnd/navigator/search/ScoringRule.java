package com.dnd.navigator.search;

import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * A weighted relevance rule. A rule contributes {@code weight * occurrences} to a candidate's
 * score, where occurrences is 0 or 1 for predicate rules and a token count for per-token rules.
 * Rules can be scoped to specific categories.
 */
public class ScoringRule {
    private final String name;
    private final int weight;
    private final ToIntFunction<ScoringCandidate> occurrences;
    private final Set<String> applicableCategories;

    private ScoringRule(Builder builder) {
        this.name = builder.name;
        this.weight = builder.weight;
        this.occurrences = builder.occurrences;
        this.applicableCategories = builder.applicableCategories != null
                ? Set.copyOf(builder.applicableCategories) : Set.of();
    }

    public String getName() {
        return name;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * If no categories are specified, the rule applies to all of them.
     */
    public boolean appliesTo(String category) {
        return applicableCategories.isEmpty() || applicableCategories.contains(category);
    }

    /**
     * Returns this rule's contribution to the candidate's score.
     */
    public int score(ScoringCandidate candidate) {
        if (!appliesTo(candidate.category())) {
            return 0;
        }
        return weight * occurrences.applyAsInt(candidate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScoringRule that = (ScoringRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "ScoringRule{name='" + name + "', weight=" + weight + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private int weight;
        private ToIntFunction<ScoringCandidate> occurrences;
        private Set<String> applicableCategories;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        /**
         * Scores {@code weight} once when the predicate holds.
         */
        public Builder when(Predicate<ScoringCandidate> predicate) {
            this.occurrences = c -> predicate.test(c) ? 1 : 0;
            return this;
        }

        /**
         * Scores {@code weight} once per occurrence counted by the function.
         */
        public Builder perOccurrence(ToIntFunction<ScoringCandidate> occurrences) {
            this.occurrences = occurrences;
            return this;
        }

        public Builder applicableCategories(String... categories) {
            this.applicableCategories = Set.of(categories);
            return this;
        }

        public ScoringRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(occurrences, "a predicate or occurrence function is required");
            return new ScoringRule(this);
        }
    }
}

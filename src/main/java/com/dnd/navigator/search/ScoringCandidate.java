package com.dnd.navigator.search;

import com.dnd.navigator.core.model.CategoryItemSummary;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Locale;
import java.util.stream.StreamSupport;

/**
 * An item under evaluation for one query, with lower-cased views of its searchable text.
 */
public final class ScoringCandidate {

    private final String category;
    private final CategoryItemSummary item;
    private final String query;
    private final List<String> tokens;
    private final JsonNode detail;
    private final int categoryBoost;
    private final String name;
    private final String index;

    /**
     * @param category      category of the item
     * @param item          the listing entry
     * @param query         the whole query, lower-cased; whitespace runs are collapsed to one space
     * @param tokens        distinct lower-cased query tokens
     * @param detail        full item payload, or null when not fetched
     * @param categoryBoost priority boost for the item's category
     */
    public ScoringCandidate(String category, CategoryItemSummary item, String query, List<String> tokens,
                            JsonNode detail, int categoryBoost) {
        this.category = category;
        this.item = item;
        this.query = String.join(" ", query.trim().split("\\s+"));
        this.tokens = List.copyOf(tokens);
        this.detail = detail;
        this.categoryBoost = categoryBoost;
        this.name = item.name().toLowerCase(Locale.ROOT);
        this.index = item.index().toLowerCase(Locale.ROOT);
    }

    public String category() {
        return category;
    }

    public CategoryItemSummary item() {
        return item;
    }

    /**
     * The query as a single-spaced phrase.
     */
    public String query() {
        return query;
    }

    public List<String> tokens() {
        return tokens;
    }

    public String name() {
        return name;
    }

    public String index() {
        return index;
    }

    public int categoryBoost() {
        return categoryBoost;
    }

    /**
     * Lower-cased description text of the detail payload, empty when unavailable.
     * The {@code desc} field may be a string or an array of paragraphs.
     */
    public String description() {
        if (detail == null) {
            return "";
        }
        JsonNode desc = detail.path("desc");
        if (desc.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode paragraph : desc) {
                sb.append(paragraph.asText()).append(' ');
            }
            return sb.toString().toLowerCase(Locale.ROOT);
        }
        return desc.isTextual() ? desc.asText().toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Lower-cased {@code name} of a reference object in the detail payload, e.g.
     * {@code school.name}, or empty when absent.
     */
    public String referenceName(String field) {
        if (detail == null) {
            return "";
        }
        JsonNode node = detail.path(field);
        if (node.isTextual()) {
            return node.asText().toLowerCase(Locale.ROOT);
        }
        return node.path("name").asText("").toLowerCase(Locale.ROOT);
    }

    /**
     * Lower-cased names of a reference list in the detail payload, e.g. {@code classes[].name}.
     */
    public List<String> referenceNames(String field) {
        if (detail == null || !detail.path(field).isArray()) {
            return List.of();
        }
        return StreamSupport.stream(detail.path(field).spliterator(), false)
                .map(node -> node.path("name").asText("").toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /**
     * Number of tokens contained in the given text.
     */
    public int countTokensIn(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (String token : tokens) {
            if (text.contains(token)) {
                count++;
            }
        }
        return count;
    }

    public boolean anyTokenIn(String text) {
        return countTokensIn(text) > 0;
    }
}

package com.dnd.navigator.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Catalog of the upstream API categories.
 */
public final class Categories {

    public static final String SPELLS = "spells";
    public static final String MONSTERS = "monsters";
    public static final String EQUIPMENT = "equipment";
    public static final String MAGIC_ITEMS = "magic-items";
    public static final String CLASSES = "classes";
    public static final String RACES = "races";

    /**
     * Categories warmed at startup by default.
     */
    public static final List<String> DEFAULT_PREFETCH = List.of(SPELLS, EQUIPMENT, MONSTERS, CLASSES, RACES);

    /**
     * Categories holding rule text rather than searchable entities.
     */
    public static final Set<String> RULE_TEXT = Set.of("rules", "rule-sections");

    private static final Pattern SLUG = Pattern.compile("[a-z0-9][a-z0-9_-]*");

    private static final Map<String, String> DESCRIPTIONS = new LinkedHashMap<>();

    static {
        DESCRIPTIONS.put("ability-scores", "The six abilities that describe a character's physical and mental characteristics");
        DESCRIPTIONS.put("alignments", "The moral and ethical attitudes and behaviors of creatures");
        DESCRIPTIONS.put("backgrounds", "Character backgrounds and their features");
        DESCRIPTIONS.put("classes", "Character classes with features, proficiencies, and subclasses");
        DESCRIPTIONS.put("conditions", "Status conditions that affect creatures");
        DESCRIPTIONS.put("damage-types", "Types of damage that can be dealt");
        DESCRIPTIONS.put("equipment", "Items, weapons, armor, and gear for adventuring");
        DESCRIPTIONS.put("equipment-categories", "Categories of equipment");
        DESCRIPTIONS.put("feats", "Special abilities and features");
        DESCRIPTIONS.put("features", "Class and racial features");
        DESCRIPTIONS.put("languages", "Languages spoken throughout the multiverse");
        DESCRIPTIONS.put("magic-items", "Magical equipment with special properties");
        DESCRIPTIONS.put("magic-schools", "Schools of magic specialization");
        DESCRIPTIONS.put("monsters", "Creatures and foes");
        DESCRIPTIONS.put("proficiencies", "Skills and tools characters can be proficient with");
        DESCRIPTIONS.put("races", "Character races and their traits");
        DESCRIPTIONS.put("rule-sections", "Sections of the game rules");
        DESCRIPTIONS.put("rules", "Game rules");
        DESCRIPTIONS.put("skills", "Character skills tied to ability scores");
        DESCRIPTIONS.put("spells", "Magic spells with effects, components, and descriptions");
        DESCRIPTIONS.put("subclasses", "Specializations within character classes");
        DESCRIPTIONS.put("subraces", "Variants of character races");
        DESCRIPTIONS.put("traits", "Racial traits");
        DESCRIPTIONS.put("weapon-properties", "Special properties of weapons");
    }

    /**
     * All known categories, in catalog order.
     */
    public static final List<String> ALL = List.copyOf(DESCRIPTIONS.keySet());

    private Categories() {
    }

    /**
     * Categories searched by default: everything except rule text.
     */
    public static List<String> searchable() {
        return ALL.stream().filter(c -> !RULE_TEXT.contains(c)).toList();
    }

    public static boolean isKnown(String category) {
        return DESCRIPTIONS.containsKey(category);
    }

    /**
     * Returns the description for a category, with a generic fallback for unknown ones.
     */
    public static String describe(String category) {
        return DESCRIPTIONS.getOrDefault(category, "Collection of D&D 5e " + category);
    }

    /**
     * True if the value is a lower-case slug usable as a category or item index.
     */
    public static boolean isSlug(String value) {
        return value != null && SLUG.matcher(value).matches();
    }

    public static String categoryUri(String category) {
        return "resource://dnd/items/" + category;
    }

    public static String itemUri(String category, String index) {
        return "resource://dnd/item/" + category + "/" + index;
    }
}

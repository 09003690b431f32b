package com.dnd.navigator.core.model;

/**
 * An upstream category as listed by the API root.
 *
 * @param name        the category name, e.g. {@code spells}
 * @param description human readable description
 * @param uri         resource URI of the category listing
 */
public record CategoryInfo(String name, String description, String uri) {
}

package com.dnd.navigator.prefetch;

/**
 * Summary of one category warm-up.
 *
 * @param category the warmed category
 * @param listed   number of items in the category listing
 * @param fetched  items fetched from upstream by this run
 * @param skipped  items already cached and left alone
 * @param failed   items whose fetch failed
 * @param error    why the category could not be warmed at all, or null
 */
public record PrefetchReport(String category, int listed, int fetched, int skipped, int failed, String error) {

    public static PrefetchReport failed(String category, String error) {
        return new PrefetchReport(category, 0, 0, 0, 0, error);
    }

    /**
     * True if the listing was retrieved; individual item failures do not count.
     */
    public boolean isCompleted() {
        return error == null;
    }
}

package io.cinerelay.catalog;

/**
 * One search hit. {@code link} is the catalog page and doubles as the dedupe key of jobs created from it.
 */
public record CatalogEntry(String title, String link, String rating, String poster) {
}

package com.majordome.catalog;

/**
 * Counts of what a catalog import inserted or updated.
 *
 * @param members Members processed
 * @param rooms   Rooms processed
 * @param tasks   Tasks processed
 */
public record CatalogImportResult(
        int members,
        int rooms,
        int tasks
) {
}

package com.supplier.catalog.writer;

/**
 * Identifiers touched by one catalog write.
 *
 * @param productId      linked product
 * @param supplierItemId created or updated supplier item
 * @param productCreated whether the product was created by this write
 * @param itemCreated    whether the supplier item was created (false when updated in place)
 * @param productHasGtin whether the linked product carries a GTIN, making it eligible for enrichment
 */
public record WriteResult(String productId, String supplierItemId, boolean productCreated, boolean itemCreated,
                          boolean productHasGtin) {
}

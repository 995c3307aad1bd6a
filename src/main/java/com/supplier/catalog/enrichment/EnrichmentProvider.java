package com.supplier.catalog.enrichment;

/**
 * External source of product master data, looked up by the product's GTIN.
 *
 * <p>Implementations report problems through {@link EnrichmentResponse#errors()}
 * rather than throwing; callers still bound each call with a timeout.</p>
 */
public interface EnrichmentProvider {

    /**
     * Looks the product up and applies the data found to it.
     *
     * @param productId id of an existing product
     * @return what was enriched, plus media and document URLs to download
     */
    EnrichmentResponse enrichFromExternalSource(String productId);

    String getProviderName();

    /**
     * Checks if the provider is reachable.
     */
    boolean isAvailable();
}

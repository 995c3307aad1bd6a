package com.supplier.catalog.cache;

/**
 * Remembers which products were enriched recently so repeated imports of the
 * same product do not call the external source again.
 */
public interface EnrichmentCache {

    /**
     * Marks the product as being enriched now.
     *
     * @return true if the caller should enrich, false if the product was enriched recently
     */
    boolean tryAcquire(String productId);

    /**
     * Forgets the product, so the next import enriches it again.
     */
    void invalidate(String productId);

    void invalidateAll();

    CacheStats getStats();
}

package com.supplier.catalog.cache;

/**
 * Never deduplicates: every call enriches.
 */
public class NoOpEnrichmentCache implements EnrichmentCache {

    @Override
    public boolean tryAcquire(String productId) {
        return true;
    }

    @Override
    public void invalidate(String productId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}

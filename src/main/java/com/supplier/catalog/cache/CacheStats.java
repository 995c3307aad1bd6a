package com.supplier.catalog.cache;

/**
 * @param hitCount      lookups that found a recent enrichment
 * @param missCount     lookups that did not
 * @param evictionCount entries evicted by size or expiry
 * @param size          current number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}

package com.supplier.catalog.cache;

/**
 * Configuration for the recent-enrichment cache.
 *
 * @param maxSize    maximum number of remembered products
 * @param ttlSeconds how long a product counts as recently enriched
 * @param enabled    whether deduplication is active
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 10,000 products for 5 minutes.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 300, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}

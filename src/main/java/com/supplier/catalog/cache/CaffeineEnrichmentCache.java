package com.supplier.catalog.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caffeine-backed {@link EnrichmentCache}. Entries expire after the configured TTL.
 */
public class CaffeineEnrichmentCache implements EnrichmentCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineEnrichmentCache.class);

    private final Cache<String, Instant> cache;

    public CaffeineEnrichmentCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineEnrichmentCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public boolean tryAcquire(String productId) {
        AtomicBoolean acquired = new AtomicBoolean(false);
        cache.get(productId, id -> {
            acquired.set(true);
            return Instant.now();
        });
        return acquired.get();
    }

    @Override
    public void invalidate(String productId) {
        cache.invalidate(productId);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all enrichment cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }
}

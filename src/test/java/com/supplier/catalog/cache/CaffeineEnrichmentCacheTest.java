package com.supplier.catalog.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CaffeineEnrichmentCacheTest {

    @Test
    @DisplayName("Should grant the first acquisition only")
    void testTryAcquire() {
        CaffeineEnrichmentCache cache = new CaffeineEnrichmentCache(CacheConfig.defaults());

        assertTrue(cache.tryAcquire("p-1"));
        assertFalse(cache.tryAcquire("p-1"));
        assertTrue(cache.tryAcquire("p-2"));
    }

    @Test
    @DisplayName("Should grant again after invalidation")
    void testInvalidate() {
        CaffeineEnrichmentCache cache = new CaffeineEnrichmentCache(CacheConfig.defaults());
        cache.tryAcquire("p-1");
        cache.tryAcquire("p-2");

        cache.invalidate("p-1");
        assertTrue(cache.tryAcquire("p-1"));

        cache.invalidateAll();
        assertTrue(cache.tryAcquire("p-2"));
    }

    @Test
    @DisplayName("Should count hits and misses")
    void testStats() {
        CaffeineEnrichmentCache cache = new CaffeineEnrichmentCache(CacheConfig.defaults());
        cache.tryAcquire("p-1");
        cache.tryAcquire("p-1");
        cache.tryAcquire("p-1");

        CacheStats stats = cache.getStats();
        assertEquals(2, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(1, stats.size());
        assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
    }

    @Test
    @DisplayName("Should always grant when deduplication is off")
    void testNoOp() {
        NoOpEnrichmentCache cache = new NoOpEnrichmentCache();

        assertTrue(cache.tryAcquire("p-1"));
        assertTrue(cache.tryAcquire("p-1"));
        assertEquals(CacheStats.empty(), cache.getStats());
    }

    @Test
    @DisplayName("Should validate configuration")
    void testConfig() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 10, true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        assertFalse(CacheConfig.disabled().enabled());
        assertEquals(0.0, CacheStats.empty().hitRate());
    }
}

package com.supplier.catalog.enrichment;

import com.supplier.catalog.cache.CacheConfig;
import com.supplier.catalog.cache.CaffeineEnrichmentCache;
import com.supplier.catalog.core.model.AssetKind;
import com.supplier.catalog.core.model.ProductAsset;
import com.supplier.catalog.jobs.AssetJobQueue;
import com.supplier.catalog.persistence.InMemoryCatalogStore;
import com.supplier.catalog.storage.StorageProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EnrichmentTriggerTest {

    private static final String PRODUCT_ID = "p-1";
    private static final String IMAGE = "https://cdn.example.com/p1.jpg";
    private static final String MANUAL = "https://cdn.example.com/p1.pdf";

    @Mock
    private EnrichmentProvider provider;

    @Mock
    private StorageProvider storage;

    private InMemoryCatalogStore store;
    private AssetJobQueue queue;
    private EnrichmentTrigger trigger;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
        queue = new AssetJobQueue(store.assetJobs(), store.productAssets(), storage, List.of());
        trigger = newTrigger(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        trigger.close();
    }

    private EnrichmentTrigger newTrigger(Duration timeout) {
        return EnrichmentTrigger.builder()
                .provider(provider)
                .cache(new CaffeineEnrichmentCache(CacheConfig.defaults()))
                .productAssetRepository(store.productAssets())
                .assetJobQueue(queue)
                .timeout(timeout)
                .build();
    }

    private static EnrichmentResponse withAssets(List<String> media, List<String> documents) {
        return new EnrichmentResponse(true, PRODUCT_ID, List.of("brand"), media, documents, List.of(), List.of());
    }

    @Test
    @DisplayName("Should register returned URLs as assets and queue downloads")
    void testRegistersAssets() {
        when(provider.enrichFromExternalSource(PRODUCT_ID)).thenReturn(withAssets(List.of(IMAGE), List.of(MANUAL)));

        EnrichmentOutcome outcome = trigger.enrich(PRODUCT_ID);

        assertTrue(outcome.attempted());
        assertTrue(outcome.enriched());
        assertEquals(2, outcome.jobsEnqueued());
        assertTrue(outcome.warnings().isEmpty());
        List<ProductAsset> assets = store.productAssets().findByProduct(PRODUCT_ID);
        assertEquals(2, assets.size());
        assertTrue(store.productAssets().findByProductAndSourceUrl(PRODUCT_ID, AssetKind.MEDIA, IMAGE).isPresent());
        assertTrue(store.productAssets().findByProductAndSourceUrl(PRODUCT_ID, AssetKind.DOCUMENT, MANUAL).isPresent());
        assertEquals(2, queue.stats().pending());
    }

    @Test
    @DisplayName("Should skip a product enriched recently")
    void testCacheDeduplicates() {
        when(provider.enrichFromExternalSource(PRODUCT_ID)).thenReturn(withAssets(List.of(), List.of()));

        trigger.enrich(PRODUCT_ID);
        EnrichmentOutcome second = trigger.enrich(PRODUCT_ID);

        assertFalse(second.attempted());
        verify(provider, times(1)).enrichFromExternalSource(PRODUCT_ID);
    }

    @Test
    @DisplayName("Should not duplicate assets or jobs for known URLs")
    void testKnownAssetsReused() {
        when(provider.enrichFromExternalSource(PRODUCT_ID)).thenReturn(withAssets(List.of(IMAGE), List.of()));
        try (EnrichmentTrigger uncached = EnrichmentTrigger.builder()
                .provider(provider)
                .productAssetRepository(store.productAssets())
                .assetJobQueue(queue)
                .build()) {

            assertEquals(1, uncached.enrich(PRODUCT_ID).jobsEnqueued());
            assertEquals(0, uncached.enrich(PRODUCT_ID).jobsEnqueued());
        }
        assertEquals(1, store.productAssets().findByProduct(PRODUCT_ID).size());
        assertEquals(1, queue.stats().pending());
    }

    @Test
    @DisplayName("Should turn provider errors into warnings")
    void testProviderErrors() {
        when(provider.enrichFromExternalSource(PRODUCT_ID))
                .thenReturn(EnrichmentResponse.failure(PRODUCT_ID, "source returned 500"));

        EnrichmentOutcome outcome = trigger.enrich(PRODUCT_ID);

        assertTrue(outcome.attempted());
        assertFalse(outcome.enriched());
        assertEquals(List.of("Enrichment error: source returned 500"), outcome.warnings());
    }

    @Test
    @DisplayName("Should report a thrown exception and allow a retry")
    void testProviderThrows() {
        when(provider.enrichFromExternalSource(PRODUCT_ID))
                .thenThrow(new IllegalStateException("connection reset"))
                .thenReturn(withAssets(List.of(), List.of()));

        EnrichmentOutcome failed = trigger.enrich(PRODUCT_ID);
        EnrichmentOutcome retried = trigger.enrich(PRODUCT_ID);

        assertEquals(List.of("Failed to enrich product: connection reset"), failed.warnings());
        assertFalse(failed.enriched());
        assertTrue(retried.enriched());
    }

    @Test
    @DisplayName("Should give up on a provider that does not answer in time")
    void testTimeout() {
        CountDownLatch never = new CountDownLatch(1);
        when(provider.enrichFromExternalSource(PRODUCT_ID)).thenAnswer(invocation -> {
            never.await();
            return withAssets(List.of(), List.of());
        });
        trigger.close();
        trigger = newTrigger(Duration.ofSeconds(1));

        EnrichmentOutcome outcome = trigger.enrich(PRODUCT_ID);

        assertTrue(outcome.attempted());
        assertFalse(outcome.enriched());
        assertEquals(List.of("Enrichment timed out after 1s"), outcome.warnings());
    }

    @Test
    @DisplayName("Should reject a non-positive timeout")
    void testInvalidTimeout() {
        assertThrows(IllegalArgumentException.class, () -> EnrichmentTrigger.builder().timeout(Duration.ZERO));
    }
}

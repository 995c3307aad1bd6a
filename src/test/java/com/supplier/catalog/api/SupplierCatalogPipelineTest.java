package com.supplier.catalog.api;

import com.supplier.catalog.audit.AuditAction;
import com.supplier.catalog.bulk.ImportResult;
import com.supplier.catalog.bulk.RowResult;
import com.supplier.catalog.core.model.AssetJobType;
import com.supplier.catalog.core.model.MatchMethod;
import com.supplier.catalog.core.model.SupplierItem;
import com.supplier.catalog.core.model.UploadStatus;
import com.supplier.catalog.enrichment.EnrichmentProvider;
import com.supplier.catalog.enrichment.EnrichmentResponse;
import com.supplier.catalog.jobs.AssetDownloader;
import com.supplier.catalog.jobs.AssetJobResult;
import com.supplier.catalog.jobs.DownloadedAsset;
import com.supplier.catalog.metrics.MicrometerMetricsService;
import com.supplier.catalog.persistence.InMemoryCatalogStore;
import com.supplier.catalog.review.ProductData;
import com.supplier.catalog.storage.LocalStorageProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("SupplierCatalogPipeline Tests")
@ExtendWith(MockitoExtension.class)
class SupplierCatalogPipelineTest {

    private static final String SUPPLIER = "SUP-1";

    @TempDir
    Path storageDir;

    @Mock
    private EnrichmentProvider enrichmentProvider;

    @Mock
    private AssetDownloader mediaDownloader;

    @Test
    @DisplayName("Should import, enrich and download assets end to end")
    void testImportEnrichDownload() {
        when(mediaDownloader.getJobType()).thenReturn(AssetJobType.MEDIA_DOWNLOAD);
        when(mediaDownloader.getStorageFolder()).thenReturn("media");
        when(mediaDownloader.download("https://cdn.example.com/gauze.jpg")).thenReturn(new DownloadedAsset(
                "jpeg".getBytes(StandardCharsets.UTF_8), "image/jpeg", "gauze.jpg"));
        when(enrichmentProvider.enrichFromExternalSource(anyString())).thenAnswer(invocation ->
                new EnrichmentResponse(true, invocation.getArgument(0), List.of("brand"),
                        List.of("https://cdn.example.com/gauze.jpg"), List.of(), List.of(), List.of()));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        try (SupplierCatalogPipeline pipeline = SupplierCatalogPipeline.builder()
                .enrichmentProvider(enrichmentProvider)
                .storageProvider(new LocalStorageProvider(storageDir, "http://assets.test"))
                .downloaders(List.of(mediaDownloader))
                .metricsService(new MicrometerMetricsService(registry))
                .build()) {

            ImportResult result = pipeline.importCatalog(SUPPLIER, "catalog.csv",
                    "sku,gtin,name,price\nGZ-1,4006381333931,Gauze Swabs 10x10cm,\"4,99\"", "alice");

            assertEquals(UploadStatus.COMPLETED, result.status());
            assertEquals(1, result.enrichedCount());
            assertEquals(1, pipeline.getAssetJobStats().pending());

            AssetJobResult jobs = pipeline.processAssetJobs();

            assertEquals(new AssetJobResult(1, 0, 1, 0), jobs);
            assertEquals(1, pipeline.getAssetJobStats().completed());
            assertEquals(1, pipeline.getRecentUploads(10).size());
            assertEquals(1.0, registry.find("catalog.import.rows").tag("method", "NONE").counter().count());
            assertEquals(1, registry.find("catalog.import.duration").tag("status", "COMPLETED").timer().count());
        }
    }

    @Test
    @DisplayName("Should resolve a review through the facade and audit it")
    void testReviewFlow() {
        InMemoryCatalogStore store = new InMemoryCatalogStore();
        try (SupplierCatalogPipeline pipeline = SupplierCatalogPipeline.builder()
                .store(store)
                .storageProvider(new LocalStorageProvider(storageDir, "http://assets.test"))
                .build()) {

            pipeline.importCatalog(SUPPLIER, "a.csv", "name;brand\nGauze Swabs 10x10cm;Medline", "alice");
            ImportResult second = pipeline.importCatalog("SUP-2", "b.csv",
                    "name;brand\nGauze Swabs 5x5cm;Medline", "bob");
            RowResult row = second.rows().get(0);
            assertTrue(row.needsReview());

            Page<SupplierItem> pendingReviews = pipeline.getPendingReviews(PageRequest.first(10));
            assertEquals(1, pendingReviews.totalElements());

            SupplierItem linked = pipeline.createProductAndLink(row.supplierItemId(),
                    new ProductData("Gauze Swabs 5x5cm", null, "Medline", null), "reviewer");

            assertEquals(MatchMethod.MANUAL, linked.getMatchMethod());
            assertNotEquals(row.productId(), linked.getProductId());
            assertEquals(0, pipeline.countPendingReviews());
            assertEquals(1, pipeline.getAuditService().getEntriesByAction(AuditAction.PRODUCT_CREATED).size());

            ImportResult again = pipeline.importCatalog("SUP-2", "b.csv", "name;brand\nGauze Swabs 5x5cm;Medline", "bob");
            assertEquals(linked.getProductId(), again.rows().get(0).productId());
            assertFalse(again.rows().get(0).needsReview());
        }
    }

    @Test
    @DisplayName("Should require a storage provider")
    void testStorageRequired() {
        assertThrows(NullPointerException.class, () -> SupplierCatalogPipeline.builder().build());
    }

    @Test
    @DisplayName("Should expose the default options")
    void testDefaultOptions() {
        ImportOptions options = ImportOptions.builder().defaultCurrency("chf").build();
        try (SupplierCatalogPipeline pipeline = SupplierCatalogPipeline.builder()
                .storageProvider(new LocalStorageProvider(storageDir, "http://assets.test"))
                .options(options)
                .build()) {

            assertEquals("CHF", pipeline.getDefaultOptions().getDefaultCurrency());
            ImportResult result = pipeline.importCatalog(SUPPLIER, "c.csv", "name;price\nWidget;2.50", "alice");
            assertTrue(result.isCompleted());
            verifyNoInteractions(enrichmentProvider);
        }
    }
}

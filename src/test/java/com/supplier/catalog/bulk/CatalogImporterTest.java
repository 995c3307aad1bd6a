package com.supplier.catalog.bulk;

import com.supplier.catalog.api.ImportOptions;
import com.supplier.catalog.api.SupplierCatalogPipeline;
import com.supplier.catalog.core.model.CatalogUpload;
import com.supplier.catalog.core.model.ImportRow;
import com.supplier.catalog.core.model.MatchMethod;
import com.supplier.catalog.core.model.Product;
import com.supplier.catalog.core.model.SupplierItem;
import com.supplier.catalog.core.model.UploadStatus;
import com.supplier.catalog.enrichment.EnrichmentProvider;
import com.supplier.catalog.enrichment.EnrichmentResponse;
import com.supplier.catalog.matching.MatchResult;
import com.supplier.catalog.matching.ProductMatcher;
import com.supplier.catalog.metrics.NoOpMetricsService;
import com.supplier.catalog.persistence.InMemoryCatalogStore;
import com.supplier.catalog.rules.DefaultNormalizationRules;
import com.supplier.catalog.rules.NormalizationEngine;
import com.supplier.catalog.storage.LocalStorageProvider;
import com.supplier.catalog.writer.CatalogWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogImporterTest {

    private static final String SUPPLIER = "SUP-1";
    private static final String GAUZE_GTIN = "4006381333931";

    @TempDir
    Path storageDir;

    @Mock
    private EnrichmentProvider enrichmentProvider;

    private InMemoryCatalogStore store;
    private NormalizationEngine engine;
    private SupplierCatalogPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
        engine = DefaultNormalizationRules.createDefaultEngine();
        pipeline = SupplierCatalogPipeline.builder()
                .store(store)
                .storageProvider(new LocalStorageProvider(storageDir, "http://assets.test"))
                .build();

        store.products().save(Product.builder()
                .id("p-gauze")
                .gtin(GAUZE_GTIN)
                .name("Gauze Swabs 10x10cm")
                .brand("Medline")
                .normalizedName(engine.normalizeProduct("Gauze Swabs 10x10cm", "Medline"))
                .build());
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    @Test
    @DisplayName("Should link a row with a known GTIN at full confidence")
    void testGtinMatch() {
        ImportResult result = pipeline.importCatalog(SUPPLIER, "catalog.csv",
                "sku;gtin;name\nGZ-1;4006381333931;Gauze", "buyer@example.com");

        assertEquals(UploadStatus.COMPLETED, result.status());
        assertEquals(1, result.successCount());
        RowResult row = result.rows().get(0);
        assertTrue(row.success());
        assertEquals("p-gauze", row.productId());
        assertEquals(MatchMethod.GTIN_EXACT, row.matchMethod());
        assertEquals(1.0, row.matchConfidence());
        assertFalse(row.needsReview());
    }

    @Test
    @DisplayName("Should create a product for an unknown row")
    void testCreatesUnknownProduct() {
        ImportResult result = pipeline.importCatalog(SUPPLIER, "catalog.csv",
                "sku;name;price\nW-1;Unknown Widget;4,99", "buyer@example.com");

        RowResult row = result.rows().get(0);
        assertTrue(row.success());
        assertEquals(MatchMethod.NONE, row.matchMethod());
        assertEquals(1.0, row.matchConfidence());
        assertEquals(2, store.products().count());
        assertEquals("Unknown Widget", store.products().findById(row.productId()).orElseThrow().getName());
    }

    @Test
    @DisplayName("Should not create duplicates when the same file is imported twice")
    void testIdempotentReimport() {
        String csv = "sku;gtin;name\nGZ-1;4006381333931;Gauze\nW-1;;Unknown Widget";

        ImportResult first = pipeline.importCatalog(SUPPLIER, "catalog.csv", csv, "buyer@example.com");
        ImportResult second = pipeline.importCatalog(SUPPLIER, "catalog.csv", csv, "buyer@example.com");

        assertEquals(2, second.successCount());
        assertEquals(2, store.products().count());
        assertEquals(2, store.supplierItems().findBySupplier(SUPPLIER).size());
        for (int i = 0; i < 2; i++) {
            assertEquals(first.rows().get(i).supplierItemId(), second.rows().get(i).supplierItemId());
        }
        assertEquals(MatchMethod.SKU_EXACT, second.rows().get(1).matchMethod());
    }

    @Test
    @DisplayName("Should flag low-confidence fuzzy matches for review")
    void testLowConfidenceNeedsReview() {
        ImportResult result = pipeline.importCatalog(SUPPLIER, "catalog.csv",
                "name;brand\nGauze Swabs 5x5cm;Medline", "buyer@example.com");

        RowResult row = result.rows().get(0);
        assertTrue(row.success());
        assertEquals(MatchMethod.FUZZY_NAME, row.matchMethod());
        assertTrue(row.needsReview());
        assertEquals(1, result.reviewCount());
        assertEquals(1, pipeline.countPendingReviews());
    }

    @Test
    @DisplayName("Should fail unmatched rows when product creation is disabled")
    void testLinkOnly() {
        ImportResult result = pipeline.importCatalog(SUPPLIER, "catalog.csv",
                "name\nUnknown Widget", "buyer@example.com", ImportOptions.linkOnly());

        assertEquals(UploadStatus.COMPLETED, result.status());
        assertEquals(1, result.failedCount());
        assertEquals(List.of(CatalogImporter.NO_MATCH_ERROR), result.rows().get(0).errors());
        assertEquals(1, store.products().count());
    }

    @Test
    @DisplayName("Should reject a row with nothing to match on")
    void testRowWithoutIdentifyingFields() {
        ImportResult result = pipeline.importCatalog(SUPPLIER, "catalog.csv",
                "name\n---", "buyer@example.com");

        assertEquals(UploadStatus.COMPLETED, result.status());
        assertEquals(1, result.failedCount());
        assertEquals(List.of("Row has no usable name, SKU or GTIN"), result.rows().get(0).errors());
        assertEquals(1, store.products().count());
    }

    @Test
    @DisplayName("Should report rejected lines in file order next to imported rows")
    void testRejectedRowsMerged() {
        ImportResult result = pipeline.importCatalog(SUPPLIER, "catalog.csv",
                "sku;name\nA;Widget\nB;\nC;Gadget", "buyer@example.com");

        assertEquals(3, result.totalRows());
        assertEquals(2, result.successCount());
        assertEquals(1, result.failedCount());
        RowResult rejected = result.rows().get(1);
        assertFalse(rejected.success());
        assertEquals(3, rejected.lineNumber());
        assertEquals(1, rejected.rowIndex());
    }

    @Test
    @DisplayName("Should fail the run and keep the audit record when the header is unusable")
    void testUnusableHeader() {
        ImportResult result = pipeline.importCatalog(SUPPLIER, "catalog.csv", "sku;price\nA;1", "buyer@example.com");

        assertEquals(UploadStatus.FAILED, result.status());
        assertNotNull(result.errorMessage());
        CatalogUpload upload = pipeline.getUpload(result.uploadId()).orElseThrow();
        assertEquals(UploadStatus.FAILED, upload.getStatus());
        assertEquals("sku;price\nA;1", upload.getRawContent());
        assertNotNull(upload.getCompletedAt());
    }

    @Test
    @DisplayName("Should store final counts on the upload record")
    void testUploadCounts() {
        ImportResult result = pipeline.importCatalog(SUPPLIER, "catalog.csv",
                "sku;gtin;name\nGZ-1;4006381333931;Gauze\nB;;", "buyer@example.com");

        CatalogUpload upload = pipeline.getUpload(result.uploadId()).orElseThrow();
        assertEquals(UploadStatus.COMPLETED, upload.getStatus());
        assertEquals(2, upload.getRowCount());
        assertEquals(1, upload.getSuccessCount());
        assertEquals(1, upload.getFailedCount());
        assertEquals("buyer@example.com", upload.getUploadedBy());
    }

    @Test
    @DisplayName("Should enrich products with a GTIN and queue their media")
    void testEnrichment() {
        when(enrichmentProvider.enrichFromExternalSource("p-gauze")).thenReturn(new EnrichmentResponse(true,
                "p-gauze", List.of("description"), List.of("https://cdn.example.com/gauze.jpg"),
                List.of("https://cdn.example.com/gauze.pdf"), List.of(), List.of()));
        SupplierCatalogPipeline enriching = SupplierCatalogPipeline.builder()
                .store(store)
                .enrichmentProvider(enrichmentProvider)
                .storageProvider(new LocalStorageProvider(storageDir, "http://assets.test"))
                .build();

        try (enriching) {
            ImportResult result = enriching.importCatalog(SUPPLIER, "catalog.csv",
                    "gtin;name\n4006381333931;Gauze\n;Unknown Widget", "buyer@example.com");

            assertTrue(result.rows().get(0).enriched());
            assertFalse(result.rows().get(1).enriched());
            assertEquals(1, result.enrichedCount());
            assertEquals(2, enriching.getAssetJobStats().pending());
            verify(enrichmentProvider, times(1)).enrichFromExternalSource(anyString());
        }
    }

    @Test
    @DisplayName("Should not call the provider when auto-enrich is off")
    void testAutoEnrichDisabled() {
        SupplierCatalogPipeline enriching = SupplierCatalogPipeline.builder()
                .store(store)
                .enrichmentProvider(enrichmentProvider)
                .storageProvider(new LocalStorageProvider(storageDir, "http://assets.test"))
                .build();

        try (enriching) {
            ImportOptions options = ImportOptions.builder().autoEnrich(false).build();
            ImportResult result = enriching.importCatalog(SUPPLIER, "catalog.csv",
                    "gtin;name\n4006381333931;Gauze", "buyer@example.com", options);

            assertEquals(0, result.enrichedCount());
            verify(enrichmentProvider, never()).enrichFromExternalSource(any());
        }
    }

    @Test
    @DisplayName("Should attach enrichment failures as row warnings")
    void testEnrichmentFailureIsWarning() {
        when(enrichmentProvider.enrichFromExternalSource("p-gauze")).thenThrow(new IllegalStateException("down"));
        SupplierCatalogPipeline enriching = SupplierCatalogPipeline.builder()
                .store(store)
                .enrichmentProvider(enrichmentProvider)
                .storageProvider(new LocalStorageProvider(storageDir, "http://assets.test"))
                .build();

        try (enriching) {
            ImportResult result = enriching.importCatalog(SUPPLIER, "catalog.csv",
                    "gtin;name\n4006381333931;Gauze", "buyer@example.com");

            RowResult row = result.rows().get(0);
            assertTrue(row.success());
            assertFalse(row.enriched());
            assertTrue(row.warnings().stream().anyMatch(w -> w.contains("down")));
        }
    }

    @Test
    @DisplayName("Should report progress every hundred rows and at the end")
    void testProgress() {
        StringBuilder csv = new StringBuilder("sku;name\n");
        for (int i = 0; i < 150; i++) {
            csv.append("SKU-").append(i).append(";Widget Model ").append(i).append('\n');
        }
        List<Long> reported = new ArrayList<>();

        pipeline.importCatalog(SUPPLIER, "big.csv", csv.toString(), "buyer@example.com", ImportOptions.defaults(),
                (processed, total, message) -> reported.add(processed));

        assertEquals(List.of(100L, 150L), reported);
    }

    @Test
    @DisplayName("Should import rows parsed elsewhere")
    void testImportRows() {
        ImportRow row = ImportRow.builder().gtin(GAUZE_GTIN).name("Gauze").currency("EUR").build();

        ImportResult result = pipeline.importRows(SUPPLIER, List.of(row), ImportOptions.defaults());

        assertEquals(1, result.successCount());
        assertEquals(0, result.rows().get(0).lineNumber());
        assertNull(pipeline.getUpload(result.uploadId()).orElseThrow().getRawContent());
    }

    @Test
    @DisplayName("Should apply import defaults to rows parsed elsewhere")
    void testImportRowsAppliesDefaults() {
        ImportOptions usd = ImportOptions.builder().defaultCurrency("USD").build();
        ImportRow noCurrency = ImportRow.builder().name("Unknown Widget").build();
        ImportRow messy = ImportRow.builder()
                .name("Spare Handle")
                .sku("H-1")
                .currency("chf")
                .unitPrice(new BigDecimal("-3.5"))
                .minOrderQty(0)
                .build();

        ImportResult result = pipeline.importRows(SUPPLIER, List.of(noCurrency, messy), usd);

        assertEquals(2, result.successCount());
        SupplierItem first = store.supplierItems().findById(result.rows().get(0).supplierItemId()).orElseThrow();
        assertEquals("USD", first.getCurrency());
        assertEquals(1, first.getMinOrderQty());

        SupplierItem second = store.supplierItems().findById(result.rows().get(1).supplierItemId()).orElseThrow();
        assertEquals("CHF", second.getCurrency());
        assertNull(second.getUnitPrice());
        assertEquals(1, second.getMinOrderQty());
        assertTrue(result.rows().get(1).warnings().contains("Negative price ignored: -3.5"));
        assertTrue(result.rows().get(1).warnings().contains("Minimum order quantity must be at least 1: 0"));
    }

    @Test
    @DisplayName("Should reject a blank supplier id")
    void testBlankSupplier() {
        assertThrows(IllegalArgumentException.class,
                () -> pipeline.importCatalog(" ", "catalog.csv", "name\nX", "buyer@example.com"));
    }

    @Test
    @DisplayName("Should abort the run on an unexpected error but keep rows already written")
    void testAbortKeepsWrittenRows() {
        ProductMatcher matcher = mock(ProductMatcher.class);
        when(matcher.match(any(), anyString()))
                .thenReturn(MatchResult.noMatch(List.of()))
                .thenThrow(new IllegalStateException("index corrupted"));
        CatalogImporter importer = new CatalogImporter(store.uploads(), new CsvCatalogParser(), matcher,
                new CatalogWriter(store.products(), store.supplierItems(), store, engine), null,
                new NoOpMetricsService());

        ImportResult result = importer.importCatalog(SUPPLIER, "catalog.csv", "name\nFirst\nSecond\nThird",
                ImportOptions.defaults(), "buyer@example.com");

        assertEquals(UploadStatus.FAILED, result.status());
        assertEquals("index corrupted", result.errorMessage());
        assertEquals(2, result.rows().size());
        assertTrue(result.rows().get(0).success());
        assertFalse(result.rows().get(1).success());
        assertEquals(1, result.successCount());
        assertEquals(1, result.failedCount());
        assertEquals(2, store.products().count());
        assertEquals(UploadStatus.FAILED, store.uploads().findById(result.uploadId()).orElseThrow().getStatus());
    }
}

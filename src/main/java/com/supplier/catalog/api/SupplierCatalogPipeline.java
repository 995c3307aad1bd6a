package com.supplier.catalog.api;

import com.supplier.catalog.audit.AuditService;
import com.supplier.catalog.bulk.CatalogImporter;
import com.supplier.catalog.bulk.CsvCatalogParser;
import com.supplier.catalog.bulk.ImportResult;
import com.supplier.catalog.bulk.ProgressCallback;
import com.supplier.catalog.cache.CacheConfig;
import com.supplier.catalog.cache.CaffeineEnrichmentCache;
import com.supplier.catalog.cache.EnrichmentCache;
import com.supplier.catalog.cache.NoOpEnrichmentCache;
import com.supplier.catalog.core.model.CatalogUpload;
import com.supplier.catalog.core.model.ImportRow;
import com.supplier.catalog.core.model.SupplierItem;
import com.supplier.catalog.enrichment.EnrichmentProvider;
import com.supplier.catalog.enrichment.EnrichmentTrigger;
import com.supplier.catalog.jobs.AssetDownloader;
import com.supplier.catalog.jobs.AssetJobQueue;
import com.supplier.catalog.jobs.AssetJobResult;
import com.supplier.catalog.jobs.AssetJobStats;
import com.supplier.catalog.jobs.AssetQueueConfig;
import com.supplier.catalog.jobs.HttpAssetDownloader;
import com.supplier.catalog.matching.MatcherConfig;
import com.supplier.catalog.matching.ProductMatcher;
import com.supplier.catalog.metrics.MetricsService;
import com.supplier.catalog.metrics.NoOpMetricsService;
import com.supplier.catalog.persistence.AssetJobRepository;
import com.supplier.catalog.persistence.CatalogUploadRepository;
import com.supplier.catalog.persistence.InMemoryCatalogStore;
import com.supplier.catalog.persistence.ProductAssetRepository;
import com.supplier.catalog.persistence.ProductRepository;
import com.supplier.catalog.persistence.SupplierItemRepository;
import com.supplier.catalog.persistence.TransactionManager;
import com.supplier.catalog.review.ProductData;
import com.supplier.catalog.review.ReviewService;
import com.supplier.catalog.rules.DefaultNormalizationRules;
import com.supplier.catalog.rules.NormalizationEngine;
import com.supplier.catalog.similarity.BlockingKeyStrategy;
import com.supplier.catalog.similarity.TokenBlockingKeyStrategy;
import com.supplier.catalog.storage.StorageProvider;
import com.supplier.catalog.writer.CatalogWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the supplier catalog pipeline: catalog import, manual review and
 * the asset download queue.
 *
 * <pre>
 * SupplierCatalogPipeline pipeline = SupplierCatalogPipeline.builder()
 *     .storageProvider(new LocalStorageProvider(Path.of("/var/catalog/files"), "https://cdn.example.com/files"))
 *     .enrichmentProvider(HttpEnrichmentProvider.builder()
 *         .baseUrl("https://productdata.example.com/api/v1")
 *         .productRepository(store.products())
 *         .build())
 *     .store(store)
 *     .build();
 *
 * ImportResult result = pipeline.importCatalog("supplier-42", "catalog.csv", csv, "jane");
 * pipeline.processAssetJobs();
 * </pre>
 *
 * <p>Without an enrichment provider rows are never enriched, whatever the import options say.</p>
 */
public class SupplierCatalogPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SupplierCatalogPipeline.class);

    private final CatalogImporter importer;
    private final CatalogUploadRepository uploads;
    private final ReviewService reviewService;
    private final AssetJobQueue assetJobQueue;
    private final AuditService auditService;
    private final EnrichmentTrigger enrichmentTrigger;
    private final ImportOptions defaultOptions;

    private SupplierCatalogPipeline(Builder builder) {
        this.defaultOptions = builder.options;
        this.uploads = builder.uploads;
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();

        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        NormalizationEngine normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        List<AssetDownloader> downloaders = builder.downloaders != null
                ? builder.downloaders : List.of(HttpAssetDownloader.media(), HttpAssetDownloader.documents());

        this.assetJobQueue = new AssetJobQueue(builder.assetJobs, builder.productAssets, builder.storageProvider,
                downloaders, builder.assetQueueConfig, metrics, builder.clock);

        if (builder.enrichmentProvider != null) {
            EnrichmentCache cache = builder.cacheConfig.enabled()
                    ? new CaffeineEnrichmentCache(builder.cacheConfig) : new NoOpEnrichmentCache();
            this.enrichmentTrigger = EnrichmentTrigger.builder()
                    .provider(builder.enrichmentProvider)
                    .cache(cache)
                    .productAssetRepository(builder.productAssets)
                    .assetJobQueue(assetJobQueue)
                    .metrics(metrics)
                    .timeout(builder.enrichmentTimeout)
                    .build();
        } else {
            this.enrichmentTrigger = null;
        }

        ProductMatcher matcher = new ProductMatcher(builder.products, builder.supplierItems, normalizationEngine,
                builder.blockingKeyStrategy, builder.matcherConfig);
        CatalogWriter writer = new CatalogWriter(builder.products, builder.supplierItems,
                builder.transactionManager, normalizationEngine);
        this.importer = new CatalogImporter(uploads, new CsvCatalogParser(), matcher, writer,
                enrichmentTrigger, metrics);
        this.reviewService = new ReviewService(builder.products, builder.supplierItems,
                builder.transactionManager, normalizationEngine, auditService, enrichmentTrigger);

        log.info("SupplierCatalogPipeline initialized: enrichment={}, storage={}",
                enrichmentTrigger != null ? enrichmentTrigger.getProviderName() : "disabled",
                builder.storageProvider.getProviderId());
    }

    // Import

    public ImportResult importCatalog(String globalSupplierId, String filename, String rawContent, String uploadedBy) {
        return importCatalog(globalSupplierId, filename, rawContent, uploadedBy, defaultOptions);
    }

    public ImportResult importCatalog(String globalSupplierId, String filename, String rawContent, String uploadedBy,
                                      ImportOptions options) {
        return importer.importCatalog(globalSupplierId, filename, rawContent, options, uploadedBy);
    }

    public ImportResult importCatalog(String globalSupplierId, String filename, String rawContent, String uploadedBy,
                                      ImportOptions options, ProgressCallback callback) {
        return importer.importCatalog(globalSupplierId, filename, rawContent, options, uploadedBy, callback);
    }

    public ImportResult importRows(String globalSupplierId, List<ImportRow> rows, ImportOptions options) {
        return importer.importCatalog(globalSupplierId, rows, options);
    }

    public Optional<CatalogUpload> getUpload(String uploadId) {
        return uploads.findById(uploadId);
    }

    public List<CatalogUpload> getRecentUploads(int limit) {
        return uploads.findRecent(limit);
    }

    // Asset jobs

    public AssetJobResult processAssetJobs() {
        return assetJobQueue.processBatch();
    }

    public AssetJobResult processAssetJobs(int batchSize) {
        return assetJobQueue.processBatch(batchSize);
    }

    public int cleanupAssetJobs() {
        return assetJobQueue.cleanup();
    }

    public int cleanupAssetJobs(int daysOld) {
        return assetJobQueue.cleanup(daysOld);
    }

    public int releaseStaleAssetJobs() {
        return assetJobQueue.releaseStaleJobs();
    }

    public AssetJobStats getAssetJobStats() {
        return assetJobQueue.stats();
    }

    // Review

    public SupplierItem confirmMatch(String supplierItemId, String actor) {
        return reviewService.confirmMatch(supplierItemId, actor);
    }

    public SupplierItem changeProduct(String supplierItemId, String newProductId, String actor) {
        return reviewService.changeProduct(supplierItemId, newProductId, actor);
    }

    public SupplierItem createProductAndLink(String supplierItemId, ProductData productData, String actor) {
        return reviewService.createProductAndLink(supplierItemId, productData, actor);
    }

    public SupplierItem markIgnored(String supplierItemId, String actor) {
        return reviewService.markIgnored(supplierItemId, actor);
    }

    public Page<SupplierItem> getPendingReviews(PageRequest page) {
        return reviewService.getPendingReviews(page);
    }

    public long countPendingReviews() {
        return reviewService.countPending();
    }

    public ReviewService getReviewService() {
        return reviewService;
    }

    public AssetJobQueue getAssetJobQueue() {
        return assetJobQueue;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public ImportOptions getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public void close() {
        if (enrichmentTrigger != null) {
            enrichmentTrigger.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ProductRepository products;
        private SupplierItemRepository supplierItems;
        private ProductAssetRepository productAssets;
        private CatalogUploadRepository uploads;
        private AssetJobRepository assetJobs;
        private TransactionManager transactionManager;
        private NormalizationEngine normalizationEngine;
        private BlockingKeyStrategy blockingKeyStrategy;
        private MatcherConfig matcherConfig = MatcherConfig.defaults();
        private EnrichmentProvider enrichmentProvider;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private Duration enrichmentTimeout = EnrichmentTrigger.DEFAULT_TIMEOUT;
        private StorageProvider storageProvider;
        private List<AssetDownloader> downloaders;
        private AssetQueueConfig assetQueueConfig = AssetQueueConfig.defaults();
        private MetricsService metricsService;
        private AuditService auditService;
        private ImportOptions options = ImportOptions.defaults();
        private Clock clock = Clock.systemUTC();

        /**
         * Uses the in-memory store for all records and transactions.
         */
        public Builder store(InMemoryCatalogStore store) {
            this.products = store.products();
            this.supplierItems = store.supplierItems();
            this.productAssets = store.productAssets();
            this.uploads = store.uploads();
            this.assetJobs = store.assetJobs();
            this.transactionManager = store;
            return this;
        }

        public Builder products(ProductRepository products) {
            this.products = products;
            return this;
        }

        public Builder supplierItems(SupplierItemRepository supplierItems) {
            this.supplierItems = supplierItems;
            return this;
        }

        public Builder productAssets(ProductAssetRepository productAssets) {
            this.productAssets = productAssets;
            return this;
        }

        public Builder uploads(CatalogUploadRepository uploads) {
            this.uploads = uploads;
            return this;
        }

        public Builder assetJobs(AssetJobRepository assetJobs) {
            this.assetJobs = assetJobs;
            return this;
        }

        public Builder transactionManager(TransactionManager transactionManager) {
            this.transactionManager = transactionManager;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        /**
         * Must match the strategy the product repository indexes with.
         */
        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        public Builder matcherConfig(MatcherConfig matcherConfig) {
            this.matcherConfig = matcherConfig;
            return this;
        }

        public Builder enrichmentProvider(EnrichmentProvider enrichmentProvider) {
            this.enrichmentProvider = enrichmentProvider;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder enrichmentTimeout(Duration enrichmentTimeout) {
            this.enrichmentTimeout = enrichmentTimeout;
            return this;
        }

        public Builder storageProvider(StorageProvider storageProvider) {
            this.storageProvider = storageProvider;
            return this;
        }

        public Builder downloaders(List<AssetDownloader> downloaders) {
            this.downloaders = List.copyOf(downloaders);
            return this;
        }

        public Builder assetQueueConfig(AssetQueueConfig assetQueueConfig) {
            this.assetQueueConfig = assetQueueConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder options(ImportOptions options) {
            this.options = options;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public SupplierCatalogPipeline build() {
            Objects.requireNonNull(storageProvider, "storageProvider is required");
            if (blockingKeyStrategy == null) {
                blockingKeyStrategy = new TokenBlockingKeyStrategy();
            }
            if (products == null && supplierItems == null && productAssets == null
                    && uploads == null && assetJobs == null && transactionManager == null) {
                store(new InMemoryCatalogStore(blockingKeyStrategy));
            }
            Objects.requireNonNull(products, "products is required");
            Objects.requireNonNull(supplierItems, "supplierItems is required");
            Objects.requireNonNull(productAssets, "productAssets is required");
            Objects.requireNonNull(uploads, "uploads is required");
            Objects.requireNonNull(assetJobs, "assetJobs is required");
            Objects.requireNonNull(transactionManager, "transactionManager is required");
            return new SupplierCatalogPipeline(this);
        }
    }
}

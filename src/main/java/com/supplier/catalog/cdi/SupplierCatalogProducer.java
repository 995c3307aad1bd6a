package com.supplier.catalog.cdi;

import com.supplier.catalog.api.ImportOptions;
import com.supplier.catalog.api.SupplierCatalogPipeline;
import com.supplier.catalog.cache.CacheConfig;
import com.supplier.catalog.enrichment.EnrichmentProvider;
import com.supplier.catalog.enrichment.HttpEnrichmentProvider;
import com.supplier.catalog.jobs.AssetJobQueue;
import com.supplier.catalog.jobs.AssetQueueConfig;
import com.supplier.catalog.matching.MatcherConfig;
import com.supplier.catalog.metrics.MetricsService;
import com.supplier.catalog.metrics.MicrometerMetricsService;
import com.supplier.catalog.metrics.NoOpMetricsService;
import com.supplier.catalog.persistence.InMemoryCatalogStore;
import com.supplier.catalog.review.ReviewService;
import com.supplier.catalog.similarity.TokenBlockingKeyStrategy;
import com.supplier.catalog.storage.LocalStorageProvider;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the catalog pipeline from MicroProfile Config properties.
 *
 * <p>Minimal configuration:</p>
 * <pre>
 * supplier-catalog:
 *   storage:
 *     base-dir: /var/lib/supplier-catalog/assets
 *     base-url: https://cdn.example.com/assets
 * </pre>
 *
 * <p>Enrichment stays off until {@code supplier-catalog.enrichment.enabled} is true and a
 * base URL is set. A {@link MeterRegistry} bean, if present, receives the pipeline metrics.</p>
 */
@ApplicationScoped
public class SupplierCatalogProducer {

    private static final Logger log = LoggerFactory.getLogger(SupplierCatalogProducer.class);

    // ── Storage ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "supplier-catalog.storage.base-dir", defaultValue = "./data/assets")
    String storageBaseDir;

    @Inject
    @ConfigProperty(name = "supplier-catalog.storage.base-url", defaultValue = "http://localhost:8080/assets")
    String storageBaseUrl;

    // ── Import ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "supplier-catalog.import.auto-enrich", defaultValue = "true")
    boolean autoEnrich;

    @Inject
    @ConfigProperty(name = "supplier-catalog.import.create-new-products", defaultValue = "true")
    boolean createNewProducts;

    @Inject
    @ConfigProperty(name = "supplier-catalog.import.skip-invalid-rows", defaultValue = "true")
    boolean skipInvalidRows;

    @Inject
    @ConfigProperty(name = "supplier-catalog.import.min-auto-match-confidence", defaultValue = "0.90")
    double minAutoMatchConfidence;

    @Inject
    @ConfigProperty(name = "supplier-catalog.import.default-currency", defaultValue = "EUR")
    String defaultCurrency;

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "supplier-catalog.matcher.fuzzy-enabled", defaultValue = "true")
    boolean fuzzyEnabled;

    @Inject
    @ConfigProperty(name = "supplier-catalog.matcher.fuzzy-floor", defaultValue = "0.5")
    double fuzzyFloor;

    // ── Enrichment ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "supplier-catalog.enrichment.enabled", defaultValue = "false")
    boolean enrichmentEnabled;

    @Inject
    @ConfigProperty(name = "supplier-catalog.enrichment.base-url")
    Optional<String> enrichmentBaseUrl;

    @Inject
    @ConfigProperty(name = "supplier-catalog.enrichment.api-key")
    Optional<String> enrichmentApiKey;

    @Inject
    @ConfigProperty(name = "supplier-catalog.enrichment.timeout-seconds", defaultValue = "10")
    int enrichmentTimeoutSeconds;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "supplier-catalog.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "supplier-catalog.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "supplier-catalog.cache.ttl-seconds", defaultValue = "300")
    int cacheTtlSeconds;

    // ── Asset Jobs ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "supplier-catalog.asset-jobs.max-attempts", defaultValue = "3")
    int jobMaxAttempts;

    @Inject
    @ConfigProperty(name = "supplier-catalog.asset-jobs.batch-size", defaultValue = "10")
    int jobBatchSize;

    @Inject
    @ConfigProperty(name = "supplier-catalog.asset-jobs.retention-days", defaultValue = "7")
    int jobRetentionDays;

    @Inject
    @ConfigProperty(name = "supplier-catalog.asset-jobs.lease-minutes", defaultValue = "15")
    int jobLeaseMinutes;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public SupplierCatalogPipeline supplierCatalogPipeline() {
        log.info("Producing SupplierCatalogPipeline: storage={} enrichment={}", storageBaseDir, enrichmentEnabled);

        TokenBlockingKeyStrategy blocking = new TokenBlockingKeyStrategy();
        InMemoryCatalogStore store = new InMemoryCatalogStore(blocking);

        ImportOptions options = ImportOptions.builder()
                .autoEnrich(autoEnrich)
                .createNewProducts(createNewProducts)
                .skipInvalidRows(skipInvalidRows)
                .minAutoMatchConfidence(minAutoMatchConfidence)
                .defaultCurrency(defaultCurrency)
                .build();

        AssetQueueConfig queueConfig = AssetQueueConfig.builder()
                .maxAttempts(jobMaxAttempts)
                .defaultBatchSize(jobBatchSize)
                .retentionDays(jobRetentionDays)
                .leaseTimeout(Duration.ofMinutes(jobLeaseMinutes))
                .build();

        SupplierCatalogPipeline.Builder builder = SupplierCatalogPipeline.builder()
                .store(store)
                .blockingKeyStrategy(blocking)
                .matcherConfig(MatcherConfig.builder()
                        .fuzzyEnabled(fuzzyEnabled)
                        .fuzzyFloor(fuzzyFloor)
                        .build())
                .cacheConfig(new CacheConfig(cacheMaxSize, cacheTtlSeconds, cacheEnabled))
                .enrichmentTimeout(Duration.ofSeconds(enrichmentTimeoutSeconds))
                .storageProvider(new LocalStorageProvider(Path.of(storageBaseDir), storageBaseUrl))
                .assetQueueConfig(queueConfig)
                .metricsService(createMetricsService())
                .options(options);

        createEnrichmentProvider(store).ifPresent(builder::enrichmentProvider);
        return builder.build();
    }

    public void closePipeline(@Disposes SupplierCatalogPipeline pipeline) {
        log.info("Closing SupplierCatalogPipeline");
        pipeline.close();
    }

    @Produces
    @ApplicationScoped
    public ReviewService reviewService(SupplierCatalogPipeline pipeline) {
        return pipeline.getReviewService();
    }

    @Produces
    @ApplicationScoped
    public AssetJobQueue assetJobQueue(SupplierCatalogPipeline pipeline) {
        return pipeline.getAssetJobQueue();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private Optional<EnrichmentProvider> createEnrichmentProvider(InMemoryCatalogStore store) {
        if (!enrichmentEnabled) {
            log.info("Enrichment disabled");
            return Optional.empty();
        }
        if (enrichmentBaseUrl.isEmpty() || enrichmentBaseUrl.get().isBlank()) {
            log.warn("Enrichment enabled but supplier-catalog.enrichment.base-url is not set, disabling");
            return Optional.empty();
        }
        log.info("Enrichment enabled: baseUrl={}", enrichmentBaseUrl.get());
        return Optional.of(HttpEnrichmentProvider.builder()
                .baseUrl(enrichmentBaseUrl.get())
                .apiKey(enrichmentApiKey.orElse(null))
                .timeout(Duration.ofSeconds(enrichmentTimeoutSeconds))
                .productRepository(store.products())
                .build());
    }

    private MetricsService createMetricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }
}

package com.supplier.catalog.enrichment;

import com.supplier.catalog.cache.EnrichmentCache;
import com.supplier.catalog.cache.NoOpEnrichmentCache;
import com.supplier.catalog.core.model.AssetJobType;
import com.supplier.catalog.core.model.AssetKind;
import com.supplier.catalog.core.model.ProductAsset;
import com.supplier.catalog.jobs.AssetJobQueue;
import com.supplier.catalog.metrics.MetricsService;
import com.supplier.catalog.metrics.NoOpMetricsService;
import com.supplier.catalog.persistence.ProductAssetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Best-effort enrichment of a product after an import row or review action.
 *
 * <p>The provider call runs on a worker thread and is abandoned after the timeout.
 * Failures never propagate: they come back as warnings on the outcome. Returned
 * media and document URLs are registered as product assets and queued for
 * download when they have no stored content yet.</p>
 */
public class EnrichmentTrigger implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentTrigger.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final EnrichmentProvider provider;
    private final EnrichmentCache cache;
    private final ProductAssetRepository assets;
    private final AssetJobQueue assetJobQueue;
    private final MetricsService metrics;
    private final Duration timeout;
    private final ExecutorService executor;

    private EnrichmentTrigger(Builder builder) {
        this.provider = Objects.requireNonNull(builder.provider, "provider is required");
        this.assets = Objects.requireNonNull(builder.assets, "productAssetRepository is required");
        this.assetJobQueue = Objects.requireNonNull(builder.assetJobQueue, "assetJobQueue is required");
        this.cache = builder.cache != null ? builder.cache : new NoOpEnrichmentCache();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "catalog-enrichment-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Enriches the product unless it was enriched recently.
     */
    public EnrichmentOutcome enrich(String productId) {
        if (!cache.tryAcquire(productId)) {
            metrics.recordEnrichmentCacheHit();
            log.debug("enrichment.skipped productId={} reason=recentlyEnriched", productId);
            return EnrichmentOutcome.skipped();
        }
        metrics.recordEnrichmentCacheMiss();

        List<String> warnings = new ArrayList<>();
        EnrichmentResponse response = callProvider(productId, warnings);
        if (response == null) {
            // lookup never completed, so a later import may retry it
            cache.invalidate(productId);
            metrics.incrementEnrichment(false);
            return new EnrichmentOutcome(true, false, 0, warnings);
        }

        warnings.addAll(response.warnings());
        response.errors().forEach(error -> warnings.add("Enrichment error: " + error));
        metrics.incrementEnrichment(response.success());

        int enqueued = 0;
        if (response.hasAssets()) {
            try {
                enqueued += registerAssets(productId, AssetKind.MEDIA, response.mediaUrls());
                enqueued += registerAssets(productId, AssetKind.DOCUMENT, response.documentUrls());
            } catch (RuntimeException e) {
                log.warn("enrichment.assets.failed productId={} error={}", productId, e.getMessage(), e);
                warnings.add("Failed to register product assets: " + e.getMessage());
            }
        }

        log.info("enrichment.completed productId={} success={} fields={} jobsEnqueued={}",
                productId, response.success(), response.enrichedFields(), enqueued);
        return new EnrichmentOutcome(true, response.success(), enqueued, warnings);
    }

    private EnrichmentResponse callProvider(String productId, List<String> warnings) {
        Future<EnrichmentResponse> future = executor.submit(() -> provider.enrichFromExternalSource(productId));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("enrichment.timeout productId={} timeout={}", productId, timeout);
            warnings.add("Enrichment timed out after " + timeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("enrichment.failed productId={} error={}", productId, cause.getMessage(), cause);
            warnings.add("Failed to enrich product: " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            warnings.add("Enrichment interrupted");
        }
        return null;
    }

    private int registerAssets(String productId, AssetKind kind, List<String> urls) {
        int enqueued = 0;
        for (String url : urls) {
            ProductAsset asset = assets.findByProductAndSourceUrl(productId, kind, url)
                    .orElseGet(() -> assets.save(ProductAsset.builder()
                            .kind(kind)
                            .productId(productId)
                            .sourceUrl(url)
                            .build()));
            if (!asset.hasStoredContent()
                    && assetJobQueue.enqueue(AssetJobType.forAsset(kind), asset.getId(), productId, url)) {
                enqueued++;
            }
        }
        return enqueued;
    }

    public String getProviderName() {
        return provider.getProviderName();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EnrichmentProvider provider;
        private EnrichmentCache cache;
        private ProductAssetRepository assets;
        private AssetJobQueue assetJobQueue;
        private MetricsService metrics;
        private Duration timeout;

        public Builder provider(EnrichmentProvider provider) {
            this.provider = provider;
            return this;
        }

        public Builder cache(EnrichmentCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder productAssetRepository(ProductAssetRepository assets) {
            this.assets = assets;
            return this;
        }

        public Builder assetJobQueue(AssetJobQueue assetJobQueue) {
            this.assetJobQueue = assetJobQueue;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public EnrichmentTrigger build() {
            return new EnrichmentTrigger(this);
        }
    }
}

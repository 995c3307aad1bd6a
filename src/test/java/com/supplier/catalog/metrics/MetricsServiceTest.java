package com.supplier.catalog.metrics;

import com.supplier.catalog.core.model.AssetJobType;
import com.supplier.catalog.core.model.JobStatus;
import com.supplier.catalog.core.model.MatchMethod;
import com.supplier.catalog.core.model.UploadStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordImportDuration(UploadStatus.COMPLETED, Duration.ofMillis(100));
                noOp.incrementRowImported(MatchMethod.GTIN_EXACT, false);
                noOp.incrementRowFailed();
                noOp.recordMatchConfidence(0.85);
                noOp.incrementEnrichment(true);
                noOp.recordEnrichmentCacheHit();
                noOp.recordEnrichmentCacheMiss();
                noOp.incrementAssetJob(AssetJobType.MEDIA_DOWNLOAD, JobStatus.COMPLETED);
                noOp.recordAssetDownloadDuration(AssetJobType.MEDIA_DOWNLOAD, Duration.ofMillis(10));
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record import duration per final status")
        void recordImportDuration() {
            metrics.recordImportDuration(UploadStatus.COMPLETED, Duration.ofMillis(150));
            metrics.recordImportDuration(UploadStatus.COMPLETED, Duration.ofMillis(250));
            metrics.recordImportDuration(UploadStatus.FAILED, Duration.ofMillis(10));

            Timer timer = registry.find("catalog.import.duration").tag("status", "COMPLETED").timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(400, timer.totalTime(TimeUnit.MILLISECONDS), 1.0);
        }

        @Test
        @DisplayName("Should count imported rows by method and review flag")
        void incrementRowImported() {
            metrics.incrementRowImported(MatchMethod.FUZZY_NAME, true);
            metrics.incrementRowImported(MatchMethod.FUZZY_NAME, true);
            metrics.incrementRowImported(MatchMethod.NONE, false);

            Counter fuzzy = registry.find("catalog.import.rows")
                    .tag("method", "FUZZY_NAME")
                    .tag("review", "true")
                    .counter();
            Counter created = registry.find("catalog.import.rows").tag("method", "NONE").counter();

            assertEquals(2.0, fuzzy.count());
            assertEquals(1.0, created.count());
        }

        @Test
        @DisplayName("Should record match confidence distribution")
        void recordMatchConfidence() {
            metrics.recordMatchConfidence(0.7);
            metrics.recordMatchConfidence(0.9);

            DistributionSummary summary = registry.find("catalog.match.confidence").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(1.6, summary.totalAmount(), 1e-9);
        }

        @Test
        @DisplayName("Should count enrichment outcomes and cache lookups")
        void enrichmentCounters() {
            metrics.incrementEnrichment(true);
            metrics.incrementEnrichment(false);
            metrics.incrementEnrichment(false);
            metrics.recordEnrichmentCacheHit();
            metrics.recordEnrichmentCacheMiss();
            metrics.recordEnrichmentCacheMiss();

            assertEquals(1.0, registry.find("catalog.enrichment").tag("outcome", "success").counter().count());
            assertEquals(2.0, registry.find("catalog.enrichment").tag("outcome", "failure").counter().count());
            assertEquals(1.0, registry.find("catalog.enrichment.cache.hit").counter().count());
            assertEquals(2.0, registry.find("catalog.enrichment.cache.miss").counter().count());
        }

        @Test
        @DisplayName("Should count asset jobs and time downloads per type")
        void assetJobMetrics() {
            metrics.incrementAssetJob(AssetJobType.DOCUMENT_DOWNLOAD, JobStatus.FAILED);
            metrics.recordAssetDownloadDuration(AssetJobType.MEDIA_DOWNLOAD, Duration.ofMillis(40));
            metrics.incrementRowFailed();

            Counter failed = registry.find("catalog.asset.jobs")
                    .tag("type", "DOCUMENT_DOWNLOAD")
                    .tag("outcome", "FAILED")
                    .counter();
            Timer download = registry.find("catalog.asset.download.duration").tag("type", "MEDIA_DOWNLOAD").timer();

            assertEquals(1.0, failed.count());
            assertEquals(1, download.count());
            assertEquals(1.0, registry.find("catalog.import.rows.failed").counter().count());
        }
    }
}

package com.supplier.catalog.metrics;

import com.supplier.catalog.core.model.AssetJobType;
import com.supplier.catalog.core.model.JobStatus;
import com.supplier.catalog.core.model.MatchMethod;
import com.supplier.catalog.core.model.UploadStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code catalog.import.duration}: Timer (tag: status)</li>
 *   <li>{@code catalog.import.rows}: Counter (tags: method, review)</li>
 *   <li>{@code catalog.import.rows.failed}: Counter</li>
 *   <li>{@code catalog.match.confidence}: DistributionSummary</li>
 *   <li>{@code catalog.enrichment}: Counter (tag: outcome)</li>
 *   <li>{@code catalog.enrichment.cache.hit} / {@code .miss}: Counter</li>
 *   <li>{@code catalog.asset.jobs}: Counter (tags: type, outcome)</li>
 *   <li>{@code catalog.asset.download.duration}: Timer (tag: type)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary matchConfidenceSummary;
    private final Counter rowFailedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.matchConfidenceSummary = DistributionSummary.builder("catalog.match.confidence")
                .description("Confidence of accepted matches")
                .register(registry);
        this.rowFailedCounter = Counter.builder("catalog.import.rows.failed")
                .description("Number of rows that failed to import")
                .register(registry);
        this.cacheHitCounter = Counter.builder("catalog.enrichment.cache.hit")
                .description("Enrichment calls skipped because the product was enriched recently")
                .register(registry);
        this.cacheMissCounter = Counter.builder("catalog.enrichment.cache.miss")
                .description("Enrichment calls not found in the recent-enrichment cache")
                .register(registry);
    }

    @Override
    public void recordImportDuration(UploadStatus status, Duration duration) {
        timer("import:" + status.name(), "catalog.import.duration", "Duration of catalog import runs",
                "status", status.name()).record(duration);
    }

    @Override
    public void incrementRowImported(MatchMethod method, boolean needsReview) {
        String key = "rows:" + method.name() + ":" + needsReview;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("catalog.import.rows")
                        .description("Number of imported rows")
                        .tag("method", method.name())
                        .tag("review", Boolean.toString(needsReview))
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementRowFailed() {
        rowFailedCounter.increment();
    }

    @Override
    public void recordMatchConfidence(double confidence) {
        matchConfidenceSummary.record(confidence);
    }

    @Override
    public void incrementEnrichment(boolean success) {
        String outcome = success ? "success" : "failure";
        counterCache.computeIfAbsent("enrichment:" + outcome, k ->
                Counter.builder("catalog.enrichment")
                        .description("Number of external enrichment calls")
                        .tag("outcome", outcome)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordEnrichmentCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordEnrichmentCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void incrementAssetJob(AssetJobType type, JobStatus outcome) {
        String key = "job:" + type.name() + ":" + outcome.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("catalog.asset.jobs")
                        .description("Number of asset jobs processed")
                        .tag("type", type.name())
                        .tag("outcome", outcome.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void recordAssetDownloadDuration(AssetJobType type, Duration duration) {
        timer("download:" + type.name(), "catalog.asset.download.duration", "Duration of asset downloads",
                "type", type.name()).record(duration);
    }

    private Timer timer(String key, String name, String description, String tagKey, String tagValue) {
        return timerCache.computeIfAbsent(key, k ->
                Timer.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}

package com.supplier.catalog.metrics;

import com.supplier.catalog.core.model.AssetJobType;
import com.supplier.catalog.core.model.JobStatus;
import com.supplier.catalog.core.model.MatchMethod;
import com.supplier.catalog.core.model.UploadStatus;

import java.time.Duration;

/**
 * Discards all metrics.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordImportDuration(UploadStatus status, Duration duration) {
    }

    @Override
    public void incrementRowImported(MatchMethod method, boolean needsReview) {
    }

    @Override
    public void incrementRowFailed() {
    }

    @Override
    public void recordMatchConfidence(double confidence) {
    }

    @Override
    public void incrementEnrichment(boolean success) {
    }

    @Override
    public void recordEnrichmentCacheHit() {
    }

    @Override
    public void recordEnrichmentCacheMiss() {
    }

    @Override
    public void incrementAssetJob(AssetJobType type, JobStatus outcome) {
    }

    @Override
    public void recordAssetDownloadDuration(AssetJobType type, Duration duration) {
    }
}

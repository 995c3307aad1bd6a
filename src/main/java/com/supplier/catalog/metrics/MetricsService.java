package com.supplier.catalog.metrics;

import com.supplier.catalog.core.model.AssetJobType;
import com.supplier.catalog.core.model.JobStatus;
import com.supplier.catalog.core.model.MatchMethod;
import com.supplier.catalog.core.model.UploadStatus;

import java.time.Duration;

/**
 * Records pipeline metrics. {@link NoOpMetricsService} is the default, so the
 * library runs without a metrics backend.
 */
public interface MetricsService {

    void recordImportDuration(UploadStatus status, Duration duration);

    /**
     * A row was written; {@code method} is NONE for rows that created a product.
     */
    void incrementRowImported(MatchMethod method, boolean needsReview);

    void incrementRowFailed();

    void recordMatchConfidence(double confidence);

    void incrementEnrichment(boolean success);

    void recordEnrichmentCacheHit();

    void recordEnrichmentCacheMiss();

    /**
     * A job reached COMPLETED or FAILED in a processing pass.
     */
    void incrementAssetJob(AssetJobType type, JobStatus outcome);

    void recordAssetDownloadDuration(AssetJobType type, Duration duration);
}

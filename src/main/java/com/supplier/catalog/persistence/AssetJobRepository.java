package com.supplier.catalog.persistence;

import com.supplier.catalog.core.model.AssetJob;
import com.supplier.catalog.core.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage of asset download jobs. Status transitions go through conditional
 * updates so that concurrent workers never process the same job twice.
 */
public interface AssetJobRepository {

    AssetJob insert(AssetJob job);

    Optional<AssetJob> findById(String id);

    /**
     * The PENDING or PROCESSING job for the asset, if any.
     */
    Optional<AssetJob> findActiveByAssetId(String assetId);

    /**
     * PENDING jobs and FAILED jobs with fewer than {@code maxAttempts} attempts, oldest first.
     */
    List<AssetJob> findProcessable(int maxAttempts, int limit);

    /**
     * Moves the job to PROCESSING with attempts + 1 and processedAt = now, but only if it
     * still has the observed status and attempt count.
     *
     * @return the claimed job, or empty when another worker got there first
     */
    Optional<AssetJob> tryClaim(String jobId, JobStatus expectedStatus, int expectedAttempts, Instant now);

    /**
     * Completes a PROCESSING job.
     *
     * @return false when the job is no longer PROCESSING
     */
    boolean markCompleted(String jobId, Instant now);

    /**
     * Fails a PROCESSING job, recording the error.
     *
     * @return false when the job is no longer PROCESSING
     */
    boolean markFailed(String jobId, String error);

    /**
     * PROCESSING jobs whose claim happened before the cutoff.
     */
    List<AssetJob> findProcessingClaimedBefore(Instant cutoff);

    /**
     * Deletes COMPLETED jobs processed before the cutoff.
     *
     * @return number of jobs deleted
     */
    int deleteCompletedBefore(Instant cutoff);

    Map<JobStatus, Long> countByStatus();
}

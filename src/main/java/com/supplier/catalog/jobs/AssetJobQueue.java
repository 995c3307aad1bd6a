package com.supplier.catalog.jobs;

import com.supplier.catalog.core.exception.AssetDownloadException;
import com.supplier.catalog.core.exception.RecordNotFoundException;
import com.supplier.catalog.core.model.AssetJob;
import com.supplier.catalog.core.model.AssetJobType;
import com.supplier.catalog.core.model.JobStatus;
import com.supplier.catalog.core.model.ProductAsset;
import com.supplier.catalog.logging.LogContext;
import com.supplier.catalog.metrics.MetricsService;
import com.supplier.catalog.metrics.NoOpMetricsService;
import com.supplier.catalog.persistence.AssetJobRepository;
import com.supplier.catalog.persistence.ProductAssetRepository;
import com.supplier.catalog.storage.StorageProvider;
import com.supplier.catalog.storage.StorageUploadOptions;
import com.supplier.catalog.storage.StorageUploadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable queue of asset downloads.
 *
 * <p>Jobs are picked oldest first among PENDING jobs and FAILED jobs below the
 * attempt ceiling. Each job is claimed with a conditional update before any work,
 * so two workers running {@link #processBatch(int)} concurrently never download
 * the same asset. Job failures are recorded on the job and never thrown.</p>
 */
public class AssetJobQueue {
    private static final Logger log = LoggerFactory.getLogger(AssetJobQueue.class);

    static final String LEASE_EXPIRED = "lease expired";

    private final AssetJobRepository jobs;
    private final ProductAssetRepository assets;
    private final StorageProvider storage;
    private final Map<AssetJobType, AssetDownloader> downloaders = new EnumMap<>(AssetJobType.class);
    private final AssetQueueConfig config;
    private final MetricsService metrics;
    private final Clock clock;

    public AssetJobQueue(AssetJobRepository jobs,
                         ProductAssetRepository assets,
                         StorageProvider storage,
                         List<AssetDownloader> downloaders) {
        this(jobs, assets, storage, downloaders, AssetQueueConfig.defaults(), new NoOpMetricsService(),
                Clock.systemUTC());
    }

    public AssetJobQueue(AssetJobRepository jobs,
                         ProductAssetRepository assets,
                         StorageProvider storage,
                         List<AssetDownloader> downloaders,
                         AssetQueueConfig config,
                         MetricsService metrics,
                         Clock clock) {
        this.jobs = jobs;
        this.assets = assets;
        this.storage = storage;
        for (AssetDownloader downloader : downloaders) {
            this.downloaders.put(downloader.getJobType(), downloader);
        }
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Adds a PENDING job unless the asset already has a PENDING or PROCESSING one.
     *
     * @return true if a job was created
     */
    public synchronized boolean enqueue(AssetJobType type, String assetId, String productId, String sourceUrl) {
        Optional<AssetJob> existing = jobs.findActiveByAssetId(assetId);
        if (existing.isPresent()) {
            log.debug("assetJob.enqueue.skipped assetId={} existingJobId={}", assetId, existing.get().getId());
            return false;
        }

        AssetJob job = jobs.insert(AssetJob.builder()
                .type(type)
                .assetId(assetId)
                .productId(productId)
                .sourceUrl(sourceUrl)
                .status(JobStatus.PENDING)
                .createdAt(clock.instant())
                .build());
        log.info("assetJob.enqueued jobId={} type={} assetId={} productId={}", job.getId(), type, assetId, productId);
        return true;
    }

    /**
     * Enqueues a download for every asset of the product that has no stored content.
     *
     * @return number of jobs created
     */
    public int enqueueMissingAssets(String productId) {
        int enqueued = 0;
        for (ProductAsset asset : assets.findByProduct(productId)) {
            if (asset.hasStoredContent()) {
                continue;
            }
            if (enqueue(AssetJobType.forAsset(asset.getKind()), asset.getId(), productId, asset.getSourceUrl())) {
                enqueued++;
            }
        }
        return enqueued;
    }

    public AssetJobResult processBatch() {
        return processBatch(config.getDefaultBatchSize());
    }

    public AssetJobResult processBatch(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        List<AssetJob> candidates = jobs.findProcessable(config.getMaxAttempts(), batchSize);
        if (candidates.isEmpty()) {
            return AssetJobResult.empty();
        }

        int processed = 0;
        int errors = 0;
        int media = 0;
        int documents = 0;
        for (AssetJob candidate : candidates) {
            JobStatus outcome = processJob(candidate);
            if (outcome == JobStatus.COMPLETED) {
                processed++;
                if (candidate.getType() == AssetJobType.MEDIA_DOWNLOAD) {
                    media++;
                } else {
                    documents++;
                }
            } else if (outcome == JobStatus.FAILED) {
                errors++;
            }
        }

        AssetJobResult result = new AssetJobResult(processed, errors, media, documents);
        log.info("assetJob.batch.completed result={}", result);
        return result;
    }

    /**
     * @return COMPLETED or FAILED, or null when another worker claimed the job first
     */
    private JobStatus processJob(AssetJob candidate) {
        Optional<AssetJob> claimed = jobs.tryClaim(candidate.getId(), candidate.getStatus(),
                candidate.getAttempts(), clock.instant());
        if (claimed.isEmpty()) {
            log.debug("assetJob.claim.lost jobId={}", candidate.getId());
            return null;
        }
        AssetJob job = claimed.get();

        try (LogContext ctx = LogContext.forAssetJob(job.getId(), job.getAssetId())) {
            Instant started = clock.instant();
            try {
                store(job);
                jobs.markCompleted(job.getId(), clock.instant());
                metrics.incrementAssetJob(job.getType(), JobStatus.COMPLETED);
                metrics.recordAssetDownloadDuration(job.getType(), Duration.between(started, clock.instant()));
                log.info("assetJob.completed jobId={} type={} attempt={}", job.getId(), job.getType(), job.getAttempts());
                return JobStatus.COMPLETED;
            } catch (RuntimeException e) {
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                jobs.markFailed(job.getId(), error);
                metrics.incrementAssetJob(job.getType(), JobStatus.FAILED);
                log.warn("assetJob.failed jobId={} type={} attempt={} error={}", job.getId(), job.getType(),
                        job.getAttempts(), error);
                return JobStatus.FAILED;
            }
        }
    }

    private void store(AssetJob job) {
        ProductAsset asset = assets.findById(job.getAssetId())
                .orElseThrow(() -> new RecordNotFoundException("ProductAsset", job.getAssetId()));
        if (asset.hasStoredContent()) {
            log.debug("assetJob.alreadyStored assetId={} storageKey={}", asset.getId(), asset.getStorageKey());
            return;
        }

        AssetDownloader downloader = downloaders.get(job.getType());
        if (downloader == null) {
            throw new AssetDownloadException("No downloader registered for " + job.getType());
        }
        DownloadedAsset download = downloader.download(job.getSourceUrl());
        StorageUploadResult stored = storage.upload(download.content(),
                StorageUploadOptions.inFolder(downloader.getStorageFolder(), download.contentType()));

        asset.attachStoredContent(storage.getProviderId(), stored.storageKey(), stored.url(),
                download.filename(), stored.contentType(), stored.fileSize());
        assets.save(asset);
    }

    public int cleanup() {
        return cleanup(config.getRetentionDays());
    }

    /**
     * Deletes COMPLETED jobs processed more than {@code daysOld} days ago.
     *
     * @return number of jobs deleted
     */
    public int cleanup(int daysOld) {
        if (daysOld < 0) {
            throw new IllegalArgumentException("daysOld must be >= 0");
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(daysOld));
        int deleted = jobs.deleteCompletedBefore(cutoff);
        if (deleted > 0) {
            log.info("assetJob.cleanup deleted={} cutoff={}", deleted, cutoff);
        }
        return deleted;
    }

    public AssetJobStats stats() {
        Map<JobStatus, Long> counts = jobs.countByStatus();
        return new AssetJobStats(
                counts.getOrDefault(JobStatus.PENDING, 0L),
                counts.getOrDefault(JobStatus.PROCESSING, 0L),
                counts.getOrDefault(JobStatus.COMPLETED, 0L),
                counts.getOrDefault(JobStatus.FAILED, 0L));
    }

    public int releaseStaleJobs() {
        return releaseStaleJobs(config.getLeaseTimeout());
    }

    /**
     * Fails PROCESSING jobs claimed longer ago than the lease, typically left behind by a
     * crashed worker. They become retry-eligible while below the attempt ceiling.
     *
     * @return number of jobs released
     */
    public int releaseStaleJobs(Duration leaseTimeout) {
        Instant cutoff = clock.instant().minus(leaseTimeout);
        int released = 0;
        for (AssetJob job : jobs.findProcessingClaimedBefore(cutoff)) {
            if (jobs.markFailed(job.getId(), LEASE_EXPIRED)) {
                released++;
                log.warn("assetJob.leaseExpired jobId={} assetId={} claimedAt={}", job.getId(), job.getAssetId(),
                        job.getProcessedAt());
            }
        }
        return released;
    }
}

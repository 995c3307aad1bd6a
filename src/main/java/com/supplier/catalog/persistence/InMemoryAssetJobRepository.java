package com.supplier.catalog.persistence;

import com.supplier.catalog.core.model.AssetJob;
import com.supplier.catalog.core.model.JobStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory asset jobs. Every status transition is a {@code compute} on the
 * job's map entry, which makes claims and completions atomic per job.
 */
public class InMemoryAssetJobRepository implements AssetJobRepository {

    private final ConcurrentMap<String, AssetJob> jobs = new ConcurrentHashMap<>();

    @Override
    public AssetJob insert(AssetJob job) {
        jobs.put(job.getId(), job.copy());
        return job;
    }

    @Override
    public Optional<AssetJob> findById(String id) {
        return Optional.ofNullable(jobs.get(id)).map(AssetJob::copy);
    }

    @Override
    public Optional<AssetJob> findActiveByAssetId(String assetId) {
        return jobs.values().stream()
                .filter(j -> j.getAssetId().equals(assetId))
                .filter(j -> j.getStatus().isActive())
                .findFirst()
                .map(AssetJob::copy);
    }

    @Override
    public List<AssetJob> findProcessable(int maxAttempts, int limit) {
        return jobs.values().stream()
                .filter(j -> j.getStatus() == JobStatus.PENDING
                        || (j.getStatus() == JobStatus.FAILED && j.getAttempts() < maxAttempts))
                .sorted(Comparator.comparing(AssetJob::getCreatedAt).thenComparing(AssetJob::getId))
                .limit(limit)
                .map(AssetJob::copy)
                .toList();
    }

    @Override
    public Optional<AssetJob> tryClaim(String jobId, JobStatus expectedStatus, int expectedAttempts, Instant now) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        AssetJob result = jobs.computeIfPresent(jobId, (id, current) -> {
            if (current.getStatus() != expectedStatus || current.getAttempts() != expectedAttempts) {
                return current;
            }
            AssetJob next = current.copy();
            next.claim(now);
            claimed.set(true);
            return next;
        });
        return claimed.get() ? Optional.of(result.copy()) : Optional.empty();
    }

    @Override
    public boolean markCompleted(String jobId, Instant now) {
        return transitionFromProcessing(jobId, job -> job.complete(now));
    }

    @Override
    public boolean markFailed(String jobId, String error) {
        return transitionFromProcessing(jobId, job -> job.fail(error));
    }

    @Override
    public List<AssetJob> findProcessingClaimedBefore(Instant cutoff) {
        return jobs.values().stream()
                .filter(j -> j.getStatus() == JobStatus.PROCESSING)
                .filter(j -> j.getProcessedAt() != null && j.getProcessedAt().isBefore(cutoff))
                .map(AssetJob::copy)
                .toList();
    }

    @Override
    public int deleteCompletedBefore(Instant cutoff) {
        AtomicInteger deleted = new AtomicInteger();
        for (String id : List.copyOf(jobs.keySet())) {
            jobs.computeIfPresent(id, (key, job) -> {
                if (job.getStatus() == JobStatus.COMPLETED
                        && job.getProcessedAt() != null
                        && job.getProcessedAt().isBefore(cutoff)) {
                    deleted.incrementAndGet();
                    return null;
                }
                return job;
            });
        }
        return deleted.get();
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        jobs.values().forEach(j -> counts.merge(j.getStatus(), 1L, Long::sum));
        return counts;
    }

    private boolean transitionFromProcessing(String jobId, Consumer<AssetJob> change) {
        AtomicBoolean applied = new AtomicBoolean(false);
        jobs.computeIfPresent(jobId, (id, current) -> {
            if (current.getStatus() != JobStatus.PROCESSING) {
                return current;
            }
            AssetJob next = current.copy();
            change.accept(next);
            applied.set(true);
            return next;
        });
        return applied.get();
    }
}

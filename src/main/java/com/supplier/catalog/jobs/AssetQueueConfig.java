package com.supplier.catalog.jobs;

import java.time.Duration;

/**
 * Retry, batch and retention settings of the asset job queue.
 */
public class AssetQueueConfig {

    private static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final int DEFAULT_BATCH_SIZE = 10;
    private static final int DEFAULT_RETENTION_DAYS = 7;
    private static final Duration DEFAULT_LEASE_TIMEOUT = Duration.ofMinutes(15);

    private final int maxAttempts;
    private final int defaultBatchSize;
    private final int retentionDays;
    private final Duration leaseTimeout;

    private AssetQueueConfig(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.defaultBatchSize = builder.defaultBatchSize;
        this.retentionDays = builder.retentionDays;
        this.leaseTimeout = builder.leaseTimeout;
    }

    /**
     * FAILED jobs with fewer attempts than this are picked up again.
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public int getDefaultBatchSize() {
        return defaultBatchSize;
    }

    /**
     * Age after which COMPLETED jobs are purged by cleanup.
     */
    public int getRetentionDays() {
        return retentionDays;
    }

    /**
     * How long a job may stay PROCESSING before {@link AssetJobQueue#releaseStaleJobs} fails it.
     */
    public Duration getLeaseTimeout() {
        return leaseTimeout;
    }

    public static AssetQueueConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private int defaultBatchSize = DEFAULT_BATCH_SIZE;
        private int retentionDays = DEFAULT_RETENTION_DAYS;
        private Duration leaseTimeout = DEFAULT_LEASE_TIMEOUT;

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder defaultBatchSize(int defaultBatchSize) {
            if (defaultBatchSize < 1) {
                throw new IllegalArgumentException("defaultBatchSize must be >= 1");
            }
            this.defaultBatchSize = defaultBatchSize;
            return this;
        }

        public Builder retentionDays(int retentionDays) {
            if (retentionDays < 0) {
                throw new IllegalArgumentException("retentionDays must be >= 0");
            }
            this.retentionDays = retentionDays;
            return this;
        }

        public Builder leaseTimeout(Duration leaseTimeout) {
            if (leaseTimeout == null || leaseTimeout.isNegative() || leaseTimeout.isZero()) {
                throw new IllegalArgumentException("leaseTimeout must be positive");
            }
            this.leaseTimeout = leaseTimeout;
            return this;
        }

        public AssetQueueConfig build() {
            return new AssetQueueConfig(this);
        }
    }
}

package com.supplier.catalog.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Background download job for one product asset.
 * At most one PENDING or PROCESSING job exists per asset id.
 */
public class AssetJob {
    private final String id;
    private final AssetJobType type;
    private final String assetId;
    private final String productId;
    private final String sourceUrl;
    private JobStatus status;
    private int attempts;
    private String lastError;
    private Instant processedAt;
    private final Instant createdAt;

    private AssetJob(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.assetId = Objects.requireNonNull(builder.assetId, "assetId is required");
        this.productId = Objects.requireNonNull(builder.productId, "productId is required");
        this.sourceUrl = Objects.requireNonNull(builder.sourceUrl, "sourceUrl is required");
        this.status = builder.status != null ? builder.status : JobStatus.PENDING;
        if (builder.attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative");
        }
        this.attempts = builder.attempts;
        this.lastError = builder.lastError;
        this.processedAt = builder.processedAt;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public AssetJobType getType() {
        return type;
    }

    public String getAssetId() {
        return assetId;
    }

    public String getProductId() {
        return productId;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public JobStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastError() {
        return lastError;
    }

    /**
     * Time of the last claim; for COMPLETED jobs this is the completion reference for retention.
     */
    public Instant getProcessedAt() {
        return processedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void claim(Instant now) {
        this.status = JobStatus.PROCESSING;
        this.attempts = attempts + 1;
        this.processedAt = now;
    }

    public void complete(Instant now) {
        this.status = JobStatus.COMPLETED;
        this.lastError = null;
        this.processedAt = now;
    }

    public void fail(String error) {
        this.status = JobStatus.FAILED;
        this.lastError = error;
    }

    public AssetJob copy() {
        return new Builder()
                .id(id)
                .type(type)
                .assetId(assetId)
                .productId(productId)
                .sourceUrl(sourceUrl)
                .status(status)
                .attempts(attempts)
                .lastError(lastError)
                .processedAt(processedAt)
                .createdAt(createdAt)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AssetJob assetJob = (AssetJob) o;
        return Objects.equals(id, assetJob.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AssetJob{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", assetId='" + assetId + '\'' +
                ", status=" + status +
                ", attempts=" + attempts +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private AssetJobType type;
        private String assetId;
        private String productId;
        private String sourceUrl;
        private JobStatus status;
        private int attempts;
        private String lastError;
        private Instant processedAt;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(AssetJobType type) {
            this.type = type;
            return this;
        }

        public Builder assetId(String assetId) {
            this.assetId = assetId;
            return this;
        }

        public Builder productId(String productId) {
            this.productId = productId;
            return this;
        }

        public Builder sourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder processedAt(Instant processedAt) {
            this.processedAt = processedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public AssetJob build() {
            return new AssetJob(this);
        }
    }
}

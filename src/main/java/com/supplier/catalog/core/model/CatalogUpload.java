package com.supplier.catalog.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Audit record of one catalog import run.
 *
 * <p>The raw content is kept unchanged so a run can be replayed. Completion
 * (COMPLETED or FAILED) is written exactly once; later attempts are rejected.</p>
 */
public class CatalogUpload {
    private final String id;
    private final String globalSupplierId;
    private final String filename;
    private final String rawContent;
    private final String uploadedBy;
    private final Instant createdAt;
    private int rowCount;
    private UploadStatus status;
    private int successCount;
    private int failedCount;
    private int reviewCount;
    private int enrichedCount;
    private String errorMessage;
    private Instant completedAt;

    private CatalogUpload(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.globalSupplierId = Objects.requireNonNull(builder.globalSupplierId, "globalSupplierId is required");
        this.filename = builder.filename;
        this.rawContent = builder.rawContent;
        this.uploadedBy = builder.uploadedBy;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.rowCount = builder.rowCount;
        this.status = builder.status != null ? builder.status : UploadStatus.RECEIVED;
        this.successCount = builder.successCount;
        this.failedCount = builder.failedCount;
        this.reviewCount = builder.reviewCount;
        this.enrichedCount = builder.enrichedCount;
        this.errorMessage = builder.errorMessage;
        this.completedAt = builder.completedAt;
    }

    public String getId() {
        return id;
    }

    public String getGlobalSupplierId() {
        return globalSupplierId;
    }

    public String getFilename() {
        return filename;
    }

    public String getRawContent() {
        return rawContent;
    }

    public String getUploadedBy() {
        return uploadedBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public int getRowCount() {
        return rowCount;
    }

    public UploadStatus getStatus() {
        return status;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailedCount() {
        return failedCount;
    }

    public int getReviewCount() {
        return reviewCount;
    }

    public int getEnrichedCount() {
        return enrichedCount;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void startProcessing(int rowCount) {
        if (status != UploadStatus.RECEIVED) {
            throw new IllegalStateException("Upload " + id + " cannot start processing from " + status);
        }
        this.rowCount = rowCount;
        this.status = UploadStatus.PROCESSING;
    }

    /**
     * Writes the terminal status and aggregate counts.
     *
     * @throws IllegalStateException if the upload is already terminal
     */
    public void complete(UploadStatus finalStatus, int successCount, int failedCount, int reviewCount,
                         int enrichedCount, String errorMessage) {
        if (finalStatus == null || !finalStatus.isTerminal()) {
            throw new IllegalArgumentException("finalStatus must be COMPLETED or FAILED");
        }
        if (status.isTerminal()) {
            throw new IllegalStateException("Upload " + id + " already completed with " + status);
        }
        this.status = finalStatus;
        this.successCount = successCount;
        this.failedCount = failedCount;
        this.reviewCount = reviewCount;
        this.enrichedCount = enrichedCount;
        this.errorMessage = errorMessage;
        this.completedAt = Instant.now();
    }

    public CatalogUpload copy() {
        return new Builder()
                .id(id)
                .globalSupplierId(globalSupplierId)
                .filename(filename)
                .rawContent(rawContent)
                .uploadedBy(uploadedBy)
                .createdAt(createdAt)
                .rowCount(rowCount)
                .status(status)
                .successCount(successCount)
                .failedCount(failedCount)
                .reviewCount(reviewCount)
                .enrichedCount(enrichedCount)
                .errorMessage(errorMessage)
                .completedAt(completedAt)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CatalogUpload that = (CatalogUpload) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CatalogUpload{" +
                "id='" + id + '\'' +
                ", supplier='" + globalSupplierId + '\'' +
                ", filename='" + filename + '\'' +
                ", status=" + status +
                ", rows=" + rowCount +
                ", success=" + successCount +
                ", failed=" + failedCount +
                ", review=" + reviewCount +
                ", enriched=" + enrichedCount +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String globalSupplierId;
        private String filename;
        private String rawContent;
        private String uploadedBy;
        private Instant createdAt;
        private int rowCount;
        private UploadStatus status;
        private int successCount;
        private int failedCount;
        private int reviewCount;
        private int enrichedCount;
        private String errorMessage;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder globalSupplierId(String globalSupplierId) {
            this.globalSupplierId = globalSupplierId;
            return this;
        }

        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public Builder rawContent(String rawContent) {
            this.rawContent = rawContent;
            return this;
        }

        public Builder uploadedBy(String uploadedBy) {
            this.uploadedBy = uploadedBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder rowCount(int rowCount) {
            this.rowCount = rowCount;
            return this;
        }

        public Builder status(UploadStatus status) {
            this.status = status;
            return this;
        }

        public Builder successCount(int successCount) {
            this.successCount = successCount;
            return this;
        }

        public Builder failedCount(int failedCount) {
            this.failedCount = failedCount;
            return this;
        }

        public Builder reviewCount(int reviewCount) {
            this.reviewCount = reviewCount;
            return this;
        }

        public Builder enrichedCount(int enrichedCount) {
            this.enrichedCount = enrichedCount;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public CatalogUpload build() {
            return new CatalogUpload(this);
        }
    }
}

package com.supplier.catalog.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Image or document attached to a product. Content is downloaded lazily;
 * until then only the source URL is known.
 */
public class ProductAsset {
    private final String id;
    private final AssetKind kind;
    private final String productId;
    private final String sourceUrl;
    private String storageProvider;
    private String storageKey;
    private String storageUrl;
    private String filename;
    private String mimeType;
    private Long fileSize;
    private final Instant createdAt;
    private Instant updatedAt;

    private ProductAsset(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.productId = Objects.requireNonNull(builder.productId, "productId is required");
        this.sourceUrl = Objects.requireNonNull(builder.sourceUrl, "sourceUrl is required");
        this.storageProvider = builder.storageProvider;
        this.storageKey = builder.storageKey;
        this.storageUrl = builder.storageUrl;
        this.filename = builder.filename;
        this.mimeType = builder.mimeType;
        this.fileSize = builder.fileSize;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public AssetKind getKind() {
        return kind;
    }

    public String getProductId() {
        return productId;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public String getStorageProvider() {
        return storageProvider;
    }

    public String getStorageKey() {
        return storageKey;
    }

    public String getStorageUrl() {
        return storageUrl;
    }

    public String getFilename() {
        return filename;
    }

    public String getMimeType() {
        return mimeType;
    }

    public Long getFileSize() {
        return fileSize;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean hasStoredContent() {
        return storageKey != null;
    }

    public void attachStoredContent(String storageProvider, String storageKey, String storageUrl,
                                    String filename, String mimeType, long fileSize) {
        this.storageProvider = storageProvider;
        this.storageKey = Objects.requireNonNull(storageKey, "storageKey is required");
        this.storageUrl = storageUrl;
        this.filename = filename;
        this.mimeType = mimeType;
        this.fileSize = fileSize;
        this.updatedAt = Instant.now();
    }

    public ProductAsset copy() {
        return new Builder()
                .id(id)
                .kind(kind)
                .productId(productId)
                .sourceUrl(sourceUrl)
                .storageProvider(storageProvider)
                .storageKey(storageKey)
                .storageUrl(storageUrl)
                .filename(filename)
                .mimeType(mimeType)
                .fileSize(fileSize)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProductAsset that = (ProductAsset) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ProductAsset{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", productId='" + productId + '\'' +
                ", sourceUrl='" + sourceUrl + '\'' +
                ", storageKey='" + storageKey + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private AssetKind kind;
        private String productId;
        private String sourceUrl;
        private String storageProvider;
        private String storageKey;
        private String storageUrl;
        private String filename;
        private String mimeType;
        private Long fileSize;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(AssetKind kind) {
            this.kind = kind;
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

        public Builder storageProvider(String storageProvider) {
            this.storageProvider = storageProvider;
            return this;
        }

        public Builder storageKey(String storageKey) {
            this.storageKey = storageKey;
            return this;
        }

        public Builder storageUrl(String storageUrl) {
            this.storageUrl = storageUrl;
            return this;
        }

        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public Builder mimeType(String mimeType) {
            this.mimeType = mimeType;
            return this;
        }

        public Builder fileSize(Long fileSize) {
            this.fileSize = fileSize;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ProductAsset build() {
            return new ProductAsset(this);
        }
    }
}

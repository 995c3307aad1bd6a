package com.supplier.catalog.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A supplier's offer of a canonical product: SKU, price and match provenance.
 * At most one non-ignored item exists per (globalSupplierId, productId).
 * Items are never deleted, only marked ignored.
 */
public class SupplierItem {
    private final String id;
    private final String globalSupplierId;
    private String productId;
    private String supplierSku;
    private String supplierName;
    private BigDecimal unitPrice;
    private String currency;
    private Integer minOrderQty;
    private Integer stockLevel;
    private Integer leadTimeDays;
    private MatchMethod matchMethod;
    private double matchConfidence;
    private boolean needsReview;
    private boolean ignored;
    private String matchedBy;
    private final Instant createdAt;
    private Instant updatedAt;

    private SupplierItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.globalSupplierId = Objects.requireNonNull(builder.globalSupplierId, "globalSupplierId is required");
        this.productId = Objects.requireNonNull(builder.productId, "productId is required");
        this.supplierSku = builder.supplierSku;
        this.supplierName = builder.supplierName;
        this.unitPrice = builder.unitPrice;
        this.currency = builder.currency;
        this.minOrderQty = builder.minOrderQty;
        this.stockLevel = builder.stockLevel;
        this.leadTimeDays = builder.leadTimeDays;
        this.matchMethod = builder.matchMethod != null ? builder.matchMethod : MatchMethod.NONE;
        if (builder.matchConfidence < 0.0 || builder.matchConfidence > 1.0) {
            throw new IllegalArgumentException("matchConfidence must be between 0.0 and 1.0");
        }
        this.matchConfidence = builder.matchConfidence;
        this.needsReview = builder.needsReview;
        this.ignored = builder.ignored;
        this.matchedBy = builder.matchedBy;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getGlobalSupplierId() {
        return globalSupplierId;
    }

    public String getProductId() {
        return productId;
    }

    public String getSupplierSku() {
        return supplierSku;
    }

    public String getSupplierName() {
        return supplierName;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public String getCurrency() {
        return currency;
    }

    public Integer getMinOrderQty() {
        return minOrderQty;
    }

    public Integer getStockLevel() {
        return stockLevel;
    }

    public Integer getLeadTimeDays() {
        return leadTimeDays;
    }

    public MatchMethod getMatchMethod() {
        return matchMethod;
    }

    public double getMatchConfidence() {
        return matchConfidence;
    }

    public boolean isNeedsReview() {
        return needsReview;
    }

    public boolean isIgnored() {
        return ignored;
    }

    public String getMatchedBy() {
        return matchedBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Overwrites the commercial fields from an imported row.
     */
    public void updateOffer(String supplierSku, String supplierName, BigDecimal unitPrice, String currency,
                            Integer minOrderQty, Integer stockLevel, Integer leadTimeDays) {
        this.supplierSku = supplierSku;
        this.supplierName = supplierName;
        this.unitPrice = unitPrice;
        this.currency = currency;
        this.minOrderQty = minOrderQty;
        this.stockLevel = stockLevel;
        this.leadTimeDays = leadTimeDays;
        touch();
    }

    /**
     * Records how this item was linked to its product.
     */
    public void recordMatch(MatchMethod method, double confidence, boolean needsReview, String matchedBy) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("matchConfidence must be between 0.0 and 1.0");
        }
        this.matchMethod = Objects.requireNonNull(method, "method is required");
        this.matchConfidence = confidence;
        this.needsReview = needsReview;
        this.matchedBy = matchedBy;
        touch();
    }

    public void relinkTo(String productId) {
        this.productId = Objects.requireNonNull(productId, "productId is required");
        touch();
    }

    public void confirm(String actor) {
        this.needsReview = false;
        this.matchedBy = actor;
        touch();
    }

    public void markIgnored(String actor) {
        this.ignored = true;
        this.needsReview = false;
        this.matchedBy = actor;
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    public SupplierItem copy() {
        return new Builder()
                .id(id)
                .globalSupplierId(globalSupplierId)
                .productId(productId)
                .supplierSku(supplierSku)
                .supplierName(supplierName)
                .unitPrice(unitPrice)
                .currency(currency)
                .minOrderQty(minOrderQty)
                .stockLevel(stockLevel)
                .leadTimeDays(leadTimeDays)
                .matchMethod(matchMethod)
                .matchConfidence(matchConfidence)
                .needsReview(needsReview)
                .ignored(ignored)
                .matchedBy(matchedBy)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SupplierItem that = (SupplierItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "SupplierItem{" +
                "id='" + id + '\'' +
                ", supplier='" + globalSupplierId + '\'' +
                ", productId='" + productId + '\'' +
                ", sku='" + supplierSku + '\'' +
                ", method=" + matchMethod +
                ", confidence=" + matchConfidence +
                ", needsReview=" + needsReview +
                ", ignored=" + ignored +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String globalSupplierId;
        private String productId;
        private String supplierSku;
        private String supplierName;
        private BigDecimal unitPrice;
        private String currency;
        private Integer minOrderQty;
        private Integer stockLevel;
        private Integer leadTimeDays;
        private MatchMethod matchMethod;
        private double matchConfidence;
        private boolean needsReview;
        private boolean ignored;
        private String matchedBy;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder globalSupplierId(String globalSupplierId) {
            this.globalSupplierId = globalSupplierId;
            return this;
        }

        public Builder productId(String productId) {
            this.productId = productId;
            return this;
        }

        public Builder supplierSku(String supplierSku) {
            this.supplierSku = supplierSku;
            return this;
        }

        public Builder supplierName(String supplierName) {
            this.supplierName = supplierName;
            return this;
        }

        public Builder unitPrice(BigDecimal unitPrice) {
            this.unitPrice = unitPrice;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder minOrderQty(Integer minOrderQty) {
            this.minOrderQty = minOrderQty;
            return this;
        }

        public Builder stockLevel(Integer stockLevel) {
            this.stockLevel = stockLevel;
            return this;
        }

        public Builder leadTimeDays(Integer leadTimeDays) {
            this.leadTimeDays = leadTimeDays;
            return this;
        }

        public Builder matchMethod(MatchMethod matchMethod) {
            this.matchMethod = matchMethod;
            return this;
        }

        public Builder matchConfidence(double matchConfidence) {
            this.matchConfidence = matchConfidence;
            return this;
        }

        public Builder needsReview(boolean needsReview) {
            this.needsReview = needsReview;
            return this;
        }

        public Builder ignored(boolean ignored) {
            this.ignored = ignored;
            return this;
        }

        public Builder matchedBy(String matchedBy) {
            this.matchedBy = matchedBy;
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

        public SupplierItem build() {
            return new SupplierItem(this);
        }
    }
}

package com.supplier.catalog.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Canonical, cross-supplier product.
 * The GTIN is globally unique when present.
 */
public class Product {
    private final String id;
    private String gtin;
    private String name;
    private String normalizedName;
    private String brand;
    private String description;
    private VerificationStatus verificationStatus;
    private final Instant createdAt;
    private Instant updatedAt;

    private Product(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.gtin = builder.gtin;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.normalizedName = builder.normalizedName;
        this.brand = builder.brand;
        this.description = builder.description;
        this.verificationStatus = builder.verificationStatus != null
                ? builder.verificationStatus : VerificationStatus.UNVERIFIED;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getGtin() {
        return gtin;
    }

    public void setGtin(String gtin) {
        this.gtin = gtin;
        this.updatedAt = Instant.now();
    }

    public boolean hasGtin() {
        return gtin != null && !gtin.isEmpty();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
        this.updatedAt = Instant.now();
    }

    /**
     * Lowercased name plus brand with punctuation stripped; feeds the fuzzy matcher's index.
     */
    public String getNormalizedName() {
        return normalizedName;
    }

    public void setNormalizedName(String normalizedName) {
        this.normalizedName = normalizedName;
        this.updatedAt = Instant.now();
    }

    public String getBrand() {
        return brand;
    }

    public void setBrand(String brand) {
        this.brand = brand;
        this.updatedAt = Instant.now();
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
        this.updatedAt = Instant.now();
    }

    public VerificationStatus getVerificationStatus() {
        return verificationStatus;
    }

    public void setVerificationStatus(VerificationStatus verificationStatus) {
        this.verificationStatus = verificationStatus;
        this.updatedAt = Instant.now();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Detached copy, used by stores that must not share mutable state with callers.
     */
    public Product copy() {
        return toBuilder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .gtin(gtin)
                .name(name)
                .normalizedName(normalizedName)
                .brand(brand)
                .description(description)
                .verificationStatus(verificationStatus)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Product product = (Product) o;
        return Objects.equals(id, product.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Product{" +
                "id='" + id + '\'' +
                ", gtin='" + gtin + '\'' +
                ", name='" + name + '\'' +
                ", brand='" + brand + '\'' +
                ", verificationStatus=" + verificationStatus +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String gtin;
        private String name;
        private String normalizedName;
        private String brand;
        private String description;
        private VerificationStatus verificationStatus;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder gtin(String gtin) {
            this.gtin = gtin;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder verificationStatus(VerificationStatus verificationStatus) {
            this.verificationStatus = verificationStatus;
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

        public Product build() {
            return new Product(this);
        }
    }
}

package com.supplier.catalog.review;

/**
 * Fields a reviewer supplies when a supplier item needs a new product.
 *
 * @param name        product name, required
 * @param gtin        optional GTIN; must pass check-digit validation when given
 * @param brand       optional brand
 * @param description optional description
 */
public record ProductData(String name, String gtin, String brand, String description) {

    public ProductData {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        name = name.trim();
        gtin = gtin != null && !gtin.isBlank() ? gtin.trim() : null;
    }
}

package com.supplier.catalog.rest.dto;

import com.supplier.catalog.review.ProductData;

/**
 * Request DTO for creating a product and linking a supplier item to it.
 */
public record CreateProductRequest(String actor, String name, String gtin, String brand, String description) {
    public CreateProductRequest {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor is required");
        }
    }

    public ProductData toProductData() {
        return new ProductData(name, gtin, brand, description);
    }
}

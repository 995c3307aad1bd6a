package com.supplier.catalog.rest.dto;

/**
 * Request DTO for re-linking a supplier item to another product.
 */
public record ChangeProductRequest(String actor, String productId) {
    public ChangeProductRequest {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor is required");
        }
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId is required");
        }
    }
}

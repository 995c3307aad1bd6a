package com.supplier.catalog.rest.dto;

/**
 * Request DTO for confirm and ignore actions.
 */
public record ReviewActionRequest(String actor) {
    public ReviewActionRequest {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor is required");
        }
    }
}

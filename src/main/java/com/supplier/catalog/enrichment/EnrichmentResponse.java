package com.supplier.catalog.enrichment;

import java.util.List;

/**
 * Result of one enrichment lookup.
 *
 * @param success        true if data was found and applied
 * @param productId      the enriched product
 * @param enrichedFields names of the product fields that were filled in
 * @param mediaUrls      image or video URLs published for the product
 * @param documentUrls   document URLs published for the product
 * @param errors         lookup failures
 * @param warnings       non-fatal findings, such as a product unknown to the source
 */
public record EnrichmentResponse(
        boolean success,
        String productId,
        List<String> enrichedFields,
        List<String> mediaUrls,
        List<String> documentUrls,
        List<String> errors,
        List<String> warnings
) {
    public EnrichmentResponse {
        enrichedFields = enrichedFields != null ? List.copyOf(enrichedFields) : List.of();
        mediaUrls = mediaUrls != null ? List.copyOf(mediaUrls) : List.of();
        documentUrls = documentUrls != null ? List.copyOf(documentUrls) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static EnrichmentResponse failure(String productId, String error) {
        return new EnrichmentResponse(false, productId, List.of(), List.of(), List.of(), List.of(error), List.of());
    }

    public static EnrichmentResponse notEnriched(String productId, String warning) {
        return new EnrichmentResponse(false, productId, List.of(), List.of(), List.of(), List.of(), List.of(warning));
    }

    public boolean hasAssets() {
        return !mediaUrls.isEmpty() || !documentUrls.isEmpty();
    }
}

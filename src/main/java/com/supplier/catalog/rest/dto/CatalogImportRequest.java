package com.supplier.catalog.rest.dto;

import com.supplier.catalog.api.ImportOptions;

/**
 * Request DTO for importing a catalog file. Option fields left null keep their defaults.
 */
public record CatalogImportRequest(
        String globalSupplierId,
        String filename,
        String content,
        String uploadedBy,
        Boolean autoEnrich,
        Boolean createNewProducts,
        Boolean skipInvalidRows,
        Double minAutoMatchConfidence,
        String defaultCurrency
) {
    public CatalogImportRequest {
        if (globalSupplierId == null || globalSupplierId.isBlank()) {
            throw new IllegalArgumentException("globalSupplierId is required");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content is required");
        }
    }

    public ImportOptions toOptions(ImportOptions defaults) {
        ImportOptions.Builder builder = ImportOptions.builder()
                .autoEnrich(autoEnrich != null ? autoEnrich : defaults.isAutoEnrich())
                .createNewProducts(createNewProducts != null ? createNewProducts : defaults.isCreateNewProducts())
                .skipInvalidRows(skipInvalidRows != null ? skipInvalidRows : defaults.isSkipInvalidRows())
                .minAutoMatchConfidence(minAutoMatchConfidence != null
                        ? minAutoMatchConfidence : defaults.getMinAutoMatchConfidence())
                .defaultCurrency(defaultCurrency != null ? defaultCurrency : defaults.getDefaultCurrency());
        return builder.build();
    }
}

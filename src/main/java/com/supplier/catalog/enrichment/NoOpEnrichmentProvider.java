package com.supplier.catalog.enrichment;

/**
 * Provider used when no external source is configured. Never enriches.
 */
public class NoOpEnrichmentProvider implements EnrichmentProvider {

    static final String NOT_CONFIGURED = "No enrichment source configured";

    @Override
    public EnrichmentResponse enrichFromExternalSource(String productId) {
        return EnrichmentResponse.notEnriched(productId, NOT_CONFIGURED);
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}

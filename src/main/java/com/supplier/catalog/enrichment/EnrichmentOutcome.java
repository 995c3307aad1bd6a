package com.supplier.catalog.enrichment;

import java.util.List;

/**
 * What an enrichment attempt did for one product.
 *
 * @param attempted    false if the product was enriched recently and the lookup was skipped
 * @param enriched     true if the source returned data for the product
 * @param jobsEnqueued asset download jobs created
 * @param warnings     failures and findings to attach to the import row
 */
public record EnrichmentOutcome(boolean attempted, boolean enriched, int jobsEnqueued, List<String> warnings) {

    public EnrichmentOutcome {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static EnrichmentOutcome skipped() {
        return new EnrichmentOutcome(false, false, 0, List.of());
    }
}

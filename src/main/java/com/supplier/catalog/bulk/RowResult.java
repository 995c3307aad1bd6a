package com.supplier.catalog.bulk;

import com.supplier.catalog.core.model.MatchMethod;

import java.util.List;

/**
 * Outcome of one catalog row.
 *
 * @param rowIndex        0-based position among the run's data rows
 * @param lineNumber      1-based line in the source file, 0 for rows not read from a file
 * @param success         whether a supplier item was written
 * @param productId       linked product, null on failure
 * @param supplierItemId  written supplier item, null on failure
 * @param matchMethod     how the product was found; NONE for a created product
 * @param matchConfidence confidence stored on the link
 * @param needsReview     whether the link awaits manual review
 * @param enriched        whether external data was applied to the product
 * @param errors          reasons the row failed
 * @param warnings        non-fatal issues
 */
public record RowResult(
        int rowIndex,
        int lineNumber,
        boolean success,
        String productId,
        String supplierItemId,
        MatchMethod matchMethod,
        Double matchConfidence,
        boolean needsReview,
        boolean enriched,
        List<String> errors,
        List<String> warnings
) {
    public RowResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static RowResult failed(int rowIndex, int lineNumber, String error, List<String> warnings) {
        return new RowResult(rowIndex, lineNumber, false, null, null, null, null, false, false,
                List.of(error), warnings);
    }
}

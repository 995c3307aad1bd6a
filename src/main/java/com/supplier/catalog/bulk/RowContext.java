package com.supplier.catalog.bulk;

import com.supplier.catalog.api.ImportOptions;

/**
 * Per-row state handed through matching, writing and enrichment.
 *
 * @param uploadId         the import run the row belongs to
 * @param globalSupplierId supplier the row is imported for
 * @param rowIndex         0-based position in the run's results
 * @param options          options of the run
 */
record RowContext(String uploadId, String globalSupplierId, int rowIndex, ImportOptions options) {
}

package com.supplier.catalog.decision;

/**
 * What the writer does with a matched (or unmatched) row.
 *
 * <p>A low-confidence match is not a separate action: it is {@link #ACCEPT} with
 * {@link Decision#needsReview()} set, so the link is written and queued for a reviewer.
 * {@link #REJECT} covers an unmatched row when product creation is disabled.</p>
 */
public enum ImportAction {
    /** Link the row to the matched product. */
    ACCEPT,
    /** Create a product from the row and link to it. */
    CREATE_NEW,
    /** Fail the row without writing anything. */
    REJECT
}

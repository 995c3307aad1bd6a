package com.supplier.catalog.core.model;

/**
 * Outcome of looking a product up in the external product-data source.
 */
public enum VerificationStatus {
    UNVERIFIED,
    VERIFIED,
    FAILED_LOOKUP
}

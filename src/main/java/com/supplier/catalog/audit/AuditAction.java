package com.supplier.catalog.audit;

/**
 * Manual actions on supplier item links that are recorded for audit.
 */
public enum AuditAction {
    MATCH_CONFIRMED,
    MATCH_PRODUCT_CHANGED,
    PRODUCT_CREATED,
    MATCH_IGNORED
}

package com.supplier.catalog.core.model;

/**
 * How a supplier item was linked to its canonical product.
 * Stored on every {@link SupplierItem} so review screens can show provenance.
 */
public enum MatchMethod {
    /**
     * Checksummed GTIN found on an existing product.
     */
    GTIN_EXACT,

    /**
     * Supplier SKU already linked for this supplier.
     */
    SKU_EXACT,

    /**
     * Normalized name and brand similarity above the floor.
     */
    FUZZY_NAME,

    /**
     * Set by a reviewer.
     */
    MANUAL,

    /**
     * No existing product matched; the product was created from the row.
     */
    NONE
}

package com.supplier.catalog.core.exception;

/**
 * Thrown when a product would take a GTIN already owned by another product.
 */
public class DuplicateGtinException extends CatalogImportException {
    private final String gtin;

    public DuplicateGtinException(String gtin, String existingProductId) {
        super("GTIN " + gtin + " already belongs to product " + existingProductId);
        this.gtin = gtin;
    }

    public String getGtin() {
        return gtin;
    }
}

package com.supplier.catalog.core.exception;

/**
 * Thrown when a write would create a second non-ignored supplier item
 * for the same supplier and product.
 */
public class DuplicateSupplierItemException extends CatalogImportException {
    private final String globalSupplierId;
    private final String productId;

    public DuplicateSupplierItemException(String globalSupplierId, String productId) {
        super("Supplier " + globalSupplierId + " already has an active item for product " + productId);
        this.globalSupplierId = globalSupplierId;
        this.productId = productId;
    }

    public String getGlobalSupplierId() {
        return globalSupplierId;
    }

    public String getProductId() {
        return productId;
    }
}

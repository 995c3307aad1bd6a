package com.supplier.catalog.persistence;

import com.supplier.catalog.api.Page;
import com.supplier.catalog.api.PageRequest;
import com.supplier.catalog.core.model.SupplierItem;

import java.util.List;
import java.util.Optional;

/**
 * Storage of supplier items. Implementations enforce that a supplier has at
 * most one non-ignored item per product.
 */
public interface SupplierItemRepository {

    /**
     * Inserts or replaces an item.
     *
     * @throws com.supplier.catalog.core.exception.DuplicateSupplierItemException if a different
     *         non-ignored item already links the same supplier and product
     */
    SupplierItem save(SupplierItem item);

    Optional<SupplierItem> findById(String id);

    /**
     * The non-ignored item linking the supplier to the product, if any.
     */
    Optional<SupplierItem> findActive(String globalSupplierId, String productId);

    /**
     * The non-ignored item of the supplier with the given SKU, compared trimmed and case-insensitively.
     */
    Optional<SupplierItem> findActiveBySku(String globalSupplierId, String supplierSku);

    List<SupplierItem> findBySupplier(String globalSupplierId);

    /**
     * Non-ignored items flagged for review, oldest first.
     */
    Page<SupplierItem> findNeedingReview(PageRequest page);

    long countNeedingReview();
}

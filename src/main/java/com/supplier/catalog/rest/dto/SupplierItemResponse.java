package com.supplier.catalog.rest.dto;

import com.supplier.catalog.core.model.MatchMethod;
import com.supplier.catalog.core.model.SupplierItem;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * REST view of a supplier item link.
 */
public record SupplierItemResponse(
        String id,
        String globalSupplierId,
        String productId,
        String supplierSku,
        String supplierName,
        BigDecimal unitPrice,
        String currency,
        MatchMethod matchMethod,
        double matchConfidence,
        boolean needsReview,
        boolean ignored,
        String matchedBy,
        Instant updatedAt
) {
    public static SupplierItemResponse from(SupplierItem item) {
        return new SupplierItemResponse(
                item.getId(),
                item.getGlobalSupplierId(),
                item.getProductId(),
                item.getSupplierSku(),
                item.getSupplierName(),
                item.getUnitPrice(),
                item.getCurrency(),
                item.getMatchMethod(),
                item.getMatchConfidence(),
                item.isNeedsReview(),
                item.isIgnored(),
                item.getMatchedBy(),
                item.getUpdatedAt()
        );
    }
}

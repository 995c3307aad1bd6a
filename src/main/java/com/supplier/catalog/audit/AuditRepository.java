package com.supplier.catalog.audit;

import java.util.List;

/**
 * Append-only storage of review audit entries.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findBySupplierItemId(String supplierItemId);

    /**
     * Gets entries that linked an item to the product or moved an item away from it.
     */
    List<AuditEntry> findByProductId(String productId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findByActorId(String actorId);

    int count();

    /**
     * Gets the most recent entries, oldest first, up to the limit.
     */
    List<AuditEntry> findRecent(int limit);
}

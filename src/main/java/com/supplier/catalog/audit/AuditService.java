package com.supplier.catalog.audit;

import com.supplier.catalog.core.model.SupplierItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Records and queries the trail of manual review actions.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    public AuditEntry recordConfirmed(SupplierItem item, String actor) {
        return record(AuditEntry.forItem(AuditAction.MATCH_CONFIRMED, item, actor).build());
    }

    public AuditEntry recordProductChanged(SupplierItem item, String previousProductId, String actor) {
        return record(AuditEntry.forItem(AuditAction.MATCH_PRODUCT_CHANGED, item, actor)
                .previousProductId(previousProductId)
                .build());
    }

    /**
     * Records a re-link to a product the reviewer just created.
     */
    public AuditEntry recordProductCreated(SupplierItem item, String previousProductId, String actor) {
        return record(AuditEntry.forItem(AuditAction.PRODUCT_CREATED, item, actor)
                .previousProductId(previousProductId)
                .build());
    }

    public AuditEntry recordIgnored(SupplierItem item, String actor) {
        return record(AuditEntry.forItem(AuditAction.MATCH_IGNORED, item, actor).build());
    }

    public AuditEntry record(AuditEntry entry) {
        AuditEntry saved = repository.save(entry);
        log.debug("audit.recorded action={} supplierItemId={} productId={} actor={}", entry.action(),
                entry.supplierItemId(), entry.productId(), entry.actorId());
        return saved;
    }

    public List<AuditEntry> getEntriesForItem(String supplierItemId) {
        return repository.findBySupplierItemId(supplierItemId);
    }

    /**
     * Gets the review history of a product, including items moved away from it.
     */
    public List<AuditEntry> getEntriesForProduct(String productId) {
        return repository.findByProductId(productId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getEntriesByActor(String actorId) {
        return repository.findByActorId(actorId);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }
}

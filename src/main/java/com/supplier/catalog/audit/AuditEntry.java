package com.supplier.catalog.audit;

import com.supplier.catalog.core.model.MatchMethod;
import com.supplier.catalog.core.model.SupplierItem;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of a manual review action on a supplier item.
 *
 * <p>The link state is captured as it was right after the action, so the trail
 * answers who linked which supplier item to which product, and how.</p>
 *
 * @param supplierItemId    the reviewed supplier item
 * @param globalSupplierId  owner of the supplier item
 * @param productId         product the item is linked to after the action
 * @param previousProductId product the item was linked to before a re-link, otherwise null
 * @param matchMethod       match method after the action
 * @param matchConfidence   match confidence after the action
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String supplierItemId,
        String globalSupplierId,
        String actorId,
        String productId,
        String previousProductId,
        MatchMethod matchMethod,
        double matchConfidence,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(supplierItemId, "supplierItemId is required");
        Objects.requireNonNull(actorId, "actorId is required");
        Objects.requireNonNull(productId, "productId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (matchConfidence < 0.0 || matchConfidence > 1.0) {
            throw new IllegalArgumentException("matchConfidence must be between 0.0 and 1.0");
        }
    }

    public boolean isRelink() {
        return previousProductId != null && !previousProductId.equals(productId);
    }

    /**
     * Concerns the product either as the new or the previous link target.
     */
    public boolean involvesProduct(String product) {
        return product.equals(productId) || product.equals(previousProductId);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts an entry from the item's state after the action.
     */
    public static Builder forItem(AuditAction action, SupplierItem item, String actorId) {
        return new Builder()
                .action(action)
                .supplierItemId(item.getId())
                .globalSupplierId(item.getGlobalSupplierId())
                .actorId(actorId)
                .productId(item.getProductId())
                .matchMethod(item.getMatchMethod())
                .matchConfidence(item.getMatchConfidence());
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private String supplierItemId;
        private String globalSupplierId;
        private String actorId;
        private String productId;
        private String previousProductId;
        private MatchMethod matchMethod;
        private double matchConfidence;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder supplierItemId(String supplierItemId) {
            this.supplierItemId = supplierItemId;
            return this;
        }

        public Builder globalSupplierId(String globalSupplierId) {
            this.globalSupplierId = globalSupplierId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder productId(String productId) {
            this.productId = productId;
            return this;
        }

        public Builder previousProductId(String previousProductId) {
            this.previousProductId = previousProductId;
            return this;
        }

        public Builder matchMethod(MatchMethod matchMethod) {
            this.matchMethod = matchMethod;
            return this;
        }

        public Builder matchConfidence(double matchConfidence) {
            this.matchConfidence = matchConfidence;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, supplierItemId, globalSupplierId, actorId, productId,
                    previousProductId, matchMethod, matchConfidence, timestamp);
        }
    }
}

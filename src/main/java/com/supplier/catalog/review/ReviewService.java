package com.supplier.catalog.review;

import com.supplier.catalog.api.Page;
import com.supplier.catalog.api.PageRequest;
import com.supplier.catalog.audit.AuditService;
import com.supplier.catalog.core.exception.DuplicateSupplierItemException;
import com.supplier.catalog.core.exception.RecordNotFoundException;
import com.supplier.catalog.core.model.MatchMethod;
import com.supplier.catalog.core.model.Product;
import com.supplier.catalog.core.model.SupplierItem;
import com.supplier.catalog.enrichment.EnrichmentOutcome;
import com.supplier.catalog.enrichment.EnrichmentTrigger;
import com.supplier.catalog.logging.LogContext;
import com.supplier.catalog.persistence.ProductRepository;
import com.supplier.catalog.persistence.SupplierItemRepository;
import com.supplier.catalog.persistence.TransactionManager;
import com.supplier.catalog.rules.Gtin;
import com.supplier.catalog.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Manual review actions on supplier item links.
 *
 * <p>Every action runs in a transaction, clears the review flag, records the reviewer
 * as {@code matchedBy} and writes an audit entry. Ignored items accept no further actions.</p>
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    static final double MANUAL_CONFIDENCE = 1.0;

    private final ProductRepository products;
    private final SupplierItemRepository supplierItems;
    private final TransactionManager transactionManager;
    private final NormalizationEngine normalizationEngine;
    private final AuditService auditService;
    private final EnrichmentTrigger enrichmentTrigger;

    /**
     * @param enrichmentTrigger may be null, in which case created products are not enriched
     */
    public ReviewService(ProductRepository products,
                         SupplierItemRepository supplierItems,
                         TransactionManager transactionManager,
                         NormalizationEngine normalizationEngine,
                         AuditService auditService,
                         EnrichmentTrigger enrichmentTrigger) {
        this.products = products;
        this.supplierItems = supplierItems;
        this.transactionManager = transactionManager;
        this.normalizationEngine = normalizationEngine;
        this.auditService = auditService;
        this.enrichmentTrigger = enrichmentTrigger;
    }

    /**
     * Accepts the current link as correct.
     */
    public SupplierItem confirmMatch(String supplierItemId, String actor) {
        requireActor(actor);
        try (LogContext ctx = LogContext.forReview(supplierItemId, actor)) {
            SupplierItem item = transactionManager.inTransaction(() -> {
                SupplierItem current = findReviewable(supplierItemId);
                current.confirm(actor);
                return supplierItems.save(current);
            });

            auditService.recordConfirmed(item, actor);
            log.info("review.confirmed supplierItemId={} productId={}", supplierItemId, item.getProductId());
            return item;
        }
    }

    /**
     * Re-links the item to another existing product, with method MANUAL and confidence 1.0.
     *
     * @throws DuplicateSupplierItemException if the supplier already has a non-ignored link to that product
     */
    public SupplierItem changeProduct(String supplierItemId, String newProductId, String actor) {
        requireActor(actor);
        try (LogContext ctx = LogContext.forReview(supplierItemId, actor)) {
            Relinked relinked = transactionManager.inTransaction(() -> {
                SupplierItem current = findReviewable(supplierItemId);
                String previousProductId = current.getProductId();
                return new Relinked(relink(current, newProductId, actor), previousProductId);
            });

            auditService.recordProductChanged(relinked.item(), relinked.previousProductId(), actor);
            log.info("review.productChanged supplierItemId={} from={} to={}", supplierItemId,
                    relinked.previousProductId(), newProductId);
            return relinked.item();
        }
    }

    /**
     * Creates a product from the reviewer's data and re-links the item to it in one
     * transaction. A product with a GTIN is then enriched on a best-effort basis.
     */
    public SupplierItem createProductAndLink(String supplierItemId, ProductData data, String actor) {
        requireActor(actor);
        if (data.gtin() != null) {
            Gtin.Validation validation = Gtin.validate(data.gtin());
            if (!validation.valid()) {
                throw new IllegalArgumentException("Invalid GTIN: " + validation.error());
            }
        }

        try (LogContext ctx = LogContext.forReview(supplierItemId, actor)) {
            Created created = transactionManager.inTransaction(() -> {
                SupplierItem current = findReviewable(supplierItemId);
                String previousProductId = current.getProductId();
                Product product = products.save(Product.builder()
                        .gtin(data.gtin() != null ? Gtin.validate(data.gtin()).normalized() : null)
                        .name(data.name())
                        .brand(data.brand())
                        .description(data.description())
                        .normalizedName(normalizationEngine.normalizeProduct(data.name(), data.brand()))
                        .build());
                return new Created(relink(current, product.getId(), actor), product, previousProductId);
            });
            Product product = created.product();

            auditService.recordProductCreated(created.item(), created.previousProductId(), actor);
            log.info("review.productCreated supplierItemId={} productId={}", supplierItemId, product.getId());

            if (product.hasGtin() && enrichmentTrigger != null) {
                EnrichmentOutcome outcome = enrichmentTrigger.enrich(product.getId());
                if (!outcome.warnings().isEmpty()) {
                    log.warn("review.enrichment.warnings productId={} warnings={}", product.getId(),
                            outcome.warnings());
                }
            }
            return created.item();
        }
    }

    /**
     * Marks the item ignored. Ignored items no longer count as the supplier's link to the product.
     */
    public SupplierItem markIgnored(String supplierItemId, String actor) {
        requireActor(actor);
        try (LogContext ctx = LogContext.forReview(supplierItemId, actor)) {
            SupplierItem item = transactionManager.inTransaction(() -> {
                SupplierItem current = findReviewable(supplierItemId);
                current.markIgnored(actor);
                return supplierItems.save(current);
            });

            auditService.recordIgnored(item, actor);
            log.info("review.ignored supplierItemId={} productId={}", supplierItemId, item.getProductId());
            return item;
        }
    }

    /**
     * Gets items awaiting review, oldest first.
     */
    public Page<SupplierItem> getPendingReviews(PageRequest page) {
        return supplierItems.findNeedingReview(page);
    }

    public long countPending() {
        return supplierItems.countNeedingReview();
    }

    private SupplierItem relink(SupplierItem item, String newProductId, String actor) {
        if (products.findById(newProductId).isEmpty()) {
            throw new RecordNotFoundException("Product", newProductId);
        }
        Optional<SupplierItem> existing = supplierItems.findActive(item.getGlobalSupplierId(), newProductId);
        if (existing.isPresent() && !existing.get().getId().equals(item.getId())) {
            throw new DuplicateSupplierItemException(item.getGlobalSupplierId(), newProductId);
        }
        item.relinkTo(newProductId);
        item.recordMatch(MatchMethod.MANUAL, MANUAL_CONFIDENCE, false, actor);
        return supplierItems.save(item);
    }

    private SupplierItem findReviewable(String supplierItemId) {
        SupplierItem item = supplierItems.findById(supplierItemId)
                .orElseThrow(() -> new RecordNotFoundException("SupplierItem", supplierItemId));
        if (item.isIgnored()) {
            throw new IllegalStateException("Supplier item is ignored: " + supplierItemId);
        }
        return item;
    }

    private record Relinked(SupplierItem item, String previousProductId) {
    }

    private record Created(SupplierItem item, Product product, String previousProductId) {
    }

    private static void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor is required");
        }
    }
}

package com.supplier.catalog.writer;

import com.supplier.catalog.core.exception.RecordNotFoundException;
import com.supplier.catalog.core.model.ImportRow;
import com.supplier.catalog.core.model.MatchMethod;
import com.supplier.catalog.core.model.Product;
import com.supplier.catalog.core.model.SupplierItem;
import com.supplier.catalog.matching.MatchResult;
import com.supplier.catalog.persistence.ProductRepository;
import com.supplier.catalog.persistence.SupplierItemRepository;
import com.supplier.catalog.persistence.TransactionManager;
import com.supplier.catalog.rules.Gtin;
import com.supplier.catalog.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Writes the outcome of a row decision. Each call runs in its own transaction, so
 * the find-then-write on the (supplier, product) link cannot interleave with
 * another writer and a failure leaves nothing behind.
 */
public class CatalogWriter {
    private static final Logger log = LoggerFactory.getLogger(CatalogWriter.class);

    public static final String SYSTEM_ACTOR = "system";

    /** Confidence stored on links to products created from the row itself. */
    static final double CREATED_CONFIDENCE = 1.0;

    private final ProductRepository products;
    private final SupplierItemRepository supplierItems;
    private final TransactionManager transactionManager;
    private final NormalizationEngine normalizationEngine;

    public CatalogWriter(ProductRepository products,
                         SupplierItemRepository supplierItems,
                         TransactionManager transactionManager,
                         NormalizationEngine normalizationEngine) {
        this.products = products;
        this.supplierItems = supplierItems;
        this.transactionManager = transactionManager;
        this.normalizationEngine = normalizationEngine;
    }

    /**
     * Creates a product from the row and links the supplier to it with method NONE.
     * Only a valid GTIN is copied onto the product.
     */
    public WriteResult createProductAndItem(String globalSupplierId, ImportRow row) {
        return transactionManager.inTransaction(() -> {
            Gtin.Validation gtin = Gtin.validate(row.gtin());
            Product product = products.save(Product.builder()
                    .gtin(gtin.valid() ? gtin.normalized() : null)
                    .name(row.name())
                    .brand(row.brand())
                    .description(row.description())
                    .normalizedName(normalizationEngine.normalizeProduct(row.name(), row.brand()))
                    .build());

            SupplierItem item = supplierItems.save(newItem(globalSupplierId, product.getId(), row)
                    .matchMethod(MatchMethod.NONE)
                    .matchConfidence(CREATED_CONFIDENCE)
                    .needsReview(false)
                    .matchedBy(SYSTEM_ACTOR)
                    .build());

            log.debug("writer.created supplier={} productId={} itemId={}", globalSupplierId,
                    product.getId(), item.getId());
            return new WriteResult(product.getId(), item.getId(), true, true, product.hasGtin());
        });
    }

    /**
     * Links the supplier to the matched product, updating the existing non-ignored
     * item in place when there is one.
     *
     * @throws RecordNotFoundException if the matched product no longer exists
     */
    public WriteResult linkToProduct(String globalSupplierId, ImportRow row, MatchResult match, boolean needsReview) {
        return transactionManager.inTransaction(() -> {
            String productId = match.productId();
            Product product = products.findById(productId)
                    .orElseThrow(() -> new RecordNotFoundException("Product", productId));

            Optional<SupplierItem> existing = supplierItems.findActive(globalSupplierId, productId);
            SupplierItem item;
            if (existing.isPresent()) {
                item = existing.get();
                item.updateOffer(row.sku(), row.name(), row.unitPrice(), row.currency(),
                        row.minOrderQty(), row.stockLevel(), row.leadTimeDays());
                item.recordMatch(match.method(), match.confidence(), needsReview, SYSTEM_ACTOR);
            } else {
                item = newItem(globalSupplierId, productId, row)
                        .matchMethod(match.method())
                        .matchConfidence(match.confidence())
                        .needsReview(needsReview)
                        .matchedBy(SYSTEM_ACTOR)
                        .build();
            }
            SupplierItem saved = supplierItems.save(item);

            log.debug("writer.linked supplier={} productId={} itemId={} updated={}", globalSupplierId,
                    productId, saved.getId(), existing.isPresent());
            return new WriteResult(productId, saved.getId(), false, existing.isEmpty(), product.hasGtin());
        });
    }

    private static SupplierItem.Builder newItem(String globalSupplierId, String productId, ImportRow row) {
        return SupplierItem.builder()
                .globalSupplierId(globalSupplierId)
                .productId(productId)
                .supplierSku(row.sku())
                .supplierName(row.name())
                .unitPrice(row.unitPrice())
                .currency(row.currency())
                .minOrderQty(row.minOrderQty())
                .stockLevel(row.stockLevel())
                .leadTimeDays(row.leadTimeDays());
    }
}

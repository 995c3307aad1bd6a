package com.supplier.catalog.persistence;

import com.supplier.catalog.api.Page;
import com.supplier.catalog.api.PageRequest;
import com.supplier.catalog.core.exception.DuplicateSupplierItemException;
import com.supplier.catalog.core.model.SupplierItem;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory supplier items. The uniqueness check and the write happen under the
 * store lock, so two writers can never both link the same supplier and product.
 */
public class InMemorySupplierItemRepository extends InMemoryRecords<SupplierItem> implements SupplierItemRepository {

    InMemorySupplierItemRepository(ReentrantLock lock) {
        super(lock);
    }

    @Override
    public SupplierItem save(SupplierItem item) {
        return locked(() -> {
            if (!item.isIgnored()) {
                Optional<SupplierItem> conflict = active(item.getGlobalSupplierId(), item.getProductId())
                        .filter(existing -> !existing.getId().equals(item.getId()));
                if (conflict.isPresent()) {
                    throw new DuplicateSupplierItemException(item.getGlobalSupplierId(), item.getProductId());
                }
            }
            SupplierItem stored = item.copy();
            records.put(stored.getId(), stored);
            return stored.copy();
        });
    }

    @Override
    public Optional<SupplierItem> findById(String id) {
        return locked(() -> Optional.ofNullable(records.get(id)).map(SupplierItem::copy));
    }

    @Override
    public Optional<SupplierItem> findActive(String globalSupplierId, String productId) {
        return locked(() -> active(globalSupplierId, productId).map(SupplierItem::copy));
    }

    @Override
    public Optional<SupplierItem> findActiveBySku(String globalSupplierId, String supplierSku) {
        if (supplierSku == null || supplierSku.isBlank()) {
            return Optional.empty();
        }
        String wanted = normalizeSku(supplierSku);
        return locked(() -> records.values().stream()
                .filter(i -> !i.isIgnored())
                .filter(i -> i.getGlobalSupplierId().equals(globalSupplierId))
                .filter(i -> i.getSupplierSku() != null && normalizeSku(i.getSupplierSku()).equals(wanted))
                .findFirst()
                .map(SupplierItem::copy));
    }

    @Override
    public List<SupplierItem> findBySupplier(String globalSupplierId) {
        return locked(() -> records.values().stream()
                .filter(i -> i.getGlobalSupplierId().equals(globalSupplierId))
                .map(SupplierItem::copy)
                .toList());
    }

    @Override
    public Page<SupplierItem> findNeedingReview(PageRequest page) {
        return locked(() -> Page.of(needingReview(), page));
    }

    @Override
    public long countNeedingReview() {
        return locked(() -> (long) needingReview().size());
    }

    private List<SupplierItem> needingReview() {
        return records.values().stream()
                .filter(i -> i.isNeedsReview() && !i.isIgnored())
                .sorted(Comparator.comparing(SupplierItem::getCreatedAt))
                .map(SupplierItem::copy)
                .toList();
    }

    private Optional<SupplierItem> active(String globalSupplierId, String productId) {
        return records.values().stream()
                .filter(i -> !i.isIgnored())
                .filter(i -> i.getGlobalSupplierId().equals(globalSupplierId))
                .filter(i -> i.getProductId().equals(productId))
                .findFirst();
    }

    private static String normalizeSku(String sku) {
        return sku.trim().toLowerCase(Locale.ROOT);
    }
}

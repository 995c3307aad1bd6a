package com.supplier.catalog.persistence;

import com.supplier.catalog.core.model.AssetKind;
import com.supplier.catalog.core.model.ProductAsset;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory product media and documents.
 */
public class InMemoryProductAssetRepository extends InMemoryRecords<ProductAsset> implements ProductAssetRepository {

    InMemoryProductAssetRepository(ReentrantLock lock) {
        super(lock);
    }

    @Override
    public ProductAsset save(ProductAsset asset) {
        return locked(() -> {
            ProductAsset stored = asset.copy();
            records.put(stored.getId(), stored);
            return stored.copy();
        });
    }

    @Override
    public Optional<ProductAsset> findById(String id) {
        return locked(() -> Optional.ofNullable(records.get(id)).map(ProductAsset::copy));
    }

    @Override
    public Optional<ProductAsset> findByProductAndSourceUrl(String productId, AssetKind kind, String sourceUrl) {
        return locked(() -> records.values().stream()
                .filter(a -> a.getProductId().equals(productId))
                .filter(a -> a.getKind() == kind)
                .filter(a -> a.getSourceUrl().equals(sourceUrl))
                .findFirst()
                .map(ProductAsset::copy));
    }

    @Override
    public List<ProductAsset> findByProduct(String productId) {
        return locked(() -> records.values().stream()
                .filter(a -> a.getProductId().equals(productId))
                .map(ProductAsset::copy)
                .toList());
    }
}

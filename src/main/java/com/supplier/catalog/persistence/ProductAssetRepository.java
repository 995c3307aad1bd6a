package com.supplier.catalog.persistence;

import com.supplier.catalog.core.model.AssetKind;
import com.supplier.catalog.core.model.ProductAsset;

import java.util.List;
import java.util.Optional;

/**
 * Storage of product media and documents.
 */
public interface ProductAssetRepository {

    ProductAsset save(ProductAsset asset);

    Optional<ProductAsset> findById(String id);

    Optional<ProductAsset> findByProductAndSourceUrl(String productId, AssetKind kind, String sourceUrl);

    List<ProductAsset> findByProduct(String productId);
}

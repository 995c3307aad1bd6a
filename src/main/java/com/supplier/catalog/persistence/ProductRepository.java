package com.supplier.catalog.persistence;

import com.supplier.catalog.core.model.Product;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage of canonical products.
 */
public interface ProductRepository {

    /**
     * Inserts or replaces a product.
     *
     * @throws com.supplier.catalog.core.exception.DuplicateGtinException if another product owns the GTIN
     */
    Product save(Product product);

    Optional<Product> findById(String id);

    Optional<Product> findByGtin(String gtin);

    /**
     * Returns products whose GTIN equals any of the given values.
     */
    List<Product> findByGtins(Collection<String> gtins);

    /**
     * Returns up to {@code limit} products sharing at least one blocking key,
     * the products sharing the most keys first.
     */
    List<Product> findCandidates(Set<String> blockingKeys, int limit);

    long count();
}

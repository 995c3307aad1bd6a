package com.supplier.catalog.persistence;

import com.supplier.catalog.core.model.CatalogUpload;

import java.util.List;
import java.util.Optional;

/**
 * Storage of upload audit records.
 */
public interface CatalogUploadRepository {

    CatalogUpload save(CatalogUpload upload);

    Optional<CatalogUpload> findById(String id);

    /**
     * Most recent uploads first.
     */
    List<CatalogUpload> findRecent(int limit);

    List<CatalogUpload> findBySupplier(String globalSupplierId);
}

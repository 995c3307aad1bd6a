package com.supplier.catalog.persistence;

import com.supplier.catalog.core.model.CatalogUpload;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory upload audit records. Not part of catalog transactions: an upload's
 * status must survive the rollback of any row.
 */
public class InMemoryCatalogUploadRepository implements CatalogUploadRepository {

    private final ConcurrentMap<String, CatalogUpload> uploads = new ConcurrentHashMap<>();

    @Override
    public CatalogUpload save(CatalogUpload upload) {
        uploads.put(upload.getId(), upload.copy());
        return upload;
    }

    @Override
    public Optional<CatalogUpload> findById(String id) {
        return Optional.ofNullable(uploads.get(id)).map(CatalogUpload::copy);
    }

    @Override
    public List<CatalogUpload> findRecent(int limit) {
        return uploads.values().stream()
                .sorted(Comparator.comparing(CatalogUpload::getCreatedAt).reversed())
                .limit(limit)
                .map(CatalogUpload::copy)
                .toList();
    }

    @Override
    public List<CatalogUpload> findBySupplier(String globalSupplierId) {
        return uploads.values().stream()
                .filter(u -> u.getGlobalSupplierId().equals(globalSupplierId))
                .sorted(Comparator.comparing(CatalogUpload::getCreatedAt).reversed())
                .map(CatalogUpload::copy)
                .toList();
    }
}

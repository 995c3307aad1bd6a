package com.supplier.catalog.audit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory {@link AuditRepository}. Thread-safe via CopyOnWriteArrayList.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    @Override
    public List<AuditEntry> findBySupplierItemId(String supplierItemId) {
        return entries.stream()
                .filter(e -> supplierItemId.equals(e.supplierItemId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findByProductId(String productId) {
        return entries.stream()
                .filter(e -> e.involvesProduct(productId))
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findByActorId(String actorId) {
        return entries.stream()
                .filter(e -> actorId.equals(e.actorId()))
                .collect(Collectors.toList());
    }

    @Override
    public int count() {
        return entries.size();
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        List<AuditEntry> snapshot = new ArrayList<>(entries);
        int size = snapshot.size();
        if (size <= limit) {
            return Collections.unmodifiableList(snapshot);
        }
        return Collections.unmodifiableList(new ArrayList<>(snapshot.subList(size - limit, size)));
    }
}

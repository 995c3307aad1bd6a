package com.supplier.catalog.persistence;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Record map shared by the transactional in-memory repositories. All access
 * goes through the store's lock, so a running transaction sees no foreign writes.
 */
abstract class InMemoryRecords<T> {

    protected final Map<String, T> records = new LinkedHashMap<>();
    private final ReentrantLock lock;

    protected InMemoryRecords(ReentrantLock lock) {
        this.lock = lock;
    }

    protected <R> R locked(Supplier<R> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    Map<String, T> snapshot() {
        return new LinkedHashMap<>(records);
    }

    void restore(Map<String, T> snapshot) {
        records.clear();
        records.putAll(snapshot);
        reindex();
    }

    /**
     * Rebuilds secondary indexes after a rollback.
     */
    protected void reindex() {
    }
}

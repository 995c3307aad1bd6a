package com.supplier.catalog.persistence;

import java.util.function.Supplier;

/**
 * Runs a unit of work atomically against the catalog records (products,
 * supplier items and assets). If the work throws, every change it made is
 * rolled back and the exception propagates unchanged. Nested calls join the
 * outer transaction.
 */
public interface TransactionManager {

    <T> T inTransaction(Supplier<T> work);

    default void inTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }
}

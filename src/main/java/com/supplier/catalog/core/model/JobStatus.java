package com.supplier.catalog.core.model;

/**
 * Status of an asset download job.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    /**
     * Active jobs block a second job for the same asset from being enqueued.
     */
    public boolean isActive() {
        return this == PENDING || this == PROCESSING;
    }
}

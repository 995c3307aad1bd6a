package com.supplier.catalog.core.model;

/**
 * Lifecycle of a catalog upload run: RECEIVED, PROCESSING, then COMPLETED or FAILED.
 */
public enum UploadStatus {
    RECEIVED,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}

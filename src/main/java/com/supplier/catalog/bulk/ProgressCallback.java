package com.supplier.catalog.bulk;

/**
 * Callback for tracking progress of an import run.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed rows processed so far
     * @param total     rows in the run
     * @param message   progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}

package com.supplier.catalog.jobs;

/**
 * Outcome of one processing pass.
 *
 * @param processed           jobs completed successfully
 * @param errors              jobs that failed in this pass
 * @param mediaDownloaded     completed media downloads
 * @param documentsDownloaded completed document downloads
 */
public record AssetJobResult(int processed, int errors, int mediaDownloaded, int documentsDownloaded) {

    public static AssetJobResult empty() {
        return new AssetJobResult(0, 0, 0, 0);
    }

    @Override
    public String toString() {
        return "AssetJobResult{processed=" + processed +
                ", errors=" + errors +
                ", media=" + mediaDownloaded +
                ", documents=" + documentsDownloaded + '}';
    }
}

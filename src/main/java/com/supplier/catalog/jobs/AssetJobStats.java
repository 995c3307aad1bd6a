package com.supplier.catalog.jobs;

/**
 * Job counts per status.
 */
public record AssetJobStats(long pending, long processing, long completed, long failed) {

    public long total() {
        return pending + processing + completed + failed;
    }
}

package com.supplier.catalog.bulk;

import com.supplier.catalog.core.model.UploadStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of a catalog import run. Mirrors the final state of its CatalogUpload.
 *
 * @param uploadId         audit record of the run
 * @param globalSupplierId supplier whose catalog was imported
 * @param status           COMPLETED, or FAILED if the file was rejected or the run aborted
 * @param totalRows        data rows seen
 * @param successCount     rows that wrote a supplier item
 * @param failedCount      rows that did not
 * @param reviewCount      written rows flagged for review
 * @param enrichedCount    written rows whose product was enriched
 * @param errorMessage     why the run failed, null when COMPLETED
 * @param startedAt        run start
 * @param completedAt      run end
 * @param rows             per-row results in row order
 */
public record ImportResult(
        String uploadId,
        String globalSupplierId,
        UploadStatus status,
        int totalRows,
        int successCount,
        int failedCount,
        int reviewCount,
        int enrichedCount,
        String errorMessage,
        Instant startedAt,
        Instant completedAt,
        List<RowResult> rows
) {
    public ImportResult {
        rows = rows != null ? List.copyOf(rows) : List.of();
    }

    public boolean isCompleted() {
        return status == UploadStatus.COMPLETED;
    }

    public boolean hasErrors() {
        return failedCount > 0 || status == UploadStatus.FAILED;
    }

    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }

    @Override
    public String toString() {
        return "ImportResult{uploadId=" + uploadId +
                ", status=" + status +
                ", total=" + totalRows +
                ", success=" + successCount +
                ", failed=" + failedCount +
                ", review=" + reviewCount +
                ", enriched=" + enrichedCount + '}';
    }
}

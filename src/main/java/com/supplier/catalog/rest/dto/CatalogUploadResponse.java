package com.supplier.catalog.rest.dto;

import com.supplier.catalog.core.model.CatalogUpload;
import com.supplier.catalog.core.model.UploadStatus;

import java.time.Instant;

/**
 * REST view of an import run's audit record. The raw file content is not exposed.
 */
public record CatalogUploadResponse(
        String id,
        String globalSupplierId,
        String filename,
        String uploadedBy,
        UploadStatus status,
        int rowCount,
        int successCount,
        int failedCount,
        int reviewCount,
        int enrichedCount,
        String errorMessage,
        Instant createdAt,
        Instant completedAt
) {
    public static CatalogUploadResponse from(CatalogUpload upload) {
        return new CatalogUploadResponse(
                upload.getId(),
                upload.getGlobalSupplierId(),
                upload.getFilename(),
                upload.getUploadedBy(),
                upload.getStatus(),
                upload.getRowCount(),
                upload.getSuccessCount(),
                upload.getFailedCount(),
                upload.getReviewCount(),
                upload.getEnrichedCount(),
                upload.getErrorMessage(),
                upload.getCreatedAt(),
                upload.getCompletedAt()
        );
    }
}

package com.supplier.catalog.core.model;

/**
 * Kind of asset an {@link AssetJob} downloads.
 */
public enum AssetJobType {
    MEDIA_DOWNLOAD,
    DOCUMENT_DOWNLOAD;

    public static AssetJobType forAsset(AssetKind kind) {
        return kind == AssetKind.MEDIA ? MEDIA_DOWNLOAD : DOCUMENT_DOWNLOAD;
    }
}

package com.supplier.catalog.core.exception;

/**
 * Thrown when a remote asset cannot be fetched or is rejected
 * (bad status, oversize, disallowed content type).
 */
public class AssetDownloadException extends CatalogImportException {

    public AssetDownloadException(String message) {
        super(message);
    }

    public AssetDownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}

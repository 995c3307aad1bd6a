package com.supplier.catalog.core.exception;

/**
 * Thrown when a storage provider cannot persist or remove content.
 */
public class StorageException extends CatalogImportException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

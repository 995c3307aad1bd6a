package com.supplier.catalog.core.exception;

/**
 * Thrown when a referenced record does not exist.
 */
public class RecordNotFoundException extends CatalogImportException {

    public RecordNotFoundException(String recordType, String id) {
        super(recordType + " not found: " + id);
    }
}

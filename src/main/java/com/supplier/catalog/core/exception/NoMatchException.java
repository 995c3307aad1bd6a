package com.supplier.catalog.core.exception;

/**
 * Thrown when a row matches no product and product creation is disabled.
 */
public class NoMatchException extends CatalogImportException {

    public NoMatchException(String message) {
        super(message);
    }
}

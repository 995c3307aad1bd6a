package com.supplier.catalog.core.exception;

/**
 * Thrown when a row cannot be imported because its content is unusable.
 */
public class InvalidRowException extends CatalogImportException {

    public InvalidRowException(String message) {
        super(message);
    }
}

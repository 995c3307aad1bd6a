package com.supplier.catalog.core.exception;

/**
 * Root of the domain exceptions raised while importing catalogs and
 * processing their follow-up work. Row-level subtypes are recorded on the
 * row and do not abort a run.
 */
public class CatalogImportException extends RuntimeException {

    public CatalogImportException(String message) {
        super(message);
    }

    public CatalogImportException(String message, Throwable cause) {
        super(message, cause);
    }
}

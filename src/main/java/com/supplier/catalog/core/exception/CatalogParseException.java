package com.supplier.catalog.core.exception;

/**
 * Thrown by the parser in fail-fast mode, or when the input has no usable header.
 */
public class CatalogParseException extends CatalogImportException {
    private final int lineNumber;

    public CatalogParseException(int lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}

package com.supplier.catalog.bulk;

/**
 * A catalog line the parser rejected.
 *
 * @param lineNumber 1-based line in the file
 * @param raw        the line as read
 * @param message    why it was rejected
 */
public record RowError(int lineNumber, String raw, String message) {
}

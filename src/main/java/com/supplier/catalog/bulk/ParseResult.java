package com.supplier.catalog.bulk;

import com.supplier.catalog.core.model.ImportRow;

import java.util.List;

/**
 * Parsed catalog: accepted rows and rejected lines, each in file order.
 */
public record ParseResult(List<ImportRow> rows, List<RowError> rejected) {

    public ParseResult {
        rows = rows != null ? List.copyOf(rows) : List.of();
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
    }

    public static ParseResult empty() {
        return new ParseResult(List.of(), List.of());
    }

    /**
     * Data lines seen, accepted or not.
     */
    public int rowCount() {
        return rows.size() + rejected.size();
    }
}

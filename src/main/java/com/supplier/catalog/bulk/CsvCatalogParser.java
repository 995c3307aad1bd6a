package com.supplier.catalog.bulk;

import com.supplier.catalog.api.ImportOptions;
import com.supplier.catalog.core.exception.CatalogParseException;
import com.supplier.catalog.core.model.ImportRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses a supplier catalog in delimited text form.
 *
 * <p>Expected format:</p>
 * <pre>
 * sku;gtin;name;brand;price;currency;min_qty;stock;lead_time
 * A-100;4006381333931;"Gauze; sterile 10x10cm";Acme;12,50;eur;10;250;3
 * </pre>
 *
 * <p>The first non-blank line is the header. The delimiter is {@code ;} when the header
 * uses it, otherwise {@code ,}. Columns are recognized by name in English, Dutch and
 * German; unknown columns are ignored. Quoted fields may contain the delimiter and
 * {@code ""} escapes, but not line breaks.</p>
 */
public class CsvCatalogParser {
    private static final Logger log = LoggerFactory.getLogger(CsvCatalogParser.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");
    private static final Pattern NON_HEADER_CHARS = Pattern.compile("[^a-z0-9_]");
    private static final Pattern NON_NUMERIC_CHARS = Pattern.compile("[^0-9,.\\-]");

    static final String NAME_REQUIRED = "Name is required";

    enum Column {
        SKU("sku", "supplier_sku", "suppliersku", "article", "article_number", "artikelnummer"),
        GTIN("gtin", "ean", "barcode", "upc"),
        NAME("name", "product_name", "productname", "bezeichnung"),
        BRAND("brand", "merk", "manufacturer", "hersteller"),
        DESCRIPTION("description", "details", "beschreibung", "long_description"),
        PRICE("price", "unit_price", "unitprice", "prijs", "preis"),
        CURRENCY("currency", "valuta", "wahrung"),
        MIN_ORDER_QTY("min_qty", "minorderqty", "min_order_qty", "min_order", "minimum"),
        STOCK("stock", "stock_level", "inventory", "voorraad", "bestand"),
        LEAD_TIME("lead_time", "leadtime", "lead_time_days", "delivery_days", "lieferzeit");

        private final List<String> aliases;

        Column(String... aliases) {
            this.aliases = List.of(aliases);
        }

        List<String> aliases() {
            return aliases;
        }
    }

    /**
     * Parses the whole catalog.
     *
     * @throws CatalogParseException if the header has no name column, or a row is invalid
     *                               and {@link ImportOptions#isSkipInvalidRows()} is false
     */
    public ParseResult parse(String content, ImportOptions options) {
        if (content == null || content.isBlank()) {
            return ParseResult.empty();
        }
        String[] lines = LINE_BREAK.split(content, -1);

        int headerIndex = 0;
        while (headerIndex < lines.length && lines[headerIndex].isBlank()) {
            headerIndex++;
        }
        String headerLine = stripBom(lines[headerIndex]);
        char delimiter = detectDelimiter(headerLine);
        Map<Column, List<Integer>> columns = mapColumns(splitLine(headerLine, delimiter));
        if (!columns.containsKey(Column.NAME)) {
            throw new CatalogParseException(headerIndex + 1,
                    "Missing required column: one of " + Column.NAME.aliases());
        }

        List<ImportRow> rows = new ArrayList<>();
        List<RowError> rejected = new ArrayList<>();
        for (int i = headerIndex + 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            int lineNumber = i + 1;
            List<String> fields = splitLine(line, delimiter);
            if (fields.stream().allMatch(String::isBlank)) {
                continue;
            }

            String name = value(fields, columns, Column.NAME);
            if (name == null) {
                if (!options.isSkipInvalidRows()) {
                    throw new CatalogParseException(lineNumber, NAME_REQUIRED);
                }
                rejected.add(new RowError(lineNumber, line, NAME_REQUIRED));
                continue;
            }
            rows.add(toRow(lineNumber, name, fields, columns, options));
        }

        log.debug("catalog.parsed rows={} rejected={} delimiter='{}'", rows.size(), rejected.size(), delimiter);
        return new ParseResult(rows, rejected);
    }

    private ImportRow toRow(int lineNumber, String name, List<String> fields, Map<Column, List<Integer>> columns,
                            ImportOptions options) {
        ImportRow.Builder row = ImportRow.builder()
                .lineNumber(lineNumber)
                .name(name)
                .sku(value(fields, columns, Column.SKU))
                .brand(value(fields, columns, Column.BRAND))
                .description(value(fields, columns, Column.DESCRIPTION));

        row.gtin(value(fields, columns, Column.GTIN));
        row.unitPrice(parseDecimal(value(fields, columns, Column.PRICE), "price", row));
        row.currency(value(fields, columns, Column.CURRENCY));
        row.minOrderQty(parseInteger(value(fields, columns, Column.MIN_ORDER_QTY), "minimum order quantity", row));
        row.stockLevel(parseInteger(value(fields, columns, Column.STOCK), "stock level", row));
        row.leadTimeDays(parseInteger(value(fields, columns, Column.LEAD_TIME), "lead time", row));
        return ImportRowNormalizer.normalize(row.build(), options);
    }

    static char detectDelimiter(String headerLine) {
        int semicolons = 0;
        int commas = 0;
        boolean inQuotes = false;
        for (char c : headerLine.toCharArray()) {
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (!inQuotes && c == ';') {
                semicolons++;
            } else if (!inQuotes && c == ',') {
                commas++;
            }
        }
        return semicolons > commas ? ';' : ',';
    }

    static List<String> splitLine(String line, char delimiter) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == delimiter && !inQuotes) {
                fields.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString().trim());
        return fields;
    }

    private static Map<Column, List<Integer>> mapColumns(List<String> header) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String key = NON_HEADER_CHARS.matcher(header.get(i).trim().toLowerCase(Locale.ROOT)).replaceAll("_");
            positions.putIfAbsent(key, i);
        }

        Map<Column, List<Integer>> columns = new EnumMap<>(Column.class);
        for (Column column : Column.values()) {
            for (String alias : column.aliases()) {
                Integer position = positions.get(alias);
                if (position != null) {
                    columns.computeIfAbsent(column, c -> new ArrayList<>()).add(position);
                }
            }
        }
        return columns;
    }

    /**
     * First non-blank value among the column's aliases, trimmed; null if none.
     */
    private static String value(List<String> fields, Map<Column, List<Integer>> columns, Column column) {
        for (int position : columns.getOrDefault(column, List.of())) {
            if (position < fields.size() && !fields.get(position).isBlank()) {
                return fields.get(position).trim();
            }
        }
        return null;
    }

    /**
     * Accepts decimal commas and thousands separators; negative or unreadable values become null with a warning.
     */
    static BigDecimal parseDecimal(String raw, String field, ImportRow.Builder row) {
        if (raw == null) {
            return null;
        }
        String cleaned = NON_NUMERIC_CHARS.matcher(raw).replaceAll("");
        if (cleaned.lastIndexOf(',') > cleaned.lastIndexOf('.')) {
            cleaned = cleaned.replace(".", "").replace(',', '.');
        } else {
            cleaned = cleaned.replace(",", "");
        }
        try {
            BigDecimal value = new BigDecimal(cleaned);
            if (value.signum() < 0) {
                row.warning("Negative " + field + " ignored: " + raw);
                return null;
            }
            return value;
        } catch (NumberFormatException e) {
            row.warning("Invalid " + field + ": " + raw);
            return null;
        }
    }

    static Integer parseInteger(String raw, String field, ImportRow.Builder row) {
        BigDecimal value = parseDecimal(raw, field, row);
        if (value == null) {
            return null;
        }
        try {
            return value.setScale(0, RoundingMode.FLOOR).intValueExact();
        } catch (ArithmeticException e) {
            row.warning("Invalid " + field + ": " + raw);
            return null;
        }
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}

package com.supplier.catalog.bulk;

import com.supplier.catalog.api.ImportOptions;
import com.supplier.catalog.core.exception.CatalogParseException;
import com.supplier.catalog.core.model.ImportRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvCatalogParserTest {

    private CsvCatalogParser parser;
    private ImportOptions options;

    @BeforeEach
    void setUp() {
        parser = new CsvCatalogParser();
        options = ImportOptions.defaults();
    }

    @Test
    @DisplayName("Should parse a semicolon catalog with quoted fields and decimal commas")
    void testSemicolonCatalog() {
        String csv = """
                sku;gtin;name;brand;price;currency;min_qty;stock;lead_time
                A-100;4006381333931;"Gauze; sterile 10x10cm";Acme;12,50;eur;10;250;3
                """;

        ParseResult result = parser.parse(csv, options);

        assertEquals(1, result.rowCount());
        ImportRow row = result.rows().get(0);
        assertEquals(2, row.lineNumber());
        assertEquals("A-100", row.sku());
        assertEquals("4006381333931", row.gtin());
        assertEquals("Gauze; sterile 10x10cm", row.name());
        assertEquals("Acme", row.brand());
        assertEquals(new BigDecimal("12.50"), row.unitPrice());
        assertEquals("EUR", row.currency());
        assertEquals(10, row.minOrderQty());
        assertEquals(250, row.stockLevel());
        assertEquals(3, row.leadTimeDays());
        assertTrue(row.warnings().isEmpty());
    }

    @Test
    @DisplayName("Should parse a comma catalog with localized headers and thousands separators")
    void testCommaCatalogWithAliases() {
        String csv = "EAN,Product Name,Hersteller,Preis\n"
                + "96385074,Nitrile Gloves,Ansell,\"1,234.5\"\n";

        ImportRow row = parser.parse(csv, options).rows().get(0);

        assertEquals("96385074", row.gtin());
        assertEquals("Nitrile Gloves", row.name());
        assertEquals("Ansell", row.brand());
        assertEquals(new BigDecimal("1234.50"), row.unitPrice());
        assertEquals("EUR", row.currency());
        assertEquals(1, row.minOrderQty());
    }

    @Test
    @DisplayName("Should reject a file without a name column")
    void testMissingNameColumn() {
        CatalogParseException e = assertThrows(CatalogParseException.class,
                () -> parser.parse("sku;price\nA;1", options));
        assertEquals(1, e.getLineNumber());
    }

    @Test
    @DisplayName("Should reject rows without a name when skipping invalid rows")
    void testMissingNameRejected() {
        ParseResult result = parser.parse("sku;name\nA;Widget\nB;\nC;Gadget", options);

        assertEquals(3, result.rowCount());
        assertEquals(List.of(2, 4), result.rows().stream().map(ImportRow::lineNumber).toList());
        assertEquals(1, result.rejected().size());
        RowError error = result.rejected().get(0);
        assertEquals(3, error.lineNumber());
        assertEquals("B;", error.raw());
        assertEquals(CsvCatalogParser.NAME_REQUIRED, error.message());
    }

    @Test
    @DisplayName("Should fail the file on a row without a name when not skipping")
    void testMissingNameFatal() {
        ImportOptions strict = ImportOptions.builder().skipInvalidRows(false).build();

        CatalogParseException e = assertThrows(CatalogParseException.class,
                () -> parser.parse("sku;name\nA;Widget\nB;", strict));
        assertEquals(3, e.getLineNumber());
    }

    @Test
    @DisplayName("Should keep an invalid GTIN with a warning")
    void testInvalidGtinWarning() {
        ImportRow row = parser.parse("gtin;name\n4006-3813-3393-2;Gauze", options).rows().get(0);

        assertEquals("4006381333932", row.gtin());
        assertEquals(1, row.warnings().size());
        assertTrue(row.warnings().get(0).startsWith("Invalid GTIN"));
    }

    @Test
    @DisplayName("Should drop negative and unreadable numbers with warnings")
    void testNumericWarnings() {
        ImportRow row = parser.parse("name;price;min_qty;stock;currency\nGauze;-5;0;lots;EURO", options)
                .rows().get(0);

        assertNull(row.unitPrice());
        assertEquals(1, row.minOrderQty());
        assertNull(row.stockLevel());
        assertEquals("EUR", row.currency());
        assertEquals(4, row.warnings().size());
        assertTrue(row.warnings().contains("Negative price ignored: -5"));
        assertTrue(row.warnings().contains("Invalid stock level: lots"));
    }

    @Test
    @DisplayName("Should use the configured default currency")
    void testDefaultCurrency() {
        ImportOptions usd = ImportOptions.builder().defaultCurrency("usd").build();

        assertEquals("USD", parser.parse("name\nGauze", usd).rows().get(0).currency());
    }

    @Test
    @DisplayName("Should skip blank lines and a byte order mark while keeping line numbers")
    void testBlankLinesAndBom() {
        ParseResult result = parser.parse("\uFEFFname;price\r\nA;1\r\n\r\n;\r\nB;2", options);

        assertEquals(List.of(2, 5), result.rows().stream().map(ImportRow::lineNumber).toList());
        assertTrue(result.rejected().isEmpty());
    }

    @Test
    @DisplayName("Should return an empty result for empty content")
    void testEmptyContent() {
        assertEquals(0, parser.parse("", options).rowCount());
        assertEquals(0, parser.parse(null, options).rowCount());
        assertEquals(0, parser.parse("name;price\n", options).rowCount());
    }

    @Test
    @DisplayName("Should pick the delimiter the header uses most")
    void testDetectDelimiter() {
        assertEquals(';', CsvCatalogParser.detectDelimiter("sku;name;price"));
        assertEquals(',', CsvCatalogParser.detectDelimiter("sku,name,price"));
        assertEquals(',', CsvCatalogParser.detectDelimiter("\"a;b;c\",name"));
        assertEquals(',', CsvCatalogParser.detectDelimiter("name"));
    }

    @Test
    @DisplayName("Should unescape doubled quotes")
    void testSplitLine() {
        assertEquals(List.of("a", "b \"c\"", "d"), CsvCatalogParser.splitLine("a,\"b \"\"c\"\"\",d", ','));
        assertEquals(List.of("", "x", ""), CsvCatalogParser.splitLine(";x;", ';'));
    }

    @ParameterizedTest
    @DisplayName("Should read decimal commas and thousands separators")
    @CsvSource(delimiter = '|', value = {
            "12,50|12.50",
            "1.234,56|1234.56",
            "1,234.56|1234.56",
            "€ 9.99|9.99",
            "100|100"
    })
    void testParseDecimal(String raw, String expected) {
        ImportRow.Builder row = ImportRow.builder();
        assertEquals(new BigDecimal(expected), CsvCatalogParser.parseDecimal(raw, "price", row));
    }

    @Test
    @DisplayName("Should floor fractional integers")
    void testParseInteger() {
        assertEquals(12, CsvCatalogParser.parseInteger("12.7", "stock", ImportRow.builder()));
        assertNull(CsvCatalogParser.parseInteger(null, "stock", ImportRow.builder()));
    }
}

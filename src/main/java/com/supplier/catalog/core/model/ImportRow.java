package com.supplier.catalog.core.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * One parsed catalog line, ready for matching.
 *
 * @param lineNumber   1-based line in the source file, 0 when the row did not come from a file
 * @param sku          supplier SKU
 * @param gtin         GTIN with separators removed; not validated here
 * @param name         product label, never blank
 * @param brand        brand or manufacturer
 * @param description  free text description
 * @param unitPrice    price rounded to two decimals
 * @param currency     upper-cased ISO currency code
 * @param minOrderQty  minimum order quantity
 * @param stockLevel   units in stock
 * @param leadTimeDays delivery lead time
 * @param warnings     non-fatal parse issues on this row
 */
public record ImportRow(
        int lineNumber,
        String sku,
        String gtin,
        String name,
        String brand,
        String description,
        BigDecimal unitPrice,
        String currency,
        Integer minOrderQty,
        Integer stockLevel,
        Integer leadTimeDays,
        List<String> warnings
) {
    public ImportRow {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        name = name.trim();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean hasGtin() {
        return gtin != null && !gtin.isEmpty();
    }

    public boolean hasSku() {
        return sku != null && !sku.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int lineNumber;
        private String sku;
        private String gtin;
        private String name;
        private String brand;
        private String description;
        private BigDecimal unitPrice;
        private String currency;
        private Integer minOrderQty;
        private Integer stockLevel;
        private Integer leadTimeDays;
        private final List<String> warnings = new ArrayList<>();

        public Builder lineNumber(int lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder sku(String sku) {
            this.sku = sku;
            return this;
        }

        public Builder gtin(String gtin) {
            this.gtin = gtin;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder unitPrice(BigDecimal unitPrice) {
            this.unitPrice = unitPrice;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder minOrderQty(Integer minOrderQty) {
            this.minOrderQty = minOrderQty;
            return this;
        }

        public Builder stockLevel(Integer stockLevel) {
            this.stockLevel = stockLevel;
            return this;
        }

        public Builder leadTimeDays(Integer leadTimeDays) {
            this.leadTimeDays = leadTimeDays;
            return this;
        }

        public Builder warning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        public ImportRow build() {
            return new ImportRow(lineNumber, sku, gtin, name, brand, description, unitPrice, currency,
                    minOrderQty, stockLevel, leadTimeDays, warnings);
        }
    }
}

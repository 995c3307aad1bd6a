package com.supplier.catalog.api;

import java.util.Locale;

/**
 * Options for one catalog import run.
 */
public class ImportOptions {

    private static final double DEFAULT_MIN_AUTO_MATCH_CONFIDENCE = 0.90;
    private static final String DEFAULT_CURRENCY = "EUR";

    private final boolean autoEnrich;
    private final boolean createNewProducts;
    private final boolean skipInvalidRows;
    private final double minAutoMatchConfidence;
    private final String defaultCurrency;

    private ImportOptions(Builder builder) {
        this.autoEnrich = builder.autoEnrich;
        this.createNewProducts = builder.createNewProducts;
        this.skipInvalidRows = builder.skipInvalidRows;
        this.minAutoMatchConfidence = builder.minAutoMatchConfidence;
        this.defaultCurrency = builder.defaultCurrency;
    }

    /**
     * Whether products with a GTIN are looked up in the external data source after the row is written.
     */
    public boolean isAutoEnrich() {
        return autoEnrich;
    }

    /**
     * Whether unmatched rows create a new product. When false they fail.
     */
    public boolean isCreateNewProducts() {
        return createNewProducts;
    }

    /**
     * Whether rows that fail parsing are reported and skipped. When false the whole file is rejected.
     */
    public boolean isSkipInvalidRows() {
        return skipInvalidRows;
    }

    /**
     * Matches below this confidence are linked but flagged for review.
     */
    public double getMinAutoMatchConfidence() {
        return minAutoMatchConfidence;
    }

    public String getDefaultCurrency() {
        return defaultCurrency;
    }

    public static ImportOptions defaults() {
        return builder().build();
    }

    /**
     * Options that only link to existing products and never call the external source.
     */
    public static ImportOptions linkOnly() {
        return builder()
                .createNewProducts(false)
                .autoEnrich(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean autoEnrich = true;
        private boolean createNewProducts = true;
        private boolean skipInvalidRows = true;
        private double minAutoMatchConfidence = DEFAULT_MIN_AUTO_MATCH_CONFIDENCE;
        private String defaultCurrency = DEFAULT_CURRENCY;

        public Builder autoEnrich(boolean autoEnrich) {
            this.autoEnrich = autoEnrich;
            return this;
        }

        public Builder createNewProducts(boolean createNewProducts) {
            this.createNewProducts = createNewProducts;
            return this;
        }

        public Builder skipInvalidRows(boolean skipInvalidRows) {
            this.skipInvalidRows = skipInvalidRows;
            return this;
        }

        public Builder minAutoMatchConfidence(double minAutoMatchConfidence) {
            if (minAutoMatchConfidence < 0.0 || minAutoMatchConfidence > 1.0) {
                throw new IllegalArgumentException("minAutoMatchConfidence must be between 0.0 and 1.0");
            }
            this.minAutoMatchConfidence = minAutoMatchConfidence;
            return this;
        }

        public Builder defaultCurrency(String defaultCurrency) {
            if (defaultCurrency == null || defaultCurrency.isBlank()) {
                throw new IllegalArgumentException("defaultCurrency must not be blank");
            }
            this.defaultCurrency = defaultCurrency.trim().toUpperCase(Locale.ROOT);
            return this;
        }

        public ImportOptions build() {
            return new ImportOptions(this);
        }
    }
}

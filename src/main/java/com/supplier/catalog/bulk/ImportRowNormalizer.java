package com.supplier.catalog.bulk;

import com.supplier.catalog.api.ImportOptions;
import com.supplier.catalog.core.model.ImportRow;
import com.supplier.catalog.rules.Gtin;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Applies the import defaults to a row regardless of where it came from.
 *
 * <p>GTIN separators are stripped, prices are rounded to two decimals, the currency is
 * upper-cased or replaced by the default, and the minimum order quantity defaults to 1.
 * Negative numbers are dropped. Every correction adds a warning.</p>
 */
final class ImportRowNormalizer {

    private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");

    private ImportRowNormalizer() {
    }

    static ImportRow normalize(ImportRow row, ImportOptions options) {
        List<String> warnings = new ArrayList<>(row.warnings());

        String gtin = Gtin.clean(row.gtin());
        if (gtin != null) {
            Gtin.Validation validation = Gtin.validate(gtin);
            if (!validation.valid()) {
                warnings.add("Invalid GTIN " + row.gtin() + ": " + validation.error());
            }
        }

        BigDecimal price = row.unitPrice();
        if (price != null && price.signum() < 0) {
            warnings.add("Negative price ignored: " + price.toPlainString());
            price = null;
        }
        if (price != null) {
            price = price.setScale(2, RoundingMode.HALF_UP);
        }

        String currency = currency(row.currency(), options.getDefaultCurrency(), warnings);

        Integer minOrderQty = row.minOrderQty();
        if (minOrderQty != null && minOrderQty < 1) {
            warnings.add("Minimum order quantity must be at least 1: " + minOrderQty);
            minOrderQty = null;
        }

        return new ImportRow(row.lineNumber(), blankToNull(row.sku()), gtin, row.name(), blankToNull(row.brand()),
                blankToNull(row.description()), price, currency, minOrderQty != null ? minOrderQty : 1,
                nonNegative(row.stockLevel(), "stock level", warnings),
                nonNegative(row.leadTimeDays(), "lead time", warnings), warnings);
    }

    private static String currency(String raw, String defaultCurrency, List<String> warnings) {
        if (raw == null || raw.isBlank()) {
            return defaultCurrency;
        }
        String code = raw.trim().toUpperCase(Locale.ROOT);
        if (CURRENCY_CODE.matcher(code).matches()) {
            return code;
        }
        warnings.add("Invalid currency " + raw + ", using " + defaultCurrency);
        return defaultCurrency;
    }

    private static Integer nonNegative(Integer value, String field, List<String> warnings) {
        if (value != null && value < 0) {
            warnings.add("Negative " + field + " ignored: " + value);
            return null;
        }
        return value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

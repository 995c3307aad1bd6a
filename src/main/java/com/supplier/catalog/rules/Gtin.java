package com.supplier.catalog.rules;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * GS1 GTIN utilities: cleaning, mod-10 check digit validation and the
 * equivalent forms used for variant lookups.
 *
 * <p>Accepted lengths are 8 (GTIN-8), 12 (UPC), 13 (EAN) and 14 (GTIN-14).</p>
 */
public final class Gtin {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-.]");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private Gtin() {
        // Utility class
    }

    /**
     * Result of validating a GTIN.
     *
     * @param valid      whether the GTIN passed all checks
     * @param normalized the cleaned digits when valid
     * @param error      the reason when invalid
     */
    public record Validation(boolean valid, String normalized, String error) {

        static Validation ok(String normalized) {
            return new Validation(true, normalized, null);
        }

        static Validation invalid(String error) {
            return new Validation(false, null, error);
        }

        /**
         * Returns the GS1 type name (GTIN-8, GTIN-12, GTIN-13, GTIN-14) or null when invalid.
         */
        public String type() {
            return valid ? "GTIN-" + normalized.length() : null;
        }
    }

    /**
     * Removes spaces, dashes and dots. Returns null for null or blank input.
     */
    public static String clean(String gtin) {
        if (gtin == null || gtin.isBlank()) {
            return null;
        }
        return SEPARATORS.matcher(gtin).replaceAll("");
    }

    public static Validation validate(String gtin) {
        String cleaned = clean(gtin);
        if (cleaned == null) {
            return Validation.invalid("GTIN is required");
        }
        if (!DIGITS.matcher(cleaned).matches()) {
            return Validation.invalid("GTIN must contain only digits");
        }
        int length = cleaned.length();
        if (length != 8 && length != 12 && length != 13 && length != 14) {
            return Validation.invalid("GTIN must be 8, 12, 13, or 14 digits. Got " + length + " digits.");
        }
        int expected = checkDigit(cleaned.substring(0, length - 1));
        int provided = cleaned.charAt(length - 1) - '0';
        if (expected != provided) {
            return Validation.invalid("Invalid check digit. Expected " + expected + ", got " + provided + ".");
        }
        return Validation.ok(cleaned);
    }

    public static boolean isValid(String gtin) {
        return validate(gtin).valid();
    }

    /**
     * Computes the mod-10 check digit for a GTIN body (all digits except the check digit).
     * Weights alternate 3, 1, 3, ... starting from the rightmost body digit.
     */
    public static int checkDigit(String body) {
        int sum = 0;
        for (int i = 0; i < body.length(); i++) {
            int digit = body.charAt(body.length() - 1 - i) - '0';
            if (digit < 0 || digit > 9) {
                throw new IllegalArgumentException("GTIN body must contain only digits: " + body);
            }
            sum += digit * (i % 2 == 0 ? 3 : 1);
        }
        return (10 - (sum % 10)) % 10;
    }

    /**
     * Pads a valid GTIN to 14 digits, or returns null when invalid.
     */
    public static String toGtin14(String gtin) {
        Validation validation = validate(gtin);
        if (!validation.valid()) {
            return null;
        }
        return "0".repeat(14 - validation.normalized().length()) + validation.normalized();
    }

    public static boolean areEquivalent(String first, String second) {
        String a = toGtin14(first);
        String b = toGtin14(second);
        return a != null && a.equals(b);
    }

    /**
     * Returns the other representations of the same trade item that a catalog may have
     * stored: leading zeros stripped (while at least 8 digits remain), zero-padded to 13
     * and 14 digits, and a GTIN-13 without its leading zero. The input itself is excluded.
     */
    public static Set<String> variants(String gtin) {
        String cleaned = clean(gtin);
        Set<String> variants = new LinkedHashSet<>();
        if (cleaned == null || !DIGITS.matcher(cleaned).matches()) {
            return variants;
        }

        String stripped = cleaned.replaceFirst("^0+", "");
        if (stripped.length() >= 8 && !stripped.equals(cleaned)) {
            variants.add(stripped);
        }
        if (cleaned.length() < 13) {
            variants.add("0".repeat(13 - cleaned.length()) + cleaned);
        }
        if (cleaned.length() < 14) {
            variants.add("0".repeat(14 - cleaned.length()) + cleaned);
        }
        if (cleaned.length() == 13 && cleaned.charAt(0) == '0') {
            variants.add(cleaned.substring(1));
        }
        variants.remove(cleaned);
        return variants;
    }
}

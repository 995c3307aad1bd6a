package com.supplier.catalog.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GtinTest {

    @ParameterizedTest
    @DisplayName("Should accept valid GTINs of every supported length")
    @CsvSource({
            "96385074,GTIN-8",
            "036000291452,GTIN-12",
            "4006381333931,GTIN-13",
            "04006381333931,GTIN-14"
    })
    void testValidGtins(String gtin, String type) {
        Gtin.Validation validation = Gtin.validate(gtin);
        assertTrue(validation.valid());
        assertEquals(gtin, validation.normalized());
        assertEquals(type, validation.type());
        assertNull(validation.error());
    }

    @Test
    @DisplayName("Should strip spaces, dashes and dots before validating")
    void testSeparatorsRemoved() {
        Gtin.Validation validation = Gtin.validate(" 400-6381.333 931 ");
        assertTrue(validation.valid());
        assertEquals("4006381333931", validation.normalized());
    }

    @Test
    @DisplayName("Should reject a wrong check digit and report the expected one")
    void testWrongCheckDigit() {
        Gtin.Validation validation = Gtin.validate("4006381333932");
        assertFalse(validation.valid());
        assertEquals("Invalid check digit. Expected 1, got 2.", validation.error());
        assertNull(validation.type());
    }

    @ParameterizedTest
    @DisplayName("Should reject malformed input")
    @ValueSource(strings = {"12345", "400638133393A", "123456789012345", "ABCDEFGH"})
    void testMalformed(String gtin) {
        assertFalse(Gtin.isValid(gtin));
    }

    @Test
    @DisplayName("Should reject null and blank input")
    void testNullAndBlank() {
        assertEquals("GTIN is required", Gtin.validate(null).error());
        assertEquals("GTIN is required", Gtin.validate("  ").error());
        assertNull(Gtin.clean("   "));
    }

    @Test
    @DisplayName("Should report length in the error message")
    void testLengthError() {
        assertEquals("GTIN must be 8, 12, 13, or 14 digits. Got 5 digits.", Gtin.validate("12345").error());
    }

    @Test
    @DisplayName("Should compute mod-10 check digits")
    void testCheckDigit() {
        assertEquals(1, Gtin.checkDigit("400638133393"));
        assertEquals(2, Gtin.checkDigit("03600029145"));
        assertThrows(IllegalArgumentException.class, () -> Gtin.checkDigit("40063813339X"));
    }

    @Test
    @DisplayName("Should treat zero-padded forms as the same trade item")
    void testEquivalence() {
        assertEquals("04006381333931", Gtin.toGtin14("4006381333931"));
        assertTrue(Gtin.areEquivalent("036000291452", "00036000291452"));
        assertFalse(Gtin.areEquivalent("4006381333931", "036000291452"));
        assertFalse(Gtin.areEquivalent("4006381333932", "04006381333932"));
        assertNull(Gtin.toGtin14("bogus"));
    }

    @Test
    @DisplayName("Should list stripped and padded variants excluding the input")
    void testVariants() {
        assertEquals(Set.of("04006381333931"), Gtin.variants("4006381333931"));
        assertEquals(Set.of("36000291452", "0036000291452", "00036000291452"), Gtin.variants("036000291452"));
        assertEquals(Set.of("4006381333931"), Gtin.variants("04006381333931"));
        assertTrue(Gtin.variants("abc").isEmpty());
        assertTrue(Gtin.variants(null).isEmpty());
    }
}

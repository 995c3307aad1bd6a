package com.supplier.catalog.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageTest {

    @Test
    @DisplayName("Should cut pages from a sorted list")
    void testOf() {
        List<Integer> items = List.of(1, 2, 3, 4, 5);

        Page<Integer> second = Page.of(items, PageRequest.of(1, 2));
        Page<Integer> last = Page.of(items, PageRequest.of(2, 2));
        Page<Integer> beyond = Page.of(items, PageRequest.of(5, 2));

        assertEquals(List.of(3, 4), second.content());
        assertTrue(second.hasNext());
        assertEquals(1, second.pageNumber());
        assertEquals(List.of(5), last.content());
        assertFalse(last.hasNext());
        assertEquals(3, last.totalPages());
        assertTrue(beyond.content().isEmpty());
        assertEquals(5, beyond.totalElements());
    }

    @Test
    @DisplayName("Should validate page requests")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> PageRequest.of(-1, 10));
        assertThrows(IllegalArgumentException.class, () -> PageRequest.of(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new PageRequest(0, 1_001));
        assertEquals(new PageRequest(0, 20), PageRequest.first(20));
        assertTrue(Page.empty(PageRequest.first(5)).content().isEmpty());
    }

    @Test
    @DisplayName("Should fill import option defaults")
    void testImportOptions() {
        ImportOptions defaults = ImportOptions.defaults();
        assertTrue(defaults.isAutoEnrich());
        assertTrue(defaults.isCreateNewProducts());
        assertTrue(defaults.isSkipInvalidRows());
        assertEquals(0.90, defaults.getMinAutoMatchConfidence());
        assertEquals("EUR", defaults.getDefaultCurrency());

        ImportOptions linkOnly = ImportOptions.linkOnly();
        assertFalse(linkOnly.isCreateNewProducts());
        assertFalse(linkOnly.isAutoEnrich());
    }
}

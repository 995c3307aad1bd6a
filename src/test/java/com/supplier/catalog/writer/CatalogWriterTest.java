package com.supplier.catalog.writer;

import com.supplier.catalog.core.exception.DuplicateGtinException;
import com.supplier.catalog.core.exception.RecordNotFoundException;
import com.supplier.catalog.core.model.ImportRow;
import com.supplier.catalog.core.model.MatchMethod;
import com.supplier.catalog.core.model.Product;
import com.supplier.catalog.core.model.SupplierItem;
import com.supplier.catalog.matching.MatchResult;
import com.supplier.catalog.persistence.InMemoryCatalogStore;
import com.supplier.catalog.rules.DefaultNormalizationRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class CatalogWriterTest {

    private static final String SUPPLIER = "SUP-1";

    private InMemoryCatalogStore store;
    private CatalogWriter writer;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
        writer = new CatalogWriter(store.products(), store.supplierItems(), store,
                DefaultNormalizationRules.createDefaultEngine());
    }

    @Test
    @DisplayName("Should create a product and an item linked with method NONE")
    void testCreateProductAndItem() {
        WriteResult result = writer.createProductAndItem(SUPPLIER, row("4006381333931", "19.90"));

        assertTrue(result.productCreated());
        assertTrue(result.itemCreated());
        assertTrue(result.productHasGtin());

        Product product = store.products().findById(result.productId()).orElseThrow();
        assertEquals("4006381333931", product.getGtin());
        assertEquals("gauze swabs medline", product.getNormalizedName());

        SupplierItem item = store.supplierItems().findById(result.supplierItemId()).orElseThrow();
        assertEquals(MatchMethod.NONE, item.getMatchMethod());
        assertEquals(1.0, item.getMatchConfidence());
        assertFalse(item.isNeedsReview());
        assertEquals(CatalogWriter.SYSTEM_ACTOR, item.getMatchedBy());
        assertEquals(new BigDecimal("19.90"), item.getUnitPrice());
    }

    @Test
    @DisplayName("Should not copy an invalid GTIN onto a new product")
    void testInvalidGtinNotCopied() {
        WriteResult result = writer.createProductAndItem(SUPPLIER, row("4006381333932", null));

        assertFalse(result.productHasGtin());
        assertNull(store.products().findById(result.productId()).orElseThrow().getGtin());
    }

    @Test
    @DisplayName("Should leave nothing behind when the product GTIN is taken")
    void testDuplicateGtinRollsBack() {
        writer.createProductAndItem(SUPPLIER, row("4006381333931", null));

        assertThrows(DuplicateGtinException.class,
                () -> writer.createProductAndItem("SUP-2", row("4006381333931", null)));
        assertEquals(1, store.products().count());
        assertTrue(store.supplierItems().findBySupplier("SUP-2").isEmpty());
    }

    @Test
    @DisplayName("Should update the existing item in place when linking again")
    void testLinkUpdatesExisting() {
        WriteResult created = writer.createProductAndItem(SUPPLIER, row("4006381333931", "10.00"));
        MatchResult match = MatchResult.matched(created.productId(), MatchMethod.GTIN_EXACT, 1.0);

        WriteResult linked = writer.linkToProduct(SUPPLIER, row("4006381333931", "12.50"), match, false);

        assertFalse(linked.productCreated());
        assertFalse(linked.itemCreated());
        assertEquals(created.supplierItemId(), linked.supplierItemId());
        SupplierItem item = store.supplierItems().findById(linked.supplierItemId()).orElseThrow();
        assertEquals(new BigDecimal("12.50"), item.getUnitPrice());
        assertEquals(MatchMethod.GTIN_EXACT, item.getMatchMethod());
    }

    @Test
    @DisplayName("Should create a new review-flagged item for a fuzzy link")
    void testLinkCreatesItem() {
        store.products().save(Product.builder().id("p-1").name("Gauze Swabs").build());
        MatchResult match = MatchResult.matched("p-1", MatchMethod.FUZZY_NAME, 0.7);

        WriteResult linked = writer.linkToProduct(SUPPLIER, row(null, null), match, true);

        assertTrue(linked.itemCreated());
        assertFalse(linked.productHasGtin());
        SupplierItem item = store.supplierItems().findById(linked.supplierItemId()).orElseThrow();
        assertTrue(item.isNeedsReview());
        assertEquals(0.7, item.getMatchConfidence());
    }

    @Test
    @DisplayName("Should fail when the matched product no longer exists")
    void testLinkMissingProduct() {
        MatchResult match = MatchResult.matched("gone", MatchMethod.SKU_EXACT, 0.95);

        assertThrows(RecordNotFoundException.class, () -> writer.linkToProduct(SUPPLIER, row(null, null), match, false));
    }

    private static ImportRow row(String gtin, String price) {
        return ImportRow.builder()
                .lineNumber(2)
                .sku("GZ-10")
                .gtin(gtin)
                .name("Gauze Swabs")
                .brand("Medline")
                .unitPrice(price != null ? new BigDecimal(price) : null)
                .currency("EUR")
                .minOrderQty(1)
                .build();
    }
}

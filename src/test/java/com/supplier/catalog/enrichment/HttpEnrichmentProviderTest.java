package com.supplier.catalog.enrichment;

import com.supplier.catalog.core.model.Product;
import com.supplier.catalog.core.model.VerificationStatus;
import com.supplier.catalog.persistence.InMemoryCatalogStore;
import com.supplier.catalog.persistence.ProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HttpEnrichmentProviderTest {

    private static final String GTIN = "4006381333931";

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private ProductRepository products;
    private HttpEnrichmentProvider provider;

    @BeforeEach
    void setUp() {
        products = new InMemoryCatalogStore().products();
        provider = HttpEnrichmentProvider.builder()
                .baseUrl("https://productdata.example.com/api/v1/")
                .apiKey("secret")
                .productRepository(products)
                .httpClient(httpClient)
                .build();
    }

    private Product save(String gtin, String brand) {
        return products.save(Product.builder()
                .id("p-1")
                .gtin(gtin)
                .name("Gauze Swabs")
                .brand(brand)
                .build());
    }

    private void respond(int status, String body) throws Exception {
        when(response.statusCode()).thenReturn(status);
        if (body != null) {
            when(response.body()).thenReturn(body);
        }
        doReturn(response).when(httpClient).send(any(), any());
    }

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @Test
        @DisplayName("Should fill blank fields and mark the product verified")
        void testApply() throws Exception {
            save(GTIN, null);
            respond(200, """
                    {"gtin":"4006381333931","brandName":" Medline ","shortDescription":"Sterile gauze",
                     "mediaUrls":["https://cdn.example.com/a.jpg"," ","https://cdn.example.com/a.jpg"],
                     "documentUrls":["https://cdn.example.com/ifu.pdf"],"netContent":"100"}
                    """);

            EnrichmentResponse result = provider.enrichFromExternalSource("p-1");

            assertTrue(result.success());
            assertEquals(List.of("brand", "description", "verificationStatus"), result.enrichedFields());
            assertEquals(List.of("https://cdn.example.com/a.jpg"), result.mediaUrls());
            assertEquals(List.of("https://cdn.example.com/ifu.pdf"), result.documentUrls());
            Product stored = products.findById("p-1").orElseThrow();
            assertEquals("Medline", stored.getBrand());
            assertEquals("Sterile gauze", stored.getDescription());
            assertEquals(VerificationStatus.VERIFIED, stored.getVerificationStatus());
        }

        @Test
        @DisplayName("Should keep existing values")
        void testKeepsExistingBrand() throws Exception {
            save(GTIN, "Hartmann");
            respond(200, "{\"brandName\":\"Medline\"}");

            EnrichmentResponse result = provider.enrichFromExternalSource("p-1");

            assertEquals(List.of("verificationStatus"), result.enrichedFields());
            assertEquals("Hartmann", products.findById("p-1").orElseThrow().getBrand());
        }

        @Test
        @DisplayName("Should send the GTIN path and bearer token")
        void testRequest() throws Exception {
            save(GTIN, null);
            respond(404, null);

            provider.enrichFromExternalSource("p-1");

            ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(request.capture(), any());
            assertEquals("https://productdata.example.com/api/v1/products/" + GTIN, request.getValue().uri().toString());
            assertEquals("Bearer secret", request.getValue().headers().firstValue("Authorization").orElseThrow());
        }

        @Test
        @DisplayName("Should mark the product as failed lookup on 404")
        void testUnknownToSource() throws Exception {
            save(GTIN, null);
            respond(404, null);

            EnrichmentResponse result = provider.enrichFromExternalSource("p-1");

            assertFalse(result.success());
            assertEquals(List.of(HttpEnrichmentProvider.UNKNOWN_TO_SOURCE), result.warnings());
            assertEquals(VerificationStatus.FAILED_LOOKUP,
                    products.findById("p-1").orElseThrow().getVerificationStatus());
        }

        @Test
        @DisplayName("Should report server errors")
        void testServerError() throws Exception {
            save(GTIN, null);
            respond(503, null);

            EnrichmentResponse result = provider.enrichFromExternalSource("p-1");

            assertFalse(result.success());
            assertTrue(result.errors().get(0).contains("status 503"));
        }

        @Test
        @DisplayName("Should report connection failures")
        void testIoError() throws Exception {
            save(GTIN, null);
            doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

            EnrichmentResponse result = provider.enrichFromExternalSource("p-1");

            assertEquals(List.of("Error calling product data source: connection refused"), result.errors());
        }
    }

    @Nested
    @DisplayName("Preconditions")
    class PreconditionTests {

        @Test
        @DisplayName("Should fail for an unknown product")
        void testMissingProduct() {
            EnrichmentResponse result = provider.enrichFromExternalSource("nope");

            assertEquals(List.of(HttpEnrichmentProvider.PRODUCT_NOT_FOUND), result.errors());
            verifyNoInteractions(httpClient);
        }

        @Test
        @DisplayName("Should not call the source for a product without GTIN")
        void testNoGtin() {
            save(null, null);

            EnrichmentResponse result = provider.enrichFromExternalSource("p-1");

            assertEquals(List.of(HttpEnrichmentProvider.NO_GTIN), result.warnings());
            verifyNoInteractions(httpClient);
        }
    }

    @Test
    @DisplayName("Should name itself after the base URL")
    void testProviderName() {
        assertEquals("Http/https://productdata.example.com/api/v1", provider.getProviderName());
    }

    @Test
    @DisplayName("Should never enrich without a source")
    void testNoOpProvider() {
        NoOpEnrichmentProvider noOp = new NoOpEnrichmentProvider();

        EnrichmentResponse result = noOp.enrichFromExternalSource("p-1");

        assertFalse(result.success());
        assertEquals(List.of(NoOpEnrichmentProvider.NOT_CONFIGURED), result.warnings());
        assertFalse(noOp.isAvailable());
    }
}

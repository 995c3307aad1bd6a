package com.supplier.catalog.enrichment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplier.catalog.core.model.Product;
import com.supplier.catalog.core.model.VerificationStatus;
import com.supplier.catalog.persistence.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Enrichment provider backed by a JSON product-data service.
 *
 * <p>Issues {@code GET {baseUrl}/products/{gtin}}. A 404 means the GTIN is unknown to
 * the source. On a hit, blank brand and description fields of the product are filled
 * in and the product is marked VERIFIED.</p>
 *
 * <pre>
 * EnrichmentProvider provider = HttpEnrichmentProvider.builder()
 *     .baseUrl("https://productdata.example.com/api/v1")
 *     .apiKey(System.getenv("PRODUCT_DATA_API_KEY"))
 *     .productRepository(store.products())
 *     .build();
 * </pre>
 */
public class HttpEnrichmentProvider implements EnrichmentProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpEnrichmentProvider.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    static final String PRODUCT_NOT_FOUND = "Product not found";
    static final String NO_GTIN = "Product has no GTIN, cannot enrich from external source";
    static final String UNKNOWN_TO_SOURCE = "Product not found in external source";

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final ProductRepository products;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpEnrichmentProvider(Builder builder) {
        String url = Objects.requireNonNull(builder.baseUrl, "baseUrl is required");
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.apiKey = builder.apiKey;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.products = Objects.requireNonNull(builder.productRepository, "productRepository is required");
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public EnrichmentResponse enrichFromExternalSource(String productId) {
        Optional<Product> found = products.findById(productId);
        if (found.isEmpty()) {
            return EnrichmentResponse.failure(productId, PRODUCT_NOT_FOUND);
        }
        Product product = found.get();
        if (!product.hasGtin()) {
            return EnrichmentResponse.notEnriched(productId, NO_GTIN);
        }

        log.debug("enrichment.lookup productId={} gtin={}", productId, product.getGtin());
        try {
            Optional<ProductDataDto> data = lookup(product.getGtin());
            if (data.isEmpty()) {
                product.setVerificationStatus(VerificationStatus.FAILED_LOOKUP);
                products.save(product);
                return EnrichmentResponse.notEnriched(productId, UNKNOWN_TO_SOURCE);
            }
            return apply(product, data.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EnrichmentResponse.failure(productId, "Enrichment interrupted");
        } catch (IOException | RuntimeException e) {
            log.error("enrichment.failed productId={} error={}", productId, e.getMessage(), e);
            return EnrichmentResponse.failure(productId, "Error calling product data source: " + e.getMessage());
        }
    }

    @Override
    public String getProviderName() {
        return "Http/" + baseUrl;
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = authorized(HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/health"))
                    .timeout(Duration.ofSeconds(5))
                    .GET())
                    .build();
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() == 200;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (IOException | RuntimeException e) {
            log.debug("Product data source not available: {}", e.getMessage());
            return false;
        }
    }

    private Optional<ProductDataDto> lookup(String gtin) throws IOException, InterruptedException {
        HttpRequest request = authorized(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/products/" + URLEncoder.encode(gtin, StandardCharsets.UTF_8)))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET())
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        if (response.statusCode() != 200) {
            throw new IOException("Product data source returned status " + response.statusCode());
        }
        return Optional.of(objectMapper.readValue(response.body(), ProductDataDto.class));
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder request) {
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }
        return request;
    }

    private EnrichmentResponse apply(Product product, ProductDataDto data) {
        List<String> enrichedFields = new ArrayList<>();
        if (isBlank(product.getBrand()) && !isBlank(data.brandName())) {
            product.setBrand(data.brandName().trim());
            enrichedFields.add("brand");
        }
        String description = !isBlank(data.shortDescription()) ? data.shortDescription() : data.tradeItemDescription();
        if (isBlank(product.getDescription()) && !isBlank(description)) {
            product.setDescription(description.trim());
            enrichedFields.add("description");
        }
        product.setVerificationStatus(VerificationStatus.VERIFIED);
        enrichedFields.add("verificationStatus");
        products.save(product);

        List<String> mediaUrls = nonBlank(data.mediaUrls());
        List<String> documentUrls = nonBlank(data.documentUrls());
        log.info("enrichment.applied productId={} fields={} media={} documents={}",
                product.getId(), enrichedFields, mediaUrls.size(), documentUrls.size());
        return new EnrichmentResponse(true, product.getId(), enrichedFields, mediaUrls, documentUrls,
                List.of(), List.of());
    }

    private static List<String> nonBlank(List<String> urls) {
        if (urls == null) {
            return List.of();
        }
        return urls.stream()
                .filter(url -> !isBlank(url))
                .map(String::trim)
                .distinct()
                .toList();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration timeout;
        private ProductRepository productRepository;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder productRepository(ProductRepository productRepository) {
            this.productRepository = productRepository;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public HttpEnrichmentProvider build() {
            return new HttpEnrichmentProvider(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProductDataDto(
            @JsonProperty("gtin") String gtin,
            @JsonProperty("brandName") String brandName,
            @JsonProperty("tradeItemDescription") String tradeItemDescription,
            @JsonProperty("shortDescription") String shortDescription,
            @JsonProperty("mediaUrls") List<String> mediaUrls,
            @JsonProperty("documentUrls") List<String> documentUrls
    ) {
    }
}

package com.supplier.catalog.matching;

import com.supplier.catalog.core.model.ImportRow;
import com.supplier.catalog.core.model.MatchMethod;
import com.supplier.catalog.core.model.Product;
import com.supplier.catalog.core.model.SupplierItem;
import com.supplier.catalog.persistence.ProductRepository;
import com.supplier.catalog.persistence.SupplierItemRepository;
import com.supplier.catalog.rules.Gtin;
import com.supplier.catalog.rules.NormalizationEngine;
import com.supplier.catalog.similarity.BlockingKeyStrategy;
import com.supplier.catalog.similarity.CompositeSimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves an import row to a canonical product. Tiers run in order and the
 * first hit wins:
 * <ol>
 *   <li>GTIN exact (1.0), then GTIN variants (0.99)</li>
 *   <li>supplier SKU exact on the supplier's own items (0.95)</li>
 *   <li>fuzzy name + brand over blocking-key candidates (composite score, floor 0.5)</li>
 * </ol>
 * Invalid GTINs never match on the GTIN tier; the row falls through to SKU and name.
 */
public class ProductMatcher {
    private static final Logger log = LoggerFactory.getLogger(ProductMatcher.class);

    private final ProductRepository products;
    private final SupplierItemRepository supplierItems;
    private final NormalizationEngine normalizationEngine;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final CompositeSimilarityScorer scorer;
    private final MatcherConfig config;

    public ProductMatcher(ProductRepository products,
                          SupplierItemRepository supplierItems,
                          NormalizationEngine normalizationEngine,
                          BlockingKeyStrategy blockingKeyStrategy,
                          MatcherConfig config) {
        this.products = products;
        this.supplierItems = supplierItems;
        this.normalizationEngine = normalizationEngine;
        this.blockingKeyStrategy = blockingKeyStrategy;
        this.config = config;
        this.scorer = new CompositeSimilarityScorer(config.getWeights());
    }

    public MatchResult match(ImportRow row, String globalSupplierId) {
        Optional<MatchResult> byGtin = matchGtin(row);
        if (byGtin.isPresent()) {
            return byGtin.get();
        }

        Optional<MatchResult> bySku = matchSku(row, globalSupplierId);
        if (bySku.isPresent()) {
            return bySku.get();
        }

        if (!config.isFuzzyEnabled()) {
            return MatchResult.noMatch(List.of());
        }
        return matchFuzzy(row);
    }

    private Optional<MatchResult> matchGtin(ImportRow row) {
        if (!row.hasGtin()) {
            return Optional.empty();
        }
        Gtin.Validation validation = Gtin.validate(row.gtin());
        if (!validation.valid()) {
            log.debug("match.gtin.skipped line={} gtin={} reason={}", row.lineNumber(), row.gtin(), validation.error());
            return Optional.empty();
        }

        Optional<Product> exact = products.findByGtin(validation.normalized());
        if (exact.isPresent()) {
            log.debug("match.gtin.exact line={} productId={}", row.lineNumber(), exact.get().getId());
            return Optional.of(MatchResult.matched(exact.get().getId(), MatchMethod.GTIN_EXACT,
                    MatcherConfig.GTIN_EXACT_CONFIDENCE));
        }

        Set<String> variants = Gtin.variants(validation.normalized());
        if (variants.isEmpty()) {
            return Optional.empty();
        }
        return products.findByGtins(variants).stream()
                .findFirst()
                .map(p -> {
                    log.debug("match.gtin.variant line={} gtin={} productGtin={}", row.lineNumber(),
                            validation.normalized(), p.getGtin());
                    return MatchResult.matched(p.getId(), MatchMethod.GTIN_EXACT, MatcherConfig.GTIN_VARIANT_CONFIDENCE);
                });
    }

    private Optional<MatchResult> matchSku(ImportRow row, String globalSupplierId) {
        if (!row.hasSku()) {
            return Optional.empty();
        }
        return supplierItems.findActiveBySku(globalSupplierId, row.sku())
                .map(SupplierItem::getProductId)
                .map(productId -> {
                    log.debug("match.sku.exact line={} sku={} productId={}", row.lineNumber(), row.sku(), productId);
                    return MatchResult.matched(productId, MatchMethod.SKU_EXACT, MatcherConfig.SKU_EXACT_CONFIDENCE);
                });
    }

    private MatchResult matchFuzzy(ImportRow row) {
        String normalized = normalizationEngine.normalizeProduct(row.name(), row.brand());
        Set<String> keys = blockingKeyStrategy.generateKeys(normalized);
        if (keys.isEmpty()) {
            return MatchResult.noMatch(List.of());
        }

        List<MatchCandidate> scored = new ArrayList<>();
        for (Product product : products.findCandidates(keys, config.getCandidatePoolSize())) {
            String candidateName = product.getNormalizedName() != null
                    ? product.getNormalizedName()
                    : normalizationEngine.normalizeProduct(product.getName(), product.getBrand());
            double score = scorer.compute(normalized, candidateName);
            scored.add(new MatchCandidate(product.getId(), product.getName(), product.getBrand(),
                    product.getGtin(), score));
        }
        scored.sort(Comparator.comparingDouble(MatchCandidate::score).reversed()
                .thenComparing(MatchCandidate::productId));

        if (!scored.isEmpty() && scored.get(0).score() >= config.getFuzzyFloor()) {
            MatchCandidate best = scored.get(0);
            List<MatchCandidate> runnersUp = scored.subList(1, Math.min(scored.size(), config.getMaxCandidates() + 1));
            log.debug("match.fuzzy line={} productId={} score={} candidates={}", row.lineNumber(),
                    best.productId(), best.score(), scored.size());
            return new MatchResult(best.productId(), MatchMethod.FUZZY_NAME, best.score(), runnersUp);
        }

        log.debug("match.none line={} candidates={}", row.lineNumber(), scored.size());
        return MatchResult.noMatch(scored.subList(0, Math.min(scored.size(), config.getMaxCandidates())));
    }
}

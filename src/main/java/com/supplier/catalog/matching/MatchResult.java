package com.supplier.catalog.matching;

import com.supplier.catalog.core.model.MatchMethod;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of matching one import row against the catalog.
 *
 * @param productId  matched product, or null when nothing matched
 * @param method     tier that produced the match, NONE when nothing matched
 * @param confidence 0.0 to 1.0; 0.0 when nothing matched
 * @param candidates runner-up fuzzy candidates, best first
 */
public record MatchResult(
        String productId,
        MatchMethod method,
        double confidence,
        List<MatchCandidate> candidates
) {
    public MatchResult {
        Objects.requireNonNull(method, "method is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        if (productId == null && (method != MatchMethod.NONE || confidence != 0.0)) {
            throw new IllegalArgumentException("a result without product must have method NONE and confidence 0");
        }
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public static MatchResult noMatch(List<MatchCandidate> candidates) {
        return new MatchResult(null, MatchMethod.NONE, 0.0, candidates);
    }

    public static MatchResult matched(String productId, MatchMethod method, double confidence) {
        return new MatchResult(Objects.requireNonNull(productId, "productId is required"), method, confidence, List.of());
    }

    public boolean hasMatch() {
        return productId != null;
    }
}

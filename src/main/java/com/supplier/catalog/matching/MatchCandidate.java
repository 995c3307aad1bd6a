package com.supplier.catalog.matching;

/**
 * A scored product shown on review screens next to the chosen match.
 */
public record MatchCandidate(String productId, String name, String brand, String gtin, double score) {

    public MatchCandidate {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0");
        }
    }
}

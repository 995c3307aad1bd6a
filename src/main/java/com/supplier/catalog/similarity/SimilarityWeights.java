package com.supplier.catalog.similarity;

/**
 * Weights of the composite product-name score. Must be non-negative and sum to 1.0,
 * which keeps the composite within [0, 1].
 */
public record SimilarityWeights(double tokenWeight, double editWeight) {

    public SimilarityWeights {
        if (tokenWeight < 0 || editWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = tokenWeight + editWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Favors token overlap: supplier labels often reorder words.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.6, 0.4);
    }

    public static SimilarityWeights editDistanceFocused() {
        return new SimilarityWeights(0.3, 0.7);
    }
}

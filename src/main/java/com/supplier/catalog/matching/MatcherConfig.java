package com.supplier.catalog.matching;

import com.supplier.catalog.similarity.SimilarityWeights;

/**
 * Tuning of the matcher's confidence levels and fuzzy tier.
 */
public class MatcherConfig {

    public static final double GTIN_EXACT_CONFIDENCE = 1.0;
    public static final double GTIN_VARIANT_CONFIDENCE = 0.99;
    public static final double SKU_EXACT_CONFIDENCE = 0.95;

    private static final double DEFAULT_FUZZY_FLOOR = 0.5;
    private static final int DEFAULT_MAX_CANDIDATES = 5;
    private static final int DEFAULT_CANDIDATE_POOL_SIZE = 50;

    private final boolean fuzzyEnabled;
    private final double fuzzyFloor;
    private final SimilarityWeights weights;
    private final int maxCandidates;
    private final int candidatePoolSize;

    private MatcherConfig(Builder builder) {
        this.fuzzyEnabled = builder.fuzzyEnabled;
        this.fuzzyFloor = builder.fuzzyFloor;
        this.weights = builder.weights;
        this.maxCandidates = builder.maxCandidates;
        this.candidatePoolSize = builder.candidatePoolSize;
    }

    public boolean isFuzzyEnabled() {
        return fuzzyEnabled;
    }

    /**
     * Minimum composite score for a fuzzy candidate to count as a match.
     */
    public double getFuzzyFloor() {
        return fuzzyFloor;
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    /**
     * Number of runner-up candidates reported with a result.
     */
    public int getMaxCandidates() {
        return maxCandidates;
    }

    /**
     * Maximum number of products pulled from the blocking index and scored per row.
     */
    public int getCandidatePoolSize() {
        return candidatePoolSize;
    }

    public static MatcherConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean fuzzyEnabled = true;
        private double fuzzyFloor = DEFAULT_FUZZY_FLOOR;
        private SimilarityWeights weights = SimilarityWeights.defaultWeights();
        private int maxCandidates = DEFAULT_MAX_CANDIDATES;
        private int candidatePoolSize = DEFAULT_CANDIDATE_POOL_SIZE;

        public Builder fuzzyEnabled(boolean fuzzyEnabled) {
            this.fuzzyEnabled = fuzzyEnabled;
            return this;
        }

        public Builder fuzzyFloor(double fuzzyFloor) {
            if (fuzzyFloor < 0.0 || fuzzyFloor > 1.0) {
                throw new IllegalArgumentException("fuzzyFloor must be between 0.0 and 1.0");
            }
            this.fuzzyFloor = fuzzyFloor;
            return this;
        }

        public Builder weights(SimilarityWeights weights) {
            if (weights == null) {
                throw new IllegalArgumentException("weights must not be null");
            }
            this.weights = weights;
            return this;
        }

        public Builder maxCandidates(int maxCandidates) {
            if (maxCandidates < 0) {
                throw new IllegalArgumentException("maxCandidates must be >= 0");
            }
            this.maxCandidates = maxCandidates;
            return this;
        }

        public Builder candidatePoolSize(int candidatePoolSize) {
            if (candidatePoolSize < 1) {
                throw new IllegalArgumentException("candidatePoolSize must be >= 1");
            }
            this.candidatePoolSize = candidatePoolSize;
            return this;
        }

        public MatcherConfig build() {
            return new MatcherConfig(this);
        }
    }
}

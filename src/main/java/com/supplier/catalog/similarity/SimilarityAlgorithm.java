package com.supplier.catalog.similarity;

/**
 * Scores how alike two normalized product labels are.
 * Implementations return 0.0 for unrelated input and 1.0 for identical input.
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}

package com.supplier.catalog.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weighted blend of token overlap and edit distance:
 * {@code score = tokenWeight * jaccard + editWeight * levenshtein}.
 */
public class CompositeSimilarityScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(CompositeSimilarityScorer.class);

    private final JaccardSimilarity jaccard = new JaccardSimilarity();
    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final SimilarityWeights weights;

    public CompositeSimilarityScorer() {
        this(SimilarityWeights.defaultWeights());
    }

    public CompositeSimilarityScorer(SimilarityWeights weights) {
        this.weights = weights;
    }

    @Override
    public double compute(String s1, String s2) {
        return computeWithBreakdown(s1, s2).compositeScore();
    }

    @Override
    public String getName() {
        return "Composite";
    }

    public SimilarityBreakdown computeWithBreakdown(String s1, String s2) {
        if (s1 != null && s1.equals(s2)) {
            return new SimilarityBreakdown(1.0, 1.0, 1.0, weights);
        }
        double tokenScore = jaccard.compute(s1, s2);
        double editScore = levenshtein.compute(s1, s2);
        double composite = weights.tokenWeight() * tokenScore + weights.editWeight() * editScore;
        // guard against floating point drift past 1.0
        composite = Math.min(1.0, composite);

        log.trace("similarity '{}' vs '{}' jaccard={} levenshtein={} composite={}",
                s1, s2, tokenScore, editScore, composite);
        return new SimilarityBreakdown(tokenScore, editScore, composite, weights);
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    public record SimilarityBreakdown(
            double tokenScore,
            double editScore,
            double compositeScore,
            SimilarityWeights weights
    ) {
        @Override
        public String toString() {
            return String.format("SimilarityBreakdown{jaccard=%.4f (w=%.2f), levenshtein=%.4f (w=%.2f), composite=%.4f}",
                    tokenScore, weights.tokenWeight(), editScore, weights.editWeight(), compositeScore);
        }
    }
}

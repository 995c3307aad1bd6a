package com.supplier.catalog.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token overlap: |shared tokens| / |all tokens|. Insensitive to word order,
 * which suits supplier labels that put the brand or pack size in front.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        Set<String> left = tokens(s1);
        Set<String> right = tokens(s2);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }

        int shared = 0;
        for (String token : left) {
            if (right.contains(token)) {
                shared++;
            }
        }
        int union = left.size() + right.size() - shared;
        return (double) shared / union;
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    static Set<String> tokens(String text) {
        Set<String> tokens = new HashSet<>();
        for (String token : WHITESPACE.split(text.toLowerCase(Locale.ROOT).trim())) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}

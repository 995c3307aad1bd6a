package com.supplier.catalog.similarity;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One key per significant token ({@code tok:gauze}). Tokens shorter than the
 * minimum length are dropped unless they contain a digit, since pack sizes
 * like "5x5" are distinctive.
 */
public class TokenBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final int DEFAULT_MIN_TOKEN_LENGTH = 3;

    private final int minTokenLength;

    public TokenBlockingKeyStrategy() {
        this(DEFAULT_MIN_TOKEN_LENGTH);
    }

    public TokenBlockingKeyStrategy(int minTokenLength) {
        if (minTokenLength < 1) {
            throw new IllegalArgumentException("minTokenLength must be >= 1");
        }
        this.minTokenLength = minTokenLength;
    }

    @Override
    public Set<String> generateKeys(String normalizedName) {
        Set<String> keys = new LinkedHashSet<>();
        if (normalizedName == null || normalizedName.isBlank()) {
            return keys;
        }
        for (String token : JaccardSimilarity.tokens(normalizedName)) {
            if (token.length() >= minTokenLength || token.chars().anyMatch(Character::isDigit)) {
                keys.add("tok:" + token);
            }
        }
        return keys;
    }
}

package com.supplier.catalog.similarity;

import java.util.Set;

/**
 * Generates blocking keys from a normalized product label. Products sharing at
 * least one key with an incoming row become fuzzy-match candidates, so the
 * matcher never scans the whole catalog.
 */
public interface BlockingKeyStrategy {

    /**
     * @param normalizedName output of the normalization engine
     * @return blocking keys, never null
     */
    Set<String> generateKeys(String normalizedName);
}

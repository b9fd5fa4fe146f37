package com.catalog.resolution.similarity;

import java.util.Set;

/**
 * Derives the keys a candidate store filters on before any row is scored.
 *
 * <p>A store returns a row only if it shares a key with the query or its text equals
 * the query. Keys must never exclude a row that would score above zero.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * @param normalizedText output of {@code TextNormalizer.normalize}
     * @return the keys, empty for text too short to produce any
     */
    Set<String> generateKeys(String normalizedText);
}

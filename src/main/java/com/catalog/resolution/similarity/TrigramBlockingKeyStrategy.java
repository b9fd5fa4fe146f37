package com.catalog.resolution.similarity;

import java.util.Set;

/**
 * Uses the trigrams themselves as blocking keys.
 * Any row sharing a key with the query shares a trigram with it, which is exactly the
 * condition for a non-zero trigram similarity.
 */
public class TrigramBlockingKeyStrategy implements BlockingKeyStrategy {

    @Override
    public Set<String> generateKeys(String normalizedText) {
        return TrigramProfile.of(normalizedText).trigrams();
    }
}

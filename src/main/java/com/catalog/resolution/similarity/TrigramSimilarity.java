package com.catalog.resolution.similarity;

/**
 * Trigram-set Jaccard similarity.
 * Computes similarity as |shared trigrams| / |union of trigrams|.
 *
 * <p>Identical strings score 1.0, including two empty strings. A string without any
 * trigram scores 0.0 against every other string.</p>
 */
public class TrigramSimilarity {

    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        return compute(TrigramProfile.of(s1), TrigramProfile.of(s2));
    }

    /**
     * Computes the similarity of two prepared profiles.
     * Lets callers extract the query's trigrams once per resolution call.
     */
    public double compute(TrigramProfile p1, TrigramProfile p2) {
        if (p1.text().equals(p2.text())) {
            return 1.0;
        }
        if (p1.isEmpty() || p2.isEmpty()) {
            return 0.0;
        }

        int shared = p1.sharedCount(p2);
        // |union| = |A| + |B| - |intersection|
        int union = p1.trigrams().size() + p2.trigrams().size() - shared;
        return (double) shared / union;
    }

    /**
     * Returns true if the candidate can score above zero against the query.
     * Candidates that fail this check are skipped without being scored.
     */
    public boolean isScorable(TrigramProfile query, TrigramProfile candidate) {
        return query.text().equals(candidate.text()) || query.sharesAnyWith(candidate);
    }
}

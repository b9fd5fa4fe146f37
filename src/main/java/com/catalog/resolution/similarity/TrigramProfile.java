package com.catalog.resolution.similarity;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The trigram set of a normalized string.
 *
 * <p>Words are maximal runs of letters and digits. Each word is padded with two leading
 * spaces and one trailing space before being cut into overlapping three-code-point
 * shingles, so "a" still yields {@code "  a"} and {@code " a "}. Punctuation and
 * whitespace only separate words.</p>
 */
public final class TrigramProfile {

    private static final TrigramProfile EMPTY = new TrigramProfile("", Set.of());

    private final String text;
    private final Set<String> trigrams;

    private TrigramProfile(String text, Set<String> trigrams) {
        this.text = text;
        this.trigrams = trigrams;
    }

    /**
     * Builds the profile of a normalized string.
     */
    public static TrigramProfile of(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return EMPTY;
        }
        Set<String> trigrams = new LinkedHashSet<>();
        int[] codePoints = normalized.codePoints().toArray();
        int wordStart = -1;
        for (int i = 0; i <= codePoints.length; i++) {
            boolean wordChar = i < codePoints.length && Character.isLetterOrDigit(codePoints[i]);
            if (wordChar && wordStart < 0) {
                wordStart = i;
            } else if (!wordChar && wordStart >= 0) {
                addWordTrigrams(codePoints, wordStart, i, trigrams);
                wordStart = -1;
            }
        }
        return new TrigramProfile(normalized, Collections.unmodifiableSet(trigrams));
    }

    private static void addWordTrigrams(int[] codePoints, int start, int end, Set<String> out) {
        int length = end - start;
        int[] padded = new int[length + 3];
        padded[0] = ' ';
        padded[1] = ' ';
        System.arraycopy(codePoints, start, padded, 2, length);
        padded[padded.length - 1] = ' ';
        for (int i = 0; i + 3 <= padded.length; i++) {
            out.add(new String(padded, i, 3));
        }
    }

    public String text() {
        return text;
    }

    public Set<String> trigrams() {
        return trigrams;
    }

    public boolean isEmpty() {
        return trigrams.isEmpty();
    }

    /**
     * Counts trigrams present in both profiles.
     */
    public int sharedCount(TrigramProfile other) {
        Set<String> smaller = trigrams.size() <= other.trigrams.size() ? trigrams : other.trigrams;
        Set<String> larger = smaller == trigrams ? other.trigrams : trigrams;
        int shared = 0;
        for (String trigram : smaller) {
            if (larger.contains(trigram)) {
                shared++;
            }
        }
        return shared;
    }

    /**
     * Returns true if the profiles have at least one trigram in common.
     */
    public boolean sharesAnyWith(TrigramProfile other) {
        Set<String> smaller = trigrams.size() <= other.trigrams.size() ? trigrams : other.trigrams;
        Set<String> larger = smaller == trigrams ? other.trigrams : trigrams;
        for (String trigram : smaller) {
            if (larger.contains(trigram)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TrigramProfile that = (TrigramProfile) o;
        return Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }

    @Override
    public String toString() {
        return "TrigramProfile{text='" + text + "', trigrams=" + trigrams.size() + '}';
    }
}

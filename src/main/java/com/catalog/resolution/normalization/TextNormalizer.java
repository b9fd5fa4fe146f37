package com.catalog.resolution.normalization;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes text into the form stored next to every entity name and alias and
 * computed fresh for every incoming query.
 *
 * <p>The transform lower-cases with {@link Locale#ROOT}, decomposes to NFD and drops
 * combining marks ("Café" becomes "cafe"), then trims surrounding whitespace, Unicode
 * space separators (no-break and figure spaces included) and zero-width characters. It is
 * total, pure and idempotent.</p>
 *
 * <p>Stored normalized text is only comparable with queries normalized by the same
 * {@link #VERSION}. Bumping the version means every stored row must be re-normalized.</p>
 */
public final class TextNormalizer {

    /** Version of the normalization function. */
    public static final int VERSION = 2;

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final String EDGE = "[\\p{Z}\\p{javaWhitespace}\\u200B-\\u200D\\u2060\\uFEFF]+";
    private static final Pattern SURROUNDING_BLANKS = Pattern.compile("^" + EDGE + "|" + EDGE + "$");

    private TextNormalizer() {
        // utility class
    }

    /**
     * Normalizes the given text. Null normalizes to the empty string.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        // Case folding runs first: some upper-case letters fold to a base letter plus a combining mark.
        String folded = text.toLowerCase(Locale.ROOT);
        String decomposed = Normalizer.normalize(folded, Normalizer.Form.NFD);
        String unmarked = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return SURROUNDING_BLANKS.matcher(unmarked).replaceAll("");
    }

    /**
     * Returns true if the text is empty once normalized.
     */
    public static boolean isBlankAfterNormalization(String text) {
        return normalize(text).isEmpty();
    }
}

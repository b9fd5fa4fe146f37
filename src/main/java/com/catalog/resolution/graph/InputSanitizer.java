package com.catalog.resolution.graph;

/**
 * Checks text before it is rendered into a Cypher statement.
 * {@link FalkorDBConnection} inlines parameters, so every catalog string written to the
 * graph is bounded in length and kept to a single printable line.
 */
public final class InputSanitizer {

    /** Longest display name or alias text accepted. */
    public static final int MAX_TEXT_LENGTH = 1000;

    /** Longest string value of any kind, serialized profile JSON included. */
    public static final int MAX_CYPHER_VALUE_LENGTH = 4000;

    private InputSanitizer() {
    }

    /**
     * @param field label used in the error message, e.g. "Alias text"
     * @throws IllegalArgumentException if the value is blank, too long, or spans lines
     */
    public static void validateText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        if (value.length() > MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "%s is %d characters, limit is %d", field, value.length(), MAX_TEXT_LENGTH));
        }
        if (value.chars().anyMatch(InputSanitizer::isForbiddenControl)) {
            throw new IllegalArgumentException(field + " must not contain control characters");
        }
    }

    /**
     * @throws IllegalArgumentException if a non-null value exceeds {@link #MAX_CYPHER_VALUE_LENGTH}
     */
    public static void checkCypherValueLength(String value) {
        if (value != null && value.length() > MAX_CYPHER_VALUE_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "Cypher value is %d characters, limit is %d", value.length(), MAX_CYPHER_VALUE_LENGTH));
        }
    }

    // C0 controls other than tab, plus DEL
    private static boolean isForbiddenControl(int c) {
        return (c < 0x20 && c != '\t') || c == 0x7F;
    }
}

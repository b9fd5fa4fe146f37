package com.catalog.resolution.normalization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TextNormalizer Tests")
class TextNormalizerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Hammer Strength Chest Press|hammer strength chest press",
            "'  Lat Pulldown  '|lat pulldown",
            "Développé Couché|developpe couche",
            "CAFÉ|cafe",
            "Crème Brûlée|creme brulee",
            "Chest Press (Plate-Loaded)|chest press (plate-loaded)",
            "Ñandú|nandu"
    })
    @DisplayName("Should lower-case, strip marks and trim")
    void normalizes(String input, String expected) {
        assertEquals(expected, TextNormalizer.normalize(input));
    }

    @Test
    @DisplayName("Null and empty input normalize to empty")
    void nullAndEmpty() {
        assertEquals("", TextNormalizer.normalize(null));
        assertEquals("", TextNormalizer.normalize(""));
    }

    @Test
    @DisplayName("Inner whitespace and punctuation are kept")
    void keepsInnerText() {
        assertEquals("egg,  whole", TextNormalizer.normalize("Egg,  Whole\t"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Développé Couché", "  ÅNGSTRÖM  ", "İstanbul", "straße", "Greek Yogurt, Plain", "x\u0301\u0301"})
    @DisplayName("Normalization is idempotent")
    void idempotent(String input) {
        String once = TextNormalizer.normalize(input);
        assertEquals(once, TextNormalizer.normalize(once));
    }

    @Test
    @DisplayName("Locale-sensitive letters fold with the root locale")
    void rootLocaleFolding() {
        // Turkish dotted capital I folds to i plus a combining dot, which is then dropped
        assertEquals("istanbul", TextNormalizer.normalize("İstanbul"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t\n", "\u0301", "\u00A0", "\u2007", "\u200B", "\u3000", "\uFEFF \u00A0"})
    @DisplayName("Whitespace and lone combining marks are blank after normalization")
    void blankAfterNormalization(String input) {
        assertTrue(TextNormalizer.isBlankAfterNormalization(input));
    }

    @Test
    @DisplayName("No-break, figure and zero-width spaces are trimmed but kept inside")
    void trimsUnicodeSpaces() {
        assertEquals("lat pulldown", TextNormalizer.normalize("\u00A0Lat Pulldown\u2007"));
        assertEquals("lat pulldown", TextNormalizer.normalize("\u200BLat Pulldown\u200B"));
        assertEquals("lat\u00A0pulldown", TextNormalizer.normalize(" Lat\u00A0Pulldown\u202F"));
    }

    @Test
    @DisplayName("Text with letters is not blank")
    void notBlank() {
        assertFalse(TextNormalizer.isBlankAfterNormalization(" a "));
    }
}

package com.catalog.resolution.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FalkorDBConnection parameter inlining")
class FalkorDBConnectionTest {

    @Test
    @DisplayName("Strings are quoted and escaped")
    void quotesStrings() {
        assertEquals("'it\\'s'", FalkorDBConnection.formatValue("it's"));
        assertEquals("'a\\\\b'", FalkorDBConnection.formatValue("a\\b"));
    }

    @Test
    @DisplayName("Scalars and null are written as literals")
    void scalars() {
        assertEquals("null", FalkorDBConnection.formatValue(null));
        assertEquals("42", FalkorDBConnection.formatValue(42));
        assertEquals("1700000000000", FalkorDBConnection.formatValue(1_700_000_000_000L));
        assertEquals("0.95", FalkorDBConnection.formatValue(0.95));
        assertEquals("true", FalkorDBConnection.formatValue(true));
    }

    @Test
    @DisplayName("Collections become Cypher lists")
    void lists() {
        assertEquals("['  l', ' la']", FalkorDBConnection.formatValue(List.of("  l", " la")));
        assertEquals("[]", FalkorDBConnection.formatValue(List.of()));
    }

    @Test
    @DisplayName("Placeholders are substituted by name")
    void substitutes() {
        String query = FalkorDBConnection.processParams(
                "MATCH (e:CatalogEntity {id: $id}) WHERE e.kind = $kind RETURN e",
                Map.of("id", "e1", "kind", "FOOD"));

        assertEquals("MATCH (e:CatalogEntity {id: 'e1'}) WHERE e.kind = 'FOOD' RETURN e", query);
    }

    @Test
    @DisplayName("A name that prefixes another does not clobber it")
    void prefixNames() {
        String query = FalkorDBConnection.processParams(
                "SET e.id = $id, e.idx = $idx",
                Map.of("id", "a", "idx", 2));

        assertEquals("SET e.id = 'a', e.idx = 2", query);
    }

    @Test
    @DisplayName("Values containing placeholders are not substituted again")
    void singlePass() {
        String query = FalkorDBConnection.processParams(
                "SET a.value = $value, a.locale = $locale",
                Map.of("value", "costs $locale", "locale", "en"));

        assertEquals("SET a.value = 'costs $locale', a.locale = 'en'", query);
    }

    @Test
    @DisplayName("Unknown placeholders are left untouched")
    void unknownKept() {
        assertEquals("RETURN $missing, 'x'",
                FalkorDBConnection.processParams("RETURN $missing, $known", Map.of("known", "x")));
        assertEquals("RETURN $any", FalkorDBConnection.processParams("RETURN $any", Map.of()));
    }
}

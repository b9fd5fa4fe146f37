package com.catalog.resolution.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchCandidateTest {

    @Test
    void testCanonicalFactory() {
        MatchCandidate match = MatchCandidate.canonical("ex-1", "Treadmill Run", 0.8);

        assertEquals("Treadmill Run", match.matchedText());
        assertEquals(MatchSource.CANONICAL, match.source());
        assertFalse(match.isAliasMatch());
        assertNull(match.brand());
    }

    @Test
    void testScoreRange() {
        assertThrows(IllegalArgumentException.class,
                () -> new MatchCandidate("e", "n", "t", MatchSource.ALIAS, 1.01, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new MatchCandidate("e", "n", "t", MatchSource.ALIAS, -0.01, null, null));
    }

    @Test
    void testWireNames() {
        assertEquals("canonical", MatchSource.CANONICAL.getWireName());
        assertEquals("alias", MatchSource.ALIAS.getWireName());
        assertEquals("Exercise", EntityKind.EXERCISE.getLabel());
        assertEquals("Food", EntityKind.FOOD.getLabel());
    }

    @Test
    void testCanonicalOrderedBeforeAlias() {
        assertTrue(MatchSource.CANONICAL.compareTo(MatchSource.ALIAS) < 0);
    }
}

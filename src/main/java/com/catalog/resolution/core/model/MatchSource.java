package com.catalog.resolution.core.model;

/**
 * Which candidate source produced a match.
 * Declaration order is the tie-break priority: a canonical hit beats an alias hit with the same score.
 */
public enum MatchSource {
    CANONICAL("canonical"),
    ALIAS("alias");

    private final String wireName;

    MatchSource(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}

package com.catalog.resolution.core.model;

/**
 * Provenance of an alias.
 */
public enum AliasSource {
    /**
     * Curated seed data shipped with the catalog.
     */
    SEED,

    /**
     * Submitted by an end user.
     */
    USER,

    /**
     * Proposed by an LLM or heuristic mapper, usually with a confidence below 1.
     */
    LLM,

    /**
     * Brought in by an automated import.
     */
    IMPORT
}

package com.catalog.resolution.core.model;

/**
 * Kinds of catalog entity the resolver can match against.
 * Each kind is served by its own candidate store.
 */
public enum EntityKind {
    EXERCISE("Exercise"),
    FOOD("Food");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

package com.catalog.resolution.store;

/**
 * A canonical-name row offered to the resolver.
 *
 * @param entityId       the entity
 * @param normalizedName the stored normalized display name
 * @param rawName        the display name as entered
 */
public record CanonicalCandidate(String entityId, String normalizedName, String rawName) {}

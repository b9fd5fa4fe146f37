package com.catalog.resolution.store;

/**
 * An alias row offered to the resolver, joined with its entity's display name.
 *
 * @param entityId        the entity the alias points to
 * @param displayName     the entity's display name
 * @param normalizedAlias the stored normalized alias text
 * @param rawAlias        the alias as entered
 * @param brand           brand annotation, may be null
 * @param model           model annotation, may be null
 */
public record AliasCandidate(
        String entityId,
        String displayName,
        String normalizedAlias,
        String rawAlias,
        String brand,
        String model
) {}

package com.catalog.resolution.cache;

import com.catalog.resolution.core.model.EntityKind;

/**
 * Everything a resolution result depends on besides the catalog contents.
 */
public record ResolutionCacheKey(
        EntityKind kind,
        String normalizedQuery,
        String locale,
        int maxResults,
        double minScore
) {}

package com.catalog.resolution.store;

import java.util.Set;

/**
 * Prefilter hint passed to a store along with a candidate request.
 * A store honoring it returns only rows whose normalized text equals the query or
 * shares at least one blocking key with it.
 *
 * @param normalizedQuery the normalized query text
 * @param blockingKeys    the query's blocking keys
 */
public record CandidateHint(String normalizedQuery, Set<String> blockingKeys) {
    public CandidateHint {
        blockingKeys = blockingKeys != null ? Set.copyOf(blockingKeys) : Set.of();
    }
}

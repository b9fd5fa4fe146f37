package com.catalog.resolution.core.model;

import java.util.Objects;

/**
 * A scored hit produced while resolving a single query.
 * Lives only for the duration of one resolution call.
 *
 * @param entityId    the matched entity
 * @param displayName the entity's display name, used as the secondary ranking key
 * @param matchedText the raw canonical name or alias text that produced the hit
 * @param source      whether the hit came from the canonical name or an alias
 * @param score       trigram similarity in [0,1]
 * @param brand       brand carried by the alias, if any
 * @param model       model carried by the alias, if any
 */
public record MatchCandidate(
        String entityId,
        String displayName,
        String matchedText,
        MatchSource source,
        double score,
        String brand,
        String model
) {
    public MatchCandidate {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(displayName, "displayName is required");
        Objects.requireNonNull(matchedText, "matchedText is required");
        Objects.requireNonNull(source, "source is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
    }

    public static MatchCandidate canonical(String entityId, String displayName, double score) {
        return new MatchCandidate(entityId, displayName, displayName, MatchSource.CANONICAL, score, null, null);
    }

    public boolean isAliasMatch() {
        return source == MatchSource.ALIAS;
    }
}

package com.catalog.resolution.api;

import com.catalog.resolution.core.model.CatalogEntity;
import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.core.model.ExerciseProfile;
import com.catalog.resolution.core.model.MatchCandidate;
import com.catalog.resolution.core.model.MatchSource;
import com.catalog.resolution.core.model.NutritionProfile;

import java.util.Objects;

/**
 * A ranked match hydrated with the entity's descriptive fields.
 * This is what callers outside the library see.
 */
public record ResolvedMatch(
        String entityId,
        EntityKind kind,
        String displayName,
        String category,
        String modality,
        double score,
        String matchedText,
        MatchSource matchedSource,
        String brand,
        String model,
        ExerciseProfile exerciseProfile,
        NutritionProfile nutritionProfile
) {
    public ResolvedMatch {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(matchedSource, "matchedSource is required");
    }

    /**
     * Combines a match with the entity it points to.
     * The entity's current display name wins over the one captured while scoring.
     */
    public static ResolvedMatch of(MatchCandidate match, CatalogEntity entity) {
        if (!match.entityId().equals(entity.getId())) {
            throw new IllegalArgumentException("Match " + match.entityId()
                    + " does not belong to entity " + entity.getId());
        }
        return new ResolvedMatch(
                entity.getId(),
                entity.getKind(),
                entity.getDisplayName(),
                entity.getCategory(),
                entity.getModality(),
                match.score(),
                match.matchedText(),
                match.source(),
                match.brand(),
                match.model(),
                entity.getExerciseProfile(),
                entity.getNutritionProfile());
    }
}

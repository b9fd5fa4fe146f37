package com.catalog.resolution.rest.dto;

import com.catalog.resolution.core.model.CatalogEntity;
import com.catalog.resolution.core.model.ExerciseProfile;
import com.catalog.resolution.core.model.NutritionProfile;

/**
 * A single catalog entity as returned by the lookup and curation endpoints.
 */
public record CatalogEntityResponse(
        String id,
        String kind,
        String displayName,
        String category,
        String modality,
        boolean active,
        boolean isPublic,
        ExerciseProfile exercise,
        NutritionProfile nutrition
) {
    public static CatalogEntityResponse from(CatalogEntity entity) {
        return new CatalogEntityResponse(
                entity.getId(),
                entity.getKind().getLabel(),
                entity.getDisplayName(),
                entity.getCategory(),
                entity.getModality(),
                entity.isActive(),
                entity.isPublic(),
                entity.getExerciseProfile(),
                entity.getNutritionProfile()
        );
    }
}

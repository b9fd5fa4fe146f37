package com.catalog.resolution.rest.dto;

import com.catalog.resolution.api.ResolvedMatch;
import com.catalog.resolution.core.model.ExerciseProfile;
import com.catalog.resolution.core.model.NutritionProfile;

/**
 * One search hit as returned over HTTP.
 * {@code matchedSource} is {@code canonical} or {@code alias}.
 */
public record SearchMatchResponse(
        String id,
        String kind,
        String displayName,
        String category,
        String modality,
        double score,
        String matchedText,
        String matchedSource,
        String brand,
        String model,
        ExerciseProfile exercise,
        NutritionProfile nutrition
) {
    public static SearchMatchResponse from(ResolvedMatch match) {
        return new SearchMatchResponse(
                match.entityId(),
                match.kind().getLabel(),
                match.displayName(),
                match.category(),
                match.modality(),
                match.score(),
                match.matchedText(),
                match.matchedSource().getWireName(),
                match.brand(),
                match.model(),
                match.exerciseProfile(),
                match.nutritionProfile()
        );
    }
}

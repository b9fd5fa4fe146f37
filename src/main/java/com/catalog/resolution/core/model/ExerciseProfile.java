package com.catalog.resolution.core.model;

import java.util.List;

/**
 * Exercise-specific descriptive fields of a catalog entity.
 */
public record ExerciseProfile(
        String slug,
        String movementPattern,
        List<String> primaryMuscles,
        List<String> secondaryMuscles,
        List<String> joints,
        List<String> equipmentRequired,
        boolean unilateral
) {
    public ExerciseProfile {
        primaryMuscles = primaryMuscles != null ? List.copyOf(primaryMuscles) : List.of();
        secondaryMuscles = secondaryMuscles != null ? List.copyOf(secondaryMuscles) : List.of();
        joints = joints != null ? List.copyOf(joints) : List.of();
        equipmentRequired = equipmentRequired != null ? List.copyOf(equipmentRequired) : List.of();
    }
}

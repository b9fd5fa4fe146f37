package com.catalog.resolution.core.model;

/**
 * Food-specific descriptive fields of a catalog entity.
 * Nutrient values are expressed against {@link #basis()} and may be null when unknown.
 */
public record NutritionProfile(
        String brand,
        String barcode,
        String basis,
        Double kcal,
        Double proteinG,
        Double carbsG,
        Double fatG,
        Double fiberG,
        Double sugarG,
        Double sodiumMg
) {
    public static final String PER_100G = "per_100g";
    public static final String PER_SERVING = "per_serving";
    public static final String PER_UNIT = "per_unit";

    public NutritionProfile {
        if (basis == null) {
            basis = PER_100G;
        }
        if (!basis.equals(PER_100G) && !basis.equals(PER_SERVING) && !basis.equals(PER_UNIT)) {
            throw new IllegalArgumentException("Unsupported nutrition basis: " + basis);
        }
    }
}

package com.catalog.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A canonical catalog item: an exercise or a food.
 * Instances are immutable; stores replace whole rows so readers never observe a partial update.
 */
public final class CatalogEntity {
    private final String id;
    private final EntityKind kind;
    private final String displayName;
    private final String normalizedName;
    private final String category;
    private final String modality;
    private final boolean active;
    private final boolean isPublic;
    private final ExerciseProfile exerciseProfile;
    private final NutritionProfile nutritionProfile;
    private final Instant createdAt;
    private final Instant updatedAt;

    private CatalogEntity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.kind = builder.kind;
        this.displayName = builder.displayName;
        this.normalizedName = builder.normalizedName;
        this.category = builder.category;
        this.modality = builder.modality;
        this.active = builder.active;
        this.isPublic = builder.isPublic;
        this.exerciseProfile = builder.exerciseProfile;
        this.nutritionProfile = builder.nutritionProfile;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getCategory() {
        return category;
    }

    public String getModality() {
        return modality;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Whether the entity is listed in public search results. User-submitted foods
     * stay private until approved.
     */
    public boolean isPublic() {
        return isPublic;
    }

    public ExerciseProfile getExerciseProfile() {
        return exerciseProfile;
    }

    public NutritionProfile getNutritionProfile() {
        return nutritionProfile;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CatalogEntity that = (CatalogEntity) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CatalogEntity{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", displayName='" + displayName + '\'' +
                ", normalizedName='" + normalizedName + '\'' +
                ", category='" + category + '\'' +
                ", active=" + active +
                ", public=" + isPublic +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(CatalogEntity entity) {
        return new Builder()
                .id(entity.id)
                .kind(entity.kind)
                .displayName(entity.displayName)
                .normalizedName(entity.normalizedName)
                .category(entity.category)
                .modality(entity.modality)
                .active(entity.active)
                .isPublic(entity.isPublic)
                .exerciseProfile(entity.exerciseProfile)
                .nutritionProfile(entity.nutritionProfile)
                .createdAt(entity.createdAt)
                .updatedAt(entity.updatedAt);
    }

    public static class Builder {
        private String id;
        private EntityKind kind;
        private String displayName;
        private String normalizedName;
        private String category;
        private String modality;
        private boolean active = true;
        private boolean isPublic = true;
        private ExerciseProfile exerciseProfile;
        private NutritionProfile nutritionProfile;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(EntityKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder modality(String modality) {
            this.modality = modality;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder isPublic(boolean isPublic) {
            this.isPublic = isPublic;
            return this;
        }

        public Builder exerciseProfile(ExerciseProfile exerciseProfile) {
            this.exerciseProfile = exerciseProfile;
            return this;
        }

        public Builder nutritionProfile(NutritionProfile nutritionProfile) {
            this.nutritionProfile = nutritionProfile;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public CatalogEntity build() {
            Objects.requireNonNull(kind, "kind is required");
            Objects.requireNonNull(displayName, "displayName is required");
            if (kind == EntityKind.EXERCISE && nutritionProfile != null) {
                throw new IllegalArgumentException("An exercise cannot carry a nutrition profile");
            }
            if (kind == EntityKind.FOOD && exerciseProfile != null) {
                throw new IllegalArgumentException("A food cannot carry an exercise profile");
            }
            return new CatalogEntity(this);
        }
    }
}

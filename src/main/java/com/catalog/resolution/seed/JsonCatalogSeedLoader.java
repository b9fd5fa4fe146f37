package com.catalog.resolution.seed;

import com.catalog.resolution.core.model.Alias;
import com.catalog.resolution.core.model.AliasSource;
import com.catalog.resolution.core.model.CatalogEntity;
import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.core.model.ExerciseProfile;
import com.catalog.resolution.core.model.NutritionProfile;
import com.catalog.resolution.logging.LogContext;
import com.catalog.resolution.normalization.TextNormalizer;
import com.catalog.resolution.store.CatalogWriter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Loads catalog seed data from JSON and writes it through a {@link CatalogWriter}.
 *
 * <pre>
 * {
 *   "kind": "EXERCISE",
 *   "entities": [
 *     {
 *       "display_name": "Chest Press (Plate-Loaded)",
 *       "category": "strength",
 *       "exercise": { "slug": "chest-press-plate-loaded", "primary_muscles": ["chest"] },
 *       "aliases": [
 *         { "value": "Hammer Strength Chest Press", "brand": "Hammer Strength", "confidence": 0.95 }
 *       ]
 *     }
 *   ]
 * }
 * </pre>
 *
 * <p>An entity without an explicit id gets one derived from its kind and normalized
 * name, so loading the same document twice rewrites the same entities and skips every
 * alias as a duplicate. The {@code active} and {@code public} flags only apply when an
 * entity is first created; a reload never reactivates or republishes a curated row.</p>
 */
public class JsonCatalogSeedLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonCatalogSeedLoader.class);

    private final ObjectMapper objectMapper;

    public JsonCatalogSeedLoader() {
        this(new ObjectMapper());
    }

    public JsonCatalogSeedLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads a seed document from the classpath.
     *
     * @throws FileNotFoundException if the resource does not exist
     */
    public SeedResult loadResource(String resourcePath, CatalogWriter writer) throws IOException {
        try (InputStream in = JsonCatalogSeedLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new FileNotFoundException("Seed resource not found: " + resourcePath);
            }
            return load(resourcePath, in, writer);
        }
    }

    public SeedResult load(InputStream in, CatalogWriter writer) throws IOException {
        return load("stream-" + UUID.randomUUID().toString().substring(0, 8), in, writer);
    }

    /**
     * Reads a seed document and writes its entities and aliases.
     * The stream is not closed.
     *
     * @param seedId name of the seed, used in log context
     * @throws IOException              if the document cannot be read or parsed
     * @throws IllegalArgumentException if the document is structurally invalid
     */
    public SeedResult load(String seedId, InputStream in, CatalogWriter writer) throws IOException {
        SeedDocument document = objectMapper.readValue(in, SeedDocument.class);
        if (document.kind() == null) {
            throw new IllegalArgumentException("Seed document must declare a kind");
        }
        EntityKind kind = EntityKind.valueOf(document.kind().toUpperCase(Locale.ROOT));
        List<SeedEntity> entities = document.entities() != null ? document.entities() : List.of();

        int entityCount = 0;
        int aliasCount = 0;
        int skipped = 0;
        try (LogContext ctx = LogContext.forSeed(seedId, kind)) {
            log.info("seed.started seedId={} kind={} entities={}", seedId, kind, entities.size());
            for (SeedEntity seedEntity : entities) {
                CatalogEntity saved = writer.saveEntity(toEntity(kind, seedEntity));
                entityCount++;

                List<SeedAlias> aliases = seedEntity.aliases() != null ? seedEntity.aliases() : List.of();
                for (SeedAlias seedAlias : aliases) {
                    Alias submitted = toAlias(saved.getId(), seedAlias);
                    Alias stored = writer.saveAlias(submitted);
                    if (stored.getId().equals(submitted.getId())) {
                        aliasCount++;
                    } else {
                        skipped++;
                    }
                }
            }
            log.info("seed.completed seedId={} entities={} aliases={} skippedDuplicates={}",
                    seedId, entityCount, aliasCount, skipped);
        }
        return new SeedResult(entityCount, aliasCount, skipped);
    }

    private static CatalogEntity toEntity(EntityKind kind, SeedEntity seed) {
        if (seed.displayName() == null || seed.displayName().isBlank()) {
            throw new IllegalArgumentException("Seed entity without display_name");
        }
        String id = seed.id() != null ? seed.id() : derivedId(kind, seed.displayName());
        CatalogEntity.Builder builder = CatalogEntity.builder()
                .id(id)
                .kind(kind)
                .displayName(seed.displayName())
                .category(seed.category())
                .modality(seed.modality())
                .active(seed.active() == null || seed.active())
                .isPublic(seed.isPublic() == null || seed.isPublic());

        if (seed.exercise() != null) {
            SeedExercise e = seed.exercise();
            builder.exerciseProfile(new ExerciseProfile(e.slug(), e.movementPattern(), e.primaryMuscles(),
                    e.secondaryMuscles(), e.joints(), e.equipmentRequired(), Boolean.TRUE.equals(e.unilateral())));
        }
        if (seed.nutrition() != null) {
            SeedNutrition n = seed.nutrition();
            builder.nutritionProfile(new NutritionProfile(n.brand(), n.barcode(), n.basis(),
                    n.kcal(), n.proteinG(), n.carbsG(), n.fatG(), n.fiberG(), n.sugarG(), n.sodiumMg()));
        }
        return builder.build();
    }

    private static Alias toAlias(String entityId, SeedAlias seed) {
        if (seed.value() == null || seed.value().isBlank()) {
            throw new IllegalArgumentException("Seed alias without value for entity " + entityId);
        }
        return Alias.builder()
                .entityId(entityId)
                .value(seed.value())
                .locale(seed.locale() != null ? seed.locale() : Alias.DEFAULT_LOCALE)
                .brand(seed.brand())
                .model(seed.model())
                .source(seed.source() != null
                        ? AliasSource.valueOf(seed.source().toUpperCase(Locale.ROOT))
                        : AliasSource.SEED)
                .confidence(seed.confidence())
                .active(seed.active() == null || seed.active())
                .build();
    }

    static String derivedId(EntityKind kind, String displayName) {
        String key = kind.name() + ":" + TextNormalizer.normalize(displayName);
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedDocument(
            String kind,
            List<SeedEntity> entities
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedEntity(
            String id,
            @JsonProperty("display_name") String displayName,
            String category,
            String modality,
            Boolean active,
            @JsonProperty("public") Boolean isPublic,
            SeedExercise exercise,
            SeedNutrition nutrition,
            List<SeedAlias> aliases
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedExercise(
            String slug,
            @JsonProperty("movement_pattern") String movementPattern,
            @JsonProperty("primary_muscles") List<String> primaryMuscles,
            @JsonProperty("secondary_muscles") List<String> secondaryMuscles,
            List<String> joints,
            @JsonProperty("equipment_required") List<String> equipmentRequired,
            Boolean unilateral
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedNutrition(
            String brand,
            String barcode,
            String basis,
            Double kcal,
            @JsonProperty("protein_g") Double proteinG,
            @JsonProperty("carbs_g") Double carbsG,
            @JsonProperty("fat_g") Double fatG,
            @JsonProperty("fiber_g") Double fiberG,
            @JsonProperty("sugar_g") Double sugarG,
            @JsonProperty("sodium_mg") Double sodiumMg
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedAlias(
            String value,
            String locale,
            String brand,
            String model,
            String source,
            Double confidence,
            Boolean active
    ) {}
}

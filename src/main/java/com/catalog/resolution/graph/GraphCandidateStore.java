package com.catalog.resolution.graph;

import com.catalog.resolution.core.model.Alias;
import com.catalog.resolution.core.model.AliasSource;
import com.catalog.resolution.core.model.CatalogEntity;
import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.core.model.ExerciseProfile;
import com.catalog.resolution.core.model.NutritionProfile;
import com.catalog.resolution.normalization.TextNormalizer;
import com.catalog.resolution.similarity.BlockingKeyStrategy;
import com.catalog.resolution.similarity.TrigramBlockingKeyStrategy;
import com.catalog.resolution.store.AliasCandidate;
import com.catalog.resolution.store.CandidateHint;
import com.catalog.resolution.store.CandidateStore;
import com.catalog.resolution.store.CanonicalCandidate;
import com.catalog.resolution.store.CatalogChangeListener;
import com.catalog.resolution.store.CatalogWriter;
import com.catalog.resolution.store.StoreUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Catalog store backed by a FalkorDB graph.
 *
 * <p>One store serves one {@link EntityKind}; several stores may share a graph.
 * Descriptive profiles are stored as JSON strings. Every driver failure on the read path
 * surfaces as {@link StoreUnavailableException}.</p>
 */
public class GraphCandidateStore implements CandidateStore, CatalogWriter {
    private static final Logger log = LoggerFactory.getLogger(GraphCandidateStore.class);

    private final CypherExecutor executor;
    private final EntityKind kind;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final ObjectMapper objectMapper;
    private final List<CatalogChangeListener> listeners = new CopyOnWriteArrayList<>();

    public GraphCandidateStore(GraphConnection connection, EntityKind kind) {
        this(new CypherExecutor(connection), kind, new TrigramBlockingKeyStrategy(), new ObjectMapper());
    }

    public GraphCandidateStore(CypherExecutor executor, EntityKind kind,
                               BlockingKeyStrategy blockingKeyStrategy, ObjectMapper objectMapper) {
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.blockingKeyStrategy = Objects.requireNonNull(blockingKeyStrategy, "blockingKeyStrategy is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    @Override
    public EntityKind kind() {
        return kind;
    }

    // ========== Reads ==========

    @Override
    public Stream<CanonicalCandidate> canonicalCandidates(boolean activeOnly) {
        List<Map<String, Object>> rows = read("canonicalCandidates",
                () -> executor.findCanonicalCandidates(kind.name(), activeOnly));
        return rows.stream().map(GraphCandidateStore::toCanonical);
    }

    @Override
    public Stream<CanonicalCandidate> canonicalCandidates(boolean activeOnly, CandidateHint hint) {
        if (hint == null) {
            return canonicalCandidates(activeOnly);
        }
        List<Map<String, Object>> rows = read("canonicalCandidates",
                () -> executor.findCanonicalCandidatesByTrigrams(kind.name(), activeOnly,
                        hint.normalizedQuery(), hint.blockingKeys()));
        return rows.stream().map(GraphCandidateStore::toCanonical);
    }

    @Override
    public Stream<AliasCandidate> aliasCandidates(String locale, boolean activeOnly) {
        List<Map<String, Object>> rows = read("aliasCandidates",
                () -> executor.findAliasCandidates(kind.name(), locale, activeOnly));
        return rows.stream().map(GraphCandidateStore::toAliasCandidate);
    }

    @Override
    public Stream<AliasCandidate> aliasCandidates(String locale, boolean activeOnly, CandidateHint hint) {
        if (hint == null) {
            return aliasCandidates(locale, activeOnly);
        }
        List<Map<String, Object>> rows = read("aliasCandidates",
                () -> executor.findAliasCandidatesByTrigrams(kind.name(), locale, activeOnly,
                        hint.normalizedQuery(), hint.blockingKeys()));
        return rows.stream().map(GraphCandidateStore::toAliasCandidate);
    }

    @Override
    public Map<String, CatalogEntity> findEntities(Collection<String> entityIds) {
        if (entityIds.isEmpty()) {
            return Map.of();
        }
        List<Map<String, Object>> rows = read("findEntities", () -> executor.findEntitiesByIds(entityIds));
        Map<String, CatalogEntity> entities = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            CatalogEntity entity = mapToEntity(row);
            entities.put(entity.getId(), entity);
        }
        return entities;
    }

    @Override
    public Optional<CatalogEntity> findByBarcode(String barcode) {
        List<Map<String, Object>> rows = read("findByBarcode",
                () -> executor.findEntityByBarcode(kind.name(), barcode));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToEntity(rows.get(0)));
    }

    public Optional<CatalogEntity> findEntity(String entityId) {
        List<Map<String, Object>> rows = read("findEntity", () -> executor.findEntityById(entityId));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToEntity(rows.get(0)));
    }

    public List<Alias> findAliases(String entityId) {
        return read("findAliases", () -> executor.findAliasesForEntity(entityId)).stream()
                .map(this::mapToAlias)
                .toList();
    }

    // ========== Writes ==========

    @Override
    public CatalogEntity saveEntity(CatalogEntity entity) {
        if (entity.getKind() != kind) {
            throw new IllegalArgumentException(
                    "Store serves " + kind + " entities, got " + entity.getKind());
        }
        InputSanitizer.validateText("Display name", entity.getDisplayName());
        String normalized = TextNormalizer.normalize(entity.getDisplayName());
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Display name must not be blank");
        }
        CatalogEntity submitted = CatalogEntity.builder(entity)
                .normalizedName(normalized)
                .build();
        String profileJson = writeProfile(submitted);
        InputSanitizer.checkCypherValueLength(profileJson);
        NutritionProfile nutrition = submitted.getNutritionProfile();

        List<Map<String, Object>> rows = read("saveEntity", () -> executor.mergeEntity(CypherExecutor.properties(
                "id", submitted.getId(),
                "kind", kind.name(),
                "displayName", submitted.getDisplayName(),
                "normalizedName", normalized,
                "trigrams", List.copyOf(blockingKeyStrategy.generateKeys(normalized)),
                "category", submitted.getCategory(),
                "modality", submitted.getModality(),
                "active", submitted.isActive(),
                "isPublic", submitted.isPublic(),
                "profileJson", profileJson,
                "barcode", nutrition != null ? nutrition.barcode() : null,
                "createdAt", submitted.getCreatedAt().toEpochMilli(),
                "updatedAt", Instant.now().toEpochMilli()
        )));
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Entity id " + submitted.getId() + " belongs to another kind");
        }
        CatalogEntity stored = mapToEntity(rows.get(0));
        if (!normalized.equals(stored.getNormalizedName())) {
            log.warn("entity.nameChangeIgnored id={} stored='{}' submitted='{}'",
                    stored.getId(), stored.getDisplayName(), submitted.getDisplayName());
        }
        log.debug("entity.saved id={} kind={} normalizedName='{}'", stored.getId(), kind, stored.getNormalizedName());
        notifyListeners(stored.getId());
        return stored;
    }

    @Override
    public Alias saveAlias(Alias alias) {
        InputSanitizer.validateText("Alias text", alias.getValue());
        String normalized = TextNormalizer.normalize(alias.getValue());
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Alias text must not be blank");
        }
        CatalogEntity owner = findEntity(alias.getEntityId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity: " + alias.getEntityId()));
        if (owner.getKind() != kind) {
            throw new IllegalArgumentException("Entity " + owner.getId() + " is not a " + kind);
        }

        Alias submitted = Alias.builder(alias)
                .normalizedValue(normalized)
                .build();
        List<Map<String, Object>> rows = read("saveAlias", () -> executor.mergeAlias(CypherExecutor.properties(
                "id", submitted.getId(),
                "entityId", submitted.getEntityId(),
                "value", submitted.getValue(),
                "normalizedValue", normalized,
                "trigrams", List.copyOf(blockingKeyStrategy.generateKeys(normalized)),
                "locale", submitted.getLocale(),
                "brand", submitted.getBrand(),
                "model", submitted.getModel(),
                "source", submitted.getSource().name(),
                "confidence", submitted.getConfidence(),
                "active", submitted.isActive(),
                "createdAt", submitted.getCreatedAt().toEpochMilli()
        )));
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Unknown entity: " + alias.getEntityId());
        }
        Alias stored = mapToAlias(rows.get(0));
        if (!submitted.getId().equals(stored.getId())) {
            log.debug("alias.duplicate entityId={} alias='{}' locale={}",
                    alias.getEntityId(), alias.getValue(), alias.getLocale());
            return stored;
        }
        log.debug("alias.saved entityId={} alias='{}' locale={} source={}",
                stored.getEntityId(), stored.getValue(), stored.getLocale(), stored.getSource());
        notifyListeners(stored.getEntityId());
        return stored;
    }

    @Override
    public boolean deactivateEntity(String entityId) {
        int changed = read("deactivateEntity",
                () -> executor.deactivateEntity(entityId, Instant.now().toEpochMilli()));
        if (changed == 0) {
            return false;
        }
        log.info("entity.deactivated id={} kind={}", entityId, kind);
        notifyListeners(entityId);
        return true;
    }

    @Override
    public boolean deactivateAlias(String entityId, String aliasText, String locale) {
        String normalized = TextNormalizer.normalize(aliasText);
        int changed = read("deactivateAlias", () -> executor.deactivateAlias(entityId, normalized, locale));
        if (changed == 0) {
            return false;
        }
        log.info("alias.deactivated entityId={} alias='{}' locale={}", entityId, aliasText, locale);
        notifyListeners(entityId);
        return true;
    }

    @Override
    public CatalogEntity correctDisplayName(String entityId, String displayName) {
        CatalogEntity entity = findEntity(entityId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity: " + entityId));
        InputSanitizer.validateText("Display name", displayName);
        String normalized = TextNormalizer.normalize(displayName);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Display name must not be blank");
        }
        Instant now = Instant.now();
        write("correctDisplayName", () -> executor.updateDisplayName(entityId, displayName, normalized,
                blockingKeyStrategy.generateKeys(normalized), now.toEpochMilli()));
        log.info("entity.corrected id={} from='{}' to='{}'", entityId, entity.getDisplayName(), displayName);
        notifyListeners(entityId);
        return CatalogEntity.builder(entity)
                .displayName(displayName)
                .normalizedName(normalized)
                .updatedAt(now)
                .build();
    }

    @Override
    public Optional<CatalogEntity> approveEntity(String entityId) {
        Optional<CatalogEntity> entity = findEntity(entityId);
        if (entity.isEmpty() || entity.get().isPublic()) {
            return entity;
        }
        Instant now = Instant.now();
        int changed = read("approveEntity", () -> executor.approveEntity(entityId, now.toEpochMilli()));
        if (changed > 0) {
            log.info("entity.approved id={} kind={}", entityId, kind);
            notifyListeners(entityId);
        }
        return Optional.of(CatalogEntity.builder(entity.get())
                .isPublic(true)
                .updatedAt(now)
                .build());
    }

    @Override
    public void addChangeListener(CatalogChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    private void notifyListeners(String entityId) {
        for (CatalogChangeListener listener : listeners) {
            listener.onCatalogChanged(entityId);
        }
    }

    // ========== Driver access ==========

    private <T> T read(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("graph.failure operation={} kind={} error={}", operation, kind, e.getMessage());
            throw new StoreUnavailableException("Graph store failed during " + operation, e);
        }
    }

    private void write(String operation, Runnable call) {
        read(operation, () -> {
            call.run();
            return null;
        });
    }

    // ========== Mapping ==========

    private static CanonicalCandidate toCanonical(Map<String, Object> row) {
        return new CanonicalCandidate(
                (String) row.get("entityId"),
                (String) row.get("normalizedName"),
                (String) row.get("displayName"));
    }

    private static AliasCandidate toAliasCandidate(Map<String, Object> row) {
        return new AliasCandidate(
                (String) row.get("entityId"),
                (String) row.get("displayName"),
                (String) row.get("normalizedValue"),
                (String) row.get("value"),
                (String) row.get("brand"),
                (String) row.get("model"));
    }

    private CatalogEntity mapToEntity(Map<String, Object> row) {
        EntityKind rowKind = EntityKind.valueOf((String) row.get("kind"));
        CatalogEntity.Builder builder = CatalogEntity.builder()
                .id((String) row.get("id"))
                .kind(rowKind)
                .displayName((String) row.get("displayName"))
                .normalizedName((String) row.get("normalizedName"))
                .category((String) row.get("category"))
                .modality((String) row.get("modality"))
                .active(!Boolean.FALSE.equals(row.get("active")))
                .isPublic(!Boolean.FALSE.equals(row.get("isPublic")));

        String profileJson = (String) row.get("profileJson");
        if (profileJson != null) {
            if (rowKind == EntityKind.EXERCISE) {
                builder.exerciseProfile(readProfile(profileJson, ExerciseProfile.class));
            } else {
                builder.nutritionProfile(readProfile(profileJson, NutritionProfile.class));
            }
        }
        Instant createdAt = toInstant(row.get("createdAt"));
        if (createdAt != null) {
            builder.createdAt(createdAt);
        }
        builder.updatedAt(toInstant(row.get("updatedAt")));
        return builder.build();
    }

    private Alias mapToAlias(Map<String, Object> row) {
        Alias.Builder builder = Alias.builder()
                .id((String) row.get("id"))
                .entityId((String) row.get("entityId"))
                .value((String) row.get("value"))
                .normalizedValue((String) row.get("normalizedValue"))
                .locale((String) row.get("locale"))
                .brand((String) row.get("brand"))
                .model((String) row.get("model"))
                .active(!Boolean.FALSE.equals(row.get("active")));

        Object source = row.get("source");
        if (source != null) {
            builder.source(AliasSource.valueOf((String) source));
        }
        Object confidence = row.get("confidence");
        if (confidence != null) {
            builder.confidence(((Number) confidence).doubleValue());
        }
        Instant createdAt = toInstant(row.get("createdAt"));
        if (createdAt != null) {
            builder.createdAt(createdAt);
        }
        return builder.build();
    }

    private String writeProfile(CatalogEntity entity) {
        Object profile = entity.getKind() == EntityKind.EXERCISE
                ? entity.getExerciseProfile()
                : entity.getNutritionProfile();
        if (profile == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(profile);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Profile of entity " + entity.getId() + " is not serializable", e);
        }
    }

    private <T> T readProfile(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Stored " + type.getSimpleName() + " is unreadable", e);
        }
    }

    private static Instant toInstant(Object epochMillis) {
        return epochMillis instanceof Number n ? Instant.ofEpochMilli(n.longValue()) : null;
    }
}

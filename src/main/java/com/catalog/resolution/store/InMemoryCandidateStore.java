package com.catalog.resolution.store;

import com.catalog.resolution.core.model.Alias;
import com.catalog.resolution.core.model.CatalogEntity;
import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.normalization.TextNormalizer;
import com.catalog.resolution.similarity.BlockingKeyStrategy;
import com.catalog.resolution.similarity.TrigramBlockingKeyStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * In-memory candidate store for one catalog kind, with trigram inverted indexes
 * over canonical names and aliases.
 * Thread-safe: rows are immutable and replaced whole, writes are serialized.
 */
public class InMemoryCandidateStore implements CandidateStore, CatalogWriter {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCandidateStore.class);

    private final EntityKind kind;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final ConcurrentMap<String, CatalogEntity> entities = new ConcurrentHashMap<>();
    private final ConcurrentMap<AliasKey, Alias> aliases = new ConcurrentHashMap<>();
    // Secondary indexes: blocking key -> rows containing it. Entries are only ever added;
    // stale postings cost an extra candidate, never a missed one.
    private final ConcurrentMap<String, Set<String>> canonicalIndex = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<AliasKey>> aliasIndex = new ConcurrentHashMap<>();
    private final List<CatalogChangeListener> listeners = new CopyOnWriteArrayList<>();

    public InMemoryCandidateStore(EntityKind kind) {
        this(kind, new TrigramBlockingKeyStrategy());
    }

    public InMemoryCandidateStore(EntityKind kind, BlockingKeyStrategy blockingKeyStrategy) {
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.blockingKeyStrategy = Objects.requireNonNull(blockingKeyStrategy, "blockingKeyStrategy is required");
    }

    @Override
    public EntityKind kind() {
        return kind;
    }

    // ========== Reads ==========

    @Override
    public Stream<CanonicalCandidate> canonicalCandidates(boolean activeOnly) {
        return entities.values().stream()
                .filter(e -> !activeOnly || e.isActive())
                .map(this::toCandidate);
    }

    @Override
    public Stream<AliasCandidate> aliasCandidates(String locale, boolean activeOnly) {
        return aliases.values().stream()
                .filter(a -> a.getLocale().equals(locale))
                .map(a -> toCandidate(a, activeOnly))
                .filter(Objects::nonNull);
    }

    @Override
    public Stream<CanonicalCandidate> canonicalCandidates(boolean activeOnly, CandidateHint hint) {
        if (hint == null) {
            return canonicalCandidates(activeOnly);
        }
        if (hint.blockingKeys().isEmpty()) {
            return canonicalCandidates(activeOnly)
                    .filter(c -> c.normalizedName().equals(hint.normalizedQuery()));
        }
        Set<String> ids = new HashSet<>();
        for (String key : hint.blockingKeys()) {
            Set<String> posting = canonicalIndex.get(key);
            if (posting != null) {
                ids.addAll(posting);
            }
        }
        return ids.stream()
                .map(entities::get)
                .filter(Objects::nonNull)
                .filter(e -> !activeOnly || e.isActive())
                .map(this::toCandidate);
    }

    @Override
    public Stream<AliasCandidate> aliasCandidates(String locale, boolean activeOnly, CandidateHint hint) {
        if (hint == null) {
            return aliasCandidates(locale, activeOnly);
        }
        if (hint.blockingKeys().isEmpty()) {
            return aliasCandidates(locale, activeOnly)
                    .filter(c -> c.normalizedAlias().equals(hint.normalizedQuery()));
        }
        Set<AliasKey> keys = new HashSet<>();
        for (String key : hint.blockingKeys()) {
            Set<AliasKey> posting = aliasIndex.get(key);
            if (posting != null) {
                keys.addAll(posting);
            }
        }
        return keys.stream()
                .filter(k -> k.locale().equals(locale))
                .map(aliases::get)
                .filter(Objects::nonNull)
                .map(a -> toCandidate(a, activeOnly))
                .filter(Objects::nonNull);
    }

    @Override
    public Map<String, CatalogEntity> findEntities(Collection<String> entityIds) {
        Map<String, CatalogEntity> found = new LinkedHashMap<>();
        for (String id : entityIds) {
            CatalogEntity entity = entities.get(id);
            if (entity != null) {
                found.put(id, entity);
            }
        }
        return found;
    }

    @Override
    public Optional<CatalogEntity> findByBarcode(String barcode) {
        return entities.values().stream()
                .filter(CatalogEntity::isActive)
                .filter(e -> e.getNutritionProfile() != null && barcode.equals(e.getNutritionProfile().barcode()))
                .min(Comparator.comparing(CatalogEntity::getId));
    }

    /**
     * Returns all aliases of an entity, active or not.
     */
    public List<Alias> findAliases(String entityId) {
        return aliases.values().stream()
                .filter(a -> a.getEntityId().equals(entityId))
                .toList();
    }

    public int entityCount() {
        return entities.size();
    }

    public int aliasCount() {
        return aliases.size();
    }

    // ========== Writes ==========

    @Override
    public synchronized CatalogEntity saveEntity(CatalogEntity entity) {
        if (entity.getKind() != kind) {
            throw new IllegalArgumentException(
                    "Store serves " + kind + " entities, got " + entity.getKind());
        }
        String normalized = TextNormalizer.normalize(entity.getDisplayName());
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Display name must not be blank");
        }
        CatalogEntity existing = entities.get(entity.getId());
        if (existing != null) {
            return updateEntity(existing, entity, normalized);
        }
        CatalogEntity stored = CatalogEntity.builder(entity)
                .normalizedName(normalized)
                .build();
        entities.put(stored.getId(), stored);
        indexCanonical(stored);
        log.debug("entity.saved id={} kind={} normalizedName='{}'", stored.getId(), kind, normalized);
        notifyListeners(stored.getId());
        return stored;
    }

    private CatalogEntity updateEntity(CatalogEntity existing, CatalogEntity entity, String normalized) {
        if (!normalized.equals(existing.getNormalizedName())) {
            log.warn("entity.nameChangeIgnored id={} stored='{}' submitted='{}'",
                    existing.getId(), existing.getDisplayName(), entity.getDisplayName());
        }
        CatalogEntity stored = CatalogEntity.builder(existing)
                .category(entity.getCategory())
                .modality(entity.getModality())
                .exerciseProfile(entity.getExerciseProfile())
                .nutritionProfile(entity.getNutritionProfile())
                .updatedAt(Instant.now())
                .build();
        entities.put(stored.getId(), stored);
        log.debug("entity.updated id={} kind={}", stored.getId(), kind);
        notifyListeners(stored.getId());
        return stored;
    }

    @Override
    public synchronized Alias saveAlias(Alias alias) {
        if (!entities.containsKey(alias.getEntityId())) {
            throw new IllegalArgumentException("Unknown entity: " + alias.getEntityId());
        }
        String normalized = TextNormalizer.normalize(alias.getValue());
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Alias text must not be blank");
        }
        AliasKey key = new AliasKey(alias.getEntityId(), normalized, alias.getLocale());
        Alias existing = aliases.get(key);
        if (existing != null) {
            log.debug("alias.duplicate entityId={} alias='{}' locale={}",
                    alias.getEntityId(), alias.getValue(), alias.getLocale());
            return existing;
        }
        Alias stored = Alias.builder(alias)
                .normalizedValue(normalized)
                .build();
        aliases.put(key, stored);
        for (String blockingKey : blockingKeyStrategy.generateKeys(normalized)) {
            aliasIndex.computeIfAbsent(blockingKey, k -> ConcurrentHashMap.newKeySet()).add(key);
        }
        log.debug("alias.saved entityId={} alias='{}' locale={} source={}",
                alias.getEntityId(), alias.getValue(), alias.getLocale(), alias.getSource());
        notifyListeners(alias.getEntityId());
        return stored;
    }

    @Override
    public synchronized boolean deactivateEntity(String entityId) {
        CatalogEntity entity = entities.get(entityId);
        if (entity == null || !entity.isActive()) {
            return false;
        }
        entities.put(entityId, CatalogEntity.builder(entity)
                .active(false)
                .updatedAt(Instant.now())
                .build());
        log.info("entity.deactivated id={} kind={}", entityId, kind);
        notifyListeners(entityId);
        return true;
    }

    @Override
    public synchronized boolean deactivateAlias(String entityId, String aliasText, String locale) {
        AliasKey key = new AliasKey(entityId, TextNormalizer.normalize(aliasText), locale);
        Alias alias = aliases.get(key);
        if (alias == null || !alias.isActive()) {
            return false;
        }
        aliases.put(key, Alias.builder(alias).active(false).build());
        log.info("alias.deactivated entityId={} alias='{}' locale={}", entityId, aliasText, locale);
        notifyListeners(entityId);
        return true;
    }

    @Override
    public synchronized CatalogEntity correctDisplayName(String entityId, String displayName) {
        CatalogEntity entity = entities.get(entityId);
        if (entity == null) {
            throw new IllegalArgumentException("Unknown entity: " + entityId);
        }
        String normalized = TextNormalizer.normalize(displayName);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Display name must not be blank");
        }
        CatalogEntity corrected = CatalogEntity.builder(entity)
                .displayName(displayName)
                .normalizedName(normalized)
                .updatedAt(Instant.now())
                .build();
        entities.put(entityId, corrected);
        indexCanonical(corrected);
        log.info("entity.corrected id={} from='{}' to='{}'", entityId, entity.getDisplayName(), displayName);
        notifyListeners(entityId);
        return corrected;
    }

    @Override
    public synchronized Optional<CatalogEntity> approveEntity(String entityId) {
        CatalogEntity entity = entities.get(entityId);
        if (entity == null) {
            return Optional.empty();
        }
        if (entity.isPublic()) {
            return Optional.of(entity);
        }
        CatalogEntity approved = CatalogEntity.builder(entity)
                .isPublic(true)
                .updatedAt(Instant.now())
                .build();
        entities.put(entityId, approved);
        log.info("entity.approved id={} kind={}", entityId, kind);
        notifyListeners(entityId);
        return Optional.of(approved);
    }

    @Override
    public void addChangeListener(CatalogChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    private void indexCanonical(CatalogEntity entity) {
        for (String blockingKey : blockingKeyStrategy.generateKeys(entity.getNormalizedName())) {
            canonicalIndex.computeIfAbsent(blockingKey, k -> ConcurrentHashMap.newKeySet()).add(entity.getId());
        }
    }

    private void notifyListeners(String entityId) {
        for (CatalogChangeListener listener : listeners) {
            listener.onCatalogChanged(entityId);
        }
    }

    private CanonicalCandidate toCandidate(CatalogEntity entity) {
        return new CanonicalCandidate(entity.getId(), entity.getNormalizedName(), entity.getDisplayName());
    }

    private AliasCandidate toCandidate(Alias alias, boolean activeOnly) {
        CatalogEntity entity = entities.get(alias.getEntityId());
        if (entity == null) {
            return null;
        }
        if (activeOnly && (!alias.isActive() || !entity.isActive())) {
            return null;
        }
        return new AliasCandidate(
                entity.getId(),
                entity.getDisplayName(),
                alias.getNormalizedValue(),
                alias.getValue(),
                alias.getBrand(),
                alias.getModel()
        );
    }

    /**
     * Uniqueness key of an alias.
     */
    record AliasKey(String entityId, String normalizedValue, String locale) {}
}

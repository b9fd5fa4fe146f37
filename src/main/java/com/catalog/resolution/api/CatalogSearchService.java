package com.catalog.resolution.api;

import com.catalog.resolution.core.model.CatalogEntity;
import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.core.model.MatchCandidate;
import com.catalog.resolution.store.CandidateStore;
import com.catalog.resolution.store.CatalogWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Service facade over one {@link CatalogResolver} per catalog kind.
 * Resolves a query and hydrates the matches with entity details.
 */
public class CatalogSearchService {
    private static final Logger log = LoggerFactory.getLogger(CatalogSearchService.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern BARCODE = Pattern.compile("\\d{8,14}");

    private final Map<EntityKind, CatalogResolver> resolvers;

    public CatalogSearchService(Map<EntityKind, CatalogResolver> resolvers) {
        Objects.requireNonNull(resolvers, "resolvers is required");
        EnumMap<EntityKind, CatalogResolver> copy = new EnumMap<>(EntityKind.class);
        resolvers.forEach((kind, resolver) -> {
            if (resolver.getKind() != kind) {
                throw new IllegalArgumentException("Resolver for " + resolver.getKind()
                        + " registered under " + kind);
            }
            copy.put(kind, resolver);
        });
        this.resolvers = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a service from resolvers, keyed by the kind each one serves.
     */
    public static CatalogSearchService of(CatalogResolver... resolvers) {
        Map<EntityKind, CatalogResolver> byKind = new EnumMap<>(EntityKind.class);
        for (CatalogResolver resolver : resolvers) {
            if (byKind.putIfAbsent(resolver.getKind(), resolver) != null) {
                throw new IllegalArgumentException("Duplicate resolver for " + resolver.getKind());
            }
        }
        return new CatalogSearchService(byKind);
    }

    /**
     * Searches a catalog with default options.
     */
    public List<ResolvedMatch> search(EntityKind kind, String query) {
        return search(kind, query, resolverFor(kind).getDefaultOptions());
    }

    /**
     * Searches a catalog.
     *
     * <p>A match whose entity can no longer be loaded is dropped; the remaining
     * matches keep their rank order. Food search only lists public foods. When matches
     * are dropped the resolver is asked for more, so a page is only short when the
     * catalog has no further match.</p>
     *
     * @throws InvalidQueryException    if the query is empty after trimming or too long
     * @throws InvalidArgumentException if no catalog is configured for the kind
     * @throws com.catalog.resolution.store.StoreUnavailableException if the store cannot be read
     */
    public List<ResolvedMatch> search(EntityKind kind, String query, ResolutionOptions options) {
        CatalogResolver resolver = resolverFor(kind);
        int wanted = options.getMaxResults();
        ResolutionOptions current = options;
        while (true) {
            List<MatchCandidate> matches = resolver.resolve(query, current);
            List<ResolvedMatch> results = hydrate(kind, resolver, matches);
            int dropped = matches.size() - results.size();
            if (dropped == 0 || matches.size() < current.getMaxResults() || results.size() >= wanted) {
                return results.size() > wanted ? List.copyOf(results.subList(0, wanted)) : results;
            }
            current = ResolutionOptions.builder(current)
                    .maxResults(current.getMaxResults() + dropped)
                    .build();
            log.debug("search.refetch kind={} dropped={} maxResults={}", kind, dropped, current.getMaxResults());
        }
    }

    /**
     * Looks up an active food by product barcode. Whitespace is ignored; what remains
     * must be 8 to 14 digits (EAN-8 through GTIN-14). Private foods are returned too.
     *
     * @throws InvalidArgumentException if the barcode is malformed or no food catalog is configured
     */
    public Optional<CatalogEntity> findFoodByBarcode(String barcode) {
        String normalized = normalizeBarcode(barcode);
        Optional<CatalogEntity> found = resolverFor(EntityKind.FOOD).getCandidateStore().findByBarcode(normalized);
        log.debug("search.barcode barcode={} found={}", normalized, found.isPresent());
        return found;
    }

    /**
     * Lists a food in public search results.
     *
     * @return the approved food, or empty if no food has the id
     * @throws InvalidArgumentException if the id is blank or no food catalog is configured
     * @throws IllegalStateException    if the food catalog is read-only
     */
    public Optional<CatalogEntity> approveFood(String foodId) {
        if (foodId == null || foodId.isBlank()) {
            throw new InvalidArgumentException("food id is required");
        }
        CandidateStore store = resolverFor(EntityKind.FOOD).getCandidateStore();
        if (!(store instanceof CatalogWriter writer)) {
            throw new IllegalStateException("Food catalog is read-only");
        }
        return writer.approveEntity(foodId.strip());
    }

    static String normalizeBarcode(String barcode) {
        String digits = barcode == null ? "" : WHITESPACE.matcher(barcode).replaceAll("");
        if (!BARCODE.matcher(digits).matches()) {
            throw new InvalidArgumentException("barcode must be 8 to 14 digits");
        }
        return digits;
    }

    private static List<ResolvedMatch> hydrate(EntityKind kind, CatalogResolver resolver,
                                               List<MatchCandidate> matches) {
        if (matches.isEmpty()) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        matches.forEach(m -> ids.add(m.entityId()));
        Map<String, CatalogEntity> entities = resolver.getCandidateStore().findEntities(ids);

        List<ResolvedMatch> results = new ArrayList<>(matches.size());
        for (MatchCandidate match : matches) {
            CatalogEntity entity = entities.get(match.entityId());
            if (entity == null) {
                log.debug("search.entityVanished kind={} entityId={}", kind, match.entityId());
                continue;
            }
            if (kind == EntityKind.FOOD && !entity.isPublic()) {
                continue;
            }
            results.add(ResolvedMatch.of(match, entity));
        }
        return results;
    }

    public boolean supports(EntityKind kind) {
        return resolvers.containsKey(kind);
    }

    public CatalogResolver resolverFor(EntityKind kind) {
        CatalogResolver resolver = kind != null ? resolvers.get(kind) : null;
        if (resolver == null) {
            throw new InvalidArgumentException("No catalog configured for kind " + kind);
        }
        return resolver;
    }
}

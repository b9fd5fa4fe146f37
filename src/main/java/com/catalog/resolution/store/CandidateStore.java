package com.catalog.resolution.store;

import com.catalog.resolution.core.model.CatalogEntity;
import com.catalog.resolution.core.model.EntityKind;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read-only view over the canonical entities and aliases of one catalog.
 * Holds no matching logic; rows are stored with their normalized text precomputed.
 *
 * <p>Returned streams may be backed by store resources and must be closed by the caller.</p>
 */
public interface CandidateStore {

    /**
     * The kind of entity this store serves.
     */
    EntityKind kind();

    /**
     * Streams canonical-name rows.
     *
     * @param activeOnly when true, only active entities are returned
     * @throws StoreUnavailableException if the backing store cannot be reached
     */
    Stream<CanonicalCandidate> canonicalCandidates(boolean activeOnly);

    /**
     * Streams alias rows for a locale.
     *
     * @param locale     the locale the aliases must be tagged with
     * @param activeOnly when true, only active aliases of active entities are returned
     * @throws StoreUnavailableException if the backing store cannot be reached
     */
    Stream<AliasCandidate> aliasCandidates(String locale, boolean activeOnly);

    /**
     * Streams canonical-name rows, optionally narrowed by a prefilter hint.
     * The default ignores the hint.
     */
    default Stream<CanonicalCandidate> canonicalCandidates(boolean activeOnly, CandidateHint hint) {
        return canonicalCandidates(activeOnly);
    }

    /**
     * Streams alias rows, optionally narrowed by a prefilter hint.
     * The default ignores the hint.
     */
    default Stream<AliasCandidate> aliasCandidates(String locale, boolean activeOnly, CandidateHint hint) {
        return aliasCandidates(locale, activeOnly);
    }

    /**
     * Loads entities by id, active or not. Unknown ids are absent from the returned map.
     *
     * @throws StoreUnavailableException if the backing store cannot be reached
     */
    Map<String, CatalogEntity> findEntities(Collection<String> entityIds);

    /**
     * Finds the active entity carrying a product barcode. Barcodes are compared as stored,
     * callers normalize them first.
     *
     * @throws StoreUnavailableException if the backing store cannot be reached
     */
    Optional<CatalogEntity> findByBarcode(String barcode);
}

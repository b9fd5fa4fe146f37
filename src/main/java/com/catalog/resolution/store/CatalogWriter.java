package com.catalog.resolution.store;

import com.catalog.resolution.core.model.Alias;
import com.catalog.resolution.core.model.CatalogEntity;

import java.util.Optional;

/**
 * Ingestion and curation write path.
 * Implementations compute normalized text once, at write time, so the resolver never
 * normalizes stored rows while answering a query.
 */
public interface CatalogWriter {

    /**
     * Inserts an entity, or updates the stored row with the same id.
     *
     * <p>On update only the descriptive fields (category, modality, profiles) are
     * rewritten. The display name, creation time, active flag and public flag of the
     * stored row are kept: names change through {@link #correctDisplayName}, state
     * through {@link #deactivateEntity} and {@link #approveEntity}.</p>
     *
     * @return the stored entity
     */
    CatalogEntity saveEntity(CatalogEntity entity);

    /**
     * Inserts an alias. If an alias with the same entity, normalized text and locale
     * already exists, nothing is written and the stored alias is returned.
     *
     * @return the stored alias
     * @throws IllegalArgumentException if the owning entity does not exist or the text normalizes to empty
     */
    Alias saveAlias(Alias alias);

    /**
     * Marks an entity inactive. Entities are never deleted.
     *
     * @return true if an active entity was deactivated
     */
    boolean deactivateEntity(String entityId);

    /**
     * Marks an alias inactive.
     *
     * @return true if an active alias was deactivated
     */
    boolean deactivateAlias(String entityId, String aliasText, String locale);

    /**
     * Explicitly corrects an entity's display name, re-normalizing it.
     *
     * @return the corrected entity
     * @throws IllegalArgumentException if the entity does not exist
     */
    CatalogEntity correctDisplayName(String entityId, String displayName);

    /**
     * Lists an entity in public search results.
     *
     * @return the approved entity, or empty if no entity has the id
     */
    Optional<CatalogEntity> approveEntity(String entityId);

    /**
     * Registers a listener notified after each mutation.
     */
    void addChangeListener(CatalogChangeListener listener);
}

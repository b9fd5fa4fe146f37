package com.catalog.resolution.store;

/**
 * Listener notified after a catalog mutation has been applied.
 */
@FunctionalInterface
public interface CatalogChangeListener {

    /**
     * Called after an entity or one of its aliases was created, corrected or deactivated.
     *
     * @param entityId the affected entity
     */
    void onCatalogChanged(String entityId);
}

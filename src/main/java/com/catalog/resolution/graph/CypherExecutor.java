package com.catalog.resolution.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes the Cypher statements backing a catalog graph.
 *
 * <p>Graph layout: {@code (:CatalogEntity)} nodes carry the display name, its normalized
 * form and its trigram list; {@code (:Alias)-[:ALIAS_OF]->(:CatalogEntity)} holds alias text
 * the same way. Trigram lists back the candidate prefilter.</p>
 */
public class CypherExecutor {
    private static final Logger log = LoggerFactory.getLogger(CypherExecutor.class);

    private static final String ENTITY_COLUMNS = """
            e.id as id, e.kind as kind, e.displayName as displayName, e.normalizedName as normalizedName,
            e.category as category, e.modality as modality, e.active as active, e.isPublic as isPublic,
            e.profileJson as profileJson, e.createdAt as createdAt, e.updatedAt as updatedAt
            """;

    private static final String ALIAS_COLUMNS = """
            a.id as id, e.id as entityId, a.value as value, a.normalizedValue as normalizedValue,
            a.locale as locale, a.brand as brand, a.model as model, a.source as source,
            a.confidence as confidence, a.active as active, a.createdAt as createdAt
            """;

    private final GraphConnection connection;

    public CypherExecutor(GraphConnection connection) {
        this.connection = connection;
    }

    // ========== Candidate discovery ==========

    /**
     * Finds canonical-name rows of a kind.
     */
    public List<Map<String, Object>> findCanonicalCandidates(String kind, boolean activeOnly) {
        String query = """
                MATCH (e:CatalogEntity)
                WHERE e.kind = $kind
                  AND ($activeOnly = false OR e.active = true)
                RETURN e.id as entityId, e.normalizedName as normalizedName, e.displayName as displayName
                """;
        return connection.query(query, Map.of("kind", kind, "activeOnly", activeOnly));
    }

    /**
     * Finds canonical-name rows equal to the query or sharing at least one trigram with it.
     */
    public List<Map<String, Object>> findCanonicalCandidatesByTrigrams(String kind, boolean activeOnly,
                                                                       String normalizedQuery,
                                                                       Collection<String> trigrams) {
        String query = """
                MATCH (e:CatalogEntity)
                WHERE e.kind = $kind
                  AND ($activeOnly = false OR e.active = true)
                  AND (e.normalizedName = $normalizedQuery OR any(t IN e.trigrams WHERE t IN $trigrams))
                RETURN e.id as entityId, e.normalizedName as normalizedName, e.displayName as displayName
                """;
        return connection.query(query, Map.of(
                "kind", kind,
                "activeOnly", activeOnly,
                "normalizedQuery", normalizedQuery,
                "trigrams", List.copyOf(trigrams)
        ));
    }

    /**
     * Finds alias rows of a kind and locale, joined with their entity's display name.
     */
    public List<Map<String, Object>> findAliasCandidates(String kind, String locale, boolean activeOnly) {
        String query = """
                MATCH (a:Alias)-[:ALIAS_OF]->(e:CatalogEntity)
                WHERE e.kind = $kind
                  AND a.locale = $locale
                  AND ($activeOnly = false OR (a.active = true AND e.active = true))
                RETURN e.id as entityId, e.displayName as displayName, a.normalizedValue as normalizedValue,
                       a.value as value, a.brand as brand, a.model as model
                """;
        return connection.query(query, Map.of("kind", kind, "locale", locale, "activeOnly", activeOnly));
    }

    /**
     * Finds alias rows equal to the query or sharing at least one trigram with it.
     */
    public List<Map<String, Object>> findAliasCandidatesByTrigrams(String kind, String locale, boolean activeOnly,
                                                                   String normalizedQuery,
                                                                   Collection<String> trigrams) {
        String query = """
                MATCH (a:Alias)-[:ALIAS_OF]->(e:CatalogEntity)
                WHERE e.kind = $kind
                  AND a.locale = $locale
                  AND ($activeOnly = false OR (a.active = true AND e.active = true))
                  AND (a.normalizedValue = $normalizedQuery OR any(t IN a.trigrams WHERE t IN $trigrams))
                RETURN e.id as entityId, e.displayName as displayName, a.normalizedValue as normalizedValue,
                       a.value as value, a.brand as brand, a.model as model
                """;
        return connection.query(query, Map.of(
                "kind", kind,
                "locale", locale,
                "activeOnly", activeOnly,
                "normalizedQuery", normalizedQuery,
                "trigrams", List.copyOf(trigrams)
        ));
    }

    // ========== Entities ==========

    /**
     * Creates an entity node, or updates the descriptive fields of the node with the same id.
     * Name, state and creation time are only written on creation.
     *
     * @return the stored row, or no row if the id belongs to an entity of another kind
     */
    public List<Map<String, Object>> mergeEntity(Map<String, Object> properties) {
        String query = """
                MERGE (e:CatalogEntity {id: $id})
                ON CREATE SET e.kind = $kind,
                    e.displayName = $displayName,
                    e.normalizedName = $normalizedName,
                    e.trigrams = $trigrams,
                    e.active = $active,
                    e.isPublic = $isPublic,
                    e.createdAt = $createdAt
                WITH e
                WHERE e.kind = $kind
                SET e.category = $category,
                    e.modality = $modality,
                    e.profileJson = $profileJson,
                    e.barcode = $barcode,
                    e.updatedAt = $updatedAt
                RETURN
                """ + ENTITY_COLUMNS;
        List<Map<String, Object>> rows = connection.query(query, properties);
        log.debug("Merged entity {}", properties.get("id"));
        return rows;
    }

    public List<Map<String, Object>> findEntityById(String id) {
        String query = "MATCH (e:CatalogEntity {id: $id}) RETURN " + ENTITY_COLUMNS;
        return connection.query(query, Map.of("id", id));
    }

    public List<Map<String, Object>> findEntitiesByIds(Collection<String> ids) {
        String query = "MATCH (e:CatalogEntity) WHERE e.id IN $ids RETURN " + ENTITY_COLUMNS;
        return connection.query(query, Map.of("ids", List.copyOf(ids)));
    }

    /**
     * Marks an active entity inactive.
     *
     * @return the number of nodes changed (0 or 1)
     */
    public int deactivateEntity(String id, long updatedAt) {
        String query = """
                MATCH (e:CatalogEntity {id: $id})
                WHERE e.active = true
                SET e.active = false, e.updatedAt = $updatedAt
                RETURN count(e) as changed
                """;
        return count(connection.query(query, Map.of("id", id, "updatedAt", updatedAt)));
    }

    /**
     * Lists a private entity in public search.
     *
     * @return the number of nodes changed (0 or 1)
     */
    public int approveEntity(String id, long updatedAt) {
        String query = """
                MATCH (e:CatalogEntity {id: $id})
                WHERE e.isPublic = false
                SET e.isPublic = true, e.updatedAt = $updatedAt
                RETURN count(e) as changed
                """;
        return count(connection.query(query, Map.of("id", id, "updatedAt", updatedAt)));
    }

    /**
     * Finds the active entity of a kind carrying a barcode. The lowest id wins if several do.
     */
    public List<Map<String, Object>> findEntityByBarcode(String kind, String barcode) {
        String query = """
                MATCH (e:CatalogEntity)
                WHERE e.kind = $kind AND e.barcode = $barcode AND e.active = true
                RETURN
                """ + ENTITY_COLUMNS + """
                ORDER BY id
                LIMIT 1
                """;
        return connection.query(query, Map.of("kind", kind, "barcode", barcode));
    }

    /**
     * Rewrites an entity's display name with its derived text.
     */
    public void updateDisplayName(String id, String displayName, String normalizedName,
                                  Collection<String> trigrams, long updatedAt) {
        String query = """
                MATCH (e:CatalogEntity {id: $id})
                SET e.displayName = $displayName,
                    e.normalizedName = $normalizedName,
                    e.trigrams = $trigrams,
                    e.updatedAt = $updatedAt
                """;
        connection.execute(query, Map.of(
                "id", id,
                "displayName", displayName,
                "normalizedName", normalizedName,
                "trigrams", List.copyOf(trigrams),
                "updatedAt", updatedAt
        ));
        log.debug("Updated display name of entity {}", id);
    }

    // ========== Aliases ==========

    public List<Map<String, Object>> findAliasesForEntity(String entityId) {
        String query = """
                MATCH (a:Alias)-[:ALIAS_OF]->(e:CatalogEntity {id: $entityId})
                RETURN
                """ + ALIAS_COLUMNS;
        return connection.query(query, Map.of("entityId", entityId));
    }

    /**
     * Creates an alias node attached to its entity, unless one with the same entity,
     * normalized text and locale exists. Lookup and creation are one statement.
     *
     * @return the stored alias row, new or existing; no row if the entity does not exist
     */
    public List<Map<String, Object>> mergeAlias(Map<String, Object> properties) {
        String query = """
                MATCH (e:CatalogEntity {id: $entityId})
                MERGE (a:Alias {entityId: $entityId, normalizedValue: $normalizedValue, locale: $locale})
                ON CREATE SET a.id = $id,
                    a.value = $value,
                    a.trigrams = $trigrams,
                    a.brand = $brand,
                    a.model = $model,
                    a.source = $source,
                    a.confidence = $confidence,
                    a.active = $active,
                    a.createdAt = $createdAt
                MERGE (a)-[:ALIAS_OF]->(e)
                RETURN
                """ + ALIAS_COLUMNS;
        List<Map<String, Object>> rows = connection.query(query, properties);
        log.debug("Merged alias '{}' for entity {}", properties.get("value"), properties.get("entityId"));
        return rows;
    }

    /**
     * Marks an active alias inactive.
     *
     * @return the number of nodes changed (0 or 1)
     */
    public int deactivateAlias(String entityId, String normalizedValue, String locale) {
        String query = """
                MATCH (a:Alias)-[:ALIAS_OF]->(e:CatalogEntity {id: $entityId})
                WHERE a.normalizedValue = $normalizedValue AND a.locale = $locale AND a.active = true
                SET a.active = false
                RETURN count(a) as changed
                """;
        return count(connection.query(query, Map.of(
                "entityId", entityId,
                "normalizedValue", normalizedValue,
                "locale", locale
        )));
    }

    public GraphConnection getConnection() {
        return connection;
    }

    private static int count(List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        Object changed = rows.get(0).get("changed");
        return changed instanceof Number n ? n.intValue() : 0;
    }

    /**
     * Copies a property map, keeping null values. {@link Map#of} rejects nulls.
     */
    static Map<String, Object> properties(Object... keyValues) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}

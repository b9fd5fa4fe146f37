package com.catalog.resolution.graph;

import java.util.List;
import java.util.Map;

/**
 * Cypher access to the graph that stores one or more catalogs.
 * Parameters are referenced as {@code $name} in statement text.
 */
public interface GraphConnection extends AutoCloseable {

    /** Runs a write statement, discarding any rows it returns. */
    void execute(String cypher, Map<String, Object> params);

    /** Runs a read, one map per record keyed by column alias. */
    List<Map<String, Object>> query(String cypher, Map<String, Object> params);

    /** Round-trips a trivial query. False if the graph cannot be reached. */
    boolean ping();

    String graphName();

    /**
     * Creates the id, kind and normalized-text indexes on {@code CatalogEntity} and
     * {@code Alias} nodes. Safe to call when they already exist.
     */
    void ensureCatalogIndexes();

    @Override
    void close();
}

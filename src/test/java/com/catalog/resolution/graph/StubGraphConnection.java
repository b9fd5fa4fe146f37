package com.catalog.resolution.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process {@link GraphConnection} for unit tests.
 * Records every statement and answers queries from canned rows keyed by a query fragment.
 */
class StubGraphConnection implements GraphConnection {

    final List<String> executedStatements = new ArrayList<>();
    final List<Map<String, Object>> executedParams = new ArrayList<>();
    final List<String> queries = new ArrayList<>();
    final List<Map<String, Object>> queryParams = new ArrayList<>();

    private final Map<String, List<Map<String, Object>>> responses = new LinkedHashMap<>();
    private RuntimeException failure;
    private boolean closed;

    /**
     * Answers any query containing the fragment with the given rows.
     */
    StubGraphConnection respond(String fragment, List<Map<String, Object>> rows) {
        responses.put(fragment, rows);
        return this;
    }

    /**
     * Makes every subsequent call fail.
     */
    StubGraphConnection failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        if (failure != null) {
            throw failure;
        }
        executedStatements.add(query);
        executedParams.add(params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        if (failure != null) {
            throw failure;
        }
        queries.add(query);
        queryParams.add(params);
        for (Map.Entry<String, List<Map<String, Object>>> response : responses.entrySet()) {
            if (query.contains(response.getKey())) {
                return response.getValue();
            }
        }
        return List.of();
    }

    @Override
    public boolean ping() {
        return !closed;
    }

    @Override
    public String graphName() {
        return "catalog-test";
    }

    @Override
    public void ensureCatalogIndexes() {
    }

    @Override
    public void close() {
        closed = true;
    }
}

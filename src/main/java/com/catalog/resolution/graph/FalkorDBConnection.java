package com.catalog.resolution.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Catalog graph on FalkorDB, reached through the JFalkorDB driver.
 *
 * <p>The driver takes plain query strings, so parameters are rendered into the text as
 * Cypher literals. Strings are quoted with backslash escaping and collections become
 * list literals. Callers still pass user text through {@link InputSanitizer} first.</p>
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final Pattern PARAMETER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    private static final List<String> CATALOG_INDEXES = List.of(
            "CREATE INDEX FOR (e:CatalogEntity) ON (e.id)",
            "CREATE INDEX FOR (e:CatalogEntity) ON (e.kind)",
            "CREATE INDEX FOR (e:CatalogEntity) ON (e.normalizedName)",
            "CREATE INDEX FOR (e:CatalogEntity) ON (e.barcode)",
            "CREATE INDEX FOR (a:Alias) ON (a.id)",
            "CREATE INDEX FOR (a:Alias) ON (a.entityId)",
            "CREATE INDEX FOR (a:Alias) ON (a.normalizedValue)",
            "CREATE INDEX FOR (a:Alias) ON (a.locale)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("graph.opened host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String cypher, Map<String, Object> params) {
        String statement = processParams(cypher, params);
        log.trace("graph.execute statement={}", statement);
        graph.query(statement);
    }

    @Override
    public List<Map<String, Object>> query(String cypher, Map<String, Object> params) {
        String statement = processParams(cypher, params);
        log.trace("graph.query statement={}", statement);

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : graph.query(statement)) {
            rows.add(toRow(record));
        }
        log.debug("graph.query rows={}", rows.size());
        return rows;
    }

    private static Map<String, Object> toRow(Record record) {
        Map<String, Object> row = new HashMap<>();
        for (String column : record.keys()) {
            row.put(column, record.getValue(column));
        }
        return row;
    }

    @Override
    public boolean ping() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("graph.pingFailed graph={} error={}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String graphName() {
        return graphName;
    }

    @Override
    public void ensureCatalogIndexes() {
        int created = 0;
        for (String index : CATALOG_INDEXES) {
            try {
                graph.query(index);
                created++;
            } catch (Exception e) {
                // FalkorDB rejects an index that already exists
                log.debug("graph.indexSkipped statement={} reason={}", index, e.getMessage());
            }
        }
        log.info("graph.indexesReady graph={} created={} total={}", graphName, created, CATALOG_INDEXES.size());
    }

    /**
     * Substitutes {@code $name} placeholders in a single pass, so text inside a
     * substituted value is never treated as a placeholder. Unknown names are left as-is.
     */
    static String processParams(String query, Map<String, Object> params) {
        if (params.isEmpty()) {
            return query;
        }
        Matcher matcher = PARAMETER.matcher(query);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name)
                    ? formatValue(params.get(name))
                    : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> values) {
            StringJoiner list = new StringJoiner(", ", "[", "]");
            for (Object element : values) {
                list.add(formatValue(element));
            }
            return list.toString();
        }
        return quote(value.toString());
    }

    private static String quote(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
            log.info("graph.closed graph={}", graphName);
        } catch (Exception e) {
            log.warn("graph.closeFailed graph={} error={}", graphName, e.getMessage(), e);
        }
    }
}

package com.aml.network.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * FalkorDB implementation of {@link GraphConnection} using the JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection initialized for graph: {}", graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Executing: {}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Querying: {}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }

        log.debug("Query returned {} rows", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("Creating indexes for network analysis...");
        safeExecute("CREATE INDEX FOR (e:Entity) ON (e.id)");
        safeExecute("CREATE INDEX FOR (e:Entity) ON (e.entityType)");
        safeExecute("CREATE INDEX FOR ()-[r:RELATED]-() ON (r.id)");
        log.info("Index creation complete");
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // index may already exist
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    /**
     * Substitutes {@code $param} placeholders with literal values. Longer names are
     * substituted first so {@code $ids} never clobbers {@code $idsExtra}.
     */
    private String processParams(String query, Map<String, Object> params) {
        String result = query;
        List<String> names = params.keySet().stream()
                .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                .toList();
        for (String name : names) {
            result = result.replace("$" + name, formatValue(params.get(name)));
        }
        return result;
    }

    private String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .map(this::formatValue)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        if (driver != null) {
            try {
                driver.close();
            } catch (Exception e) {
                log.warn("Error closing FalkorDB connection", e);
            }
        }
        log.info("FalkorDB connection closed");
    }
}

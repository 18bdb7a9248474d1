package com.aml.network.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to a Cypher-speaking graph database holding the entity and
 * relationship data. Abstracts the underlying driver.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher statement
     * @param params statement parameters
     */
    void execute(String query, Map<String, Object> params);

    /**
     * Executes a Cypher query and returns its rows.
     *
     * @param query  the Cypher query
     * @param params query parameters
     * @return result rows as column name to value maps
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes the network queries rely on, if they don't exist.
     */
    void createIndexes();

    @Override
    void close();
}

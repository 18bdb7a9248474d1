package com.aml.network.graph;

import com.aml.network.core.model.NetworkGraph;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.TraversalHop;

import java.util.List;

/**
 * Direct connections of an entity, either from an already built graph or from the store.
 * Lets breadth-first algorithms run unchanged over both.
 */
@FunctionalInterface
public interface ConnectionSource {

    /**
     * Edges incident to {@code entityId} in either direction, self loops excluded.
     *
     * @throws GraphStoreException if backed by a store that cannot be queried
     */
    List<RelationshipEdge> connectionsOf(String entityId);

    /**
     * Connections taken from a built graph, restricted by {@code filter}.
     */
    static ConnectionSource of(NetworkGraph graph, TraversalFilter filter) {
        return entityId -> graph.connectionsOf(entityId).stream()
                .filter(edge -> !edge.isSelfLoop())
                .filter(filter::matches)
                .toList();
    }

    /**
     * Connections looked up one hop at a time from the store.
     */
    static ConnectionSource of(GraphStore store, TraversalFilter filter) {
        return entityId -> store.boundedTraversal(entityId, 1, filter).stream()
                .map(TraversalHop::edge)
                .filter(edge -> !edge.isSelfLoop())
                .toList();
    }
}

package com.aml.network.core.model;

import java.util.List;

/**
 * Shortest hop-count path between two entities, with aggregate path characteristics.
 *
 * @param sourceEntityId    path start
 * @param targetEntityId    path end
 * @param found             whether a path exists within the depth limit
 * @param edges             traversed relationships in order (empty when not found or source == target)
 * @param connectionStrength mean confidence along the path
 * @param pathRisk          mean relationship type risk weight along the path
 * @param pathConfidence    weakest confidence along the path
 * @param error             store failure message, or null
 */
public record NetworkPath(
        String sourceEntityId,
        String targetEntityId,
        boolean found,
        List<RelationshipEdge> edges,
        double connectionStrength,
        double pathRisk,
        double pathConfidence,
        String error
) {
    public NetworkPath {
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public static NetworkPath notFound(String sourceEntityId, String targetEntityId, String error) {
        return new NetworkPath(sourceEntityId, targetEntityId, false, List.of(), 0.0, 0.0, 0.0, error);
    }

    /**
     * Builds a found path and derives its aggregate characteristics.
     */
    public static NetworkPath of(String sourceEntityId, String targetEntityId, List<RelationshipEdge> edges) {
        if (edges.isEmpty()) {
            return new NetworkPath(sourceEntityId, targetEntityId, true, List.of(), 0.0, 0.0, 0.0, null);
        }
        double strength = edges.stream().mapToDouble(RelationshipEdge::getConfidence).average().orElse(0.0);
        double risk = edges.stream().mapToDouble(e -> e.getType().riskWeight()).average().orElse(0.0);
        double weakest = edges.stream().mapToDouble(RelationshipEdge::getConfidence).min().orElse(0.0);
        return new NetworkPath(sourceEntityId, targetEntityId, true, edges, strength, risk, weakest, null);
    }

    /**
     * Number of hops, i.e. degrees of separation. Zero when not found.
     */
    public int hopCount() {
        return edges.size();
    }
}

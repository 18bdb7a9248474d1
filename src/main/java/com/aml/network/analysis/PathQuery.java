package com.aml.network.analysis;

import com.aml.network.core.model.RelationshipType;
import com.aml.network.graph.InputSanitizer;
import com.aml.network.graph.TraversalFilter;

import java.util.Set;

/**
 * Shortest path search parameters.
 *
 * @param sourceEntityId    path start
 * @param targetEntityId    path end
 * @param maxDepth          hop limit, 1 to 10
 * @param relationshipTypes allowed types; empty allows all
 * @param minConfidence     minimum edge confidence
 * @param onlyActive        traverse active edges only
 */
public record PathQuery(
        String sourceEntityId,
        String targetEntityId,
        int maxDepth,
        Set<RelationshipType> relationshipTypes,
        double minConfidence,
        boolean onlyActive
) {
    public static final int DEFAULT_MAX_DEPTH = 6;

    public PathQuery {
        InputSanitizer.validateEntityId("sourceEntityId", sourceEntityId);
        InputSanitizer.validateEntityId("targetEntityId", targetEntityId);
        InputSanitizer.validateRange("maxDepth", maxDepth, 1, 10);
        InputSanitizer.validateUnitInterval("minConfidence", minConfidence);
        relationshipTypes = relationshipTypes != null ? Set.copyOf(relationshipTypes) : Set.of();
    }

    /**
     * Default search: depth 6, every type, any confidence, active edges only.
     */
    public static PathQuery between(String sourceEntityId, String targetEntityId) {
        return new PathQuery(sourceEntityId, targetEntityId, DEFAULT_MAX_DEPTH, Set.of(), 0.0, true);
    }

    public PathQuery withMaxDepth(int depth) {
        return new PathQuery(sourceEntityId, targetEntityId, depth, relationshipTypes, minConfidence, onlyActive);
    }

    public TraversalFilter toFilter() {
        return new TraversalFilter(relationshipTypes, minConfidence, false, onlyActive);
    }
}

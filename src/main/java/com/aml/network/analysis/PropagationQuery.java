package com.aml.network.analysis;

import com.aml.network.core.model.RelationshipType;
import com.aml.network.graph.InputSanitizer;
import com.aml.network.graph.TraversalFilter;

import java.util.Set;

/**
 * Risk propagation parameters.
 *
 * @param sourceEntityId     seed entity
 * @param maxDepth           hop limit, 1 to 5
 * @param propagationFactor  per-hop decay in [0, 1]
 * @param minPropagatedScore values below this are not recorded
 * @param relationshipTypes  types risk may travel over; empty allows all
 */
public record PropagationQuery(
        String sourceEntityId,
        int maxDepth,
        double propagationFactor,
        double minPropagatedScore,
        Set<RelationshipType> relationshipTypes
) {
    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final double DEFAULT_FACTOR = 0.5;
    public static final double DEFAULT_MIN_SCORE = 0.1;

    public PropagationQuery {
        InputSanitizer.validateEntityId("sourceEntityId", sourceEntityId);
        InputSanitizer.validateRange("maxDepth", maxDepth, 1, 5);
        InputSanitizer.validateUnitInterval("propagationFactor", propagationFactor);
        InputSanitizer.validateUnitInterval("minPropagatedScore", minPropagatedScore);
        relationshipTypes = relationshipTypes != null ? Set.copyOf(relationshipTypes) : Set.of();
    }

    public static PropagationQuery from(String sourceEntityId) {
        return new PropagationQuery(sourceEntityId, DEFAULT_MAX_DEPTH, DEFAULT_FACTOR, DEFAULT_MIN_SCORE, Set.of());
    }

    /**
     * Active edges of the allowed types.
     */
    public TraversalFilter toFilter() {
        return TraversalFilter.activeOfTypes(relationshipTypes);
    }
}

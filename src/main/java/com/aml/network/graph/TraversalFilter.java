package com.aml.network.graph;

import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.RelationshipType;

import java.util.Set;

/**
 * Edge restrictions applied during a bounded traversal.
 *
 * @param relationshipTypes allowed types; empty allows every type
 * @param minConfidence     minimum edge confidence (inclusive)
 * @param onlyVerified      keep verified edges only
 * @param onlyActive        keep active edges only
 */
public record TraversalFilter(
        Set<RelationshipType> relationshipTypes,
        double minConfidence,
        boolean onlyVerified,
        boolean onlyActive
) {
    public TraversalFilter {
        relationshipTypes = relationshipTypes != null ? Set.copyOf(relationshipTypes) : Set.of();
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be between 0 and 1");
        }
    }

    /**
     * Active edges of any type and confidence.
     */
    public static TraversalFilter activeOnly() {
        return new TraversalFilter(Set.of(), 0.0, false, true);
    }

    public static TraversalFilter activeOfTypes(Set<RelationshipType> types) {
        return new TraversalFilter(types, 0.0, false, true);
    }

    public boolean matches(RelationshipEdge edge) {
        if (onlyActive && !edge.isActive()) {
            return false;
        }
        if (onlyVerified && !edge.isVerified()) {
            return false;
        }
        if (edge.getConfidence() < minConfidence) {
            return false;
        }
        return relationshipTypes.isEmpty() || relationshipTypes.contains(edge.getType());
    }
}

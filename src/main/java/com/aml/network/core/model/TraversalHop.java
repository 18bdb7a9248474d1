package com.aml.network.core.model;

import java.util.Objects;

/**
 * An edge discovered by a bounded traversal together with the hop level that reached it.
 *
 * @param edge  the relationship
 * @param depth 1-based hop level at which the edge was first discovered
 */
public record TraversalHop(RelationshipEdge edge, int depth) {

    public TraversalHop {
        Objects.requireNonNull(edge, "edge is required");
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be >= 1");
        }
    }
}

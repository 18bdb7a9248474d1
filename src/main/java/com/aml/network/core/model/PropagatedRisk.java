package com.aml.network.core.model;

import java.util.List;

/**
 * Risk that reached an entity from a propagation seed.
 *
 * @param entityId the reached entity
 * @param risk     propagated risk value
 * @param depth    hop level at which the entity was first reached
 * @param path     edges traversed from the seed, in order
 */
public record PropagatedRisk(String entityId, double risk, int depth, List<RelationshipEdge> path) {

    public PropagatedRisk {
        path = path != null ? List.copyOf(path) : List.of();
    }
}

package com.aml.network.analysis;

import com.aml.network.core.model.RelationshipType;

import java.util.List;
import java.util.Set;

/**
 * Hub detection parameters.
 *
 * @param candidateIds        entities to consider; empty considers every entity in the supplied edges
 * @param minConnections      minimum degree for a hub
 * @param connectionTypes     relationship types that count; empty counts all
 * @param includeRiskAnalysis look up entity details and compute the influence score
 */
public record HubQuery(
        List<String> candidateIds,
        int minConnections,
        Set<RelationshipType> connectionTypes,
        boolean includeRiskAnalysis
) {
    public static final int DEFAULT_MIN_CONNECTIONS = 5;

    public HubQuery {
        candidateIds = candidateIds != null ? List.copyOf(candidateIds) : List.of();
        connectionTypes = connectionTypes != null ? Set.copyOf(connectionTypes) : Set.of();
        if (minConnections < 1) {
            throw new IllegalArgumentException("minConnections must be >= 1");
        }
    }

    public static HubQuery defaults() {
        return new HubQuery(List.of(), DEFAULT_MIN_CONNECTIONS, Set.of(), true);
    }

    public static HubQuery forCandidates(List<String> candidateIds) {
        return new HubQuery(candidateIds, DEFAULT_MIN_CONNECTIONS, Set.of(), true);
    }
}

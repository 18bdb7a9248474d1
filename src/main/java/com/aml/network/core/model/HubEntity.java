package com.aml.network.core.model;

import java.util.Set;

/**
 * An entity whose relationship degree meets the hub threshold.
 *
 * <p>The identity fields ({@code name}, {@code type}, {@code riskScore}, {@code riskLevel})
 * and {@code hubInfluenceScore} are only populated when risk analysis was requested and
 * the entity lookup succeeded; otherwise they are {@code null}.</p>
 *
 * @param entityId          hub entity id
 * @param totalConnections  combined outgoing + incoming active degree
 * @param averageConfidence mean confidence of the counted edges
 * @param relationshipTypes distinct relationship types among the counted edges
 * @param name              entity name, or null
 * @param type              entity type, or null
 * @param riskScore         base risk score, or null
 * @param riskLevel         recorded risk level, or null
 * @param hubInfluenceScore weighted influence score, or null
 */
public record HubEntity(
        String entityId,
        int totalConnections,
        double averageConfidence,
        Set<RelationshipType> relationshipTypes,
        String name,
        EntityType type,
        Double riskScore,
        RiskLevel riskLevel,
        Double hubInfluenceScore
) {
    public HubEntity {
        relationshipTypes = relationshipTypes != null ? Set.copyOf(relationshipTypes) : Set.of();
    }

    public boolean isEnriched() {
        return hubInfluenceScore != null;
    }
}

package com.aml.network.api;

import com.aml.network.core.model.EntityNode;
import com.aml.network.core.model.EntityType;
import com.aml.network.core.model.NetworkGraph;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.RelationshipPattern;
import com.aml.network.core.model.RelationshipType;
import com.aml.network.core.model.RiskLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Descriptive statistics of a built network.
 *
 * @param totalEntities                node count
 * @param totalRelationships           edge count
 * @param density                      edges / (n(n-1)/2), 0 below two nodes
 * @param riskDistribution             nodes per risk level
 * @param entityTypeDistribution       nodes per entity type
 * @param relationshipTypeDistribution edges per relationship type
 * @param patternCounts                edges per structural pattern
 * @param averageConfidence            mean edge confidence
 * @param verifiedCount                verified edges
 * @param verificationRate             verified / max(edges, 1)
 * @param averageRiskWeight            mean relationship type risk weight
 * @param highRiskRelationshipCount    edges whose type risk weight exceeds 0.6
 */
public record NetworkStatistics(
        int totalEntities,
        int totalRelationships,
        double density,
        Map<RiskLevel, Integer> riskDistribution,
        Map<EntityType, Integer> entityTypeDistribution,
        Map<RelationshipType, Integer> relationshipTypeDistribution,
        Map<RelationshipPattern, Integer> patternCounts,
        double averageConfidence,
        int verifiedCount,
        double verificationRate,
        double averageRiskWeight,
        int highRiskRelationshipCount
) {
    public static final double HIGH_RISK_WEIGHT = 0.6;

    public NetworkStatistics {
        riskDistribution = Collections.unmodifiableMap(new EnumMap<>(riskDistribution));
        entityTypeDistribution = Collections.unmodifiableMap(new EnumMap<>(entityTypeDistribution));
        relationshipTypeDistribution = Collections.unmodifiableMap(new EnumMap<>(relationshipTypeDistribution));
        patternCounts = Collections.unmodifiableMap(new EnumMap<>(patternCounts));
    }

    public static NetworkStatistics of(NetworkGraph graph) {
        int n = graph.getTotalEntities();
        int e = graph.getTotalRelationships();

        Map<RiskLevel, Integer> risk = new EnumMap<>(RiskLevel.class);
        Map<EntityType, Integer> types = new EnumMap<>(EntityType.class);
        for (EntityNode node : graph.getNodes()) {
            risk.merge(node.getRiskLevel(), 1, Integer::sum);
            types.merge(node.getType(), 1, Integer::sum);
        }

        Map<RelationshipType, Integer> relationshipTypes = new EnumMap<>(RelationshipType.class);
        Map<RelationshipPattern, Integer> patterns = new EnumMap<>(RelationshipPattern.class);
        double confidenceSum = 0.0;
        double weightSum = 0.0;
        int verified = 0;
        int highRisk = 0;
        for (RelationshipEdge edge : graph.getEdges()) {
            relationshipTypes.merge(edge.getType(), 1, Integer::sum);
            patterns.merge(edge.getType().pattern(), 1, Integer::sum);
            confidenceSum += edge.getConfidence();
            weightSum += edge.getType().riskWeight();
            if (edge.isVerified()) {
                verified++;
            }
            if (edge.getType().riskWeight() > HIGH_RISK_WEIGHT) {
                highRisk++;
            }
        }

        double density = n < 2 ? 0.0 : e / (n * (n - 1) / 2.0);
        return new NetworkStatistics(n, e, density, risk, types, relationshipTypes, patterns,
                e > 0 ? confidenceSum / e : 0.0,
                verified,
                (double) verified / Math.max(e, 1),
                e > 0 ? weightSum / e : 0.0,
                highRisk);
    }

    public int patternCount(RelationshipPattern pattern) {
        return patternCounts.getOrDefault(pattern, 0);
    }
}

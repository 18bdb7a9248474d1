package com.aml.network.api;

import com.aml.network.core.model.RiskLevel;

/**
 * Risk of one node once its neighborhood is taken into account.
 *
 * @param entityId             the node
 * @param baseRiskScore        the entity's own risk score
 * @param connectionRiskFactor contribution of HIGH/CRITICAL neighbors, at most 0.5
 * @param networkRiskScore     min(base + factor, 1.0)
 * @param networkRiskLevel     category of the network risk score
 * @param centralityLevel      category of the composite centrality score, or null when not computed
 */
public record NodeRiskAssessment(
        String entityId,
        double baseRiskScore,
        double connectionRiskFactor,
        double networkRiskScore,
        RiskLevel networkRiskLevel,
        RiskLevel centralityLevel
) {
}

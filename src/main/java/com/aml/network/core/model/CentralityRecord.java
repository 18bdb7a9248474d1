package com.aml.network.core.model;

/**
 * Centrality metrics for one entity, recomputed per request.
 *
 * <p>{@code closeness} and {@code betweenness} are linear transforms of the normalized
 * degree, not shortest-path centralities. They are {@code null} unless advanced metrics
 * were requested.</p>
 *
 * @param entityId                  the entity
 * @param degreeCentrality          incident edge count (outgoing + incoming)
 * @param normalizedDegree          degree / max(candidates - 1, 1)
 * @param weightedCentrality        sum of incident edge confidences
 * @param riskWeightedCentrality    sum of confidence x relationship type risk weight
 * @param highConfidenceConnections incident edges with confidence >= 0.8
 * @param centralityScore           composite score
 * @param closeness                 degree-derived closeness approximation, or null
 * @param betweenness               degree-derived betweenness approximation, or null
 */
public record CentralityRecord(
        String entityId,
        int degreeCentrality,
        double normalizedDegree,
        double weightedCentrality,
        double riskWeightedCentrality,
        int highConfidenceConnections,
        double centralityScore,
        Double closeness,
        Double betweenness
) {

    /**
     * Record for an entity with no qualifying edges.
     */
    public static CentralityRecord zero(String entityId, boolean includeAdvanced) {
        return new CentralityRecord(entityId, 0, 0.0, 0.0, 0.0, 0, 0.0,
                includeAdvanced ? 0.0 : null, includeAdvanced ? 0.0 : null);
    }

    public RiskLevel centralityLevel() {
        return RiskLevel.fromScore(centralityScore);
    }
}

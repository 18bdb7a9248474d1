package com.aml.network.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one risk propagation run.
 *
 * @param sourceEntityId the seed entity
 * @param seedRisk       the seed's base risk
 * @param propagated     reached entities in discovery order (the seed is not included)
 * @param error          store failure message, or null
 */
public record RiskPropagationResult(
        String sourceEntityId,
        double seedRisk,
        Map<String, PropagatedRisk> propagated,
        String error
) {
    public RiskPropagationResult {
        propagated = propagated != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(propagated))
                : Map.of();
    }

    public static RiskPropagationResult empty(String sourceEntityId, double seedRisk) {
        return new RiskPropagationResult(sourceEntityId, seedRisk, Map.of(), null);
    }

    public static RiskPropagationResult failed(String sourceEntityId, String error) {
        return new RiskPropagationResult(sourceEntityId, 0.0, Map.of(), error);
    }

    /**
     * Entity id to propagated risk value, in discovery order.
     */
    public Map<String, Double> riskScores() {
        Map<String, Double> scores = new LinkedHashMap<>();
        propagated.forEach((id, risk) -> scores.put(id, risk.risk()));
        return scores;
    }

    public Optional<PropagatedRisk> riskFor(String entityId) {
        return Optional.ofNullable(propagated.get(entityId));
    }

    public boolean hasError() {
        return error != null;
    }
}

package com.aml.network.core.model;

import java.util.Objects;

/**
 * Entity details resolved by a batch lookup: just enough to enrich a network node.
 *
 * @param id        entity identifier
 * @param name      display name
 * @param type      entity type
 * @param riskScore base risk score in [0, 1]
 * @param riskLevel recorded risk level
 */
public record EntitySummary(String id, String name, EntityType type, double riskScore, RiskLevel riskLevel) {

    public static final String UNKNOWN_NAME = "Unknown";

    public EntitySummary {
        Objects.requireNonNull(id, "id is required");
        name = name != null && !name.isBlank() ? name : UNKNOWN_NAME;
        type = type != null ? type : EntityType.UNKNOWN;
        riskScore = clamp(riskScore);
        riskLevel = riskLevel != null ? riskLevel : RiskLevel.fromScore(riskScore);
    }

    /**
     * Summary for an entity the store could not describe: name "Unknown", type UNKNOWN, risk 0.0.
     */
    public static EntitySummary withDefaults(String id) {
        return new EntitySummary(id, UNKNOWN_NAME, EntityType.UNKNOWN, 0.0, RiskLevel.LOW);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}

package com.aml.network.core.model;

import java.util.Locale;

/**
 * Risk categories used for entities, network risk scores and composite centrality.
 */
public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * True for HIGH and CRITICAL.
     */
    public boolean isElevated() {
        return this == HIGH || this == CRITICAL;
    }

    /**
     * Categorizes a score with the fixed cutoffs: {@code >= 0.8} critical,
     * {@code >= 0.6} high, {@code >= 0.4} medium, otherwise low.
     */
    public static RiskLevel fromScore(double score) {
        if (score >= 0.8) {
            return CRITICAL;
        }
        if (score >= 0.6) {
            return HIGH;
        }
        if (score >= 0.4) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * Lenient parse of a store value, falling back to {@code fallback}.
     */
    public static RiskLevel fromValue(String value, RiskLevel fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        for (RiskLevel level : values()) {
            if (level.label.equals(value.trim().toLowerCase(Locale.ROOT))) {
                return level;
            }
        }
        return fallback;
    }
}

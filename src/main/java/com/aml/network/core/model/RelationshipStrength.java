package com.aml.network.core.model;

import java.util.Locale;

/**
 * Qualitative strength of a relationship as recorded by investigators or ingest.
 */
public enum RelationshipStrength {
    CONFIRMED,
    LIKELY,
    POSSIBLE,
    SUSPECTED;

    /**
     * Lenient parse; missing or unrecognized values default to {@link #POSSIBLE}.
     */
    public static RelationshipStrength fromValue(String value) {
        if (value == null || value.isBlank()) {
            return POSSIBLE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return POSSIBLE;
        }
    }
}

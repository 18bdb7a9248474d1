package com.aml.network.core.model;

import java.util.Locale;

/**
 * Kinds of entities that appear in an AML relationship network.
 * {@link #UNKNOWN} is the substitute for missing or unrecognized store values.
 */
public enum EntityType {
    INDIVIDUAL("individual"),
    ORGANIZATION("organization"),
    UNKNOWN("unknown");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Lenient parse of a store value. Never throws; unrecognized values map to {@link #UNKNOWN}.
     */
    public static EntityType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "individual", "person" -> INDIVIDUAL;
            case "organization", "organisation", "company" -> ORGANIZATION;
            default -> UNKNOWN;
        };
    }
}

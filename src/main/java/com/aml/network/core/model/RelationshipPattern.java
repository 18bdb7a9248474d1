package com.aml.network.core.model;

/**
 * Structural pattern a relationship type contributes to when counting network patterns.
 */
public enum RelationshipPattern {
    CORPORATE_HIERARCHY,
    BENEFICIAL_OWNERSHIP,
    HOUSEHOLD,
    DUPLICATE_ENTITY,
    HIGH_RISK_NETWORK,
    OTHER
}

package com.aml.network.core.model;

import java.util.Locale;

/**
 * Closed set of relationship types known to the network engine.
 *
 * <p>Each type carries a static AML risk weight used by centrality scoring and risk
 * propagation, and the structural pattern it contributes to. Both lookups are exhaustive
 * switches, so adding a type forces a decision on its weight.</p>
 */
public enum RelationshipType {
    CONFIRMED_SAME_ENTITY("confirmed_same_entity"),
    POTENTIAL_DUPLICATE("potential_duplicate"),
    DIRECTOR_OF("director_of"),
    UBO_OF("ubo_of"),
    PARENT_OF_SUBSIDIARY("parent_of_subsidiary"),
    SHAREHOLDER_OF("shareholder_of"),
    HOUSEHOLD_MEMBER("household_member"),
    FAMILY_MEMBER("family_member"),
    BUSINESS_ASSOCIATE("business_associate"),
    BUSINESS_ASSOCIATE_SUSPECTED("business_associate_suspected"),
    POTENTIAL_BENEFICIAL_OWNER_OF("potential_beneficial_owner_of"),
    TRANSACTIONAL_COUNTERPARTY_HIGH_RISK("transactional_counterparty_high_risk"),
    PROFESSIONAL_COLLEAGUE_PUBLIC("professional_colleague_public"),
    SOCIAL_MEDIA_CONNECTION_PUBLIC("social_media_connection_public"),
    SHARED_ADDRESS("shared_address"),
    SHARED_IDENTIFIER("shared_identifier"),
    TRANSACTION_COUNTERPARTY("transaction_counterparty"),
    ASSOCIATED_WITH("associated_with"),
    UNKNOWN("unknown");

    public static final double DEFAULT_RISK_WEIGHT = 0.5;

    private final String value;

    RelationshipType(String value) {
        this.value = value;
    }

    /**
     * The store representation, e.g. {@code director_of}.
     */
    public String getValue() {
        return value;
    }

    public double riskWeight() {
        return switch (this) {
            case CONFIRMED_SAME_ENTITY, BUSINESS_ASSOCIATE_SUSPECTED -> 0.9;
            case DIRECTOR_OF, UBO_OF, PARENT_OF_SUBSIDIARY -> 0.7;
            case HOUSEHOLD_MEMBER, PROFESSIONAL_COLLEAGUE_PUBLIC -> 0.3;
            case POTENTIAL_DUPLICATE, SHAREHOLDER_OF, FAMILY_MEMBER, BUSINESS_ASSOCIATE,
                 POTENTIAL_BENEFICIAL_OWNER_OF, TRANSACTIONAL_COUNTERPARTY_HIGH_RISK,
                 SOCIAL_MEDIA_CONNECTION_PUBLIC, SHARED_ADDRESS, SHARED_IDENTIFIER,
                 TRANSACTION_COUNTERPARTY, ASSOCIATED_WITH, UNKNOWN -> DEFAULT_RISK_WEIGHT;
        };
    }

    public RelationshipPattern pattern() {
        return switch (this) {
            case DIRECTOR_OF, SHAREHOLDER_OF, PARENT_OF_SUBSIDIARY -> RelationshipPattern.CORPORATE_HIERARCHY;
            case UBO_OF, POTENTIAL_BENEFICIAL_OWNER_OF -> RelationshipPattern.BENEFICIAL_OWNERSHIP;
            case HOUSEHOLD_MEMBER -> RelationshipPattern.HOUSEHOLD;
            case CONFIRMED_SAME_ENTITY, POTENTIAL_DUPLICATE -> RelationshipPattern.DUPLICATE_ENTITY;
            case TRANSACTIONAL_COUNTERPARTY_HIGH_RISK, BUSINESS_ASSOCIATE_SUSPECTED ->
                    RelationshipPattern.HIGH_RISK_NETWORK;
            case FAMILY_MEMBER, BUSINESS_ASSOCIATE, PROFESSIONAL_COLLEAGUE_PUBLIC,
                 SOCIAL_MEDIA_CONNECTION_PUBLIC, SHARED_ADDRESS, SHARED_IDENTIFIER,
                 TRANSACTION_COUNTERPARTY, ASSOCIATED_WITH, UNKNOWN -> RelationshipPattern.OTHER;
        };
    }

    /**
     * Lenient parse of a store value. Unrecognized values map to {@link #UNKNOWN}.
     */
    public static RelationshipType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RelationshipType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}

package com.aml.network.core.model;

import java.util.Objects;

/**
 * A relationship between two entities as seen by the network engine.
 *
 * Edges are identified by their relationship id; two edges with the same id are the
 * same relationship regardless of which traversal discovered them.
 */
public final class RelationshipEdge {

    public static final double DEFAULT_CONFIDENCE = 0.5;

    private final String relationshipId;
    private final String sourceId;
    private final String targetId;
    private final RelationshipType type;
    private final RelationshipStrength strength;
    private final double confidence;
    private final boolean verified;
    private final boolean active;

    private RelationshipEdge(Builder builder) {
        this.relationshipId = Objects.requireNonNull(builder.relationshipId, "relationshipId is required");
        this.sourceId = Objects.requireNonNull(builder.sourceId, "sourceId is required");
        this.targetId = Objects.requireNonNull(builder.targetId, "targetId is required");
        this.type = builder.type != null ? builder.type : RelationshipType.UNKNOWN;
        this.strength = builder.strength != null ? builder.strength : RelationshipStrength.POSSIBLE;
        this.confidence = builder.confidence != null ? EntitySummary.clamp(builder.confidence) : DEFAULT_CONFIDENCE;
        this.verified = builder.verified;
        this.active = builder.active;
    }

    public String getRelationshipId() {
        return relationshipId;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public RelationshipType getType() {
        return type;
    }

    public RelationshipStrength getStrength() {
        return strength;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isVerified() {
        return verified;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * True when the entity is either endpoint.
     */
    public boolean connects(String entityId) {
        return sourceId.equals(entityId) || targetId.equals(entityId);
    }

    /**
     * The endpoint opposite {@code entityId}; edges are walked in either direction.
     *
     * @throws IllegalArgumentException if the entity is not an endpoint
     */
    public String otherEnd(String entityId) {
        if (sourceId.equals(entityId)) {
            return targetId;
        }
        if (targetId.equals(entityId)) {
            return sourceId;
        }
        throw new IllegalArgumentException("Entity " + entityId + " is not an endpoint of " + relationshipId);
    }

    public boolean isSelfLoop() {
        return sourceId.equals(targetId);
    }

    /**
     * Confidence scaled by the relationship type's risk weight.
     */
    public double riskWeightedConfidence() {
        return confidence * type.riskWeight();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RelationshipEdge that = (RelationshipEdge) o;
        return Objects.equals(relationshipId, that.relationshipId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(relationshipId);
    }

    @Override
    public String toString() {
        return "RelationshipEdge{" +
                "id='" + relationshipId + '\'' +
                ", sourceId='" + sourceId + '\'' +
                ", targetId='" + targetId + '\'' +
                ", type=" + type.getValue() +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String relationshipId;
        private String sourceId;
        private String targetId;
        private RelationshipType type;
        private RelationshipStrength strength;
        private Double confidence;
        private boolean verified = false;
        private boolean active = true;

        public Builder relationshipId(String relationshipId) {
            this.relationshipId = relationshipId;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder targetId(String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder type(RelationshipType type) {
            this.type = type;
            return this;
        }

        public Builder strength(RelationshipStrength strength) {
            this.strength = strength;
            return this;
        }

        public Builder confidence(Double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder verified(boolean verified) {
            this.verified = verified;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public RelationshipEdge build() {
            return new RelationshipEdge(this);
        }
    }
}

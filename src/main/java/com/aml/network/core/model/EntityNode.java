package com.aml.network.core.model;

import java.util.Objects;

/**
 * A node of a built network graph. Created when an entity first appears in a subgraph
 * and immutable for the rest of the request.
 */
public final class EntityNode {

    private final String id;
    private final String name;
    private final EntityType type;
    private final double riskScore;
    private final RiskLevel riskLevel;
    private final int connectionCount;
    private final boolean center;
    private final int depth;

    private EntityNode(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name != null ? builder.name : EntitySummary.UNKNOWN_NAME;
        this.type = builder.type != null ? builder.type : EntityType.UNKNOWN;
        this.riskScore = EntitySummary.clamp(builder.riskScore);
        this.riskLevel = builder.riskLevel != null ? builder.riskLevel : RiskLevel.fromScore(riskScore);
        this.connectionCount = builder.connectionCount;
        this.center = builder.center;
        this.depth = builder.depth;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public EntityType getType() {
        return type;
    }

    public double getRiskScore() {
        return riskScore;
    }

    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    public int getConnectionCount() {
        return connectionCount;
    }

    public boolean isCenter() {
        return center;
    }

    /**
     * Hop distance from the center at which this node was discovered.
     */
    public int getDepth() {
        return depth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityNode that = (EntityNode) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "EntityNode{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", riskLevel=" + riskLevel +
                ", connections=" + connectionCount +
                ", center=" + center +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder pre-populated from a looked-up summary.
     */
    public static Builder from(EntitySummary summary) {
        return new Builder()
                .id(summary.id())
                .name(summary.name())
                .type(summary.type())
                .riskScore(summary.riskScore())
                .riskLevel(summary.riskLevel());
    }

    public static class Builder {
        private String id;
        private String name;
        private EntityType type;
        private double riskScore;
        private RiskLevel riskLevel;
        private int connectionCount;
        private boolean center;
        private int depth;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder riskScore(double riskScore) {
            this.riskScore = riskScore;
            return this;
        }

        public Builder riskLevel(RiskLevel riskLevel) {
            this.riskLevel = riskLevel;
            return this;
        }

        public Builder connectionCount(int connectionCount) {
            this.connectionCount = connectionCount;
            return this;
        }

        public Builder center(boolean center) {
            this.center = center;
            return this;
        }

        public Builder depth(int depth) {
            this.depth = depth;
            return this;
        }

        public EntityNode build() {
            return new EntityNode(this);
        }
    }
}

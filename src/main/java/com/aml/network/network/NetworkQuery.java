package com.aml.network.network;

import com.aml.network.core.InvalidRequestException;
import com.aml.network.core.model.EntityType;
import com.aml.network.core.model.RelationshipType;
import com.aml.network.graph.InputSanitizer;
import com.aml.network.graph.TraversalFilter;

import java.util.Objects;
import java.util.Set;

/**
 * Parameters of a network build around a center entity.
 *
 * <p>Ranges are validated in {@link Builder#build()}; an out of range value raises
 * {@link InvalidRequestException} before any traversal.</p>
 */
public final class NetworkQuery {

    public static final int DEFAULT_MAX_DEPTH = 2;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.5;
    public static final int DEFAULT_MAX_ENTITIES = 100;
    public static final int DEFAULT_MAX_RELATIONSHIPS = 500;

    private final String centerEntityId;
    private final int maxDepth;
    private final Set<RelationshipType> relationshipTypes;
    private final double minConfidence;
    private final boolean onlyVerified;
    private final boolean onlyActive;
    private final Set<EntityType> includeEntityTypes;
    private final Set<EntityType> excludeEntityTypes;
    private final int maxEntities;
    private final int maxRelationships;

    private NetworkQuery(Builder builder) {
        this.centerEntityId = builder.centerEntityId;
        this.maxDepth = builder.maxDepth;
        this.relationshipTypes = Set.copyOf(builder.relationshipTypes);
        this.minConfidence = builder.minConfidence;
        this.onlyVerified = builder.onlyVerified;
        this.onlyActive = builder.onlyActive;
        this.includeEntityTypes = Set.copyOf(builder.includeEntityTypes);
        this.excludeEntityTypes = Set.copyOf(builder.excludeEntityTypes);
        this.maxEntities = builder.maxEntities;
        this.maxRelationships = builder.maxRelationships;
    }

    public static Builder builder(String centerEntityId) {
        return new Builder().centerEntityId(centerEntityId);
    }

    public String getCenterEntityId() {
        return centerEntityId;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public Set<RelationshipType> getRelationshipTypes() {
        return relationshipTypes;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public boolean isOnlyVerified() {
        return onlyVerified;
    }

    public boolean isOnlyActive() {
        return onlyActive;
    }

    public Set<EntityType> getIncludeEntityTypes() {
        return includeEntityTypes;
    }

    public Set<EntityType> getExcludeEntityTypes() {
        return excludeEntityTypes;
    }

    public int getMaxEntities() {
        return maxEntities;
    }

    public int getMaxRelationships() {
        return maxRelationships;
    }

    /**
     * The edge filter handed to the store traversal.
     */
    public TraversalFilter toFilter() {
        return new TraversalFilter(relationshipTypes, minConfidence, onlyVerified, onlyActive);
    }

    /**
     * Whether an entity of the given type survives the include/exclude filters.
     */
    public boolean admits(EntityType type) {
        if (!includeEntityTypes.isEmpty() && !includeEntityTypes.contains(type)) {
            return false;
        }
        return !excludeEntityTypes.contains(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NetworkQuery that = (NetworkQuery) o;
        return maxDepth == that.maxDepth
                && Double.compare(that.minConfidence, minConfidence) == 0
                && onlyVerified == that.onlyVerified
                && onlyActive == that.onlyActive
                && maxEntities == that.maxEntities
                && maxRelationships == that.maxRelationships
                && centerEntityId.equals(that.centerEntityId)
                && relationshipTypes.equals(that.relationshipTypes)
                && includeEntityTypes.equals(that.includeEntityTypes)
                && excludeEntityTypes.equals(that.excludeEntityTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(centerEntityId, maxDepth, relationshipTypes, minConfidence, onlyVerified,
                onlyActive, includeEntityTypes, excludeEntityTypes, maxEntities, maxRelationships);
    }

    @Override
    public String toString() {
        return "NetworkQuery{" +
                "center='" + centerEntityId + '\'' +
                ", maxDepth=" + maxDepth +
                ", minConfidence=" + minConfidence +
                ", types=" + relationshipTypes +
                ", maxEntities=" + maxEntities +
                ", maxRelationships=" + maxRelationships +
                '}';
    }

    public static class Builder {
        private String centerEntityId;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private Set<RelationshipType> relationshipTypes = Set.of();
        private double minConfidence = DEFAULT_MIN_CONFIDENCE;
        private boolean onlyVerified = false;
        private boolean onlyActive = true;
        private Set<EntityType> includeEntityTypes = Set.of();
        private Set<EntityType> excludeEntityTypes = Set.of();
        private int maxEntities = DEFAULT_MAX_ENTITIES;
        private int maxRelationships = DEFAULT_MAX_RELATIONSHIPS;

        public Builder centerEntityId(String centerEntityId) {
            this.centerEntityId = centerEntityId;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder relationshipTypes(Set<RelationshipType> relationshipTypes) {
            this.relationshipTypes = relationshipTypes != null ? relationshipTypes : Set.of();
            return this;
        }

        public Builder minConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder onlyVerified(boolean onlyVerified) {
            this.onlyVerified = onlyVerified;
            return this;
        }

        public Builder onlyActive(boolean onlyActive) {
            this.onlyActive = onlyActive;
            return this;
        }

        public Builder includeEntityTypes(Set<EntityType> includeEntityTypes) {
            this.includeEntityTypes = includeEntityTypes != null ? includeEntityTypes : Set.of();
            return this;
        }

        public Builder excludeEntityTypes(Set<EntityType> excludeEntityTypes) {
            this.excludeEntityTypes = excludeEntityTypes != null ? excludeEntityTypes : Set.of();
            return this;
        }

        public Builder maxEntities(int maxEntities) {
            this.maxEntities = maxEntities;
            return this;
        }

        public Builder maxRelationships(int maxRelationships) {
            this.maxRelationships = maxRelationships;
            return this;
        }

        public NetworkQuery build() {
            InputSanitizer.validateEntityId("centerEntityId", centerEntityId);
            InputSanitizer.validateRange("maxDepth", maxDepth, 1, 5);
            InputSanitizer.validateUnitInterval("minConfidence", minConfidence);
            InputSanitizer.validateRange("maxEntities", maxEntities, 10, 500);
            InputSanitizer.validateRange("maxRelationships", maxRelationships, 20, 2000);
            return new NetworkQuery(this);
        }
    }
}

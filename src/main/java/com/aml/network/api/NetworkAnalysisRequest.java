package com.aml.network.api;

import com.aml.network.analysis.CommunityDetector;
import com.aml.network.analysis.HubQuery;
import com.aml.network.analysis.PropagationQuery;
import com.aml.network.core.InvalidRequestException;
import com.aml.network.graph.InputSanitizer;
import com.aml.network.network.NetworkQuery;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A full network analysis: the network to build, which analyses to run over it and an
 * optional path target searched concurrently with the build.
 *
 * <p>Equality covers every parameter except the timeout, so equal requests share a
 * cached result.</p>
 */
public final class NetworkAnalysisRequest {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final NetworkQuery networkQuery;
    private final boolean includeCentrality;
    private final boolean includeAdvancedCentrality;
    private final boolean includeCommunities;
    private final int minCommunitySize;
    private final double communityResolution;
    private final boolean includeHubs;
    private final int hubMinConnections;
    private final boolean includeRiskPropagation;
    private final int propagationDepth;
    private final double propagationFactor;
    private final double minPropagatedScore;
    private final boolean includeCycles;
    private final String pathTarget;
    private final LayoutAlgorithm layout;
    private final Duration timeout;

    private NetworkAnalysisRequest(Builder builder) {
        this.networkQuery = builder.networkQuery;
        this.includeCentrality = builder.includeCentrality;
        this.includeAdvancedCentrality = builder.includeAdvancedCentrality;
        this.includeCommunities = builder.includeCommunities;
        this.minCommunitySize = builder.minCommunitySize;
        this.communityResolution = builder.communityResolution;
        this.includeHubs = builder.includeHubs;
        this.hubMinConnections = builder.hubMinConnections;
        this.includeRiskPropagation = builder.includeRiskPropagation;
        this.propagationDepth = builder.propagationDepth;
        this.propagationFactor = builder.propagationFactor;
        this.minPropagatedScore = builder.minPropagatedScore;
        this.includeCycles = builder.includeCycles;
        this.pathTarget = builder.pathTarget;
        this.layout = builder.layout;
        this.timeout = builder.timeout;
    }

    public static Builder builder(NetworkQuery networkQuery) {
        return new Builder(networkQuery);
    }

    /**
     * Every analysis with default parameters around {@code centerEntityId}.
     */
    public static NetworkAnalysisRequest forCenter(String centerEntityId) {
        return builder(NetworkQuery.builder(centerEntityId).build()).build();
    }

    public NetworkQuery getNetworkQuery() {
        return networkQuery;
    }

    public String getCenterEntityId() {
        return networkQuery.getCenterEntityId();
    }

    public boolean isIncludeCentrality() {
        return includeCentrality;
    }

    public boolean isIncludeAdvancedCentrality() {
        return includeAdvancedCentrality;
    }

    public boolean isIncludeCommunities() {
        return includeCommunities;
    }

    public int getMinCommunitySize() {
        return minCommunitySize;
    }

    public double getCommunityResolution() {
        return communityResolution;
    }

    public boolean isIncludeHubs() {
        return includeHubs;
    }

    public int getHubMinConnections() {
        return hubMinConnections;
    }

    public boolean isIncludeRiskPropagation() {
        return includeRiskPropagation;
    }

    public boolean isIncludeCycles() {
        return includeCycles;
    }

    public String getPathTarget() {
        return pathTarget;
    }

    public LayoutAlgorithm getLayout() {
        return layout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Propagation from the center using this request's propagation parameters and
     * relationship type filter.
     */
    public PropagationQuery toPropagationQuery() {
        return new PropagationQuery(getCenterEntityId(), propagationDepth, propagationFactor,
                minPropagatedScore, networkQuery.getRelationshipTypes());
    }

    /**
     * Hub detection over the given candidates using this request's threshold.
     */
    public HubQuery toHubQuery(List<String> candidateIds) {
        return new HubQuery(candidateIds, hubMinConnections, Set.of(), true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NetworkAnalysisRequest that = (NetworkAnalysisRequest) o;
        return includeCentrality == that.includeCentrality
                && includeAdvancedCentrality == that.includeAdvancedCentrality
                && includeCommunities == that.includeCommunities
                && minCommunitySize == that.minCommunitySize
                && Double.compare(that.communityResolution, communityResolution) == 0
                && includeHubs == that.includeHubs
                && hubMinConnections == that.hubMinConnections
                && includeRiskPropagation == that.includeRiskPropagation
                && propagationDepth == that.propagationDepth
                && Double.compare(that.propagationFactor, propagationFactor) == 0
                && Double.compare(that.minPropagatedScore, minPropagatedScore) == 0
                && includeCycles == that.includeCycles
                && networkQuery.equals(that.networkQuery)
                && Objects.equals(pathTarget, that.pathTarget)
                && layout == that.layout;
    }

    @Override
    public int hashCode() {
        return Objects.hash(networkQuery, includeCentrality, includeAdvancedCentrality, includeCommunities,
                minCommunitySize, communityResolution, includeHubs, hubMinConnections, includeRiskPropagation,
                propagationDepth, propagationFactor, minPropagatedScore, includeCycles, pathTarget, layout);
    }

    @Override
    public String toString() {
        return "NetworkAnalysisRequest{" +
                "query=" + networkQuery +
                ", pathTarget='" + pathTarget + '\'' +
                ", layout=" + layout +
                ", timeout=" + timeout +
                '}';
    }

    public static class Builder {
        private final NetworkQuery networkQuery;
        private boolean includeCentrality = true;
        private boolean includeAdvancedCentrality = false;
        private boolean includeCommunities = true;
        private int minCommunitySize = CommunityDetector.DEFAULT_MIN_SIZE;
        private double communityResolution = CommunityDetector.DEFAULT_RESOLUTION;
        private boolean includeHubs = true;
        private int hubMinConnections = HubQuery.DEFAULT_MIN_CONNECTIONS;
        private boolean includeRiskPropagation = true;
        private int propagationDepth = PropagationQuery.DEFAULT_MAX_DEPTH;
        private double propagationFactor = PropagationQuery.DEFAULT_FACTOR;
        private double minPropagatedScore = PropagationQuery.DEFAULT_MIN_SCORE;
        private boolean includeCycles = true;
        private String pathTarget;
        private LayoutAlgorithm layout = LayoutAlgorithm.FORCE;
        private Duration timeout = DEFAULT_TIMEOUT;

        private Builder(NetworkQuery networkQuery) {
            this.networkQuery = Objects.requireNonNull(networkQuery, "networkQuery is required");
        }

        public Builder includeCentrality(boolean includeCentrality) {
            this.includeCentrality = includeCentrality;
            return this;
        }

        public Builder includeAdvancedCentrality(boolean includeAdvancedCentrality) {
            this.includeAdvancedCentrality = includeAdvancedCentrality;
            return this;
        }

        public Builder includeCommunities(boolean includeCommunities) {
            this.includeCommunities = includeCommunities;
            return this;
        }

        public Builder minCommunitySize(int minCommunitySize) {
            this.minCommunitySize = minCommunitySize;
            return this;
        }

        public Builder communityResolution(double communityResolution) {
            this.communityResolution = communityResolution;
            return this;
        }

        public Builder includeHubs(boolean includeHubs) {
            this.includeHubs = includeHubs;
            return this;
        }

        public Builder hubMinConnections(int hubMinConnections) {
            this.hubMinConnections = hubMinConnections;
            return this;
        }

        public Builder includeRiskPropagation(boolean includeRiskPropagation) {
            this.includeRiskPropagation = includeRiskPropagation;
            return this;
        }

        public Builder propagationDepth(int propagationDepth) {
            this.propagationDepth = propagationDepth;
            return this;
        }

        public Builder propagationFactor(double propagationFactor) {
            this.propagationFactor = propagationFactor;
            return this;
        }

        public Builder minPropagatedScore(double minPropagatedScore) {
            this.minPropagatedScore = minPropagatedScore;
            return this;
        }

        public Builder includeCycles(boolean includeCycles) {
            this.includeCycles = includeCycles;
            return this;
        }

        /**
         * Also searches the shortest path from the center to this entity.
         */
        public Builder pathTarget(String pathTarget) {
            this.pathTarget = pathTarget;
            return this;
        }

        public Builder layout(LayoutAlgorithm layout) {
            this.layout = layout != null ? layout : LayoutAlgorithm.FORCE;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public NetworkAnalysisRequest build() {
            if (minCommunitySize < 1) {
                throw new InvalidRequestException("minCommunitySize must be >= 1, got: " + minCommunitySize);
            }
            if (communityResolution <= 0.0 || Double.isNaN(communityResolution)) {
                throw new InvalidRequestException("communityResolution must be > 0, got: " + communityResolution);
            }
            if (hubMinConnections < 1) {
                throw new InvalidRequestException("hubMinConnections must be >= 1, got: " + hubMinConnections);
            }
            InputSanitizer.validateRange("propagationDepth", propagationDepth, 1, 5);
            InputSanitizer.validateUnitInterval("propagationFactor", propagationFactor);
            InputSanitizer.validateUnitInterval("minPropagatedScore", minPropagatedScore);
            if (pathTarget != null) {
                InputSanitizer.validateEntityId("pathTarget", pathTarget);
            }
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new InvalidRequestException("timeout must be positive, got: " + timeout);
            }
            return new NetworkAnalysisRequest(this);
        }
    }
}

package com.aml.network.api;

import com.aml.network.core.model.CentralityRecord;
import com.aml.network.core.model.CircularRelationship;
import com.aml.network.core.model.Community;
import com.aml.network.core.model.HubEntity;
import com.aml.network.core.model.NetworkGraph;
import com.aml.network.core.model.NetworkPath;
import com.aml.network.core.model.RiskPropagationResult;
import com.aml.network.network.NetworkBuildResult;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Everything one {@link NetworkAnalysisRequest} produced. Immutable, so it can be shared
 * through the result cache.
 *
 * <p>A component that failed leaves its section empty and adds a message to
 * {@link #getErrors()}; the other sections are unaffected.</p>
 */
public final class NetworkAnalysisResult {

    private final String correlationId;
    private final NetworkBuildResult build;
    private final List<CentralityRecord> centrality;
    private final List<Community> communities;
    private final List<HubEntity> hubs;
    private final RiskPropagationResult riskPropagation;
    private final List<CircularRelationship> cycles;
    private final NetworkPath path;
    private final NetworkStatistics statistics;
    private final List<NodeRiskAssessment> nodeRisks;
    private final List<String> recommendations;
    private final VisualizationHints visualization;
    private final List<String> errors;
    private final Duration processingTime;

    private NetworkAnalysisResult(Builder builder) {
        this.correlationId = builder.correlationId;
        this.build = builder.build;
        this.centrality = List.copyOf(builder.centrality);
        this.communities = List.copyOf(builder.communities);
        this.hubs = List.copyOf(builder.hubs);
        this.riskPropagation = builder.riskPropagation;
        this.cycles = List.copyOf(builder.cycles);
        this.path = builder.path;
        this.statistics = builder.statistics;
        this.nodeRisks = List.copyOf(builder.nodeRisks);
        this.recommendations = List.copyOf(builder.recommendations);
        this.visualization = builder.visualization;
        this.errors = List.copyOf(builder.errors);
        this.processingTime = builder.processingTime;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public NetworkBuildResult getBuild() {
        return build;
    }

    public NetworkGraph getGraph() {
        return build.graph();
    }

    public boolean isBuildFailed() {
        return build.isFailed();
    }

    public List<CentralityRecord> getCentrality() {
        return centrality;
    }

    public Optional<CentralityRecord> getCentrality(String entityId) {
        return centrality.stream().filter(c -> c.entityId().equals(entityId)).findFirst();
    }

    public List<Community> getCommunities() {
        return communities;
    }

    public List<HubEntity> getHubs() {
        return hubs;
    }

    public RiskPropagationResult getRiskPropagation() {
        return riskPropagation;
    }

    public List<CircularRelationship> getCycles() {
        return cycles;
    }

    /**
     * The center-to-target path, present when the request named a path target.
     */
    public Optional<NetworkPath> getPath() {
        return Optional.ofNullable(path);
    }

    public NetworkStatistics getStatistics() {
        return statistics;
    }

    public List<NodeRiskAssessment> getNodeRisks() {
        return nodeRisks;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public VisualizationHints getVisualization() {
        return visualization;
    }

    public List<String> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Duration getProcessingTime() {
        return processingTime;
    }

    @Override
    public String toString() {
        return "NetworkAnalysisResult{" +
                "graph=" + build.graph() +
                ", status=" + build.status() +
                ", communities=" + communities.size() +
                ", hubs=" + hubs.size() +
                ", cycles=" + cycles.size() +
                ", errors=" + errors +
                ", processingTime=" + processingTime +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String correlationId;
        private NetworkBuildResult build;
        private List<CentralityRecord> centrality = List.of();
        private List<Community> communities = List.of();
        private List<HubEntity> hubs = List.of();
        private RiskPropagationResult riskPropagation;
        private List<CircularRelationship> cycles = List.of();
        private NetworkPath path;
        private NetworkStatistics statistics;
        private List<NodeRiskAssessment> nodeRisks = List.of();
        private List<String> recommendations = List.of();
        private VisualizationHints visualization;
        private List<String> errors = List.of();
        private Duration processingTime = Duration.ZERO;

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder buildResult(NetworkBuildResult build) {
            this.build = build;
            return this;
        }

        public Builder centrality(List<CentralityRecord> centrality) {
            this.centrality = centrality;
            return this;
        }

        public Builder communities(List<Community> communities) {
            this.communities = communities;
            return this;
        }

        public Builder hubs(List<HubEntity> hubs) {
            this.hubs = hubs;
            return this;
        }

        public Builder riskPropagation(RiskPropagationResult riskPropagation) {
            this.riskPropagation = riskPropagation;
            return this;
        }

        public Builder cycles(List<CircularRelationship> cycles) {
            this.cycles = cycles;
            return this;
        }

        public Builder path(NetworkPath path) {
            this.path = path;
            return this;
        }

        public Builder statistics(NetworkStatistics statistics) {
            this.statistics = statistics;
            return this;
        }

        public Builder nodeRisks(List<NodeRiskAssessment> nodeRisks) {
            this.nodeRisks = nodeRisks;
            return this;
        }

        public Builder recommendations(List<String> recommendations) {
            this.recommendations = recommendations;
            return this;
        }

        public Builder visualization(VisualizationHints visualization) {
            this.visualization = visualization;
            return this;
        }

        public Builder errors(List<String> errors) {
            this.errors = errors;
            return this;
        }

        public Builder processingTime(Duration processingTime) {
            this.processingTime = processingTime;
            return this;
        }

        public NetworkAnalysisResult build() {
            if (build == null) {
                throw new IllegalStateException("build result is required");
            }
            if (riskPropagation == null) {
                riskPropagation = RiskPropagationResult.empty(build.graph().getCenterEntityId(), 0.0);
            }
            if (statistics == null) {
                statistics = NetworkStatistics.of(build.graph());
            }
            if (visualization == null) {
                visualization = VisualizationHints.forGraph(build.graph(), LayoutAlgorithm.FORCE);
            }
            return new NetworkAnalysisResult(this);
        }
    }
}

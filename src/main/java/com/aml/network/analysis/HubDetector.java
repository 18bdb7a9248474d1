package com.aml.network.analysis;

import com.aml.network.core.model.EntitySummary;
import com.aml.network.core.model.HubEntity;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.RelationshipType;
import com.aml.network.graph.GraphStore;
import com.aml.network.graph.GraphStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds entities whose active relationship degree meets a threshold.
 *
 * <p>Influence score, when risk analysis is requested:</p>
 * <pre>
 * 0.4 * degree + 0.3 * (avgConfidence * 30) + 0.2 * (distinctTypes * 5) + 0.1 * (riskScore * 10)
 * </pre>
 */
public class HubDetector {
    private static final Logger log = LoggerFactory.getLogger(HubDetector.class);

    public static final int MAX_HUBS = 20;

    private final GraphStore store;

    public HubDetector(GraphStore store) {
        this.store = store;
    }

    public Result detect(HubQuery query, Collection<RelationshipEdge> edges) {
        Set<String> candidates = new LinkedHashSet<>(query.candidateIds());
        if (candidates.isEmpty()) {
            for (RelationshipEdge edge : edges) {
                if (edge.isActive()) {
                    candidates.add(edge.getSourceId());
                    candidates.add(edge.getTargetId());
                }
            }
        }

        List<Degree> degrees = new ArrayList<>();
        for (String entityId : candidates) {
            int count = 0;
            double confidenceSum = 0.0;
            Set<RelationshipType> types = EnumSet.noneOf(RelationshipType.class);
            for (RelationshipEdge edge : edges) {
                if (!edge.isActive() || edge.isSelfLoop() || !edge.connects(entityId)) {
                    continue;
                }
                if (!query.connectionTypes().isEmpty() && !query.connectionTypes().contains(edge.getType())) {
                    continue;
                }
                count++;
                confidenceSum += edge.getConfidence();
                types.add(edge.getType());
            }
            if (count >= query.minConnections()) {
                degrees.add(new Degree(entityId, count, confidenceSum / count, types));
            }
        }
        degrees.sort(Comparator.comparingInt(Degree::count).reversed().thenComparing(Degree::entityId));
        if (degrees.size() > MAX_HUBS) {
            degrees = degrees.subList(0, MAX_HUBS);
        }

        if (!query.includeRiskAnalysis() || degrees.isEmpty()) {
            return new Result(degrees.stream().map(Degree::toHub).toList(), null);
        }

        Map<String, EntitySummary> summaries;
        try {
            summaries = store.batchLookupEntities(degrees.stream().map(Degree::entityId).toList());
        } catch (GraphStoreException e) {
            log.warn("Hub enrichment lookup failed, returning {} hubs without risk analysis: {}",
                    degrees.size(), e.getMessage());
            return new Result(degrees.stream().map(Degree::toHub).toList(), e.getMessage());
        }

        List<HubEntity> hubs = new ArrayList<>(degrees.size());
        for (Degree degree : degrees) {
            EntitySummary summary = summaries.get(degree.entityId());
            if (summary == null) {
                summary = EntitySummary.withDefaults(degree.entityId());
            }
            double influence = 0.4 * degree.count()
                    + 0.3 * (degree.averageConfidence() * 30)
                    + 0.2 * (degree.types().size() * 5)
                    + 0.1 * (summary.riskScore() * 10);
            hubs.add(new HubEntity(degree.entityId(), degree.count(), degree.averageConfidence(), degree.types(),
                    summary.name(), summary.type(), summary.riskScore(), summary.riskLevel(), influence));
        }
        return new Result(hubs, null);
    }

    /**
     * Hubs by descending degree (ties by id), plus the enrichment error if the lookup failed.
     */
    public record Result(List<HubEntity> hubs, String error) {
        public Result {
            hubs = hubs != null ? List.copyOf(hubs) : List.of();
        }
    }

    private record Degree(String entityId, int count, double averageConfidence, Set<RelationshipType> types) {
        HubEntity toHub() {
            return new HubEntity(entityId, count, averageConfidence, types, null, null, null, null, null);
        }
    }
}

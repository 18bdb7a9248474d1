package com.aml.network.analysis;

import com.aml.network.core.model.PropagatedRisk;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.RiskPropagationResult;
import com.aml.network.graph.ConnectionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spreads a seed entity's risk across its relationships, decaying at every hop.
 *
 * <p>For an unreached neighbor of an entity reached at the previous level:</p>
 * <pre>
 * propagated = parentRisk * propagationFactor * confidence * typeRiskWeight
 * </pre>
 * <p>so the value at depth {@code d} is {@code seed * factor^d} times the product of
 * the edge terms along its path. An entity keeps the value of its first arrival. A zero
 * value, or one below the minimum, is not recorded and leaves the neighbor open to other edges.</p>
 */
public class RiskPropagator {
    private static final Logger log = LoggerFactory.getLogger(RiskPropagator.class);

    /**
     * @throws com.aml.network.graph.GraphStoreException if the connection source is store-backed and fails
     */
    public RiskPropagationResult propagate(PropagationQuery query, double seedRisk, ConnectionSource connections) {
        String sourceId = query.sourceEntityId();
        if (seedRisk <= 0.0 || seedRisk < query.minPropagatedScore()) {
            log.debug("Seed risk {} of {} below minimum {}, nothing propagates",
                    seedRisk, sourceId, query.minPropagatedScore());
            return RiskPropagationResult.empty(sourceId, seedRisk);
        }

        Map<String, PropagatedRisk> reached = new LinkedHashMap<>();
        Map<String, Double> riskOf = new HashMap<>();
        Map<String, List<RelationshipEdge>> pathOf = new HashMap<>();
        riskOf.put(sourceId, seedRisk);
        pathOf.put(sourceId, List.of());
        List<String> frontier = List.of(sourceId);

        for (int depth = 1; depth <= query.maxDepth() && !frontier.isEmpty(); depth++) {
            List<String> next = new ArrayList<>();
            for (String parentId : frontier) {
                double parentRisk = riskOf.get(parentId);
                List<RelationshipEdge> edges = new ArrayList<>(connections.connectionsOf(parentId));
                edges.sort(Comparator.comparing((RelationshipEdge e) -> e.otherEnd(parentId))
                        .thenComparing(RelationshipEdge::getRelationshipId));
                for (RelationshipEdge edge : edges) {
                    String neighbor = edge.otherEnd(parentId);
                    if (riskOf.containsKey(neighbor)) {
                        continue;
                    }
                    double propagated = parentRisk * query.propagationFactor() * edge.riskWeightedConfidence();
                    if (propagated <= 0.0 || propagated < query.minPropagatedScore()) {
                        continue;
                    }
                    List<RelationshipEdge> path = new ArrayList<>(pathOf.get(parentId));
                    path.add(edge);
                    riskOf.put(neighbor, propagated);
                    pathOf.put(neighbor, path);
                    reached.put(neighbor, new PropagatedRisk(neighbor, propagated, depth, path));
                    next.add(neighbor);
                }
            }
            log.debug("Propagation from {} level {}: {} newly reached", sourceId, depth, next.size());
            frontier = next;
        }
        return new RiskPropagationResult(sourceId, seedRisk, reached, null);
    }
}

package com.aml.network.analysis;

import com.aml.network.core.model.Community;
import com.aml.network.core.model.RelationshipEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Connected components over high-confidence relationships.
 *
 * <p>The confidence floor is {@code min(0.7 * resolution, 1.0)}. Components are grown by
 * breadth-first search seeded in candidate order, so community numbering is stable for
 * a given input. Components smaller than the minimum size are discarded.</p>
 */
public class CommunityDetector {
    private static final Logger log = LoggerFactory.getLogger(CommunityDetector.class);

    public static final int DEFAULT_MIN_SIZE = 3;
    public static final double DEFAULT_RESOLUTION = 1.0;
    public static final double BASE_CONFIDENCE_FLOOR = 0.7;

    public List<Community> detect(Collection<String> candidateIds, Collection<RelationshipEdge> edges) {
        return detect(candidateIds, edges, DEFAULT_MIN_SIZE, DEFAULT_RESOLUTION);
    }

    public List<Community> detect(Collection<String> candidateIds, Collection<RelationshipEdge> edges,
                                  int minCommunitySize, double resolution) {
        if (minCommunitySize < 1) {
            throw new IllegalArgumentException("minCommunitySize must be >= 1");
        }
        if (resolution <= 0.0) {
            throw new IllegalArgumentException("resolution must be > 0");
        }
        double floor = Math.min(BASE_CONFIDENCE_FLOOR * resolution, 1.0);
        Set<String> candidates = new LinkedHashSet<>(candidateIds);

        Map<String, List<RelationshipEdge>> adjacency = new LinkedHashMap<>();
        for (RelationshipEdge edge : edges) {
            if (!edge.isActive() || edge.isSelfLoop() || edge.getConfidence() < floor
                    || !candidates.contains(edge.getSourceId()) || !candidates.contains(edge.getTargetId())) {
                continue;
            }
            adjacency.computeIfAbsent(edge.getSourceId(), k -> new ArrayList<>()).add(edge);
            adjacency.computeIfAbsent(edge.getTargetId(), k -> new ArrayList<>()).add(edge);
        }

        List<Community> communities = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String seed : candidates) {
            if (!visited.add(seed)) {
                continue;
            }
            List<String> members = new ArrayList<>();
            Set<String> internalEdges = new HashSet<>();
            double confidenceSum = 0.0;
            Deque<String> queue = new ArrayDeque<>();
            queue.add(seed);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                members.add(current);
                for (RelationshipEdge edge : adjacency.getOrDefault(current, List.of())) {
                    if (internalEdges.add(edge.getRelationshipId())) {
                        confidenceSum += edge.getConfidence();
                    }
                    String neighbor = edge.otherEnd(current);
                    if (visited.add(neighbor)) {
                        queue.add(neighbor);
                    }
                }
            }
            if (members.size() < minCommunitySize) {
                continue;
            }
            int n = members.size();
            int internal = internalEdges.size();
            double density = n > 1 ? internal / (n * (n - 1) / 2.0) : 0.0;
            double averageConfidence = internal > 0 ? confidenceSum / internal : 0.0;
            communities.add(new Community("community_" + communities.size(), members, internal,
                    density, averageConfidence));
        }
        log.debug("Detected {} communities among {} candidates (floor {})", communities.size(),
                candidates.size(), floor);
        return communities;
    }
}

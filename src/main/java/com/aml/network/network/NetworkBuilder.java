package com.aml.network.network;

import com.aml.network.core.model.EntityNode;
import com.aml.network.core.model.EntitySummary;
import com.aml.network.core.model.NetworkGraph;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.TraversalHop;
import com.aml.network.graph.GraphStore;
import com.aml.network.graph.GraphStoreException;
import com.aml.network.metrics.MetricsService;
import com.aml.network.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pulls a filtered, depth-bounded subgraph around a center entity from a {@link GraphStore}
 * and normalizes it into a {@link NetworkGraph}.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>one bidirectional bounded traversal from the center</li>
 *   <li>self loops dropped, duplicates removed by relationship id, edges truncated
 *       to {@code maxRelationships} in traversal order</li>
 *   <li>batch lookup of every endpoint; ids the store does not know get defaults</li>
 *   <li>entity type include/exclude filters (the center is never removed)</li>
 *   <li>node cap: farthest discovered entities are dropped first</li>
 *   <li>edges that lost an endpoint are dropped, then every entity no longer within
 *       {@code maxDepth} hops of the center over the remaining edges, with its edges</li>
 * </ol>
 *
 * <p>A store failure yields a {@link NetworkBuildResult.Status#FAILED} result with a
 * zero-sized graph.</p>
 */
public class NetworkBuilder {
    private static final Logger log = LoggerFactory.getLogger(NetworkBuilder.class);

    private final GraphStore store;
    private final MetricsService metrics;

    public NetworkBuilder(GraphStore store) {
        this(store, new NoOpMetricsService());
    }

    public NetworkBuilder(GraphStore store, MetricsService metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    public NetworkBuildResult build(NetworkQuery query) {
        long start = System.nanoTime();
        String centerId = query.getCenterEntityId();
        try {
            NetworkGraph graph = doBuild(query);
            metrics.recordGraphSize(graph.getTotalEntities(), graph.getTotalRelationships());
            log.info("Built network for {}: {} entities, {} relationships (depth {})",
                    centerId, graph.getTotalEntities(), graph.getTotalRelationships(), query.getMaxDepth());
            return NetworkBuildResult.built(graph);
        } catch (GraphStoreException e) {
            metrics.incrementStoreFailure(e.getOperation());
            log.warn("Network build for {} failed during {}: {}", centerId, e.getOperation(), e.getMessage());
            return NetworkBuildResult.failed(centerId, query.getMaxDepth(), e.getMessage());
        } finally {
            metrics.recordBuildDuration(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private NetworkGraph doBuild(NetworkQuery query) {
        String centerId = query.getCenterEntityId();
        List<TraversalHop> hops = store.boundedTraversal(centerId, query.getMaxDepth(), query.toFilter());

        // discovery depth per entity, in discovery order
        Map<String, Integer> discovered = new LinkedHashMap<>();
        discovered.put(centerId, 0);
        List<RelationshipEdge> edges = new ArrayList<>();
        Set<String> seenRelationships = new HashSet<>();
        int selfLoops = 0;

        for (TraversalHop hop : hops) {
            RelationshipEdge edge = hop.edge();
            if (edge.isSelfLoop()) {
                selfLoops++;
                continue;
            }
            if (!seenRelationships.add(edge.getRelationshipId())) {
                continue;
            }
            if (edges.size() >= query.getMaxRelationships()) {
                log.debug("Relationship limit {} reached for {}", query.getMaxRelationships(), centerId);
                break;
            }
            edges.add(edge);
            discovered.putIfAbsent(edge.getSourceId(), hop.depth());
            discovered.putIfAbsent(edge.getTargetId(), hop.depth());
        }
        if (selfLoops > 0) {
            log.debug("Dropped {} self-loop relationships around {}", selfLoops, centerId);
        }

        Map<String, EntitySummary> summaries = store.batchLookupEntities(List.copyOf(discovered.keySet()));
        Map<String, EntitySummary> resolved = new LinkedHashMap<>();
        for (String id : discovered.keySet()) {
            EntitySummary summary = summaries.get(id);
            if (summary == null) {
                log.debug("Entity {} not found by lookup, using defaults", id);
                summary = EntitySummary.withDefaults(id);
            }
            resolved.put(id, summary);
        }

        Set<String> kept = new LinkedHashSet<>();
        for (EntitySummary summary : resolved.values()) {
            if (summary.id().equals(centerId) || query.admits(summary.type())) {
                kept.add(summary.id());
            }
        }
        if (kept.size() > query.getMaxEntities()) {
            // discovery order is nearest-first, so the tail holds the farthest entities
            Set<String> capped = new LinkedHashSet<>();
            for (String id : kept) {
                if (capped.size() >= query.getMaxEntities()) {
                    break;
                }
                capped.add(id);
            }
            log.debug("Entity limit {} reached for {}, dropped {}",
                    query.getMaxEntities(), centerId, kept.size() - capped.size());
            kept = capped;
        }

        List<RelationshipEdge> candidates = new ArrayList<>();
        for (RelationshipEdge edge : edges) {
            if (kept.contains(edge.getSourceId()) && kept.contains(edge.getTargetId())) {
                candidates.add(edge);
            }
        }

        Map<String, Integer> distances = reachableFromCenter(centerId, candidates, query.getMaxDepth());
        if (distances.size() < kept.size()) {
            log.debug("Dropped {} entities cut off from {} by filtering", kept.size() - distances.size(), centerId);
        }

        List<RelationshipEdge> surviving = new ArrayList<>();
        Map<String, Integer> connectionCounts = new HashMap<>();
        for (RelationshipEdge edge : candidates) {
            if (distances.containsKey(edge.getSourceId()) && distances.containsKey(edge.getTargetId())) {
                surviving.add(edge);
                connectionCounts.merge(edge.getSourceId(), 1, Integer::sum);
                connectionCounts.merge(edge.getTargetId(), 1, Integer::sum);
            }
        }

        List<EntityNode> nodes = new ArrayList<>();
        for (String id : kept) {
            Integer distance = distances.get(id);
            if (distance == null) {
                continue;
            }
            nodes.add(EntityNode.from(resolved.get(id))
                    .connectionCount(connectionCounts.getOrDefault(id, 0))
                    .center(id.equals(centerId))
                    .depth(distance)
                    .build());
        }
        return new NetworkGraph(centerId, query.getMaxDepth(), nodes, surviving);
    }

    /**
     * Hop distance from the center over {@code edges}, for every entity within {@code maxDepth}.
     */
    private static Map<String, Integer> reachableFromCenter(String centerId, List<RelationshipEdge> edges,
                                                            int maxDepth) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (RelationshipEdge edge : edges) {
            adjacency.computeIfAbsent(edge.getSourceId(), k -> new ArrayList<>()).add(edge.getTargetId());
            adjacency.computeIfAbsent(edge.getTargetId(), k -> new ArrayList<>()).add(edge.getSourceId());
        }
        Map<String, Integer> distances = new HashMap<>();
        distances.put(centerId, 0);
        Deque<String> queue = new ArrayDeque<>(List.of(centerId));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int next = distances.get(current) + 1;
            if (next > maxDepth) {
                continue;
            }
            for (String neighbor : adjacency.getOrDefault(current, List.of())) {
                if (distances.putIfAbsent(neighbor, next) == null) {
                    queue.add(neighbor);
                }
            }
        }
        return distances;
    }
}

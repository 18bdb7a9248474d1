package com.aml.network.analysis;

import com.aml.network.core.model.NetworkPath;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.graph.ConnectionSource;
import com.aml.network.graph.GraphStore;
import com.aml.network.graph.GraphStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Breadth-first shortest path search over undirected relationships.
 *
 * <p>Each level looks up the direct connections of every frontier entity, in ascending
 * id order, and visits their edges in (neighbor id, relationship id) order. The first
 * time the target is reached the path is reconstructed from parent pointers, so the
 * result has the minimum hop count and ties resolve the same way on every run.</p>
 */
public class PathFinder {
    private static final Logger log = LoggerFactory.getLogger(PathFinder.class);

    private final GraphStore store;

    public PathFinder(GraphStore store) {
        this.store = store;
    }

    /**
     * Finds the shortest path. Never throws for store failures: the result is a
     * not-found path carrying the error.
     */
    public NetworkPath findPath(PathQuery query) {
        String source = query.sourceEntityId();
        String target = query.targetEntityId();
        if (source.equals(target)) {
            return NetworkPath.of(source, target, List.of());
        }
        try {
            return search(query, ConnectionSource.of(store, query.toFilter()));
        } catch (GraphStoreException e) {
            log.warn("Path search {} -> {} failed during {}: {}", source, target, e.getOperation(), e.getMessage());
            return NetworkPath.notFound(source, target, e.getMessage());
        }
    }

    private NetworkPath search(PathQuery query, ConnectionSource connections) {
        String source = query.sourceEntityId();
        String target = query.targetEntityId();
        Map<String, RelationshipEdge> parentEdge = new HashMap<>();
        Map<String, String> parent = new HashMap<>();
        parent.put(source, null);
        Set<String> frontier = new TreeSet<>(Set.of(source));

        for (int depth = 1; depth <= query.maxDepth() && !frontier.isEmpty(); depth++) {
            Set<String> next = new TreeSet<>();
            for (String current : frontier) {
                List<RelationshipEdge> edges = new ArrayList<>(connections.connectionsOf(current));
                edges.sort(Comparator.comparing((RelationshipEdge e) -> e.otherEnd(current))
                        .thenComparing(RelationshipEdge::getRelationshipId));
                for (RelationshipEdge edge : edges) {
                    String neighbor = edge.otherEnd(current);
                    if (parent.containsKey(neighbor)) {
                        continue;
                    }
                    parent.put(neighbor, current);
                    parentEdge.put(neighbor, edge);
                    if (neighbor.equals(target)) {
                        NetworkPath path = NetworkPath.of(source, target, reconstruct(target, parent, parentEdge));
                        log.debug("Path {} -> {} found with {} hops", source, target, path.hopCount());
                        return path;
                    }
                    next.add(neighbor);
                }
            }
            frontier = next;
        }
        log.debug("No path {} -> {} within {} hops", source, target, query.maxDepth());
        return NetworkPath.notFound(source, target, null);
    }

    private static List<RelationshipEdge> reconstruct(String target, Map<String, String> parent,
                                                      Map<String, RelationshipEdge> parentEdge) {
        List<RelationshipEdge> edges = new ArrayList<>();
        String current = target;
        while (parent.get(current) != null) {
            edges.add(parentEdge.get(current));
            current = parent.get(current);
        }
        Collections.reverse(edges);
        return edges;
    }
}

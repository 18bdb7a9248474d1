package com.aml.network.analysis;

import com.aml.network.core.model.CircularRelationship;
import com.aml.network.core.model.NetworkGraph;
import com.aml.network.core.model.RelationshipEdge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds closed chains of relationships in a built graph.
 *
 * <p>Depth-first search from every node over active edges, treated as undirected. A
 * walk never steps back over the relationship it just used and never revisits an
 * entity, so each cycle has at least three distinct entities. Cycles are rotated to
 * start at their smallest id and oriented toward the smaller neighbor, so each one is
 * reported once.</p>
 */
public class CycleDetector {

    public static final int DEFAULT_MAX_LENGTH = 6;
    public static final int MAX_CYCLES = 10;

    public List<CircularRelationship> detect(NetworkGraph graph) {
        return detect(graph, DEFAULT_MAX_LENGTH);
    }

    public List<CircularRelationship> detect(NetworkGraph graph, int maxCycleLength) {
        if (maxCycleLength < 3) {
            throw new IllegalArgumentException("maxCycleLength must be >= 3");
        }
        Set<List<String>> found = new LinkedHashSet<>();
        List<String> starts = new ArrayList<>(graph.getNodeIds());
        Collections.sort(starts);
        for (String start : starts) {
            if (found.size() >= MAX_CYCLES) {
                break;
            }
            List<String> walk = new ArrayList<>();
            walk.add(start);
            search(graph, start, start, null, walk, maxCycleLength, found);
        }
        return found.stream().map(CircularRelationship::new).toList();
    }

    private void search(NetworkGraph graph, String start, String current, RelationshipEdge arrivedBy,
                        List<String> walk, int maxLength, Set<List<String>> found) {
        List<RelationshipEdge> edges = new ArrayList<>(graph.connectionsOf(current));
        edges.sort(Comparator.comparing((RelationshipEdge e) -> e.otherEnd(current))
                .thenComparing(RelationshipEdge::getRelationshipId));
        for (RelationshipEdge edge : edges) {
            if (found.size() >= MAX_CYCLES) {
                return;
            }
            if (!edge.isActive() || edge.isSelfLoop() || edge.equals(arrivedBy)) {
                continue;
            }
            String next = edge.otherEnd(current);
            if (next.equals(start)) {
                if (walk.size() >= 3) {
                    found.add(canonical(walk));
                }
                continue;
            }
            // only extend through ids larger than the start; smaller starts already covered them
            if (walk.contains(next) || next.compareTo(start) < 0 || walk.size() >= maxLength) {
                continue;
            }
            walk.add(next);
            search(graph, start, next, edge, walk, maxLength, found);
            walk.remove(walk.size() - 1);
        }
    }

    private static List<String> canonical(List<String> walk) {
        int n = walk.size();
        int min = 0;
        for (int i = 1; i < n; i++) {
            if (walk.get(i).compareTo(walk.get(min)) < 0) {
                min = i;
            }
        }
        List<String> forward = new ArrayList<>(n);
        List<String> backward = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            forward.add(walk.get((min + i) % n));
            backward.add(walk.get((min - i + n) % n));
        }
        return forward.get(1).compareTo(backward.get(1)) <= 0 ? List.copyOf(forward) : List.copyOf(backward);
    }
}

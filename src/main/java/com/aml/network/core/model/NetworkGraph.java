package com.aml.network.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, request-scoped subgraph around a center entity.
 *
 * <p>Every edge endpoint is a node, and the node set is exactly the edge endpoints plus
 * the center. The only exception is the zero-sized graph returned when a build fails.
 * Nodes keep discovery order (nearest first) and edges keep traversal order.</p>
 */
public final class NetworkGraph {

    private final String centerEntityId;
    private final int maxDepth;
    private final Map<String, EntityNode> nodes;
    private final List<RelationshipEdge> edges;
    private final Map<String, List<RelationshipEdge>> adjacency;

    public NetworkGraph(String centerEntityId, int maxDepth,
                        Collection<EntityNode> nodes, List<RelationshipEdge> edges) {
        this.centerEntityId = Objects.requireNonNull(centerEntityId, "centerEntityId is required");
        this.maxDepth = maxDepth;

        Map<String, EntityNode> nodeMap = new LinkedHashMap<>();
        for (EntityNode node : nodes) {
            nodeMap.put(node.getId(), node);
        }
        Map<String, List<RelationshipEdge>> adj = new LinkedHashMap<>();
        for (RelationshipEdge edge : edges) {
            if (!nodeMap.containsKey(edge.getSourceId()) || !nodeMap.containsKey(edge.getTargetId())) {
                throw new IllegalArgumentException("Edge " + edge.getRelationshipId()
                        + " references an entity that is not a node of the graph");
            }
            adj.computeIfAbsent(edge.getSourceId(), k -> new ArrayList<>()).add(edge);
            if (!edge.isSelfLoop()) {
                adj.computeIfAbsent(edge.getTargetId(), k -> new ArrayList<>()).add(edge);
            }
        }
        adj.replaceAll((k, v) -> List.copyOf(v));

        this.nodes = Collections.unmodifiableMap(nodeMap);
        this.edges = List.copyOf(edges);
        this.adjacency = Collections.unmodifiableMap(adj);
    }

    /**
     * Zero-sized graph: no nodes and no edges. Used as the payload of a failed build.
     */
    public static NetworkGraph empty(String centerEntityId, int maxDepth) {
        return new NetworkGraph(centerEntityId, maxDepth, List.of(), List.of());
    }

    public String getCenterEntityId() {
        return centerEntityId;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public List<EntityNode> getNodes() {
        return List.copyOf(nodes.values());
    }

    public Set<String> getNodeIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(nodes.keySet()));
    }

    public Optional<EntityNode> getNode(String entityId) {
        return Optional.ofNullable(nodes.get(entityId));
    }

    public boolean containsNode(String entityId) {
        return nodes.containsKey(entityId);
    }

    public List<RelationshipEdge> getEdges() {
        return edges;
    }

    /**
     * Edges incident to an entity in either direction, in traversal order.
     */
    public List<RelationshipEdge> connectionsOf(String entityId) {
        return adjacency.getOrDefault(entityId, List.of());
    }

    public int getTotalEntities() {
        return nodes.size();
    }

    public int getTotalRelationships() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public String toString() {
        return "NetworkGraph{" +
                "center='" + centerEntityId + '\'' +
                ", maxDepth=" + maxDepth +
                ", nodes=" + nodes.size() +
                ", edges=" + edges.size() +
                '}';
    }
}

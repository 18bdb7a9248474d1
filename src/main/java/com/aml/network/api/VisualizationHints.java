package com.aml.network.api;

import com.aml.network.core.model.EntityNode;
import com.aml.network.core.model.NetworkGraph;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.RiskLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rendering hints for a built network: colors, sizes and positions.
 *
 * @param layout     layout the positions were computed with
 * @param nodeStyles node id to style, in graph order
 * @param edgeStyles relationship id to style, in graph order
 */
public record VisualizationHints(
        LayoutAlgorithm layout,
        Map<String, NodeStyle> nodeStyles,
        Map<String, EdgeStyle> edgeStyles
) {
    private static final double FORCE_BASE_RADIUS = 100.0;
    private static final double CIRCULAR_RADIUS = 150.0;
    private static final double ROW_SPACING = 100.0;
    private static final double COLUMN_SPACING = 120.0;

    public VisualizationHints {
        nodeStyles = Collections.unmodifiableMap(new LinkedHashMap<>(nodeStyles));
        edgeStyles = Collections.unmodifiableMap(new LinkedHashMap<>(edgeStyles));
    }

    public record NodeStyle(String color, int size, double x, double y) {
    }

    public record EdgeStyle(String color, double thickness) {
    }

    public static VisualizationHints forGraph(NetworkGraph graph, LayoutAlgorithm layout) {
        Map<String, double[]> positions = switch (layout) {
            case FORCE -> ringLayout(graph, true);
            case CIRCULAR -> ringLayout(graph, false);
            case HIERARCHICAL -> hierarchicalLayout(graph);
        };

        Map<String, NodeStyle> nodes = new LinkedHashMap<>();
        for (EntityNode node : graph.getNodes()) {
            double[] position = positions.getOrDefault(node.getId(), new double[]{0.0, 0.0});
            nodes.put(node.getId(), new NodeStyle(nodeColor(node.getRiskLevel()),
                    nodeSize(node.getConnectionCount()), position[0], position[1]));
        }
        Map<String, EdgeStyle> edges = new LinkedHashMap<>();
        for (RelationshipEdge edge : graph.getEdges()) {
            edges.put(edge.getRelationshipId(),
                    new EdgeStyle(edgeColor(edge.getConfidence()), Math.max(1.0, edge.getConfidence() * 5)));
        }
        return new VisualizationHints(layout, nodes, edges);
    }

    static String nodeColor(RiskLevel level) {
        return switch (level) {
            case LOW -> "#4CAF50";
            case MEDIUM -> "#FF9800";
            case HIGH -> "#F44336";
            case CRITICAL -> "#9C27B0";
        };
    }

    static int nodeSize(int connections) {
        return Math.max(10, Math.min(50, connections * 5));
    }

    static String edgeColor(double confidence) {
        if (confidence >= 0.8) {
            return "#4CAF50";
        }
        if (confidence >= 0.6) {
            return "#FF9800";
        }
        if (confidence >= 0.4) {
            return "#FFC107";
        }
        return "#9E9E9E";
    }

    private static Map<String, double[]> ringLayout(NetworkGraph graph, boolean radiusByConnections) {
        Map<String, double[]> positions = new LinkedHashMap<>();
        List<EntityNode> others = new ArrayList<>();
        for (EntityNode node : graph.getNodes()) {
            if (node.isCenter()) {
                positions.put(node.getId(), new double[]{0.0, 0.0});
            } else {
                others.add(node);
            }
        }
        for (int i = 0; i < others.size(); i++) {
            EntityNode node = others.get(i);
            double angle = 2 * Math.PI * i / others.size();
            double radius = radiusByConnections
                    ? FORCE_BASE_RADIUS + 10.0 * node.getConnectionCount()
                    : CIRCULAR_RADIUS;
            positions.put(node.getId(), new double[]{radius * Math.cos(angle), radius * Math.sin(angle)});
        }
        return positions;
    }

    private static Map<String, double[]> hierarchicalLayout(NetworkGraph graph) {
        Map<Integer, List<EntityNode>> rows = new TreeMap<>();
        for (EntityNode node : graph.getNodes()) {
            rows.computeIfAbsent(node.isCenter() ? 0 : node.getDepth(), k -> new ArrayList<>()).add(node);
        }
        Map<String, double[]> positions = new LinkedHashMap<>();
        rows.forEach((depth, row) -> {
            double offset = (row.size() - 1) * COLUMN_SPACING / 2.0;
            for (int i = 0; i < row.size(); i++) {
                positions.put(row.get(i).getId(), new double[]{i * COLUMN_SPACING - offset, depth * ROW_SPACING});
            }
        });
        return positions;
    }
}

package com.aml.network.network;

import com.aml.network.GraphFixtures;
import com.aml.network.core.InvalidRequestException;
import com.aml.network.core.model.EntityNode;
import com.aml.network.core.model.EntitySummary;
import com.aml.network.core.model.EntityType;
import com.aml.network.core.model.NetworkGraph;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.RelationshipType;
import com.aml.network.graph.GraphStore;
import com.aml.network.graph.GraphStoreException;
import com.aml.network.graph.InMemoryGraphStore;
import com.aml.network.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static com.aml.network.GraphFixtures.edge;
import static com.aml.network.GraphFixtures.entity;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("NetworkBuilder Tests")
class NetworkBuilderTest {

    private static NetworkGraph build(GraphStore store, NetworkQuery query) {
        NetworkBuildResult result = new NetworkBuilder(store).build(query);
        assertFalse(result.isFailed(), () -> "build failed: " + result.error());
        return result.graph();
    }

    /**
     * Center with {@code leaves} direct neighbors; each neighbor has one further neighbor.
     */
    private static InMemoryGraphStore star(int leaves) {
        InMemoryGraphStore store = new InMemoryGraphStore();
        store.putEntity(entity("HUB", 0.4));
        for (int i = 1; i <= leaves; i++) {
            String leaf = String.format("N%02d", i);
            String outer = String.format("O%02d", i);
            store.putEntity(entity(leaf, 0.1));
            store.putEntity(entity(outer, 0.1));
            store.putRelationship(edge(String.format("L%02d", i), "HUB", leaf));
            store.putRelationship(edge(String.format("M%02d", i), leaf, outer));
        }
        return store;
    }

    @Nested
    @DisplayName("Traversal")
    class TraversalTests {

        @Test
        @DisplayName("Should build the whole chain at depth 2 with depths and connection counts")
        void chain() {
            NetworkGraph graph = build(GraphFixtures.chain(), NetworkQuery.builder("A").build());

            EntityNode a = graph.getNode("A").orElseThrow();
            EntityNode b = graph.getNode("B").orElseThrow();
            EntityNode c = graph.getNode("C").orElseThrow();
            assertAll(
                    () -> assertEquals(3, graph.getTotalEntities()),
                    () -> assertEquals(2, graph.getTotalRelationships()),
                    () -> assertTrue(a.isCenter()),
                    () -> assertFalse(b.isCenter()),
                    () -> assertEquals(0, a.getDepth()),
                    () -> assertEquals(1, b.getDepth()),
                    () -> assertEquals(2, c.getDepth()),
                    () -> assertEquals(1, a.getConnectionCount()),
                    () -> assertEquals(2, b.getConnectionCount()),
                    () -> assertEquals(1, c.getConnectionCount())
            );
        }

        @Test
        @DisplayName("Depth 1 should stop at direct neighbors")
        void depthOne() {
            NetworkGraph graph = build(GraphFixtures.chain(), NetworkQuery.builder("A").maxDepth(1).build());

            assertEquals(Set.of("A", "B"), graph.getNodeIds());
        }

        @Test
        @DisplayName("Traversal should follow relationships against their direction")
        void bidirectional() {
            NetworkGraph graph = build(GraphFixtures.chain(), NetworkQuery.builder("C").build());

            assertEquals(Set.of("A", "B", "C"), graph.getNodeIds());
        }

        @Test
        @DisplayName("An isolated center should yield a single-node graph")
        void isolatedCenter() {
            InMemoryGraphStore store = new InMemoryGraphStore();
            store.putEntity(entity("Z", 0.3));

            NetworkGraph graph = build(store, NetworkQuery.builder("Z").build());

            assertEquals(1, graph.getTotalEntities());
            assertEquals(0, graph.getTotalRelationships());
            assertTrue(graph.getNode("Z").orElseThrow().isCenter());
        }

        @Test
        @DisplayName("Unknown endpoints should be filled with default attributes")
        void unknownEndpoints() {
            InMemoryGraphStore store = new InMemoryGraphStore();
            store.putEntity(entity("A", 0.5));
            store.putRelationship(edge("R1", "A", "GHOST"));

            EntityNode ghost = build(store, NetworkQuery.builder("A").build()).getNode("GHOST").orElseThrow();

            assertAll(
                    () -> assertEquals(EntitySummary.UNKNOWN_NAME, ghost.getName()),
                    () -> assertEquals(EntityType.UNKNOWN, ghost.getType()),
                    () -> assertEquals(0.0, ghost.getRiskScore())
            );
        }
    }

    @Nested
    @DisplayName("Filtering")
    class FilterTests {

        @Test
        @DisplayName("Self loops should be dropped")
        void selfLoops() {
            InMemoryGraphStore store = GraphFixtures.chain();
            store.putRelationship(edge("LOOP", "A", "A"));

            NetworkGraph graph = build(store, NetworkQuery.builder("A").build());

            assertTrue(graph.getEdges().stream().noneMatch(RelationshipEdge::isSelfLoop));
            assertEquals(2, graph.getTotalRelationships());
        }

        @Test
        @DisplayName("Relationships below the confidence floor should be ignored")
        void confidenceFloor() {
            InMemoryGraphStore store = GraphFixtures.chain();
            store.putEntity(entity("WEAK", 0.9));
            store.putRelationship(edge("R9", "A", "WEAK", RelationshipType.ASSOCIATED_WITH, 0.3));

            assertFalse(build(store, NetworkQuery.builder("A").build()).containsNode("WEAK"));
            assertTrue(build(store, NetworkQuery.builder("A").minConfidence(0.2).build()).containsNode("WEAK"));
        }

        @Test
        @DisplayName("Relationship type filters should restrict traversal")
        void relationshipTypes() {
            InMemoryGraphStore store = GraphFixtures.chain();
            store.putEntity(entity("D", 0.1));
            store.putRelationship(edge("R3", "A", "D", RelationshipType.SHARED_ADDRESS, 0.9));

            NetworkGraph graph = build(store, NetworkQuery.builder("A")
                    .relationshipTypes(Set.of(RelationshipType.SHARED_ADDRESS))
                    .build());

            assertEquals(Set.of("A", "D"), graph.getNodeIds());
        }

        @Test
        @DisplayName("Excluded entity types should be removed with their relationships, never the center")
        void entityTypeExclusion() {
            InMemoryGraphStore store = new InMemoryGraphStore();
            store.putEntity(entity("A", EntityType.INDIVIDUAL, 0.2));
            store.putEntity(entity("B", EntityType.INDIVIDUAL, 0.2));
            store.putEntity(entity("C", EntityType.ORGANIZATION, 0.2));
            store.putRelationship(edge("R1", "A", "B"));
            store.putRelationship(edge("R2", "B", "C"));
            store.putRelationship(edge("R3", "A", "C"));

            NetworkGraph graph = build(store, NetworkQuery.builder("A")
                    .excludeEntityTypes(Set.of(EntityType.INDIVIDUAL))
                    .build());

            assertEquals(Set.of("A", "C"), graph.getNodeIds());
            assertEquals(1, graph.getTotalRelationships());
            assertEquals("R3", graph.getEdges().get(0).getRelationshipId());
        }

        @Test
        @DisplayName("Entities only reachable through an excluded entity should be dropped")
        void cutOffByExclusion() {
            InMemoryGraphStore store = new InMemoryGraphStore();
            store.putEntity(entity("A", EntityType.INDIVIDUAL, 0.2));
            store.putEntity(entity("B", EntityType.ORGANIZATION, 0.2));
            store.putEntity(entity("C", EntityType.INDIVIDUAL, 0.2));
            store.putEntity(entity("D", EntityType.INDIVIDUAL, 0.2));
            store.putRelationship(edge("R1", "A", "B"));
            store.putRelationship(edge("R2", "B", "C"));
            store.putRelationship(edge("R3", "B", "D"));
            store.putRelationship(edge("R4", "C", "D"));

            NetworkGraph graph = build(store, NetworkQuery.builder("A")
                    .maxDepth(3)
                    .excludeEntityTypes(Set.of(EntityType.ORGANIZATION))
                    .build());

            assertEquals(Set.of("A"), graph.getNodeIds());
            assertEquals(0, graph.getTotalRelationships());
        }

        @Test
        @DisplayName("Depth should be the hop distance over the relationships that remain")
        void depthAfterExclusion() {
            InMemoryGraphStore store = new InMemoryGraphStore();
            store.putEntity(entity("A", EntityType.INDIVIDUAL, 0.2));
            store.putEntity(entity("B", EntityType.ORGANIZATION, 0.2));
            store.putEntity(entity("C", EntityType.INDIVIDUAL, 0.2));
            store.putEntity(entity("X", EntityType.INDIVIDUAL, 0.2));
            store.putEntity(entity("Y", EntityType.INDIVIDUAL, 0.2));
            store.putRelationship(edge("R1", "A", "B"));
            store.putRelationship(edge("R2", "B", "C"));
            store.putRelationship(edge("R3", "A", "X"));
            store.putRelationship(edge("R4", "X", "Y"));
            store.putRelationship(edge("R5", "Y", "C"));

            NetworkGraph graph = build(store, NetworkQuery.builder("A")
                    .maxDepth(3)
                    .excludeEntityTypes(Set.of(EntityType.ORGANIZATION))
                    .build());

            // C was first reached through B at hop 2; without B it is 3 hops out
            assertEquals(Set.of("A", "X", "Y", "C"), graph.getNodeIds());
            assertEquals(3, graph.getNode("C").orElseThrow().getDepth());
        }

        @Test
        @DisplayName("Include filters should keep only the listed types")
        void entityTypeInclusion() {
            InMemoryGraphStore store = new InMemoryGraphStore();
            store.putEntity(entity("A", EntityType.ORGANIZATION, 0.2));
            store.putEntity(entity("P", EntityType.INDIVIDUAL, 0.2));
            store.putEntity(entity("O", EntityType.ORGANIZATION, 0.2));
            store.putRelationship(edge("R1", "A", "P"));
            store.putRelationship(edge("R2", "A", "O"));

            NetworkGraph graph = build(store, NetworkQuery.builder("A")
                    .includeEntityTypes(Set.of(EntityType.ORGANIZATION))
                    .build());

            assertEquals(Set.of("A", "O"), graph.getNodeIds());
        }
    }

    @Nested
    @DisplayName("Limits")
    class LimitTests {

        @Test
        @DisplayName("Entity cap should drop the farthest entities first")
        void entityCap() {
            NetworkGraph graph = build(star(15), NetworkQuery.builder("HUB").maxEntities(10).build());

            assertEquals(10, graph.getTotalEntities());
            assertTrue(graph.getNodes().stream().allMatch(n -> n.getDepth() <= 1));
            assertTrue(graph.getEdges().stream().allMatch(
                    e -> graph.containsNode(e.getSourceId()) && graph.containsNode(e.getTargetId())));
        }

        @Test
        @DisplayName("Relationship cap should truncate in traversal order")
        void relationshipCap() {
            NetworkGraph graph = build(star(25), NetworkQuery.builder("HUB").maxRelationships(20).build());

            assertEquals(20, graph.getTotalRelationships());
            assertTrue(graph.getEdges().stream().allMatch(e -> e.getRelationshipId().startsWith("L")));
            assertEquals(21, graph.getTotalEntities());
        }

        @Test
        @DisplayName("Out-of-range parameters should be rejected")
        void invalidParameters() {
            assertAll(
                    () -> assertThrows(InvalidRequestException.class,
                            () -> NetworkQuery.builder("A").maxDepth(0).build()),
                    () -> assertThrows(InvalidRequestException.class,
                            () -> NetworkQuery.builder("A").maxDepth(6).build()),
                    () -> assertThrows(InvalidRequestException.class,
                            () -> NetworkQuery.builder("A").maxEntities(5).build()),
                    () -> assertThrows(InvalidRequestException.class,
                            () -> NetworkQuery.builder("A").maxRelationships(5000).build()),
                    () -> assertThrows(InvalidRequestException.class,
                            () -> NetworkQuery.builder("A").minConfidence(1.5).build()),
                    () -> assertThrows(InvalidRequestException.class,
                            () -> NetworkQuery.builder(" ").build())
            );
        }
    }

    /**
     * Eight entities of both types with parallel routes, a cycle and two weak links.
     */
    private static InMemoryGraphStore mixed() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        store.putEntity(entity("A", EntityType.INDIVIDUAL, 0.3));
        store.putEntity(entity("B", EntityType.ORGANIZATION, 0.6));
        store.putEntity(entity("C", EntityType.INDIVIDUAL, 0.2));
        store.putEntity(entity("D", EntityType.INDIVIDUAL, 0.1));
        store.putEntity(entity("E", EntityType.ORGANIZATION, 0.8));
        store.putEntity(entity("F", EntityType.INDIVIDUAL, 0.4));
        store.putEntity(entity("G", EntityType.ORGANIZATION, 0.5));
        store.putEntity(entity("H", EntityType.INDIVIDUAL, 0.2));
        store.putRelationship(edge("R01", "A", "B", RelationshipType.DIRECTOR_OF, 0.9));
        store.putRelationship(edge("R02", "B", "C", RelationshipType.SHAREHOLDER_OF, 0.9));
        store.putRelationship(edge("R03", "B", "D", RelationshipType.SHAREHOLDER_OF, 0.6));
        store.putRelationship(edge("R04", "C", "D", RelationshipType.FAMILY_MEMBER, 0.9));
        store.putRelationship(edge("R05", "A", "E", RelationshipType.UBO_OF, 0.9));
        store.putRelationship(edge("R06", "E", "F", RelationshipType.DIRECTOR_OF, 0.9));
        store.putRelationship(edge("R07", "F", "G", RelationshipType.BUSINESS_ASSOCIATE, 0.6));
        store.putRelationship(edge("R08", "G", "H", RelationshipType.DIRECTOR_OF, 0.9));
        store.putRelationship(edge("R09", "C", "H", RelationshipType.FAMILY_MEMBER, 0.9));
        store.putRelationship(edge("R10", "D", "F", RelationshipType.BUSINESS_ASSOCIATE, 0.9));
        return store;
    }

    static Stream<Arguments> builds() {
        Supplier<InMemoryGraphStore> mixed = NetworkBuilderTest::mixed;
        return Stream.of(
                Arguments.of("defaults", mixed, NetworkQuery.builder("A").build()),
                Arguments.of("depth 3", mixed, NetworkQuery.builder("A").maxDepth(3).build()),
                Arguments.of("depth 5", mixed, NetworkQuery.builder("A").maxDepth(5).build()),
                Arguments.of("exclude organizations", mixed, NetworkQuery.builder("A").maxDepth(3)
                        .excludeEntityTypes(Set.of(EntityType.ORGANIZATION)).build()),
                Arguments.of("include individuals", mixed, NetworkQuery.builder("A").maxDepth(4)
                        .includeEntityTypes(Set.of(EntityType.INDIVIDUAL)).build()),
                Arguments.of("exclude individuals", mixed, NetworkQuery.builder("E").maxDepth(4)
                        .excludeEntityTypes(Set.of(EntityType.INDIVIDUAL)).build()),
                Arguments.of("confidence floor", mixed, NetworkQuery.builder("A").maxDepth(4)
                        .minConfidence(0.8).build()),
                Arguments.of("floor and exclusion", mixed, NetworkQuery.builder("H").maxDepth(5)
                        .minConfidence(0.8).excludeEntityTypes(Set.of(EntityType.ORGANIZATION)).build()),
                Arguments.of("entity cap", (Supplier<InMemoryGraphStore>) () -> star(15),
                        NetworkQuery.builder("HUB").maxEntities(10).build()),
                Arguments.of("relationship cap", (Supplier<InMemoryGraphStore>) () -> star(25),
                        NetworkQuery.builder("HUB").maxRelationships(20).build()),
                Arguments.of("both caps", (Supplier<InMemoryGraphStore>) () -> star(30),
                        NetworkQuery.builder("HUB").maxDepth(3).maxEntities(25).maxRelationships(40).build())
        );
    }

    /**
     * Hop distance from the center over the graph's own edges.
     */
    private static Map<String, Integer> distancesFromCenter(NetworkGraph graph) {
        Map<String, Integer> distances = new HashMap<>();
        distances.put(graph.getCenterEntityId(), 0);
        Deque<String> queue = new ArrayDeque<>(List.of(graph.getCenterEntityId()));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (RelationshipEdge edge : graph.connectionsOf(current)) {
                String neighbor = edge.otherEnd(current);
                if (!distances.containsKey(neighbor)) {
                    distances.put(neighbor, distances.get(current) + 1);
                    queue.add(neighbor);
                }
            }
        }
        return distances;
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("builds")
    @DisplayName("Nodes should be exactly the edge endpoints plus the center")
    void nodesMatchEdgeEndpoints(String name, Supplier<InMemoryGraphStore> store, NetworkQuery query) {
        NetworkGraph graph = build(store.get(), query);

        Set<String> expected = new HashSet<>();
        expected.add(query.getCenterEntityId());
        for (RelationshipEdge edge : graph.getEdges()) {
            expected.add(edge.getSourceId());
            expected.add(edge.getTargetId());
        }
        assertEquals(expected, graph.getNodeIds());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("builds")
    @DisplayName("Every node should be reachable within maxDepth hops over the kept relationships")
    void nodesWithinMaxDepth(String name, Supplier<InMemoryGraphStore> store, NetworkQuery query) {
        NetworkGraph graph = build(store.get(), query);
        Map<String, Integer> distances = distancesFromCenter(graph);

        for (EntityNode node : graph.getNodes()) {
            Integer distance = distances.get(node.getId());
            assertNotNull(distance, () -> node.getId() + " is not reachable from the center");
            assertTrue(distance <= query.getMaxDepth(), () -> node.getId() + " is " + distance + " hops out");
            assertEquals(distance.intValue(), node.getDepth(), () -> "depth of " + node.getId());
        }
        assertTrue(graph.getTotalEntities() <= query.getMaxEntities());
        assertTrue(graph.getTotalRelationships() <= query.getMaxRelationships());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("builds")
    @DisplayName("Repeated builds should give identical nodes and relationships")
    void deterministic(String name, Supplier<InMemoryGraphStore> store, NetworkQuery query) {
        InMemoryGraphStore source = store.get();
        NetworkGraph first = build(source, query);
        NetworkGraph second = build(source, query);
        NetworkGraph rebuilt = build(store.get(), query);

        List<String> firstEdges = first.getEdges().stream().map(RelationshipEdge::getRelationshipId).toList();
        List<String> firstNodes = first.getNodes().stream().map(EntityNode::getId).toList();
        assertAll(
                () -> assertEquals(firstNodes, second.getNodes().stream().map(EntityNode::getId).toList()),
                () -> assertEquals(firstEdges, second.getEdges().stream()
                        .map(RelationshipEdge::getRelationshipId).toList()),
                () -> assertEquals(firstNodes, rebuilt.getNodes().stream().map(EntityNode::getId).toList()),
                () -> assertEquals(firstEdges, rebuilt.getEdges().stream()
                        .map(RelationshipEdge::getRelationshipId).toList())
        );
    }

    @Test
    @DisplayName("Store failures should produce a failed result and a failure metric")
    void storeFailure() {
        GraphStore store = mock(GraphStore.class);
        when(store.boundedTraversal(anyString(), anyInt(), any()))
                .thenThrow(new GraphStoreException("boundedTraversal", "connection reset"));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        NetworkBuildResult result = new NetworkBuilder(store, new MicrometerMetricsService(registry))
                .build(NetworkQuery.builder("A").build());

        assertAll(
                () -> assertTrue(result.isFailed()),
                () -> assertTrue(result.error().contains("connection reset")),
                () -> assertEquals("A", result.graph().getCenterEntityId()),
                () -> assertEquals(0, result.graph().getTotalRelationships()),
                () -> assertEquals(1.0, registry.find("network.store.failure")
                        .tag("operation", "boundedTraversal").counter().count()),
                () -> assertEquals(1, registry.find("network.build.duration").timer().count())
        );
    }
}

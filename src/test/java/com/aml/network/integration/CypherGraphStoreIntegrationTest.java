package com.aml.network.integration;

import com.aml.network.api.NetworkAnalysisRequest;
import com.aml.network.api.NetworkAnalysisResult;
import com.aml.network.api.NetworkAnalyzer;
import com.aml.network.core.model.EntitySummary;
import com.aml.network.core.model.EntityType;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.RelationshipType;
import com.aml.network.core.model.TraversalHop;
import com.aml.network.graph.CypherGraphStore;
import com.aml.network.graph.FalkorDBConnection;
import com.aml.network.graph.TraversalFilter;
import com.aml.network.network.NetworkQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static com.aml.network.GraphFixtures.edge;
import static com.aml.network.GraphFixtures.entity;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Traversal and analysis against a live FalkorDB instance.
 */
@Tag("integration")
class CypherGraphStoreIntegrationTest extends AbstractFalkorDBIntegrationTest {

    private FalkorDBConnection connection;
    private CypherGraphStore store;

    @BeforeEach
    void setUp() {
        connection = openConnection("network");
        store = new CypherGraphStore(connection);
        // owner -> shell company -> account holder, plus a dormant link and a loop
        seed(store,
                List.of(entity("OWN", EntityType.INDIVIDUAL, 0.9),
                        entity("SHELL", 0.6),
                        entity("ACC", EntityType.INDIVIDUAL, 0.2),
                        entity("OLD", 0.1)),
                List.of(edge("R1", "OWN", "SHELL", RelationshipType.UBO_OF, 0.95),
                        edge("R2", "SHELL", "ACC", RelationshipType.BUSINESS_ASSOCIATE, 0.8),
                        edge("R3", "ACC", "OWN", RelationshipType.FAMILY_MEMBER, 0.7),
                        RelationshipEdge.builder()
                                .relationshipId("R4")
                                .sourceId("OLD")
                                .targetId("OWN")
                                .type(RelationshipType.DIRECTOR_OF)
                                .confidence(0.9)
                                .active(false)
                                .build()));
    }

    @AfterEach
    void tearDown() {
        if (connection != null) {
            connection.close();
        }
    }

    @Test
    @DisplayName("Traversal should follow edges in both directions and skip inactive ones")
    void traversal() {
        List<TraversalHop> hops = store.boundedTraversal("OWN", 2, TraversalFilter.activeOnly());

        assertEquals(List.of("R1", "R3"), hops.stream()
                .filter(hop -> hop.depth() == 1)
                .map(hop -> hop.edge().getRelationshipId())
                .toList());
        assertEquals(List.of("R2"), hops.stream()
                .filter(hop -> hop.depth() == 2)
                .map(hop -> hop.edge().getRelationshipId())
                .toList());
    }

    @Test
    @DisplayName("Lookup should map stored properties and omit unknown ids")
    void lookup() {
        Map<String, EntitySummary> found = store.batchLookupEntities(List.of("OWN", "SHELL", "MISSING"));

        assertEquals(2, found.size());
        assertEquals(EntityType.INDIVIDUAL, found.get("OWN").type());
        assertEquals(0.9, found.get("OWN").riskScore(), 1e-9);
        assertEquals("Entity SHELL", found.get("SHELL").name());
    }

    @Test
    @DisplayName("Full analysis should detect the ownership loop")
    void fullAnalysis() {
        try (NetworkAnalyzer analyzer = NetworkAnalyzer.builder().graphStore(store).build()) {
            NetworkAnalysisResult result = analyzer.analyze(NetworkAnalysisRequest.builder(
                            NetworkQuery.builder("OWN").maxDepth(3).build())
                    .pathTarget("ACC")
                    .build());

            assertFalse(result.hasErrors(), () -> "errors: " + result.getErrors());
            assertEquals(3, result.getGraph().getTotalEntities());
            assertEquals(1, result.getCycles().size());
            assertEquals(1, result.getPath().orElseThrow().hopCount());
            assertEquals(OptionalInt.of(1), analyzer.degreesOfSeparation("SHELL", "ACC"));
        }
    }
}

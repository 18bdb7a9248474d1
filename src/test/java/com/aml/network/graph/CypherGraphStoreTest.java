package com.aml.network.graph;

import com.aml.network.core.model.EntitySummary;
import com.aml.network.core.model.EntityType;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.RelationshipStrength;
import com.aml.network.core.model.RelationshipType;
import com.aml.network.core.model.RiskLevel;
import com.aml.network.core.model.TraversalHop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CypherGraphStore")
class CypherGraphStoreTest {

    @Mock
    private GraphConnection connection;

    private CypherGraphStore store;

    @BeforeEach
    void setUp() {
        store = new CypherGraphStore(connection);
    }

    private static Map<String, Object> row(String id, String source, String target, String type, Object confidence) {
        Map<String, Object> row = new HashMap<>();
        row.put("relationshipId", id);
        row.put("sourceId", source);
        row.put("targetId", target);
        row.put("type", type);
        row.put("confidence", confidence);
        row.put("active", true);
        return row;
    }

    @Test
    @DisplayName("Should expand one frontier query per hop level")
    void perHopQueries() {
        when(connection.query(contains("$frontier"), anyMap()))
                .thenReturn(List.of(row("R1", "A", "B", "director_of", 0.9)))
                .thenReturn(List.of(row("R1", "A", "B", "director_of", 0.9),
                        row("R2", "B", "C", "ubo_of", 0.8)));

        List<TraversalHop> hops = store.boundedTraversal("A", 2, TraversalFilter.activeOnly());

        assertEquals(List.of("R1", "R2"), hops.stream().map(h -> h.edge().getRelationshipId()).toList());
        assertEquals(RelationshipType.UBO_OF, hops.get(1).edge().getType());
        assertEquals(2, hops.get(1).depth());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(connection, times(2)).query(anyString(), params.capture());
        assertEquals(List.of("A"), params.getAllValues().get(0).get("frontier"));
        assertEquals(List.of("B"), params.getAllValues().get(1).get("frontier"));
    }

    @Test
    @DisplayName("Rows with missing values should receive defaults")
    void rowDefaults() {
        when(connection.query(contains("$frontier"), anyMap()))
                .thenReturn(List.of(row("R1", "A", "B", null, null)))
                .thenReturn(List.of());

        TraversalHop hop = store.boundedTraversal("A", 2, TraversalFilter.activeOnly()).get(0);

        assertEquals(RelationshipType.UNKNOWN, hop.edge().getType());
        assertEquals(0.5, hop.edge().getConfidence());
    }

    @Test
    @DisplayName("Connection failures should surface as GraphStoreException")
    void wrapsFailures() {
        when(connection.query(anyString(), anyMap())).thenThrow(new RuntimeException("connection refused"));

        GraphStoreException e = assertThrows(GraphStoreException.class,
                () -> store.boundedTraversal("A", 1, TraversalFilter.activeOnly()));
        assertEquals("boundedTraversal", e.getOperation());
        assertThrows(GraphStoreException.class, () -> store.batchLookupEntities(List.of("A")));
    }

    @Test
    @DisplayName("Entity lookup should map rows and default missing risk")
    void entityLookup() {
        Map<String, Object> known = new HashMap<>();
        known.put("id", "A");
        known.put("name", "Acme");
        known.put("entityType", "company");
        known.put("riskScore", 0.65);
        known.put("riskLevel", "high");
        Map<String, Object> sparse = new HashMap<>();
        sparse.put("id", "B");
        when(connection.query(contains("$ids"), anyMap())).thenReturn(List.of(known, sparse));

        Map<String, EntitySummary> found = store.batchLookupEntities(List.of("A", "B"));

        assertAll(
                () -> assertEquals(EntityType.ORGANIZATION, found.get("A").type()),
                () -> assertEquals(RiskLevel.HIGH, found.get("A").riskLevel()),
                () -> assertEquals(EntitySummary.UNKNOWN_NAME, found.get("B").name()),
                () -> assertEquals(0.0, found.get("B").riskScore()),
                () -> assertEquals(RiskLevel.LOW, found.get("B").riskLevel())
        );
    }

    @Test
    @DisplayName("Relationship strength should be written in lower case regardless of the default locale")
    void strengthIsLocaleIndependent() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            store.createRelationship(RelationshipEdge.builder()
                    .relationshipId("R1")
                    .sourceId("A")
                    .targetId("B")
                    .type(RelationshipType.DIRECTOR_OF)
                    .strength(RelationshipStrength.LIKELY)
                    .confidence(0.8)
                    .build());
        } finally {
            Locale.setDefault(original);
        }

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(connection).execute(contains("CREATE (s)-[r:RELATED"), params.capture());
        assertEquals("likely", params.getValue().get("strength"));
        assertEquals("director_of", params.getValue().get("type"));
    }

    @Test
    @DisplayName("Empty lookups should not query the database")
    void emptyLookup() {
        assertTrue(store.batchLookupEntities(List.of()).isEmpty());
        verifyNoInteractions(connection);
    }
}

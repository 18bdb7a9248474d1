package com.aml.network.analysis;

import com.aml.network.core.model.Community;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.RelationshipType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.aml.network.GraphFixtures.edge;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CommunityDetector Tests")
class CommunityDetectorTest {

    private static final List<String> MEMBERS = List.of("P", "Q", "R", "S", "T", "U");
    private static final List<RelationshipEdge> TRIANGLES = List.of(
            edge("T1", "P", "Q"), edge("T2", "Q", "R"), edge("T3", "R", "P"),
            edge("T4", "S", "T"), edge("T5", "T", "U"), edge("T6", "U", "S"));

    private final CommunityDetector detector = new CommunityDetector();

    @Test
    @DisplayName("Two disjoint triangles should form two dense communities")
    void twoTriangles() {
        List<Community> communities = detector.detect(MEMBERS, TRIANGLES);

        assertEquals(2, communities.size());
        Community first = communities.get(0);
        assertAll(
                () -> assertEquals("community_0", first.id()),
                () -> assertEquals(List.of("P", "Q", "R"), first.memberIds()),
                () -> assertEquals(3, first.internalEdgeCount()),
                () -> assertEquals(1.0, first.density(), 1e-9),
                () -> assertEquals(0.9, first.averageConfidence(), 1e-9),
                () -> assertEquals("community_1", communities.get(1).id()),
                () -> assertTrue(communities.get(1).contains("T"))
        );
    }

    @Test
    @DisplayName("Weak links should not merge communities")
    void weakBridge() {
        List<RelationshipEdge> edges = new java.util.ArrayList<>(TRIANGLES);
        edges.add(edge("W1", "R", "S", RelationshipType.ASSOCIATED_WITH, 0.5));

        assertEquals(2, detector.detect(MEMBERS, edges).size());
    }

    @Test
    @DisplayName("Components below the minimum size should be dropped")
    void minimumSize() {
        assertTrue(detector.detect(MEMBERS, TRIANGLES, 4, 1.0).isEmpty());
    }

    @Test
    @DisplayName("Higher resolution should raise the confidence floor")
    void resolution() {
        List<Community> singletons = detector.detect(MEMBERS, TRIANGLES, 1, 1.5);

        assertEquals(6, singletons.size());
        assertTrue(singletons.stream().allMatch(c -> c.size() == 1 && c.density() == 0.0));
    }

    @Test
    @DisplayName("Invalid parameters should be rejected")
    void invalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> detector.detect(MEMBERS, TRIANGLES, 0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> detector.detect(MEMBERS, TRIANGLES, 3, 0.0));
    }
}

package com.aml.network.api;

import com.aml.network.analysis.HubQuery;
import com.aml.network.analysis.PropagationQuery;
import com.aml.network.core.InvalidRequestException;
import com.aml.network.core.model.RelationshipType;
import com.aml.network.network.NetworkQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NetworkAnalysisRequest")
class NetworkAnalysisRequestTest {

    @Test
    @DisplayName("Defaults should enable every analysis")
    void defaults() {
        NetworkAnalysisRequest request = NetworkAnalysisRequest.forCenter("E1");

        assertAll(
                () -> assertEquals("E1", request.getCenterEntityId()),
                () -> assertEquals(NetworkQuery.DEFAULT_MAX_DEPTH, request.getNetworkQuery().getMaxDepth()),
                () -> assertTrue(request.isIncludeCentrality()),
                () -> assertFalse(request.isIncludeAdvancedCentrality()),
                () -> assertTrue(request.isIncludeCommunities()),
                () -> assertTrue(request.isIncludeHubs()),
                () -> assertTrue(request.isIncludeRiskPropagation()),
                () -> assertTrue(request.isIncludeCycles()),
                () -> assertNull(request.getPathTarget()),
                () -> assertEquals(LayoutAlgorithm.FORCE, request.getLayout()),
                () -> assertEquals(NetworkAnalysisRequest.DEFAULT_TIMEOUT, request.getTimeout())
        );
    }

    @Test
    @DisplayName("Equality should ignore the timeout and respect every other parameter")
    void equality() {
        NetworkAnalysisRequest base = NetworkAnalysisRequest.forCenter("E1");
        NetworkAnalysisRequest shorter = NetworkAnalysisRequest.builder(NetworkQuery.builder("E1").build())
                .timeout(Duration.ofSeconds(2))
                .build();
        NetworkAnalysisRequest withTarget = NetworkAnalysisRequest.builder(NetworkQuery.builder("E1").build())
                .pathTarget("E9")
                .build();

        assertEquals(base, shorter);
        assertEquals(base.hashCode(), shorter.hashCode());
        assertNotEquals(base, withTarget);
    }

    @Test
    @DisplayName("Derived queries should carry the request parameters")
    void derivedQueries() {
        NetworkAnalysisRequest request = NetworkAnalysisRequest.builder(NetworkQuery.builder("E1")
                        .relationshipTypes(Set.of(RelationshipType.UBO_OF))
                        .build())
                .propagationDepth(2)
                .propagationFactor(0.3)
                .minPropagatedScore(0.02)
                .hubMinConnections(3)
                .build();

        PropagationQuery propagation = request.toPropagationQuery();
        HubQuery hubs = request.toHubQuery(List.of("E1", "E2"));

        assertAll(
                () -> assertEquals("E1", propagation.sourceEntityId()),
                () -> assertEquals(2, propagation.maxDepth()),
                () -> assertEquals(0.3, propagation.propagationFactor()),
                () -> assertEquals(0.02, propagation.minPropagatedScore()),
                () -> assertEquals(Set.of(RelationshipType.UBO_OF), propagation.relationshipTypes()),
                () -> assertEquals(3, hubs.minConnections()),
                () -> assertEquals(List.of("E1", "E2"), hubs.candidateIds()),
                () -> assertTrue(hubs.includeRiskAnalysis())
        );
    }

    @Test
    @DisplayName("Invalid parameters should be rejected")
    void validation() {
        NetworkQuery query = NetworkQuery.builder("E1").build();
        assertAll(
                () -> assertThrows(InvalidRequestException.class,
                        () -> NetworkAnalysisRequest.builder(query).minCommunitySize(0).build()),
                () -> assertThrows(InvalidRequestException.class,
                        () -> NetworkAnalysisRequest.builder(query).communityResolution(0.0).build()),
                () -> assertThrows(InvalidRequestException.class,
                        () -> NetworkAnalysisRequest.builder(query).hubMinConnections(0).build()),
                () -> assertThrows(InvalidRequestException.class,
                        () -> NetworkAnalysisRequest.builder(query).propagationDepth(6).build()),
                () -> assertThrows(InvalidRequestException.class,
                        () -> NetworkAnalysisRequest.builder(query).propagationFactor(1.2).build()),
                () -> assertThrows(InvalidRequestException.class,
                        () -> NetworkAnalysisRequest.builder(query).pathTarget("\n").build()),
                () -> assertThrows(InvalidRequestException.class,
                        () -> NetworkAnalysisRequest.builder(query).timeout(Duration.ZERO).build()),
                () -> assertThrows(NullPointerException.class, () -> NetworkAnalysisRequest.builder(null))
        );
    }
}

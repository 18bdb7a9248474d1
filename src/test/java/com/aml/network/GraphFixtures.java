package com.aml.network;

import com.aml.network.core.model.EntitySummary;
import com.aml.network.core.model.EntityType;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.RelationshipType;
import com.aml.network.core.model.RiskLevel;
import com.aml.network.graph.InMemoryGraphStore;

/**
 * Shared graphs for tests.
 */
public final class GraphFixtures {

    private GraphFixtures() {
    }

    public static RelationshipEdge edge(String id, String source, String target,
                                        RelationshipType type, double confidence) {
        return RelationshipEdge.builder()
                .relationshipId(id)
                .sourceId(source)
                .targetId(target)
                .type(type)
                .confidence(confidence)
                .build();
    }

    public static RelationshipEdge edge(String id, String source, String target) {
        return edge(id, source, target, RelationshipType.BUSINESS_ASSOCIATE, 0.9);
    }

    public static EntitySummary entity(String id, double riskScore) {
        return new EntitySummary(id, "Entity " + id, EntityType.ORGANIZATION, riskScore, null);
    }

    public static EntitySummary entity(String id, EntityType type, double riskScore) {
        return new EntitySummary(id, "Entity " + id, type, riskScore, null);
    }

    /**
     * A - B - C, director_of, confidence 0.9, risk(A) = 0.8.
     */
    public static InMemoryGraphStore chain() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        store.putEntity(entity("A", 0.8));
        store.putEntity(entity("B", 0.2));
        store.putEntity(entity("C", 0.1));
        store.putRelationship(edge("R1", "A", "B", RelationshipType.DIRECTOR_OF, 0.9));
        store.putRelationship(edge("R2", "B", "C", RelationshipType.DIRECTOR_OF, 0.9));
        return store;
    }

    /**
     * Five entities; X has six active relationships, every other entity at most two.
     */
    public static InMemoryGraphStore hub() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        store.putEntity(entity("X", 0.5));
        for (String id : new String[]{"A", "B", "C", "D"}) {
            store.putEntity(entity(id, 0.1));
        }
        store.putRelationship(edge("H1", "X", "A", RelationshipType.BUSINESS_ASSOCIATE, 0.9));
        store.putRelationship(edge("H2", "A", "X", RelationshipType.SHARED_ADDRESS, 0.7));
        store.putRelationship(edge("H3", "X", "B", RelationshipType.DIRECTOR_OF, 0.8));
        store.putRelationship(edge("H4", "B", "X", RelationshipType.SHAREHOLDER_OF, 0.6));
        store.putRelationship(edge("H5", "X", "C", RelationshipType.BUSINESS_ASSOCIATE, 0.9));
        store.putRelationship(edge("H6", "X", "D", RelationshipType.BUSINESS_ASSOCIATE, 0.9));
        return store;
    }

    /**
     * Two disjoint high-confidence triangles P-Q-R and S-T-U.
     */
    public static InMemoryGraphStore twoTriangles() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        for (String id : new String[]{"P", "Q", "R", "S", "T", "U"}) {
            store.putEntity(entity(id, 0.3));
        }
        store.putRelationship(edge("T1", "P", "Q"));
        store.putRelationship(edge("T2", "Q", "R"));
        store.putRelationship(edge("T3", "R", "P"));
        store.putRelationship(edge("T4", "S", "T"));
        store.putRelationship(edge("T5", "T", "U"));
        store.putRelationship(edge("T6", "U", "S"));
        return store;
    }

    public static EntitySummary highRisk(String id) {
        return new EntitySummary(id, "Entity " + id, EntityType.INDIVIDUAL, 0.7, RiskLevel.HIGH);
    }
}

package com.aml.network.graph;

import com.aml.network.core.model.EntitySummary;
import com.aml.network.core.model.EntityType;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.RelationshipStrength;
import com.aml.network.core.model.RelationshipType;
import com.aml.network.core.model.RiskLevel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Loads an entity/relationship snapshot from JSON into an {@link InMemoryGraphStore}.
 *
 * <p>Expected format:</p>
 * <pre>
 * {
 *   "entities": [
 *     {"id": "E1", "name": "Acme Ltd", "entityType": "organization", "riskScore": 0.72, "riskLevel": "high"}
 *   ],
 *   "relationships": [
 *     {"id": "R1", "source": "E1", "target": "E2", "type": "director_of",
 *      "strength": "confirmed", "confidence": 0.9, "verified": true, "active": true}
 *   ]
 * }
 * </pre>
 *
 * <p>Missing optional fields receive the documented defaults (name "Unknown", type
 * unknown, risk 0.0, confidence 0.5, strength possible, active true, verified false).
 * Records without an id or endpoints are skipped with a warning.</p>
 */
public class JsonGraphLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonGraphLoader.class);

    private final ObjectMapper objectMapper;

    public JsonGraphLoader() {
        this(new ObjectMapper());
    }

    public JsonGraphLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads a snapshot into a new store.
     *
     * @throws UncheckedIOException if the input is not readable JSON
     */
    public InMemoryGraphStore load(InputStream input) {
        InMemoryGraphStore store = new InMemoryGraphStore();
        loadInto(store, input);
        return store;
    }

    /**
     * Reads a snapshot into an existing store.
     *
     * @return the number of relationships loaded
     */
    public int loadInto(InMemoryGraphStore store, InputStream input) {
        JsonNode root;
        try {
            root = objectMapper.readTree(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read graph snapshot", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Graph snapshot must be a JSON object");
        }

        int entities = 0;
        for (JsonNode node : root.path("entities")) {
            EntitySummary entity = toEntity(node);
            if (entity != null) {
                store.putEntity(entity);
                entities++;
            }
        }

        int relationships = 0;
        for (JsonNode node : root.path("relationships")) {
            RelationshipEdge edge = toEdge(node);
            if (edge != null) {
                store.putRelationship(edge);
                relationships++;
            }
        }
        log.info("Loaded graph snapshot: {} entities, {} relationships", entities, relationships);
        return relationships;
    }

    private EntitySummary toEntity(JsonNode node) {
        String id = text(node, "id");
        if (id == null) {
            log.warn("Skipping entity without id: {}", node);
            return null;
        }
        if (!node.hasNonNull("riskScore")) {
            log.debug("Entity {} has no riskScore, defaulting to 0.0", id);
        }
        double riskScore = node.path("riskScore").asDouble(0.0);
        return new EntitySummary(
                id,
                text(node, "name"),
                EntityType.fromValue(text(node, "entityType")),
                riskScore,
                RiskLevel.fromValue(text(node, "riskLevel"), RiskLevel.fromScore(riskScore)));
    }

    private RelationshipEdge toEdge(JsonNode node) {
        String id = text(node, "id");
        String source = text(node, "source");
        String target = text(node, "target");
        if (id == null || source == null || target == null) {
            log.warn("Skipping relationship without id or endpoints: {}", node);
            return null;
        }
        return RelationshipEdge.builder()
                .relationshipId(id)
                .sourceId(source)
                .targetId(target)
                .type(RelationshipType.fromValue(text(node, "type")))
                .strength(RelationshipStrength.fromValue(text(node, "strength")))
                .confidence(node.hasNonNull("confidence") ? node.get("confidence").asDouble() : null)
                .verified(node.path("verified").asBoolean(false))
                .active(node.path("active").asBoolean(true))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}

package com.aml.network.graph;

import com.aml.network.core.model.EntitySummary;
import com.aml.network.core.model.EntityType;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.RelationshipStrength;
import com.aml.network.core.model.RelationshipType;
import com.aml.network.core.model.RiskLevel;
import com.aml.network.core.model.TraversalHop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link GraphStore} over a Cypher graph database.
 *
 * <p>Entities are {@code (:Entity {id, name, entityType, riskScore, riskLevel})} nodes and
 * relationships are {@code [:RELATED {id, type, strength, confidence, verified, active}]}
 * edges. A bounded traversal issues one query per hop level for the whole frontier and
 * applies the filter to the returned rows, so expansion order matches
 * {@link InMemoryGraphStore}.</p>
 */
public class CypherGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(CypherGraphStore.class);

    private static final String FRONTIER_QUERY = """
            MATCH (s:Entity)-[r:RELATED]->(t:Entity)
            WHERE s.id IN $frontier OR t.id IN $frontier
            RETURN r.id as relationshipId, s.id as sourceId, t.id as targetId,
                   r.type as type, r.strength as strength, r.confidence as confidence,
                   r.verified as verified, r.active as active
            """;

    private static final String ENTITY_LOOKUP_QUERY = """
            MATCH (e:Entity)
            WHERE e.id IN $ids
            RETURN e.id as id, e.name as name, e.entityType as entityType,
                   e.riskScore as riskScore, e.riskLevel as riskLevel
            """;

    private final GraphConnection connection;

    public CypherGraphStore(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public List<TraversalHop> boundedTraversal(String centerId, int maxDepth, TraversalFilter filter) {
        InputSanitizer.validateEntityId("centerId", centerId);
        List<TraversalHop> hops = new ArrayList<>();
        Set<String> seenRelationships = new HashSet<>();
        Set<String> reached = new HashSet<>(Set.of(centerId));
        Set<String> frontier = new TreeSet<>(Set.of(centerId));

        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            List<RelationshipEdge> levelEdges = queryFrontier(frontier);
            Set<String> next = new TreeSet<>();
            for (String entityId : frontier) {
                List<RelationshipEdge> incident = levelEdges.stream()
                        .filter(edge -> edge.connects(entityId))
                        .sorted(Comparator.comparing(RelationshipEdge::getRelationshipId))
                        .toList();
                for (RelationshipEdge edge : incident) {
                    if (!filter.matches(edge) || !seenRelationships.add(edge.getRelationshipId())) {
                        continue;
                    }
                    hops.add(new TraversalHop(edge, depth));
                    String other = edge.otherEnd(entityId);
                    if (reached.add(other)) {
                        next.add(other);
                    }
                }
            }
            log.debug("Hop {} from {}: frontier={}, edges={}", depth, centerId, frontier.size(), levelEdges.size());
            frontier = next;
        }
        return hops;
    }

    @Override
    public Map<String, EntitySummary> batchLookupEntities(Collection<String> ids) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        List<Map<String, Object>> rows;
        try {
            rows = connection.query(ENTITY_LOOKUP_QUERY, Map.of("ids", List.copyOf(ids)));
        } catch (RuntimeException e) {
            throw new GraphStoreException("batchLookupEntities",
                    "Entity lookup failed for " + ids.size() + " ids: " + e.getMessage(), e);
        }
        Map<String, EntitySummary> result = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            EntitySummary summary = mapToEntity(row);
            if (summary != null) {
                result.put(summary.id(), summary);
            }
        }
        return result;
    }

    /**
     * Writes an entity node. Used to seed graphs for tests and demos.
     */
    public void createEntity(EntitySummary entity) {
        InputSanitizer.validateEntityId("entityId", entity.id());
        String query = """
                CREATE (e:Entity {
                    id: $id,
                    name: $name,
                    entityType: $entityType,
                    riskScore: $riskScore,
                    riskLevel: $riskLevel
                })
                """;
        connection.execute(query, Map.of(
                "id", entity.id(),
                "name", entity.name(),
                "entityType", entity.type().getLabel(),
                "riskScore", entity.riskScore(),
                "riskLevel", entity.riskLevel().getLabel()
        ));
    }

    /**
     * Writes a relationship between two existing entity nodes.
     */
    public void createRelationship(RelationshipEdge edge) {
        String query = """
                MATCH (s:Entity {id: $sourceId})
                MATCH (t:Entity {id: $targetId})
                CREATE (s)-[r:RELATED {
                    id: $relationshipId,
                    type: $type,
                    strength: $strength,
                    confidence: $confidence,
                    verified: $verified,
                    active: $active
                }]->(t)
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("sourceId", edge.getSourceId());
        params.put("targetId", edge.getTargetId());
        params.put("relationshipId", edge.getRelationshipId());
        params.put("type", edge.getType().getValue());
        params.put("strength", edge.getStrength().name().toLowerCase(Locale.ROOT));
        params.put("confidence", edge.getConfidence());
        params.put("verified", edge.isVerified());
        params.put("active", edge.isActive());
        connection.execute(query, params);
        log.debug("Created relationship {} ({}) from {} to {}",
                edge.getRelationshipId(), edge.getType().getValue(), edge.getSourceId(), edge.getTargetId());
    }

    private List<RelationshipEdge> queryFrontier(Set<String> frontier) {
        List<Map<String, Object>> rows;
        try {
            rows = connection.query(FRONTIER_QUERY, Map.of("frontier", List.copyOf(frontier)));
        } catch (RuntimeException e) {
            throw new GraphStoreException("boundedTraversal",
                    "Traversal query failed for frontier of " + frontier.size() + ": " + e.getMessage(), e);
        }
        List<RelationshipEdge> edges = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            RelationshipEdge edge = mapToEdge(row);
            if (edge != null) {
                edges.add(edge);
            }
        }
        return edges;
    }

    private RelationshipEdge mapToEdge(Map<String, Object> row) {
        String relationshipId = asString(row.get("relationshipId"));
        String sourceId = asString(row.get("sourceId"));
        String targetId = asString(row.get("targetId"));
        if (relationshipId == null || sourceId == null || targetId == null) {
            log.debug("Skipping relationship row without id or endpoints: {}", row);
            return null;
        }
        Double confidence = asDouble(row.get("confidence"));
        if (confidence == null) {
            log.debug("Relationship {} has no confidence, using default {}",
                    relationshipId, RelationshipEdge.DEFAULT_CONFIDENCE);
        }
        return RelationshipEdge.builder()
                .relationshipId(relationshipId)
                .sourceId(sourceId)
                .targetId(targetId)
                .type(RelationshipType.fromValue(asString(row.get("type"))))
                .strength(RelationshipStrength.fromValue(asString(row.get("strength"))))
                .confidence(confidence)
                .verified(asBoolean(row.get("verified"), false))
                .active(asBoolean(row.get("active"), true))
                .build();
    }

    private EntitySummary mapToEntity(Map<String, Object> row) {
        String id = asString(row.get("id"));
        if (id == null) {
            return null;
        }
        Double riskScore = asDouble(row.get("riskScore"));
        if (riskScore == null) {
            log.debug("Entity {} has no risk score, defaulting to 0.0", id);
        }
        double score = riskScore != null ? riskScore : 0.0;
        return new EntitySummary(
                id,
                asString(row.get("name")),
                EntityType.fromValue(asString(row.get("entityType"))),
                score,
                RiskLevel.fromValue(asString(row.get("riskLevel")), RiskLevel.fromScore(score)));
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    private static Double asDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean asBoolean(Object value, boolean fallback) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s);
        }
        return fallback;
    }
}

package com.aml.network.graph;

import com.aml.network.cache.RelationshipChangeListener;
import com.aml.network.core.model.EntitySummary;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.TraversalHop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link GraphStore} backed by an adjacency index.
 *
 * <p>Traversal is deterministic: each hop level expands frontier entities in ascending
 * id order and their relationships in ascending relationship id order. Writes notify
 * registered {@link RelationshipChangeListener}s so cached results can be invalidated.</p>
 */
public class InMemoryGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryGraphStore.class);

    private final ConcurrentMap<String, EntitySummary> entities = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RelationshipEdge> relationships = new ConcurrentHashMap<>();
    // entityId -> ids of relationships touching it
    private final ConcurrentMap<String, Set<String>> adjacency = new ConcurrentHashMap<>();
    private final List<RelationshipChangeListener> listeners = new CopyOnWriteArrayList<>();

    public void addChangeListener(RelationshipChangeListener listener) {
        listeners.add(listener);
    }

    public void putEntity(EntitySummary entity) {
        entities.put(entity.id(), entity);
    }

    /**
     * Adds or replaces a relationship. Endpoints do not need a stored entity; lookups
     * for them fall back to defaults.
     */
    public void putRelationship(RelationshipEdge edge) {
        RelationshipEdge previous = relationships.put(edge.getRelationshipId(), edge);
        if (previous != null) {
            unindex(previous);
        }
        adjacency.computeIfAbsent(edge.getSourceId(), k -> ConcurrentHashMap.newKeySet())
                .add(edge.getRelationshipId());
        adjacency.computeIfAbsent(edge.getTargetId(), k -> ConcurrentHashMap.newKeySet())
                .add(edge.getRelationshipId());
        notifyListeners(edge);
    }

    public boolean removeRelationship(String relationshipId) {
        RelationshipEdge removed = relationships.remove(relationshipId);
        if (removed == null) {
            return false;
        }
        unindex(removed);
        notifyListeners(removed);
        return true;
    }

    public Optional<RelationshipEdge> findRelationship(String relationshipId) {
        return Optional.ofNullable(relationships.get(relationshipId));
    }

    public int entityCount() {
        return entities.size();
    }

    public int relationshipCount() {
        return relationships.size();
    }

    @Override
    public List<TraversalHop> boundedTraversal(String centerId, int maxDepth, TraversalFilter filter) {
        List<TraversalHop> hops = new ArrayList<>();
        Set<String> seenRelationships = new HashSet<>();
        Set<String> reached = new HashSet<>();
        reached.add(centerId);
        Set<String> frontier = new TreeSet<>(Set.of(centerId));

        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            Set<String> next = new TreeSet<>();
            for (String entityId : frontier) {
                Set<String> relIds = adjacency.getOrDefault(entityId, Set.of());
                for (String relId : new TreeSet<>(relIds)) {
                    RelationshipEdge edge = relationships.get(relId);
                    if (edge == null || !filter.matches(edge) || !seenRelationships.add(relId)) {
                        continue;
                    }
                    hops.add(new TraversalHop(edge, depth));
                    String other = edge.otherEnd(entityId);
                    if (reached.add(other)) {
                        next.add(other);
                    }
                }
            }
            frontier = next;
        }
        log.debug("In-memory traversal from {} (depth {}) returned {} edges", centerId, maxDepth, hops.size());
        return hops;
    }

    @Override
    public Map<String, EntitySummary> batchLookupEntities(Collection<String> ids) {
        Map<String, EntitySummary> result = new LinkedHashMap<>();
        for (String id : ids) {
            EntitySummary entity = entities.get(id);
            if (entity != null) {
                result.put(id, entity);
            }
        }
        return result;
    }

    private void unindex(RelationshipEdge edge) {
        Set<String> fromSource = adjacency.get(edge.getSourceId());
        if (fromSource != null) {
            fromSource.remove(edge.getRelationshipId());
        }
        Set<String> fromTarget = adjacency.get(edge.getTargetId());
        if (fromTarget != null) {
            fromTarget.remove(edge.getRelationshipId());
        }
    }

    private void notifyListeners(RelationshipEdge edge) {
        for (RelationshipChangeListener listener : listeners) {
            listener.onRelationshipChanged(edge.getSourceId(), edge.getTargetId());
        }
    }
}

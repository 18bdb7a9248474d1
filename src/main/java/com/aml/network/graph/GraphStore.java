package com.aml.network.graph;

import com.aml.network.core.model.EntitySummary;
import com.aml.network.core.model.TraversalHop;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read-only contract through which the network engine consumes the entity and
 * relationship store. Any storage engine can back it: a graph database, a relational
 * adjacency table, or an in-memory structure.
 *
 * <p>Both operations are side-effect free. Failures surface as
 * {@link GraphStoreException}, which callers treat as non-fatal.</p>
 */
public interface GraphStore {

    /**
     * Returns the relationships reachable within {@code maxDepth} hops from
     * {@code centerId}, following edges in either direction and only through edges that
     * match {@code filter}. Each relationship appears once, tagged with the hop level that
     * first reached it, and the list is ordered nearest hop first.
     *
     * @param centerId the entity the traversal starts from
     * @param maxDepth maximum number of hops (>= 1)
     * @param filter   edge restrictions
     * @return discovered edges in breadth-first order
     * @throws GraphStoreException if the store cannot be queried
     */
    List<TraversalHop> boundedTraversal(String centerId, int maxDepth, TraversalFilter filter);

    /**
     * Resolves entity summaries for a set of ids. Ids unknown to the store are absent
     * from the returned map.
     *
     * @param ids entity ids
     * @return summaries keyed by entity id
     * @throws GraphStoreException if the store cannot be queried
     */
    Map<String, EntitySummary> batchLookupEntities(Collection<String> ids);
}

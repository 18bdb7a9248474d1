package com.aml.network.cache;

/**
 * Listener for changes to underlying relationship data. Cached analysis results have no
 * automatic invalidation; writers call this hook so dependent results can be evicted.
 */
public interface RelationshipChangeListener {

    /**
     * Called after a relationship between two entities was created, updated or removed.
     *
     * @param sourceEntityId one endpoint of the changed relationship
     * @param targetEntityId the other endpoint
     */
    void onRelationshipChanged(String sourceEntityId, String targetEntityId);
}

package com.aml.network.cache;

import com.aml.network.api.NetworkAnalysisRequest;
import com.aml.network.api.NetworkAnalysisResult;

import java.util.Optional;

/**
 * Cache of analysis results keyed by request. Entries expire after a TTL; there is no
 * automatic invalidation when the underlying relationships change, so writers must call
 * {@link #invalidate(String)} or register the cache as a {@link RelationshipChangeListener}.
 */
public interface NetworkResultCache {

    Optional<NetworkAnalysisResult> get(NetworkAnalysisRequest request);

    void put(NetworkAnalysisRequest request, NetworkAnalysisResult result);

    /**
     * Evicts every cached result whose graph contains the entity.
     */
    void invalidate(String entityId);

    void invalidateAll();

    CacheStats getStats();
}

package com.aml.network.cache;

import com.aml.network.api.NetworkAnalysisRequest;
import com.aml.network.api.NetworkAnalysisResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed result cache with an entity index for targeted invalidation.
 * Implements {@link RelationshipChangeListener} so a store can evict affected results
 * when it writes a relationship.
 */
public class CaffeineNetworkResultCache implements NetworkResultCache, RelationshipChangeListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineNetworkResultCache.class);

    private final Cache<NetworkAnalysisRequest, NetworkAnalysisResult> cache;
    // entityId -> requests whose cached graph contains that entity
    private final ConcurrentMap<String, Set<NetworkAnalysisRequest>> entityIndex = new ConcurrentHashMap<>();

    public CaffeineNetworkResultCache(CacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    CaffeineNetworkResultCache(CacheConfig config, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxResults())
                .expireAfterWrite(config.ttl())
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .removalListener((NetworkAnalysisRequest key, NetworkAnalysisResult value, RemovalCause cause) -> {
                    if (key != null) {
                        removeFromIndex(key);
                    }
                })
                .build();
        log.info("CaffeineNetworkResultCache initialized: maxResults={}, ttl={}",
                config.maxResults(), config.ttl());
    }

    @Override
    public Optional<NetworkAnalysisResult> get(NetworkAnalysisRequest request) {
        return Optional.ofNullable(cache.getIfPresent(request));
    }

    @Override
    public void put(NetworkAnalysisRequest request, NetworkAnalysisResult result) {
        cache.put(request, result);
        for (String entityId : result.getGraph().getNodeIds()) {
            index(entityId, request);
        }
        // the center is indexed even when the graph came back empty
        index(request.getCenterEntityId(), request);
    }

    @Override
    public void invalidate(String entityId) {
        Set<NetworkAnalysisRequest> keys = entityIndex.remove(entityId);
        if (keys != null) {
            keys.forEach(cache::invalidate);
            log.debug("Invalidated {} cached results containing entity {}", keys.size(), entityId);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        entityIndex.clear();
        log.debug("Invalidated all cached results");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(),
                cache.estimatedSize(), entityIndex.size());
    }

    @Override
    public void onRelationshipChanged(String sourceEntityId, String targetEntityId) {
        invalidate(sourceEntityId);
        invalidate(targetEntityId);
        log.debug("Cache invalidated for relationship change: {} <-> {}", sourceEntityId, targetEntityId);
    }

    private void index(String entityId, NetworkAnalysisRequest request) {
        entityIndex.compute(entityId, (id, keys) -> {
            Set<NetworkAnalysisRequest> target = keys != null ? keys : ConcurrentHashMap.newKeySet();
            target.add(request);
            return target;
        });
    }

    private void removeFromIndex(NetworkAnalysisRequest key) {
        for (String entityId : List.copyOf(entityIndex.keySet())) {
            entityIndex.computeIfPresent(entityId, (id, keys) -> {
                keys.remove(key);
                return keys.isEmpty() ? null : keys;
            });
        }
    }
}

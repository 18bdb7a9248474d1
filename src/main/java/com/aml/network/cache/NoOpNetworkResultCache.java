package com.aml.network.cache;

import com.aml.network.api.NetworkAnalysisRequest;
import com.aml.network.api.NetworkAnalysisResult;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpNetworkResultCache implements NetworkResultCache {

    @Override
    public Optional<NetworkAnalysisResult> get(NetworkAnalysisRequest request) {
        return Optional.empty();
    }

    @Override
    public void put(NetworkAnalysisRequest request, NetworkAnalysisResult result) {
    }

    @Override
    public void invalidate(String entityId) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}

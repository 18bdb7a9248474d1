package com.aml.network.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordBuildDuration(Duration duration) {
    }

    @Override
    public void recordGraphSize(int nodes, int edges) {
    }

    @Override
    public void recordAnalysisDuration(String component, Duration duration) {
    }

    @Override
    public void incrementStoreFailure(String operation) {
    }

    @Override
    public void recordPathLength(int hops) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}

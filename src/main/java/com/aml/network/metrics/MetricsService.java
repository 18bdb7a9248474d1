package com.aml.network.metrics;

import java.time.Duration;

/**
 * Interface for recording network analysis metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works without
 * any metrics dependency on the classpath.
 */
public interface MetricsService {

    void recordBuildDuration(Duration duration);

    void recordGraphSize(int nodes, int edges);

    void recordAnalysisDuration(String component, Duration duration);

    void incrementStoreFailure(String operation);

    void recordPathLength(int hops);

    void recordCacheHit();

    void recordCacheMiss();
}

package com.aml.network.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code network.build.duration}: Timer</li>
 *   <li>{@code network.graph.nodes}, {@code network.graph.edges}: DistributionSummary</li>
 *   <li>{@code network.analysis.duration}: Timer (tag: component)</li>
 *   <li>{@code network.store.failure}: Counter (tag: operation)</li>
 *   <li>{@code network.path.length}: DistributionSummary</li>
 *   <li>{@code network.cache.hit}, {@code network.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer buildTimer;
    private final DistributionSummary nodesSummary;
    private final DistributionSummary edgesSummary;
    private final DistributionSummary pathLengthSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.buildTimer = Timer.builder("network.build.duration")
                .description("Duration of network graph builds")
                .register(registry);
        this.nodesSummary = DistributionSummary.builder("network.graph.nodes")
                .description("Entities per built network graph")
                .register(registry);
        this.edgesSummary = DistributionSummary.builder("network.graph.edges")
                .description("Relationships per built network graph")
                .register(registry);
        this.pathLengthSummary = DistributionSummary.builder("network.path.length")
                .description("Hop count of found paths")
                .register(registry);
        this.cacheHitCounter = Counter.builder("network.cache.hit")
                .description("Number of analysis result cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("network.cache.miss")
                .description("Number of analysis result cache misses")
                .register(registry);
    }

    @Override
    public void recordBuildDuration(Duration duration) {
        buildTimer.record(duration);
    }

    @Override
    public void recordGraphSize(int nodes, int edges) {
        nodesSummary.record(nodes);
        edgesSummary.record(edges);
    }

    @Override
    public void recordAnalysisDuration(String component, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(component, k ->
                Timer.builder("network.analysis.duration")
                        .description("Duration of individual analysis components")
                        .tag("component", component)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementStoreFailure(String operation) {
        Counter counter = counterCache.computeIfAbsent(operation, k ->
                Counter.builder("network.store.failure")
                        .description("Graph store calls that failed or timed out")
                        .tag("operation", operation)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordPathLength(int hops) {
        pathLengthSummary.record(hops);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}

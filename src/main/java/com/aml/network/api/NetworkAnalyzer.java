package com.aml.network.api;

import com.aml.network.analysis.HubQuery;
import com.aml.network.analysis.PathQuery;
import com.aml.network.analysis.PropagationQuery;
import com.aml.network.cache.CacheConfig;
import com.aml.network.cache.CaffeineNetworkResultCache;
import com.aml.network.cache.NetworkResultCache;
import com.aml.network.cache.NoOpNetworkResultCache;
import com.aml.network.cache.RelationshipChangeListener;
import com.aml.network.core.model.CentralityRecord;
import com.aml.network.core.model.CircularRelationship;
import com.aml.network.core.model.Community;
import com.aml.network.core.model.HubEntity;
import com.aml.network.core.model.NetworkPath;
import com.aml.network.core.model.RiskPropagationResult;
import com.aml.network.graph.CypherGraphStore;
import com.aml.network.graph.FalkorDBConnection;
import com.aml.network.graph.GraphConnection;
import com.aml.network.graph.GraphStore;
import com.aml.network.graph.InMemoryGraphStore;
import com.aml.network.metrics.MetricsService;
import com.aml.network.metrics.NoOpMetricsService;
import com.aml.network.network.NetworkBuildResult;
import com.aml.network.network.NetworkQuery;
import com.aml.network.tracing.NoOpTracingService;
import com.aml.network.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for network analysis.
 *
 * <p>Usage:</p>
 * <pre>
 * try (NetworkAnalyzer analyzer = NetworkAnalyzer.builder()
 *         .falkorDB("localhost", 6379, "aml")
 *         .metricsService(new MicrometerMetricsService(registry))
 *         .build()) {
 *
 *     NetworkAnalysisResult result = analyzer.analyze(NetworkAnalysisRequest.builder(
 *                     NetworkQuery.builder("E123").maxDepth(3).build())
 *             .pathTarget("E456")
 *             .build());
 *
 *     result.getHubs().forEach(hub -&gt; log.info("hub {}", hub.entityId()));
 * }
 * </pre>
 *
 * <p>The analyzer owns its worker pools, and the graph connection when it opened it;
 * {@link #close()} releases them.</p>
 */
public class NetworkAnalyzer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NetworkAnalyzer.class);

    public static final int DEFAULT_ANALYSIS_THREADS = 4;
    public static final Duration DEFAULT_STORE_CALL_TIMEOUT = Duration.ofSeconds(10);

    private final NetworkAnalysisService service;
    private final ExecutorService analysisExecutor;
    private final ExecutorService storeExecutor;
    private final GraphConnection ownedConnection;

    private NetworkAnalyzer(Builder builder, GraphStore store) {
        this.ownedConnection = builder.ownedConnection;
        this.analysisExecutor = Executors.newFixedThreadPool(builder.analysisThreads, namedThreads("network-analysis"));
        this.storeExecutor = Executors.newCachedThreadPool(namedThreads("network-store"));

        MetricsService metrics = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        NetworkResultCache cache;
        if (builder.cache != null) {
            cache = builder.cache;
        } else if (builder.cacheConfig.enabled()) {
            cache = new CaffeineNetworkResultCache(builder.cacheConfig);
        } else {
            cache = new NoOpNetworkResultCache();
        }

        // in-memory stores notify the cache of relationship writes directly
        if (store instanceof InMemoryGraphStore inMemory && cache instanceof RelationshipChangeListener listener) {
            inMemory.addChangeListener(listener);
        }

        this.service = new NetworkAnalysisService(store, storeExecutor, analysisExecutor,
                builder.storeCallTimeout, cache, metrics, tracing);
        log.info("NetworkAnalyzer initialized: store={}, analysisThreads={}, storeCallTimeout={}",
                store.getClass().getSimpleName(), builder.analysisThreads, builder.storeCallTimeout);
    }

    public NetworkAnalysisResult analyze(NetworkAnalysisRequest request) {
        return service.analyze(request);
    }

    /**
     * Analysis around {@code centerEntityId} with every default.
     */
    public NetworkAnalysisResult analyze(String centerEntityId) {
        return service.analyze(NetworkAnalysisRequest.forCenter(centerEntityId));
    }

    public NetworkBuildResult buildNetwork(NetworkQuery query) {
        return service.buildNetwork(query);
    }

    public NetworkPath findPath(String sourceEntityId, String targetEntityId) {
        return service.findPath(PathQuery.between(sourceEntityId, targetEntityId));
    }

    public NetworkPath findPath(PathQuery query) {
        return service.findPath(query);
    }

    public OptionalInt degreesOfSeparation(String sourceEntityId, String targetEntityId) {
        return service.degreesOfSeparation(sourceEntityId, targetEntityId, PathQuery.DEFAULT_MAX_DEPTH);
    }

    public AnalysisOutcome<List<CentralityRecord>> analyzeCentrality(List<String> entityIds, int maxDepth,
                                                                     boolean includeAdvanced) {
        return service.analyzeCentrality(entityIds, maxDepth, includeAdvanced);
    }

    public AnalysisOutcome<List<Community>> detectCommunities(List<String> entityIds, int maxDepth,
                                                              int minCommunitySize, double resolution) {
        return service.detectCommunities(entityIds, maxDepth, minCommunitySize, resolution);
    }

    public AnalysisOutcome<List<HubEntity>> detectHubs(HubQuery query) {
        return service.detectHubs(query);
    }

    public RiskPropagationResult propagateRisk(PropagationQuery query) {
        return service.propagateRisk(query);
    }

    public AnalysisOutcome<List<CircularRelationship>> detectCycles(NetworkQuery query) {
        return service.detectCycles(query);
    }

    /**
     * Evicts cached results affected by a relationship change between two entities.
     */
    public void onRelationshipChanged(String sourceEntityId, String targetEntityId) {
        service.invalidate(sourceEntityId, targetEntityId);
    }

    public void invalidateAll() {
        service.invalidateAll();
    }

    public NetworkAnalysisService getService() {
        return service;
    }

    @Override
    public void close() {
        analysisExecutor.shutdown();
        storeExecutor.shutdownNow();
        try {
            if (!analysisExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                analysisExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            analysisExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (ownedConnection != null) {
            try {
                ownedConnection.close();
            } catch (Exception e) {
                log.warn("Error closing graph connection", e);
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphStore graphStore;
        private GraphConnection ownedConnection;
        private boolean createIndexes = true;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private NetworkResultCache cache;
        private MetricsService metricsService;
        private TracingService tracingService;
        private int analysisThreads = DEFAULT_ANALYSIS_THREADS;
        private Duration storeCallTimeout = DEFAULT_STORE_CALL_TIMEOUT;

        /**
         * Uses an existing store. The caller keeps ownership of any underlying connection.
         */
        public Builder graphStore(GraphStore graphStore) {
            this.graphStore = graphStore;
            return this;
        }

        /**
         * Opens a FalkorDB connection owned and closed by the analyzer.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.ownedConnection = new FalkorDBConnection(host, port, graphName);
            this.graphStore = new CypherGraphStore(ownedConnection);
            return this;
        }

        /**
         * Controls whether to create graph indexes on startup when the analyzer opens the connection.
         */
        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Sets a custom result cache, overriding {@link #cacheConfig(CacheConfig)}.
         */
        public Builder cache(NetworkResultCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder analysisThreads(int analysisThreads) {
            this.analysisThreads = analysisThreads;
            return this;
        }

        /**
         * Upper bound for a single store call; the request deadline may cut it shorter.
         */
        public Builder storeCallTimeout(Duration storeCallTimeout) {
            this.storeCallTimeout = storeCallTimeout;
            return this;
        }

        public NetworkAnalyzer build() {
            if (graphStore == null) {
                throw new IllegalStateException("GraphStore is required");
            }
            if (analysisThreads <= 0) {
                throw new IllegalArgumentException("analysisThreads must be > 0");
            }
            if (storeCallTimeout == null || storeCallTimeout.isNegative() || storeCallTimeout.isZero()) {
                throw new IllegalArgumentException("storeCallTimeout must be positive");
            }
            if (ownedConnection != null && createIndexes) {
                ownedConnection.createIndexes();
            }
            return new NetworkAnalyzer(this, graphStore);
        }
    }
}

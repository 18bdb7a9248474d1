package com.aml.network.api;

import com.aml.network.analysis.CentralityAnalyzer;
import com.aml.network.analysis.CommunityDetector;
import com.aml.network.analysis.CycleDetector;
import com.aml.network.analysis.HubDetector;
import com.aml.network.analysis.HubQuery;
import com.aml.network.analysis.PathFinder;
import com.aml.network.analysis.PathQuery;
import com.aml.network.analysis.PropagationQuery;
import com.aml.network.analysis.RiskPropagator;
import com.aml.network.cache.NetworkResultCache;
import com.aml.network.core.InvalidRequestException;
import com.aml.network.core.model.CentralityRecord;
import com.aml.network.core.model.CircularRelationship;
import com.aml.network.core.model.Community;
import com.aml.network.core.model.EntityNode;
import com.aml.network.core.model.EntitySummary;
import com.aml.network.core.model.HubEntity;
import com.aml.network.core.model.NetworkGraph;
import com.aml.network.core.model.NetworkPath;
import com.aml.network.core.model.RelationshipEdge;
import com.aml.network.core.model.RelationshipPattern;
import com.aml.network.core.model.RiskLevel;
import com.aml.network.core.model.RiskPropagationResult;
import com.aml.network.core.model.TraversalHop;
import com.aml.network.graph.ConnectionSource;
import com.aml.network.graph.DeadlineGraphStore;
import com.aml.network.graph.GraphStore;
import com.aml.network.graph.GraphStoreException;
import com.aml.network.graph.InputSanitizer;
import com.aml.network.graph.TraversalFilter;
import com.aml.network.logging.LogContext;
import com.aml.network.metrics.MetricsService;
import com.aml.network.network.NetworkBuildResult;
import com.aml.network.network.NetworkBuilder;
import com.aml.network.network.NetworkQuery;
import com.aml.network.tracing.NetworkOperation;
import com.aml.network.tracing.Span;
import com.aml.network.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Orchestrates network builds and analyses.
 *
 * <p>{@link #analyze(NetworkAnalysisRequest)} builds the network once and runs the enabled
 * analyzers concurrently over the same immutable graph. Every store call is bounded by
 * the request deadline. A failing or timed-out component leaves its section empty and
 * reports its error; it never fails the whole request.</p>
 */
public class NetworkAnalysisService {
    private static final Logger log = LoggerFactory.getLogger(NetworkAnalysisService.class);

    static final String COMPONENT_CENTRALITY = "centrality";
    static final String COMPONENT_COMMUNITIES = "communities";
    static final String COMPONENT_HUBS = "hubs";
    static final String COMPONENT_PROPAGATION = "propagation";
    static final String COMPONENT_CYCLES = "cycles";
    static final String COMPONENT_PATH = "path";

    private static final double HIGH_NEIGHBOR_WEIGHT = 0.8;
    private static final double CRITICAL_NEIGHBOR_WEIGHT = 1.0;
    private static final double MAX_CONNECTION_RISK_FACTOR = 0.5;

    private final GraphStore store;
    private final ExecutorService storeExecutor;
    private final ExecutorService analysisExecutor;
    private final Duration storeCallTimeout;
    private final NetworkResultCache cache;
    private final MetricsService metrics;
    private final TracingService tracing;

    private final CentralityAnalyzer centralityAnalyzer = new CentralityAnalyzer();
    private final CommunityDetector communityDetector = new CommunityDetector();
    private final RiskPropagator riskPropagator = new RiskPropagator();
    private final CycleDetector cycleDetector = new CycleDetector();

    public NetworkAnalysisService(GraphStore store, ExecutorService storeExecutor, ExecutorService analysisExecutor,
                                  Duration storeCallTimeout, NetworkResultCache cache,
                                  MetricsService metrics, TracingService tracing) {
        this.store = store;
        this.storeExecutor = storeExecutor;
        this.analysisExecutor = analysisExecutor;
        this.storeCallTimeout = storeCallTimeout;
        this.cache = cache;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    // ========== Full analysis ==========

    public NetworkAnalysisResult analyze(NetworkAnalysisRequest request) {
        String correlationId = LogContext.generateCorrelationId();
        String centerId = request.getCenterEntityId();
        try (LogContext ctx = LogContext.forAnalysis(correlationId, centerId);
             Span span = tracing.startSpan(NetworkOperation.ANALYZE, centerId)) {

            // a path may run through entities outside the graph, so the entity index cannot cover it
            boolean cacheable = request.getPathTarget() == null;
            if (cacheable) {
                Optional<NetworkAnalysisResult> cached = cache.get(request);
                if (cached.isPresent()) {
                    metrics.recordCacheHit();
                    log.debug("Cache hit for analysis of {}", centerId);
                    span.setAttribute(Span.CACHE_HIT, "true");
                    span.markOk();
                    return cached.get();
                }
                metrics.recordCacheMiss();
            }

            long start = System.nanoTime();
            Instant deadline = Instant.now().plus(request.getTimeout());
            GraphStore bounded = boundedStore(deadline);

            CompletableFuture<NetworkPath> pathFuture = null;
            if (request.getPathTarget() != null) {
                PathQuery pathQuery = PathQuery.between(centerId, request.getPathTarget());
                pathFuture = CompletableFuture.supplyAsync(() -> tracedPath(pathQuery, bounded), analysisExecutor);
            }

            NetworkBuildResult build = tracedBuild(request.getNetworkQuery(), bounded);
            NetworkAnalysisResult.Builder result = NetworkAnalysisResult.builder()
                    .correlationId(correlationId)
                    .buildResult(build);
            List<String> errors = new ArrayList<>();

            if (build.isFailed()) {
                errors.add("build: " + build.error());
            } else {
                runAnalyzers(request, build.graph(), bounded, deadline, result, errors);
            }

            if (pathFuture != null) {
                Outcome<NetworkPath> path = await(COMPONENT_PATH, pathFuture, deadline,
                        NetworkPath.notFound(centerId, request.getPathTarget(), null));
                path.addErrorTo(errors);
                if (path.value().error() != null) {
                    errors.add(COMPONENT_PATH + ": " + path.value().error());
                }
                result.path(path.value());
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            NetworkAnalysisResult analysis = result
                    .visualization(VisualizationHints.forGraph(build.graph(), request.getLayout()))
                    .errors(errors)
                    .processingTime(elapsed)
                    .build();
            traceOutcome(span, build, errors);

            if (cacheable && !build.isFailed() && errors.isEmpty()) {
                cache.put(request, analysis);
            }
            log.info("network.analyzed center={} nodes={} edges={} errors={} durationMs={}",
                    centerId, build.graph().getTotalEntities(), build.graph().getTotalRelationships(),
                    errors.size(), elapsed.toMillis());
            return analysis;
        }
    }

    private void runAnalyzers(NetworkAnalysisRequest request, NetworkGraph graph, GraphStore bounded,
                              Instant deadline, NetworkAnalysisResult.Builder result, List<String> errors) {
        List<String> nodeIds = List.copyOf(graph.getNodeIds());
        List<RelationshipEdge> edges = graph.getEdges();

        CompletableFuture<List<CentralityRecord>> centrality = request.isIncludeCentrality()
                ? submit(COMPONENT_CENTRALITY, () ->
                        centralityAnalyzer.analyze(nodeIds, edges, request.isIncludeAdvancedCentrality()))
                : CompletableFuture.completedFuture(List.of());
        CompletableFuture<List<Community>> communities = request.isIncludeCommunities()
                ? submit(COMPONENT_COMMUNITIES, () -> communityDetector.detect(nodeIds, edges,
                        request.getMinCommunitySize(), request.getCommunityResolution()))
                : CompletableFuture.completedFuture(List.of());
        CompletableFuture<HubDetector.Result> hubs = request.isIncludeHubs()
                ? submit(COMPONENT_HUBS, () ->
                        new HubDetector(bounded).detect(request.toHubQuery(nodeIds), edges))
                : CompletableFuture.completedFuture(new HubDetector.Result(List.of(), null));
        CompletableFuture<RiskPropagationResult> propagation = request.isIncludeRiskPropagation()
                ? submit(COMPONENT_PROPAGATION, () -> propagateInGraph(request.toPropagationQuery(), graph))
                : CompletableFuture.completedFuture(RiskPropagationResult.empty(request.getCenterEntityId(), 0.0));
        CompletableFuture<List<CircularRelationship>> cycles = request.isIncludeCycles()
                ? submit(COMPONENT_CYCLES, () -> cycleDetector.detect(graph))
                : CompletableFuture.completedFuture(List.of());

        Outcome<List<CentralityRecord>> centralityOutcome = await(COMPONENT_CENTRALITY, centrality, deadline, List.of());
        Outcome<List<Community>> communityOutcome = await(COMPONENT_COMMUNITIES, communities, deadline, List.of());
        Outcome<HubDetector.Result> hubOutcome = await(COMPONENT_HUBS, hubs, deadline,
                new HubDetector.Result(List.of(), null));
        Outcome<RiskPropagationResult> propagationOutcome = await(COMPONENT_PROPAGATION, propagation, deadline,
                RiskPropagationResult.empty(request.getCenterEntityId(), 0.0));
        Outcome<List<CircularRelationship>> cycleOutcome = await(COMPONENT_CYCLES, cycles, deadline, List.of());

        centralityOutcome.addErrorTo(errors);
        communityOutcome.addErrorTo(errors);
        hubOutcome.addErrorTo(errors);
        if (hubOutcome.value().error() != null) {
            errors.add(COMPONENT_HUBS + ": " + hubOutcome.value().error());
        }
        propagationOutcome.addErrorTo(errors);
        cycleOutcome.addErrorTo(errors);

        NetworkStatistics statistics = NetworkStatistics.of(graph);
        result.centrality(centralityOutcome.value())
                .communities(communityOutcome.value())
                .hubs(hubOutcome.value().hubs())
                .riskPropagation(propagationOutcome.value())
                .cycles(cycleOutcome.value())
                .statistics(statistics)
                .nodeRisks(assessNodeRisks(graph, centralityOutcome.value()))
                .recommendations(recommendations(statistics, cycleOutcome.value()));
    }

    private <T> CompletableFuture<T> submit(String component, Supplier<T> task) {
        return CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            try {
                return task.get();
            } finally {
                metrics.recordAnalysisDuration(component, Duration.ofNanos(System.nanoTime() - start));
            }
        }, analysisExecutor);
    }

    private <T> Outcome<T> await(String component, CompletableFuture<T> future, Instant deadline, T fallback) {
        long remainingMs = Math.max(Duration.between(Instant.now(), deadline).toMillis(), 1);
        try {
            return new Outcome<>(future.orTimeout(remainingMs, TimeUnit.MILLISECONDS).join(), null, component);
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message;
            if (cause instanceof TimeoutException) {
                message = "timed out";
            } else {
                message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            }
            if (cause instanceof GraphStoreException storeException) {
                metrics.incrementStoreFailure(storeException.getOperation());
            }
            log.warn("Analysis component {} failed: {}", component, message);
            return new Outcome<>(fallback, message, component);
        }
    }

    private record Outcome<T>(T value, String error, String component) {
        void addErrorTo(List<String> errors) {
            if (error != null) {
                errors.add(component + ": " + error);
            }
        }
    }

    // ========== Standalone operations ==========

    public NetworkBuildResult buildNetwork(NetworkQuery query) {
        try (LogContext ctx = LogContext.forBuild(LogContext.generateCorrelationId(), query.getCenterEntityId())) {
            return tracedBuild(query, boundedStore(defaultDeadline()));
        }
    }

    public NetworkPath findPath(PathQuery query) {
        try (LogContext ctx = LogContext.forPath(LogContext.generateCorrelationId(),
                query.sourceEntityId(), query.targetEntityId())) {
            return tracedPath(query, boundedStore(defaultDeadline()));
        }
    }

    /**
     * Hop count of the shortest path, or empty when none exists within {@code maxDepth}
     * or the store failed.
     */
    public OptionalInt degreesOfSeparation(String sourceEntityId, String targetEntityId, int maxDepth) {
        NetworkPath path = findPath(PathQuery.between(sourceEntityId, targetEntityId).withMaxDepth(maxDepth));
        return path.found() ? OptionalInt.of(path.hopCount()) : OptionalInt.empty();
    }

    /**
     * Centrality over the given entities, using relationships within {@code maxDepth} of each.
     * Only relationships between two of the given entities are counted.
     */
    public AnalysisOutcome<List<CentralityRecord>> analyzeCentrality(List<String> entityIds, int maxDepth,
                                                                     boolean includeAdvanced) {
        validateCandidates(entityIds, maxDepth);
        try (LogContext ctx = LogContext.forOperation(COMPONENT_CENTRALITY, LogContext.generateCorrelationId())) {
            List<RelationshipEdge> edges = collectEdges(entityIds, maxDepth, boundedStore(defaultDeadline()));
            return AnalysisOutcome.success(centralityAnalyzer.analyze(entityIds, edges, includeAdvanced));
        } catch (GraphStoreException e) {
            return storeFailure(COMPONENT_CENTRALITY, e, entityIds.stream()
                    .distinct()
                    .map(id -> CentralityRecord.zero(id, includeAdvanced))
                    .toList());
        }
    }

    public AnalysisOutcome<List<Community>> detectCommunities(List<String> entityIds, int maxDepth,
                                                              int minCommunitySize, double resolution) {
        validateCandidates(entityIds, maxDepth);
        if (minCommunitySize < 1) {
            throw new InvalidRequestException("minCommunitySize must be >= 1, got: " + minCommunitySize);
        }
        if (resolution <= 0.0 || Double.isNaN(resolution)) {
            throw new InvalidRequestException("resolution must be > 0, got: " + resolution);
        }
        try (LogContext ctx = LogContext.forOperation(COMPONENT_COMMUNITIES, LogContext.generateCorrelationId())) {
            List<RelationshipEdge> edges = collectEdges(entityIds, maxDepth, boundedStore(defaultDeadline()));
            return AnalysisOutcome.success(communityDetector.detect(entityIds, edges, minCommunitySize, resolution));
        } catch (GraphStoreException e) {
            return storeFailure(COMPONENT_COMMUNITIES, e, List.of());
        }
    }

    /**
     * Hubs among the given candidates, counting their direct relationships in the store.
     * The store offers no full scan, so at least one candidate is required here.
     */
    public AnalysisOutcome<List<HubEntity>> detectHubs(HubQuery query) {
        if (query.candidateIds().isEmpty()) {
            throw new InvalidRequestException("detectHubs requires at least one candidate entity");
        }
        validateCandidates(query.candidateIds(), 1);
        try (LogContext ctx = LogContext.forOperation(COMPONENT_HUBS, LogContext.generateCorrelationId())) {
            GraphStore bounded = boundedStore(defaultDeadline());
            List<RelationshipEdge> edges = collectEdges(query.candidateIds(), 1, bounded);
            HubDetector.Result hubs = new HubDetector(bounded).detect(query, edges);
            return new AnalysisOutcome<>(hubs.hubs(), hubs.error());
        } catch (GraphStoreException e) {
            return storeFailure(COMPONENT_HUBS, e, List.of());
        }
    }

    /**
     * Propagates risk from the query's source using its base risk from the store.
     */
    public RiskPropagationResult propagateRisk(PropagationQuery query) {
        try (LogContext ctx = LogContext.forOperation(COMPONENT_PROPAGATION, LogContext.generateCorrelationId())
                .with("sourceEntityId", query.sourceEntityId())) {
            GraphStore bounded = boundedStore(defaultDeadline());
            EntitySummary seed = bounded.batchLookupEntities(List.of(query.sourceEntityId()))
                    .getOrDefault(query.sourceEntityId(), EntitySummary.withDefaults(query.sourceEntityId()));
            return riskPropagator.propagate(query, seed.riskScore(), ConnectionSource.of(bounded, query.toFilter()));
        } catch (GraphStoreException e) {
            metrics.incrementStoreFailure(e.getOperation());
            log.warn("Risk propagation from {} failed: {}", query.sourceEntityId(), e.getMessage());
            return RiskPropagationResult.failed(query.sourceEntityId(), e.getMessage());
        }
    }

    /**
     * Circular relationships in the network around the query's center.
     */
    public AnalysisOutcome<List<CircularRelationship>> detectCycles(NetworkQuery query) {
        NetworkBuildResult build = buildNetwork(query);
        if (build.isFailed()) {
            return AnalysisOutcome.failure(List.of(), build.error());
        }
        return AnalysisOutcome.success(cycleDetector.detect(build.graph()));
    }

    /**
     * Evicts cached results whose graph contains either endpoint of a changed relationship.
     */
    public void invalidate(String sourceEntityId, String targetEntityId) {
        cache.invalidate(sourceEntityId);
        cache.invalidate(targetEntityId);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public NetworkResultCache getCache() {
        return cache;
    }

    // ========== Internals ==========

    private GraphStore boundedStore(Instant deadline) {
        return new DeadlineGraphStore(store, storeExecutor, storeCallTimeout, deadline);
    }

    private Instant defaultDeadline() {
        return Instant.now().plus(NetworkAnalysisRequest.DEFAULT_TIMEOUT);
    }

    private NetworkBuildResult tracedBuild(NetworkQuery query, GraphStore bounded) {
        try (Span span = tracing.startSpan(NetworkOperation.BUILD, query.getCenterEntityId())) {
            span.setAttribute(Span.MAX_DEPTH, query.getMaxDepth());
            NetworkBuildResult build = new NetworkBuilder(bounded, metrics).build(query);
            span.recordGraph(build.graph());
            if (build.isFailed()) {
                span.markFailed(build.error());
            } else {
                span.markOk();
            }
            return build;
        }
    }

    /**
     * A failed build fails the analysis span; component errors only add events to it.
     */
    private static void traceOutcome(Span span, NetworkBuildResult build, List<String> errors) {
        span.recordGraph(build.graph());
        for (String error : errors) {
            int split = error.indexOf(": ");
            if (split > 0) {
                span.recordComponentError(error.substring(0, split), error.substring(split + 2));
            } else {
                span.recordComponentError("analysis", error);
            }
        }
        if (build.isFailed()) {
            span.markFailed(build.error());
        } else {
            span.markOk();
        }
    }

    private NetworkPath tracedPath(PathQuery query, GraphStore bounded) {
        try (Span span = tracing.startSpan(NetworkOperation.PATH, query.sourceEntityId())) {
            span.setAttribute(Span.MAX_DEPTH, query.maxDepth());
            NetworkPath path = new PathFinder(bounded).findPath(query);
            span.recordPath(path);
            if (path.error() != null) {
                metrics.incrementStoreFailure("boundedTraversal");
                span.markFailed(path.error());
            } else {
                if (path.found()) {
                    metrics.recordPathLength(path.hopCount());
                }
                span.markOk();
            }
            return path;
        }
    }

    private RiskPropagationResult propagateInGraph(PropagationQuery query, NetworkGraph graph) {
        double seed = graph.getNode(query.sourceEntityId()).map(EntityNode::getRiskScore).orElse(0.0);
        return riskPropagator.propagate(query, seed, ConnectionSource.of(graph, query.toFilter()));
    }

    private List<RelationshipEdge> collectEdges(List<String> entityIds, int maxDepth, GraphStore bounded) {
        Map<String, RelationshipEdge> edges = new LinkedHashMap<>();
        for (String entityId : new LinkedHashSet<>(entityIds)) {
            for (TraversalHop hop : bounded.boundedTraversal(entityId, maxDepth, TraversalFilter.activeOnly())) {
                edges.putIfAbsent(hop.edge().getRelationshipId(), hop.edge());
            }
        }
        return List.copyOf(edges.values());
    }

    private <T> AnalysisOutcome<T> storeFailure(String component, GraphStoreException e, T fallback) {
        metrics.incrementStoreFailure(e.getOperation());
        log.warn("Standalone {} analysis failed during {}: {}", component, e.getOperation(), e.getMessage());
        return AnalysisOutcome.failure(fallback, e.getMessage());
    }

    private static void validateCandidates(List<String> entityIds, int maxDepth) {
        if (entityIds == null || entityIds.isEmpty()) {
            throw new InvalidRequestException("entityIds must not be empty");
        }
        for (String entityId : entityIds) {
            InputSanitizer.validateEntityId("entityIds", entityId);
        }
        InputSanitizer.validateRange("maxDepth", maxDepth, 1, 5);
    }

    /**
     * Per-node risk with neighborhood contribution. Only HIGH and CRITICAL neighbors
     * contribute, weighted 0.8 and 1.0 times the connecting edge's confidence.
     */
    static List<NodeRiskAssessment> assessNodeRisks(NetworkGraph graph, List<CentralityRecord> centrality) {
        Map<String, CentralityRecord> centralityById = new HashMap<>();
        for (CentralityRecord record : centrality) {
            centralityById.put(record.entityId(), record);
        }
        List<NodeRiskAssessment> assessments = new ArrayList<>();
        for (EntityNode node : graph.getNodes()) {
            List<RelationshipEdge> connections = graph.connectionsOf(node.getId());
            double contribution = 0.0;
            for (RelationshipEdge edge : connections) {
                Optional<EntityNode> neighbor = graph.getNode(edge.otherEnd(node.getId()));
                if (neighbor.isEmpty()) {
                    continue;
                }
                RiskLevel level = neighbor.get().getRiskLevel();
                if (level == RiskLevel.CRITICAL) {
                    contribution += edge.getConfidence() * CRITICAL_NEIGHBOR_WEIGHT;
                } else if (level == RiskLevel.HIGH) {
                    contribution += edge.getConfidence() * HIGH_NEIGHBOR_WEIGHT;
                }
            }
            double factor = connections.isEmpty()
                    ? 0.0
                    : Math.min(contribution / connections.size(), MAX_CONNECTION_RISK_FACTOR);
            double score = Math.min(node.getRiskScore() + factor, 1.0);
            CentralityRecord record = centralityById.get(node.getId());
            assessments.add(new NodeRiskAssessment(node.getId(), node.getRiskScore(), factor, score,
                    RiskLevel.fromScore(score), record != null ? record.centralityLevel() : null));
        }
        return assessments;
    }

    static List<String> recommendations(NetworkStatistics statistics, List<CircularRelationship> cycles) {
        List<String> recommendations = new ArrayList<>();
        if (statistics.totalRelationships() > 0 && statistics.verificationRate() < 0.5) {
            recommendations.add("Verify more relationships to improve network reliability");
        }
        if (statistics.highRiskRelationshipCount() > 0) {
            recommendations.add("Review high-risk relationships for compliance");
        }
        if (statistics.patternCount(RelationshipPattern.BENEFICIAL_OWNERSHIP) > 2) {
            recommendations.add("Investigate complex beneficial ownership structures");
        }
        if (statistics.density() > 0.8) {
            recommendations.add("High network density may indicate shell company structures");
        }
        if (!cycles.isEmpty()) {
            recommendations.add("Review circular relationships for layering or round-tripping");
        }
        return recommendations;
    }
}

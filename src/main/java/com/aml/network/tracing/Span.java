package com.aml.network.tracing;

import com.aml.network.core.model.NetworkPath;
import com.aml.network.core.model.NetworkGraph;

/**
 * A traced network operation. Ended automatically when used in a try-with-resources block.
 *
 * <pre>
 * try (Span span = tracingService.startSpan(NetworkOperation.BUILD, centerId)) {
 *     NetworkBuildResult build = builder.build(query);
 *     span.recordGraph(build.graph());
 *     span.markOk();
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    String ENTITY_ID = "network.entity_id";
    String TARGET_ENTITY_ID = "network.target_entity_id";
    String MAX_DEPTH = "network.max_depth";
    String NODES = "network.nodes";
    String EDGES = "network.edges";
    String PATH_FOUND = "network.path.found";
    String PATH_HOPS = "network.path.hops";
    String CACHE_HIT = "network.cache.hit";

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    /**
     * Records a failed component as a span event. The span status is left alone, since
     * one failed analyzer does not fail the whole operation.
     */
    void recordComponentError(String component, String message);

    void markOk();

    void markFailed(String reason);

    @Override
    void close();

    default void recordGraph(NetworkGraph graph) {
        setAttribute(NODES, graph.getTotalEntities());
        setAttribute(EDGES, graph.getTotalRelationships());
    }

    default void recordPath(NetworkPath path) {
        setAttribute(TARGET_ENTITY_ID, path.targetEntityId());
        setAttribute(PATH_FOUND, String.valueOf(path.found()));
        setAttribute(PATH_HOPS, path.hopCount());
    }
}

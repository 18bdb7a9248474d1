package com.aml.network.network;

import com.aml.network.core.model.NetworkGraph;

import java.util.Objects;

/**
 * Outcome of a network build. A failed build carries a zero-sized graph and the store
 * error; it is never signalled by an exception.
 *
 * @param graph  the built graph, empty when the build failed
 * @param status build status
 * @param error  store failure message, or null
 */
public record NetworkBuildResult(NetworkGraph graph, Status status, String error) {

    public enum Status { BUILT, FAILED }

    public NetworkBuildResult {
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(status, "status is required");
    }

    public static NetworkBuildResult built(NetworkGraph graph) {
        return new NetworkBuildResult(graph, Status.BUILT, null);
    }

    public static NetworkBuildResult failed(String centerEntityId, int maxDepth, String error) {
        return new NetworkBuildResult(NetworkGraph.empty(centerEntityId, maxDepth), Status.FAILED, error);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}

package com.aml.network.graph;

/**
 * A {@link GraphStore} call failed: the store is unreachable, the call timed out, or the
 * query could not be executed. Callers recover by returning an empty or partial result
 * with the error attached; this exception is never fatal to an analysis request.
 */
public class GraphStoreException extends RuntimeException {

    private final String operation;

    public GraphStoreException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public GraphStoreException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /**
     * The store operation that failed, e.g. {@code boundedTraversal}.
     */
    public String getOperation() {
        return operation;
    }
}

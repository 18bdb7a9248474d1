package com.aml.network.tracing;

/**
 * Interface for distributed tracing integration.
 * The default {@link NoOpTracingService} does nothing, so the library works without
 * any tracing backend configured.
 */
public interface TracingService {

    /**
     * Starts a span for {@code operation}, tagged with the entity it runs from.
     */
    Span startSpan(NetworkOperation operation, String entityId);
}

package com.aml.network.tracing;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * OpenTelemetry adapter for {@link TracingService}. Component failures become
 * {@value #COMPONENT_ERROR_EVENT} events on the operation's span.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String COMPONENT_ERROR_EVENT = "network.component.error";
    static final AttributeKey<String> COMPONENT = AttributeKey.stringKey("network.component");
    static final AttributeKey<String> ERROR_MESSAGE = AttributeKey.stringKey("network.error");

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(NetworkOperation operation, String entityId) {
        return new OTelSpan(tracer.spanBuilder(operation.spanName())
                .setAttribute(Span.ENTITY_ID, entityId)
                .startSpan());
    }

    private static final class OTelSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        OTelSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void recordComponentError(String component, String message) {
            delegate.addEvent(COMPONENT_ERROR_EVENT, Attributes.of(
                    COMPONENT, component,
                    ERROR_MESSAGE, message == null ? "unknown" : message));
        }

        @Override
        public void markOk() {
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void markFailed(String reason) {
            delegate.setStatus(StatusCode.ERROR, reason == null ? "unknown" : reason);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}

package com.aml.network.tracing;

import com.aml.network.core.model.NetworkPath;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycle() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan(NetworkOperation.BUILD, "E1")) {
                    span.setAttribute(Span.NODES, 12L);
                    span.recordComponentError("hubs", "store down");
                    span.recordPath(NetworkPath.notFound("E1", "E2", null));
                    span.markFailed("store down");
                }
            });
        }

        @Test
        @DisplayName("Should hand out one shared span")
        void sharedSpan() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan(NetworkOperation.BUILD, "E1"), noOp.startSpan(NetworkOperation.ANALYZE, "E2"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder spanBuilder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            spanBuilder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
            when(spanBuilder.setAttribute(anyString(), anyString())).thenReturn(spanBuilder);
            when(spanBuilder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Should name the span after the operation and tag the entity")
        void startsNamedSpan() {
            Span span = service.startSpan(NetworkOperation.ANALYZE, "E1");

            assertNotNull(span);
            verify(tracer).spanBuilder("network.analyze");
            verify(spanBuilder).setAttribute(Span.ENTITY_ID, "E1");
            verify(spanBuilder).startSpan();
        }

        @Test
        @DisplayName("Path outcome should be recorded under network attributes")
        void pathAttributes() {
            try (Span span = service.startSpan(NetworkOperation.PATH, "E1")) {
                span.recordPath(NetworkPath.notFound("E1", "E9", null));
                span.markOk();
            }

            verify(otelSpan).setAttribute(Span.TARGET_ENTITY_ID, "E9");
            verify(otelSpan).setAttribute(Span.PATH_FOUND, "false");
            verify(otelSpan).setAttribute(Span.PATH_HOPS, 0L);
            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).end();
        }

        @Test
        @DisplayName("Component errors should become events and leave the status alone")
        void componentErrorEvent() {
            try (Span span = service.startSpan(NetworkOperation.ANALYZE, "E1")) {
                span.recordComponentError("centrality", "timed out");
            }

            verify(otelSpan).addEvent(OpenTelemetryTracingService.COMPONENT_ERROR_EVENT, Attributes.of(
                    OpenTelemetryTracingService.COMPONENT, "centrality",
                    OpenTelemetryTracingService.ERROR_MESSAGE, "timed out"));
            verify(otelSpan, never()).setStatus(any(StatusCode.class));
            verify(otelSpan, never()).setStatus(any(StatusCode.class), anyString());
        }

        @Test
        @DisplayName("A failed operation should carry the reason in its error status")
        void failedStatus() {
            service.startSpan(NetworkOperation.BUILD, "E1").markFailed("traversal failed");

            verify(otelSpan).setStatus(StatusCode.ERROR, "traversal failed");
        }
    }
}

package com.aml.network.tracing;

/**
 * No-op implementation of {@link TracingService}; every span is a shared do-nothing instance.
 */
public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new NoOpSpan();

    @Override
    public Span startSpan(NetworkOperation operation, String entityId) {
        return NO_OP_SPAN;
    }

    private static class NoOpSpan implements Span {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void recordComponentError(String component, String message) {
        }

        @Override
        public void markOk() {
        }

        @Override
        public void markFailed(String reason) {
        }

        @Override
        public void close() {
        }
    }
}

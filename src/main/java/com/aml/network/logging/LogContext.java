package com.aml.network.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Keys added through this context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forAnalysis(correlationId, centerId)) {
 *     log.info("network.analyzed nodes={} edges={}", nodes, edges);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forAnalysis(String correlationId, String centerEntityId) {
        return forOperation("analyze", correlationId)
                .with("centerEntityId", centerEntityId);
    }

    public static LogContext forBuild(String correlationId, String centerEntityId) {
        return forOperation("build", correlationId)
                .with("centerEntityId", centerEntityId);
    }

    public static LogContext forPath(String correlationId, String sourceEntityId, String targetEntityId) {
        return forOperation("path", correlationId)
                .with("sourceEntityId", sourceEntityId)
                .with("targetEntityId", targetEntityId);
    }

    /**
     * Context for a standalone operation such as {@code centrality} or {@code hubs}.
     */
    public static LogContext forOperation(String operation, String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", operation);
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}

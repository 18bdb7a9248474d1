package com.aml.network.graph;

import com.aml.network.core.model.EntitySummary;
import com.aml.network.core.model.TraversalHop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorator that bounds every store call by a request deadline.
 *
 * <p>Each call runs on the supplied executor and waits at most the smaller of the
 * per-call timeout and the time left until the deadline. A timeout, interrupt or
 * delegate failure is rethrown as {@link GraphStoreException}, which callers treat as
 * a non-fatal store failure.</p>
 */
public class DeadlineGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(DeadlineGraphStore.class);

    private final GraphStore delegate;
    private final ExecutorService executor;
    private final Duration callTimeout;
    private final Instant deadline;
    private final Clock clock;

    public DeadlineGraphStore(GraphStore delegate, ExecutorService executor,
                              Duration callTimeout, Instant deadline) {
        this(delegate, executor, callTimeout, deadline, Clock.systemUTC());
    }

    DeadlineGraphStore(GraphStore delegate, ExecutorService executor,
                       Duration callTimeout, Instant deadline, Clock clock) {
        this.delegate = delegate;
        this.executor = executor;
        this.callTimeout = callTimeout;
        this.deadline = deadline;
        this.clock = clock;
    }

    @Override
    public List<TraversalHop> boundedTraversal(String centerId, int maxDepth, TraversalFilter filter) {
        return call("boundedTraversal", () -> delegate.boundedTraversal(centerId, maxDepth, filter));
    }

    @Override
    public Map<String, EntitySummary> batchLookupEntities(Collection<String> ids) {
        return call("batchLookupEntities", () -> delegate.batchLookupEntities(ids));
    }

    private <T> T call(String operation, Callable<T> task) {
        long remainingMs = Duration.between(clock.instant(), deadline).toMillis();
        long waitMs = Math.min(remainingMs, callTimeout.toMillis());
        if (waitMs <= 0) {
            throw new GraphStoreException(operation, "Request deadline exceeded before " + operation);
        }

        Future<T> future = executor.submit(task);
        try {
            return future.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Store call {} timed out after {}ms", operation, waitMs);
            throw new GraphStoreException(operation, operation + " timed out after " + waitMs + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new GraphStoreException(operation, operation + " was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GraphStoreException storeException) {
                throw storeException;
            }
            throw new GraphStoreException(operation, operation + " failed: " + cause.getMessage(), cause);
        }
    }
}

package com.entity.network.snapshot;

import com.entity.network.core.exception.NetworkAnalyticsException;
import com.entity.network.core.exception.StoreUnavailableException;
import com.entity.network.core.model.Entity;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.Scope;
import com.entity.network.store.GraphStore;
import com.entity.network.store.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loads every entity and relationship of a scope into an immutable {@link GraphSnapshot}.
 *
 * <p>Store reads run on an owned daemon pool so that a hung driver call is bounded by
 * {@link StoreConfig#readTimeout()}. When one read fails or times out the other is
 * cancelled and interrupted. Timeouts and driver failures surface as
 * {@link StoreUnavailableException}. Safe to call concurrently.</p>
 */
public class GraphBuilder implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final GraphStore store;
    private final StoreConfig config;
    private final Clock clock;
    private final ExecutorService executor;

    public GraphBuilder(GraphStore store) {
        this(store, StoreConfig.defaults(), Clock.systemUTC());
    }

    public GraphBuilder(GraphStore store, StoreConfig config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "graph-builder-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public GraphSnapshot load(Scope scope) {
        long start = System.nanoTime();
        Future<List<Entity>> entities = executor.submit(() -> store.findEntities(scope));
        Future<List<Relationship>> relationships = executor.submit(() -> store.findRelationships(scope));

        long deadline = start + config.readTimeout().toNanos();
        List<Entity> loadedEntities;
        List<Relationship> loadedRelationships;
        try {
            loadedEntities = await(scope, entities, deadline);
            loadedRelationships = await(scope, relationships, deadline);
        } catch (RuntimeException e) {
            // Interrupts whichever read is still running
            entities.cancel(true);
            relationships.cancel(true);
            throw e;
        }

        GraphSnapshot snapshot = GraphSnapshot.of(scope, loadedEntities, loadedRelationships, clock.instant());
        log.info("snapshot.loaded scope={} nodes={} edges={} durationMs={}",
                scope, snapshot.nodeCount(), snapshot.edgeCount(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return snapshot;
    }

    private <T> T await(Scope scope, Future<T> future, long deadlineNanos) {
        long remaining = Math.max(0, deadlineNanos - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("snapshot.load.timeout scope={} timeoutMs={}", scope, config.readTimeout().toMillis());
            throw new StoreUnavailableException("Store read for scope " + scope + " timed out after "
                    + config.readTimeout().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while loading scope " + scope, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StoreUnavailableException sue) {
                throw sue;
            }
            if (cause instanceof NetworkAnalyticsException nae) {
                throw nae;
            }
            log.warn("snapshot.load.failed scope={} error={}", scope, cause.getMessage());
            throw new StoreUnavailableException("Store read for scope " + scope + " failed: "
                    + cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}

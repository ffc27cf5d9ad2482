package com.entity.network.cache;

import com.entity.network.core.exception.ComputationTimeoutException;
import com.entity.network.core.exception.NetworkAnalyticsException;
import com.entity.network.core.model.Scope;
import com.entity.network.metrics.MetricsService;
import com.entity.network.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Caffeine-backed cache of analytics results, one cache per {@link CacheTier}.
 *
 * <p>Every (scope, tier) pair carries an invalidation generation. An entry is only
 * served while its generation is current, so nothing computed before an
 * invalidation is returned after it, whatever its remaining TTL. Generations are
 * drawn from one counter shared by all pairs, so a pair's state can be dropped once
 * it has been idle for longer than the longest TTL and recreated later without
 * ever matching an older entry.</p>
 *
 * <p>An entry is stale only once its age exceeds the tier TTL; a read at exactly
 * the TTL is still a hit.</p>
 *
 * <p>Concurrent misses on the same key and generation are coalesced: one caller runs
 * the loader and the others wait for its result, up to {@link CacheConfig#waitTimeout()}.
 * Loader failures reach every waiter and are not cached.</p>
 *
 * <p>Implements {@link MutationListener} so stores and discovery can invalidate a
 * scope directly after a committed write.</p>
 */
public class AnalyticsCache implements MutationListener {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsCache.class);

    private final CacheConfig config;
    private final MetricsService metrics;
    private final Ticker ticker;
    private final Clock clock;
    private final Map<CacheTier, Cache<CacheKey, CacheEntry>> tiers = new EnumMap<>(CacheTier.class);
    private final Cache<TierSlot, TierState> states;
    private final AtomicLong generations = new AtomicLong();
    private final ConcurrentMap<Flight, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder loads = new LongAdder();
    private final LongAdder coalesced = new LongAdder();

    public AnalyticsCache(CacheConfig config) {
        this(config, new NoOpMetricsService());
    }

    public AnalyticsCache(CacheConfig config, MetricsService metrics) {
        this(config, metrics, Ticker.systemTicker(), Clock.systemUTC());
    }

    public AnalyticsCache(CacheConfig config, MetricsService metrics, Ticker ticker, Clock clock) {
        this.config = config;
        this.metrics = metrics;
        this.ticker = ticker;
        this.clock = clock;
        Duration longestTtl = Duration.ZERO;
        for (CacheTier tier : CacheTier.values()) {
            if (config.ttl(tier).compareTo(longestTtl) > 0) {
                longestTtl = config.ttl(tier);
            }
            // Caffeine expires at age >= duration
            tiers.put(tier, Caffeine.newBuilder()
                    .maximumSize(config.maxSize())
                    .expireAfterWrite(config.ttl(tier).plusNanos(1))
                    .ticker(ticker)
                    .executor(Runnable::run)
                    .recordStats()
                    .build());
        }
        this.states = Caffeine.newBuilder()
                .expireAfterAccess(longestTtl.plusNanos(1))
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
        log.info("AnalyticsCache initialized: enabled={}, maxSize={}, snapshotTtl={}s, layoutTtl={}s, clusterTtl={}s",
                config.enabled(), config.maxSize(), config.snapshotTtl().toSeconds(),
                config.layoutTtl().toSeconds(), config.clusterTtl().toSeconds());
    }

    public CacheConfig config() {
        return config;
    }

    /**
     * Returns the cached value for {@code key}, or computes it with {@code loader}.
     *
     * @throws ComputationTimeoutException if waiting on another caller's computation
     *                                     exceeds {@link CacheConfig#waitTimeout()}
     */
    @SuppressWarnings("unchecked")
    public <V> V get(CacheKey key, Supplier<? extends V> loader) {
        TierState state = state(key.scope(), key.tier());
        if (!config.enabled()) {
            recordMiss(key.tier(), state);
            return loader.get();
        }
        long generation = state.generation.get();
        CacheEntry entry = tiers.get(key.tier()).getIfPresent(key);
        if (entry != null && entry.generation() == generation) {
            recordHit(key.tier(), state);
            return (V) entry.value();
        }
        recordMiss(key.tier(), state);

        Flight flightKey = new Flight(key, generation);
        CompletableFuture<Object> flight = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(flightKey, flight);
        if (existing != null) {
            coalesced.increment();
            log.debug("cache.coalesced key={} generation={}", key, generation);
            return (V) await(key, existing);
        }
        return (V) load(key, loader, state, generation, flightKey, flight);
    }

    private Object load(CacheKey key, Supplier<?> loader, TierState state, long generation,
                        Flight flightKey, CompletableFuture<Object> flight) {
        long start = ticker.read();
        loads.increment();
        try {
            Object value = Objects.requireNonNull(loader.get(), "loader returned null for " + key);
            long loadedAtNanos = ticker.read();
            CacheEntry entry = new CacheEntry(value, key, clock.instant(), loadedAtNanos, generation);
            Cache<CacheKey, CacheEntry> cache = tiers.get(key.tier());
            if (state.generation.get() == generation) {
                cache.put(key, entry);
                // An invalidation may have landed between the check and the put
                if (state.generation.get() != generation) {
                    cache.asMap().remove(key, entry);
                }
            }
            Duration elapsed = Duration.ofNanos(loadedAtNanos - start);
            metrics.recordCacheLoad(key.tier(), elapsed, true);
            log.debug("cache.loaded key={} generation={} durationMs={}", key, generation, elapsed.toMillis());
            flight.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            metrics.recordCacheLoad(key.tier(), Duration.ofNanos(ticker.read() - start), false);
            log.warn("cache.load.failed key={} error={}", key, e.getMessage());
            flight.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(flightKey, flight);
        }
    }

    private Object await(CacheKey key, CompletableFuture<Object> flight) {
        long timeoutMs = config.waitTimeout().toMillis();
        try {
            return flight.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ComputationTimeoutException(
                    "Waited more than " + timeoutMs + "ms for recomputation of " + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new NetworkAnalyticsException("Recomputation of " + key + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputationTimeoutException("Interrupted while waiting for recomputation of " + key, e);
        }
    }

    /**
     * Returns the value cached for {@code key} if present and current, without loading.
     */
    @SuppressWarnings("unchecked")
    public <V> Optional<V> getIfPresent(CacheKey key) {
        TierState state = states.getIfPresent(new TierSlot(key.scope(), key.tier()));
        CacheEntry entry = tiers.get(key.tier()).getIfPresent(key);
        if (state == null || entry == null || entry.generation() != state.generation.get()) {
            return Optional.empty();
        }
        return Optional.of((V) entry.value());
    }

    /**
     * Invalidates every tier of the scope.
     */
    public void invalidate(Scope scope) {
        invalidate(scope, CacheTier.SNAPSHOT);
    }

    /**
     * Invalidates one tier of the scope and every tier derived from it.
     */
    public void invalidate(Scope scope, CacheTier tier) {
        for (CacheTier target : tier.withDependents()) {
            state(scope, target).generation.set(generations.incrementAndGet());
            tiers.get(target).asMap().keySet().removeIf(k -> k.scope().equals(scope));
            metrics.recordCacheInvalidation(target);
        }
        log.debug("cache.invalidated scope={} tiers={}", scope, tier.withDependents());
    }

    public void invalidateAll() {
        states.asMap().values().forEach(state -> state.generation.set(generations.incrementAndGet()));
        tiers.values().forEach(Cache::invalidateAll);
        log.debug("cache.invalidated.all");
    }

    @Override
    public void onMutation(Scope scope) {
        invalidate(scope);
    }

    public CacheStatus status(Scope scope) {
        Map<CacheTier, TierStatus> result = new EnumMap<>(CacheTier.class);
        long now = ticker.read();
        for (CacheTier tier : CacheTier.values()) {
            TierState state = states.getIfPresent(new TierSlot(scope, tier));
            long generation = state != null ? state.generation.get() : 0L;
            int entries = 0;
            long youngest = Long.MAX_VALUE;
            for (CacheEntry entry : tiers.get(tier).asMap().values()) {
                if (entry.key().scope().equals(scope) && entry.generation() == generation) {
                    entries++;
                    youngest = Math.min(youngest, now - entry.loadedAtNanos());
                }
            }
            Optional<Duration> age = entries > 0 ? Optional.of(Duration.ofNanos(youngest)) : Optional.empty();
            result.put(tier, state == null
                    ? new TierStatus(tier, entries, age, 0, 0, AccessOutcome.NONE, generation)
                    : new TierStatus(tier, entries, age, state.hits.sum(), state.misses.sum(),
                    state.lastAccess, generation));
        }
        return new CacheStatus(scope, result);
    }

    public CacheStats stats() {
        long evictions = 0;
        long size = 0;
        for (Cache<CacheKey, CacheEntry> cache : tiers.values()) {
            evictions += cache.stats().evictionCount();
            size += cache.estimatedSize();
        }
        return new CacheStats(hits.sum(), misses.sum(), loads.sum(), coalesced.sum(), evictions, size);
    }

    /**
     * Runs pending expiry and eviction work, including dropping idle scope state.
     */
    public void cleanUp() {
        tiers.values().forEach(Cache::cleanUp);
        states.cleanUp();
    }

    /**
     * Number of (scope, tier) pairs whose invalidation state is currently held.
     */
    long trackedSlots() {
        return states.estimatedSize();
    }

    private TierState state(Scope scope, CacheTier tier) {
        return states.get(new TierSlot(scope, tier), slot -> new TierState(generations.incrementAndGet()));
    }

    private void recordHit(CacheTier tier, TierState state) {
        hits.increment();
        state.hits.increment();
        state.lastAccess = AccessOutcome.HIT;
        metrics.recordCacheHit(tier);
    }

    private void recordMiss(CacheTier tier, TierState state) {
        misses.increment();
        state.misses.increment();
        state.lastAccess = AccessOutcome.MISS;
        metrics.recordCacheMiss(tier);
    }

    private record TierSlot(Scope scope, CacheTier tier) {
    }

    private record Flight(CacheKey key, long generation) {
    }

    private static final class TierState {
        final AtomicLong generation;
        final LongAdder hits = new LongAdder();
        final LongAdder misses = new LongAdder();
        volatile AccessOutcome lastAccess = AccessOutcome.NONE;

        TierState(long generation) {
            this.generation = new AtomicLong(generation);
        }
    }
}

package com.tokenmetadata.common;

import com.github.benmanes.caffeine.cache.Cache;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Bounded cache with single-flight computation per key.
 *
 * <p>Completed values live in a size-bounded Caffeine cache. Computations in progress live in a separate
 * map of shared futures, so a key being computed is never subject to eviction. The first caller for an
 * absent key installs a future and runs the computation; concurrent callers for the same key wait on that
 * future. A failed computation is not cached: its waiters see the failure and the next caller recomputes.
 */
public class SingleFlightCache<K, V> {

    private final Cache<K, V> completed;
    private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong joins = new AtomicLong();

    public SingleFlightCache(Cache<K, V> completed) {
        this.completed = Objects.requireNonNull(completed, "completed");
    }

    /**
     * Returns the cached value for {@code key}, or computes it exactly once among concurrent callers.
     *
     * @throws RuntimeException whatever {@code compute} threw, for the computing caller and all waiters
     */
    public V getOrCompute(K key, Supplier<V> compute) {
        Objects.requireNonNull(key, "key");
        V cached = completed.getIfPresent(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }

        CompletableFuture<V> mine = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            joins.incrementAndGet();
            return await(existing);
        }

        try {
            // another caller may have finished between the cache check and installing our future
            V raced = completed.getIfPresent(key);
            if (raced != null) {
                hits.incrementAndGet();
                mine.complete(raced);
                return raced;
            }
            misses.incrementAndGet();
            V value = Objects.requireNonNull(compute.get(), "computed value");
            completed.put(key, value);
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    V getIfPresent(K key) {
        return completed.getIfPresent(key);
    }

    boolean isInFlight(K key) {
        return inFlight.containsKey(key);
    }

    int inFlightCount() {
        return inFlight.size();
    }

    public long estimatedSize() {
        completed.cleanUp();
        return completed.estimatedSize();
    }

    public Stats stats() {
        return new Stats(hits.get(), misses.get(), joins.get());
    }

    private static <V> V await(CompletableFuture<V> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    /**
     * Hits served from the cache, misses that ran the computation, joins that waited on another caller.
     */
    public record Stats(long hits, long misses, long joins) {
    }
}

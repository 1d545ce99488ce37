package com.rpcgateway.common;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Thread-safe map with atomic load-or-create semantics where creation may fail.
 * <p>
 * At most one creation per key is in flight. Callers that ask for a key while its creation is running share
 * the outcome (value or failure) instead of starting their own. A failed creation is forgotten before its
 * waiters are notified, so the next call for that key starts a fresh attempt. Successful values stay cached
 * for the lifetime of the map.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class ConcurrentLoadingMap<K, V> {

    private final ConcurrentMap<K, CompletableFuture<V>> entries = new ConcurrentHashMap<>();
    private final Executor executor;

    /**
     * @param executor runs value factories; use a direct executor ({@code Runnable::run}) to create inline
     */
    public ConcurrentLoadingMap(Executor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor required");
        }
        this.executor = executor;
    }

    /**
     * Returns the value for {@code key}, creating it with {@code factory} if absent.
     * <p>
     * Every caller gets its own dependent future: cancelling it or letting it time out leaves the shared
     * creation running, so the value still lands in the map for later callers.
     */
    public CompletableFuture<Loaded<V>> loadOrCreateAsync(K key, ValueFactory<K, V> factory) {
        CompletableFuture<V> existing = entries.get(key);
        if (existing != null) {
            return existing.thenApply(v -> new Loaded<>(v, false));
        }
        CompletableFuture<V> creation = new CompletableFuture<>();
        existing = entries.putIfAbsent(key, creation);
        if (existing != null) {
            return existing.thenApply(v -> new Loaded<>(v, false));
        }
        try {
            executor.execute(() -> create(key, factory, creation));
        } catch (RejectedExecutionException e) {
            fail(key, creation, e);
        }
        return creation.thenApply(v -> new Loaded<>(v, true));
    }

    /**
     * Blocking variant of {@link #loadOrCreateAsync}. Rethrows the factory failure as is when unchecked,
     * wrapped in {@link CompletionException} otherwise.
     */
    public Loaded<V> loadOrCreate(K key, ValueFactory<K, V> factory) {
        try {
            return loadOrCreateAsync(key, factory).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted while waiting for " + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new CompletionException(cause);
        }
    }

    /**
     * Value for {@code key} if its creation has completed successfully.
     */
    public Optional<V> get(K key) {
        CompletableFuture<V> f = entries.get(key);
        if (f == null || !f.isDone() || f.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.ofNullable(f.getNow(null));
    }

    /** Keys with a cached value or a creation in flight. */
    public Set<K> keys() {
        return Set.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    private void create(K key, ValueFactory<K, V> factory, CompletableFuture<V> creation) {
        V value;
        try {
            value = factory.create(key);
        } catch (Throwable t) {
            fail(key, creation, t);
            return;
        }
        if (value == null) {
            fail(key, creation, new IllegalStateException("Factory returned null for " + key));
            return;
        }
        creation.complete(value);
    }

    private void fail(K key, CompletableFuture<V> creation, Throwable cause) {
        entries.remove(key, creation);
        creation.completeExceptionally(cause);
    }

    /**
     * Creates the value for a key. May block on I/O; runs on the map's executor.
     */
    @FunctionalInterface
    public interface ValueFactory<K, V> {
        V create(K key) throws Exception;
    }

    /**
     * A value and whether the calling request started its creation.
     */
    public record Loaded<V>(V value, boolean created) {}
}

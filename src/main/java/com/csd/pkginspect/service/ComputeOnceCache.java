package com.csd.pkginspect.service;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Read-through cache with at-most-one computation per key. Concurrent callers asking for a key that
 * is being computed wait for that computation instead of starting a second one. Failed computations
 * are not cached.
 */
@Slf4j
public class ComputeOnceCache<K, V> {

    private final String name;
    private final ConcurrentMap<K, CompletableFuture<V>> entries = new ConcurrentHashMap<>();

    public ComputeOnceCache(String name) {
        this.name = name;
    }

    public V get(K key, Function<? super K, ? extends V> loader) {
        CompletableFuture<V> future = entries.get(key);
        if (future != null) {
            log.debug("Cache hit in {} for {}", name, key);
            return await(future);
        }
        CompletableFuture<V> created = new CompletableFuture<>();
        future = entries.putIfAbsent(key, created);
        if (future != null) {
            return await(future);
        }
        try {
            log.debug("Computing {} entry for {}", name, key);
            created.complete(loader.apply(key));
        } catch (RuntimeException | Error e) {
            entries.remove(key, created);
            created.completeExceptionally(e);
            throw e;
        }
        return await(created);
    }

    public Optional<V> getIfPresent(K key) {
        CompletableFuture<V> future = entries.get(key);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.ofNullable(future.join());
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
        log.info("{} cache cleared", name);
    }

    private V await(CompletableFuture<V> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + name + " entry", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(name + " computation failed", cause);
        }
    }
}

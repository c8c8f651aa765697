package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.OperationTimeoutException;
import com.csd.pkginspect.exception.PkgInspectException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Bounded pool for independent, order-preserving map operations. Each task writes only its own
 * result slot; results come back in input order.
 */
@Slf4j
@Component
public class WorkerPool implements AutoCloseable {

    private final ExecutorService executor;
    private final Duration defaultTimeout;

    public WorkerPool(@Value("${pkginspect.workers:8}") int workers,
                      @Value("${pkginspect.timeout-seconds:300}") long defaultTimeoutSeconds) {
        if (workers < 1) {
            throw new IllegalArgumentException("pkginspect.workers must be a positive integer, got " + workers);
        }
        this.defaultTimeout = Duration.ofSeconds(defaultTimeoutSeconds);
        this.executor = Executors.newFixedThreadPool(workers, namedThreads());
        log.info("Worker pool started with {} workers", workers);
    }

    public <T, R> List<R> map(List<T> items, Function<? super T, ? extends R> task) {
        return map(items, task, defaultTimeout);
    }

    public <T, R> List<R> map(List<T> items, Function<? super T, ? extends R> task, Duration timeout) {
        if (items.isEmpty()) {
            return List.of();
        }
        List<Callable<R>> callables = new ArrayList<>(items.size());
        for (T item : items) {
            callables.add(() -> task.apply(item));
        }
        List<Future<R>> futures;
        try {
            futures = executor.invokeAll(callables, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException("Interrupted while waiting for " + items.size() + " tasks", e);
        }
        List<R> results = new ArrayList<>(futures.size());
        for (Future<R> future : futures) {
            results.add(collect(future, timeout));
        }
        return results;
    }

    private <R> R collect(Future<R> future, Duration timeout) {
        try {
            return future.get();
        } catch (CancellationException e) {
            throw new OperationTimeoutException("Task did not finish within " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException("Interrupted while collecting task results", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new PkgInspectException("Worker task failed: " + cause.getMessage(), cause);
        }
    }

    @PreDestroy
    @Override
    public void close() {
        executor.shutdownNow();
        log.debug("Worker pool stopped");
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "pkg-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

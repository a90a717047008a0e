package com.paxkun.mangaha.service.support;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * AutoCloseableExecutor is a wrapper for ExecutorService implementing AutoCloseable,
 * allowing use in try-with-resources blocks so a worker pool never outlives the
 * operation that created it.
 *
 * Usage Example:
 * <pre>
 * try (AutoCloseableExecutor pool = AutoCloseableExecutor.fixed("catalog", 5)) {
 *     pool.executor().submit(() -> { ... });
 * }
 * </pre>
 *
 * Author: Pax
 */
@Slf4j
public record AutoCloseableExecutor(ExecutorService executor, Duration shutdownTimeout) implements AutoCloseable {

    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofMinutes(10);

    public AutoCloseableExecutor(ExecutorService executor) {
        this(executor, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * Fixed pool of {@code threads} daemon workers named {@code <name>-<n>}.
     */
    public static AutoCloseableExecutor fixed(String name, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1, got " + threads);
        }
        ExecutorService pool = Executors.newFixedThreadPool(threads, new NamedThreadFactory(name));
        return new AutoCloseableExecutor(pool);
    }

    /**
     * Stops accepting work and waits for submitted tasks to finish.
     * If interrupted or the timeout passes, forces shutdown immediately.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("⚠️ Executor did not terminate within {}s, forced shutdown.", shutdownTimeout.toSeconds());
            } else {
                log.debug("✅ Executor shutdown cleanly.");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            log.error("❌ Executor shutdown interrupted: {}", e.getMessage(), e);
        }
    }
}

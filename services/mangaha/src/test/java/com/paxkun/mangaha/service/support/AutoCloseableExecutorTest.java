package com.paxkun.mangaha.service.support;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutoCloseableExecutorTest {

    @Test
    void closeWaitsForSubmittedWork() throws Exception {
        AtomicBoolean finished = new AtomicBoolean();
        Future<String> threadName;
        ExecutorService executor;

        try (AutoCloseableExecutor pool = AutoCloseableExecutor.fixed("test-pool", 2)) {
            executor = pool.executor();
            threadName = executor.submit(() -> Thread.currentThread().getName());
            executor.submit(() -> {
                Thread.sleep(100);
                finished.set(true);
                return null;
            });
        }

        assertThat(finished).isTrue();
        assertThat(executor.isTerminated()).isTrue();
        assertThat(threadName.get()).startsWith("test-pool-");
    }

    @Test
    void closeForcesShutdownAfterTimeout() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        AutoCloseableExecutor pool = new AutoCloseableExecutor(
                Executors.newSingleThreadExecutor(), Duration.ofMillis(50));
        pool.executor().submit(() -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        });
        started.await();

        pool.close();

        assertThat(pool.executor().isShutdown()).isTrue();
        Thread.sleep(100);
        assertThat(interrupted).isTrue();
    }

    @Test
    void rejectsEmptyPool() {
        assertThatThrownBy(() -> AutoCloseableExecutor.fixed("none", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.rpcgateway.common;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrentLoadingMapTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("first call creates, later calls reuse the cached value")
    void createsOnceThenReuses() {
        ConcurrentLoadingMap<String, String> map = new ConcurrentLoadingMap<>(Runnable::run);
        AtomicInteger calls = new AtomicInteger();

        ConcurrentLoadingMap.Loaded<String> first = map.loadOrCreate("a", k -> k + calls.incrementAndGet());
        ConcurrentLoadingMap.Loaded<String> second = map.loadOrCreate("a", k -> k + calls.incrementAndGet());

        assertThat(first.created()).isTrue();
        assertThat(second.created()).isFalse();
        assertThat(second.value()).isEqualTo("a1");
        assertThat(calls.get()).isEqualTo(1);
        assertThat(map.get("a")).contains("a1");
        assertThat(map.keys()).containsExactly("a");
    }

    @Test
    @DisplayName("concurrent callers for one key share a single creation")
    void concurrentCallersShareCreation() throws Exception {
        ConcurrentLoadingMap<String, Integer> map = new ConcurrentLoadingMap<>(executor);
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ConcurrentLoadingMap.ValueFactory<String, Integer> slow = k -> {
            release.await(5, TimeUnit.SECONDS);
            return calls.incrementAndGet();
        };

        List<CompletableFuture<ConcurrentLoadingMap.Loaded<Integer>>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            futures.add(map.loadOrCreateAsync("node", slow));
        }
        release.countDown();

        int created = 0;
        for (CompletableFuture<ConcurrentLoadingMap.Loaded<Integer>> f : futures) {
            ConcurrentLoadingMap.Loaded<Integer> loaded = f.get(5, TimeUnit.SECONDS);
            assertThat(loaded.value()).isEqualTo(1);
            if (loaded.created()) {
                created++;
            }
        }
        assertThat(calls.get()).isEqualTo(1);
        assertThat(created).isEqualTo(1);
    }

    @Test
    @DisplayName("failed creation is not cached and the next call retries")
    void failureIsNotCached() {
        ConcurrentLoadingMap<String, String> map = new ConcurrentLoadingMap<>(Runnable::run);

        assertThatThrownBy(() -> map.loadOrCreate("a", k -> {
            throw new IllegalStateException("down");
        })).isInstanceOf(IllegalStateException.class).hasMessage("down");
        assertThat(map.size()).isZero();
        assertThat(map.get("a")).isEmpty();

        ConcurrentLoadingMap.Loaded<String> retried = map.loadOrCreate("a", k -> "up");
        assertThat(retried.created()).isTrue();
        assertThat(retried.value()).isEqualTo("up");
    }

    @Test
    @DisplayName("checked factory failure is wrapped, null value counts as failure")
    void checkedFailureAndNullValue() {
        ConcurrentLoadingMap<String, String> map = new ConcurrentLoadingMap<>(Runnable::run);

        assertThatThrownBy(() -> map.loadOrCreate("a", k -> {
            throw new IOException("refused");
        })).hasCauseInstanceOf(IOException.class);
        assertThatThrownBy(() -> map.loadOrCreate("b", k -> null))
                .isInstanceOf(IllegalStateException.class);
        assertThat(map.size()).isZero();
    }

    @Test
    @DisplayName("cancelling one caller's future leaves the shared creation running")
    void cancellationDoesNotAbortCreation() throws Exception {
        ConcurrentLoadingMap<String, String> map = new ConcurrentLoadingMap<>(executor);
        CountDownLatch release = new CountDownLatch(1);
        ConcurrentLoadingMap.ValueFactory<String, String> slow = k -> {
            release.await(5, TimeUnit.SECONDS);
            return "client";
        };

        CompletableFuture<ConcurrentLoadingMap.Loaded<String>> abandoned = map.loadOrCreateAsync("n", slow);
        CompletableFuture<ConcurrentLoadingMap.Loaded<String>> waiting = map.loadOrCreateAsync("n", slow);
        abandoned.cancel(true);
        release.countDown();

        assertThat(waiting.get(5, TimeUnit.SECONDS).value()).isEqualTo("client");
        assertThat(map.get("n")).contains("client");
    }

    @Test
    @DisplayName("rejected execution fails the call and frees the key")
    void rejectedExecution() {
        ExecutorService stopped = Executors.newSingleThreadExecutor();
        stopped.shutdown();
        ConcurrentLoadingMap<String, String> map = new ConcurrentLoadingMap<>(stopped);

        assertThat(map.loadOrCreateAsync("a", k -> "v")).isCompletedExceptionally();
        assertThat(map.size()).isZero();
    }
}

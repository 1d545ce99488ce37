package com.rpcgateway.node;

import com.rpcgateway.common.ConcurrentLoadingMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ClientProviderTest {

    private static final String NODE_URL = "http://user:pw@node1:12537/";

    private final ExecutorService connectExecutor = Executors.newFixedThreadPool(4);

    @Mock
    private ClientFactory<String> factory;
    @Mock
    private Router router;

    @AfterEach
    void shutdown() {
        connectExecutor.shutdownNow();
    }

    @Test
    @DisplayName("concurrent calls for one node invoke the factory once and share the client")
    void atMostOneCreation() throws Exception {
        AtomicInteger creations = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ClientFactory<String> blocking = url -> {
            release.await(5, TimeUnit.SECONDS);
            return "client-" + creations.incrementAndGet();
        };
        ClientProvider<String> provider = provider(fixedRouter(NODE_URL), blocking, Duration.ofSeconds(5));

        List<CompletableFuture<String>> calls = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            calls.add(provider.getClientAsync("10.0.0." + i, Group.CFX_HTTP));
        }
        release.countDown();

        for (CompletableFuture<String> call : calls) {
            assertThat(call.get(5, TimeUnit.SECONDS)).isEqualTo("client-1");
        }
        assertThat(creations.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("concurrent calls for one node share a single connection failure")
    void concurrentCallersShareFailure() throws Exception {
        AtomicInteger creations = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ClientFactory<String> failing = url -> {
            creations.incrementAndGet();
            release.await(5, TimeUnit.SECONDS);
            throw new IllegalStateException("connection refused");
        };
        ClientProvider<String> provider = provider(fixedRouter(NODE_URL), failing, Duration.ofSeconds(5));

        List<CompletableFuture<String>> calls = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            calls.add(provider.getClientAsync("10.0.0." + i, Group.CFX_HTTP));
        }
        release.countDown();

        Set<Throwable> rootCauses = Collections.newSetFromMap(new IdentityHashMap<>());
        for (CompletableFuture<String> call : calls) {
            assertThatThrownBy(() -> call.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause()
                    .isInstanceOf(UpstreamConnectException.class)
                    .hasRootCauseMessage("connection refused");
            Throwable cause = call.handle((client, error) -> error).get();
            while (cause.getCause() != null) {
                cause = cause.getCause();
            }
            rootCauses.add(cause);
        }
        assertThat(creations.get()).isEqualTo(1);
        assertThat(rootCauses).hasSize(1);
    }

    @Test
    @DisplayName("concurrent group registration yields one pool")
    void groupRegistrationIsIdempotent() throws Exception {
        ClientProvider<String> provider = provider(fixedRouter(NODE_URL), url -> "c", Duration.ofSeconds(1));
        Group group = new Group("archive");
        Set<ConcurrentLoadingMap<String, String>> pools = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<Void>> done = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                done.add(CompletableFuture.runAsync(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    pools.add(provider.registerGroup(group));
                }, callers));
            }
            start.countDown();
            CompletableFuture.allOf(done.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
        } finally {
            callers.shutdownNow();
        }

        assertThat(pools).hasSize(1);
        assertThat(provider.registerGroup(group)).isSameAs(pools.iterator().next());
        assertThat(provider.groups()).contains(group, Group.CFX_HTTP, Group.CFX_LOGS);
    }

    @Test
    @DisplayName("empty route fails with no upstream and never calls the factory")
    void noRouteNoFactoryCall() {
        ClientProvider<String> provider = provider((group, key) -> Optional.empty(), factory, Duration.ofSeconds(1));

        assertThatThrownBy(() -> provider.getClient("1.2.3.4", Group.CFX_HTTP))
                .isInstanceOf(NoUpstreamAvailableException.class);
        verifyNoInteractions(factory);
    }

    @Test
    @DisplayName("unregistered group fails without routing or connecting")
    void unknownGroup() {
        ClientProvider<String> provider = provider(router, factory, Duration.ofSeconds(1));

        assertThatThrownBy(() -> provider.getClient("1.2.3.4", new Group("unregistered")))
                .isInstanceOf(UnknownGroupException.class);
        verify(router, never()).route(any(), any());
        verifyNoInteractions(factory);
    }

    @Test
    @DisplayName("a failed connection is retried by the next call")
    void retryAfterFailure() {
        AtomicInteger attempts = new AtomicInteger();
        ClientFactory<String> flaky = url -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("connection refused");
            }
            return "client";
        };
        ClientProvider<String> provider = provider(fixedRouter(NODE_URL), flaky, Duration.ofSeconds(5));

        assertThatThrownBy(() -> provider.getClient("1.2.3.4", Group.CFX_HTTP))
                .isInstanceOf(UpstreamConnectException.class)
                .hasMessageContaining("node1:12537")
                .hasMessageNotContaining("pw")
                .hasRootCauseMessage("connection refused");

        assertThat(provider.getClient("1.2.3.4", Group.CFX_HTTP)).isEqualTo("client");
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("caller gives up after the connect timeout while creation completes in the background")
    void connectTimeoutKeepsCreationRunning() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger creations = new AtomicInteger();
        ClientFactory<String> slow = url -> {
            release.await(5, TimeUnit.SECONDS);
            creations.incrementAndGet();
            return "late-client";
        };
        ClientProvider<String> provider = provider(fixedRouter(NODE_URL), slow, Duration.ofMillis(50));

        assertThatThrownBy(() -> provider.getClient("1.2.3.4", Group.CFX_HTTP))
                .isInstanceOf(UpstreamConnectException.class)
                .hasMessageContaining("no connection within 50ms");

        release.countDown();
        CompletableFuture<String> next = null;
        for (int i = 0; i < 50 && (next == null || next.isCompletedExceptionally()); i++) {
            next = provider.getClientAsync("1.2.3.4", Group.CFX_HTTP);
            try {
                next.get(1, TimeUnit.SECONDS);
            } catch (Exception e) {
                Thread.sleep(20);
            }
        }
        assertThat(next.get(1, TimeUnit.SECONDS)).isEqualTo("late-client");
        assertThat(creations.get()).isEqualTo(1);
    }

    @Test
    void methodsMapToTheirGroup() {
        ClientProvider<String> provider = provider(fixedRouter(NODE_URL), url -> "c", Duration.ofSeconds(1));

        assertThat(provider.groupFor("cfx_getLogs")).isEqualTo(Group.CFX_LOGS);
        assertThat(provider.groupFor("cfx_getBalance")).isEqualTo(Group.CFX_HTTP);
    }

    @Test
    void urlsOfOneNodeShareAClient() throws Exception {
        AtomicInteger creations = new AtomicInteger();
        String[] urls = {"http://Node1:12537", "http://node1:12537/"};
        AtomicInteger next = new AtomicInteger();
        Router alternating = (group, key) -> Optional.of(urls[next.getAndIncrement() % 2]);
        ClientProvider<String> provider = provider(alternating, url -> "c" + creations.incrementAndGet(), Duration.ofSeconds(1));

        assertThat(provider.getClient("a", Group.CFX_HTTP)).isEqualTo("c1");
        assertThat(provider.getClient("b", Group.CFX_HTTP)).isEqualTo("c1");
        assertThat(creations.get()).isEqualTo(1);
    }

    private ClientProvider<String> provider(Router router, ClientFactory<String> factory, Duration connectTimeout) {
        return new ClientProvider<>(router, factory, connectExecutor, connectTimeout,
                Group.CFX_HTTP, Map.of("cfx_getLogs", Group.CFX_LOGS));
    }

    private static Router fixedRouter(String url) {
        return (group, key) -> Optional.of(url);
    }
}

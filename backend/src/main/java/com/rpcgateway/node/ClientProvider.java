package com.rpcgateway.node;

import com.rpcgateway.common.ConcurrentLoadingMap;
import com.rpcgateway.common.NodeNames;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Provides full node clients by routing key (caller IP) and node group, for load balancing and resource
 * isolation. One pool of clients per group, one client per node, created on first use and reused for the
 * lifetime of the provider.
 *
 * @param <C> client type of the space
 */
@Slf4j
public class ClientProvider<C> {

    private final Router router;
    private final ClientFactory<C> factory;
    private final Executor connectExecutor;
    private final Duration connectTimeout;
    private final Group defaultGroup;
    private final Map<String, Group> methodGroups;

    // group => node name => client
    private final ConcurrentMap<Group, ConcurrentLoadingMap<String, C>> clients = new ConcurrentHashMap<>();

    /**
     * @param connectExecutor runs client creation off the caller's thread
     * @param connectTimeout  how long a caller waits for a client being created
     * @param defaultGroup    group serving methods without an entry in {@code methodGroups}
     * @param methodGroups    method name → group, e.g. log queries to a dedicated tier
     */
    public ClientProvider(Router router, ClientFactory<C> factory, Executor connectExecutor, Duration connectTimeout,
                          Group defaultGroup, Map<String, Group> methodGroups) {
        if (router == null || factory == null || connectExecutor == null) {
            throw new IllegalArgumentException("router, factory and connectExecutor are required");
        }
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        this.router = router;
        this.factory = factory;
        this.connectExecutor = connectExecutor;
        this.connectTimeout = connectTimeout;
        this.defaultGroup = defaultGroup;
        this.methodGroups = Map.copyOf(methodGroups);
        registerGroup(defaultGroup);
        this.methodGroups.values().forEach(this::registerGroup);
    }

    /**
     * Registers a node group; idempotent. All callers get the same pool instance for a group.
     */
    public ConcurrentLoadingMap<String, C> registerGroup(Group group) {
        return clients.computeIfAbsent(group, g -> new ConcurrentLoadingMap<>(connectExecutor));
    }

    /**
     * Client for the node the router picks for {@code (group, key)}, connecting on first use.
     * The returned future fails with {@link UnknownGroupException}, {@link NoUpstreamAvailableException}
     * or {@link UpstreamConnectException}; it times out after the connect timeout without cancelling
     * a connection attempt other callers may still use.
     */
    public CompletableFuture<C> getClientAsync(String key, Group group) {
        ConcurrentLoadingMap<String, C> pool = clients.get(group);
        if (pool == null) {
            UnknownGroupException e = new UnknownGroupException(group);
            log.error("Failed to get full node client from provider: key={}, group={}", key, group, e);
            return CompletableFuture.failedFuture(e);
        }

        Optional<String> routed = router.route(group, key.getBytes(StandardCharsets.UTF_8));
        if (routed.isEmpty() || routed.get().isBlank()) {
            log.error("Failed to get full node client from provider: key={}, group={}, cause=no full node available",
                    key, group);
            return CompletableFuture.failedFuture(new NoUpstreamAvailableException(group));
        }

        String url = routed.get();
        String nodeName = NodeNames.fromUrl(url);
        log.trace("Route RPC request: key={}, group={}, node={}", key, group, nodeName);

        CompletableFuture<C> result = new CompletableFuture<>();
        pool.loadOrCreateAsync(nodeName, name -> factory.create(url))
                .orTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((loaded, error) -> {
                    if (error != null) {
                        UpstreamConnectException e = connectFailure(nodeName, unwrap(error));
                        log.error("Failed to get full node client from provider: key={}, group={}, node={}, url={}",
                                key, group, nodeName, NodeNames.redact(url), e);
                        result.completeExceptionally(e);
                        return;
                    }
                    if (loaded.created()) {
                        log.info("Succeeded to connect to full node: group={}, node={}, url={}",
                                group, nodeName, NodeNames.redact(url));
                    } else {
                        log.trace("Reuse full node client: group={}, node={}", group, nodeName);
                    }
                    result.complete(loaded.value());
                });
        return result;
    }

    /**
     * Blocking variant of {@link #getClientAsync}.
     */
    public C getClient(String key, Group group) {
        try {
            return getClientAsync(key, group).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamConnectException(String.valueOf(group), "interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new CompletionException(e.getCause());
        }
    }

    /**
     * Group serving the given JSON-RPC method.
     */
    public Group groupFor(String method) {
        return methodGroups.getOrDefault(method, defaultGroup);
    }

    public Set<Group> groups() {
        return Set.copyOf(clients.keySet());
    }

    public Router getRouter() {
        return router;
    }

    private UpstreamConnectException connectFailure(String nodeName, Throwable cause) {
        if (cause instanceof TimeoutException) {
            return new UpstreamConnectException(nodeName,
                    "no connection within " + connectTimeout.toMillis() + "ms", cause);
        }
        return new UpstreamConnectException(nodeName, String.valueOf(cause.getMessage()), cause);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

package com.rpcgateway.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.rpcgateway.node.ClientProvider;
import com.rpcgateway.node.Group;
import com.rpcgateway.ratelimit.RateLimitRegistry;
import com.rpcgateway.ratelimit.RateLimitedException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Rejects calls over the caller's quota before any handler runs, so throttled callers never cause an
 * upstream connection to be created. Buckets are keyed by caller identity and the node group the method
 * is served from.
 */
@Slf4j
public class RateLimitMiddleware implements RpcMiddleware {

    private final RateLimitRegistry registry;
    private final ClientProvider<?> clientProvider;

    /**
     * @param clientProvider resolves the node group of a method; null for servers without a provider
     */
    public RateLimitMiddleware(RateLimitRegistry registry, ClientProvider<?> clientProvider) {
        if (registry == null) {
            throw new IllegalArgumentException("registry required");
        }
        this.registry = registry;
        this.clientProvider = clientProvider;
    }

    @Override
    public Mono<JsonNode> handle(RpcCall call, RpcInvoker next) {
        String identity = call.context().remoteAddr();
        Group group = clientProvider != null ? clientProvider.groupFor(call.method()) : null;
        if (!registry.tryAcquire(identity, call.method(), group)) {
            log.warn("Rate limited: ip={}, method={}, group={}", identity, call.method(), group);
            return Mono.error(new RateLimitedException(identity, call.method()));
        }
        return next.invoke(call);
    }
}

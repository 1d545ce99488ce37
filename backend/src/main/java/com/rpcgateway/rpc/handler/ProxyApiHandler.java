package com.rpcgateway.rpc.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.rpcgateway.node.ClientProvider;
import com.rpcgateway.node.Group;
import com.rpcgateway.node.client.UpstreamClient;
import com.rpcgateway.rpc.ApiHandler;
import com.rpcgateway.rpc.RpcCall;
import reactor.core.publisher.Mono;

/**
 * Forwards calls unchanged to the full node the provider picks for the caller's IP.
 */
public class ProxyApiHandler<C extends UpstreamClient> implements ApiHandler {

    private final ClientProvider<C> provider;

    public ProxyApiHandler(ClientProvider<C> provider) {
        this.provider = provider;
    }

    @Override
    public Mono<JsonNode> handle(RpcCall call) {
        Group group = provider.groupFor(call.method());
        return Mono.fromFuture(() -> provider.getClientAsync(call.context().remoteAddr(), group))
                .flatMap(client -> client.call(call.method(), call.params()));
    }
}

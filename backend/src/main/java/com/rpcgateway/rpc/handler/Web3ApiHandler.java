package com.rpcgateway.rpc.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.rpcgateway.rpc.ApiHandler;
import com.rpcgateway.rpc.RpcCall;
import reactor.core.publisher.Mono;

/**
 * {@code web3_clientVersion} reports the gateway, not whichever node happens to serve the call.
 * Other web3 methods go to {@code delegate}.
 */
public class Web3ApiHandler implements ApiHandler {

    private final String clientVersion;
    private final ApiHandler delegate;

    public Web3ApiHandler(String clientVersion, ApiHandler delegate) {
        this.clientVersion = clientVersion;
        this.delegate = delegate;
    }

    @Override
    public Mono<JsonNode> handle(RpcCall call) {
        if ("web3_clientVersion".equals(call.method())) {
            return Mono.just(TextNode.valueOf(clientVersion));
        }
        return delegate.handle(call);
    }
}

package com.rpcgateway.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Serves the methods of one RPC module namespace.
 */
@FunctionalInterface
public interface ApiHandler {

    /**
     * @return the JSON-RPC result; errors with a {@link com.rpcgateway.common.GatewayException} subtype
     */
    Mono<JsonNode> handle(RpcCall call);
}

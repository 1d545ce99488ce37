package com.rpcgateway.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Next step of the middleware chain.
 */
@FunctionalInterface
public interface RpcInvoker {

    Mono<JsonNode> invoke(RpcCall call);
}

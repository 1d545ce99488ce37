package com.rpcgateway.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Intercepts every call before it reaches a module handler. May short-circuit by not invoking {@code next}.
 */
@FunctionalInterface
public interface RpcMiddleware {

    Mono<JsonNode> handle(RpcCall call, RpcInvoker next);
}

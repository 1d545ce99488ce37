package com.rpcgateway.node.client;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Connected full node client. Safe for concurrent use; the gateway shares one instance per node.
 */
public interface UpstreamClient {

    /** URL the client is bound to. */
    String url();

    /**
     * Perform a single JSON-RPC call.
     *
     * @param method e.g. "cfx_getBalance"
     * @param params positional params array; null means no params
     * @return the {@code result} member of the response; errors with {@link UpstreamRpcErrorException}
     * when the node answers with a JSON-RPC error, {@link UpstreamCallException} on transport failure
     */
    Mono<JsonNode> call(String method, JsonNode params);
}

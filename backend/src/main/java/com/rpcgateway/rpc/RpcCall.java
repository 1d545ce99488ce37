package com.rpcgateway.rpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One JSON-RPC invocation on its way through the middleware chain to a module handler.
 */
public record RpcCall(String method, JsonNode params, CallContext context) {

    public RpcCall {
        if (context == null) {
            context = CallContext.unknown();
        }
    }

    /**
     * Module namespace of the method: {@code cfx_getBalance} → {@code cfx}. Null when the method has none.
     */
    public String namespace() {
        int idx = method == null ? -1 : method.indexOf('_');
        return idx > 0 ? method.substring(0, idx) : null;
    }
}

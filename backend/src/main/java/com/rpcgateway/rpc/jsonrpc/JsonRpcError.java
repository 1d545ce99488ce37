package com.rpcgateway.rpc.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC error object.
 */
public record JsonRpcError(int code, String message, JsonNode data) {

    public static JsonRpcError of(int code, String message) {
        return new JsonRpcError(code, message, null);
    }
}

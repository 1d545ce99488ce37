package com.rpcgateway.node.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.rpcgateway.common.GatewayException;
import lombok.Getter;

/**
 * The full node answered with a JSON-RPC error object. Relayed to the caller with the node's code.
 */
@Getter
public class UpstreamRpcErrorException extends GatewayException {

    private final int code;
    private final JsonNode data;

    public UpstreamRpcErrorException(int code, String message, JsonNode data) {
        super(message);
        this.code = code;
        this.data = data;
    }
}

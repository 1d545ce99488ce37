package com.rpcgateway.rpc;

import com.rpcgateway.common.GatewayException;

/**
 * Request envelope is not a valid JSON-RPC request.
 */
public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(message);
    }
}

package com.rpcgateway.node.client;

import com.rpcgateway.common.GatewayException;

/**
 * Thrown when an upstream call fails below JSON-RPC (HTTP status, I/O, timeout).
 */
public class UpstreamCallException extends GatewayException {

    public UpstreamCallException(String message) {
        super(message);
    }

    public UpstreamCallException(String message, Throwable cause) {
        super(message, cause);
    }
}

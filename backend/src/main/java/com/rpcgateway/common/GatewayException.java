package com.rpcgateway.common;

/**
 * Base of all gateway failures. Unchecked; per-call failures are mapped to JSON-RPC errors at the HTTP edge.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}

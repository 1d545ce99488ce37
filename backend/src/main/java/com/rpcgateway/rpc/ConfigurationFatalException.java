package com.rpcgateway.rpc;

import com.rpcgateway.common.GatewayException;

/**
 * Server cannot be assembled from its configuration. Raised at startup only; the application does not
 * start with a partially configured server.
 */
public class ConfigurationFatalException extends GatewayException {

    public ConfigurationFatalException(String message) {
        super(message);
    }

    public ConfigurationFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}

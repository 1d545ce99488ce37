package com.rpcgateway.rpc;

import com.rpcgateway.common.GatewayException;

/**
 * Method does not exist, belongs to a module this server does not expose, or is disabled.
 */
public class MethodNotFoundException extends GatewayException {

    public MethodNotFoundException(String method) {
        super("the method " + method + " does not exist/is not available");
    }
}

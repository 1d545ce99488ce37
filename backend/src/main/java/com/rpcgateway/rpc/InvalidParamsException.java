package com.rpcgateway.rpc;

import com.rpcgateway.common.GatewayException;

/**
 * Call parameters cannot be interpreted by the handler.
 */
public class InvalidParamsException extends GatewayException {

    public InvalidParamsException(String message) {
        super(message);
    }
}

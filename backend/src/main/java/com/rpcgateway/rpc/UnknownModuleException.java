package com.rpcgateway.rpc;

import com.rpcgateway.common.GatewayException;
import lombok.Getter;

/**
 * Exposed-module allow-list names a module the server does not have.
 */
@Getter
public class UnknownModuleException extends GatewayException {

    private final String module;

    public UnknownModuleException(String module) {
        super("Unknown RPC module " + module);
        this.module = module;
    }
}

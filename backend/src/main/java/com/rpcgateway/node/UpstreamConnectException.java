package com.rpcgateway.node;

import com.rpcgateway.common.GatewayException;
import lombok.Getter;

/**
 * Connecting to a full node failed. The pool slot is not kept, so a later call connects again.
 */
@Getter
public class UpstreamConnectException extends GatewayException {

    private final String node;

    public UpstreamConnectException(String node, String message, Throwable cause) {
        super("Bad full node connection to " + node + ": " + message, cause);
        this.node = node;
    }
}

package com.rpcgateway.node;

import com.rpcgateway.common.GatewayException;
import lombok.Getter;

/**
 * A client was requested for a group that was never registered with the provider.
 */
@Getter
public class UnknownGroupException extends GatewayException {

    private final Group group;

    public UnknownGroupException(Group group) {
        super("Unknown node group " + group);
        this.group = group;
    }
}

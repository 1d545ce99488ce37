package com.rpcgateway.node;

import com.rpcgateway.common.GatewayException;
import lombok.Getter;

/**
 * The router found no full node for the group. Operational condition; callers may retry later.
 */
@Getter
public class NoUpstreamAvailableException extends GatewayException {

    private final Group group;

    public NoUpstreamAvailableException(Group group) {
        super("No full node available in group " + group);
        this.group = group;
    }
}

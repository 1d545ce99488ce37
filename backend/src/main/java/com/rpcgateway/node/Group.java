package com.rpcgateway.node;

/**
 * Logical partition of full nodes, used for tiering and resource isolation (e.g. a dedicated tier for
 * log queries). Groups are discovered as they are referenced; these constants are the groups the gateway
 * registers itself.
 */
public record Group(String name) {

    public static final Group CFX_HTTP = new Group("cfxhttp");
    public static final Group CFX_LOGS = new Group("cfxlogs");
    public static final Group ETH_HTTP = new Group("ethhttp");
    public static final Group ETH_LOGS = new Group("ethlogs");

    public Group {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("group name must not be blank");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}

package com.rpcgateway.node;

import java.util.Optional;

/**
 * Decides which full node serves a request. Implementations must be safe for concurrent use and must make
 * membership changes visible to subsequent calls without a restart.
 */
@FunctionalInterface
public interface Router {

    /**
     * @param group node group the request targets
     * @param key   routing key, usually the caller's IP address
     * @return URL of the node to use, or empty when no node of the group is available
     */
    Optional<String> route(Group group, byte[] key);
}

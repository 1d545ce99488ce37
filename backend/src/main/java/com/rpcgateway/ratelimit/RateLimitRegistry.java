package com.rpcgateway.ratelimit;

import com.rpcgateway.node.Group;

/**
 * Per-caller quota lookup. Must not perform network I/O; may briefly contend on an internal counter.
 */
public interface RateLimitRegistry {

    /** Registry that admits every call. */
    RateLimitRegistry UNLIMITED = (identity, method, group) -> true;

    /**
     * Takes one permit for the call if available.
     *
     * @param identity caller identity, usually the IP address
     * @param method   JSON-RPC method
     * @param group    node group the method is served from; null when the server has no client provider
     * @return false when the caller is over its quota
     */
    boolean tryAcquire(String identity, String method, Group group);
}

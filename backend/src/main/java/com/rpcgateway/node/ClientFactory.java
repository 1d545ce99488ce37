package com.rpcgateway.node;

/**
 * Creates a connected client for a full node URL. May block on network I/O.
 *
 * @param <C> client type of the space
 */
@FunctionalInterface
public interface ClientFactory<C> {

    C create(String url) throws Exception;
}

package com.rpcgateway.config;

import com.rpcgateway.rpc.RpcServer;

/**
 * An assembled server and the HTTP path it is mounted at.
 */
public record RpcServerEndpoint(String path, RpcServer server) {}

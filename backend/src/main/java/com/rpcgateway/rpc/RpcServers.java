package com.rpcgateway.rpc;

import com.rpcgateway.node.CfxClientProvider;
import com.rpcgateway.node.ClientFactory;
import com.rpcgateway.node.EthClientProvider;
import com.rpcgateway.node.client.CfxClient;
import com.rpcgateway.node.client.EthClient;
import com.rpcgateway.ratelimit.RateLimitRegistry;
import com.rpcgateway.rpc.handler.GasStationHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Assembles the per-space RPC servers: module set, exposed-module filter, middleware chain, fixed name.
 * Every configuration problem raises {@link ConfigurationFatalException}; no server is returned half built.
 */
@Slf4j
public final class RpcServers {

    public static final String NATIVE_SPACE_RPC_SERVER_NAME = "core_space_rpc";
    public static final String EVM_SPACE_RPC_SERVER_NAME = "evm_space_rpc";
    public static final String NATIVE_SPACE_BRIDGE_RPC_SERVER_NAME = "core_space_bridge_rpc";

    private RpcServers() {
    }

    /**
     * Core space server. With an empty {@code exposedModules} list all public modules are exposed.
     *
     * @param gasStation optional gas station handler
     */
    public static RpcServer newNativeSpaceServer(CfxClientProvider provider, GasStationHandler gasStation,
                                                 List<String> exposedModules, RateLimitRegistry registry, ApiOptions options) {
        List<ApiModule> all = NativeSpaceApis.all(provider, gasStation, orNone(options));
        List<ApiModule> exposed = filter(NATIVE_SPACE_RPC_SERVER_NAME, all, exposedModules);
        return server(NATIVE_SPACE_RPC_SERVER_NAME, exposed, List.of(new RateLimitMiddleware(registry, provider)));
    }

    /**
     * EVM space server. With an empty {@code exposedModules} list all public modules are exposed.
     */
    public static RpcServer newEvmSpaceServer(EthClientProvider provider, String clientVersion, List<String> exposedModules,
                                              RateLimitRegistry registry, ApiOptions options) {
        List<ApiModule> all = EvmSpaceApis.all(provider, clientVersion, orNone(options));
        List<ApiModule> exposed = filter(EVM_SPACE_RPC_SERVER_NAME, all, exposedModules);
        return server(EVM_SPACE_RPC_SERVER_NAME, exposed, List.of(new RateLimitMiddleware(registry, provider)));
    }

    /**
     * Core space bridge server over an EVM node. Both nodes are connected eagerly; failing to connect
     * either one is fatal.
     */
    public static RpcServer newNativeSpaceBridgeServer(CfxBridgeServerConfig config, ClientFactory<EthClient> ethFactory,
                                                       ClientFactory<CfxClient> cfxFactory, RateLimitRegistry registry,
                                                       ApiOptions options) {
        if (config.ethNode() == null || config.ethNode().isBlank() || config.cfxNode() == null || config.cfxNode().isBlank()) {
            throw new ConfigurationFatalException("Failed to new CFX bridge RPC server: eth node and cfx node are required");
        }
        EthClient eth;
        CfxClient cfx;
        try {
            eth = ethFactory.create(config.ethNode());
            cfx = cfxFactory.create(config.cfxNode());
        } catch (Exception e) {
            throw new ConfigurationFatalException("Failed to new CFX bridge RPC server: " + e.getMessage(), e);
        }
        List<ApiModule> all = NativeSpaceBridgeApis.all(eth, cfx, orNone(options));
        List<ApiModule> exposed = filter(NATIVE_SPACE_BRIDGE_RPC_SERVER_NAME, all, config.exposedModules());
        return server(NATIVE_SPACE_BRIDGE_RPC_SERVER_NAME, exposed, List.of(new RateLimitMiddleware(registry, null)));
    }

    private static List<ApiModule> filter(String serverName, List<ApiModule> all, List<String> exposedModules) {
        try {
            return ExposedApiFilter.filter(all, exposedModules);
        } catch (UnknownModuleException e) {
            throw new ConfigurationFatalException(
                    "Failed to new " + serverName + " server with bad exposed modules: " + e.getMessage(), e);
        }
    }

    private static RpcServer server(String name, List<ApiModule> exposed, List<RpcMiddleware> middlewares) {
        RpcServer server;
        try {
            server = new RpcServer(name, exposed, middlewares);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationFatalException("Failed to new " + name + " server: " + e.getMessage(), e);
        }
        log.info("RPC server {} assembled with modules {}", name, server.getModules());
        return server;
    }

    private static ApiOptions orNone(ApiOptions options) {
        return options != null ? options : ApiOptions.NONE;
    }
}

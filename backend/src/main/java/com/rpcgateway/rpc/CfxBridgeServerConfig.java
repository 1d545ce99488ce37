package com.rpcgateway.rpc;

import java.util.List;

/**
 * Bridge server settings.
 *
 * @param ethNode        EVM space node URL serving translated {@code cfx_*} calls
 * @param cfxNode        core space node URL serving {@code pos_*} calls
 * @param exposedModules module allow-list; empty exposes all public modules
 * @param path           HTTP path the server is mounted at
 */
public record CfxBridgeServerConfig(String ethNode, String cfxNode, List<String> exposedModules, String path) {

    public CfxBridgeServerConfig {
        exposedModules = exposedModules == null ? List.of() : List.copyOf(exposedModules);
    }
}

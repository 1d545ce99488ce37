package com.rpcgateway.rpc;

import com.rpcgateway.node.EthClientProvider;
import com.rpcgateway.rpc.handler.ProxyApiHandler;
import com.rpcgateway.rpc.handler.Web3ApiHandler;

import java.util.List;

/**
 * EVM space RPC modules.
 */
public final class EvmSpaceApis {

    private EvmSpaceApis() {
    }

    public static List<ApiModule> all(EthClientProvider provider, String clientVersion, ApiOptions options) {
        ProxyApiHandler<?> proxy = new ProxyApiHandler<>(provider);
        return options.apply(List.of(
                new ApiModule("eth", proxy, true),
                new ApiModule("net", proxy, true),
                new ApiModule("web3", new Web3ApiHandler(clientVersion, proxy), true),
                new ApiModule("txpool", proxy, true),
                new ApiModule("trace", proxy, true),
                new ApiModule("debug", proxy, false)
        ));
    }
}

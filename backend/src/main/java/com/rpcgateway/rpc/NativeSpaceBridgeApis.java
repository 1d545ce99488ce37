package com.rpcgateway.rpc;

import com.rpcgateway.node.client.CfxClient;
import com.rpcgateway.node.client.EthClient;
import com.rpcgateway.rpc.handler.CfxBridgeApiHandler;

import java.util.List;

/**
 * Bridge server modules: {@code cfx} translated onto the EVM node, {@code pos} relayed to the core space node.
 */
public final class NativeSpaceBridgeApis {

    private NativeSpaceBridgeApis() {
    }

    public static List<ApiModule> all(EthClient eth, CfxClient cfx, ApiOptions options) {
        ApiHandler pos = call -> cfx.call(call.method(), call.params());
        return options.apply(List.of(
                new ApiModule("cfx", new CfxBridgeApiHandler(eth), true),
                new ApiModule("pos", pos, true)
        ));
    }
}

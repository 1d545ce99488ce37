package com.rpcgateway.rpc;

import com.rpcgateway.node.CfxClientProvider;
import com.rpcgateway.rpc.handler.GasStationHandler;
import com.rpcgateway.rpc.handler.ProxyApiHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Core space RPC modules.
 */
public final class NativeSpaceApis {

    private NativeSpaceApis() {
    }

    /**
     * @param gasStation optional; the {@code gasstation} module is only registered when present
     */
    public static List<ApiModule> all(CfxClientProvider provider, GasStationHandler gasStation, ApiOptions options) {
        ProxyApiHandler<?> proxy = new ProxyApiHandler<>(provider);
        List<ApiModule> modules = new ArrayList<>(List.of(
                new ApiModule("cfx", proxy, true),
                new ApiModule("pos", proxy, true),
                new ApiModule("txpool", proxy, true),
                new ApiModule("trace", proxy, true),
                new ApiModule("debug", proxy, false)
        ));
        if (gasStation != null) {
            modules.add(new ApiModule("gasstation", gasStation, true));
        }
        return options.apply(modules);
    }
}

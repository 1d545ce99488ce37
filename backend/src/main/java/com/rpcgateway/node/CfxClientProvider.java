package com.rpcgateway.node;

import com.rpcgateway.node.client.CfxClient;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Core space client provider: {@code cfx_getLogs} is served by the {@code cfxlogs} group, everything else
 * by {@code cfxhttp}.
 */
public class CfxClientProvider extends ClientProvider<CfxClient> {

    public CfxClientProvider(Router router, ClientFactory<CfxClient> factory, Executor connectExecutor,
                             Duration connectTimeout) {
        super(router, factory, connectExecutor, connectTimeout, Group.CFX_HTTP, Map.of("cfx_getLogs", Group.CFX_LOGS));
    }
}

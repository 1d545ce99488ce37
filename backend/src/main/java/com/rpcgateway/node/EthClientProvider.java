package com.rpcgateway.node;

import com.rpcgateway.node.client.EthClient;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * EVM space client provider: {@code eth_getLogs} is served by the {@code ethlogs} group, everything else
 * by {@code ethhttp}.
 */
public class EthClientProvider extends ClientProvider<EthClient> {

    public EthClientProvider(Router router, ClientFactory<EthClient> factory, Executor connectExecutor,
                             Duration connectTimeout) {
        super(router, factory, connectExecutor, connectTimeout, Group.ETH_HTTP, Map.of("eth_getLogs", Group.ETH_LOGS));
    }
}

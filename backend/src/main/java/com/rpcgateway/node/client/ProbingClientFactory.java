package com.rpcgateway.node.client;

import com.rpcgateway.common.NodeNames;
import com.rpcgateway.node.ClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.function.Function;

/**
 * Builds a client for a node URL and, when probing is on, issues one cheap call to prove the node answers
 * before the client gets cached. A failing probe fails the creation.
 */
@Slf4j
public class ProbingClientFactory<C extends JsonRpcUpstreamClient> implements ClientFactory<C> {

    private final Function<String, C> constructor;
    private final String probeMethod;
    private final boolean probe;
    private final Duration connectTimeout;

    public ProbingClientFactory(Function<String, C> constructor, String probeMethod, boolean probe, Duration connectTimeout) {
        this.constructor = constructor;
        this.probeMethod = probeMethod;
        this.probe = probe;
        this.connectTimeout = connectTimeout;
    }

    public static ProbingClientFactory<CfxClient> cfx(WebClient webClient, Duration requestTimeout, boolean probe, Duration connectTimeout) {
        return new ProbingClientFactory<>(url -> new CfxClient(url, webClient, requestTimeout), "cfx_getStatus", probe, connectTimeout);
    }

    public static ProbingClientFactory<EthClient> eth(WebClient webClient, Duration requestTimeout, boolean probe, Duration connectTimeout) {
        return new ProbingClientFactory<>(url -> new EthClient(url, webClient, requestTimeout), "eth_chainId", probe, connectTimeout);
    }

    @Override
    public C create(String url) {
        C client = constructor.apply(url);
        if (probe) {
            client.call(probeMethod, null).block(connectTimeout);
            log.debug("Probed full node {} with {}", NodeNames.redact(url), probeMethod);
        }
        return client;
    }
}

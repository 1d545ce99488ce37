package com.rpcgateway.node.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * EVM space full node client.
 */
public final class EthClient extends JsonRpcUpstreamClient {

    public EthClient(String url, WebClient webClient, Duration requestTimeout) {
        super(url, webClient, requestTimeout);
    }

    public Mono<JsonNode> chainId() {
        return call("eth_chainId", null);
    }

    public Mono<JsonNode> blockNumber() {
        return call("eth_blockNumber", null);
    }

    public Mono<JsonNode> gasPrice() {
        return call("eth_gasPrice", null);
    }
}

package com.rpcgateway.node.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Core space full node client.
 */
public final class CfxClient extends JsonRpcUpstreamClient {

    public CfxClient(String url, WebClient webClient, Duration requestTimeout) {
        super(url, webClient, requestTimeout);
    }

    public Mono<JsonNode> getStatus() {
        return call("cfx_getStatus", null);
    }

    public Mono<JsonNode> gasPrice() {
        return call("cfx_gasPrice", null);
    }

    public Mono<JsonNode> epochNumber(String epoch) {
        return call("cfx_epochNumber", epoch == null ? null : params(epoch));
    }
}

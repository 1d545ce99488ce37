package com.rpcgateway.node.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rpcgateway.common.NodeNames;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC over HTTP using WebClient. The shared WebClient pools the underlying connections per host.
 */
public class JsonRpcUpstreamClient implements UpstreamClient {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final String url;
    private final WebClient webClient;
    private final Duration requestTimeout;
    private final AtomicLong ids = new AtomicLong();

    public JsonRpcUpstreamClient(String url, WebClient webClient, Duration requestTimeout) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url required");
        }
        this.url = url;
        this.webClient = webClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String url() {
        return url;
    }

    @Override
    public Mono<JsonNode> call(String method, JsonNode params) {
        ObjectNode body = JSON.objectNode();
        body.put("jsonrpc", "2.0");
        body.put("id", ids.incrementAndGet());
        body.put("method", method);
        body.set("params", params != null && !params.isNull() ? params : JSON.arrayNode());
        return webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(requestTimeout)
                .onErrorMap(WebClientResponseException.class,
                        e -> new UpstreamCallException(method + " on " + NodeNames.redact(url) + ": HTTP " + e.getStatusCode().value(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new UpstreamCallException(method + " on " + NodeNames.redact(url) + ": " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new UpstreamCallException(method + " on " + NodeNames.redact(url) + " timed out after " + requestTimeout.toMillis() + "ms", e))
                .flatMap(response -> resultOf(method, response));
    }

    protected static JsonNode params(Object... values) {
        var array = JSON.arrayNode();
        for (Object v : values) {
            if (v == null) {
                array.addNull();
            } else if (v instanceof JsonNode node) {
                array.add(node);
            } else if (v instanceof Boolean b) {
                array.add(b);
            } else {
                array.add(v.toString());
            }
        }
        return array;
    }

    private Mono<JsonNode> resultOf(String method, JsonNode response) {
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            return Mono.error(new UpstreamRpcErrorException(
                    error.path("code").asInt(-32603),
                    error.path("message").asText("upstream error"),
                    error.get("data")));
        }
        if (!response.has("result")) {
            return Mono.error(new UpstreamCallException(method + " on " + NodeNames.redact(url) + ": response without result"));
        }
        JsonNode result = response.get("result");
        return Mono.just(result != null ? result : NullNode.getInstance());
    }
}

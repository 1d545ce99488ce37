package com.rpcgateway.rpc.jsonrpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rpcgateway.rpc.CallContext;
import com.rpcgateway.rpc.InvalidRequestException;
import com.rpcgateway.rpc.RpcCall;
import com.rpcgateway.rpc.RpcServer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.server.HandlerFunction;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * HTTP endpoint of one {@link RpcServer}: parses single and batch JSON-RPC requests, runs each call through
 * the server and writes the responses. Batch calls run concurrently; responses keep request order.
 */
@Slf4j
public class JsonRpcHttpHandler implements HandlerFunction<ServerResponse> {

    private final RpcServer server;
    private final ObjectMapper objectMapper;
    private final int maxBatchSize;

    public JsonRpcHttpHandler(RpcServer server, ObjectMapper objectMapper, int maxBatchSize) {
        this.server = server;
        this.objectMapper = objectMapper;
        this.maxBatchSize = maxBatchSize;
    }

    @Override
    public Mono<ServerResponse> handle(ServerRequest request) {
        CallContext context = new CallContext(
                RemoteAddressResolver.resolve(request.headers().asHttpHeaders(), request.remoteAddress()));
        return request.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> handleBody(body, context));
    }

    private Mono<ServerResponse> handleBody(String body, CallContext context) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return write(HttpStatus.OK, error(NullNode.getInstance(), JsonRpcError.of(JsonRpcErrors.PARSE_ERROR, "parse error")));
        }
        if (payload == null || payload.isMissingNode()) {
            return write(HttpStatus.OK, error(NullNode.getInstance(), JsonRpcError.of(JsonRpcErrors.PARSE_ERROR, "parse error")));
        }
        if (payload.isArray()) {
            return handleBatch((ArrayNode) payload, context);
        }
        return process(payload, context)
                .flatMap(outcome -> write(outcome.status(), outcome.response()));
    }

    private Mono<ServerResponse> handleBatch(ArrayNode batch, CallContext context) {
        if (batch.isEmpty()) {
            return write(HttpStatus.OK, error(NullNode.getInstance(), JsonRpcError.of(JsonRpcErrors.INVALID_REQUEST, "empty batch")));
        }
        if (batch.size() > maxBatchSize) {
            return write(HttpStatus.OK, error(NullNode.getInstance(),
                    JsonRpcError.of(JsonRpcErrors.INVALID_REQUEST, "batch too large, max " + maxBatchSize)));
        }
        return Flux.fromIterable(batch)
                .flatMapSequential(node -> process(node, context))
                .map(Outcome::response)
                .collectList()
                .flatMap(responses -> {
                    ArrayNode array = objectMapper.createArrayNode();
                    responses.forEach(array::add);
                    return write(HttpStatus.OK, array);
                });
    }

    private Mono<Outcome> process(JsonNode request, CallContext context) {
        JsonNode id = request.isObject() && request.has("id") ? request.get("id") : NullNode.getInstance();
        RpcCall call;
        try {
            call = toCall(request, context);
        } catch (InvalidRequestException e) {
            return Mono.just(new Outcome(HttpStatus.OK, error(id, JsonRpcErrors.of(e))));
        }
        return server.call(call)
                .defaultIfEmpty(NullNode.getInstance())
                .map(result -> new Outcome(HttpStatus.OK, success(id, result)))
                .onErrorResume(t -> {
                    if (JsonRpcErrors.isExpected(t)) {
                        log.debug("RPC {} on {} failed for {}: {}", call.method(), server.getName(), context.remoteAddr(), t.getMessage());
                    } else {
                        log.error("RPC {} on {} failed unexpectedly for {}", call.method(), server.getName(), context.remoteAddr(), t);
                    }
                    return Mono.just(new Outcome(JsonRpcErrors.httpStatus(t), error(id, JsonRpcErrors.of(t))));
                });
    }

    private static RpcCall toCall(JsonNode request, CallContext context) {
        if (!request.isObject()) {
            throw new InvalidRequestException("invalid request");
        }
        JsonNode method = request.get("method");
        if (method == null || !method.isTextual() || method.asText().isBlank()) {
            throw new InvalidRequestException("missing method");
        }
        JsonNode params = request.get("params");
        if (params != null && !params.isNull() && !params.isArray() && !params.isObject()) {
            throw new InvalidRequestException("params must be an array or object");
        }
        return new RpcCall(method.asText(), params == null || params.isNull() ? null : params, context);
    }

    private ObjectNode success(JsonNode id, JsonNode result) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        response.set("result", result);
        return response;
    }

    private ObjectNode error(JsonNode id, JsonRpcError error) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("code", error.code());
        body.put("message", error.message());
        if (error.data() != null && !error.data().isNull()) {
            body.set("data", error.data());
        }
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        response.set("error", body);
        return response;
    }

    private Mono<ServerResponse> write(HttpStatus status, JsonNode body) {
        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body);
    }

    private record Outcome(HttpStatus status, ObjectNode response) {}
}

package com.rpcgateway.rpc.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.rpcgateway.node.client.EthClient;
import com.rpcgateway.rpc.ApiHandler;
import com.rpcgateway.rpc.InvalidParamsException;
import com.rpcgateway.rpc.MethodNotFoundException;
import com.rpcgateway.rpc.RpcCall;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Serves core space {@code cfx_*} methods from an EVM space node. Epoch tags are mapped to block tags;
 * addresses and hashes pass through unchanged.
 */
@Slf4j
public class CfxBridgeApiHandler implements ApiHandler {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    /** cfx method → eth method and the index of its epoch parameter (-1 when none). */
    private static final Map<String, Translation> TRANSLATIONS = Map.ofEntries(
            Map.entry("cfx_gasPrice", new Translation("eth_gasPrice", -1)),
            Map.entry("cfx_maxPriorityFeePerGas", new Translation("eth_maxPriorityFeePerGas", -1)),
            Map.entry("cfx_sendRawTransaction", new Translation("eth_sendRawTransaction", -1)),
            Map.entry("cfx_getTransactionByHash", new Translation("eth_getTransactionByHash", -1)),
            Map.entry("cfx_getTransactionReceipt", new Translation("eth_getTransactionReceipt", -1)),
            Map.entry("cfx_getBlockByHash", new Translation("eth_getBlockByHash", -1)),
            Map.entry("cfx_getBlockByEpochNumber", new Translation("eth_getBlockByNumber", 0)),
            Map.entry("cfx_getBalance", new Translation("eth_getBalance", 1)),
            Map.entry("cfx_getNextNonce", new Translation("eth_getTransactionCount", 1)),
            Map.entry("cfx_getCode", new Translation("eth_getCode", 1)),
            Map.entry("cfx_call", new Translation("eth_call", 1)),
            Map.entry("cfx_getStorageAt", new Translation("eth_getStorageAt", 2)),
            Map.entry("cfx_clientVersion", new Translation("web3_clientVersion", -1))
    );

    private final EthClient eth;

    public CfxBridgeApiHandler(EthClient eth) {
        this.eth = eth;
    }

    @Override
    public Mono<JsonNode> handle(RpcCall call) {
        return Mono.defer(() -> translate(call));
    }

    private Mono<JsonNode> translate(RpcCall call) {
        switch (call.method()) {
            case "cfx_epochNumber":
                return eth.blockNumber();
            case "cfx_getStatus":
                return status();
            case "cfx_estimateGasAndCollateral":
                return estimateGasAndCollateral(call.params());
            default:
                break;
        }
        Translation translation = TRANSLATIONS.get(call.method());
        if (translation == null) {
            return Mono.error(new MethodNotFoundException(call.method()));
        }
        JsonNode params = translation.epochIndex() >= 0 ? withBlockTag(call.params(), translation.epochIndex()) : call.params();
        log.trace("Bridge {} -> {}", call.method(), translation.ethMethod());
        return eth.call(translation.ethMethod(), params);
    }

    /**
     * Core space epoch tag → EVM block tag. Hex epoch numbers map to the same block number.
     */
    static String toBlockTag(String epoch) {
        return switch (epoch) {
            case "latest_state", "latest_mined" -> "latest";
            case "latest_confirmed" -> "safe";
            case "latest_finalized", "latest_checkpoint" -> "finalized";
            case "earliest" -> "earliest";
            default -> {
                if (epoch.startsWith("0x")) {
                    yield epoch;
                }
                throw new InvalidParamsException("Invalid epoch " + epoch);
            }
        };
    }

    private Mono<JsonNode> status() {
        return Mono.zip(eth.chainId(), eth.blockNumber())
                .map(t -> {
                    ObjectNode status = JSON.objectNode();
                    status.set("chainId", t.getT1());
                    status.set("networkId", t.getT1());
                    status.set("epochNumber", t.getT2());
                    status.set("blockNumber", t.getT2());
                    status.set("latestState", t.getT2());
                    status.set("latestConfirmed", t.getT2());
                    return status;
                });
    }

    private Mono<JsonNode> estimateGasAndCollateral(JsonNode params) {
        JsonNode request = params != null && params.isArray() && params.size() > 0 ? params.get(0) : null;
        if (request == null) {
            return Mono.error(new InvalidParamsException("missing call request"));
        }
        ArrayNode ethParams = JSON.arrayNode().add(request);
        return eth.call("eth_estimateGas", ethParams)
                .map(gas -> {
                    ObjectNode estimate = JSON.objectNode();
                    estimate.set("gasLimit", gas);
                    estimate.set("gasUsed", gas);
                    estimate.put("storageCollateralized", "0x0");
                    return estimate;
                });
    }

    /**
     * Translates the epoch param at {@code index}. An omitted trailing epoch after other params defaults
     * to latest state, as it does on a core space node.
     */
    private static JsonNode withBlockTag(JsonNode params, int index) {
        if (params == null || !params.isArray() || params.size() < index || params.size() == 0) {
            return params;
        }
        ArrayNode copy = ((ArrayNode) params).deepCopy();
        if (copy.size() == index) {
            return copy.add(toBlockTag("latest_state"));
        }
        JsonNode epoch = copy.get(index);
        if (epoch.isTextual()) {
            copy.set(index, TextNode.valueOf(toBlockTag(epoch.asText())));
        }
        return copy;
    }

    private record Translation(String ethMethod, int epochIndex) {}
}

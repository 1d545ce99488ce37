package com.rpcgateway.rpc.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rpcgateway.node.CfxClientProvider;
import com.rpcgateway.node.client.CfxClient;
import com.rpcgateway.rpc.ApiHandler;
import com.rpcgateway.rpc.InvalidParamsException;
import com.rpcgateway.rpc.MethodNotFoundException;
import com.rpcgateway.rpc.RpcCall;
import reactor.core.publisher.Mono;

import java.math.BigInteger;

/**
 * {@code gasstation_price}: gas price tiers derived from the node's current {@code cfx_gasPrice}.
 */
public class GasStationHandler implements ApiHandler {

    static final String PRICE_METHOD = "gasstation_price";

    private static final int SAFE_LOW_PERCENT = 100;
    private static final int AVERAGE_PERCENT = 110;
    private static final int FAST_PERCENT = 125;
    private static final int FASTEST_PERCENT = 150;

    private final CfxClientProvider provider;

    public GasStationHandler(CfxClientProvider provider) {
        this.provider = provider;
    }

    @Override
    public Mono<JsonNode> handle(RpcCall call) {
        if (!PRICE_METHOD.equals(call.method())) {
            return Mono.error(new MethodNotFoundException(call.method()));
        }
        return Mono.fromFuture(() -> provider.getClientAsync(call.context().remoteAddr(), provider.groupFor("cfx_gasPrice")))
                .flatMap(CfxClient::gasPrice)
                .map(GasStationHandler::tiers);
    }

    static JsonNode tiers(JsonNode gasPrice) {
        BigInteger base = parseQuantity(gasPrice);
        ObjectNode tiers = JsonNodeFactory.instance.objectNode();
        tiers.put("safeLow", toQuantity(percent(base, SAFE_LOW_PERCENT)));
        tiers.put("average", toQuantity(percent(base, AVERAGE_PERCENT)));
        tiers.put("fast", toQuantity(percent(base, FAST_PERCENT)));
        tiers.put("fastest", toQuantity(percent(base, FASTEST_PERCENT)));
        return tiers;
    }

    private static BigInteger percent(BigInteger value, int percent) {
        return value.multiply(BigInteger.valueOf(percent)).divide(BigInteger.valueOf(100));
    }

    private static BigInteger parseQuantity(JsonNode quantity) {
        String text = quantity == null ? "" : quantity.asText();
        if (!text.startsWith("0x") || text.length() < 3) {
            throw new InvalidParamsException("Unexpected gas price from full node: " + text);
        }
        return new BigInteger(text.substring(2), 16);
    }

    private static String toQuantity(BigInteger value) {
        return "0x" + value.toString(16);
    }
}

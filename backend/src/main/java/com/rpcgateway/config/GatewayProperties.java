package com.rpcgateway.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway settings: upstream connection behaviour and one section per RPC server.
 */
@ConfigurationProperties(prefix = "rpcgateway")
@NoArgsConstructor
@Getter
@Setter
public class GatewayProperties {

    /** Reported by web3_clientVersion on the EVM space server. */
    private String clientVersion = "rpc-gateway/v0.1.0";

    /** Max calls in one JSON-RPC batch request. */
    private int maxBatchSize = 100;

    private UpstreamProperties upstream = new UpstreamProperties();
    private SpaceProperties nativeSpace = new SpaceProperties("/core");
    private SpaceProperties evmSpace = new SpaceProperties("/evm");
    private BridgeProperties bridge = new BridgeProperties();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class UpstreamProperties {

        /** How long a call waits for a new full node client; creation itself keeps running. */
        private long connectTimeoutMs = 5_000;

        /** Deadline of each upstream JSON-RPC call. */
        private long requestTimeoutMs = 30_000;

        /** Issue a cheap call to a node before caching its client. */
        private boolean probeOnConnect = true;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class SpaceProperties {

        private boolean enabled = true;
        private String path;

        /** Module allow-list. Empty: all modules designated public. */
        private List<String> exposedModules = new ArrayList<>();

        /** Methods answered with "method not found". */
        private List<String> disabledMethods = new ArrayList<>();

        /** Node URLs per group name (cfxhttp, cfxlogs / ethhttp, ethlogs). */
        private Map<String, List<String>> nodes = new HashMap<>();

        /** Consistent-hash ring points per node. */
        private int virtualNodes = 160;

        private RateLimitProperties rateLimit = new RateLimitProperties();

        public SpaceProperties(String path) {
            this.path = path;
        }

        public void setExposedModules(List<String> exposedModules) {
            this.exposedModules = exposedModules != null ? exposedModules : new ArrayList<>();
        }

        public void setNodes(Map<String, List<String>> nodes) {
            this.nodes = nodes != null ? nodes : new HashMap<>();
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class BridgeProperties {

        private boolean enabled = false;
        private String path = "/bridge";
        private String ethNode;
        private String cfxNode;
        private List<String> exposedModules = new ArrayList<>();
        private RateLimitProperties rateLimit = new RateLimitProperties();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class RateLimitProperties {

        private boolean enabled = true;

        /** Requests per second per caller IP and node group. 0 rejects everything. */
        private int defaultPermitsPerSecond = 100;

        /** Requests per second per caller IP for specific methods, e.g. cfx_getLogs: 5. */
        private Map<String, Integer> methods = new HashMap<>();

        /** Forget limiters of callers idle this long. */
        private long identityExpireMinutes = 10;

        private long maxIdentities = 100_000;
    }
}

package com.rpcgateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rpcgateway.common.NodeNames;
import com.rpcgateway.node.CfxClientProvider;
import com.rpcgateway.node.ConsistentHashRouter;
import com.rpcgateway.node.EthClientProvider;
import com.rpcgateway.node.Group;
import com.rpcgateway.node.client.CfxClient;
import com.rpcgateway.node.client.EthClient;
import com.rpcgateway.node.client.ProbingClientFactory;
import com.rpcgateway.ratelimit.CaffeineRateLimitRegistry;
import com.rpcgateway.ratelimit.RateLimitRegistry;
import com.rpcgateway.rpc.ApiOptions;
import com.rpcgateway.rpc.CfxBridgeServerConfig;
import com.rpcgateway.rpc.ConfigurationFatalException;
import com.rpcgateway.rpc.RpcServer;
import com.rpcgateway.rpc.RpcServers;
import com.rpcgateway.rpc.handler.GasStationHandler;
import com.rpcgateway.rpc.jsonrpc.JsonRpcHttpHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Composition root: one router, client provider, rate-limit registry and RPC server per enabled space,
 * each server mounted at its own HTTP path. Any configuration error fails bean creation and with it the
 * application start.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayServerConfig {

    @Bean
    public WebClient upstreamWebClient(WebClient.Builder webClientBuilder) {
        return webClientBuilder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "rpcgateway.native-space", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CfxClientProvider cfxClientProvider(GatewayProperties properties, WebClient upstreamWebClient,
                                               @Qualifier(ExecutorConfig.CONNECT_EXECUTOR) Executor connectExecutor) {
        GatewayProperties.UpstreamProperties upstream = properties.getUpstream();
        ConsistentHashRouter router = router("native space", properties.getNativeSpace(), Set.of(Group.CFX_HTTP, Group.CFX_LOGS));
        return new CfxClientProvider(router, cfxFactory(upstream, upstreamWebClient), connectExecutor, connectTimeout(upstream));
    }

    @Bean
    @ConditionalOnProperty(prefix = "rpcgateway.native-space", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RpcServerEndpoint nativeSpaceServer(GatewayProperties properties, CfxClientProvider cfxClientProvider) {
        GatewayProperties.SpaceProperties space = properties.getNativeSpace();
        RpcServer server = RpcServers.newNativeSpaceServer(
                cfxClientProvider,
                new GasStationHandler(cfxClientProvider),
                space.getExposedModules(),
                rateLimitRegistry("cfx", space.getRateLimit()),
                ApiOptions.disabledMethods(Set.copyOf(space.getDisabledMethods())));
        return new RpcServerEndpoint(space.getPath(), server);
    }

    @Bean
    @ConditionalOnProperty(prefix = "rpcgateway.evm-space", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EthClientProvider ethClientProvider(GatewayProperties properties, WebClient upstreamWebClient,
                                               @Qualifier(ExecutorConfig.CONNECT_EXECUTOR) Executor connectExecutor) {
        GatewayProperties.UpstreamProperties upstream = properties.getUpstream();
        ConsistentHashRouter router = router("EVM space", properties.getEvmSpace(), Set.of(Group.ETH_HTTP, Group.ETH_LOGS));
        return new EthClientProvider(router, ethFactory(upstream, upstreamWebClient), connectExecutor, connectTimeout(upstream));
    }

    @Bean
    @ConditionalOnProperty(prefix = "rpcgateway.evm-space", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RpcServerEndpoint evmSpaceServer(GatewayProperties properties, EthClientProvider ethClientProvider) {
        GatewayProperties.SpaceProperties space = properties.getEvmSpace();
        RpcServer server = RpcServers.newEvmSpaceServer(
                ethClientProvider,
                properties.getClientVersion(),
                space.getExposedModules(),
                rateLimitRegistry("eth", space.getRateLimit()),
                ApiOptions.disabledMethods(Set.copyOf(space.getDisabledMethods())));
        return new RpcServerEndpoint(space.getPath(), server);
    }

    @Bean
    @ConditionalOnProperty(prefix = "rpcgateway.bridge", name = "enabled", havingValue = "true")
    public RpcServerEndpoint nativeSpaceBridgeServer(GatewayProperties properties, WebClient upstreamWebClient) {
        GatewayProperties.BridgeProperties bridge = properties.getBridge();
        GatewayProperties.UpstreamProperties upstream = properties.getUpstream();
        CfxBridgeServerConfig config = new CfxBridgeServerConfig(
                bridge.getEthNode(), bridge.getCfxNode(), bridge.getExposedModules(), bridge.getPath());
        RpcServer server = RpcServers.newNativeSpaceBridgeServer(
                config,
                ethFactory(upstream, upstreamWebClient),
                cfxFactory(upstream, upstreamWebClient),
                rateLimitRegistry("cfxbridge", bridge.getRateLimit()),
                ApiOptions.NONE);
        return new RpcServerEndpoint(config.path(), server);
    }

    @Bean
    public RouterFunction<ServerResponse> rpcRoutes(ObjectProvider<RpcServerEndpoint> serverEndpoints, ObjectMapper objectMapper,
                                                    GatewayProperties properties) {
        List<RpcServerEndpoint> endpoints = serverEndpoints.orderedStream().toList();
        if (endpoints.isEmpty()) {
            throw new ConfigurationFatalException("No RPC server enabled");
        }
        Set<String> paths = new HashSet<>();
        RouterFunctions.Builder routes = RouterFunctions.route();
        for (RpcServerEndpoint endpoint : endpoints) {
            String path = endpoint.path();
            if (path == null || !path.startsWith("/")) {
                throw new ConfigurationFatalException("Bad HTTP path '" + path + "' for " + endpoint.server().getName());
            }
            if (!paths.add(path)) {
                throw new ConfigurationFatalException("HTTP path " + path + " used by more than one RPC server");
            }
            routes.POST(path, new JsonRpcHttpHandler(endpoint.server(), objectMapper, properties.getMaxBatchSize()));
            log.info("RPC server {} listening on {}", endpoint.server().getName(), path);
        }
        return routes.build();
    }

    static ConsistentHashRouter router(String space, GatewayProperties.SpaceProperties properties, Set<Group> groups) {
        Map<Group, List<String>> nodes = new HashMap<>();
        properties.getNodes().forEach((groupName, urls) -> {
            Group group = new Group(groupName);
            if (!groups.contains(group)) {
                throw new ConfigurationFatalException("Unknown node group " + groupName + " for " + space + ", expected one of " + groups);
            }
            Map<String, String> byNodeName = new HashMap<>();
            for (String url : urls) {
                if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
                    throw new ConfigurationFatalException("Bad full node URL in group " + groupName + " for " + space);
                }
                // clients are pooled by node name, which drops credentials and query
                String other = byNodeName.putIfAbsent(NodeNames.fromUrl(url), url);
                if (other != null) {
                    throw new ConfigurationFatalException("Full node URLs " + NodeNames.redact(other) + " and "
                            + NodeNames.redact(url) + " in group " + groupName + " for " + space + " name the same node");
                }
            }
            nodes.put(group, urls);
        });
        for (Group group : groups) {
            if (!nodes.containsKey(group)) {
                log.warn("No full node configured for group {} of {}; its calls fail until nodes are added", group, space);
            }
        }
        return ConsistentHashRouter.of(nodes, properties.getVirtualNodes());
    }

    static RateLimitRegistry rateLimitRegistry(String name, GatewayProperties.RateLimitProperties properties) {
        if (!properties.isEnabled()) {
            log.info("Rate limiting disabled for {}", name);
            return RateLimitRegistry.UNLIMITED;
        }
        return new CaffeineRateLimitRegistry(
                name,
                properties.getDefaultPermitsPerSecond(),
                properties.getMethods(),
                Duration.ofMinutes(Math.max(1L, properties.getIdentityExpireMinutes())),
                Math.max(1L, properties.getMaxIdentities()));
    }

    private static ProbingClientFactory<CfxClient> cfxFactory(GatewayProperties.UpstreamProperties upstream, WebClient webClient) {
        return ProbingClientFactory.cfx(webClient, Duration.ofMillis(upstream.getRequestTimeoutMs()),
                upstream.isProbeOnConnect(), connectTimeout(upstream));
    }

    private static ProbingClientFactory<EthClient> ethFactory(GatewayProperties.UpstreamProperties upstream, WebClient webClient) {
        return ProbingClientFactory.eth(webClient, Duration.ofMillis(upstream.getRequestTimeoutMs()),
                upstream.isProbeOnConnect(), connectTimeout(upstream));
    }

    private static Duration connectTimeout(GatewayProperties.UpstreamProperties upstream) {
        return Duration.ofMillis(upstream.getConnectTimeoutMs());
    }
}

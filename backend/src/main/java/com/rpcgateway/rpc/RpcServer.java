package com.rpcgateway.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named JSON-RPC server: a fixed module set behind a middleware chain. Stateless apart from what its
 * handlers hold; safe for concurrent calls.
 */
@Slf4j
public class RpcServer {

    private final String name;
    private final Map<String, ApiModule> modules;
    private final RpcInvoker chain;

    /**
     * @param middlewares applied in list order; the first one sees the call first
     */
    public RpcServer(String name, List<ApiModule> modules, List<RpcMiddleware> middlewares) {
        this.name = name;
        Map<String, ApiModule> byNamespace = new LinkedHashMap<>();
        for (ApiModule module : modules) {
            if (byNamespace.putIfAbsent(module.namespace(), module) != null) {
                throw new IllegalArgumentException("Duplicate RPC module " + module.namespace() + " in server " + name);
            }
        }
        this.modules = Collections.unmodifiableMap(byNamespace);
        RpcInvoker invoker = this::dispatch;
        for (int i = middlewares.size() - 1; i >= 0; i--) {
            RpcMiddleware middleware = middlewares.get(i);
            RpcInvoker next = invoker;
            invoker = call -> middleware.handle(call, next);
        }
        this.chain = invoker;
    }

    public Mono<JsonNode> call(RpcCall call) {
        return Mono.defer(() -> chain.invoke(call));
    }

    public String getName() {
        return name;
    }

    /** Exposed module namespaces in registration order. */
    public Set<String> getModules() {
        return modules.keySet();
    }

    private Mono<JsonNode> dispatch(RpcCall call) {
        String namespace = call.namespace();
        ApiModule module = namespace == null ? null : modules.get(namespace);
        if (module == null) {
            log.debug("Server {} has no module for method {}", name, call.method());
            return Mono.error(new MethodNotFoundException(call.method()));
        }
        return module.handler().handle(call);
    }
}

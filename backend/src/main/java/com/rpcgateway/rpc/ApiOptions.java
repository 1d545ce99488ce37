package com.rpcgateway.rpc;

import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Extra per-server module options supplied by whoever assembles the server.
 *
 * @param extraModules    modules added to the space's built-in ones
 * @param publicOverrides namespace → public flag, overriding a module's default visibility
 * @param disabledMethods methods answered with "method not found" regardless of module
 */
public record ApiOptions(List<ApiModule> extraModules, Map<String, Boolean> publicOverrides, Set<String> disabledMethods) {

    public static final ApiOptions NONE = new ApiOptions(List.of(), Map.of(), Set.of());

    public ApiOptions {
        extraModules = extraModules == null ? List.of() : List.copyOf(extraModules);
        publicOverrides = publicOverrides == null ? Map.of() : Map.copyOf(publicOverrides);
        disabledMethods = disabledMethods == null ? Set.of() : Set.copyOf(disabledMethods);
    }

    public static ApiOptions disabledMethods(Set<String> methods) {
        return new ApiOptions(List.of(), Map.of(), methods);
    }

    /**
     * Built-in modules with this option set applied: extras appended, visibility overridden, disabled
     * methods guarded.
     */
    List<ApiModule> apply(List<ApiModule> builtIn) {
        List<ApiModule> all = new ArrayList<>(builtIn);
        all.addAll(extraModules);
        List<ApiModule> result = new ArrayList<>(all.size());
        for (ApiModule module : all) {
            ApiModule m = module;
            Boolean exposed = publicOverrides.get(m.namespace());
            if (exposed != null) {
                m = m.withPublic(exposed);
            }
            if (!disabledMethods.isEmpty()) {
                ApiHandler delegate = m.handler();
                m = m.withHandler(call -> disabledMethods.contains(call.method())
                        ? Mono.error(new MethodNotFoundException(call.method()))
                        : delegate.handle(call));
            }
            result.add(m);
        }
        return result;
    }
}

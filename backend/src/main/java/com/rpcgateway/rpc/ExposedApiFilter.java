package com.rpcgateway.rpc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses which modules a server exposes.
 */
public final class ExposedApiFilter {

    private ExposedApiFilter() {
    }

    /**
     * With an empty allow-list, all modules marked public; otherwise exactly the listed modules in list order,
     * public or not.
     *
     * @throws UnknownModuleException when the allow-list names a module not in {@code all}
     */
    public static List<ApiModule> filter(List<ApiModule> all, List<String> exposedModules) {
        if (exposedModules == null || exposedModules.isEmpty()) {
            return all.stream().filter(ApiModule::isPublic).toList();
        }
        Map<String, ApiModule> byNamespace = new LinkedHashMap<>();
        for (ApiModule module : all) {
            byNamespace.put(module.namespace(), module);
        }
        List<ApiModule> exposed = new ArrayList<>();
        for (String name : exposedModules) {
            ApiModule module = byNamespace.get(name == null ? null : name.trim());
            if (module == null) {
                throw new UnknownModuleException(name);
            }
            if (!exposed.contains(module)) {
                exposed.add(module);
            }
        }
        return List.copyOf(exposed);
    }
}

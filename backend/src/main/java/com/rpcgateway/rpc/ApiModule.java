package com.rpcgateway.rpc;

/**
 * RPC module descriptor: namespace, handler and whether it is exposed when no allow-list is configured.
 */
public record ApiModule(String namespace, ApiHandler handler, boolean isPublic) {

    public ApiModule {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace required");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler required for module " + namespace);
        }
    }

    public ApiModule withPublic(boolean exposed) {
        return new ApiModule(namespace, handler, exposed);
    }

    public ApiModule withHandler(ApiHandler other) {
        return new ApiModule(namespace, other, isPublic);
    }
}

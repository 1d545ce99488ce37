package com.rpcgateway.node;

import java.util.List;
import java.util.Optional;

/**
 * Asks each router in order and returns the first URL found. Typical use: a dynamic router backed by
 * node discovery, falling back to the statically configured node list.
 */
public class ChainedRouter implements Router {

    private final List<Router> routers;

    public ChainedRouter(List<Router> routers) {
        if (routers == null || routers.isEmpty()) {
            throw new IllegalArgumentException("At least one router required");
        }
        this.routers = List.copyOf(routers);
    }

    @Override
    public Optional<String> route(Group group, byte[] key) {
        for (Router router : routers) {
            Optional<String> url = router.route(group, key);
            if (url.isPresent() && !url.get().isBlank()) {
                return url;
            }
        }
        return Optional.empty();
    }
}

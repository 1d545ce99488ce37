package com.rpcgateway.ratelimit;

import com.rpcgateway.common.GatewayException;
import lombok.Getter;

/**
 * Caller exceeded its quota. Clients should back off and retry.
 */
@Getter
public class RateLimitedException extends GatewayException {

    private final String identity;
    private final String method;

    public RateLimitedException(String identity, String method) {
        super("Too many requests, exceeded rate limit for " + method);
        this.identity = identity;
        this.method = method;
    }
}

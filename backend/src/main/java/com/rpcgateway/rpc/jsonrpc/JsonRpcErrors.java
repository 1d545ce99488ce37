package com.rpcgateway.rpc.jsonrpc;

import com.rpcgateway.node.NoUpstreamAvailableException;
import com.rpcgateway.node.UnknownGroupException;
import com.rpcgateway.node.UpstreamConnectException;
import com.rpcgateway.node.client.UpstreamCallException;
import com.rpcgateway.node.client.UpstreamRpcErrorException;
import com.rpcgateway.ratelimit.RateLimitedException;
import com.rpcgateway.rpc.InvalidParamsException;
import com.rpcgateway.rpc.InvalidRequestException;
import com.rpcgateway.rpc.MethodNotFoundException;
import org.springframework.http.HttpStatus;

/**
 * Maps gateway failures to JSON-RPC error objects and, for single calls, HTTP status codes.
 * Messages returned to callers never carry node URLs.
 */
public final class JsonRpcErrors {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int RATE_LIMITED = -32005;
    public static final int NO_UPSTREAM = -32011;
    public static final int UPSTREAM_CONNECT_FAILED = -32012;
    public static final int UPSTREAM_CALL_FAILED = -32013;

    private JsonRpcErrors() {
    }

    public static JsonRpcError of(Throwable t) {
        if (t instanceof RateLimitedException e) {
            return JsonRpcError.of(RATE_LIMITED, e.getMessage());
        }
        if (t instanceof NoUpstreamAvailableException) {
            return JsonRpcError.of(NO_UPSTREAM, "no full node available");
        }
        if (t instanceof UpstreamConnectException) {
            return JsonRpcError.of(UPSTREAM_CONNECT_FAILED, "bad full node connection");
        }
        if (t instanceof UpstreamRpcErrorException e) {
            return new JsonRpcError(e.getCode(), e.getMessage(), e.getData());
        }
        if (t instanceof UpstreamCallException) {
            return JsonRpcError.of(UPSTREAM_CALL_FAILED, "full node request failed");
        }
        if (t instanceof MethodNotFoundException e) {
            return JsonRpcError.of(METHOD_NOT_FOUND, e.getMessage());
        }
        if (t instanceof InvalidParamsException e) {
            return JsonRpcError.of(INVALID_PARAMS, e.getMessage());
        }
        if (t instanceof InvalidRequestException e) {
            return JsonRpcError.of(INVALID_REQUEST, e.getMessage());
        }
        // unknown group included: a wiring bug, not something to explain to callers
        return JsonRpcError.of(INTERNAL_ERROR, "internal error");
    }

    /**
     * HTTP status for a single (non-batch) call that failed with {@code t}.
     */
    public static HttpStatus httpStatus(Throwable t) {
        if (t instanceof RateLimitedException) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        if (t instanceof NoUpstreamAvailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.OK;
    }

    public static boolean isExpected(Throwable t) {
        return t instanceof RateLimitedException
                || t instanceof NoUpstreamAvailableException
                || t instanceof UpstreamConnectException
                || t instanceof UpstreamRpcErrorException
                || t instanceof UpstreamCallException
                || t instanceof MethodNotFoundException
                || t instanceof InvalidParamsException
                || t instanceof InvalidRequestException
                || t instanceof UnknownGroupException;
    }
}

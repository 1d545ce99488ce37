package com.rpcgateway.rpc.jsonrpc;

import com.rpcgateway.rpc.CallContext;
import org.springframework.http.HttpHeaders;

import java.net.InetSocketAddress;
import java.util.Optional;

/**
 * Caller IP as seen behind reverse proxies: {@code X-Real-IP}, then the first {@code X-Forwarded-For} hop,
 * then the socket peer. Never fails; unknown callers get {@link CallContext#UNKNOWN_IP}.
 */
public final class RemoteAddressResolver {

    static final String X_REAL_IP = "X-Real-IP";
    static final String X_FORWARDED_FOR = "X-Forwarded-For";

    private RemoteAddressResolver() {
    }

    public static String resolve(HttpHeaders headers, Optional<InetSocketAddress> remoteAddress) {
        String realIp = headers.getFirst(X_REAL_IP);
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        String forwardedFor = headers.getFirst(X_FORWARDED_FOR);
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return remoteAddress
                .map(a -> a.getAddress() != null ? a.getAddress().getHostAddress() : a.getHostString())
                .filter(ip -> !ip.isBlank())
                .orElse(CallContext.UNKNOWN_IP);
    }
}

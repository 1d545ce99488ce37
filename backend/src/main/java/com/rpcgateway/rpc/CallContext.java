package com.rpcgateway.rpc;

/**
 * Transport-level facts about a caller, captured once per HTTP request.
 *
 * @param remoteAddr caller IP; {@link #UNKNOWN_IP} when the transport could not tell
 */
public record CallContext(String remoteAddr) {

    public static final String UNKNOWN_IP = "unknown_ip";

    public CallContext {
        if (remoteAddr == null || remoteAddr.isBlank()) {
            remoteAddr = UNKNOWN_IP;
        }
    }

    public static CallContext unknown() {
        return new CallContext(UNKNOWN_IP);
    }
}

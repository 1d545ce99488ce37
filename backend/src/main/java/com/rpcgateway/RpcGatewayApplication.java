package com.rpcgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Gateway process. Exits when any RPC server cannot be assembled from configuration.
 */
@SpringBootApplication
public class RpcGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(RpcGatewayApplication.class, args);
    }
}

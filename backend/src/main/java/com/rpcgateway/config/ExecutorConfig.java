package com.rpcgateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. upstream-connect runs full node client creation (may block on network I/O) so that
 * request threads only ever wait with a deadline.
 */
@Configuration
public class ExecutorConfig {

    public static final String CONNECT_EXECUTOR = "upstream-connect-executor";

    @Bean(name = CONNECT_EXECUTOR)
    public Executor upstreamConnectExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(16);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("upstream-connect-");
        e.initialize();
        return e;
    }
}
